package com.riskplatform.common.exception;

/**
 * Base of the engine's unchecked exceptions, tagged with the component that raised it.
 */
public class RiskEngineException extends RuntimeException {
    private final String component;

    public RiskEngineException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public RiskEngineException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
