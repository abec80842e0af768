package com.riskplatform.common.exception;

/**
 * Raised when caller-supplied data cannot be estimated on: zero total weight after
 * alignment, empty or too-short series, decay factors or windows out of range.
 */
public class InvalidInputException extends RiskEngineException {

    public InvalidInputException(String component, String message) {
        super(component, message);
    }
}
