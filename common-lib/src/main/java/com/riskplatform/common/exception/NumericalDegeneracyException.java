package com.riskplatform.common.exception;

/**
 * Raised when an intermediate quantity is numerically unusable: a correlation matrix
 * that is not positive definite, or a degrees-of-freedom value for which the
 * variance or expected shortfall of the Student-t is undefined.
 */
public class NumericalDegeneracyException extends RiskEngineException {

    public NumericalDegeneracyException(String component, String message) {
        super(component, message);
    }

    public NumericalDegeneracyException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
