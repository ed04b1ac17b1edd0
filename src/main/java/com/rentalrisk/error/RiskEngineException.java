package com.rentalrisk.error;

/**
 * Base of the engine's error taxonomy. Every failure surfaced to a caller
 * carries a machine-readable error code.
 */
public abstract class RiskEngineException extends RuntimeException {

    protected RiskEngineException(String message) {
        super(message);
    }

    protected RiskEngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();
}
