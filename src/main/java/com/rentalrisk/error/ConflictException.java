package com.rentalrisk.error;

/**
 * Thrown when a write would duplicate or overwrite an existing record:
 * a second risk profile for a product, a second open violation of the same
 * type for a booking, or a state change on a record that no longer allows it.
 */
public class ConflictException extends RiskEngineException {

    public ConflictException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "CONFLICT";
    }
}
