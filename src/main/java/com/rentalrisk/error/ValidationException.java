package com.rentalrisk.error;

import java.util.List;

/**
 * Malformed input: missing required fields or out-of-range values.
 * Never retried.
 */
public class ValidationException extends RiskEngineException {

    private final List<FieldError> fieldErrors;

    public ValidationException(String message) {
        this(List.of(new FieldError(null, message)));
    }

    public ValidationException(List<FieldError> fieldErrors) {
        super(describe(fieldErrors));
        this.fieldErrors = List.copyOf(fieldErrors);
    }

    @Override
    public String errorCode() {
        return "VALIDATION_FAILED";
    }

    public List<FieldError> getFieldErrors() {
        return fieldErrors;
    }

    private static String describe(List<FieldError> errors) {
        if (errors.size() == 1) {
            return errors.get(0).message();
        }
        StringBuilder sb = new StringBuilder(errors.size() + " validation errors: ");
        for (int i = 0; i < errors.size(); i++) {
            if (i > 0) {
                sb.append("; ");
            }
            sb.append(errors.get(i).message());
        }
        return sb.toString();
    }

    public record FieldError(String field, String message) {}
}
