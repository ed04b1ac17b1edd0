package com.rentalrisk.support;

import com.rentalrisk.error.RiskEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Outcome of a bulk operation. Items are processed independently; a failing
 * item lands in {@code errors} and never prevents the others from running.
 * Failures outside the engine's error taxonomy are reported as
 * {@value #INTERNAL_ERROR}.
 */
public record BatchResult<T>(
    int successful,
    int failed,
    List<T> results,
    List<BatchError> errors
) {

    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private static final Logger log = LoggerFactory.getLogger(BatchResult.class);

    public record BatchError(int index, String errorCode, String message) {}

    public static <I, T> BatchResult<T> process(List<I> inputs, Function<I, T> operation) {
        List<T> results = new ArrayList<>();
        List<BatchError> errors = new ArrayList<>();
        for (int i = 0; i < inputs.size(); i++) {
            try {
                results.add(operation.apply(inputs.get(i)));
            } catch (RiskEngineException ex) {
                log.warn("Batch item {} failed: {} {}", i, ex.errorCode(), ex.getMessage());
                errors.add(new BatchError(i, ex.errorCode(), ex.getMessage()));
            } catch (RuntimeException ex) {
                log.warn("Batch item {} failed unexpectedly", i, ex);
                errors.add(new BatchError(i, INTERNAL_ERROR, String.valueOf(ex.getMessage())));
            }
        }
        return new BatchResult<>(results.size(), errors.size(), List.copyOf(results), List.copyOf(errors));
    }
}
