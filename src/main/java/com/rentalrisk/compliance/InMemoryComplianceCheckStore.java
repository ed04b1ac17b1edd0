package com.rentalrisk.compliance;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryComplianceCheckStore implements ComplianceCheckStore {

    private final ConcurrentHashMap<String, ComplianceCheck> checks = new ConcurrentHashMap<>();

    @Override
    public Optional<ComplianceCheck> findByBooking(String bookingId) {
        return Optional.ofNullable(checks.get(bookingId));
    }

    @Override
    public ComplianceCheck compute(String bookingId, UnaryOperator<ComplianceCheck> remapping) {
        return checks.compute(bookingId, (id, current) -> remapping.apply(current));
    }

    @Override
    public Optional<ComplianceCheck> update(String bookingId, UnaryOperator<ComplianceCheck> remapping) {
        return Optional.ofNullable(checks.computeIfPresent(bookingId, (id, current) -> remapping.apply(current)));
    }

    @Override
    public List<ComplianceCheck> findAll() {
        return List.copyOf(checks.values());
    }
}
