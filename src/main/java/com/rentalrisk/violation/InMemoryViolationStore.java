package com.rentalrisk.violation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryViolationStore implements ViolationStore {

    private final ConcurrentHashMap<String, PolicyViolation> violations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<OpenSlot, String> openSlots = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfNoOpen(PolicyViolation violation) {
        OpenSlot slot = OpenSlot.of(violation);
        if (openSlots.putIfAbsent(slot, violation.id()) != null) {
            return false;
        }
        violations.put(violation.id(), violation);
        return true;
    }

    @Override
    public Optional<PolicyViolation> findById(String id) {
        return Optional.ofNullable(violations.get(id));
    }

    @Override
    public Optional<PolicyViolation> update(String id, UnaryOperator<PolicyViolation> remapping) {
        PolicyViolation updated = violations.computeIfPresent(id, (key, current) -> remapping.apply(current));
        if (updated != null && !updated.isOpen()) {
            openSlots.remove(OpenSlot.of(updated), updated.id());
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public List<PolicyViolation> findAll() {
        return List.copyOf(violations.values());
    }

    private record OpenSlot(String bookingId, ViolationType type) {

        static OpenSlot of(PolicyViolation violation) {
            return new OpenSlot(violation.bookingId(), violation.violationType());
        }
    }
}
