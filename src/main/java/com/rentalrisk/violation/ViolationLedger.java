package com.rentalrisk.violation;

import com.rentalrisk.error.ConflictException;
import com.rentalrisk.error.NotFoundException;
import com.rentalrisk.error.ValidationException;
import com.rentalrisk.error.ValidationException.FieldError;
import com.rentalrisk.support.PageQuery;
import com.rentalrisk.support.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Records, resolves and escalates policy violations.
 */
@Service
public class ViolationLedger {

    private static final Logger log = LoggerFactory.getLogger(ViolationLedger.class);

    private static final Comparator<PolicyViolation> MOST_RECENT_FIRST =
        Comparator.comparing(PolicyViolation::detectedAt).reversed().thenComparing(PolicyViolation::id);

    private final ViolationStore store;
    private final PenaltyPolicy penaltyPolicy;
    private final Clock clock;

    public ViolationLedger(ViolationStore store, PenaltyPolicy penaltyPolicy, Clock clock) {
        this.store = store;
        this.penaltyPolicy = penaltyPolicy;
        this.clock = clock;
    }

    /**
     * @throws ConflictException when an open violation of the same type is
     *                           already recorded for the booking
     */
    public PolicyViolation record(ViolationDraft draft) {
        validate(draft);
        BigDecimal penalty = draft.penaltyAmount() != null
            ? draft.penaltyAmount()
            : penaltyPolicy.assess(draft.severity(), countForRenter(draft.renterId()));

        PolicyViolation violation = new PolicyViolation(
            UUID.randomUUID().toString(),
            draft.bookingId(),
            draft.productId(),
            draft.renterId(),
            draft.violationType(),
            draft.severity(),
            draft.description(),
            clock.instant(),
            null,
            List.of(),
            null,
            penalty,
            ViolationStatus.ACTIVE,
            null
        );
        if (!store.insertIfNoOpen(violation)) {
            throw new ConflictException("an open " + draft.violationType().getValue()
                + " violation already exists for booking " + draft.bookingId());
        }
        log.info("Recorded violation {} booking={} type={} severity={} penalty={}",
            violation.id(), violation.bookingId(), violation.violationType().getValue(),
            violation.severity().getValue(), violation.penaltyAmount());
        return violation;
    }

    public PolicyViolation resolve(String id, List<String> resolutionActions, String notes) {
        Instant now = clock.instant();
        PolicyViolation resolved = mutateOpen(id, v -> v.resolved(resolutionActions, notes, now));
        log.info("Resolved violation {} booking={} type={}", id, resolved.bookingId(), resolved.violationType().getValue());
        return resolved;
    }

    public PolicyViolation escalate(String id) {
        PolicyViolation escalated = mutateOpen(id, v -> {
            if (v.status() == ViolationStatus.ESCALATED) {
                throw new ConflictException("violation " + id + " is already escalated");
            }
            return v.escalated();
        });
        log.info("Escalated violation {} booking={} type={}", id, escalated.bookingId(), escalated.violationType().getValue());
        return escalated;
    }

    public PolicyViolation assessPenalty(String id, BigDecimal amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(List.of(new FieldError("penaltyAmount", "must be 0 or greater")));
        }
        PolicyViolation assessed = mutateOpen(id, v -> v.withPenalty(amount));
        log.info("Assessed penalty {} on violation {}", amount, id);
        return assessed;
    }

    /**
     * Hands an open violation to an inspector. Reassigning replaces the
     * previous inspector.
     */
    public PolicyViolation assign(String id, String inspectorId) {
        if (inspectorId == null || inspectorId.isBlank()) {
            throw new ValidationException(List.of(new FieldError("inspectorId", "must not be blank")));
        }
        PolicyViolation assigned = mutateOpen(id, v -> v.withAssignee(inspectorId));
        log.info("Assigned violation {} booking={} to inspector {}", id, assigned.bookingId(), inspectorId);
        return assigned;
    }

    public PolicyViolation get(String id) {
        return store.findById(id).orElseThrow(() -> new NotFoundException("violation", id));
    }

    public PagedResult<PolicyViolation> list(ViolationFilter filter, PageQuery page) {
        return PagedResult.of(store.findAll().stream()
            .filter(filter)
            .sorted(MOST_RECENT_FIRST), page);
    }

    public List<PolicyViolation> all() {
        return store.findAll();
    }

    private PolicyViolation mutateOpen(String id, UnaryOperator<PolicyViolation> change) {
        return store.update(id, current -> {
            if (!current.isOpen()) {
                throw new ConflictException("violation " + id + " is resolved and can no longer change");
            }
            return change.apply(current);
        }).orElseThrow(() -> new NotFoundException("violation", id));
    }

    private long countForRenter(String renterId) {
        return store.findAll().stream()
            .filter(v -> renterId.equals(v.renterId()))
            .count();
    }

    private void validate(ViolationDraft draft) {
        if (draft == null) {
            throw new ValidationException("violation is required");
        }
        List<FieldError> errors = new ArrayList<>();
        if (draft.bookingId() == null || draft.bookingId().isBlank()) {
            errors.add(new FieldError("bookingId", "must not be blank"));
        }
        if (draft.productId() == null || draft.productId().isBlank()) {
            errors.add(new FieldError("productId", "must not be blank"));
        }
        if (draft.renterId() == null || draft.renterId().isBlank()) {
            errors.add(new FieldError("renterId", "must not be blank"));
        }
        if (draft.violationType() == null) {
            errors.add(new FieldError("violationType", "is required"));
        }
        if (draft.severity() == null) {
            errors.add(new FieldError("severity", "is required"));
        }
        if (draft.penaltyAmount() != null && draft.penaltyAmount().signum() < 0) {
            errors.add(new FieldError("penaltyAmount", "must be 0 or greater"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
