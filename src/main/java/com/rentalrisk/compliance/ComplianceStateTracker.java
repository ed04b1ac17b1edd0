package com.rentalrisk.compliance;

import com.rentalrisk.config.RiskEngineProperties;
import com.rentalrisk.error.NotFoundException;
import com.rentalrisk.error.ValidationException;
import com.rentalrisk.error.ValidationException.FieldError;
import com.rentalrisk.facts.BookingFacts;
import com.rentalrisk.facts.RenterFacts;
import com.rentalrisk.facts.RuleFactsService;
import com.rentalrisk.profile.MandatoryRequirements;
import com.rentalrisk.profile.RiskProfile;
import com.rentalrisk.profile.RiskProfileService;
import com.rentalrisk.regulation.RegulationCandidate;
import com.rentalrisk.regulation.RegulationCheckResult;
import com.rentalrisk.regulation.RegulationComplianceEvaluator;
import com.rentalrisk.support.PageQuery;
import com.rentalrisk.support.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Owns the stored compliance state of each booking. Evaluation reads facts
 * outside the store; the state transition itself runs atomically per booking.
 */
@Service
public class ComplianceStateTracker {

    private static final Logger log = LoggerFactory.getLogger(ComplianceStateTracker.class);

    private static final Comparator<ComplianceCheck> MOST_RECENT_FIRST =
        Comparator.comparing(ComplianceCheck::lastCheckedAt).reversed().thenComparing(ComplianceCheck::bookingId);

    private final ComplianceCheckStore store;
    private final RiskProfileService profiles;
    private final RuleFactsService facts;
    private final RegulationComplianceEvaluator regulations;
    private final Duration recheckInterval;
    private final Clock clock;

    public ComplianceStateTracker(ComplianceCheckStore store,
                                  RiskProfileService profiles,
                                  RuleFactsService facts,
                                  RegulationComplianceEvaluator regulations,
                                  RiskEngineProperties properties,
                                  Clock clock) {
        this.store = store;
        this.profiles = profiles;
        this.facts = facts;
        this.regulations = regulations;
        this.recheckInterval = properties.compliance().recheckInterval();
        this.clock = clock;
    }

    public ComplianceCheck checkCompliance(ComplianceRequest request) {
        validate(request);
        RiskProfile profile = profiles.requireByProduct(request.productId());
        BookingFacts booking = facts.requireBooking(request.bookingId());
        if (!booking.productId().equals(request.productId()) || !booking.renterId().equals(request.renterId())) {
            throw new ValidationException("booking " + booking.bookingId()
                + " does not belong to product " + request.productId() + " and renter " + request.renterId());
        }

        Instant now = clock.instant();
        Optional<ComplianceCheck> existing = store.findByBooking(booking.bookingId());
        if (existing.isPresent()) {
            ComplianceCheck stored = existing.get();
            if (booking.status().isTerminal()) {
                return stored;
            }
            boolean fresh = Duration.between(stored.lastCheckedAt(), now).compareTo(recheckInterval) < 0;
            if (!request.forceCheck() && fresh && !stored.graceExpired(now)) {
                return stored;
            }
        }

        Evaluation evaluation = evaluate(profile, booking, now);
        ComplianceCheck updated = store.compute(booking.bookingId(),
            current -> apply(current, booking, profile, evaluation, now));

        ComplianceStatus previous = existing.map(ComplianceCheck::status).orElse(ComplianceStatus.PENDING);
        if (previous != updated.status()) {
            log.info("Compliance status booking={} {} -> {} (score={}, missing={})",
                updated.bookingId(), previous.getValue(), updated.status().getValue(),
                updated.complianceScore(), updated.missingRequirements());
        }
        return updated;
    }

    public ComplianceCheck getComplianceStatus(String bookingId) {
        return store.findByBooking(bookingId)
            .orElseThrow(() -> new NotFoundException("compliance check", bookingId));
    }

    public PagedResult<ComplianceCheck> listComplianceChecks(ComplianceFilter filter, PageQuery page) {
        return PagedResult.of(store.findAll().stream()
            .filter(filter)
            .sorted(MOST_RECENT_FIRST), page);
    }

    public List<ComplianceCheck> all() {
        return store.findAll();
    }

    /**
     * Administrative override: the booking is exempt from enforcement until
     * its check is discarded.
     */
    public ComplianceCheck grantExemption(String bookingId, String actor, String reason) {
        if (actor == null || actor.isBlank()) {
            throw new ValidationException(List.of(new FieldError("actor", "must not be blank")));
        }
        Instant now = clock.instant();
        ComplianceCheck exempted = store.update(bookingId, current -> current.exempted(actor, reason, now))
            .orElseThrow(() -> new NotFoundException("compliance check", bookingId));
        log.info("Booking {} exempted from compliance enforcement by {}: {}", bookingId, actor, reason);
        return exempted;
    }

    /**
     * Atomic read-modify-write of an existing check, used to record
     * enforcement actions against it.
     */
    public ComplianceCheck update(String bookingId, UnaryOperator<ComplianceCheck> remapping) {
        return store.update(bookingId, remapping)
            .orElseThrow(() -> new NotFoundException("compliance check", bookingId));
    }

    private ComplianceCheck apply(ComplianceCheck current,
                                  BookingFacts booking,
                                  RiskProfile profile,
                                  Evaluation evaluation,
                                  Instant now) {
        ComplianceTransition next = ComplianceTransition.next(
            current, evaluation.compliant(), profile.exempt(), profile.gracePeriodHours(), now);

        Instant statusChangedAt = current != null && current.status() == next.status()
            ? current.statusChangedAt()
            : now;
        return new ComplianceCheck(
            booking.bookingId(),
            booking.productId(),
            booking.renterId(),
            evaluation.compliant(),
            evaluation.missing(),
            evaluation.regulationViolations(),
            evaluation.score(),
            next.status(),
            next.gracePeriodEndsAt(),
            current != null ? current.enforcementActions() : List.of(),
            now,
            statusChangedAt,
            current != null ? current.exemptedBy() : null,
            current != null ? current.exemptionReason() : null
        );
    }

    private Evaluation evaluate(RiskProfile profile, BookingFacts booking, Instant now) {
        MandatoryRequirements requirements = profile.mandatoryRequirements();
        List<MissingRequirement> missing = new ArrayList<>();
        List<String> regulationViolations = new ArrayList<>();
        int applicable = 0;
        int passed = 0;

        boolean insuranceNeeded = requirements.insuranceRequired() || requirements.hasCoverageFloor();
        if (insuranceNeeded) {
            applicable++;
            if (booking.hasActiveInsurance()) {
                passed++;
            } else {
                missing.add(MissingRequirement.MISSING_INSURANCE);
            }
        }
        if (requirements.hasCoverageFloor()) {
            applicable++;
            if (booking.hasActiveInsurance()) {
                if (coverageOf(booking).compareTo(requirements.minCoverage()) >= 0) {
                    passed++;
                } else {
                    missing.add(MissingRequirement.INADEQUATE_COVERAGE);
                }
            }
        }
        if (requirements.inspectionRequired()) {
            applicable++;
            boolean inspected = requirements.inspectionTypes().isEmpty()
                ? !booking.completedInspectionTypes().isEmpty()
                : booking.completedInspectionTypes().containsAll(requirements.inspectionTypes());
            if (inspected) {
                passed++;
            } else {
                missing.add(MissingRequirement.MISSING_INSPECTION);
            }
        }
        if (booking.countryId() != null) {
            RenterFacts renter = facts.requireRenter(booking.renterId());
            RegulationCheckResult result = regulations.checkCompliance(
                profile.categoryId(), booking.countryId(), candidateFor(booking, renter, now));
            applicable += (int) result.applicableCount();
            passed += (int) result.passedCount();
            if (!result.isCompliant()) {
                missing.add(MissingRequirement.REGULATORY_NONCOMPLIANCE);
                regulationViolations.addAll(result.violations());
            }
        }

        int score = applicable == 0 ? 100 : (int) Math.round(passed * 100.0 / applicable);
        return new Evaluation(missing.isEmpty(), missing, regulationViolations, score);
    }

    private static BigDecimal coverageOf(BookingFacts booking) {
        BigDecimal amount = booking.insurance().coverageAmount();
        return amount == null ? BigDecimal.ZERO : amount;
    }

    private static RegulationCandidate candidateFor(BookingFacts booking, RenterFacts renter, Instant now) {
        LocalDate onDate = booking.startDate() != null ? booking.startDate() : LocalDate.ofInstant(now, ZoneOffset.UTC);
        return RegulationCandidate.builder()
            .userAge(renter.ageOn(onDate))
            .rentalDurationDays(booking.durationDays())
            .license(renter.hasLicense(), renter.licenseType())
            .insurance(booking.hasActiveInsurance(), booking.hasActiveInsurance() ? coverageOf(booking) : null)
            .backgroundCheckStatus(renter.backgroundCheckStatus())
            .season(booking.season())
            .documentationProvided(renter.documentsProvided())
            .build();
    }

    private void validate(ComplianceRequest request) {
        if (request == null) {
            throw new ValidationException("compliance request is required");
        }
        List<FieldError> errors = new ArrayList<>();
        if (request.bookingId() == null || request.bookingId().isBlank()) {
            errors.add(new FieldError("bookingId", "must not be blank"));
        }
        if (request.productId() == null || request.productId().isBlank()) {
            errors.add(new FieldError("productId", "must not be blank"));
        }
        if (request.renterId() == null || request.renterId().isBlank()) {
            errors.add(new FieldError("renterId", "must not be blank"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private record Evaluation(
        boolean compliant,
        List<MissingRequirement> missing,
        List<String> regulationViolations,
        int score
    ) {}
}
