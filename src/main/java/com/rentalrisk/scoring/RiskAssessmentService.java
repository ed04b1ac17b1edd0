package com.rentalrisk.scoring;

import com.rentalrisk.compliance.ComplianceStatus;
import com.rentalrisk.config.RiskEngineProperties;
import com.rentalrisk.error.NotFoundException;
import com.rentalrisk.error.ValidationException;
import com.rentalrisk.error.ValidationException.FieldError;
import com.rentalrisk.facts.BookingFacts;
import com.rentalrisk.facts.ProductFacts;
import com.rentalrisk.facts.RenterFacts;
import com.rentalrisk.facts.RuleFactsService;
import com.rentalrisk.profile.MandatoryRequirements;
import com.rentalrisk.profile.RiskProfile;
import com.rentalrisk.profile.RiskProfileService;
import com.rentalrisk.support.BatchResult;
import com.rentalrisk.support.PageQuery;
import com.rentalrisk.support.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Produces risk assessments. Every assessment is a fresh computation over
 * current facts; assessments are recorded for statistics but never reused.
 */
@Service
public class RiskAssessmentService {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessmentService.class);

    private static final Comparator<RiskAssessment> MOST_RECENT_FIRST =
        Comparator.comparing(RiskAssessment::assessmentDate).reversed().thenComparing(RiskAssessment::id);

    private final RiskScoringEngine engine;
    private final RecommendationPolicy recommendations;
    private final RuleFactsService facts;
    private final RiskProfileService profiles;
    private final AssessmentHistory history;
    private final Duration assessmentValidity;
    private final Clock clock;

    public RiskAssessmentService(RiskScoringEngine engine,
                                 RecommendationPolicy recommendations,
                                 RuleFactsService facts,
                                 RiskProfileService profiles,
                                 AssessmentHistory history,
                                 RiskEngineProperties properties,
                                 Clock clock) {
        this.engine = engine;
        this.recommendations = recommendations;
        this.facts = facts;
        this.profiles = profiles;
        this.history = history;
        this.assessmentValidity = properties.scoring().assessmentValidity();
        this.clock = clock;
    }

    public RiskAssessment assess(AssessmentRequest request) {
        validate(request);

        ProductFacts product = facts.requireProduct(request.productId());
        RenterFacts renter = facts.requireRenter(request.renterId());
        BookingFacts booking = null;
        if (request.bookingId() != null) {
            booking = facts.requireBooking(request.bookingId());
            if (!booking.productId().equals(product.productId()) || !booking.renterId().equals(renter.renterId())) {
                throw new ValidationException("booking " + booking.bookingId()
                    + " does not belong to product " + product.productId() + " and renter " + renter.renterId());
            }
        }
        RiskProfile profile = profiles.findByProduct(product.productId()).orElse(null);

        Instant now = clock.instant();
        ScoringContext context = new ScoringContext(
            product,
            profile,
            renter,
            booking,
            facts.categoryNorms(product.categoryId()).orElse(null),
            facts.seasonalCalendar(product.categoryId()),
            now,
            LocalDate.ofInstant(now, ZoneOffset.UTC)
        );
        RiskScore score = engine.score(context);

        MandatoryRequirements requirements = profile != null ? profile.mandatoryRequirements() : MandatoryRequirements.none();
        List<String> advice = request.includeRecommendations()
            ? recommendations.recommend(score, requirements, profile != null)
            : List.of();

        RiskAssessment assessment = new RiskAssessment(
            UUID.randomUUID().toString(),
            product.productId(),
            renter.renterId(),
            request.bookingId(),
            score.overall(),
            score.level(),
            score.factors(),
            advice,
            requirements,
            profile != null && profile.exempt() ? ComplianceStatus.EXEMPT : ComplianceStatus.PENDING,
            now,
            now.plus(assessmentValidity)
        );
        history.record(assessment);

        log.info("Assessed product={} renter={} booking={} score={} level={}",
            assessment.productId(), assessment.renterId(), assessment.bookingId(),
            assessment.overallRiskScore(), assessment.riskLevel().getValue());
        return assessment;
    }

    public BatchResult<RiskAssessment> bulkAssess(List<AssessmentRequest> requests) {
        BatchResult<RiskAssessment> result = BatchResult.process(requests, this::assess);
        log.info("Bulk risk assessment: {} successful, {} failed", result.successful(), result.failed());
        return result;
    }

    public RiskAssessment getAssessment(String assessmentId) {
        return history.findById(assessmentId)
            .orElseThrow(() -> new NotFoundException("risk assessment", assessmentId));
    }

    /**
     * Most recent first; ties break on id so paging is stable.
     */
    public PagedResult<RiskAssessment> listAssessments(AssessmentFilter filter, PageQuery page) {
        return PagedResult.of(history.findAll().stream()
            .filter(filter)
            .sorted(MOST_RECENT_FIRST), page);
    }

    public double averageRiskScore() {
        return history.averageScore().orElse(0.0);
    }

    private void validate(AssessmentRequest request) {
        if (request == null) {
            throw new ValidationException("assessment request is required");
        }
        List<FieldError> errors = new ArrayList<>();
        if (request.productId() == null || request.productId().isBlank()) {
            errors.add(new FieldError("productId", "must not be blank"));
        }
        if (request.renterId() == null || request.renterId().isBlank()) {
            errors.add(new FieldError("renterId", "must not be blank"));
        }
        if (request.bookingId() != null && request.bookingId().isBlank()) {
            errors.add(new FieldError("bookingId", "must not be blank when present"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }
}
