package com.rentalrisk.profile;

import com.rentalrisk.error.ConflictException;
import com.rentalrisk.error.NotFoundException;
import com.rentalrisk.facts.RuleFactsService;
import com.rentalrisk.support.BatchResult;
import com.rentalrisk.support.PageQuery;
import com.rentalrisk.support.PagedResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Registry of per-product risk profiles. Profiles are created once per
 * product and changed only through {@link #update}.
 */
@Service
public class RiskProfileService {

    private static final Logger log = LoggerFactory.getLogger(RiskProfileService.class);

    private static final Comparator<RiskProfile> NEWEST_FIRST =
        Comparator.comparing(RiskProfile::createdAt).reversed().thenComparing(RiskProfile::id);

    private final RiskProfileStore store;
    private final RiskProfileValidator validator;
    private final RuleFactsService facts;
    private final Clock clock;

    public RiskProfileService(RiskProfileStore store,
                              RiskProfileValidator validator,
                              RuleFactsService facts,
                              Clock clock) {
        this.store = store;
        this.validator = validator;
        this.facts = facts;
        this.clock = clock;
    }

    public RiskProfile create(RiskProfileDraft draft) {
        validator.validate(draft);
        facts.requireProduct(draft.productId());

        Instant now = clock.instant();
        RiskProfile profile = new RiskProfile(
            UUID.randomUUID().toString(),
            draft.productId(),
            draft.categoryId(),
            draft.riskLevel(),
            draft.mandatoryRequirements() != null ? draft.mandatoryRequirements() : MandatoryRequirements.none(),
            draft.riskFactors(),
            draft.mitigationStrategies(),
            draft.enforcementLevel() != null ? draft.enforcementLevel() : draft.riskLevel().defaultEnforcementLevel(),
            Boolean.TRUE.equals(draft.autoEnforcement()),
            draft.gracePeriodHours() != null ? draft.gracePeriodHours() : 0,
            false,
            now,
            now
        );

        if (!store.insertIfAbsent(profile)) {
            throw new ConflictException("risk profile already exists for product " + draft.productId());
        }
        log.info("Created risk profile {} for product={} level={} enforcement={}",
            profile.id(), profile.productId(), profile.riskLevel().getValue(), profile.enforcementLevel().getValue());
        return profile;
    }

    public BatchResult<RiskProfile> bulkCreate(List<RiskProfileDraft> drafts) {
        BatchResult<RiskProfile> result = BatchResult.process(drafts, this::create);
        log.info("Bulk risk profile creation: {} successful, {} failed", result.successful(), result.failed());
        return result;
    }

    public Optional<RiskProfile> findByProduct(String productId) {
        return store.findByProduct(productId);
    }

    public RiskProfile requireByProduct(String productId) {
        return store.findByProduct(productId)
            .orElseThrow(() -> new NotFoundException("risk profile", productId));
    }

    public RiskProfile update(String productId, RiskProfilePatch patch) {
        validator.validate(patch);
        Instant now = clock.instant();
        RiskProfile updated = store.update(productId, current -> applyPatch(current, patch, now))
            .orElseThrow(() -> new NotFoundException("risk profile", productId));
        log.info("Updated risk profile for product={} (exempt={}, enforcement={})",
            productId, updated.exempt(), updated.enforcementLevel().getValue());
        return updated;
    }

    public PagedResult<RiskProfile> list(RiskProfileFilter filter, PageQuery page) {
        return PagedResult.of(store.findAll().stream()
            .filter(filter)
            .sorted(NEWEST_FIRST), page);
    }

    public List<RiskProfile> all() {
        return store.findAll();
    }

    public long count() {
        return store.count();
    }

    private RiskProfile applyPatch(RiskProfile current, RiskProfilePatch patch, Instant now) {
        return new RiskProfile(
            current.id(),
            current.productId(),
            current.categoryId(),
            patch.riskLevel() != null ? patch.riskLevel() : current.riskLevel(),
            patch.mandatoryRequirements() != null ? patch.mandatoryRequirements() : current.mandatoryRequirements(),
            patch.riskFactors() != null ? patch.riskFactors() : current.riskFactors(),
            patch.mitigationStrategies() != null ? patch.mitigationStrategies() : current.mitigationStrategies(),
            patch.enforcementLevel() != null ? patch.enforcementLevel() : current.enforcementLevel(),
            patch.autoEnforcement() != null ? patch.autoEnforcement() : current.autoEnforcement(),
            patch.gracePeriodHours() != null ? patch.gracePeriodHours() : current.gracePeriodHours(),
            patch.exempt() != null ? patch.exempt() : current.exempt(),
            current.createdAt(),
            now
        );
    }
}
