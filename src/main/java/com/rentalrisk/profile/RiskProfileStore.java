package com.rentalrisk.profile;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface RiskProfileStore {

    /**
     * Inserts the profile unless one already exists for its product.
     *
     * @return false when the product already has a profile
     */
    boolean insertIfAbsent(RiskProfile profile);

    Optional<RiskProfile> findByProduct(String productId);

    /**
     * Atomically replaces the product's profile.
     *
     * @return the updated profile, or empty when the product has none
     */
    Optional<RiskProfile> update(String productId, UnaryOperator<RiskProfile> change);

    List<RiskProfile> findAll();

    long count();
}
