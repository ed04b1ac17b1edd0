package com.rentalrisk.profile;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Component
public class InMemoryRiskProfileStore implements RiskProfileStore {

    private final ConcurrentHashMap<String, RiskProfile> byProduct = new ConcurrentHashMap<>();

    @Override
    public boolean insertIfAbsent(RiskProfile profile) {
        return byProduct.putIfAbsent(profile.productId(), profile) == null;
    }

    @Override
    public Optional<RiskProfile> findByProduct(String productId) {
        return Optional.ofNullable(byProduct.get(productId));
    }

    @Override
    public Optional<RiskProfile> update(String productId, UnaryOperator<RiskProfile> change) {
        return Optional.ofNullable(byProduct.computeIfPresent(productId, (id, current) -> change.apply(current)));
    }

    @Override
    public List<RiskProfile> findAll() {
        return new ArrayList<>(byProduct.values());
    }

    @Override
    public long count() {
        return byProduct.size();
    }
}
