package com.rentalrisk.regulation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryRegulationStore implements RegulationStore {

    private final ConcurrentHashMap<Key, CategoryRegulation> regulations = new ConcurrentHashMap<>();

    @Override
    public void save(CategoryRegulation regulation) {
        regulations.put(new Key(regulation.categoryId(), regulation.countryId()), regulation);
    }

    @Override
    public Optional<CategoryRegulation> find(String categoryId, String countryId) {
        return Optional.ofNullable(regulations.get(new Key(categoryId, countryId)));
    }

    @Override
    public List<CategoryRegulation> findAll() {
        return List.copyOf(regulations.values());
    }

    private record Key(String categoryId, String countryId) {}
}
