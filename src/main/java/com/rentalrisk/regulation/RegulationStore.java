package com.rentalrisk.regulation;

import java.util.List;
import java.util.Optional;

public interface RegulationStore {

    /** Inserts or replaces the regulation for its (category, country) pair. */
    void save(CategoryRegulation regulation);

    Optional<CategoryRegulation> find(String categoryId, String countryId);

    List<CategoryRegulation> findAll();
}
