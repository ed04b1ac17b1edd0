package com.rentalrisk.regulation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rentalrisk.config.RiskEngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Seeds the regulation store from a JSON catalog at startup. A catalog
 * with unknown keys or a missing (category, country) pair stops startup.
 */
@Component
public class RegulationCatalogLoader implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RegulationCatalogLoader.class);

    private final ObjectMapper mapper;
    private final RegulationStore store;
    private final ResourceLoader resourceLoader;
    private final String catalogLocation;

    public RegulationCatalogLoader(RegulationStore store,
                                   ResourceLoader resourceLoader,
                                   ObjectMapper objectMapper,
                                   RiskEngineProperties properties) {
        // strict copy; the shared mapper keeps its own settings
        this.mapper = objectMapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        this.store = store;
        this.resourceLoader = resourceLoader;
        this.catalogLocation = properties.regulations().catalogLocation();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (catalogLocation == null || catalogLocation.isBlank()) {
            log.info("No regulation catalog configured");
            return;
        }
        load(resourceLoader.getResource(catalogLocation));
    }

    public int load(Resource resource) {
        List<CategoryRegulation> regulations;
        try (InputStream in = resource.getInputStream()) {
            regulations = mapper.readValue(in, new TypeReference<List<CategoryRegulation>>() {});
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read regulation catalog " + resource.getDescription(), ex);
        }
        for (CategoryRegulation regulation : regulations) {
            if (regulation.categoryId() == null || regulation.countryId() == null) {
                throw new IllegalStateException("Regulation " + regulation.id()
                    + " in " + resource.getDescription() + " has no category_id/country_id");
            }
            store.save(regulation);
        }
        log.info("Loaded {} category regulations from {}", regulations.size(), resource.getDescription());
        return regulations.size();
    }
}
