package com.openrangelabs.nycdata.sync.config;

import com.openrangelabs.nycdata.sync.service.DatasetRegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Registers the built-in datasets that are not in the registry yet
 */
@Component
public class DatasetCatalogInitializer implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(DatasetCatalogInitializer.class);

    private final DatasetRegistryService registryService;
    private final NycDataProperties properties;

    public DatasetCatalogInitializer(DatasetRegistryService registryService, NycDataProperties properties) {
        this.registryService = registryService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Long seeded = registryService.seedBuiltIns(properties.getCatalog().getBuiltIn())
                .count()
                .block();
        logger.info("Dataset catalog ready: {} built-in datasets checked", seeded);
    }
}
