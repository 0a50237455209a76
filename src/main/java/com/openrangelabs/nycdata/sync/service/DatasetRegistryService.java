package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.dto.CreateDatasetRequest;
import com.openrangelabs.nycdata.sync.dto.DatasetDetails;
import com.openrangelabs.nycdata.sync.dto.UpdateDatasetRequest;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.BuiltInDatasetException;
import com.openrangelabs.nycdata.sync.exception.DatasetAlreadyExistsException;
import com.openrangelabs.nycdata.sync.exception.DatasetNotFoundException;
import com.openrangelabs.nycdata.sync.repository.DataFreshnessRepository;
import com.openrangelabs.nycdata.sync.repository.DatasetConfigRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Service for dataset configurations and their freshness records
 */
@Service
public class DatasetRegistryService {

    private static final Logger logger = LoggerFactory.getLogger(DatasetRegistryService.class);

    private final DatasetConfigRepository configRepository;
    private final DataFreshnessRepository freshnessRepository;
    private final SyncLogService syncLogService;
    private final Clock clock;

    public DatasetRegistryService(DatasetConfigRepository configRepository,
                                  DataFreshnessRepository freshnessRepository,
                                  SyncLogService syncLogService,
                                  Clock clock) {
        this.configRepository = configRepository;
        this.freshnessRepository = freshnessRepository;
        this.syncLogService = syncLogService;
        this.clock = clock;
    }

    /**
     * Get all datasets, most urgent first
     */
    public Flux<DatasetConfig> getAllDatasets() {
        return configRepository.findAllOrderByPriority();
    }

    /**
     * Get active datasets, most urgent first
     */
    public Flux<DatasetConfig> getActiveDatasets() {
        return configRepository.findActiveOrderByPriority();
    }

    /**
     * Find a dataset, empty if unknown
     */
    public Mono<DatasetConfig> findDataset(String datasetId) {
        return configRepository.findByDatasetId(datasetId);
    }

    /**
     * Get a dataset or fail with {@link DatasetNotFoundException}
     */
    public Mono<DatasetConfig> getDataset(String datasetId) {
        return configRepository.findByDatasetId(datasetId)
                .switchIfEmpty(Mono.error(new DatasetNotFoundException(datasetId)));
    }

    public Mono<DatasetDetails> getDatasetDetails(String datasetId) {
        return getDataset(datasetId)
                .flatMap(config -> Mono.zip(
                                getFreshness(datasetId),
                                syncLogService.getLatestCompleted(datasetId)
                                        .map(Optional::of)
                                        .defaultIfEmpty(Optional.empty()))
                        .map(tuple -> new DatasetDetails(config, tuple.getT1(), tuple.getT2().orElse(null))));
    }

    /**
     * Register a custom dataset
     */
    public Mono<DatasetConfig> registerDataset(CreateDatasetRequest request, String actor) {
        return configRepository.existsByDatasetId(request.getDatasetId())
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DatasetAlreadyExistsException(request.getDatasetId()));
                    }

                    DatasetConfig config = new DatasetConfig(request.getDatasetId(), request.getName(),
                            request.getPriority() != null ? request.getPriority() : 50);
                    config.setSyncEnabled(request.getSyncEnabled() == null || request.getSyncEnabled());
                    config.setPrimaryKeyFieldList(request.getPrimaryKeyFields());
                    config.setDateField(request.getDateField());
                    config.setDateFormat(request.getDateFormat());
                    config.setApiEndpoint(request.getApiEndpoint());
                    config.setMaxAgeHours(request.getMaxAgeHours());
                    config.setBuiltIn(false);
                    config.setCreatedBy(actor);
                    config.setCreatedAt(LocalDateTime.now(clock));
                    config.setUpdatedAt(config.getCreatedAt());

                    return configRepository.save(config)
                            .flatMap(saved -> ensureFreshnessRecord(saved.getDatasetId()).thenReturn(saved))
                            .doOnSuccess(saved -> logger.info("Registered custom dataset {} ({}) by {}",
                                    saved.getDatasetId(), saved.getName(), actor));
                });
    }

    /**
     * Update dataset settings. Built-ins accept updates, including disabling them.
     */
    public Mono<DatasetConfig> updateDataset(String datasetId, UpdateDatasetRequest request, String actor) {
        return getDataset(datasetId)
                .flatMap(config -> {
                    if (request.getName() != null) config.setName(request.getName());
                    if (request.getPriority() != null) config.setPriority(request.getPriority());
                    if (request.getActive() != null) config.setActive(request.getActive());
                    if (request.getSyncEnabled() != null) config.setSyncEnabled(request.getSyncEnabled());
                    if (request.getPrimaryKeyFields() != null) config.setPrimaryKeyFieldList(request.getPrimaryKeyFields());
                    if (request.getDateField() != null) config.setDateField(blankToNull(request.getDateField()));
                    if (request.getDateFormat() != null) config.setDateFormat(blankToNull(request.getDateFormat()));
                    if (request.getApiEndpoint() != null) config.setApiEndpoint(blankToNull(request.getApiEndpoint()));
                    if (request.getMaxAgeHours() != null) config.setMaxAgeHours(request.getMaxAgeHours());
                    config.setUpdatedBy(actor);
                    config.setUpdatedAt(LocalDateTime.now(clock));

                    return configRepository.save(config)
                            .flatMap(saved -> saved.isEligibleForSync()
                                    ? Mono.just(saved)
                                    : clearRecommendation(datasetId).thenReturn(saved))
                            .doOnSuccess(saved -> logger.info("Updated dataset {} by {}", datasetId, actor));
                });
    }

    /**
     * Soft-remove a custom dataset. Built-ins are rejected.
     */
    public Mono<DatasetConfig> deactivateDataset(String datasetId, String actor) {
        return getDataset(datasetId)
                .flatMap(config -> {
                    if (Boolean.TRUE.equals(config.getBuiltIn())) {
                        return Mono.error(new BuiltInDatasetException(datasetId));
                    }
                    config.deactivate(actor);
                    config.setUpdatedAt(LocalDateTime.now(clock));
                    return configRepository.save(config)
                            .flatMap(saved -> clearRecommendation(datasetId).thenReturn(saved))
                            .doOnSuccess(saved -> logger.info("Deactivated dataset {} by {}", datasetId, actor));
                });
    }

    /**
     * Insert a built-in dataset if missing. Existing rows are left as operators configured them.
     */
    public Mono<DatasetConfig> ensureBuiltIn(NycDataProperties.BuiltInDataset definition) {
        return configRepository.findByDatasetId(definition.getDatasetId())
                .switchIfEmpty(Mono.defer(() -> {
                    DatasetConfig config = new DatasetConfig(definition.getDatasetId(), definition.getName(),
                            definition.getPriority());
                    config.setBuiltIn(true);
                    config.setPrimaryKeyFieldList(definition.getPrimaryKeyFields());
                    config.setDateField(definition.getDateField());
                    config.setDateFormat(definition.getDateFormat());
                    config.setMaxAgeHours(definition.getMaxAgeHours());
                    config.setCreatedBy("system");
                    config.setCreatedAt(LocalDateTime.now(clock));
                    config.setUpdatedAt(config.getCreatedAt());
                    return configRepository.save(config)
                            .doOnSuccess(saved -> logger.info("Seeded built-in dataset {}", saved.getDatasetId()));
                }))
                .flatMap(config -> ensureFreshnessRecord(config.getDatasetId()).thenReturn(config));
    }

    /**
     * Seed every built-in dataset
     */
    public Flux<DatasetConfig> seedBuiltIns(List<NycDataProperties.BuiltInDataset> definitions) {
        return Flux.fromIterable(definitions).concatMap(this::ensureBuiltIn);
    }

    /**
     * Current freshness record, or an unchecked one if none is stored
     */
    public Mono<DataFreshness> getFreshness(String datasetId) {
        return freshnessRepository.findByDatasetId(datasetId)
                .defaultIfEmpty(new DataFreshness(datasetId));
    }

    public Flux<DataFreshness> getAllFreshness() {
        return freshnessRepository.findAll();
    }

    /**
     * Replace the stored freshness record. The stored {@code lastChecked} never moves backwards.
     */
    public Mono<DataFreshness> saveFreshness(DataFreshness record) {
        return freshnessRepository.findByDatasetId(record.getDatasetId())
                .map(stored -> {
                    record.setId(stored.getId());
                    if (stored.getLastChecked() != null
                            && (record.getLastChecked() == null || record.getLastChecked().isBefore(stored.getLastChecked()))) {
                        record.setLastChecked(stored.getLastChecked());
                    }
                    if (stored.getLastVerifiedAt() != null
                            && (record.getLastVerifiedAt() == null || record.getLastVerifiedAt().isBefore(stored.getLastVerifiedAt()))) {
                        record.setLastVerifiedAt(stored.getLastVerifiedAt());
                    }
                    return record;
                })
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    record.setId(null);
                    return record;
                }))
                .flatMap(freshnessRepository::save);
    }

    private Mono<DataFreshness> ensureFreshnessRecord(String datasetId) {
        return freshnessRepository.findByDatasetId(datasetId)
                .switchIfEmpty(Mono.defer(() -> freshnessRepository.save(new DataFreshness(datasetId))));
    }

    private Mono<DataFreshness> clearRecommendation(String datasetId) {
        return getFreshness(datasetId)
                .flatMap(freshness -> {
                    freshness.setRecommendSync(false);
                    return saveFreshness(freshness);
                });
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
