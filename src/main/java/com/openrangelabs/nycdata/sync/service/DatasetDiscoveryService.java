package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.dto.CreateDatasetRequest;
import com.openrangelabs.nycdata.sync.dto.RegisterDiscoveredRequest;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.DatasetConfigurationException;
import com.openrangelabs.nycdata.sync.exception.DatasetNotFoundException;
import com.openrangelabs.nycdata.sync.model.CatalogSearchFilters;
import com.openrangelabs.nycdata.sync.model.CatalogSearchResult;
import com.openrangelabs.nycdata.sync.model.DatasetColumn;
import com.openrangelabs.nycdata.sync.model.DiscoveredDataset;
import com.openrangelabs.nycdata.sync.model.DiscoveryDetails;
import com.openrangelabs.nycdata.sync.model.RecommendedDataset;
import com.openrangelabs.nycdata.sync.source.DatasetCatalogClient;
import com.openrangelabs.nycdata.sync.source.OpenDataClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds datasets in the source catalog and turns them into registry entries
 */
@Slf4j
@Service
public class DatasetDiscoveryService {

    private static final List<String> HIGH_RELEVANCE = List.of("property", "building", "real estate", "housing", "permit");
    private static final List<String> MEDIUM_RELEVANCE = List.of("construction", "development", "zoning", "assessment", "violation");
    private static final List<String> LOW_RELEVANCE = List.of("tax", "finance", "planning", "inspection", "license");
    private static final List<String> PRIORITY_KEYWORDS = List.of("property", "building", "permit", "violation", "housing", "rent", "sale");

    private static final List<Pattern> KEY_PATTERNS = List.of(
            Pattern.compile("^id$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_id$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_number$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^unique.*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^primary.*$", Pattern.CASE_INSENSITIVE));
    private static final List<Pattern> DATE_PATTERNS = List.of(
            Pattern.compile("^.*_date$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^.*_time$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(created|updated|modified).*$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^timestamp$", Pattern.CASE_INSENSITIVE));
    private static final Pattern PREFERRED_DATE = Pattern.compile("^(created|updated|modified).*$", Pattern.CASE_INSENSITIVE);

    private static final int MAX_KEY_FIELDS = 2;
    private static final int MAX_NAME_LENGTH = 255;

    private final DatasetCatalogClient catalogClient;
    private final OpenDataClient openDataClient;
    private final DatasetRegistryService registryService;
    private final NycDataProperties.Discovery properties;
    private final Clock clock;

    public DatasetDiscoveryService(DatasetCatalogClient catalogClient,
                                   OpenDataClient openDataClient,
                                   DatasetRegistryService registryService,
                                   NycDataProperties properties,
                                   Clock clock) {
        this.catalogClient = catalogClient;
        this.openDataClient = openDataClient;
        this.registryService = registryService;
        this.properties = properties.getDiscovery();
        this.clock = clock;
    }

    /**
     * Search the catalog, flagging datasets that are already registered
     */
    public Mono<CatalogSearchResult> search(CatalogSearchFilters filters) {
        int limit = filters.limit() <= 0 ? properties.getDefaultLimit() : Math.min(filters.limit(), properties.getMaxLimit());
        return catalogClient.search(filters.withLimit(limit))
                .zipWith(configuredIds())
                .map(tuple -> tuple.getT1().markConfigured(tuple.getT2()));
    }

    /**
     * Catalog datasets about property and buildings, most relevant first
     */
    public Mono<List<RecommendedDataset>> recommended() {
        CatalogSearchFilters filters = new CatalogSearchFilters(
                String.join(" OR ", properties.getRecommendedKeywords()), null, List.of(), properties.getMaxLimit(), 0);
        return search(filters)
                .map(result -> result.datasets().stream()
                        .map(dataset -> new RecommendedDataset(dataset, relevance(dataset)))
                        .sorted(Comparator.comparingInt(RecommendedDataset::relevanceScore).reversed()
                                .thenComparing(recommendation -> recommendation.dataset().name()))
                        .limit(properties.getRecommendedLimit())
                        .collect(Collectors.toList()));
    }

    /**
     * Catalog metadata with the live record count and detected registration settings
     */
    public Mono<DiscoveryDetails> details(String datasetId) {
        return catalogClient.fetchMetadata(datasetId)
                .switchIfEmpty(Mono.error(new DatasetNotFoundException(datasetId)))
                .flatMap(dataset -> Mono.zip(recordCount(dataset), configuredIds())
                        .map(tuple -> dataset
                                .withRecordCount(tuple.getT1().orElse(null))
                                .withConfigured(tuple.getT2().contains(datasetId))))
                .map(dataset -> new DiscoveryDetails(dataset,
                        detectPrimaryKeyFields(dataset.columns()),
                        detectDateField(dataset.columns()),
                        suggestPriority(dataset)));
    }

    /**
     * Register a catalog dataset as a custom dataset, filling unset overrides from detection
     */
    public Mono<DatasetConfig> register(String datasetId, RegisterDiscoveredRequest overrides, String actor) {
        RegisterDiscoveredRequest settings = overrides != null ? overrides : new RegisterDiscoveredRequest();
        return details(datasetId)
                .flatMap(details -> {
                    List<String> keys = settings.getPrimaryKeyFields() != null && !settings.getPrimaryKeyFields().isEmpty()
                            ? settings.getPrimaryKeyFields()
                            : details.suggestedPrimaryKeyFields();
                    if (keys.isEmpty()) {
                        return Mono.error(new DatasetConfigurationException(
                                "No primary key field detected for " + datasetId + "; supply primaryKeyFields"));
                    }
                    DiscoveredDataset dataset = details.dataset();
                    CreateDatasetRequest request = new CreateDatasetRequest(datasetId, truncate(dataset.name()),
                            settings.getPriority() != null ? settings.getPriority() : details.suggestedPriority(), keys);
                    request.setSyncEnabled(settings.getSyncEnabled() == null || settings.getSyncEnabled());
                    request.setDateField(settings.getDateField() != null ? settings.getDateField() : details.suggestedDateField());
                    request.setDateFormat(settings.getDateFormat());
                    request.setMaxAgeHours(settings.getMaxAgeHours());

                    log.info("Registering catalog dataset {} ({}) with keys {} and date field {}",
                            datasetId, dataset.name(), keys, request.getDateField());
                    return registryService.registerDataset(request, actor);
                });
    }

    int relevance(DiscoveredDataset dataset) {
        String text = (dataset.name() + " " + dataset.description() + " " + String.join(" ", dataset.tags()))
                .toLowerCase(Locale.ROOT);
        int score = 0;
        for (String keyword : HIGH_RELEVANCE) {
            if (text.contains(keyword)) score += 10;
        }
        for (String keyword : MEDIUM_RELEVANCE) {
            if (text.contains(keyword)) score += 5;
        }
        for (String keyword : LOW_RELEVANCE) {
            if (text.contains(keyword)) score += 2;
        }
        return score;
    }

    /**
     * Up to two id-like columns, else the first column. Socrata system columns are ignored.
     */
    List<String> detectPrimaryKeyFields(List<DatasetColumn> columns) {
        List<String> candidates = columns.stream()
                .map(DatasetColumn::fieldName)
                .filter(field -> !field.startsWith(":"))
                .collect(Collectors.toList());
        List<String> keys = candidates.stream()
                .filter(field -> KEY_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(field).matches()))
                .limit(MAX_KEY_FIELDS)
                .collect(Collectors.toList());
        if (!keys.isEmpty()) {
            return keys;
        }
        return candidates.isEmpty() ? List.of() : List.of(candidates.get(0));
    }

    String detectDateField(List<DatasetColumn> columns) {
        List<DatasetColumn> dates = columns.stream()
                .filter(column -> !column.fieldName().startsWith(":"))
                .filter(column -> column.isDate()
                        || DATE_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(column.fieldName()).matches()))
                .collect(Collectors.toList());
        return dates.stream()
                .filter(column -> PREFERRED_DATE.matcher(column.fieldName()).matches())
                .findFirst()
                .or(() -> dates.stream().findFirst())
                .map(DatasetColumn::fieldName)
                .orElse(null);
    }

    int suggestPriority(DiscoveredDataset dataset) {
        int priority = 50;
        String text = (dataset.name() + " " + dataset.description()).toLowerCase(Locale.ROOT);
        for (String keyword : PRIORITY_KEYWORDS) {
            if (text.contains(keyword)) priority += 5;
        }
        Long records = dataset.recordCount();
        if (records != null && records > 100_000) {
            priority += 10;
        } else if (records != null && records > 10_000) {
            priority += 5;
        }
        if (dataset.lastUpdated() != null && dataset.lastUpdated().isAfter(LocalDateTime.now(clock).minusDays(30))) {
            priority += 5;
        }
        return Math.min(100, Math.max(1, priority));
    }

    private Mono<Optional<Long>> recordCount(DiscoveredDataset dataset) {
        DatasetConfig target = new DatasetConfig(dataset.id(), dataset.name(), 50);
        target.setApiEndpoint(dataset.apiEndpoint());
        return openDataClient.fetchRecordCount(target)
                .map(Optional::of)
                .onErrorResume(error -> {
                    log.warn("Could not count records of catalog dataset {}: {}", dataset.id(), error.getMessage());
                    return Mono.just(Optional.empty());
                });
    }

    private Mono<Set<String>> configuredIds() {
        return registryService.getAllDatasets()
                .map(DatasetConfig::getDatasetId)
                .collect(Collectors.toSet());
    }

    private static String truncate(String name) {
        return name.length() <= MAX_NAME_LENGTH ? name : name.substring(0, MAX_NAME_LENGTH);
    }
}
