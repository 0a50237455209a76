package com.openrangelabs.nycdata.sync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.exception.OpenDataSourceException;
import com.openrangelabs.nycdata.sync.exception.SourceRequestException;
import com.openrangelabs.nycdata.sync.exception.SourceUnavailableException;
import com.openrangelabs.nycdata.sync.model.CatalogSearchFilters;
import com.openrangelabs.nycdata.sync.model.CatalogSearchResult;
import com.openrangelabs.nycdata.sync.model.DatasetColumn;
import com.openrangelabs.nycdata.sync.model.DiscoveredDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Catalog client for the Socrata discovery API, scoped to one portal domain
 */
@Component
public class SocrataCatalogClient implements DatasetCatalogClient {

    private static final Logger logger = LoggerFactory.getLogger(SocrataCatalogClient.class);

    private static final String CATALOG = "catalog";
    private static final int POPULAR_TAGS = 20;

    private final WebClient webClient;
    private final NycDataProperties.Source source;
    private final NycDataProperties.Discovery discovery;

    public SocrataCatalogClient(@Qualifier("openDataWebClient") WebClient webClient,
                                NycDataProperties properties) {
        this.webClient = webClient;
        this.source = properties.getSource();
        this.discovery = properties.getDiscovery();
    }

    @Override
    public Mono<CatalogSearchResult> search(CatalogSearchFilters filters) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(discovery.getCatalogUrl())
                .queryParam("domains", discovery.getDomain())
                .queryParam("search_context", discovery.getDomain())
                .queryParam("only", "datasets")
                .queryParam("limit", filters.limit())
                .queryParam("offset", filters.offset());
        if (StringUtils.hasText(filters.query())) {
            builder.queryParam("q", filters.query());
        }
        if (StringUtils.hasText(filters.category())) {
            builder.queryParam("categories", filters.category());
        }
        for (String tag : filters.tags()) {
            builder.queryParam("tags", tag);
        }

        URI uri = builder.build().encode().toUri();
        return get(CATALOG, uri)
                .map(this::toSearchResult)
                .doOnNext(result -> logger.debug("Catalog search '{}' returned {} of {} datasets",
                        filters.query(), result.datasets().size(), result.totalCount()));
    }

    @Override
    public Mono<DiscoveredDataset> fetchMetadata(String datasetId) {
        URI uri = UriComponentsBuilder.fromUriString("https://" + discovery.getDomain() + "/api/views/{id}.json")
                .buildAndExpand(datasetId)
                .encode()
                .toUri();
        return get(datasetId, uri)
                .map(view -> fromView(datasetId, view))
                .onErrorResume(SourceRequestException.class, error -> {
                    if (error.getStatusCode() == 404) {
                        logger.debug("Catalog has no dataset {}", datasetId);
                        return Mono.empty();
                    }
                    return Mono.error(error);
                });
    }

    private CatalogSearchResult toSearchResult(JsonNode body) {
        JsonNode results = body.path("results");
        if (!results.isArray()) {
            throw new SourceUnavailableException(CATALOG, "Unexpected catalog response shape: " + body.getNodeType());
        }

        List<DiscoveredDataset> datasets = new ArrayList<>();
        TreeSet<String> categories = new TreeSet<>();
        Map<String, Integer> tagCounts = new HashMap<>();
        for (JsonNode item : results) {
            JsonNode resource = item.path("resource");
            if (!"dataset".equals(resource.path("type").asText())
                    || !StringUtils.hasText(resource.path("id").asText())
                    || !StringUtils.hasText(resource.path("name").asText())) {
                continue;
            }
            DiscoveredDataset dataset = fromCatalogItem(resource, item.path("classification"));
            datasets.add(dataset);
            if (!"Other".equals(dataset.category())) {
                categories.add(dataset.category());
            }
            dataset.tags().forEach(tag -> tagCounts.merge(tag, 1, Integer::sum));
        }

        List<String> popularTags = tagCounts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(POPULAR_TAGS)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        long total = body.path("resultSetSize").asLong(datasets.size());
        return new CatalogSearchResult(datasets, total, new ArrayList<>(categories), popularTags);
    }

    private DiscoveredDataset fromCatalogItem(JsonNode resource, JsonNode classification) {
        String id = resource.path("id").asText();
        String category = text(classification.path("domain_category"));
        if (category == null) {
            category = text(classification.path("categories").path(0));
        }
        List<String> tags = strings(classification.path("domain_tags"));
        if (tags.isEmpty()) {
            tags = strings(classification.path("tags"));
        }

        List<String> fieldNames = strings(resource.path("columns_field_name"));
        List<String> names = strings(resource.path("columns_name"));
        List<String> types = strings(resource.path("columns_datatype"));
        List<String> descriptions = strings(resource.path("columns_description"));
        List<DatasetColumn> columns = new ArrayList<>(fieldNames.size());
        for (int i = 0; i < fieldNames.size(); i++) {
            columns.add(new DatasetColumn(fieldNames.get(i),
                    i < names.size() ? names.get(i) : fieldNames.get(i),
                    normalizeType(i < types.size() ? types.get(i) : null),
                    i < descriptions.size() ? descriptions.get(i) : "",
                    i));
        }

        LocalDateTime lastUpdated = isoTimestamp(text(resource.path("data_updated_at")));
        if (lastUpdated == null) {
            lastUpdated = isoTimestamp(text(resource.path("updatedAt")));
        }
        return dataset(id, resource.path("name").asText(), text(resource.path("description")),
                category, tags, lastUpdated, columns, null);
    }

    private DiscoveredDataset fromView(String datasetId, JsonNode view) {
        List<DatasetColumn> columns = new ArrayList<>();
        int index = 0;
        for (JsonNode column : view.path("columns")) {
            String fieldName = text(column.path("fieldName"));
            if (fieldName != null) {
                columns.add(new DatasetColumn(fieldName,
                        column.path("name").asText(fieldName),
                        normalizeType(text(column.path("dataTypeName"))),
                        column.path("description").asText(""),
                        column.path("position").asInt(index)));
            }
            index++;
        }

        LocalDateTime lastUpdated = null;
        if (view.path("rowsUpdatedAt").canConvertToLong()) {
            lastUpdated = LocalDateTime.ofInstant(Instant.ofEpochSecond(view.path("rowsUpdatedAt").asLong()), ZoneOffset.UTC);
        }
        String frequency = text(view.path("metadata").path("custom_fields")
                .path("Dataset Information").path("Update Frequency"));

        return dataset(datasetId, view.path("name").asText(datasetId), text(view.path("description")),
                text(view.path("category")), strings(view.path("tags")), lastUpdated, columns, frequency);
    }

    private DiscoveredDataset dataset(String id, String name, String description, String category,
                                      List<String> tags, LocalDateTime lastUpdated,
                                      List<DatasetColumn> columns, String updateFrequency) {
        return new DiscoveredDataset(id, name,
                description != null ? description : "",
                category != null ? category : "Other",
                tags,
                source.getBaseUrl() + "/" + id + ".json",
                "https://" + discovery.getDomain() + "/d/" + id,
                null,
                lastUpdated,
                columns,
                updateFrequency != null ? updateFrequency : "Unknown",
                false);
    }

    private Mono<JsonNode> get(String subject, URI uri) {
        return webClient.get()
                .uri(uri)
                .retrieve()
                .onStatus(status -> status.value() == 429 || status.is5xxServerError(),
                        response -> Mono.error(new SourceUnavailableException(subject,
                                "Catalog returned " + response.statusCode().value())))
                .onStatus(HttpStatusCode::is4xxClientError,
                        response -> Mono.error(new SourceRequestException(subject,
                                response.statusCode().value(),
                                "Catalog rejected request with " + response.statusCode().value())))
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(source.getTimeoutSeconds()))
                .onErrorMap(error -> !(error instanceof OpenDataSourceException),
                        error -> new SourceUnavailableException(subject,
                                "Catalog call failed: " + error.getMessage(), error))
                .retryWhen(Retry.backoff(source.getRetryAttempts(),
                                Duration.ofMillis(source.getRetryBackoffMillis()))
                        .maxBackoff(Duration.ofMillis(source.getMaxRetryBackoffMillis()))
                        .filter(SourceUnavailableException.class::isInstance)
                        .doBeforeRetry(signal -> logger.warn("Retrying catalog call for {} (attempt {}): {}",
                                subject, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    static String normalizeType(String socrataType) {
        if (socrataType == null) {
            return "text";
        }
        switch (socrataType.trim().toLowerCase().replace(' ', '_')) {
            case "number":
            case "money":
            case "percent":
            case "double":
                return "number";
            case "floating_timestamp":
            case "calendar_date":
            case "fixed_timestamp":
            case "date":
                return "date";
            case "checkbox":
                return "boolean";
            default:
                return "text";
        }
    }

    private static LocalDateTime isoTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable catalog timestamp {}", value);
            return null;
        }
    }

    private static String text(JsonNode node) {
        return node.isTextual() && StringUtils.hasText(node.textValue()) ? node.textValue() : null;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(value -> {
                if (value.isTextual()) {
                    values.add(value.textValue());
                }
            });
        }
        return values;
    }
}
