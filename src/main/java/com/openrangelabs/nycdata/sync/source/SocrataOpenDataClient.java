package com.openrangelabs.nycdata.sync.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.OpenDataSourceException;
import com.openrangelabs.nycdata.sync.exception.SourceRequestException;
import com.openrangelabs.nycdata.sync.exception.SourceUnavailableException;
import com.openrangelabs.nycdata.sync.transform.RecordDates;
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
import java.util.ArrayList;
import java.util.List;

/**
 * Client for Socrata-backed open data portals such as data.cityofnewyork.us
 */
@Component
public class SocrataOpenDataClient implements OpenDataClient {

    private static final Logger logger = LoggerFactory.getLogger(SocrataOpenDataClient.class);

    private final WebClient webClient;
    private final NycDataProperties.Source properties;

    public SocrataOpenDataClient(@Qualifier("openDataWebClient") WebClient webClient,
                                 NycDataProperties properties) {
        this.webClient = webClient;
        this.properties = properties.getSource();
    }

    @Override
    public Mono<Long> fetchRecordCount(DatasetConfig dataset) {
        URI uri = resource(dataset)
                .queryParam("$select", "count(*) as count")
                .build()
                .encode()
                .toUri();

        return get(dataset, uri)
                .map(body -> parseCount(dataset, body))
                .doOnNext(count -> logger.debug("Source reports {} records for {}", count, dataset.getDatasetId()));
    }

    @Override
    public Mono<List<JsonNode>> fetchPage(DatasetConfig dataset, SourcePageRequest page) {
        UriComponentsBuilder builder = resource(dataset)
                .queryParam("$limit", page.limit())
                .queryParam("$offset", page.offset());

        String order = orderColumn(dataset);
        if (order != null) {
            builder.queryParam("$order", order + " ASC, :id ASC");
        }
        if (page.watermark() != null && dataset.supportsIncrementalSync()) {
            builder.queryParam("$where", dataset.getDateField() + " > '"
                    + RecordDates.format(page.watermark(), dataset.getDateFormat()) + "'");
        }

        URI uri = builder.build().encode().toUri();
        return get(dataset, uri)
                .map(body -> {
                    if (!body.isArray()) {
                        throw new SourceUnavailableException(dataset.getDatasetId(),
                                "Unexpected response shape from source: " + body.getNodeType());
                    }
                    List<JsonNode> records = new ArrayList<>(body.size());
                    body.forEach(records::add);
                    return records;
                })
                .doOnNext(records -> logger.debug("Fetched {} records for {} at offset {}",
                        records.size(), dataset.getDatasetId(), page.offset()));
    }

    private long parseCount(DatasetConfig dataset, JsonNode body) {
        JsonNode count = body.isArray() && !body.isEmpty() ? body.get(0).path("count") : null;
        if (count != null && count.isIntegralNumber()) {
            return count.longValue();
        }
        if (count != null && count.isTextual()) {
            try {
                return Long.parseLong(count.textValue().trim());
            } catch (NumberFormatException e) {
                throw new SourceUnavailableException(dataset.getDatasetId(),
                        "Source returned a non-numeric count: " + count.textValue(), e);
            }
        }
        // a missing count must not read as an empty dataset
        throw new SourceUnavailableException(dataset.getDatasetId(),
                "Unexpected count response from source: " + body);
    }

    private Mono<JsonNode> get(DatasetConfig dataset, URI uri) {
        String datasetId = dataset.getDatasetId();
        return webClient.get()
                .uri(uri)
                .retrieve()
                .onStatus(status -> status.value() == 429 || status.is5xxServerError(),
                        response -> Mono.error(new SourceUnavailableException(datasetId,
                                "Source returned " + response.statusCode().value())))
                .onStatus(HttpStatusCode::is4xxClientError,
                        response -> Mono.error(new SourceRequestException(datasetId,
                                response.statusCode().value(),
                                "Source rejected request with " + response.statusCode().value())))
                .bodyToMono(JsonNode.class)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .onErrorMap(error -> !(error instanceof OpenDataSourceException),
                        error -> new SourceUnavailableException(datasetId,
                                "Source call failed: " + error.getMessage(), error))
                .retryWhen(Retry.backoff(properties.getRetryAttempts(),
                                Duration.ofMillis(properties.getRetryBackoffMillis()))
                        .maxBackoff(Duration.ofMillis(properties.getMaxRetryBackoffMillis()))
                        .filter(SourceUnavailableException.class::isInstance)
                        .doBeforeRetry(signal -> logger.warn("Retrying source call for {} (attempt {}): {}",
                                datasetId, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    private UriComponentsBuilder resource(DatasetConfig dataset) {
        String endpoint = StringUtils.hasText(dataset.getApiEndpoint())
                ? dataset.getApiEndpoint()
                : properties.getBaseUrl() + "/" + dataset.getDatasetId() + ".json";
        return UriComponentsBuilder.fromUriString(endpoint);
    }

    private String orderColumn(DatasetConfig dataset) {
        if (dataset.supportsIncrementalSync()) {
            return dataset.getDateField();
        }
        List<String> keys = dataset.getPrimaryKeyFieldList();
        return keys.isEmpty() ? null : keys.get(0);
    }
}
