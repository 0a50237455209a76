package com.openrangelabs.nycdata.sync.source;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.exception.SourceUnavailableException;
import com.openrangelabs.nycdata.sync.model.CatalogSearchFilters;
import com.openrangelabs.nycdata.sync.model.DatasetColumn;
import com.openrangelabs.nycdata.sync.model.DiscoveredDataset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

class SocrataCatalogClientTest {

    private static final String SEARCH_BODY = """
        {
          "results": [
            {
              "resource": {
                "id": "usep-8jbt",
                "name": "NYC Property Sales",
                "description": "Rolling sales of property",
                "type": "dataset",
                "data_updated_at": "2024-05-30T14:10:20.000Z",
                "columns_field_name": ["borough", "block", "lot", "sale_date"],
                "columns_name": ["BOROUGH", "BLOCK", "LOT", "SALE DATE"],
                "columns_datatype": ["Text", "Number", "Number", "Floating Timestamp"]
              },
              "classification": {
                "domain_category": "City Government",
                "domain_tags": ["property", "sales"]
              }
            },
            {
              "resource": {"id": "chrt-0001", "name": "Sales chart", "type": "chart"},
              "classification": {"domain_tags": ["sales"]}
            },
            {
              "resource": {"id": "tg4x-b46p", "name": "Event Permits", "type": "dataset"},
              "classification": {"categories": ["Recreation"], "tags": ["permits", "sales"]}
            }
          ],
          "resultSetSize": 42
        }
        """;

    private NycDataProperties properties;
    private final List<ClientRequest> requests = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new NycDataProperties();
        properties.getSource().setBaseUrl("http://opendata.test/resource");
        properties.getSource().setRetryAttempts(2);
        properties.getSource().setRetryBackoffMillis(1);
        properties.getSource().setMaxRetryBackoffMillis(5);
        properties.getDiscovery().setCatalogUrl("http://catalog.test/api/catalog/v1");
        properties.getDiscovery().setDomain("data.cityofnewyork.us");
    }

    @Test
    void search_ScopesToDomainAndPassesFilters() {
        SocrataCatalogClient client = clientReturning(HttpStatus.OK, SEARCH_BODY);

        StepVerifier.create(client.search(new CatalogSearchFilters("rolling sales", "City Government",
                List.of("property", "sales"), 10, 20)))
            .expectNextCount(1)
            .verifyComplete();

        ClientRequest request = requests.get(0);
        assertThat(request.url().getHost()).isEqualTo("catalog.test");
        String query = request.url().getQuery();
        assertThat(query).contains("domains=data.cityofnewyork.us");
        assertThat(query).contains("only=datasets");
        assertThat(query).contains("limit=10");
        assertThat(query).contains("offset=20");
        assertThat(query).contains("q=rolling sales");
        assertThat(query).contains("categories=City Government");
        assertThat(query).contains("tags=property");
        assertThat(query).contains("tags=sales");
    }

    @Test
    void search_KeepsOnlyDatasetsAndCollectsCategoriesAndTags() {
        SocrataCatalogClient client = clientReturning(HttpStatus.OK, SEARCH_BODY);

        StepVerifier.create(client.search(new CatalogSearchFilters(null, null, null, 20, 0)))
            .expectNextMatches(result -> {
                assertThat(result.totalCount()).isEqualTo(42);
                assertThat(result.datasets()).extracting(DiscoveredDataset::id)
                    .containsExactly("usep-8jbt", "tg4x-b46p");
                assertThat(result.categories()).containsExactly("City Government", "Recreation");
                assertThat(result.popularTags()).startsWith("sales");
                return true;
            })
            .verifyComplete();
    }

    @Test
    void search_MapsColumnsEndpointsAndUpdateTime() {
        SocrataCatalogClient client = clientReturning(HttpStatus.OK, SEARCH_BODY);

        StepVerifier.create(client.search(new CatalogSearchFilters(null, null, null, 20, 0)))
            .expectNextMatches(result -> {
                DiscoveredDataset sales = result.datasets().get(0);
                assertThat(sales.category()).isEqualTo("City Government");
                assertThat(sales.tags()).containsExactly("property", "sales");
                assertThat(sales.apiEndpoint()).isEqualTo("http://opendata.test/resource/usep-8jbt.json");
                assertThat(sales.webUrl()).isEqualTo("https://data.cityofnewyork.us/d/usep-8jbt");
                assertThat(sales.lastUpdated()).isEqualTo(LocalDateTime.of(2024, 5, 30, 14, 10, 20));
                assertThat(sales.configured()).isFalse();
                assertThat(sales.columns()).extracting(DatasetColumn::dataType)
                    .containsExactly("text", "number", "number", "date");
                assertThat(result.datasets().get(1).columns()).isEmpty();
                return true;
            })
            .verifyComplete();
    }

    @Test
    void search_UnexpectedShape_SourceUnavailable() {
        SocrataCatalogClient client = clientReturning(HttpStatus.OK, "[]");

        StepVerifier.create(client.search(new CatalogSearchFilters(null, null, null, 20, 0)))
            .expectError(SourceUnavailableException.class)
            .verify();
    }

    @Test
    void search_TransientFailure_Retried() {
        AtomicInteger calls = new AtomicInteger();
        SocrataCatalogClient client = client(request -> calls.incrementAndGet() == 1
            ? response(HttpStatus.BAD_GATEWAY, "")
            : response(HttpStatus.OK, SEARCH_BODY));

        StepVerifier.create(client.search(new CatalogSearchFilters(null, null, null, 20, 0)))
            .expectNextCount(1)
            .verifyComplete();

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void fetchMetadata_ReadsViewColumnsAndFrequency() {
        SocrataCatalogClient client = clientReturning(HttpStatus.OK, """
            {
              "id": "3h2n-5cm9",
              "name": "DOB Violations",
              "category": "Housing & Development",
              "tags": ["violations"],
              "rowsUpdatedAt": 1717000000,
              "columns": [
                {"fieldName": "violation_number", "name": "VIOLATION_NUMBER", "dataTypeName": "text", "position": 1},
                {"fieldName": "issue_date", "name": "ISSUE_DATE", "dataTypeName": "calendar_date", "position": 2}
              ],
              "metadata": {"custom_fields": {"Dataset Information": {"Update Frequency": "Daily"}}}
            }
            """);

        StepVerifier.create(client.fetchMetadata("3h2n-5cm9"))
            .expectNextMatches(dataset -> {
                assertThat(dataset.name()).isEqualTo("DOB Violations");
                assertThat(dataset.category()).isEqualTo("Housing & Development");
                assertThat(dataset.updateFrequency()).isEqualTo("Daily");
                assertThat(dataset.lastUpdated()).isEqualTo(LocalDateTime.of(2024, 5, 29, 16, 26, 40));
                assertThat(dataset.columns()).extracting(DatasetColumn::fieldName)
                    .containsExactly("violation_number", "issue_date");
                assertThat(dataset.columns().get(1).isDate()).isTrue();
                return true;
            })
            .verifyComplete();

        assertThat(requests.get(0).url().getHost()).isEqualTo("data.cityofnewyork.us");
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/views/3h2n-5cm9.json");
    }

    @Test
    void fetchMetadata_UnknownDataset_Empty() {
        SocrataCatalogClient client = clientReturning(HttpStatus.NOT_FOUND, "{\"code\":\"not_found\"}");

        StepVerifier.create(client.fetchMetadata("zzzz-9999"))
            .verifyComplete();

        assertThat(requests).hasSize(1);
    }

    @Test
    void normalizeType_MapsSocrataTypes() {
        assertThat(SocrataCatalogClient.normalizeType("Money")).isEqualTo("number");
        assertThat(SocrataCatalogClient.normalizeType("Calendar date")).isEqualTo("date");
        assertThat(SocrataCatalogClient.normalizeType("checkbox")).isEqualTo("boolean");
        assertThat(SocrataCatalogClient.normalizeType("Point")).isEqualTo("text");
        assertThat(SocrataCatalogClient.normalizeType(null)).isEqualTo("text");
    }

    private SocrataCatalogClient clientReturning(HttpStatus status, String body) {
        return client(request -> response(status, body));
    }

    private SocrataCatalogClient client(Function<ClientRequest, ClientResponse> responder) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(responder.apply(request));
            })
            .build();
        return new SocrataCatalogClient(webClient, properties);
    }

    private static ClientResponse response(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
