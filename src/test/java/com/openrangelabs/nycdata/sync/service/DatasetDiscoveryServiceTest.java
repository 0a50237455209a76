package com.openrangelabs.nycdata.sync.service;

import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.dto.CreateDatasetRequest;
import com.openrangelabs.nycdata.sync.dto.RegisterDiscoveredRequest;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.DatasetConfigurationException;
import com.openrangelabs.nycdata.sync.exception.DatasetNotFoundException;
import com.openrangelabs.nycdata.sync.exception.SourceUnavailableException;
import com.openrangelabs.nycdata.sync.model.CatalogSearchFilters;
import com.openrangelabs.nycdata.sync.model.CatalogSearchResult;
import com.openrangelabs.nycdata.sync.model.DatasetColumn;
import com.openrangelabs.nycdata.sync.model.DiscoveredDataset;
import com.openrangelabs.nycdata.sync.source.DatasetCatalogClient;
import com.openrangelabs.nycdata.sync.source.OpenDataClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatasetDiscoveryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private DatasetCatalogClient catalogClient;

    @Mock
    private OpenDataClient openDataClient;

    @Mock
    private DatasetRegistryService registryService;

    private NycDataProperties properties;
    private DatasetDiscoveryService discoveryService;

    @BeforeEach
    void setUp() {
        properties = new NycDataProperties();
        discoveryService = new DatasetDiscoveryService(catalogClient, openDataClient, registryService, properties, CLOCK);
    }

    @Test
    void search_FlagsRegisteredDatasetsAndCapsLimit() {
        when(catalogClient.search(any(CatalogSearchFilters.class))).thenReturn(Mono.just(new CatalogSearchResult(
            List.of(dataset("usep-8jbt", "NYC Property Sales", ""), dataset("abcd-1234", "Street Trees", "")),
            2, List.of(), List.of())));
        when(registryService.getAllDatasets()).thenReturn(Flux.just(new DatasetConfig("usep-8jbt", "NYC Property Sales", 95)));

        StepVerifier.create(discoveryService.search(new CatalogSearchFilters("sales", null, null, 5000, 0)))
            .expectNextMatches(result -> {
                assertThat(result.datasets()).extracting(DiscoveredDataset::configured).containsExactly(true, false);
                return true;
            })
            .verifyComplete();

        ArgumentCaptor<CatalogSearchFilters> filters = ArgumentCaptor.forClass(CatalogSearchFilters.class);
        verify(catalogClient).search(filters.capture());
        assertThat(filters.getValue().limit()).isEqualTo(properties.getDiscovery().getMaxLimit());
        assertThat(filters.getValue().query()).isEqualTo("sales");
    }

    @Test
    void search_NoLimit_UsesDefault() {
        when(catalogClient.search(any(CatalogSearchFilters.class)))
            .thenReturn(Mono.just(new CatalogSearchResult(List.of(), 0, List.of(), List.of())));
        when(registryService.getAllDatasets()).thenReturn(Flux.empty());

        StepVerifier.create(discoveryService.search(new CatalogSearchFilters(null, null, null, 0, 0)))
            .expectNextCount(1)
            .verifyComplete();

        verify(catalogClient).search(argThat(filters -> filters.limit() == properties.getDiscovery().getDefaultLimit()));
    }

    @Test
    void recommended_RanksByRelevanceAndCapsCount() {
        properties.getDiscovery().setRecommendedLimit(2);
        when(catalogClient.search(any(CatalogSearchFilters.class))).thenReturn(Mono.just(new CatalogSearchResult(List.of(
            dataset("aaaa-0001", "Street Trees", "Tree census"),
            dataset("bbbb-0001", "DOB Permits", "Building permit filings"),
            dataset("cccc-0001", "Housing Violations", "Property housing violation records")),
            3, List.of(), List.of())));
        when(registryService.getAllDatasets()).thenReturn(Flux.empty());

        StepVerifier.create(discoveryService.recommended())
            .expectNextMatches(recommended -> {
                assertThat(recommended).extracting(item -> item.dataset().id()).containsExactly("cccc-0001", "bbbb-0001");
                assertThat(recommended.get(0).relevanceScore()).isGreaterThan(recommended.get(1).relevanceScore());
                return true;
            })
            .verifyComplete();

        verify(catalogClient).search(argThat(filters -> filters.query().contains("property OR building")));
    }

    @Test
    void details_AddsRecordCountAndDetectedSettings() {
        DiscoveredDataset violations = new DiscoveredDataset("3h2n-5cm9", "DOB Violations", "Building violations",
            "Housing", List.of(), "https://data.cityofnewyork.us/resource/3h2n-5cm9.json", null, null,
            NOW.minusDays(2), List.of(
                column(":@computed_region_sbqj_enih", "number"),
                column("isn_dob_bis_viol", "text"),
                column("violation_number", "text"),
                column("issue_date", "text"),
                column("updated_at", "date")),
            "Daily", false);
        when(catalogClient.fetchMetadata("3h2n-5cm9")).thenReturn(Mono.just(violations));
        when(openDataClient.fetchRecordCount(any(DatasetConfig.class))).thenReturn(Mono.just(250_000L));
        when(registryService.getAllDatasets()).thenReturn(Flux.empty());

        StepVerifier.create(discoveryService.details("3h2n-5cm9"))
            .expectNextMatches(details -> {
                assertThat(details.dataset().recordCount()).isEqualTo(250_000L);
                assertThat(details.suggestedPrimaryKeyFields()).containsExactly("violation_number");
                assertThat(details.suggestedDateField()).isEqualTo("updated_at");
                // base 50, building and violation keywords, large and recently updated
                assertThat(details.suggestedPriority()).isEqualTo(75);
                return true;
            })
            .verifyComplete();

        verify(openDataClient).fetchRecordCount(argThat(config ->
            "https://data.cityofnewyork.us/resource/3h2n-5cm9.json".equals(config.getApiEndpoint())));
    }

    @Test
    void details_CountUnavailable_StillReturnsMetadata() {
        when(catalogClient.fetchMetadata("abcd-1234")).thenReturn(Mono.just(dataset("abcd-1234", "Street Trees", "")));
        when(openDataClient.fetchRecordCount(any(DatasetConfig.class)))
            .thenReturn(Mono.error(new SourceUnavailableException("abcd-1234", "Source returned 503")));
        when(registryService.getAllDatasets()).thenReturn(Flux.just(new DatasetConfig("abcd-1234", "Street Trees", 30)));

        StepVerifier.create(discoveryService.details("abcd-1234"))
            .expectNextMatches(details -> details.dataset().recordCount() == null && details.dataset().configured())
            .verifyComplete();
    }

    @Test
    void details_UnknownToCatalog_NotFound() {
        when(catalogClient.fetchMetadata("zzzz-9999")).thenReturn(Mono.empty());

        StepVerifier.create(discoveryService.details("zzzz-9999"))
            .expectError(DatasetNotFoundException.class)
            .verify();

        verifyNoInteractions(openDataClient);
    }

    @Test
    void register_FillsUnsetSettingsFromDetection() {
        DiscoveredDataset permits = new DiscoveredDataset("dq6g-a4sc", "DOB NOW: Approved Permits", "Work permits",
            "Housing", List.of(), "https://data.cityofnewyork.us/resource/dq6g-a4sc.json", null, null, null,
            List.of(column("job_filing_number", "text"), column("work_permit", "text"), column("approved_date", "date")),
            "Daily", false);
        when(catalogClient.fetchMetadata("dq6g-a4sc")).thenReturn(Mono.just(permits));
        when(openDataClient.fetchRecordCount(any(DatasetConfig.class))).thenReturn(Mono.just(500L));
        when(registryService.getAllDatasets()).thenReturn(Flux.empty());
        when(registryService.registerDataset(any(CreateDatasetRequest.class), eq("ops-admin")))
            .thenAnswer(invocation -> {
                CreateDatasetRequest request = invocation.getArgument(0);
                return Mono.just(new DatasetConfig(request.getDatasetId(), request.getName(), request.getPriority()));
            });

        RegisterDiscoveredRequest overrides = new RegisterDiscoveredRequest();
        overrides.setPrimaryKeyFields(List.of("work_permit"));
        overrides.setMaxAgeHours(24);

        StepVerifier.create(discoveryService.register("dq6g-a4sc", overrides, "ops-admin"))
            .expectNextCount(1)
            .verifyComplete();

        ArgumentCaptor<CreateDatasetRequest> request = ArgumentCaptor.forClass(CreateDatasetRequest.class);
        verify(registryService).registerDataset(request.capture(), eq("ops-admin"));
        assertThat(request.getValue().getPrimaryKeyFields()).containsExactly("work_permit");
        assertThat(request.getValue().getDateField()).isEqualTo("approved_date");
        assertThat(request.getValue().getMaxAgeHours()).isEqualTo(24);
        assertThat(request.getValue().getSyncEnabled()).isTrue();
        assertThat(request.getValue().getPriority()).isEqualTo(55);
    }

    @Test
    void register_NoColumns_RejectedWithoutRegistering() {
        when(catalogClient.fetchMetadata("abcd-1234")).thenReturn(Mono.just(dataset("abcd-1234", "Empty", "")));
        when(openDataClient.fetchRecordCount(any(DatasetConfig.class))).thenReturn(Mono.just(0L));
        when(registryService.getAllDatasets()).thenReturn(Flux.empty());

        StepVerifier.create(discoveryService.register("abcd-1234", null, "ops-admin"))
            .expectError(DatasetConfigurationException.class)
            .verify();

        verify(registryService, never()).registerDataset(any(), any());
    }

    @Test
    void detectPrimaryKeyFields_FallsBackToFirstColumn() {
        assertThat(discoveryService.detectPrimaryKeyFields(List.of(column("borough", "text"), column("block", "number"))))
            .containsExactly("borough");
        assertThat(discoveryService.detectPrimaryKeyFields(List.of())).isEmpty();
    }

    @Test
    void relevance_WeighsKeywordTiers() {
        assertThat(discoveryService.relevance(dataset("aaaa-0001", "Property Sales", ""))).isEqualTo(10);
        assertThat(discoveryService.relevance(dataset("aaaa-0002", "Zoning", "tax lots"))).isEqualTo(7);
        assertThat(discoveryService.relevance(dataset("aaaa-0003", "Street Trees", ""))).isZero();
    }

    private static DiscoveredDataset dataset(String id, String name, String description) {
        return new DiscoveredDataset(id, name, description, "Other", List.of(),
            "https://data.cityofnewyork.us/resource/" + id + ".json", null, null, null, List.of(), "Unknown", false);
    }

    private static DatasetColumn column(String fieldName, String dataType) {
        return new DatasetColumn(fieldName, fieldName.toUpperCase(), dataType, "", 0);
    }
}
