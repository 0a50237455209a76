package com.openrangelabs.nycdata.sync.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openrangelabs.nycdata.sync.config.NycDataProperties;
import com.openrangelabs.nycdata.sync.dto.CreateDatasetRequest;
import com.openrangelabs.nycdata.sync.dto.ExecuteRecommendedRequest;
import com.openrangelabs.nycdata.sync.dto.IngestRequest;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.repository.DataFreshnessRepository;
import com.openrangelabs.nycdata.sync.repository.DatasetConfigRepository;
import com.openrangelabs.nycdata.sync.repository.DatasetRecordRepository;
import com.openrangelabs.nycdata.sync.repository.SyncLogRepository;
import com.openrangelabs.nycdata.sync.service.DatasetRegistryService;
import com.openrangelabs.nycdata.sync.source.OpenDataClient;
import com.openrangelabs.nycdata.sync.source.SourcePageRequest;
import com.openrangelabs.nycdata.sync.store.DatasetRecordStore;
import com.openrangelabs.nycdata.sync.transform.RecordDates;
import com.openrangelabs.nycdata.sync.transform.RecordTransformRegistry;
import com.openrangelabs.nycdata.sync.transform.SourceRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockJwt;

/**
 * End-to-end runs against H2 with the open data source stubbed out
 */
@SpringBootTest
@AutoConfigureWebTestClient
class NycDataSyncIntegrationTest {

    private static final String DATASET_ID = "abcd-1234";

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private DatasetConfigRepository configRepository;

    @Autowired
    private DataFreshnessRepository freshnessRepository;

    @Autowired
    private SyncLogRepository syncLogRepository;

    @Autowired
    private DatasetRecordRepository recordRepository;

    @Autowired
    private DatasetRecordStore recordStore;

    @Autowired
    private RecordTransformRegistry transformRegistry;

    @Autowired
    private DatasetRegistryService registryService;

    @Autowired
    private NycDataProperties properties;

    @MockBean
    private OpenDataClient openDataClient;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private List<JsonNode> remoteRows;

    private WebTestClient admin;
    private WebTestClient viewer;

    @BeforeEach
    void setUp() {
        recordRepository.deleteAll().block();
        syncLogRepository.deleteAll().block();
        freshnessRepository.deleteAll().block();
        configRepository.deleteAll().block();

        admin = webTestClient.mutateWith(mockJwt()
            .jwt(jwt -> jwt.subject("ops-admin"))
            .authorities(new SimpleGrantedAuthority("ROLE_ADMIN")));
        viewer = webTestClient.mutateWith(mockJwt()
            .jwt(jwt -> jwt.subject("analyst"))
            .authorities(new SimpleGrantedAuthority("ROLE_USER")));

        remoteRows = rows(1, 100);
        when(openDataClient.fetchRecordCount(any())).thenReturn(Mono.just(100L));
        when(openDataClient.fetchPage(any(), any())).thenAnswer(invocation -> {
            SourcePageRequest page = invocation.getArgument(1);
            List<JsonNode> newer = new ArrayList<>();
            for (JsonNode row : remoteRows) {
                LocalDateTime date = RecordDates.parse(row.get("created_at").asText(), null);
                if (page.watermark() == null || date.isAfter(page.watermark())) {
                    newer.add(row);
                }
            }
            int from = (int) Math.min(page.offset(), newer.size());
            int to = (int) Math.min(page.offset() + page.limit(), newer.size());
            return Mono.just(new ArrayList<>(newer.subList(from, to)));
        });
    }

    @Test
    void staleDataset_CheckedRecommendedAndSynced() {
        registerDataset();
        seedLocalRecords(50);
        remoteRows = rows(51, 100);

        admin.post()
            .uri("/api/nyc-data/freshness/check?datasetId=" + DATASET_ID)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.freshnessScore").isEqualTo(0.5)
            .jsonPath("$.stale").isEqualTo(true)
            .jsonPath("$.recommendSync").isEqualTo(true);

        viewer.get()
            .uri("/api/nyc-data/recommendations")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.immediate[0].datasetId").isEqualTo(DATASET_ID)
            .jsonPath("$.summary.immediate").isEqualTo(1)
            .jsonPath("$.summary.noAction").isEqualTo(0);

        admin.post()
            .uri("/api/nyc-data/sync/execute-recommended")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new ExecuteRecommendedRequest(2, 60L))
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.executed").isEqualTo(1)
            .jsonPath("$.failed").isEqualTo(0)
            .jsonPath("$.skipped").isEqualTo(0)
            .jsonPath("$.successRate").isEqualTo(100)
            .jsonPath("$.results[0].recordsProcessed").isEqualTo(50)
            .jsonPath("$.results[0].recordsAdded").isEqualTo(50);

        assertThat(recordStore.countByDataset(DATASET_ID).block()).isEqualTo(100L);

        DataFreshness freshness = freshnessRepository.findByDatasetId(DATASET_ID).block();
        assertThat(freshness).isNotNull();
        assertThat(freshness.getOurRecordCount()).isEqualTo(100L);
        assertThat(freshness.getFreshnessScore()).isEqualTo(1.0);
        assertThat(freshness.getRecommendSync()).isFalse();

        viewer.get()
            .uri("/api/nyc-data/logs?datasetId=" + DATASET_ID)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total").isEqualTo(1)
            .jsonPath("$.logs[0].status").isEqualTo("success")
            .jsonPath("$.logs[0].triggeredBy").isEqualTo("ops-admin")
            .jsonPath("$.logs[0].recordsUpdated").isEqualTo(0)
            .jsonPath("$.stats[0].recordsAdded").isEqualTo(50);
    }

    @Test
    void repeatedIngestion_IsIdempotentAndAdvancesToIncremental() {
        registerDataset();

        ingest(new IngestRequest(DATASET_ID, true, null))
            .jsonPath("$.status").isEqualTo("success")
            .jsonPath("$.syncType").isEqualTo("full")
            .jsonPath("$.recordsAdded").isEqualTo(100);

        ingest(new IngestRequest(DATASET_ID, true, null))
            .jsonPath("$.status").isEqualTo("success")
            .jsonPath("$.recordsProcessed").isEqualTo(100)
            .jsonPath("$.recordsAdded").isEqualTo(0)
            .jsonPath("$.recordsUpdated").isEqualTo(0);

        ingest(new IngestRequest(DATASET_ID, false, null))
            .jsonPath("$.status").isEqualTo("success")
            .jsonPath("$.syncType").isEqualTo("incremental")
            .jsonPath("$.recordsProcessed").isEqualTo(0)
            .jsonPath("$.lastRecordDate").exists();

        assertThat(recordStore.countByDataset(DATASET_ID).block()).isEqualTo(100L);
        assertThat(syncLogRepository.findByDatasetIdOrderByStartTimeDesc(DATASET_ID).count().block()).isEqualTo(3L);
    }

    @Test
    void unknownDataset_IngestRecordedAsFailedRun() {
        ingest(new IngestRequest("zzzz-9999", false, null))
            .jsonPath("$.status").isEqualTo("failed")
            .jsonPath("$.recordsProcessed").isEqualTo(0)
            .jsonPath("$.errorMessage").isEqualTo("Unknown dataset: zzzz-9999");
    }

    @Test
    void builtInDataset_CannotBeRemovedButCanBeDisabled() {
        registryService.seedBuiltIns(properties.getCatalog().getBuiltIn()).blockLast();

        admin.delete()
            .uri("/api/datasets/usep-8jbt")
            .exchange()
            .expectStatus().isForbidden();

        admin.put()
            .uri("/api/datasets/usep-8jbt")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"syncEnabled\": false}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.syncEnabled").isEqualTo(false)
            .jsonPath("$.builtIn").isEqualTo(true);

        viewer.get()
            .uri("/api/nyc-data/recommendations")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.noAction[0].datasetId").isEqualTo("usep-8jbt");
    }

    @Test
    void mutatingEndpoints_RequireAdmin() {
        viewer.post()
            .uri("/api/nyc-data/ingest")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new IngestRequest(DATASET_ID, false, null))
            .exchange()
            .expectStatus().isForbidden();

        webTestClient.get()
            .uri("/api/nyc-data/freshness")
            .exchange()
            .expectStatus().isUnauthorized();
    }

    private WebTestClient.BodyContentSpec ingest(IngestRequest request) {
        return admin.post()
            .uri("/api/nyc-data/ingest")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isOk()
            .expectBody();
    }

    private void registerDataset() {
        CreateDatasetRequest request = new CreateDatasetRequest(DATASET_ID, "Street Tree Census", 60, List.of("tree_id"));
        request.setDateField("created_at");

        admin.post()
            .uri("/api/datasets")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.createdBy").isEqualTo("ops-admin");
    }

    private void seedLocalRecords(int count) {
        DatasetConfig dataset = configRepository.findByDatasetId(DATASET_ID).block();
        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode raw : rows(1, count)) {
            records.add(transformRegistry.resolve(DATASET_ID).transform(dataset, raw).orElseThrow());
        }
        recordStore.upsertBatch(DATASET_ID, records).block();
    }

    private List<JsonNode> rows(int first, int last) {
        List<JsonNode> rows = new ArrayList<>();
        for (int i = first; i <= last; i++) {
            ObjectNode row = objectMapper.createObjectNode();
            row.put("tree_id", String.valueOf(i));
            row.put("created_at", String.format("2024-05-01T%02d:%02d:00.000", i / 60, i % 60));
            row.put("spc_common", "London planetree");
            rows.add(row);
        }
        return rows;
    }
}
