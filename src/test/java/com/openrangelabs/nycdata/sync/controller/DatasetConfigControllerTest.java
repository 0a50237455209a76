package com.openrangelabs.nycdata.sync.controller;

import com.openrangelabs.nycdata.sync.config.SecurityConfig;
import com.openrangelabs.nycdata.sync.dto.CreateDatasetRequest;
import com.openrangelabs.nycdata.sync.dto.DatasetDetails;
import com.openrangelabs.nycdata.sync.dto.UpdateDatasetRequest;
import com.openrangelabs.nycdata.sync.entity.DataFreshness;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.exception.BuiltInDatasetException;
import com.openrangelabs.nycdata.sync.exception.DatasetAlreadyExistsException;
import com.openrangelabs.nycdata.sync.exception.DatasetNotFoundException;
import com.openrangelabs.nycdata.sync.service.DatasetRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@WebFluxTest(DatasetConfigController.class)
@Import(SecurityConfig.class)
class DatasetConfigControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private DatasetRegistryService registryService;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    private DatasetConfig trees;

    @BeforeEach
    void setUp() {
        trees = new DatasetConfig("abcd-1234", "Street Trees", 30);
        trees.setPrimaryKeyFieldList(List.of("tree_id"));
        trees.setDateField("created_at");
    }

    @Test
    @WithMockUser(roles = "USER")
    void getDatasets_ActiveOnly() {
        when(registryService.getActiveDatasets()).thenReturn(Flux.just(trees));

        webTestClient.get()
            .uri("/api/datasets?activeOnly=true")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].datasetId").isEqualTo("abcd-1234")
            .jsonPath("$.length()").isEqualTo(1);

        verify(registryService, never()).getAllDatasets();
    }

    @Test
    @WithMockUser(roles = "USER")
    void getDataset_IncludesFreshness() {
        DataFreshness freshness = new DataFreshness("abcd-1234");
        freshness.setFreshnessScore(0.75);
        when(registryService.getDatasetDetails("abcd-1234"))
            .thenReturn(Mono.just(new DatasetDetails(trees, freshness, null)));

        webTestClient.get()
            .uri("/api/datasets/abcd-1234")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.config.name").isEqualTo("Street Trees")
            .jsonPath("$.freshness.freshnessScore").isEqualTo(0.75);
    }

    @Test
    @WithMockUser(roles = "USER")
    void getDataset_Unknown_NotFound() {
        when(registryService.getDatasetDetails("zzzz-9999"))
            .thenReturn(Mono.error(new DatasetNotFoundException("zzzz-9999")));

        webTestClient.get()
            .uri("/api/datasets/zzzz-9999")
            .exchange()
            .expectStatus().isNotFound();
    }

    @Test
    @WithMockUser(username = "ops-admin", roles = "ADMIN")
    void registerDataset_Created() {
        CreateDatasetRequest request = new CreateDatasetRequest("abcd-1234", "Street Trees", 30, List.of("tree_id"));
        when(registryService.registerDataset(any(CreateDatasetRequest.class), eq("ops-admin")))
            .thenReturn(Mono.just(trees));

        webTestClient.post()
            .uri("/api/datasets")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isCreated()
            .expectBody()
            .jsonPath("$.datasetId").isEqualTo("abcd-1234");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void registerDataset_Duplicate_Conflict() {
        when(registryService.registerDataset(any(CreateDatasetRequest.class), any()))
            .thenReturn(Mono.error(new DatasetAlreadyExistsException("usep-8jbt")));

        webTestClient.post()
            .uri("/api/datasets")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new CreateDatasetRequest("usep-8jbt", "Sales copy", 10, List.of("id")))
            .exchange()
            .expectStatus().isEqualTo(409);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void registerDataset_MissingName_BadRequest() {
        webTestClient.post()
            .uri("/api/datasets")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new CreateDatasetRequest("abcd-1234", null, 30, List.of("tree_id")))
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.fieldErrors.name").exists();

        verifyNoInteractions(registryService);
    }

    @Test
    @WithMockUser(roles = "USER")
    void registerDataset_NonAdmin_Forbidden() {
        webTestClient.post()
            .uri("/api/datasets")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new CreateDatasetRequest("abcd-1234", "Street Trees", 30, List.of("tree_id")))
            .exchange()
            .expectStatus().isForbidden();

        verifyNoInteractions(registryService);
    }

    @Test
    @WithMockUser(username = "ops-admin", roles = "ADMIN")
    void updateDataset_ReturnsUpdatedConfig() {
        UpdateDatasetRequest request = new UpdateDatasetRequest();
        request.setSyncEnabled(false);
        trees.setSyncEnabled(false);
        when(registryService.updateDataset(eq("abcd-1234"), any(UpdateDatasetRequest.class), eq("ops-admin")))
            .thenReturn(Mono.just(trees));

        webTestClient.put()
            .uri("/api/datasets/abcd-1234")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.syncEnabled").isEqualTo(false);
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void deactivateDataset_BuiltIn_Forbidden() {
        when(registryService.deactivateDataset(eq("usep-8jbt"), any()))
            .thenReturn(Mono.error(new BuiltInDatasetException("usep-8jbt")));

        webTestClient.delete()
            .uri("/api/datasets/usep-8jbt")
            .exchange()
            .expectStatus().isForbidden()
            .expectBody()
            .jsonPath("$.error").isEqualTo("Built-in Dataset");
    }

    @Test
    @WithMockUser(roles = "ADMIN")
    void deactivateDataset_Custom_ReturnsInactiveConfig() {
        trees.deactivate("ops-admin");
        when(registryService.deactivateDataset(eq("abcd-1234"), any())).thenReturn(Mono.just(trees));

        webTestClient.delete()
            .uri("/api/datasets/abcd-1234")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.active").isEqualTo(false);
    }
}
