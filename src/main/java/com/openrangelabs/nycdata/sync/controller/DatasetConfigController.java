package com.openrangelabs.nycdata.sync.controller;

import com.openrangelabs.nycdata.sync.dto.CreateDatasetRequest;
import com.openrangelabs.nycdata.sync.dto.DatasetDetails;
import com.openrangelabs.nycdata.sync.dto.UpdateDatasetRequest;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.service.DatasetRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.security.Principal;

/**
 * REST controller for dataset configuration management
 */
@RestController
@RequestMapping("/api/datasets")
@CrossOrigin(origins = "${nycdata.security.cors.allowed-origins:http://localhost:3000}")
@Tag(name = "Datasets", description = "Registered datasets and their sync settings")
public class DatasetConfigController {

    private final DatasetRegistryService registryService;

    public DatasetConfigController(DatasetRegistryService registryService) {
        this.registryService = registryService;
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Flux<DatasetConfig> getDatasets(@RequestParam(defaultValue = "false") boolean activeOnly) {
        return activeOnly ? registryService.getActiveDatasets() : registryService.getAllDatasets();
    }

    /**
     * Dataset configuration with its freshness record and latest completed run
     */
    @GetMapping("/{datasetId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<DatasetDetails> getDataset(@PathVariable String datasetId) {
        return registryService.getDatasetDetails(datasetId);
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Register a custom dataset")
    public Mono<ResponseEntity<DatasetConfig>> registerDataset(@Valid @RequestBody CreateDatasetRequest request,
                                                               Principal principal) {
        return registryService.registerDataset(request, SyncController.actor(principal))
                .map(config -> ResponseEntity.status(HttpStatus.CREATED).body(config));
    }

    @PutMapping("/{datasetId}")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<DatasetConfig> updateDataset(@PathVariable String datasetId,
                                             @Valid @RequestBody UpdateDatasetRequest request,
                                             Principal principal) {
        return registryService.updateDataset(datasetId, request, SyncController.actor(principal));
    }

    /**
     * Soft-remove a custom dataset; built-in datasets answer 403 and can only be disabled
     */
    @DeleteMapping("/{datasetId}")
    @PreAuthorize("hasRole('ADMIN')")
    public Mono<DatasetConfig> deactivateDataset(@PathVariable String datasetId, Principal principal) {
        return registryService.deactivateDataset(datasetId, SyncController.actor(principal));
    }
}
