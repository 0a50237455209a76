package com.openrangelabs.nycdata.sync.controller;

import com.openrangelabs.nycdata.sync.dto.RegisterDiscoveredRequest;
import com.openrangelabs.nycdata.sync.entity.DatasetConfig;
import com.openrangelabs.nycdata.sync.model.CatalogSearchFilters;
import com.openrangelabs.nycdata.sync.model.CatalogSearchResult;
import com.openrangelabs.nycdata.sync.model.DiscoveryDetails;
import com.openrangelabs.nycdata.sync.model.RecommendedDataset;
import com.openrangelabs.nycdata.sync.service.DatasetDiscoveryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.util.List;

/**
 * REST controller for finding datasets in the NYC Open Data catalog
 */
@RestController
@RequestMapping("/api/datasets/discover")
@CrossOrigin(origins = "${nycdata.security.cors.allowed-origins:http://localhost:3000}")
@Tag(name = "Discovery", description = "Catalog search and registration of catalog datasets")
public class DatasetDiscoveryController {

    private final DatasetDiscoveryService discoveryService;

    public DatasetDiscoveryController(DatasetDiscoveryService discoveryService) {
        this.discoveryService = discoveryService;
    }

    @GetMapping
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "Search the catalog")
    public Mono<CatalogSearchResult> search(
            @RequestParam(required = false) String query,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) List<String> tags,
            @RequestParam(defaultValue = "0") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return discoveryService.search(new CatalogSearchFilters(query, category, tags, limit, offset));
    }

    @GetMapping("/recommended")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    @Operation(summary = "Catalog datasets about property and buildings")
    public Mono<List<RecommendedDataset>> recommended() {
        return discoveryService.recommended();
    }

    /**
     * Catalog metadata of one dataset with detected key and date fields; 404 if the catalog does not know it
     */
    @GetMapping("/{datasetId}")
    @PreAuthorize("hasRole('ADMIN') or hasRole('USER')")
    public Mono<DiscoveryDetails> details(@PathVariable String datasetId) {
        return discoveryService.details(datasetId);
    }

    @PostMapping("/{datasetId}/register")
    @PreAuthorize("hasRole('ADMIN')")
    @Operation(summary = "Register a catalog dataset as a custom dataset")
    public Mono<ResponseEntity<DatasetConfig>> register(@PathVariable String datasetId,
                                                        @Valid @RequestBody(required = false) RegisterDiscoveredRequest request,
                                                        Principal principal) {
        return discoveryService.register(datasetId, request, SyncController.actor(principal))
                .map(config -> ResponseEntity.status(HttpStatus.CREATED).body(config));
    }
}
