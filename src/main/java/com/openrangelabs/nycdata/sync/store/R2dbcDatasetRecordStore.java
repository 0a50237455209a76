package com.openrangelabs.nycdata.sync.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openrangelabs.nycdata.sync.entity.DatasetRecord;
import com.openrangelabs.nycdata.sync.exception.RecordTransformException;
import com.openrangelabs.nycdata.sync.model.BatchWriteResult;
import com.openrangelabs.nycdata.sync.model.UpsertResult;
import com.openrangelabs.nycdata.sync.repository.DatasetRecordRepository;
import com.openrangelabs.nycdata.sync.transform.SourceRecord;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Record store backed by the {@code dataset_records} table.
 * Each batch runs in its own transaction.
 */
@Component
public class R2dbcDatasetRecordStore implements DatasetRecordStore {

    private final DatasetRecordRepository repository;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public R2dbcDatasetRecordStore(DatasetRecordRepository repository,
                                   TransactionalOperator transactionalOperator,
                                   ObjectMapper objectMapper,
                                   Clock clock) {
        this.repository = repository;
        this.transactionalOperator = transactionalOperator;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Mono<BatchWriteResult> upsertBatch(String datasetId, List<SourceRecord> records) {
        if (records.isEmpty()) {
            return Mono.just(BatchWriteResult.empty());
        }
        // last occurrence wins when a page repeats a key
        Map<String, SourceRecord> byKey = new LinkedHashMap<>();
        records.forEach(record -> byKey.put(record.naturalKey(), record));

        return Flux.fromIterable(byKey.values())
                .concatMap(record -> upsert(datasetId, record))
                .collectList()
                .map(BatchWriteResult::of)
                .as(transactionalOperator::transactional);
    }

    @Override
    public Mono<Long> countByDataset(String datasetId) {
        return repository.countByDatasetId(datasetId);
    }

    private Mono<UpsertResult> upsert(String datasetId, SourceRecord record) {
        String payload = serialize(record);
        LocalDateTime now = LocalDateTime.now(clock);

        return repository.findByDatasetIdAndNaturalKey(datasetId, record.naturalKey())
                .flatMap(existing -> {
                    if (Objects.equals(existing.getPayload(), payload)
                            && Objects.equals(existing.getRecordDate(), record.recordDate())) {
                        return Mono.just(UpsertResult.UNCHANGED);
                    }
                    existing.setPayload(payload);
                    existing.setRecordDate(record.recordDate());
                    existing.setUpdatedAt(now);
                    return repository.save(existing).thenReturn(UpsertResult.UPDATED);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    DatasetRecord created = new DatasetRecord(datasetId, record.naturalKey(), record.recordDate(), payload);
                    created.setCreatedAt(now);
                    created.setUpdatedAt(now);
                    return repository.save(created).thenReturn(UpsertResult.INSERTED);
                }));
    }

    private String serialize(SourceRecord record) {
        try {
            return objectMapper.writeValueAsString(record.payload());
        } catch (JsonProcessingException e) {
            throw new RecordTransformException("Cannot serialize record " + record.naturalKey(), e);
        }
    }
}
