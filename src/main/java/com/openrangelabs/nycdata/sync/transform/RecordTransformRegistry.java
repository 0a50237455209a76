package com.openrangelabs.nycdata.sync.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves the transform for a dataset id. Built once from the transform beans;
 * datasets without a dedicated transform use the catch-all one.
 */
@Component
public class RecordTransformRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RecordTransformRegistry.class);

    private final Map<String, RecordTransform> transforms = new HashMap<>();
    private final RecordTransform fallback;

    public RecordTransformRegistry(List<RecordTransform> transformList) {
        RecordTransform catchAll = null;
        for (RecordTransform transform : transformList) {
            if (transform.supportedDatasets().isEmpty()) {
                if (catchAll != null) {
                    throw new IllegalStateException("More than one catch-all record transform registered");
                }
                catchAll = transform;
                continue;
            }
            for (String datasetId : transform.supportedDatasets()) {
                RecordTransform previous = transforms.putIfAbsent(datasetId, transform);
                if (previous != null) {
                    throw new IllegalStateException("Dataset " + datasetId + " has two record transforms: "
                            + previous.getClass().getSimpleName() + ", " + transform.getClass().getSimpleName());
                }
            }
        }
        if (catchAll == null) {
            throw new IllegalStateException("No catch-all record transform registered");
        }
        this.fallback = catchAll;

        logger.info("Initialized record transforms for datasets: {}", transforms.keySet());
    }

    public RecordTransform resolve(String datasetId) {
        return transforms.getOrDefault(datasetId, fallback);
    }

    public boolean hasDedicatedTransform(String datasetId) {
        return transforms.containsKey(datasetId);
    }
}
