package com.openrangelabs.nycdata.sync.source;

import java.time.LocalDateTime;

/**
 * One page of a source read. {@code watermark} is exclusive; null reads from the start.
 */
public record SourcePageRequest(long offset, int limit, LocalDateTime watermark) {

    public SourcePageRequest next() {
        return new SourcePageRequest(offset + limit, limit, watermark);
    }

    public SourcePageRequest withLimit(int newLimit) {
        return new SourcePageRequest(offset, newLimit, watermark);
    }
}
