package com.di.pgproof.sandbox;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Database-wide I/O counters from {@code pg_stat_database}. A before/after difference approximates
 * the cost of one statement; other sessions' I/O in the same window is included.
 */
@Value
@Builder
public class IoMetrics {

    public static final IoMetrics ZERO = IoMetrics.builder().build();

    long sharedBuffersHit;
    long sharedBuffersRead;
    long tempFiles;
    long tempBytes;
    double blkReadTimeMs;
    double blkWriteTimeMs;

    public IoMetrics minus(IoMetrics before) {
        return IoMetrics.builder()
                .sharedBuffersHit(sharedBuffersHit - before.sharedBuffersHit)
                .sharedBuffersRead(sharedBuffersRead - before.sharedBuffersRead)
                .tempFiles(tempFiles - before.tempFiles)
                .tempBytes(tempBytes - before.tempBytes)
                .blkReadTimeMs(blkReadTimeMs - before.blkReadTimeMs)
                .blkWriteTimeMs(blkWriteTimeMs - before.blkWriteTimeMs)
                .build();
    }

    /** Buffer pages touched, whether served from cache or read. */
    public long totalBufferAccesses() {
        return sharedBuffersHit + sharedBuffersRead;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("shared_buffers_hit", sharedBuffersHit);
        map.put("shared_buffers_read", sharedBuffersRead);
        map.put("temp_files", tempFiles);
        map.put("temp_bytes", tempBytes);
        map.put("blk_read_time_ms", blkReadTimeMs);
        map.put("blk_write_time_ms", blkWriteTimeMs);
        return map;
    }
}
