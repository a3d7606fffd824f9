package com.edge.equipment.core.cache;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class CacheStats {
    private int entryCount;
    private int entriesWithDescriptors;
    private String directory;
    private Instant lastIndexUpdate;
}
