package com.streamrelay.streamrelay.model;

import lombok.Value;

/**
 * Bytes used by recordings and the capacity the backend reports as available.
 */
@Value
public class StorageUsage {

    public static final StorageUsage ZERO = new StorageUsage(0L, 0L);

    long used;
    long available;
}
