package com.ryuqq.poolguard.core.spi;

import java.util.Arrays;

/**
 * Opaque dead-letter entry as seen by a {@link DeadLetterStore}.
 *
 * @param id task id
 * @param data encoded entry
 * @param createdAtMillis time the entry was created (epoch millis)
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record StoredItem(String id, byte[] data, long createdAtMillis) {

    public StoredItem {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredItem)) return false;
        StoredItem that = (StoredItem) o;
        return createdAtMillis == that.createdAtMillis && id.equals(that.id) && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * id.hashCode() + Arrays.hashCode(data)) + Long.hashCode(createdAtMillis);
    }

    @Override
    public String toString() {
        return "StoredItem{id=" + id + ", bytes=" + data.length + ", createdAtMillis=" + createdAtMillis + '}';
    }
}
