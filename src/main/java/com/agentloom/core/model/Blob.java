package com.agentloom.core.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * Inline binary payload with its MIME type.
 */
public record Blob(String mimeType, byte[] data) implements Serializable {

    public Blob {
        Objects.requireNonNull(data, "data must not be null");
        data = data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Blob other)) return false;
        return Objects.equals(mimeType, other.mimeType) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hashCode(mimeType) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Blob[mimeType=" + mimeType + ", bytes=" + data.length + "]";
    }
}
