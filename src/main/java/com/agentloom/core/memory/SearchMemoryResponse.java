package com.agentloom.core.memory;

import java.util.List;

public record SearchMemoryResponse(List<MemoryEntry> memories) {

    public SearchMemoryResponse {
        memories = memories == null ? List.of() : List.copyOf(memories);
    }

    public static SearchMemoryResponse empty() {
        return new SearchMemoryResponse(List.of());
    }
}
