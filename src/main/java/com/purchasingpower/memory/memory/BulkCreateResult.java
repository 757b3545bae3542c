package com.purchasingpower.memory.memory;

import java.util.List;

public record BulkCreateResult(List<String> memoryIds) {

    public int getCount() {
        return memoryIds.size();
    }
}
