package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.Memory;

public record SearchHit(Memory memory, double score) {
}
