package com.purchasingpower.memory.memory;

import com.purchasingpower.memory.core.Memory;

import java.util.List;

/**
 * One page of a listing; pass {@code nextOffset} back to continue.
 */
public record MemoryPage(List<Memory> memories, String nextOffset) {
}
