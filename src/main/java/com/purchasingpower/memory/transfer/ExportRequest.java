package com.purchasingpower.memory.transfer;

import com.purchasingpower.memory.core.MemoryType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Empty {@code types} exports every type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportRequest {

    @Builder.Default
    private List<MemoryType> types = new ArrayList<>();

    private boolean includeDeleted;
}
