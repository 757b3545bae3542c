package com.purchasingpower.memory.api;

import com.purchasingpower.memory.maintenance.NormalizationPhase;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizeRequest {

    private List<NormalizationPhase> phases;
    private boolean dryRun;
}
