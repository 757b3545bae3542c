package com.purchasingpower.memory.maintenance;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one phase: how many items it found (and, outside a dry run, acted on) plus
 * human-readable details.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PhaseResult {

    private NormalizationPhase phase;
    private int count;

    @Builder.Default
    private List<String> details = new ArrayList<>();

    public static PhaseResult of(NormalizationPhase phase, int count, List<String> details, String emptyMessage) {
        return PhaseResult.builder()
                .phase(phase)
                .count(count)
                .details(details.isEmpty() ? new ArrayList<>(List.of(emptyMessage)) : details)
                .build();
    }

    public static PhaseResult failed(NormalizationPhase phase, String message) {
        return PhaseResult.builder()
                .phase(phase)
                .count(0)
                .details(new ArrayList<>(List.of("Error: " + message)))
                .build();
    }
}
