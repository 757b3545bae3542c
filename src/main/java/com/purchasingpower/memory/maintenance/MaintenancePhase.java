package com.purchasingpower.memory.maintenance;

/**
 * One normalization phase. Implementations turn per-item failures into detail lines and
 * let anything else propagate; the job records it as the phase's error.
 */
public interface MaintenancePhase {

    NormalizationPhase phase();

    PhaseResult run(String projectId, boolean dryRun);
}
