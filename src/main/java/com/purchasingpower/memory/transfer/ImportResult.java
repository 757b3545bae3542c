package com.purchasingpower.memory.transfer;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class ImportResult {

    static final int MAX_ERRORS = 50;

    private int imported;
    private int skipped;
    private int failed;
    private final List<String> errors = new ArrayList<>();

    public void recordImported() {
        imported++;
    }

    public void recordSkipped() {
        skipped++;
    }

    /**
     * Counts the failure; the message is kept only while fewer than 50 are recorded.
     */
    public void recordFailure(String message) {
        failed++;
        if (errors.size() < MAX_ERRORS) {
            errors.add(message);
        }
    }
}
