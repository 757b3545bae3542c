package com.purchasingpower.memory.transfer;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Newline-delimited JSON export and import of a project's memories.
 *
 * <p>The first line of an export is a {@code _meta} header (export time, project, types,
 * format version); every further line is an {@link ExportRecord}. Import accepts the same
 * format, ignores the header, re-embeds every record and assigns it to the importing
 * project.
 *
 * @since 1.0.0
 */
public interface ExportImportService {

    String FORMAT_VERSION = "1.0";

    /**
     * @return number of memory lines written
     */
    int exportMemories(String projectId, ExportRequest request, OutputStream output);

    ImportResult importMemories(String projectId, InputStream input, ImportConflictPolicy policy);
}
