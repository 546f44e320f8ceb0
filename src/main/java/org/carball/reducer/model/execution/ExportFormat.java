package org.carball.reducer.model.execution;

import lombok.Getter;

import java.util.Locale;

@Getter
public enum ExportFormat {
    CSV("csv", "text/csv", true),
    XLSX("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", false);

    private final String extension;
    private final String mediaType;
    /**
     * Whether rows can be written as they are read. XLSX cannot: the whole sheet is
     * built in memory before the file is written, so memory grows with the result size.
     */
    private final boolean rowStreamable;

    ExportFormat(String extension, String mediaType, boolean rowStreamable) {
        this.extension = extension;
        this.mediaType = mediaType;
        this.rowStreamable = rowStreamable;
    }

    public static ExportFormat fromString(String format) {
        if (format != null) {
            String normalized = format.trim().toLowerCase(Locale.ROOT);
            for (ExportFormat candidate : values()) {
                if (candidate.extension.equals(normalized)) {
                    return candidate;
                }
            }
        }
        throw new IllegalArgumentException("export format must be csv or xlsx");
    }
}
