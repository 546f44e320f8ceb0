package org.carball.reducer.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.reducer.model.analysis.AvailableAnalysis;
import org.carball.reducer.model.analysis.BootstrapReport;
import org.carball.reducer.model.analysis.ColumnQuality;
import org.carball.reducer.model.analysis.NullProfileEntry;
import org.carball.reducer.model.grain.BlacklistFinding;
import org.carball.reducer.model.grain.Grain;
import org.carball.reducer.model.schema.ColumnDescriptor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders reducer results for people and machines: JSON for any result object, Markdown
 * for the bootstrap summary of a dataset.
 */
@Slf4j
public class ReducerReport {

    private final ObjectMapper objectMapper;

    public ReducerReport() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public String toJson(Object result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new RuntimeException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown(BootstrapReport report) {
        StringBuilder md = new StringBuilder();

        md.append("# Dataset Report: ").append(report.datasetId()).append("\n\n");
        md.append("**Generated:** ")
                .append(LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n\n");

        // Overview
        md.append("## Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        if (report.overview() != null) {
            md.append("| Rows | ").append(report.overview().rowCount()).append(" |\n");
            if (report.overview().timeRange() != null) {
                md.append("| Time Range | ").append(escape(report.overview().timeColumn())).append(": ")
                        .append(report.overview().timeRange().min()).append(" to ")
                        .append(report.overview().timeRange().max()).append(" |\n");
            }
        }
        md.append("| Columns | ").append(report.schema().size()).append(" |\n");
        md.append("| Sample Rows | ").append(report.preview().size()).append(" |\n");
        md.append("| Grains | ").append(report.grains().isEmpty() ? "none detected"
                : report.grains().stream().map(Grain::getKey).collect(Collectors.joining(", "))).append(" |\n");
        md.append("| Available Analyses | ").append(report.availableAnalyses().isEmpty() ? "none"
                : report.availableAnalyses().stream().map(AvailableAnalysis::getKey).collect(Collectors.joining(", ")))
                .append(" |\n\n");

        // Schema
        md.append("## Schema\n\n");
        md.append("| Column | Type | Engine Type | Nullable |\n");
        md.append("|--------|------|-------------|----------|\n");
        for (ColumnDescriptor column : report.schema()) {
            md.append("| ").append(escape(column.name()))
                    .append(" | ").append(column.declaredType())
                    .append(" | ").append(column.engineType())
                    .append(" | ").append(column.nullable() ? "yes" : "no")
                    .append(" |\n");
        }
        md.append("\n");

        if (report.nullProfile() != null && !report.nullProfile().isEmpty()) {
            md.append("## Column Profile\n\n");
            md.append("| Column | Nulls | Null Ratio | Distinct | Min | Max | Avg | Stddev |\n");
            md.append("|--------|-------|------------|----------|-----|-----|-----|--------|\n");
            for (NullProfileEntry entry : report.nullProfile()) {
                ColumnQuality quality = report.dataQuality() == null ? null : report.dataQuality().get(entry.column());
                Long distinct = report.uniqueness() == null ? null : report.uniqueness().get(entry.column());
                md.append("| ").append(escape(entry.column()))
                        .append(" | ").append(entry.nullCount())
                        .append(" | ").append(entry.nullRatio() == null ? "" : String.format(Locale.ROOT, "%.2f%%", entry.nullRatio() * 100))
                        .append(" | ").append(distinct == null ? "" : distinct)
                        .append(" | ").append(cell(quality == null ? null : quality.min()))
                        .append(" | ").append(cell(quality == null ? null : quality.max()))
                        .append(" | ").append(quality == null || quality.avg() == null ? "" : String.format(Locale.ROOT, "%.2f", quality.avg()))
                        .append(" | ").append(quality == null || quality.stddev() == null ? "" : String.format(Locale.ROOT, "%.2f", quality.stddev()))
                        .append(" |\n");
            }
            md.append("\n");
        }

        // Semantic guard
        md.append("## Blacklist\n\n");
        if (report.blacklist().isEmpty()) {
            md.append("No risky metric/grain combinations were found.\n");
        } else {
            md.append("| | Grain | Metric | Reason |\n");
            md.append("|-|-------|--------|--------|\n");
            for (BlacklistFinding finding : report.blacklist()) {
                md.append("| ").append(finding.isBlocking() ? "🚫" : "⚠️")
                        .append(" | ").append(finding.grain())
                        .append(" | ").append(String.join(", ", finding.metrics()))
                        .append(" | ").append(escape(finding.reason()))
                        .append(" |\n");
            }
        }

        return md.toString();
    }

    private static String cell(Object value) {
        return value == null ? "" : escape(value.toString());
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("|", "\\|");
    }
}
