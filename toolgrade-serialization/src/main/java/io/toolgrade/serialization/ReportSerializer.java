package io.toolgrade.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.toolgrade.core.suite.SuiteReport;
import java.util.List;

/// Exports suite reports as JSON.
///
/// Each report carries its suite, model, timing, a summary (counts per classification and
/// mean score) and every case outcome with its full field trace.
public final class ReportSerializer {

    private ReportSerializer() {}

    /// @param report report to export, not null
    /// @return indented JSON object, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(SuiteReport report) {
        try {
            return SuiteSerializer.createMapper().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    /// @param reports reports to export, typically one per model, not null
    /// @return indented JSON array, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(List<SuiteReport> reports) {
        try {
            return SuiteSerializer.createMapper().writeValueAsString(reports);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize reports: " + e.getMessage(), e);
        }
    }
}
