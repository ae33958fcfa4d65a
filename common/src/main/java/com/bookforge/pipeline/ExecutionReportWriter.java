package com.bookforge.pipeline;

import com.bookforge.io.CsvTables;
import com.bookforge.model.StepReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the per-step execution report ({@code step,status,duration_sec,artifact,error}).
 */
final class ExecutionReportWriter {

    static final List<String> COLUMNS = List.of("step", "status", "duration_sec", "artifact", "error");

    private ExecutionReportWriter() {
        // utility class
    }

    static void write(Path path, char delimiter, List<StepReport> steps) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(steps.size());
        for (StepReport step : steps) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("step", step.getName());
            row.put("status", step.getStatus().label());
            row.put("duration_sec", step.getDurationMillis() / 1000.0);
            row.put("artifact", step.getArtifact() == null ? "" : step.getArtifact());
            row.put("error", step.getError() == null ? "" : step.getError());
            rows.add(row);
        }
        CsvTables.write(path, delimiter, COLUMNS, rows);
    }
}
