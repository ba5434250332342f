package io.tessera.serialization.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.tessera.core.analysis.AnalysisFormat;
import io.tessera.core.analysis.ProjectAnalysis;
import io.tessera.core.project.Project;
import io.tessera.serialization.TesseraMappers;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Renders a {@link ProjectAnalysis} as text in one of the {@link AnalysisFormat}s.
///
/// ### Markdown output
/// ```
/// # Analysis
///
/// | file   | Workflows | BashOperator |
/// |:-------|----------:|-------------:|
/// | a.xml  |         1 |            2 |
/// | Totals |         1 |            2 |
/// ```
///
/// Numeric columns are right-aligned; absent cells are blank.
///
/// @implNote Stateless and thread-safe.
public class ProjectAnalyzer {

    private static final String HEADING = "# Analysis";

    /// Summarizes `project` and renders the summary.
    ///
    /// @param project project to summarize, not null
    /// @param format output encoding, not null
    /// @return rendered analysis, never null
    /// @throws IllegalArgumentException if the JSON or CSV encoder fails
    public String analyze(Project project, AnalysisFormat format) {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(format, "format must not be null");
        ProjectAnalysis analysis = ProjectAnalysis.of(project);
        switch (format) {
            case JSON:
                return toJson(analysis);
            case CSV:
                return toCsv(analysis);
            case MARKDOWN:
            default:
                return toMarkdown(analysis);
        }
    }

    String toJson(ProjectAnalysis analysis) {
        try {
            return TesseraMappers.createJsonMapper().writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to write analysis as JSON", e);
        }
    }

    String toCsv(ProjectAnalysis analysis) {
        CsvSchema.Builder schema = CsvSchema.builder();
        for (String column : analysis.getColumns()) {
            schema.addColumn(column);
        }
        CsvMapper mapper = TesseraMappers.createCsvMapper();
        try {
            return mapper.writer(schema.build().withHeader())
                    .writeValueAsString(analysis.getRows());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to write analysis as CSV", e);
        }
    }

    String toMarkdown(ProjectAnalysis analysis) {
        List<String> columns = analysis.getColumns();
        List<List<String>> cells = new ArrayList<>();
        for (Map<String, Object> row : analysis.getRows()) {
            List<String> line = new ArrayList<>();
            for (String column : columns) {
                Object value = row.get(column);
                line.add(value == null ? "" : value.toString());
            }
            cells.add(line);
        }

        int[] widths = new int[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            // separator needs room for the alignment colon plus three dashes
            widths[i] = Math.max(columns.get(i).length(), 4);
            for (List<String> line : cells) {
                widths[i] = Math.max(widths[i], line.get(i).length());
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append(HEADING).append("\n\n");
        appendRow(sb, columns, widths);
        sb.append('|');
        for (int i = 0; i < columns.size(); i++) {
            sb.append(i == 0 ? ':' + "-".repeat(widths[i] + 1) : "-".repeat(widths[i] + 1) + ':');
            sb.append('|');
        }
        sb.append('\n');
        for (List<String> line : cells) {
            appendRow(sb, line, widths);
        }
        return sb.toString();
    }

    private static void appendRow(StringBuilder sb, List<String> values, int[] widths) {
        sb.append('|');
        for (int i = 0; i < values.size(); i++) {
            String value = values.get(i);
            String padding = " ".repeat(widths[i] - value.length());
            sb.append(' ');
            sb.append(i == 0 ? value + padding : padding + value);
            sb.append(" |");
        }
        sb.append('\n');
    }
}
