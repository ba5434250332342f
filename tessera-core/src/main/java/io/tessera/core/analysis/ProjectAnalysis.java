package io.tessera.core.analysis;

import io.tessera.core.project.Project;
import io.tessera.core.workflow.Workflow;
import io.tessera.core.workflow.task.Task;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Per-source-file summary of a project's workflows and top-level task types.
///
/// One row per distinct source file, in first-seen order, counting workflows
/// and tasks by type; the last row holds the totals. A file lacking a task type
/// has no cell for it. An empty project yields only the totals row.
///
/// ```
/// file      Workflows  BashOperator  TaskGroup
/// a.xml             1             2          1
/// b.xml             1             1
/// Totals            2             3          1
/// ```
///
/// @implNote Immutable snapshot; building it never modifies the project.
public final class ProjectAnalysis {

    public static final String FILE_COLUMN = "file";
    public static final String WORKFLOWS_COLUMN = "Workflows";
    public static final String TOTALS_LABEL = "Totals";

    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    private ProjectAnalysis(List<String> columns, List<Map<String, Object>> rows) {
        this.columns = Collections.unmodifiableList(columns);
        this.rows = Collections.unmodifiableList(rows);
    }

    /// Summarizes `project`.
    ///
    /// The source file of a workflow is its originating input file when known,
    /// its output file path otherwise.
    ///
    /// @param project project to summarize, not null
    /// @return analysis snapshot, never null
    public static ProjectAnalysis of(Project project) {
        Map<String, Map<String, Integer>> byFile = new LinkedHashMap<>();
        Set<String> columns = new LinkedHashSet<>();
        columns.add(FILE_COLUMN);
        columns.add(WORKFLOWS_COLUMN);

        for (Workflow workflow : project.getWorkflows().values()) {
            String file =
                    workflow.getSourceFile() != null
                            ? workflow.getSourceFile()
                            : workflow.getFilePath();
            Map<String, Integer> counts = byFile.computeIfAbsent(file, f -> new LinkedHashMap<>());
            counts.merge(WORKFLOWS_COLUMN, 1, Integer::sum);
            for (Task task : workflow.getTasks().values()) {
                counts.merge(task.getTaskType(), 1, Integer::sum);
                columns.add(task.getTaskType());
            }
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        Map<String, Integer> totals = new LinkedHashMap<>();
        totals.put(WORKFLOWS_COLUMN, 0);
        byFile.forEach(
                (file, counts) -> {
                    Map<String, Object> row = new LinkedHashMap<>();
                    row.put(FILE_COLUMN, file);
                    row.putAll(counts);
                    rows.add(Collections.unmodifiableMap(row));
                    counts.forEach((column, count) -> totals.merge(column, count, Integer::sum));
                });

        Map<String, Object> totalsRow = new LinkedHashMap<>();
        totalsRow.put(FILE_COLUMN, TOTALS_LABEL);
        for (String column : columns) {
            if (totals.containsKey(column)) {
                totalsRow.put(column, totals.get(column));
            }
        }
        rows.add(Collections.unmodifiableMap(totalsRow));

        return new ProjectAnalysis(new ArrayList<>(columns), rows);
    }

    /// Returns the column names: the file column, the workflow count, then task
    /// types in first-seen order.
    public List<String> getColumns() {
        return columns;
    }

    /// Returns every row including the trailing totals row.
    ///
    /// @return unmodifiable list, never empty
    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /// Returns the trailing totals row.
    public Map<String, Object> getTotals() {
        return rows.get(rows.size() - 1);
    }
}
