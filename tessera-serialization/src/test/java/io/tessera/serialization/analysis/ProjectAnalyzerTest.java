package io.tessera.serialization.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.type.TypeReference;
import io.tessera.core.TesseraConfig;
import io.tessera.core.analysis.AnalysisFormat;
import io.tessera.core.project.Project;
import io.tessera.core.project.ProjectReporter;
import io.tessera.core.workflow.Workflow;
import io.tessera.core.workflow.task.OperatorTask;
import io.tessera.serialization.TesseraMappers;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class ProjectAnalyzerTest {

    private ProjectAnalyzer analyzer;
    private Project project;

    @BeforeEach
    void setUp() {
        analyzer = new ProjectAnalyzer();
        project =
                new Project(new TesseraConfig(), ProjectReporter.silent())
                        .addWorkflows(
                                workflow("a", "a.xml", "BashOperator"),
                                workflow("b", "b.xml", "BashOperator"));
    }

    @Nested
    class MarkdownTest {

        @Test
        void shouldRenderPipeTableWithTotals() {
            assertThat(analyzer.analyze(project, AnalysisFormat.MARKDOWN))
                    .isEqualTo(
                            "# Analysis\n"
                                    + "\n"
                                    + "| file   | Workflows | BashOperator |\n"
                                    + "|:-------|----------:|-------------:|\n"
                                    + "| a.xml  |         1 |            1 |\n"
                                    + "| b.xml  |         1 |            1 |\n"
                                    + "| Totals |         2 |            2 |\n");
        }

        @Test
        void shouldRenderOnlyTotalsForEmptyProject() {
            var empty = new Project(new TesseraConfig(), ProjectReporter.silent());

            assertThat(analyzer.analyze(empty, AnalysisFormat.MARKDOWN))
                    .endsWith("| Totals |         0 |\n")
                    .contains("| file   | Workflows |\n");
        }

        @Test
        void shouldLeaveMissingCellsBlank() {
            project.addWorkflows(workflow("c", "c.xml", "PythonOperator"));

            assertThat(analyzer.analyze(project, AnalysisFormat.MARKDOWN))
                    .contains("| a.xml  |         1 |            1 |                |\n");
        }
    }

    @Test
    void shouldRenderJsonRecordList() throws Exception {
        var json = analyzer.analyze(project, AnalysisFormat.JSON);

        List<Map<String, Object>> rows =
                TesseraMappers.createJsonMapper().readValue(json, new TypeReference<>() {});
        assertThat(rows).hasSize(3);
        assertThat(rows.get(2))
                .containsEntry("file", "Totals")
                .containsEntry("Workflows", 2)
                .containsEntry("BashOperator", 2);
    }

    @Test
    void shouldRenderCsvWithHeader() {
        assertThat(analyzer.analyze(project, AnalysisFormat.CSV).split("\n"))
                .containsExactly(
                        "file,Workflows,BashOperator",
                        "a.xml,1,1",
                        "b.xml,1,1",
                        "Totals,2,2");
    }

    private static Workflow workflow(String id, String sourceFile, String operator) {
        return Workflow.builder()
                .id(id)
                .filePath(id + ".py")
                .sourceFile(sourceFile)
                .task(OperatorTask.builder().taskId("t").operator(operator).build())
                .build();
    }
}
