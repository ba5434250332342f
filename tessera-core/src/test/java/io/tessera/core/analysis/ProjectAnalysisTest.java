package io.tessera.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tessera.core.TesseraConfig;
import io.tessera.core.project.Project;
import io.tessera.core.project.ProjectReporter;
import io.tessera.core.workflow.Workflow;
import io.tessera.core.workflow.task.OperatorTask;
import io.tessera.core.workflow.task.TaskGroup;
import org.junit.jupiter.api.Test;

public class ProjectAnalysisTest {

    @Test
    void shouldProduceOnlyTotalsForEmptyProject() {
        var analysis = ProjectAnalysis.of(emptyProject());

        assertThat(analysis.getRows()).hasSize(1);
        assertThat(analysis.getTotals())
                .containsEntry(ProjectAnalysis.FILE_COLUMN, ProjectAnalysis.TOTALS_LABEL)
                .containsEntry(ProjectAnalysis.WORKFLOWS_COLUMN, 0);
        assertThat(analysis.getColumns()).containsExactly("file", "Workflows");
    }

    @Test
    void shouldCountWorkflowsAndTaskTypesPerSourceFile() {
        var project =
                emptyProject()
                        .addWorkflows(
                                workflow("a", "a.xml", "BashOperator"),
                                workflow("b", "b.xml", "BashOperator"));

        var analysis = ProjectAnalysis.of(project);

        assertThat(analysis.getRows()).hasSize(3);
        assertThat(analysis.getRows().get(0))
                .containsEntry("file", "a.xml")
                .containsEntry("Workflows", 1)
                .containsEntry("BashOperator", 1);
        assertThat(analysis.getTotals())
                .containsEntry("Workflows", 2)
                .containsEntry("BashOperator", 2);
    }

    @Test
    void shouldLeaveMissingTaskTypesAbsent() {
        var group = TaskGroup.builder().taskId("g").build();
        var project =
                emptyProject()
                        .addWorkflows(
                                workflow("a", "a.xml", "BashOperator"),
                                Workflow.builder()
                                        .id("b")
                                        .filePath("b.py")
                                        .sourceFile("b.xml")
                                        .task(group)
                                        .build());

        var analysis = ProjectAnalysis.of(project);

        assertThat(analysis.getColumns())
                .containsExactly("file", "Workflows", "BashOperator", "TaskGroup");
        assertThat(analysis.getRows().get(1)).doesNotContainKey("BashOperator");
    }

    @Test
    void shouldFallBackToFilePathWithoutSourceFile() {
        var project =
                emptyProject().addWorkflows(Workflow.builder().id("x").filePath("x.py").build());

        assertThat(ProjectAnalysis.of(project).getRows().get(0)).containsEntry("file", "x.py");
    }

    @Test
    void shouldGroupWorkflowsFromSameSourceFile() {
        var project =
                emptyProject()
                        .addWorkflows(
                                workflow("a", "jobs.xml", "BashOperator"),
                                workflow("b", "jobs.xml", "PythonOperator"));

        var analysis = ProjectAnalysis.of(project);

        assertThat(analysis.getRows()).hasSize(2);
        assertThat(analysis.getRows().get(0)).containsEntry("Workflows", 2);
    }

    @Test
    void shouldResolveFormatNames() {
        assertThat(AnalysisFormat.fromName("md")).isEqualTo(AnalysisFormat.MARKDOWN);
        assertThat(AnalysisFormat.fromName("Json")).isEqualTo(AnalysisFormat.JSON);
        assertThatThrownBy(() -> AnalysisFormat.fromName("xml"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Project emptyProject() {
        return new Project(new TesseraConfig(), ProjectReporter.silent());
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
