package io.tessera.serialization.render;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.tessera.core.TesseraConfig;
import io.tessera.core.exception.EmptyProjectException;
import io.tessera.core.exception.ValidationException;
import io.tessera.core.model.EnvVar;
import io.tessera.core.model.Include;
import io.tessera.core.model.Requirement;
import io.tessera.core.project.LoggingProjectReporter;
import io.tessera.core.project.Project;
import io.tessera.core.project.ProjectReporter;
import io.tessera.core.workflow.Workflow;
import io.tessera.serialization.TesseraMappers;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.function.Function;

/// Materializes an aggregated {@link Project} as a directory of artifacts.
///
/// ### Artifacts
/// | Artifact | Written when | Content |
/// |----------|--------------|---------|
/// | `<workflowsDirectory>/<filePath>` | always, one per workflow | rendered workflow source |
/// | `requirements.txt` | a requirement names a package | sorted, distinct package names |
/// | `packages.txt` | a requirement names a system package | sorted, distinct system packages |
/// | `airflow_settings.yaml` | pools, variables or connections exist | settings document |
/// | `<include filepath>` | one per include | raw include contents |
/// | `.env` | env vars exist | one `KEY=VALUE` line per env var |
///
/// File names come from {@link TesseraConfig}. Skipped artifacts are reported
/// at debug level; they are not errors.
///
/// ### Guarantees
/// - Rendering the same project twice produces byte-identical output.
/// - Each file is written whole (see {@link AtomicFileWriter}); a failure part
///   way through leaves earlier artifacts in place, and rendering again completes them.
///
/// @implNote Thread-safe if the project is not modified during rendering.
public class ProjectRenderer {

    private final TesseraConfig config;
    private final ProjectReporter reporter;
    private final YAMLMapper yamlMapper;

    /// Creates a renderer with default configuration, logging through `java.util.logging`.
    public ProjectRenderer() {
        this(new TesseraConfig(), new LoggingProjectReporter(ProjectRenderer.class));
    }

    /// Creates a renderer.
    ///
    /// @param config artifact names and settings root key, not null
    /// @param reporter sink for diagnostics, not null
    public ProjectRenderer(TesseraConfig config, ProjectReporter reporter) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
        this.yamlMapper = TesseraMappers.createYamlMapper();
    }

    /// Writes every artifact of `project` below `outputDir`.
    ///
    /// @param project the aggregated project, not null
    /// @param outputDir root of the output, created if missing, not null
    /// @throws EmptyProjectException if the project has no workflows; nothing is written
    /// @throws ValidationException if a workflow or include path resolves outside `outputDir`
    /// @throws IOException if a file cannot be written
    public void render(Project project, Path outputDir) throws IOException {
        if (project.getWorkflows().isEmpty()) {
            throw new EmptyProjectException("No workflows to render");
        }
        Path root = outputDir.toAbsolutePath().normalize();

        writeWorkflows(project, root);
        writeManifest(
                project,
                root,
                config.getRequirementsFileName(),
                Requirement::packageName,
                "No packages to write, skipping ");
        writeManifest(
                project,
                root,
                config.getPackagesFileName(),
                Requirement::systemPackage,
                "No system packages to write, skipping ");
        writeSettings(project, root);
        writeIncludes(project, root);
        writeEnvFile(project, root);
    }

    private void writeWorkflows(Project project, Path root) throws IOException {
        Path workflowsDir = resolve(root, config.getWorkflowsDirectory());
        reporter.info("Writing " + workflowsDir);
        Files.createDirectories(workflowsDir);

        for (Workflow workflow : project.getWorkflows().values()) {
            Path file = resolve(workflowsDir, workflow.getFilePath());
            reporter.debug("Writing " + workflow.getFilePath());
            AtomicFileWriter.write(file, workflow.render());
        }
    }

    private void writeManifest(
            Project project,
            Path root,
            String fileName,
            Function<Requirement, String> field,
            String skipMessage)
            throws IOException {
        TreeSet<String> names = new TreeSet<>();
        for (Requirement requirement : project.getRequirements()) {
            String name = field.apply(requirement);
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        if (names.isEmpty()) {
            reporter.debug(skipMessage + fileName);
            return;
        }
        Path file = resolve(root, fileName);
        reporter.info("Writing " + file);
        AtomicFileWriter.write(file, String.join("\n", names));
    }

    private void writeSettings(Project project, Path root) throws IOException {
        if (project.getPools().isEmpty()
                && project.getVariables().isEmpty()
                && project.getConnections().isEmpty()) {
            reporter.debug(
                    "No pools, variables or connections to write, skipping "
                            + config.getSettingsFileName());
            return;
        }
        Map<String, Object> sections = new LinkedHashMap<>();
        sections.put("pools", new ArrayList<>(project.getPools().values()));
        sections.put("variables", new ArrayList<>(project.getVariables().values()));
        sections.put("connections", new ArrayList<>(project.getConnections().values()));
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(config.getSettingsRootKey(), sections);

        Path file = resolve(root, config.getSettingsFileName());
        reporter.info("Writing " + file);
        AtomicFileWriter.write(file, yamlMapper.writeValueAsString(document));
    }

    private void writeIncludes(Project project, Path root) throws IOException {
        if (project.getIncludes().isEmpty()) {
            reporter.debug("No files to include");
            return;
        }
        for (Include include : project.getIncludes().values()) {
            Path file = resolve(root, include.filepath());
            reporter.info("Writing " + file);
            AtomicFileWriter.write(file, include.render());
        }
    }

    private void writeEnvFile(Project project, Path root) throws IOException {
        if (project.getEnvVars().isEmpty()) {
            reporter.debug("No entries for " + config.getEnvFileName());
            return;
        }
        List<String> lines = new ArrayList<>();
        for (EnvVar envVar : project.getEnvVars().values()) {
            lines.add(envVar.render());
        }
        Path file = resolve(root, config.getEnvFileName());
        reporter.info("Writing " + file);
        AtomicFileWriter.write(file, String.join("\n", lines));
    }

    private static Path resolve(Path base, String relative) {
        Path target = base.resolve(relative).normalize();
        if (!target.startsWith(base)) {
            throw new ValidationException("Path escapes the output directory: " + relative);
        }
        return target;
    }
}
