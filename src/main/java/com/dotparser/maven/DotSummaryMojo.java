package com.dotparser.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.dotparser.maven.graph.GraphData;
import com.dotparser.maven.report.GraphSummary;
import com.dotparser.maven.report.ReportConfig;
import com.dotparser.maven.report.ReportConfigLoader;
import com.dotparser.maven.template.MustacheTemplateRenderer;
import com.dotparser.maven.template.TemplateLoader;
import com.dotparser.maven.template.TemplateRenderer;

/**
 * Parses every DOT file of the project and writes one summary per graph
 * (nodes, edges and attributes) into {@code outputDir}.
 * <p>
 * Run manually: {@code mvn dotparser:summarize}
 */
@Mojo(name = "summarize", defaultPhase = LifecyclePhase.PROCESS_RESOURCES, threadSafe = true)
public class DotSummaryMojo extends AbstractDotMojo {

    @Parameter(property = "dotparser.outputDir", defaultValue = "${project.build.directory}/dot-summaries")
    private File outputDir;

    /** YAML report configuration; the bundled dot-report.yml is used when unset. */
    @Parameter(property = "dotparser.reportConfig")
    private File reportConfig;

    /** Directory whose templates override the bundled ones. */
    @Parameter(property = "dotparser.templateDir")
    private File templateDir;

    private ReportConfig config;
    private TemplateRenderer renderer;
    private int written;

    @Override
    protected void beforeParsing() throws IOException {
        if (reportConfig != null) {
            getLog().info("DotParser: Using report configuration " + reportConfig);
            config = ReportConfigLoader.load(reportConfig.toPath());
        } else {
            config = ReportConfigLoader.loadDefault();
        }
        Path userTemplates = templateDir != null ? templateDir.toPath() : null;
        renderer = new MustacheTemplateRenderer(new TemplateLoader(userTemplates, getLog()));
        Files.createDirectories(outputDir.toPath());
        written = 0;
    }

    @Override
    protected void onGraphParsed(Path file, GraphData graph) throws IOException {
        String fileName = file.getFileName().toString();
        Map<String, Object> context = GraphSummary.toContext(fileName, graph, config);
        String content = renderer.render(config.getTemplate(), context);

        // same layout as under sourceDir
        Path relative = relativeToSourceDir(file);
        Path targetDir = relative.getParent() == null
                ? outputDir.toPath()
                : outputDir.toPath().resolve(relative.getParent());
        Files.createDirectories(targetDir);
        Path outFile = targetDir.resolve(baseName(fileName) + "." + config.getExtension());
        Files.writeString(outFile, content, StandardCharsets.UTF_8);
        written++;
        getLog().debug("DotParser: Wrote " + outFile);
    }

    @Override
    protected String goalName() {
        return "summarize";
    }

    @Override
    protected void afterParsing() {
        getLog().info("DotParser: Wrote " + written + " summary file(s) to " + outputDir);
    }

    private static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
