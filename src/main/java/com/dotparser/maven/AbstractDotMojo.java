package com.dotparser.maven;

import java.io.File;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Parameter;

import com.dotparser.maven.graph.DotParseException;
import com.dotparser.maven.graph.DotParser;
import com.dotparser.maven.graph.GraphData;

/**
 * Shared part of the goals: find DOT files under {@code sourceDir}, parse each one,
 * hand successful graphs to the subclass, and report failures.
 */
public abstract class AbstractDotMojo extends AbstractMojo {

    @Parameter(property = "dotparser.sourceDir", defaultValue = "${project.basedir}/src/main/dot")
    private File sourceDir;

    /** Comma-separated file extensions to pick up. */
    @Parameter(property = "dotparser.includes", defaultValue = "dot,gv")
    private String includes;

    @Parameter(property = "dotparser.failOnError", defaultValue = "true")
    private boolean failOnError;

    @Parameter(property = "dotparser.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("DotParser: Skipping " + goalName());
            return;
        }
        if (sourceDir == null || !sourceDir.isDirectory()) {
            getLog().warn("DotParser: Source directory does not exist: " + sourceDir);
            return;
        }

        List<String> failures = new ArrayList<>();
        int parsed = 0;
        try {
            beforeParsing();
            for (Path file : findDotFiles(sourceDir.toPath())) {
                String text;
                try {
                    text = Files.readString(file, StandardCharsets.UTF_8);
                } catch (CharacterCodingException e) {
                    String failure = file + ": not valid UTF-8 (" + e + ")";
                    getLog().error("DotParser: " + failure);
                    failures.add(failure);
                    continue;
                }
                GraphData graph;
                try {
                    graph = DotParser.parse(text);
                } catch (DotParseException e) {
                    String failure = file + ":" + e.getLine() + ":" + e.getColumn() + ": " + e.getMessage();
                    getLog().error("DotParser: " + failure);
                    failures.add(failure);
                    continue;
                }
                parsed++;
                onGraphParsed(file, graph);
            }
            afterParsing();
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to process DOT files in " + sourceDir, e);
        }

        getLog().info(String.format("DotParser: %s parsed %d graph(s), %d failed",
                goalName(), parsed, failures.size()));

        if (!failures.isEmpty() && failOnError) {
            StringBuilder message = new StringBuilder();
            message.append(failures.size()).append(" DOT file(s) could not be parsed:\n");
            for (String failure : failures) {
                message.append("  - ").append(failure).append("\n");
            }
            message.append("\nUse -Ddotparser.failOnError=false to report without failing the build.");
            throw new MojoFailureException(message.toString());
        }
    }

    /**
     * Regular files below {@code root} with an included extension, sorted by path.
     */
    List<Path> findDotFiles(Path root) throws IOException {
        Set<String> extensions = Arrays.stream(includes == null ? new String[0] : includes.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(extension(p)))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Path of {@code file} relative to {@code sourceDir}.
     */
    protected Path relativeToSourceDir(Path file) {
        return sourceDir.toPath().relativize(file);
    }

    private static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Called once before the first file is read.
     */
    protected void beforeParsing() throws IOException {
    }

    /**
     * Called once after the last file, before failures are reported.
     */
    protected void afterParsing() throws IOException {
    }

    /**
     * Called for every file that parsed without error.
     */
    protected abstract void onGraphParsed(Path file, GraphData graph) throws IOException;

    protected abstract String goalName();
}
