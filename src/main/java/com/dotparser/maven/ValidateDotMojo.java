package com.dotparser.maven;

import java.nio.file.Path;

import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;

import com.dotparser.maven.graph.GraphData;

/**
 * Parses every DOT file of the project and fails the build if any of them is malformed.
 * <p>
 * Run manually: {@code mvn dotparser:validate}
 */
@Mojo(name = "validate", defaultPhase = LifecyclePhase.VALIDATE, threadSafe = true)
public class ValidateDotMojo extends AbstractDotMojo {

    @Override
    protected void onGraphParsed(Path file, GraphData graph) {
        getLog().info(String.format("DotParser: %s: %s%s with %d node(s), %d edge(s)",
                file.getFileName(),
                graph.isStrict() ? "strict " : "",
                graph.isDirected() ? "digraph" : "graph",
                graph.nodeCount(),
                graph.edgeCount()));
    }

    @Override
    protected String goalName() {
        return "validate";
    }
}
