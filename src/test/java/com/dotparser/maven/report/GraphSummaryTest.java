package com.dotparser.maven.report;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import com.dotparser.maven.graph.DotParser;
import com.dotparser.maven.graph.GraphData;

import static org.assertj.core.api.Assertions.assertThat;

class GraphSummaryTest {

    @Test
    @SuppressWarnings("unchecked")
    void toContext_describesGraph() {
        GraphData graph = DotParser.parse(
                "strict digraph deps { label=ignored; graph [rankdir=LR] b [shape=box] a -> b [color=red] }");
        Map<String, Object> context = GraphSummary.toContext("deps.dot", graph, new ReportConfig());

        assertThat(context).containsEntry("file", "deps.dot")
                .containsEntry("name", "deps")
                .containsEntry("kind", "digraph")
                .containsEntry("strict", true)
                .containsEntry("edgeOperator", "->")
                .containsEntry("nodeCount", 2)
                .containsEntry("edgeCount", 1)
                .containsEntry("hasGraphAttributes", true)
                .containsEntry("truncated", false);

        List<Map<String, Object>> nodes = (List<Map<String, Object>>) context.get("nodes");
        assertThat(nodes).extracting(n -> n.get("id")).containsExactly("b", "a");
        assertThat(nodes.get(0)).containsEntry("attributes", "[shape=box]").containsEntry("hasAttributes", true);
        assertThat(nodes.get(1)).containsEntry("attributes", "").containsEntry("hasAttributes", false);

        List<Map<String, Object>> edges = (List<Map<String, Object>>) context.get("edges");
        assertThat(edges).hasSize(1);
        assertThat(edges.get(0)).containsEntry("source", "a")
                .containsEntry("target", "b")
                .containsEntry("occurrence", 1)
                .containsEntry("attributes", "[color=red]");

        List<Map<String, Object>> graphAttributes = (List<Map<String, Object>>) context.get("graphAttributes");
        assertThat(graphAttributes).containsExactly(Map.of("key", "rankdir", "value", "LR"));
    }

    @Test
    void toContext_unnamedGraphFallsBackToFileName() {
        GraphData graph = DotParser.parse("graph { }");
        Map<String, Object> context = GraphSummary.toContext("flow.gv", graph, new ReportConfig());
        assertThat(context).containsEntry("name", "flow")
                .containsEntry("kind", "graph")
                .containsEntry("edgeOperator", "--")
                .containsEntry("hasGraphAttributes", false);
    }

    @Test
    @SuppressWarnings("unchecked")
    void toContext_sortsNodesByNameWhenConfigured() {
        GraphData graph = DotParser.parse("graph { c b a }");
        ReportConfig config = new ReportConfig();
        config.setNodeOrder(ReportConfig.NodeOrder.NAME);
        List<Map<String, Object>> nodes =
                (List<Map<String, Object>>) GraphSummary.toContext("g.dot", graph, config).get("nodes");
        assertThat(nodes).extracting(n -> n.get("id")).containsExactly("a", "b", "c");
    }

    @Test
    @SuppressWarnings("unchecked")
    void toContext_listsEveryOccurrenceUpToMaxEdges() {
        GraphData graph = DotParser.parse("graph { a -- b [w=1] b -- a [w=2] a -- c }");
        Map<String, Object> all = GraphSummary.toContext("g.dot", graph, new ReportConfig());
        List<Map<String, Object>> edges = (List<Map<String, Object>>) all.get("edges");
        assertThat(edges).extracting(e -> e.get("occurrence")).containsExactly(1, 2, 1);
        assertThat(edges).extracting(e -> e.get("attributes")).containsExactly("[w=1]", "[w=2]", "");

        ReportConfig config = new ReportConfig();
        config.setMaxEdges(2);
        Map<String, Object> capped = GraphSummary.toContext("g.dot", graph, config);
        assertThat((List<Map<String, Object>>) capped.get("edges")).hasSize(2);
        assertThat(capped).containsEntry("truncated", true);
    }

    @Test
    void formatAttributes_keepsInsertionOrder() {
        GraphData graph = DotParser.parse("graph { a [z=1, a=2] }");
        assertThat(GraphSummary.formatAttributes(graph.getNodes().get("a"))).isEqualTo("[z=1, a=2]");
        assertThat(GraphSummary.formatAttributes(Map.of())).isEmpty();
    }
}
