package tech.terrareg.platform.ingestion.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class GraphParserTest {

    private static final String LEGACY = String.join("\n",
        "digraph {",
        "  compound = \"true\"",
        "  subgraph \"root\" {",
        "    \"[root] aws_s3_bucket.this (expand)\" [label = \"aws_s3_bucket.this\", shape = \"box\"]",
        "    \"[root] provider[\\\"registry.terraform.io/hashicorp/aws\\\"]\" [label = \"provider\", shape = \"diamond\"]",
        "    \"[root] var.name\" [label = \"var.name\", shape = \"note\"]",
        "    \"[root] aws_s3_bucket.this (expand)\" -> \"[root] provider[\\\"registry.terraform.io/hashicorp/aws\\\"]\"",
        "    \"[root] aws_s3_bucket.this (expand)\" -> \"[root] var.name\"",
        "    \"[root] provider[\\\"registry.terraform.io/hashicorp/aws\\\"] (close)\" -> \"[root] aws_s3_bucket.this (expand)\"",
        "    \"[root] root\" -> \"[root] meta.count-boundary (EachMode fixup)\"",
        "  }",
        "}");

    @Test
    @DisplayName("Legacy graph output yields resources, providers and variables with their edges")
    void parse_shouldReadLegacyFormat() {
        ResourceGraph graph = GraphParser.parse(LEGACY);

        assertThat(graph.nodes())
            .extracting(ResourceGraph.Node::type, ResourceGraph.Node::label)
            .containsExactly(
                tuple("resource", "aws_s3_bucket.this"),
                tuple("provider", "registry.terraform.io/hashicorp/aws"),
                tuple("var", "name"));
        assertThat(graph.edges()).hasSize(2);
        assertThat(graph.nodes()).allSatisfy(node -> assertThat(node.module()).isEqualTo("root"));
    }

    @Test
    @DisplayName("Close, root and meta nodes are dropped")
    void parse_shouldDropInternalNodes() {
        ResourceGraph graph = GraphParser.parse(LEGACY);

        assertThat(graph.nodes()).extracting(ResourceGraph.Node::id)
            .noneMatch(id -> id.contains("(close)") || id.startsWith("meta.") || id.equals("root"));
    }

    @Test
    @DisplayName("Nested module addresses are attributed to their module")
    void toNode_shouldAttributeModules() {
        ResourceGraph.Node resource = GraphParser.toNode("module.vpc.module.subnets.aws_subnet.private");
        ResourceGraph.Node module = GraphParser.toNode("module.vpc.module.subnets");
        ResourceGraph.Node data = GraphParser.toNode("module.vpc.data.aws_region.current");

        assertThat(resource.module()).isEqualTo("module.vpc.module.subnets");
        assertThat(resource.label()).isEqualTo("aws_subnet.private");
        assertThat(module.type()).isEqualTo("module");
        assertThat(module.label()).isEqualTo("subnets");
        assertThat(module.module()).isEqualTo("module.vpc");
        assertThat(data.type()).isEqualTo("data");
        assertThat(data.label()).isEqualTo("aws_region.current");
    }

    @Test
    @DisplayName("Self edges and empty input produce no edges")
    void parse_shouldIgnoreSelfEdges() {
        assertThat(GraphParser.parse("\"a_b.c\" -> \"a_b.c\"").edges()).isEmpty();
        assertThat(GraphParser.parse("").nodes()).isEmpty();
    }
}
