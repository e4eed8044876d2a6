package tech.terrareg.platform.ingestion.analysis;

import java.util.List;

/**
 * Resource graph stored with each module, submodule and example and served to the UI:
 * {@code {"nodes":[{"id","label","type","module"}],"edges":[{"source","target"}]}}.
 */
public record ResourceGraph(List<Node> nodes, List<Edge> edges) {

    /**
     * @param type   one of resource, data, module, provider, var, output, local
     * @param module module path the node lives in ({@code root} for the top level)
     */
    public record Node(String id, String label, String type, String module) {}

    public record Edge(String source, String target) {}
}
