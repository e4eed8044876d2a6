package tech.terrareg.platform.ingestion.analysis;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code terraform graph} DOT output into a {@link ResourceGraph}.
 *
 * Handles both the legacy format ({@code "[root] aws_x.y (expand)"}) and the
 * plain-address format of newer Terraform releases. Internal nodes (root,
 * meta, close and provisioner nodes) are dropped.
 */
public final class GraphParser {

    private static final Pattern EDGE = Pattern.compile("^\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*->\\s*\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern NODE = Pattern.compile("^\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*\\[");
    private static final Pattern PROVIDER = Pattern.compile("^provider\\[\"?([^\"\\]]+)\"?](?:\\.(.+))?$");

    public static ResourceGraph parse(String dot) {
        Map<String, ResourceGraph.Node> nodes = new LinkedHashMap<>();
        Set<ResourceGraph.Edge> edges = new LinkedHashSet<>();

        for (String line : dot.split("\n")) {
            Matcher edge = EDGE.matcher(line);
            if (edge.find()) {
                ResourceGraph.Node source = toNode(edge.group(1));
                ResourceGraph.Node target = toNode(edge.group(2));
                if (source != null && target != null && !source.id().equals(target.id())) {
                    nodes.putIfAbsent(source.id(), source);
                    nodes.putIfAbsent(target.id(), target);
                    edges.add(new ResourceGraph.Edge(source.id(), target.id()));
                }
                continue;
            }
            Matcher node = NODE.matcher(line);
            if (node.find()) {
                ResourceGraph.Node parsed = toNode(node.group(1));
                if (parsed != null) {
                    nodes.putIfAbsent(parsed.id(), parsed);
                }
            }
        }
        return new ResourceGraph(new ArrayList<>(nodes.values()), new ArrayList<>(edges));
    }

    static ResourceGraph.Node toNode(String rawName) {
        String name = rawName.replace("\\\"", "\"").trim();
        if (name.startsWith("[root] ")) {
            name = name.substring("[root] ".length());
        }
        if (name.endsWith(" (close)") || name.endsWith(" (expand)")) {
            if (name.endsWith(" (close)")) {
                return null;
            }
            name = name.substring(0, name.length() - " (expand)".length());
        }
        if (name.isEmpty() || "root".equals(name) || name.startsWith("meta.") || name.contains("provisioner[")) {
            return null;
        }

        String module = "root";
        String address = name;
        List<String> moduleParts = new ArrayList<>();
        while (address.startsWith("module.")) {
            int nextDot = address.indexOf('.', "module.".length());
            if (nextDot < 0) {
                moduleParts.add(address);
                address = "";
                break;
            }
            moduleParts.add(address.substring(0, nextDot));
            address = address.substring(nextDot + 1);
        }
        if (!moduleParts.isEmpty()) {
            module = String.join(".", moduleParts);
        }

        if (address.isEmpty()) {
            return new ResourceGraph.Node(name, moduleParts.get(moduleParts.size() - 1).substring("module.".length()),
                "module", parentModule(moduleParts));
        }
        Matcher provider = PROVIDER.matcher(address);
        if (provider.matches()) {
            String label = provider.group(1);
            if (provider.group(2) != null) {
                label = label + "." + provider.group(2);
            }
            return new ResourceGraph.Node(name, label, "provider", module);
        }
        if (address.startsWith("data.")) {
            return new ResourceGraph.Node(name, address.substring("data.".length()), "data", module);
        }
        if (address.startsWith("var.")) {
            return new ResourceGraph.Node(name, address.substring("var.".length()), "var", module);
        }
        if (address.startsWith("output.")) {
            return new ResourceGraph.Node(name, address.substring("output.".length()), "output", module);
        }
        if (address.startsWith("local.")) {
            return new ResourceGraph.Node(name, address.substring("local.".length()), "local", module);
        }
        return new ResourceGraph.Node(name, address, "resource", module);
    }

    private static String parentModule(List<String> moduleParts) {
        return moduleParts.size() == 1 ? "root" : String.join(".", moduleParts.subList(0, moduleParts.size() - 1));
    }

    private GraphParser() {
        // Utility class
    }
}
