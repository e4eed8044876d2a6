package tech.terrareg.platform.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the stored terraform-docs JSON into registry component fields.
 * Missing or unparseable JSON yields empty lists.
 */
final class TerraformDocsView {

    private static final Logger LOG = Logger.getLogger(TerraformDocsView.class);

    private final JsonNode root;

    private TerraformDocsView(JsonNode root) {
        this.root = root;
    }

    static TerraformDocsView of(ObjectMapper objectMapper, String json) {
        if (json == null || json.isBlank()) {
            return new TerraformDocsView(objectMapper.createObjectNode());
        }
        try {
            return new TerraformDocsView(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            LOG.warnf("Stored terraform-docs output is not valid JSON: %s", e.getOriginalMessage());
            return new TerraformDocsView(objectMapper.createObjectNode());
        }
    }

    List<ModuleWire.Input> inputs() {
        List<ModuleWire.Input> inputs = new ArrayList<>();
        for (JsonNode node : root.path("inputs")) {
            JsonNode defaultValue = node.get("default");
            inputs.add(new ModuleWire.Input(
                node.path("name").asText(),
                text(node, "type"),
                text(node, "description"),
                defaultValue,
                node.path("required").asBoolean(defaultValue == null || defaultValue.isNull())));
        }
        return inputs;
    }

    List<ModuleWire.Output> outputs() {
        List<ModuleWire.Output> outputs = new ArrayList<>();
        for (JsonNode node : root.path("outputs")) {
            outputs.add(new ModuleWire.Output(node.path("name").asText(), text(node, "description")));
        }
        return outputs;
    }

    List<ModuleWire.Dependency> dependencies() {
        List<ModuleWire.Dependency> dependencies = new ArrayList<>();
        for (JsonNode node : root.path("modulecalls")) {
            dependencies.add(new ModuleWire.Dependency(node.path("name").asText(), text(node, "source"), text(node, "version")));
        }
        return dependencies;
    }

    List<ModuleWire.ProviderDependency> providerDependencies() {
        List<ModuleWire.ProviderDependency> providers = new ArrayList<>();
        for (JsonNode node : root.path("requirements")) {
            String name = node.path("name").asText();
            if ("terraform".equals(name)) {
                continue;
            }
            String source = text(node, "source");
            String namespace = source != null && source.contains("/") ? source.substring(0, source.indexOf('/')) : null;
            providers.add(new ModuleWire.ProviderDependency(name, namespace, source, text(node, "version")));
        }
        return providers;
    }

    List<ModuleWire.Resource> resources() {
        List<ModuleWire.Resource> resources = new ArrayList<>();
        for (JsonNode node : root.path("resources")) {
            resources.add(new ModuleWire.Resource(node.path("name").asText(), node.path("type").asText()));
        }
        return resources;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
