package tech.terrareg.platform.registry;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Terraform Registry module payloads. Field names follow the registry protocol.
 */
public final class ModuleWire {

    /**
     * One module provider at its latest (or requested) published version.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ModuleSummary(
        String id,
        String owner,
        String namespace,
        String name,
        String version,
        String provider,
        String description,
        String source,
        @JsonProperty("published_at") String publishedAt,
        long downloads,
        boolean verified,
        boolean trusted,
        boolean internal
    ) {}

    public record Input(
        String name,
        String type,
        String description,
        @JsonProperty("default") JsonNode defaultValue,
        boolean required
    ) {}

    public record Output(String name, String description) {}

    public record Dependency(String name, String source, String version) {}

    public record ProviderDependency(String name, String namespace, String source, String version) {}

    public record Resource(String name, String type) {}

    /**
     * Root module, submodule or example.
     */
    public record Component(
        String path,
        String readme,
        boolean empty,
        List<Input> inputs,
        List<Output> outputs,
        List<Dependency> dependencies,
        @JsonProperty("provider_dependencies") List<ProviderDependency> providerDependencies,
        List<Resource> resources
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ModuleDetail(
        String id,
        String owner,
        String namespace,
        String name,
        String version,
        String provider,
        String description,
        String source,
        @JsonProperty("published_at") String publishedAt,
        long downloads,
        boolean verified,
        boolean trusted,
        boolean internal,
        Component root,
        List<Component> submodules,
        List<Component> examples,
        List<String> providers,
        List<String> versions
    ) {}

    public record VersionEntry(String version) {}

    public record ModuleVersions(String source, List<VersionEntry> versions) {}

    public record VersionsResponse(List<ModuleVersions> modules) {}

    private ModuleWire() {
        // Holder
    }
}
