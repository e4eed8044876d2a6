package tech.terrareg.platform.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Contents of {@code terrareg.json} / {@code .terrareg.json} at the module root.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModuleMetadata(
    String description,
    String owner,
    @JsonProperty("repo_clone_url") String repoCloneUrl,
    @JsonProperty("repo_browse_url") String repoBrowseUrl,
    @JsonProperty("repo_base_url") String repoBaseUrl,
    @JsonProperty("issues_url") String issuesUrl,
    String license,
    @JsonProperty("variable_template") JsonNode variableTemplate
) {

    public static final List<String> FILE_NAMES = List.of("terrareg.json", ".terrareg.json");

    public static ModuleMetadata empty() {
        return new ModuleMetadata(null, null, null, null, null, null, null, null);
    }

    /**
     * Names of {@code required} attributes that are absent or blank.
     */
    public List<String> missingAttributes(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String attribute : required) {
            if (isBlank(valueOf(attribute))) {
                missing.add(attribute);
            }
        }
        return missing;
    }

    private String valueOf(String attribute) {
        return switch (attribute) {
            case "description" -> description;
            case "owner" -> owner;
            case "repo_clone_url" -> repoCloneUrl;
            case "repo_browse_url" -> repoBrowseUrl;
            case "repo_base_url" -> repoBaseUrl;
            case "issues_url" -> issuesUrl;
            case "license" -> license;
            case "variable_template" -> variableTemplate == null || variableTemplate.isNull() ? null : variableTemplate.toString();
            default -> null;
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
