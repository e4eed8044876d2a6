package tech.terrareg.platform.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Terraform provider registry payloads.
 */
public final class ProviderWire {

    public record Platform(String os, String arch) {}

    public record VersionEntry(String version, List<String> protocols, List<Platform> platforms) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record VersionsResponse(String id, List<VersionEntry> versions, List<String> warnings) {}

    public record GpgPublicKey(
        @JsonProperty("key_id") String keyId,
        @JsonProperty("ascii_armor") String asciiArmor,
        @JsonProperty("trust_signature") String trustSignature,
        String source,
        @JsonProperty("source_url") String sourceUrl
    ) {}

    public record SigningKeys(@JsonProperty("gpg_public_keys") List<GpgPublicKey> gpgPublicKeys) {}

    public record Download(
        List<String> protocols,
        String os,
        String arch,
        String filename,
        @JsonProperty("download_url") String downloadUrl,
        @JsonProperty("shasums_url") String shasumsUrl,
        @JsonProperty("shasums_signature_url") String shasumsSignatureUrl,
        String shasum,
        @JsonProperty("signing_keys") SigningKeys signingKeys
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ProviderDetail(
        String id,
        String owner,
        String namespace,
        String name,
        String version,
        String description,
        String source,
        @JsonProperty("published_at") String publishedAt,
        String tier,
        String category,
        List<String> versions
    ) {}

    public record Category(Long id, String name, String slug, @JsonProperty("user_selectable") boolean userSelectable) {}

    private ProviderWire() {
        // Holder
    }
}
