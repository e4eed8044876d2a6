package tech.terrareg.platform.config;

import java.util.List;

/**
 * Registry policy: hosting mode, labels, auto-create behaviour and analytics wording.
 * Immutable after startup.
 */
public record DomainConfig(
    ModuleHostingMode allowModuleHosting,
    boolean allowProviderHosting,
    boolean autoCreateNamespace,
    boolean autoCreateModuleProvider,
    boolean autoPublishModuleVersions,
    List<String> trustedNamespaces,
    List<String> verifiedModuleNamespaces,
    String trustedNamespaceLabel,
    String contributedNamespaceLabel,
    String verifiedModuleLabel,
    String analyticsTokenPhrase,
    String analyticsTokenDescription,
    String exampleAnalyticsToken,
    boolean disableAnalytics,
    boolean allowUnidentifiedDownloads,
    boolean enableSecurityScanning,
    List<String> requiredModuleMetadataAttributes,
    List<String> exampleFileExtensions,
    String modulesDirectory,
    String examplesDirectory
) {

    public DomainConfig {
        trustedNamespaces = List.copyOf(trustedNamespaces);
        verifiedModuleNamespaces = List.copyOf(verifiedModuleNamespaces);
        requiredModuleMetadataAttributes = List.copyOf(requiredModuleMetadataAttributes);
        exampleFileExtensions = List.copyOf(exampleFileExtensions);
    }

    public boolean isTrustedNamespace(String namespace) {
        return trustedNamespaces.contains(namespace);
    }

    public boolean isVerifiedNamespace(String namespace) {
        return verifiedModuleNamespaces.contains(namespace);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ModuleHostingMode allowModuleHosting = ModuleHostingMode.ALLOW;
        private boolean allowProviderHosting = true;
        private boolean autoCreateNamespace = true;
        private boolean autoCreateModuleProvider = true;
        private boolean autoPublishModuleVersions = false;
        private List<String> trustedNamespaces = List.of();
        private List<String> verifiedModuleNamespaces = List.of();
        private String trustedNamespaceLabel = "Trusted";
        private String contributedNamespaceLabel = "Contributed";
        private String verifiedModuleLabel = "Verified";
        private String analyticsTokenPhrase = "analytics token";
        private String analyticsTokenDescription = "";
        private String exampleAnalyticsToken = "my-tf-application";
        private boolean disableAnalytics = false;
        private boolean allowUnidentifiedDownloads = false;
        private boolean enableSecurityScanning = true;
        private List<String> requiredModuleMetadataAttributes = List.of();
        private List<String> exampleFileExtensions = List.of("tf", "tfvars", "sh", "json");
        private String modulesDirectory = "modules";
        private String examplesDirectory = "examples";

        public Builder allowModuleHosting(ModuleHostingMode value) { this.allowModuleHosting = value; return this; }
        public Builder allowProviderHosting(boolean value) { this.allowProviderHosting = value; return this; }
        public Builder autoCreateNamespace(boolean value) { this.autoCreateNamespace = value; return this; }
        public Builder autoCreateModuleProvider(boolean value) { this.autoCreateModuleProvider = value; return this; }
        public Builder autoPublishModuleVersions(boolean value) { this.autoPublishModuleVersions = value; return this; }
        public Builder trustedNamespaces(List<String> value) { this.trustedNamespaces = value; return this; }
        public Builder verifiedModuleNamespaces(List<String> value) { this.verifiedModuleNamespaces = value; return this; }
        public Builder trustedNamespaceLabel(String value) { this.trustedNamespaceLabel = value; return this; }
        public Builder contributedNamespaceLabel(String value) { this.contributedNamespaceLabel = value; return this; }
        public Builder verifiedModuleLabel(String value) { this.verifiedModuleLabel = value; return this; }
        public Builder analyticsTokenPhrase(String value) { this.analyticsTokenPhrase = value; return this; }
        public Builder analyticsTokenDescription(String value) { this.analyticsTokenDescription = value; return this; }
        public Builder exampleAnalyticsToken(String value) { this.exampleAnalyticsToken = value; return this; }
        public Builder disableAnalytics(boolean value) { this.disableAnalytics = value; return this; }
        public Builder allowUnidentifiedDownloads(boolean value) { this.allowUnidentifiedDownloads = value; return this; }
        public Builder enableSecurityScanning(boolean value) { this.enableSecurityScanning = value; return this; }
        public Builder requiredModuleMetadataAttributes(List<String> value) { this.requiredModuleMetadataAttributes = value; return this; }
        public Builder exampleFileExtensions(List<String> value) { this.exampleFileExtensions = value; return this; }
        public Builder modulesDirectory(String value) { this.modulesDirectory = value; return this; }
        public Builder examplesDirectory(String value) { this.examplesDirectory = value; return this; }

        public DomainConfig build() {
            return new DomainConfig(
                allowModuleHosting, allowProviderHosting, autoCreateNamespace, autoCreateModuleProvider,
                autoPublishModuleVersions, trustedNamespaces, verifiedModuleNamespaces, trustedNamespaceLabel,
                contributedNamespaceLabel, verifiedModuleLabel, analyticsTokenPhrase, analyticsTokenDescription,
                exampleAnalyticsToken, disableAnalytics, allowUnidentifiedDownloads, enableSecurityScanning,
                requiredModuleMetadataAttributes, exampleFileExtensions, modulesDirectory, examplesDirectory);
        }
    }
}
