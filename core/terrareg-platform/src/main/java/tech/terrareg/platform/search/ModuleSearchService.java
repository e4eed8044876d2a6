package tech.terrareg.platform.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.terrareg.platform.config.DomainConfig;
import tech.terrareg.platform.module.ModuleProvider;
import tech.terrareg.platform.module.ModuleProviderRepository;
import tech.terrareg.platform.module.ModuleVersion;
import tech.terrareg.platform.module.ModuleVersionRepository;
import tech.terrareg.platform.module.SemanticVersion;
import tech.terrareg.platform.namespace.Namespace;
import tech.terrareg.platform.namespace.NamespaceRepository;
import tech.terrareg.platform.registry.ModuleRegistryService;
import tech.terrareg.platform.registry.ModuleWire;
import tech.terrareg.platform.shared.PageMeta;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Module listing and search over the latest published, non-beta version of each module provider.
 *
 * Results are ordered by score, then most recent publication, then
 * (namespace, module, provider), so pages are stable for a fixed data set.
 */
@ApplicationScoped
public class ModuleSearchService {

    static final int DEFAULT_LIMIT = 10;

    @Inject
    ModuleVersionRepository moduleVersionRepository;

    @Inject
    ModuleProviderRepository moduleProviderRepository;

    @Inject
    NamespaceRepository namespaceRepository;

    @Inject
    ModuleRegistryService moduleRegistryService;

    @Inject
    DomainConfig domainConfig;

    /**
     * Search parameters. Empty lists and null flags do not filter.
     */
    public record SearchQuery(
        String query,
        List<String> namespaces,
        List<String> providers,
        Boolean verified,
        Boolean trustedNamespaces,
        Boolean contributed,
        boolean includeInternal,
        Integer offset,
        Integer limit
    ) {

        public static SearchQuery listing(String namespace, String provider, Boolean verified, Integer offset, Integer limit) {
            return new SearchQuery(null,
                namespace == null ? List.of() : List.of(namespace),
                provider == null ? List.of() : List.of(provider),
                verified, null, null, false, offset, limit);
        }
    }

    public record SearchResult(PageMeta meta, List<ModuleWire.ModuleSummary> modules) {}

    public record SearchFilters(
        long verified,
        @JsonProperty("trusted_namespaces") long trustedNamespaces,
        long contributed,
        Map<String, Long> namespaces,
        Map<String, Long> providers
    ) {}

    /**
     * One candidate: latest visible version of a module provider.
     */
    record Candidate(Namespace namespace, ModuleProvider moduleProvider, ModuleVersion version, int score) {

        SearchScorer.Document document() {
            return new SearchScorer.Document(namespace.name, moduleProvider.moduleName, moduleProvider.providerName,
                version.description, version.owner);
        }
    }

    static final Comparator<Candidate> RANKING = Comparator
        .comparingInt(Candidate::score).reversed()
        .thenComparing((Candidate c) -> c.version().publishedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(c -> c.namespace().name)
        .thenComparing(c -> c.moduleProvider().moduleName)
        .thenComparing(c -> c.moduleProvider().providerName);

    public SearchResult search(SearchQuery query) {
        int limit = PageMeta.clampLimit(query.limit(), DEFAULT_LIMIT);
        int offset = PageMeta.clampOffset(query.offset());
        String[] terms = SearchScorer.terms(query.query());

        List<Candidate> ranked = candidates(terms, query.includeInternal()).stream()
            .filter(c -> SearchScorer.matches(c.document(), terms))
            .filter(c -> query.namespaces().isEmpty() || containsIgnoreCase(query.namespaces(), c.namespace().name))
            .filter(c -> query.providers().isEmpty() || containsIgnoreCase(query.providers(), c.moduleProvider().providerName))
            .filter(c -> query.verified() == null || !query.verified() || isVerified(c))
            .filter(c -> trustFilter(query, c))
            .sorted(RANKING)
            .toList();

        List<ModuleWire.ModuleSummary> page = ranked.stream()
            .skip(offset)
            .limit(limit)
            .map(c -> moduleRegistryService.summarize(c.namespace(), c.moduleProvider(), c.version()))
            .toList();
        return new SearchResult(PageMeta.of(limit, offset, ranked.size()), page);
    }

    /**
     * Counts of matches per filter value, used to render search facets.
     */
    public SearchFilters filters(String query) {
        String[] terms = SearchScorer.terms(query);
        List<Candidate> matched = candidates(terms, false).stream()
            .filter(c -> SearchScorer.matches(c.document(), terms))
            .toList();
        long verified = matched.stream().filter(this::isVerified).count();
        long trusted = matched.stream().filter(c -> domainConfig.isTrustedNamespace(c.namespace().name)).count();
        Map<String, Long> namespaces = matched.stream()
            .collect(Collectors.groupingBy(c -> c.namespace().name, TreeMap::new, Collectors.counting()));
        Map<String, Long> providers = matched.stream()
            .collect(Collectors.groupingBy(c -> c.moduleProvider().providerName, TreeMap::new, Collectors.counting()));
        return new SearchFilters(verified, trusted, matched.size() - trusted, namespaces, providers);
    }

    private List<Candidate> candidates(String[] terms, boolean includeInternal) {
        Map<Long, ModuleVersion> latest = new HashMap<>();
        for (ModuleVersion version : moduleVersionRepository.listPublished()) {
            if (version.beta || (version.internal && !includeInternal)) {
                continue;
            }
            latest.merge(version.moduleProviderId, version,
                (a, b) -> SemanticVersion.PRECEDENCE.compare(a.version, b.version) >= 0 ? a : b);
        }
        if (latest.isEmpty()) {
            return List.of();
        }
        List<ModuleProvider> moduleProviders = moduleProviderRepository.findByIds(new ArrayList<>(latest.keySet()));
        Map<Long, Namespace> namespaces = namespaceRepository
            .findByIds(moduleProviders.stream().map(mp -> mp.namespaceId).distinct().toList()).stream()
            .collect(Collectors.toMap(ns -> ns.id, Function.identity()));

        List<Candidate> candidates = new ArrayList<>();
        for (ModuleProvider moduleProvider : moduleProviders) {
            Namespace namespace = namespaces.get(moduleProvider.namespaceId);
            if (namespace == null) {
                continue;
            }
            ModuleVersion version = latest.get(moduleProvider.id);
            Candidate unscored = new Candidate(namespace, moduleProvider, version, 0);
            candidates.add(new Candidate(namespace, moduleProvider, version, SearchScorer.score(unscored.document(), terms)));
        }
        return candidates;
    }

    private boolean isVerified(Candidate candidate) {
        return candidate.moduleProvider().verified || domainConfig.isVerifiedNamespace(candidate.namespace().name);
    }

    private boolean trustFilter(SearchQuery query, Candidate candidate) {
        boolean wantTrusted = Boolean.TRUE.equals(query.trustedNamespaces());
        boolean wantContributed = Boolean.TRUE.equals(query.contributed());
        if (wantTrusted == wantContributed) {
            return true;
        }
        boolean trusted = domainConfig.isTrustedNamespace(candidate.namespace().name);
        return wantTrusted == trusted;
    }

    private static boolean containsIgnoreCase(List<String> values, String value) {
        return values.stream().anyMatch(v -> v.equalsIgnoreCase(value));
    }
}
