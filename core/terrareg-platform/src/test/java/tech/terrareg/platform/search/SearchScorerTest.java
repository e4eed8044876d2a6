package tech.terrareg.platform.search;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SearchScorerTest {

    private static final SearchScorer.Document VPC = new SearchScorer.Document(
        "acme", "vpc", "aws", "Creates a VPC with public subnets", "network-team");

    @Test
    @DisplayName("Exact module name match scores the module weight")
    void score_shouldUseExactWeight_whenModuleMatches() {
        assertThat(SearchScorer.score(VPC, SearchScorer.terms("vpc"))).isEqualTo(SearchScorer.EXACT_MODULE + SearchScorer.PARTIAL_DESCRIPTION);
    }

    @Test
    @DisplayName("Each term adds the weights of every field it matches")
    void score_shouldSumAcrossTerms_whenMultipleTermsMatch() {
        int score = SearchScorer.score(VPC, SearchScorer.terms("ACME aws"));

        assertThat(score).isEqualTo(SearchScorer.EXACT_NAMESPACE + SearchScorer.EXACT_PROVIDER);
    }

    @Test
    @DisplayName("Substring matches on namespace and owner use the partial weights")
    void score_shouldUsePartialWeights_whenSubstringMatches() {
        assertThat(SearchScorer.score(VPC, SearchScorer.terms("acm"))).isEqualTo(SearchScorer.PARTIAL_NAMESPACE);
        assertThat(SearchScorer.score(VPC, SearchScorer.terms("team"))).isEqualTo(SearchScorer.PARTIAL_OWNER);
    }

    @Test
    @DisplayName("Provider substrings do not score")
    void score_shouldIgnoreProviderSubstring() {
        SearchScorer.Document doc = new SearchScorer.Document("ns", "mod", "azurerm", null, null);

        assertThat(SearchScorer.score(doc, SearchScorer.terms("azure"))).isZero();
        assertThat(SearchScorer.matches(doc, SearchScorer.terms("azure"))).isFalse();
    }

    @Test
    @DisplayName("An empty query matches everything with score zero")
    void matches_shouldAcceptAll_whenQueryBlank() {
        String[] terms = SearchScorer.terms("   ");

        assertThat(terms).isEmpty();
        assertThat(SearchScorer.matches(VPC, terms)).isTrue();
        assertThat(SearchScorer.score(VPC, terms)).isZero();
    }
}
