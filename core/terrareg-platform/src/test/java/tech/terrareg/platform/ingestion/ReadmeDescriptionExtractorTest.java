package tech.terrareg.platform.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ReadmeDescriptionExtractorTest {

    @Test
    @DisplayName("Headings, links and short lines are skipped")
    void extract_shouldSkipUnsuitableLines() {
        String readme = """
            # terraform-aws-vpc

            See https://example.com for more information about this module.
            Short line here.
            Contact ops@example.com for help with this module please.
            This module creates a VPC with public and private subnets.
            """;

        assertThat(ReadmeDescriptionExtractor.extract(readme))
            .isEqualTo("This module creates a VPC with public and private subnets.");
    }

    @Test
    @DisplayName("Sentences are kept only while the description stays under the soft limit")
    void extract_shouldTruncateAtSentence_whenTooLong() {
        String readme = "First sentence is short and sweet here. "
            + "Second sentence adds many more words so that the result goes over the limit.";

        assertThat(ReadmeDescriptionExtractor.extract(readme)).isEqualTo("First sentence is short and sweet here");
    }

    @Test
    @DisplayName("No qualifying line yields null")
    void extract_shouldReturnNull_whenNothingQualifies() {
        assertThat(ReadmeDescriptionExtractor.extract("# Title\n\nToo short.")).isNull();
        assertThat(ReadmeDescriptionExtractor.extract(null)).isNull();
    }
}
