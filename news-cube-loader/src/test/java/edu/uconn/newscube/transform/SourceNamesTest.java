package edu.uconn.newscube.transform;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SourceNames Unit Tests")
class SourceNamesTest {

    @Test
    @DisplayName("Should accept ordinary publication names")
    void shouldAcceptPublicationNames() {
        assertThat(SourceNames.isValid("STAT News")).isTrue();
        assertThat(SourceNames.isValid("  Fierce Biotech ")).isTrue();
        assertThat(SourceNames.isValid("3M")).isTrue();
    }

    @Test
    @DisplayName("Should reject misaligned cell values")
    void shouldRejectMisalignedValues() {
        assertThat(SourceNames.isValid(null)).isFalse();
        assertThat(SourceNames.isValid("A")).isFalse();
        assertThat(SourceNames.isValid("12345")).isFalse();
        assertThat(SourceNames.isValid("--")).isFalse();
        assertThat(SourceNames.isValid("x".repeat(101))).isFalse();
    }

    @Test
    @DisplayName("Should classify sources by name")
    void shouldClassifySources() {
        assertThat(SourceNames.classify("STAT News")).isEqualTo("News");
        assertThat(SourceNames.classify("FDA Press Office")).isEqualTo("Government");
        assertThat(SourceNames.classify("Harvard University")).isEqualTo("Academic");
        assertThat(SourceNames.classify("Fierce Biotech")).isEqualTo("Industry");
        assertThat(SourceNames.classify("Reuters")).isEqualTo("Other");
    }
}
