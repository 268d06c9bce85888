package edu.uconn.newscube.transform;

import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.NormalizedText;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TextNormalizer Unit Tests")
class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer();

    @Test
    @DisplayName("Should lowercase and replace punctuation with spaces")
    void shouldLowercaseAndStripPunctuation() {
        assertThat(normalizer.normalizeText("Pfizer Inc. announced, today!"))
            .isEqualTo("pfizer inc announced today");
    }

    @Test
    @DisplayName("Should drop isolated single-character tokens")
    void shouldDropSingleCharacterTokens() {
        assertThat(normalizer.normalizeText("A deal with X Corp"))
            .isEqualTo("deal with corp");
    }

    @Test
    @DisplayName("Should remove URLs and e-mail addresses")
    void shouldRemoveUrlsAndEmails() {
        assertThat(normalizer.normalizeText("Visit https://pfizer.com or mail press@pfizer.com now"))
            .isEqualTo("visit or mail now");
    }

    @Test
    @DisplayName("Should keep hyphenated words intact")
    void shouldKeepHyphens() {
        assertThat(normalizer.normalizeText("Co-Development, in-license"))
            .isEqualTo("co-development in-license");
    }

    @Test
    @DisplayName("Should strip subscription prompts")
    void shouldStripSubscriptionPrompts() {
        String text = "Reata gains approval. To read the rest of this story subscribe to STAT+.";

        assertThat(normalizer.normalizeText(text)).isEqualTo("reata gains approval");
    }

    @Test
    @DisplayName("Should truncate text at a trailing contact marker")
    void shouldTruncateAtEndingMarker() {
        String text = "Deal closed. Contact us at the newsroom for details";

        assertThat(normalizer.normalizeText(text)).isEqualTo("deal closed");
    }

    @Test
    @DisplayName("Should map null and blank input to the empty string")
    void shouldHandleAbsentText() {
        assertThat(normalizer.normalizeText(null)).isEmpty();
        assertThat(normalizer.normalizeText("   ")).isEmpty();
    }

    @Test
    @DisplayName("Should skip consolidated text in the combined view when it repeats the body")
    void shouldNotRepeatConsolidatedText() {
        // Given
        ArticleRecord article = ArticleRecord.builder()
            .headline("Title")
            .body("Same text")
            .consolidatedText("Same text")
            .build();

        // When
        NormalizedText normalized = normalizer.normalize(article);

        // Then
        assertThat(normalized.getCombined()).isEqualTo("title same text");
        assertThat(normalized.getConsolidated()).isEqualTo("same text");
    }

    @Test
    @DisplayName("Should append distinct consolidated text to the combined view")
    void shouldAppendDistinctConsolidatedText() {
        // Given
        ArticleRecord article = ArticleRecord.builder()
            .headline("Title")
            .body("Body text")
            .consolidatedText("Other notes")
            .build();

        // When
        NormalizedText normalized = normalizer.normalize(article);

        // Then
        assertThat(normalized.getCombined()).isEqualTo("title body text other notes");
    }

    @Test
    @DisplayName("Should produce an empty combined view for an article without text")
    void shouldHandleEmptyArticle() {
        NormalizedText normalized = normalizer.normalize(ArticleRecord.builder().documentId("X1").build());

        assertThat(normalized.getCombined()).isEmpty();
        assertThat(normalizer.normalize(null)).isSameAs(NormalizedText.EMPTY);
    }
}
