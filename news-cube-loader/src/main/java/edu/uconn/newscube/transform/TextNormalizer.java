package edu.uconn.newscube.transform;

import edu.uconn.newscube.model.ArticleRecord;
import edu.uconn.newscube.model.NormalizedText;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Produces lowercase, boilerplate-free views of an article so that tag and
 * entity matchers work on a stable surface form. Original text is left
 * untouched on the record.
 */
@Component
public class TextNormalizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> BOILERPLATE = List.of(
        // subscription prompts
        Pattern.compile("to read the rest of this story subscribe to[^.]*\\.", FLAGS),
        Pattern.compile("to read the full (article|story)[^.]*subscribe[^.]*\\.", FLAGS),
        Pattern.compile("to read the full (article|story)[^.]*sign (up|in)[^.]*\\.", FLAGS),
        Pattern.compile("subscribe to[^.]*stat\\+[^.]*\\.", FLAGS),
        Pattern.compile("subscribe to[^.]*stat[^.]*\\.", FLAGS),
        Pattern.compile("subscribe to[^.]*premium[^.]*\\.", FLAGS),
        // newsletter prompts
        Pattern.compile("sign up for[^.]*newsletter[^.]*\\.", FLAGS),
        Pattern.compile("subscribe to[^.]*newsletter[^.]*\\.", FLAGS),
        // correction requests
        Pattern.compile("to submit a correction request[^.]*\\.", FLAGS),
        Pattern.compile("to submit a correction[^.]*\\.", FLAGS),
        Pattern.compile("for more information[^.]*\\.", FLAGS),
        Pattern.compile("read more at[^.]*\\.", FLAGS)
    );

    /**
     * Everything after one of these markers is trailer text.
     */
    private static final List<Pattern> ENDING_MARKERS = List.of(
        Pattern.compile("\\.\\s*to read the rest.*$", FLAGS | Pattern.DOTALL),
        Pattern.compile("\\.\\s*to read the full.*$", FLAGS | Pattern.DOTALL),
        Pattern.compile("\\.\\s*subscribe.*$", FLAGS | Pattern.DOTALL),
        Pattern.compile("\\.\\s*to submit a correction.*$", FLAGS | Pattern.DOTALL),
        Pattern.compile("\\.\\s*contact us.*$", FLAGS | Pattern.DOTALL),
        Pattern.compile("\\.\\s*for more information.*$", FLAGS | Pattern.DOTALL)
    );

    private static final Pattern REPEATED_PERIODS = Pattern.compile("\\.{2,}");
    private static final Pattern WIDE_GAPS = Pattern.compile("\\s{3,}");
    private static final Pattern URLS = Pattern.compile("https?://\\S+|www\\.\\S+");
    private static final Pattern EMAILS = Pattern.compile("\\S+@\\S+");
    private static final Pattern NOISE = Pattern.compile("[^\\w\\s'\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SINGLE_CHARACTER = Pattern.compile("\\b\\w\\b", Pattern.UNICODE_CHARACTER_CLASS);

    public NormalizedText normalize(ArticleRecord article) {
        if (article == null) {
            return NormalizedText.EMPTY;
        }

        String headline = normalizeText(article.getHeadline());
        String body = normalizeText(article.getBody());
        String consolidated = normalizeText(article.getConsolidatedText());

        StringBuilder combined = new StringBuilder(headline);
        appendSection(combined, body);
        if (!consolidated.equals(body)) {
            appendSection(combined, consolidated);
        }

        return new NormalizedText(headline, body, consolidated, combined.toString());
    }

    /**
     * Normalizes a single field. Null and blank input yield the empty string.
     */
    public String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }

        String result = removeBoilerplate(text.strip());
        result = result.toLowerCase(Locale.ROOT);
        result = URLS.matcher(result).replaceAll("");
        result = EMAILS.matcher(result).replaceAll("");
        result = NOISE.matcher(result).replaceAll(" ");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        result = SINGLE_CHARACTER.matcher(result).replaceAll("");
        result = WHITESPACE.matcher(result).replaceAll(" ");
        return result.strip();
    }

    String removeBoilerplate(String text) {
        String result = text;
        for (Pattern pattern : BOILERPLATE) {
            result = pattern.matcher(result).replaceAll("");
        }
        for (Pattern marker : ENDING_MARKERS) {
            result = marker.matcher(result).replaceAll(".");
        }
        result = REPEATED_PERIODS.matcher(result).replaceAll(".");
        result = WIDE_GAPS.matcher(result).replaceAll(" ");
        return result.strip();
    }

    private static void appendSection(StringBuilder combined, String section) {
        if (section.isEmpty()) {
            return;
        }
        if (combined.length() > 0) {
            combined.append(' ');
        }
        combined.append(section);
    }
}
