package edu.uconn.newscube.model;

import lombok.Builder;
import lombok.Value;

/**
 * One well-formed row of the cleaned article export.
 * Every text field may be {@code null} when the column is absent or empty.
 */
@Value
@Builder
public class ArticleRecord {

    String documentId;
    String date;
    String source;
    String headline;
    String body;
    String consolidatedText;
    String keywordHints;
    String newsLink;
    String cleanedText;
    String sentimentScore;
    String qcStatus;
}
