package edu.uconn.newscube.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for the Fact_Document table.
 * One row per article, with denormalized time and source attributes
 * carried alongside the foreign keys for query convenience.
 */
@Entity
@Table(name = "fact_document", indexes = {
    @Index(name = "idx_fact_document_date_key", columnList = "date_key"),
    @Index(name = "idx_fact_document_source_key", columnList = "source_key"),
    @Index(name = "idx_fact_document_document_id", columnList = "document_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FactDocument {

    public static final String KEY_EVENT_YES = "Yes";
    public static final String KEY_EVENT_NO = "No";

    public static final int MAX_DOCUMENT_ID_LENGTH = 100;

    @Id
    @Column(name = "fact_id")
    private Long factId;

    @Column(name = "document_id", nullable = false, length = MAX_DOCUMENT_ID_LENGTH)
    private String documentId;

    @Column(name = "date_key", nullable = false)
    private Integer dateKey;

    @Column(name = "source_key", nullable = false)
    private Integer sourceKey;

    @Column(name = "cal_year")
    private Integer year;

    @Column(name = "cal_quarter", length = 2)
    private String quarter;

    @Column(name = "month_name", length = 10)
    private String month;

    @Column(name = "date_string", length = 10)
    private String dateString;

    @Column(name = "source_name", columnDefinition = "TEXT")
    private String sourceName;

    @Column(name = "source_type", length = 20)
    private String sourceType;

    @Column(columnDefinition = "TEXT")
    private String headline;

    @Column(name = "body_text", columnDefinition = "TEXT")
    private String bodyText;

    @Column(name = "news_link", columnDefinition = "TEXT")
    private String newsLink;

    @Column(name = "cleaned_text", columnDefinition = "TEXT")
    private String cleanedText;

    @Column(name = "consolidated_text", columnDefinition = "TEXT")
    private String consolidatedText;

    @Column(name = "matched_keywords", columnDefinition = "TEXT")
    private String matchedKeywords;

    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Column(name = "qc_status", columnDefinition = "TEXT")
    private String qcStatus;

    @Column(name = "document_count", nullable = false)
    @Builder.Default
    private Integer documentCount = 1;

    @Column(name = "tag_count", nullable = false)
    @Builder.Default
    private Integer tagCount = 0;

    @Column(name = "has_key_event", nullable = false, length = 3)
    @Builder.Default
    private String hasKeyEvent = KEY_EVENT_NO;

    @Column(name = "loaded_at", nullable = false)
    private LocalDateTime loadedAt;

    @PrePersist
    protected void onCreate() {
        if (loadedAt == null) {
            loadedAt = LocalDateTime.now();
        }
    }
}
