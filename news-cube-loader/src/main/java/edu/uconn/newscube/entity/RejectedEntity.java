package edu.uconn.newscube.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the rejected_entity audit table.
 * Candidate names that were not promoted to Dim_Entity, with how often
 * they were seen across the run.
 */
@Entity
@Table(name = "rejected_entity", indexes = {
    @Index(name = "idx_rejected_entity_name", columnList = "rejected_entity")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RejectedEntity {

    public static final int MAX_NAME_LENGTH = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "rejected_id")
    private Long id;

    @Column(name = "rejected_entity", nullable = false, length = MAX_NAME_LENGTH)
    private String rejectedEntity;

    @Column(name = "occurrence_count", nullable = false)
    private Integer occurrenceCount;

    @Column(nullable = false, length = 100)
    private String reason;
}
