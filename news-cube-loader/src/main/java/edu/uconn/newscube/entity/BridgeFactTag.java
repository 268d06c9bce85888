package edu.uconn.newscube.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * JPA Entity for the Bridge_Fact_Tag table.
 * Resolves the document to tag many-to-many relationship.
 */
@Entity
@Table(name = "bridge_fact_tag", indexes = {
    @Index(name = "idx_bridge_fact_tag_fact_id", columnList = "fact_id"),
    @Index(name = "idx_bridge_fact_tag_tag_key", columnList = "tag_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BridgeFactTag {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "bridge_id")
    private Long id;

    @Column(name = "fact_id", nullable = false)
    private Long factId;

    @Column(name = "tag_key", nullable = false)
    private Integer tagKey;

    @Column(name = "confidence_score", precision = 3, scale = 2)
    private BigDecimal confidenceScore;
}
