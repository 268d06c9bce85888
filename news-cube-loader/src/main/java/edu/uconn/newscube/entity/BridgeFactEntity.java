package edu.uconn.newscube.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the Bridge_Fact_Entity table.
 */
@Entity
@Table(name = "bridge_fact_entity", indexes = {
    @Index(name = "idx_bridge_fact_entity_fact_id", columnList = "fact_id"),
    @Index(name = "idx_bridge_fact_entity_entity_key", columnList = "entity_key")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BridgeFactEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "bridge_id")
    private Long id;

    @Column(name = "fact_id", nullable = false)
    private Long factId;

    @Column(name = "entity_key", nullable = false)
    private Integer entityKey;

    @Column(name = "mention_count", nullable = false)
    @Builder.Default
    private Integer mentionCount = 0;
}
