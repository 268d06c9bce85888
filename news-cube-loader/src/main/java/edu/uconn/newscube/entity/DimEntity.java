package edu.uconn.newscube.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * JPA Entity for the Dim_Entity table.
 * One row per canonical organisation; the display name is the most
 * complete surface form seen for its normalized identity.
 */
@jakarta.persistence.Entity
@Table(name = "dim_entity", indexes = {
    @Index(name = "idx_dim_entity_name", columnList = "entity_name"),
    @Index(name = "idx_dim_entity_type", columnList = "entity_type")
})
@Getter
@Builder
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DimEntity {

    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_TYPE_LENGTH = 50;

    @Id
    @Column(name = "entity_key")
    private Integer entityKey;

    @Column(name = "entity_name", nullable = false, length = MAX_NAME_LENGTH)
    private String entityName;

    @Column(name = "entity_type", nullable = false, length = MAX_TYPE_LENGTH)
    private String entityType;

    @Column(name = "entity_domain", nullable = false, length = 50)
    private String entityDomain;
}
