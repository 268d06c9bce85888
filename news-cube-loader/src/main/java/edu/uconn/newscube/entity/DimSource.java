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
 * JPA Entity for the Dim_Source table.
 */
@Entity
@Table(name = "dim_source", indexes = {
    @Index(name = "idx_dim_source_name", columnList = "source_name", unique = true)
})
@Getter
@Builder
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DimSource {

    @Id
    @Column(name = "source_key")
    private Integer sourceKey;

    @Column(name = "source_name", nullable = false, length = 100)
    private String sourceName;

    @Column(name = "source_type", nullable = false, length = 20)
    private String sourceType;
}
