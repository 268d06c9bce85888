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
 * JPA Entity for the Dim_Tag table.
 */
@Entity
@Table(name = "dim_tag", indexes = {
    @Index(name = "idx_dim_tag_name", columnList = "tag_name"),
    @Index(name = "idx_dim_tag_category", columnList = "tag_category")
})
@Getter
@Builder
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DimTag {

    @Id
    @Column(name = "tag_key")
    private Integer tagKey;

    @Column(name = "tag_name", nullable = false, length = 200)
    private String tagName;

    @Column(name = "tag_category", nullable = false, length = 50)
    private String tagCategory;

    @Column(name = "tag_domain", nullable = false, length = 50)
    private String tagDomain;
}
