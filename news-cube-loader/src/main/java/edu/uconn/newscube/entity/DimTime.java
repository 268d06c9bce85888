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
 * JPA Entity for the Dim_Time table.
 * Keyed by the YYYYMMDD integer of the calendar day.
 */
@Entity
@Table(name = "dim_time", indexes = {
    @Index(name = "idx_dim_time_year", columnList = "cal_year")
})
@Getter
@Builder
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DimTime {

    @Id
    @Column(name = "date_key")
    private Integer dateKey;

    @Column(name = "cal_year", nullable = false)
    private Integer year;

    @Column(name = "cal_quarter", nullable = false, length = 2)
    private String quarter;

    @Column(name = "month_name", nullable = false, length = 10)
    private String month;

    @Column(name = "month_number", nullable = false)
    private Integer monthNumber;

    @Column(name = "day_of_month", nullable = false)
    private Integer day;

    @Column(name = "day_of_week", nullable = false, length = 10)
    private String dayOfWeek;

    @Column(name = "week_of_year", nullable = false)
    private Integer weekOfYear;

    @Column(name = "date_string", nullable = false, length = 10)
    private String dateString;
}
