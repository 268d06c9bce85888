package edu.uconn.newscube.transform;

import edu.uconn.newscube.entity.RejectedEntity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("RejectionLog Unit Tests")
class RejectionLogTest {

    @Test
    @DisplayName("Should report most frequent rejections first with their first reason")
    void shouldReportByFrequency() {
        // Given
        RejectionLog log = new RejectionLog();
        log.reject("Oncology", RejectionLog.REASON_FILTERED_TERM);
        log.reject("Zeta", RejectionLog.REASON_NOT_COMPANY);
        log.reject(" Oncology ", RejectionLog.REASON_NOT_COMPANY);
        log.reject("Alpha", RejectionLog.REASON_NOT_COMPANY);

        // When
        List<RejectedEntity> report = log.toReport();

        // Then
        assertThat(report)
            .extracting(RejectedEntity::getRejectedEntity, RejectedEntity::getOccurrenceCount,
                RejectedEntity::getReason)
            .containsExactly(
                tuple("Oncology", 2, RejectionLog.REASON_FILTERED_TERM),
                tuple("Alpha", 1, RejectionLog.REASON_NOT_COMPANY),
                tuple("Zeta", 1, RejectionLog.REASON_NOT_COMPANY));
    }

    @Test
    @DisplayName("Should add counts when merging logs")
    void shouldMergeCounts() {
        RejectionLog first = new RejectionLog();
        first.reject("Oncology", RejectionLog.REASON_FILTERED_TERM);
        RejectionLog second = new RejectionLog();
        second.reject("Oncology", RejectionLog.REASON_FILTERED_TERM);
        second.reject("Pfizer", RejectionLog.REASON_NOT_COMPANY);

        first.mergeFrom(second);

        assertThat(first.count("Oncology")).isEqualTo(2);
        assertThat(first.count("Pfizer")).isEqualTo(1);
        assertThat(first.size()).isEqualTo(2);
        assertThat(new RejectionLog().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should cut rejected names to the report column width")
    void shouldCutOverLongNames() {
        // Given
        RejectionLog log = new RejectionLog();
        String longName = "a".repeat(RejectedEntity.MAX_NAME_LENGTH + 100);

        // When
        log.reject(longName, RejectionLog.REASON_NOT_COMPANY);
        log.reject(longName + "b", RejectionLog.REASON_NOT_COMPANY);

        // Then
        assertThat(log.size()).isEqualTo(1);
        assertThat(log.count(longName)).isEqualTo(2);
        assertThat(log.toReport())
            .extracting(RejectedEntity::getRejectedEntity)
            .containsExactly("a".repeat(RejectedEntity.MAX_NAME_LENGTH));
    }
}
