package io.github.riemr.committee.domain.model;

import io.github.riemr.committee.exception.InvalidCommitteeTypeConfigException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommitteeTypeTest {

    private final CommitteeType thirdTuesday = CommitteeType.builder().id(1L).divisionId(1L).name("Board")
            .scheduledWeekday(2).frequency(Frequency.MONTHLY).weekOfMonth(3).build();

    @Test
    void validate_acceptsWellFormedRules() {
        assertThatCode(thirdTuesday::validate).doesNotThrowAnyException();
        assertThatCode(() -> thirdTuesday.toBuilder().frequency(Frequency.WEEKLY).weekOfMonth(null).build().validate())
                .doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsMalformedRules() {
        assertThatThrownBy(() -> thirdTuesday.toBuilder().scheduledWeekday(7).build().validate())
                .isInstanceOf(InvalidCommitteeTypeConfigException.class);
        assertThatThrownBy(() -> thirdTuesday.toBuilder().weekOfMonth(6).build().validate())
                .isInstanceOf(InvalidCommitteeTypeConfigException.class);
        assertThatThrownBy(() -> thirdTuesday.toBuilder().weekOfMonth(null).build().validate())
                .isInstanceOf(InvalidCommitteeTypeConfigException.class);
        assertThatThrownBy(() -> thirdTuesday.toBuilder().frequency(Frequency.WEEKLY).build().validate())
                .isInstanceOf(InvalidCommitteeTypeConfigException.class);
        assertThatThrownBy(() -> thirdTuesday.toBuilder().frequency(null).build().validate())
                .isInstanceOf(InvalidCommitteeTypeConfigException.class);
    }

    @Test
    void recursOn_matchesWeekdayAndOccurrence() {
        assertThat(thirdTuesday.recursOn(LocalDate.of(2025, 3, 18))).isTrue();
        assertThat(thirdTuesday.recursOn(LocalDate.of(2025, 3, 11))).isFalse();
        assertThat(thirdTuesday.recursOn(LocalDate.of(2025, 3, 19))).isFalse();
    }
}
