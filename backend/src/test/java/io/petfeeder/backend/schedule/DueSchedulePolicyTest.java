package io.petfeeder.backend.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import io.petfeeder.backend.schedule.DueSchedulePolicy.DueStatus;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DueSchedulePolicyTest {

  private static final String SCHEDULED = "2025-12-13T14:00:00Z";
  private static final Instant SCHEDULED_INSTANT = Instant.parse(SCHEDULED);

  private final DueSchedulePolicy policy =
      new DueSchedulePolicy(
          new ScheduleTimeCalculator(), new SchedulerProperties(true, 60_000, 1, 60));

  @ParameterizedTest
  @ValueSource(ints = {0, 1, 2, 30, 59, 60})
  void isScheduleDue_trueInsideOverdueCeiling(int minutesLate) {
    assertThat(policy.isScheduleDue(SCHEDULED, SCHEDULED_INSTANT.plus(minutes(minutesLate))))
        .isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {61, 90, 24 * 60})
  void isScheduleDue_falsePastOverdueCeiling(int minutesLate) {
    assertThat(policy.isScheduleDue(SCHEDULED, SCHEDULED_INSTANT.plus(minutes(minutesLate))))
        .isFalse();
  }

  @Test
  void isScheduleDue_neverFiresEarly() {
    assertThat(policy.isScheduleDue(SCHEDULED, SCHEDULED_INSTANT.minusSeconds(1))).isFalse();
    assertThat(policy.isScheduleDue(SCHEDULED, SCHEDULED_INSTANT.minus(minutes(30)))).isFalse();
  }

  @Test
  void evaluate_classifiesOnTimeAndCatchUpByTolerance() {
    assertThat(policy.evaluate(SCHEDULED, SCHEDULED_INSTANT)).isEqualTo(DueStatus.ON_TIME);
    assertThat(policy.evaluate(SCHEDULED, SCHEDULED_INSTANT.plusSeconds(60)))
        .isEqualTo(DueStatus.ON_TIME);
    assertThat(policy.evaluate(SCHEDULED, SCHEDULED_INSTANT.plusSeconds(61)))
        .isEqualTo(DueStatus.CATCH_UP);
    assertThat(policy.evaluate(SCHEDULED, SCHEDULED_INSTANT.plusSeconds(3601)))
        .isEqualTo(DueStatus.EXPIRED);
    assertThat(policy.evaluate(SCHEDULED, SCHEDULED_INSTANT.minusSeconds(1)))
        .isEqualTo(DueStatus.NOT_YET_DUE);
  }

  @Test
  void evaluate_strictWindowAbandonsAnythingOlderThanOneMinute() {
    var now = SCHEDULED_INSTANT.plus(minutes(2));

    assertThat(policy.evaluate(SCHEDULED, now, 1, 1)).isEqualTo(DueStatus.EXPIRED);
    assertThat(policy.evaluate(SCHEDULED, SCHEDULED_INSTANT.plusSeconds(30), 1, 1).isDue())
        .isTrue();
  }

  @Test
  void evaluate_unparseableTimeIsInvalidAndNotDue() {
    assertThat(policy.evaluate("garbage", SCHEDULED_INSTANT)).isEqualTo(DueStatus.INVALID);
    assertThat(policy.isScheduleDue(null, SCHEDULED_INSTANT)).isFalse();
  }

  @Test
  void evaluate_readsNaiveStoredTimeAsUtc() {
    assertThat(policy.evaluate("2025-12-13T14:00:00", SCHEDULED_INSTANT))
        .isEqualTo(DueStatus.ON_TIME);
  }

  private static Duration minutes(int minutes) {
    return Duration.ofMinutes(minutes);
  }
}
