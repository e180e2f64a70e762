package io.petfeeder.backend.schedule;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Timezone conversion and recurrence arithmetic for schedule times. Every value this class emits
 * has the form {@code yyyy-MM-ddTHH:mm:ssZ}: second precision and a literal {@code Z}.
 */
@Component
public class ScheduleTimeCalculator {

  private static final Logger log = LoggerFactory.getLogger(ScheduleTimeCalculator.class);

  public static final DateTimeFormatter UTC_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

  public String format(Instant instant) {
    return UTC_FORMAT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  /**
   * Parses a stored schedule time. Values with a zone designator ({@code Z} or a numeric offset)
   * are taken as-is; values without one are read as UTC.
   *
   * @throws DateTimeParseException if the value is null or not ISO 8601
   */
  public Instant parseUtc(String value) {
    if (value == null) {
      throw new DateTimeParseException("Schedule time is missing", "", 0);
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
    }
  }

  /**
   * Converts user input to the canonical UTC form. A naive value is interpreted in {@code
   * timezone} using the offset in effect on that local date, so DST is resolved for the given
   * moment rather than for today. A local time inside a spring-forward gap is moved forward by the
   * length of the gap. A value that already carries a zone designator ignores {@code timezone}.
   *
   * @throws DateTimeException if the time cannot be parsed or the timezone is unknown
   */
  public String convertToUtc(String localTime, String timezone) {
    ZoneId zone = ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone);
    if (localTime == null) {
      throw new DateTimeParseException("Schedule time is missing", "", 0);
    }
    Instant instant;
    try {
      instant = OffsetDateTime.parse(localTime).toInstant();
    } catch (DateTimeParseException e) {
      instant = LocalDateTime.parse(localTime).atZone(zone).toInstant();
    }
    return format(instant);
  }

  /**
   * Returns the occurrence after {@code scheduledTimeUtc}. Arithmetic is done on the UTC clock, so
   * the UTC time of day never moves. Monthly recurrence clamps the day to the end of a shorter
   * month (Jan 31 becomes Feb 28, or Feb 29 in a leap year).
   *
   * <p>For {@code none}, unrecognised recurrences, or an unparseable input the input is returned
   * unchanged.
   */
  public String calculateNextExecution(String scheduledTimeUtc, String recurrence) {
    Recurrence type = Recurrence.fromValue(recurrence);
    if (!type.isRecurring()) {
      return scheduledTimeUtc;
    }
    try {
      LocalDateTime current = LocalDateTime.ofInstant(parseUtc(scheduledTimeUtc), ZoneOffset.UTC);
      LocalDateTime next =
          switch (type) {
            case DAILY -> current.plusDays(1);
            case WEEKLY -> current.plusWeeks(1);
            case MONTHLY -> current.plusMonths(1);
            case NONE -> current;
          };
      return format(next.toInstant(ZoneOffset.UTC));
    } catch (DateTimeException e) {
      log.warn(
          "Cannot calculate next execution from '{}' ({}): {}",
          scheduledTimeUtc,
          recurrence,
          e.getMessage());
      return scheduledTimeUtc;
    }
  }
}
