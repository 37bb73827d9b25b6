package io.b2mash.b2b.reportengine.export;

import io.b2mash.b2b.reportengine.exception.InvalidStateException;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Computes the next fire time of a schedule, strictly after now, in the schedule's timezone. */
@Component
public class NextRunCalculator {

  static final LocalTime DEFAULT_TIME = LocalTime.of(8, 0);

  private final Clock clock;

  @Autowired
  public NextRunCalculator() {
    this(Clock.systemUTC());
  }

  NextRunCalculator(Clock clock) {
    this.clock = clock;
  }

  public Instant nextRun(ScheduleType type, ScheduleConfig config, String timezone) {
    ZoneId zone = parseZone(timezone);
    LocalTime time = parseTime(config != null ? config.time() : null);
    ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
    LocalDate today = now.toLocalDate();

    ZonedDateTime next;
    switch (type) {
      case DAILY -> {
        next = today.atTime(time).atZone(zone);
        if (!next.isAfter(now)) {
          next = today.plusDays(1).atTime(time).atZone(zone);
        }
      }
      case WEEKLY -> {
        DayOfWeek target = toDayOfWeek(config != null ? config.dayOfWeek() : null);
        LocalDate date = today.with(TemporalAdjusters.nextOrSame(target));
        next = date.atTime(time).atZone(zone);
        if (!next.isAfter(now)) {
          next = date.plusWeeks(1).atTime(time).atZone(zone);
        }
      }
      case MONTHLY -> {
        int day = config != null && config.dayOfMonth() != null ? config.dayOfMonth() : 1;
        YearMonth month = YearMonth.from(today);
        next = clampedDay(month, day).atTime(time).atZone(zone);
        if (!next.isAfter(now)) {
          next = clampedDay(month.plusMonths(1), day).atTime(time).atZone(zone);
        }
      }
      default -> throw new IllegalArgumentException("Unsupported schedule type: " + type);
    }
    return next.toInstant();
  }

  /** 0 is Sunday, 1..6 Monday..Saturday. */
  private static DayOfWeek toDayOfWeek(Integer dayOfWeek) {
    if (dayOfWeek == null) {
      return DayOfWeek.MONDAY;
    }
    return dayOfWeek == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(dayOfWeek);
  }

  private static LocalDate clampedDay(YearMonth month, int day) {
    return month.atDay(Math.min(day, month.lengthOfMonth()));
  }

  private static ZoneId parseZone(String timezone) {
    if (timezone == null || timezone.isBlank()) {
      return ZoneId.of("UTC");
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException e) {
      throw new InvalidStateException("Invalid timezone", "Unknown timezone '" + timezone + "'");
    }
  }

  private static LocalTime parseTime(String time) {
    if (time == null || time.isBlank()) {
      return DEFAULT_TIME;
    }
    try {
      return LocalTime.parse(time);
    } catch (DateTimeException e) {
      throw new InvalidStateException("Invalid schedule time", "Cannot parse time '" + time + "'");
    }
  }
}
