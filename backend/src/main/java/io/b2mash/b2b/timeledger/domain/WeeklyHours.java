package io.b2mash.b2b.timeledger.domain;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.Map;

/** Expected hours per weekday. */
public record WeeklyHours(
    BigDecimal monday,
    BigDecimal tuesday,
    BigDecimal wednesday,
    BigDecimal thursday,
    BigDecimal friday,
    BigDecimal saturday,
    BigDecimal sunday) {

  public static final WeeklyHours NONE =
      new WeeklyHours(
          Hours.ZERO, Hours.ZERO, Hours.ZERO, Hours.ZERO, Hours.ZERO, Hours.ZERO, Hours.ZERO);

  public WeeklyHours {
    monday = Hours.normalize(monday);
    tuesday = Hours.normalize(tuesday);
    wednesday = Hours.normalize(wednesday);
    thursday = Hours.normalize(thursday);
    friday = Hours.normalize(friday);
    saturday = Hours.normalize(saturday);
    sunday = Hours.normalize(sunday);
  }

  /** Same hours every weekday, nothing in the weekend. */
  public static WeeklyHours weekdays(String hours) {
    var value = Hours.of(hours);
    return new WeeklyHours(value, value, value, value, value, Hours.ZERO, Hours.ZERO);
  }

  public BigDecimal hoursOn(DayOfWeek day) {
    return switch (day) {
      case MONDAY -> monday;
      case TUESDAY -> tuesday;
      case WEDNESDAY -> wednesday;
      case THURSDAY -> thursday;
      case FRIDAY -> friday;
      case SATURDAY -> saturday;
      case SUNDAY -> sunday;
    };
  }

  public Map<DayOfWeek, BigDecimal> asMap() {
    var map = new EnumMap<DayOfWeek, BigDecimal>(DayOfWeek.class);
    for (var day : DayOfWeek.values()) {
      map.put(day, hoursOn(day));
    }
    return map;
  }
}
