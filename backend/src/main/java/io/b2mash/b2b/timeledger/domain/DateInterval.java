package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;

/** Inclusive date interval with an optional open end. */
public record DateInterval(LocalDate start, LocalDate end) {

  public boolean isOpenEnded() {
    return end == null;
  }

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && (end == null || !date.isAfter(end));
  }

  public boolean overlaps(LocalDate from, LocalDate until) {
    return !start.isAfter(until) && (end == null || !end.isBefore(from));
  }

  /** Open ends count as infinity on both sides of the comparison. */
  public boolean overlaps(DateInterval other) {
    boolean startsBeforeOtherEnds = other.end == null || !start.isAfter(other.end);
    boolean otherStartsBeforeEnd = end == null || !other.start.isAfter(end);
    return startsBeforeOtherEnds && otherStartsBeforeEnd;
  }
}
