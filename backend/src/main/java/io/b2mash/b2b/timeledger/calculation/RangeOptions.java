package io.b2mash.b2b.timeledger.calculation;

/**
 * @param daily keep the day detail of every day in the range
 * @param detailed attach contributing records to every day, implies {@code daily}
 * @param summary group performed hours by contract
 */
public record RangeOptions(boolean daily, boolean detailed, boolean summary) {

  public static final RangeOptions TOTALS_ONLY = new RangeOptions(false, false, false);

  public static RangeOptions withSummary() {
    return new RangeOptions(false, false, true);
  }

  public static RangeOptions withDaily() {
    return new RangeOptions(true, false, false);
  }

  public boolean retainDays() {
    return daily || detailed;
  }
}
