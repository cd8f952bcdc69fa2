package io.b2mash.b2b.timeledger.report;

import io.b2mash.b2b.timeledger.availability.AvailabilityInfo;
import io.b2mash.b2b.timeledger.availability.AvailabilityTagger;
import io.b2mash.b2b.timeledger.availability.InternalAvailabilityInfo;
import io.b2mash.b2b.timeledger.calculation.DailyResolver;
import io.b2mash.b2b.timeledger.calculation.DayDetail;
import io.b2mash.b2b.timeledger.calculation.RangeAggregator;
import io.b2mash.b2b.timeledger.calculation.RangeInfo;
import io.b2mash.b2b.timeledger.calculation.RangeOptions;
import io.b2mash.b2b.timeledger.exception.InvalidStateException;
import io.b2mash.b2b.timeledger.overtime.OvertimeBanker;
import io.b2mash.b2b.timeledger.overtime.OvertimeMonth;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReportController {

  private final DailyResolver dailyResolver;
  private final RangeAggregator rangeAggregator;
  private final AvailabilityTagger availabilityTagger;
  private final OvertimeBanker overtimeBanker;

  public ReportController(
      DailyResolver dailyResolver,
      RangeAggregator rangeAggregator,
      AvailabilityTagger availabilityTagger,
      OvertimeBanker overtimeBanker) {
    this.dailyResolver = dailyResolver;
    this.rangeAggregator = rangeAggregator;
    this.availabilityTagger = availabilityTagger;
    this.overtimeBanker = overtimeBanker;
  }

  @GetMapping("/api/day-detail")
  public ResponseEntity<DayDetail> getDayDetail(
      @RequestParam UUID user,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return ResponseEntity.ok(dailyResolver.resolveDay(user, date));
  }

  @GetMapping("/api/range-info")
  public ResponseEntity<Map<UUID, RangeInfo>> getRangeInfo(
      @RequestParam List<UUID> users,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate until,
      @RequestParam(defaultValue = "false") boolean daily,
      @RequestParam(defaultValue = "false") boolean detailed,
      @RequestParam(defaultValue = "false") boolean summary) {
    var options = new RangeOptions(daily, detailed, summary);
    return ResponseEntity.ok(rangeAggregator.getRangeInfo(users, from, until, options));
  }

  @GetMapping("/api/availability")
  public ResponseEntity<Map<UUID, Map<String, AvailabilityInfo>>> getAvailability(
      @RequestParam List<UUID> users,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate until) {
    return ResponseEntity.ok(availabilityTagger.getAvailabilityInfo(users, from, until));
  }

  @GetMapping("/api/internal-availability")
  public ResponseEntity<Map<UUID, InternalAvailabilityInfo>> getInternalAvailability(
      @RequestParam List<UUID> users,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return ResponseEntity.ok(availabilityTagger.getInternalAvailabilityInfo(users, date));
  }

  @GetMapping("/api/overtime")
  public ResponseEntity<List<OvertimeMonth>> getOvertime(
      @RequestParam UUID user,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate until,
      @RequestParam(defaultValue = "false") boolean sinceEmployment) {
    if (sinceEmployment) {
      return ResponseEntity.ok(overtimeBanker.getOvertimeSeriesSinceEmployment(user, until));
    }
    if (from == null) {
      throw new InvalidStateException(
          "Missing start date", "Either from or sinceEmployment=true is required");
    }
    return ResponseEntity.ok(overtimeBanker.getOvertimeSeries(user, from, until));
  }
}
