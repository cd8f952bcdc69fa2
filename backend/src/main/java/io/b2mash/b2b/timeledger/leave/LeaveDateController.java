package io.b2mash.b2b.timeledger.leave;

import io.b2mash.b2b.timeledger.calculation.RangeAggregator;
import io.b2mash.b2b.timeledger.domain.LeaveDate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LeaveDateController {

  private final LeaveDateService leaveDateService;

  public LeaveDateController(LeaveDateService leaveDateService) {
    this.leaveDateService = leaveDateService;
  }

  @PostMapping("/api/leave-dates")
  public ResponseEntity<LeaveDateResponse> createLeaveDate(
      @Valid @RequestBody CreateLeaveDateRequest request) {
    var leaveDate =
        leaveDateService.createLeaveDate(
            request.leaveId(), request.timesheetId(), request.startsAt(), request.endsAt());
    return ResponseEntity.created(URI.create("/api/leave-dates/" + leaveDate.id()))
        .body(LeaveDateResponse.from(leaveDate));
  }

  @GetMapping("/api/leave-dates")
  public ResponseEntity<List<LeaveDateResponse>> listApprovedLeaveDates(
      @RequestParam UUID user,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate until) {
    RangeAggregator.requireValidRange(from, until);
    var leaveDates = leaveDateService.listApprovedLeaveDates(user, from, until);
    return ResponseEntity.ok(leaveDates.stream().map(LeaveDateResponse::from).toList());
  }

  // --- DTOs ---

  /** Start and end are checked by the interval invariants so that errors carry the field. */
  public record CreateLeaveDateRequest(
      @NotNull(message = "leaveId is required") UUID leaveId,
      @NotNull(message = "timesheetId is required") UUID timesheetId,
      LocalDateTime startsAt,
      LocalDateTime endsAt) {}

  public record LeaveDateResponse(
      UUID id,
      UUID leaveId,
      UUID timesheetId,
      LocalDateTime startsAt,
      LocalDateTime endsAt,
      BigDecimal duration) {

    static LeaveDateResponse from(LeaveDate leaveDate) {
      return new LeaveDateResponse(
          leaveDate.id(),
          leaveDate.leaveId(),
          leaveDate.timesheetId(),
          leaveDate.startsAt(),
          leaveDate.endsAt(),
          leaveDate.duration());
    }
  }
}
