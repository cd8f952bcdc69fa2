package io.b2mash.b2b.timeledger.leave;

import io.b2mash.b2b.timeledger.domain.LeaveDate;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class LeaveDateService {

  private static final Logger log = LoggerFactory.getLogger(LeaveDateService.class);

  private final IntervalStore store;

  public LeaveDateService(IntervalStore store) {
    this.store = store;
  }

  /** Books part of a leave on a timesheet. Conflicting leave dates are refused, not stored. */
  public LeaveDate createLeaveDate(
      UUID leaveId, UUID timesheetId, LocalDateTime startsAt, LocalDateTime endsAt) {
    var saved =
        store.save(new LeaveDate(UUID.randomUUID(), leaveId, timesheetId, startsAt, endsAt));
    log.info("Created leave date {} for leave {} on {}", saved.id(), leaveId, saved.date());
    return saved;
  }

  public List<LeaveDate> listApprovedLeaveDates(UUID userId, LocalDate from, LocalDate until) {
    store.findUser(userId).orElseThrow(() -> new ResourceNotFoundException("User", userId));
    return store.findApprovedLeaveDates(userId, from, until);
  }
}
