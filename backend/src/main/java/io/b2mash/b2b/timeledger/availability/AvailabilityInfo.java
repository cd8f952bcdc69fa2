package io.b2mash.b2b.timeledger.availability;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * @param leaveDateIds approved leave dates falling on this day
 */
public record AvailabilityInfo(
    LocalDate date,
    List<AvailabilityTag> tags,
    List<UUID> leaveDateIds,
    BigDecimal workHours,
    BigDecimal scheduledHours) {

  /** Not available for internal work while otherwise present, i.e. booked on contracts. */
  @JsonIgnore
  public boolean isFullyCommitted() {
    return tags.contains(AvailabilityTag.NOT_AVAILABLE_FOR_INTERNAL_WORK)
        && tags.stream()
            .allMatch(
                tag ->
                    tag == AvailabilityTag.SCHEDULED
                        || tag == AvailabilityTag.NOT_AVAILABLE_FOR_INTERNAL_WORK);
  }
}
