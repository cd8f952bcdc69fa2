package io.b2mash.b2b.timeledger.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Fields shared by every contract variant.
 *
 * @param redmineProjectId external project mapped onto this contract, used as attribution fallback
 * @param performanceTypeIds allowed performance types, empty when any type is accepted
 */
public record ContractDetails(
    UUID id,
    String name,
    UUID customerId,
    UUID companyId,
    LocalDate startsAt,
    LocalDate endsAt,
    boolean active,
    Integer redmineProjectId,
    List<UUID> performanceTypeIds) {

  public ContractDetails {
    performanceTypeIds = performanceTypeIds == null ? List.of() : List.copyOf(performanceTypeIds);
  }
}
