package io.b2mash.b2b.timeledger.calculation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.timeledger.domain.ContractKind;
import io.b2mash.b2b.timeledger.domain.PerformanceType;
import io.b2mash.b2b.timeledger.domain.ProjectContract;
import io.b2mash.b2b.timeledger.domain.Timesheet;
import io.b2mash.b2b.timeledger.domain.User;
import io.b2mash.b2b.timeledger.exception.InvalidStateException;
import io.b2mash.b2b.timeledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.timeledger.testutil.TestLedgerFactory;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RangeAggregatorTest {

  private static final LocalDate MAY_FIRST = LocalDate.of(2024, 5, 1);
  private static final LocalDate MAY_LAST = LocalDate.of(2024, 5, 31);

  private ExecutorService executor;
  private TestLedgerFactory ledger;
  private RangeAggregator aggregator;

  private User user;
  private Timesheet may;
  private PerformanceType regular;
  private ProjectContract apollo;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    ledger = new TestLedgerFactory(TestLedgerFactory.newStore());
    var loader = new PeriodSnapshotLoader(ledger.store());
    aggregator = new RangeAggregator(loader, new DailyResolver(loader), executor);

    user = ledger.user("alice");
    ledger.employFullTime(user, LocalDate.of(2024, 1, 1));
    may = ledger.timesheet(user, YearMonth.of(2024, 5));
    regular = ledger.performanceType("Regular", "1");
    apollo = ledger.projectContract("Apollo", null);
    ledger.holiday("Labour Day", MAY_FIRST, "BE");
    ledger.activity(may, MAY_FIRST, apollo, regular, "4");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void getRangeInfo_sumsEveryDayOfTheMonth() {
    var info = aggregator.getRangeInfo(user.id(), MAY_FIRST, MAY_LAST, RangeOptions.TOTALS_ONLY);

    // 23 weekdays of 8 hours, Labour Day covered by the holiday
    assertThat(info.workHours()).isEqualByComparingTo("184");
    assertThat(info.holidayHours()).isEqualByComparingTo("8");
    assertThat(info.performedHours()).isEqualByComparingTo("4");
    assertThat(info.remainingHours()).isEqualByComparingTo("176");
    assertThat(info.overtimeHours()).isEqualByComparingTo("4");
    assertThat(info.details()).isNull();
    assertThat(info.summary()).isNull();
  }

  @Test
  void getRangeInfo_withSummary_groupsPerformancesByContract() {
    var info =
        aggregator.getRangeInfo(
            List.of(user.id()), MAY_FIRST, MAY_LAST, RangeOptions.withSummary());

    var summary = info.get(user.id()).summary();
    assertThat(summary.performances()).hasSize(1);
    var apolloTotal = summary.performances().get(0);
    assertThat(apolloTotal.contractId()).isEqualTo(apollo.id());
    assertThat(apolloTotal.contractName()).isEqualTo("Apollo");
    assertThat(apolloTotal.contractKind()).isEqualTo(ContractKind.PROJECT);
    assertThat(apolloTotal.duration()).isEqualByComparingTo("4");
  }

  @Test
  void summary_countsStandbyDaysAndLeavesOutUnattributedWork() {
    var support = ledger.supportContract("Beacon support");
    ledger.standby(may, LocalDate.of(2024, 5, 11), support);
    ledger.standby(may, LocalDate.of(2024, 5, 12), support);
    ledger.activity(may, LocalDate.of(2024, 5, 2), null, regular, "2");

    var info = aggregator.getRangeInfo(user.id(), MAY_FIRST, MAY_LAST, RangeOptions.withSummary());

    assertThat(info.standbyDays()).isEqualTo(2);
    assertThat(info.performedHours()).isEqualByComparingTo("6");
    assertThat(info.summary().performances())
        .extracting(ContractPerformanceTotal::contractName)
        .containsExactly("Apollo", "Beacon support");
    var beacon = info.summary().performances().get(1);
    assertThat(beacon.standbyDays()).isEqualTo(2);
    assertThat(beacon.duration()).isEqualByComparingTo("0");
  }

  @Test
  void getRangeInfo_daily_keysDaysByIsoDate() {
    var info = aggregator.getRangeInfo(user.id(), MAY_FIRST, MAY_LAST, RangeOptions.withDaily());

    assertThat(info.details()).hasSize(31);
    assertThat(info.details()).containsKeys("2024-05-01", "2024-05-31");
    assertThat(info.details().get("2024-05-01").sources()).isNull();
  }

  @Test
  void getRangeInfo_detailed_impliesDailyWithSources() {
    var info =
        aggregator.getRangeInfo(
            user.id(), MAY_FIRST, MAY_FIRST, new RangeOptions(false, true, false));

    assertThat(info.details()).hasSize(1);
    assertThat(info.details().get("2024-05-01").sources().performanceIds()).hasSize(1);
  }

  @Test
  void getRangeInfo_multipleUsers_keepsRequestOrderAndDropsDuplicates() {
    var bob = ledger.user("bob");
    ledger.employFullTime(bob, LocalDate.of(2024, 5, 16));

    var result =
        aggregator.getRangeInfo(
            List.of(bob.id(), user.id(), bob.id()), MAY_FIRST, MAY_LAST, RangeOptions.TOTALS_ONLY);

    assertThat(result).containsOnlyKeys(bob.id(), user.id());
    assertThat(result.keySet()).containsExactly(bob.id(), user.id());
    // 16..31 May holds 12 weekdays
    assertThat(result.get(bob.id()).workHours()).isEqualByComparingTo("96");
  }

  @Test
  void getRangeInfo_unknownUserAmongMany_propagatesNotFound() {
    assertThatThrownBy(
            () ->
                aggregator.getRangeInfo(
                    List.of(user.id(), UUID.randomUUID()),
                    MAY_FIRST,
                    MAY_LAST,
                    RangeOptions.TOTALS_ONLY))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void getRangeInfo_untilBeforeFrom_isRejected() {
    assertThatThrownBy(
            () -> aggregator.getRangeInfo(user.id(), MAY_LAST, MAY_FIRST, RangeOptions.TOTALS_ONLY))
        .isInstanceOf(InvalidStateException.class);
  }
}
