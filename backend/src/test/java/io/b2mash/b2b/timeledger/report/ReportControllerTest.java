package io.b2mash.b2b.timeledger.report;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.timeledger.domain.User;
import io.b2mash.b2b.timeledger.store.IntervalStore;
import io.b2mash.b2b.timeledger.testutil.TestLedgerFactory;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ReportControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private IntervalStore store;

  private User alice;
  private String aliceKey;

  @BeforeAll
  void setUp() {
    var ledger = new TestLedgerFactory(store);
    alice = ledger.user("report_alice");
    aliceKey = "$['" + alice.id() + "']";
    ledger.employ(
        alice, ledger.company("LU"), ledger.weekdaySchedule("8"), LocalDate.of(2024, 1, 1), null);
    var may = ledger.timesheet(alice, YearMonth.of(2024, 5));
    var regular = ledger.performanceType("Report regular", "1");
    var apollo = ledger.projectContract("Report Apollo", null);
    ledger.holiday("Labour Day", LocalDate.of(2024, 5, 1), "LU");
    ledger.activity(may, LocalDate.of(2024, 5, 1), apollo, regular, "4");
  }

  @Test
  void dayDetail_holidayWithWork() throws Exception {
    mockMvc
        .perform(
            get("/api/day-detail")
                .param("user", alice.id().toString())
                .param("date", "2024-05-01"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.date").value("2024-05-01"))
        .andExpect(jsonPath("$.workHours").value(8.0))
        .andExpect(jsonPath("$.holidayHours").value(8.0))
        .andExpect(jsonPath("$.performedHours").value(4.0))
        .andExpect(jsonPath("$.remainingHours").value(0.0))
        .andExpect(jsonPath("$.sources").doesNotExist());
  }

  @Test
  void rangeInfo_withSummary_groupsByContract() throws Exception {
    mockMvc
        .perform(
            get("/api/range-info")
                .param("users", alice.id().toString())
                .param("from", "2024-05-01")
                .param("until", "2024-05-31")
                .param("summary", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath(aliceKey + ".performedHours").value(4.0))
        .andExpect(jsonPath(aliceKey + ".details").doesNotExist())
        .andExpect(jsonPath(aliceKey + ".summary.performances", hasSize(1)))
        .andExpect(
            jsonPath(aliceKey + ".summary.performances[0].contractName").value("Report Apollo"))
        .andExpect(jsonPath(aliceKey + ".summary.performances[0].contractKind").value("PROJECT"));
  }

  @Test
  void rangeInfo_detailed_returnsDaysWithSources() throws Exception {
    mockMvc
        .perform(
            get("/api/range-info")
                .param("users", alice.id().toString())
                .param("from", "2024-05-01")
                .param("until", "2024-05-03")
                .param("detailed", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath(aliceKey + ".details['2024-05-01'].sources.holidayIds", hasSize(1)))
        .andExpect(jsonPath(aliceKey + ".details['2024-05-03'].remainingHours").value(8.0));
  }

  @Test
  void rangeInfo_untilBeforeFrom_returns400() throws Exception {
    mockMvc
        .perform(
            get("/api/range-info")
                .param("users", alice.id().toString())
                .param("from", "2024-05-31")
                .param("until", "2024-05-01"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid date range"));
  }

  @Test
  void rangeInfo_unknownUser_returns404() throws Exception {
    mockMvc
        .perform(
            get("/api/range-info")
                .param("users", UUID.randomUUID().toString())
                .param("from", "2024-05-01")
                .param("until", "2024-05-31"))
        .andExpect(status().isNotFound());
  }

  @Test
  void availability_tagsWeekendAndHoliday() throws Exception {
    mockMvc
        .perform(
            get("/api/availability")
                .param("users", alice.id().toString())
                .param("from", "2024-05-01")
                .param("until", "2024-05-05"))
        .andExpect(status().isOk())
        .andExpect(jsonPath(aliceKey + "['2024-05-01'].tags[0]").value("holiday"))
        .andExpect(jsonPath(aliceKey + "['2024-05-02'].tags[0]").value("free_hours_available"))
        .andExpect(jsonPath(aliceKey + "['2024-05-04'].tags[0]").value("weekend"));
  }

  @Test
  void internalAvailability_reportsFreeHours() throws Exception {
    mockMvc
        .perform(
            get("/api/internal-availability")
                .param("users", alice.id().toString())
                .param("date", "2024-05-02"))
        .andExpect(status().isOk())
        .andExpect(jsonPath(aliceKey + ".freeHours").value(8.0))
        .andExpect(jsonPath(aliceKey + ".availableForInternal").value(true))
        .andExpect(jsonPath(aliceKey + ".issues", hasSize(0)));
  }

  @Test
  void overtime_sinceEmployment_startsAtFirstContract() throws Exception {
    mockMvc
        .perform(
            get("/api/overtime")
                .param("user", alice.id().toString())
                .param("until", "2024-02-15")
                .param("sinceEmployment", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(2)))
        .andExpect(jsonPath("$[0].year").value(2024))
        .andExpect(jsonPath("$[0].month").value(1));
  }

  @Test
  void overtime_withoutStart_returns400() throws Exception {
    mockMvc
        .perform(
            get("/api/overtime")
                .param("user", alice.id().toString())
                .param("until", "2024-05-31"))
        .andExpect(status().isBadRequest());
  }
}
