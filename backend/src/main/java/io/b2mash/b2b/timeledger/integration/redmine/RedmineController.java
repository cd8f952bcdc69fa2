package io.b2mash.b2b.timeledger.integration.redmine;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class RedmineController {

  private final PerformanceImportService importService;
  private final RedmineChoices choices;
  private final RedmineConnector connector;

  public RedmineController(
      PerformanceImportService importService, RedmineChoices choices, RedmineConnector connector) {
    this.importService = importService;
    this.choices = choices;
    this.connector = connector;
  }

  @GetMapping("/api/redmine/performances")
  public ResponseEntity<List<PerformanceCandidate>> getExternalPerformances(
      @RequestParam UUID user,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate until) {
    return ResponseEntity.ok(importService.getUserExternalPerformances(user, from, until));
  }

  @PostMapping("/api/redmine/performances/import")
  public ResponseEntity<ImportResult> importPerformances(
      @RequestParam UUID user,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate until) {
    return ResponseEntity.ok(importService.importPerformances(user, from, until));
  }

  @GetMapping("/api/redmine/choices/users")
  public ResponseEntity<List<Choice>> getUserChoices() {
    return ResponseEntity.ok(choices.userChoices());
  }

  @GetMapping("/api/redmine/choices/projects")
  public ResponseEntity<List<Choice>> getProjectChoices() {
    return ResponseEntity.ok(choices.projectChoices());
  }

  @GetMapping("/api/redmine/connection")
  public ResponseEntity<ConnectionTestResult> testConnection() {
    return ResponseEntity.ok(connector.testConnection());
  }
}
