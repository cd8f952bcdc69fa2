package io.b2mash.b2b.timeledger.integration.redmine;

public record RedmineUser(int id, String login, String firstname, String lastname) {

  public String label() {
    var name = ((firstname == null ? "" : firstname) + " " + (lastname == null ? "" : lastname));
    return name.isBlank() ? login : name.trim();
  }
}
