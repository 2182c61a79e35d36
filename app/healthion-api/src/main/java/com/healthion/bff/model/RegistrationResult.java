package com.healthion.bff.model;

public record RegistrationResult(UserRecord user, RegistrationOutcome outcome) {

  public String upstreamUserId() {
    return user.upstreamUserId();
  }

  public boolean alreadyRegistered() {
    return outcome == RegistrationOutcome.ALREADY_LINKED;
  }
}
