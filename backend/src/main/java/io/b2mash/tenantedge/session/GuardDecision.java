package io.b2mash.tenantedge.session;

/**
 * Outcome of the session guard for one request.
 *
 * @param outcome what to do with the request
 * @param location redirect target including the return-to parameter; null unless redirecting
 */
public record GuardDecision(Outcome outcome, String location) {

  public enum Outcome {
    ALLOW,
    REDIRECT,
    UNAUTHORIZED
  }

  static GuardDecision allow() {
    return new GuardDecision(Outcome.ALLOW, null);
  }

  static GuardDecision redirect(String location) {
    return new GuardDecision(Outcome.REDIRECT, location);
  }

  static GuardDecision unauthorized() {
    return new GuardDecision(Outcome.UNAUTHORIZED, null);
  }
}
