package io.b2mash.tenantedge.session;

public enum SessionState {
  ANONYMOUS,
  AUTHENTICATED_NOT_ONBOARDED,
  AUTHENTICATED_ONBOARDED;

  /** Maps a (possibly absent) validated session to its guard state. */
  public static SessionState of(Session session) {
    if (session == null) {
      return ANONYMOUS;
    }
    return session.onboarded() ? AUTHENTICATED_ONBOARDED : AUTHENTICATED_NOT_ONBOARDED;
  }
}
