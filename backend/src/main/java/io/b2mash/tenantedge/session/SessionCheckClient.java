package io.b2mash.tenantedge.session;

import java.util.Optional;

/**
 * Port to the external session service, the source of truth for session validity. Implementations
 * throw on transport or upstream errors; callers decide how to fail.
 */
public interface SessionCheckClient {

  /** Validates an access token. Empty when the service reports the session invalid or unknown. */
  Optional<Session> currentSession(String accessToken);

  /** Exchanges a refresh token for a renewed session. Empty when the refresh is rejected. */
  Optional<Session> refresh(String refreshToken);

  /** Revokes a session. No-op upstream if it is already gone. */
  void revoke(String accessToken);
}
