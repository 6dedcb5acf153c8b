package io.b2mash.tenantedge.session;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Turns the session cookies of a request into a validated {@link Session}. A cookie is never
 * trusted on its own: the session service is asked every time, and any failure of that check yields
 * no session.
 */
@Component
public class SessionResolver {

  private static final Logger log = LoggerFactory.getLogger(SessionResolver.class);

  private final SessionCheckClient sessionCheckClient;
  private final SessionProperties properties;

  public SessionResolver(SessionCheckClient sessionCheckClient, SessionProperties properties) {
    this.sessionCheckClient = sessionCheckClient;
    this.properties = properties;
  }

  public Optional<Session> resolve(HttpServletRequest request, HttpServletResponse response) {
    var accessToken = cookieValue(request, properties.cookieName());
    var refreshToken = cookieValue(request, properties.refreshCookieName());
    if (accessToken == null && refreshToken == null) {
      return Optional.empty();
    }

    try {
      if (accessToken != null) {
        var session = sessionCheckClient.currentSession(accessToken);
        if (session.isPresent() && !session.get().isExpired(Instant.now())) {
          return session;
        }
      }
      if (refreshToken != null) {
        var refreshed = sessionCheckClient.refresh(refreshToken);
        if (refreshed.isPresent() && !refreshed.get().isExpired(Instant.now())) {
          writeCookies(response, refreshed.get());
          log.debug("Session refreshed for user {}", refreshed.get().userId());
          return refreshed;
        }
      }
      return Optional.empty();
    } catch (RuntimeException e) {
      // Fail closed: the request continues as anonymous
      log.warn("Session validity check failed, treating request as anonymous: {}", e.toString());
      return Optional.empty();
    }
  }

  /** Revokes the session upstream and expires both cookies. */
  public void logout(Session session, HttpServletResponse response) {
    try {
      sessionCheckClient.revoke(session.accessToken());
    } finally {
      expireCookie(response, properties.cookieName());
      expireCookie(response, properties.refreshCookieName());
    }
  }

  private void writeCookies(HttpServletResponse response, Session session) {
    var maxAge =
        session.expiresAt() != null
            ? Duration.between(Instant.now(), session.expiresAt())
            : Duration.ofHours(1);
    response.addHeader(
        HttpHeaders.SET_COOKIE,
        cookie(properties.cookieName(), session.accessToken(), maxAge).toString());
    if (session.refreshToken() != null) {
      response.addHeader(
          HttpHeaders.SET_COOKIE,
          cookie(properties.refreshCookieName(), session.refreshToken(), Duration.ofDays(30))
              .toString());
    }
  }

  private void expireCookie(HttpServletResponse response, String name) {
    response.addHeader(HttpHeaders.SET_COOKIE, cookie(name, "", Duration.ZERO).toString());
  }

  private ResponseCookie cookie(String name, String value, Duration maxAge) {
    return ResponseCookie.from(name, value)
        .httpOnly(true)
        .secure(properties.secureCookies())
        .sameSite("Lax")
        .path("/")
        .maxAge(maxAge)
        .build();
  }

  private static String cookieValue(HttpServletRequest request, String name) {
    var cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (name.equals(cookie.getName())
          && cookie.getValue() != null
          && !cookie.getValue().isBlank()) {
        return cookie.getValue();
      }
    }
    return null;
  }
}
