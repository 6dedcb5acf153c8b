package io.b2mash.tenantedge.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.tenantedge.exception.UpstreamTimeoutException;
import io.b2mash.tenantedge.testutil.TestFixtures;
import jakarta.servlet.http.Cookie;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class SessionResolverTest {

  private SessionCheckClient client;
  private SessionResolver resolver;
  private MockHttpServletRequest request;
  private MockHttpServletResponse response;

  @BeforeEach
  void setUp() {
    client = mock(SessionCheckClient.class);
    resolver = new SessionResolver(client, TestFixtures.sessionProperties());
    request = new MockHttpServletRequest();
    response = new MockHttpServletResponse();
  }

  @Test
  void noCookies_isAnonymousWithoutUpstreamCall() {
    assertThat(resolver.resolve(request, response)).isEmpty();

    verify(client, never()).currentSession(anyString());
  }

  @Test
  void validAccessCookie_returnsSession() {
    request.setCookies(new Cookie("session_token", "access-1"));
    var session = session("access-1", Instant.now().plus(1, ChronoUnit.HOURS));
    when(client.currentSession("access-1")).thenReturn(Optional.of(session));

    assertThat(resolver.resolve(request, response)).contains(session);
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE)).isEmpty();
  }

  @Test
  void rejectedCookie_isAnonymous() {
    request.setCookies(new Cookie("session_token", "forged"));
    when(client.currentSession("forged")).thenReturn(Optional.empty());

    assertThat(resolver.resolve(request, response)).isEmpty();
  }

  @Test
  void sessionServiceTimeout_failsClosed() {
    request.setCookies(new Cookie("session_token", "access-1"));
    when(client.currentSession("access-1"))
        .thenThrow(new UpstreamTimeoutException("auth-service", null));

    assertThat(resolver.resolve(request, response)).isEmpty();
  }

  @Test
  void expiredSession_isRefreshedAndCookieRewritten() {
    request.setCookies(
        new Cookie("session_token", "stale"), new Cookie("refresh_token", "refresh-1"));
    when(client.currentSession("stale"))
        .thenReturn(Optional.of(session("stale", Instant.now().minus(1, ChronoUnit.MINUTES))));
    var refreshed = session("fresh", Instant.now().plus(1, ChronoUnit.HOURS));
    when(client.refresh("refresh-1")).thenReturn(Optional.of(refreshed));

    assertThat(resolver.resolve(request, response)).contains(refreshed);
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE))
        .anySatisfy(cookie -> assertThat(cookie).startsWith("session_token=fresh"));
  }

  @Test
  void failedRefresh_isAnonymous() {
    request.setCookies(new Cookie("refresh_token", "refresh-1"));
    when(client.refresh("refresh-1")).thenReturn(Optional.empty());

    assertThat(resolver.resolve(request, response)).isEmpty();
  }

  @Test
  void logout_revokesAndExpiresCookies() {
    var session = session("access-1", Instant.now().plus(1, ChronoUnit.HOURS));

    resolver.logout(session, response);

    verify(client).revoke("access-1");
    assertThat(response.getHeaders(HttpHeaders.SET_COOKIE))
        .hasSize(2)
        .allSatisfy(cookie -> assertThat(cookie).contains("Max-Age=0"));
  }

  private static Session session(String accessToken, Instant expiresAt) {
    return new Session("42", "7", "owner", true, accessToken, "refresh-next", expiresAt);
  }
}
