package io.b2mash.tenantedge.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.tenantedge.session.GuardDecision.Outcome;
import io.b2mash.tenantedge.testutil.TestFixtures;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SessionGuardTest {

  private final SessionGuard guard = new SessionGuard(TestFixtures.sessionProperties());

  @Nested
  class Anonymous {

    @Test
    void dashboard_redirectsToLoginWithReturnTo() {
      var decision =
          guard.evaluate(
              RouteGroup.DASHBOARD, SessionState.ANONYMOUS, "", "/dashboard/reports?m=1");

      assertThat(decision.outcome()).isEqualTo(Outcome.REDIRECT);
      assertThat(decision.location()).isEqualTo("/login?returnTo=%2Fdashboard%2Freports%3Fm%3D1");
    }

    @Test
    void onboarding_redirectsToLogin() {
      var decision =
          guard.evaluate(RouteGroup.ONBOARDING, SessionState.ANONYMOUS, "", "/onboarding");

      assertThat(decision.location()).startsWith("/login?returnTo=");
    }

    @Test
    void publicRoute_isAllowed() {
      var decision = guard.evaluate(RouteGroup.PUBLIC, SessionState.ANONYMOUS, "", "/login");

      assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
    }

    @Test
    void api_isUnauthorized() {
      var decision = guard.evaluate(RouteGroup.API, SessionState.ANONYMOUS, "", "/api/session");

      assertThat(decision.outcome()).isEqualTo(Outcome.UNAUTHORIZED);
      assertThat(decision.location()).isNull();
    }

    @Test
    void pathBasedTenant_redirectKeepsRouteBase() {
      var decision =
          guard.evaluate(
              RouteGroup.DASHBOARD,
              SessionState.ANONYMOUS,
              "/client/coreldove",
              "/client/coreldove/dashboard");

      assertThat(decision.location())
          .isEqualTo("/client/coreldove/login?returnTo=%2Fclient%2Fcoreldove%2Fdashboard");
    }
  }

  @Nested
  class NotOnboarded {

    @Test
    void dashboard_redirectsToOnboarding() {
      var decision =
          guard.evaluate(
              RouteGroup.DASHBOARD, SessionState.AUTHENTICATED_NOT_ONBOARDED, "", "/dashboard");

      assertThat(decision.location()).startsWith("/onboarding?returnTo=");
    }

    @Test
    void publicRoute_redirectsToOnboarding() {
      var decision =
          guard.evaluate(
              RouteGroup.PUBLIC, SessionState.AUTHENTICATED_NOT_ONBOARDED, "", "/login");

      assertThat(decision.location()).startsWith("/onboarding?returnTo=");
    }

    @Test
    void onboarding_isAllowed() {
      var decision =
          guard.evaluate(
              RouteGroup.ONBOARDING, SessionState.AUTHENTICATED_NOT_ONBOARDED, "", "/onboarding");

      assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
    }
  }

  @Nested
  class Onboarded {

    @Test
    void onboarding_redirectsToDashboard() {
      var decision =
          guard.evaluate(
              RouteGroup.ONBOARDING, SessionState.AUTHENTICATED_ONBOARDED, "", "/onboarding");

      assertThat(decision.location()).startsWith("/dashboard?returnTo=");
    }

    @Test
    void publicRoute_redirectsToDashboard() {
      var decision =
          guard.evaluate(RouteGroup.PUBLIC, SessionState.AUTHENTICATED_ONBOARDED, "", "/login");

      assertThat(decision.location()).startsWith("/dashboard?returnTo=");
    }
  }

  @ParameterizedTest
  @EnumSource(SessionState.class)
  void unguarded_alwaysAllowed(SessionState state) {
    var decision = guard.evaluate(RouteGroup.UNGUARDED, state, "", "/api/oauth/hubspot/callback");

    assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW);
  }
}
