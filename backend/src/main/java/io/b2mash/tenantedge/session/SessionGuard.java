package io.b2mash.tenantedge.session;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Route-group access policy over the three session states. The table is defined once here:
 *
 * <pre>
 * group        ANONYMOUS      NOT_ONBOARDED   ONBOARDED
 * PUBLIC       allow          -> onboarding   -> dashboard
 * ONBOARDING   -> login       allow           -> dashboard
 * DASHBOARD    -> login       -> onboarding   allow
 * API          401            allow           allow
 * UNGUARDED    allow          allow           allow
 * </pre>
 */
@Component
public class SessionGuard {

  enum Action {
    ALLOW,
    TO_LOGIN,
    TO_ONBOARDING,
    TO_DASHBOARD,
    REJECT
  }

  private static final Map<RouteGroup, Map<SessionState, Action>> POLICY =
      new EnumMap<>(RouteGroup.class);

  static {
    row(RouteGroup.PUBLIC, Action.ALLOW, Action.TO_ONBOARDING, Action.TO_DASHBOARD);
    row(RouteGroup.ONBOARDING, Action.TO_LOGIN, Action.ALLOW, Action.TO_DASHBOARD);
    row(RouteGroup.DASHBOARD, Action.TO_LOGIN, Action.TO_ONBOARDING, Action.ALLOW);
    row(RouteGroup.API, Action.REJECT, Action.ALLOW, Action.ALLOW);
    row(RouteGroup.UNGUARDED, Action.ALLOW, Action.ALLOW, Action.ALLOW);
  }

  private final SessionProperties properties;

  public SessionGuard(SessionProperties properties) {
    this.properties = properties;
  }

  /**
   * Decides what happens to a request.
   *
   * @param group route group of the tenant-relative path
   * @param state session state after the validity check
   * @param routeBase prefix to put in front of redirect targets ("" unless the tenant was resolved
   *     from a path prefix)
   * @param originalPathAndQuery the path the browser asked for, preserved as the return-to value
   */
  public GuardDecision evaluate(
      RouteGroup group, SessionState state, String routeBase, String originalPathAndQuery) {
    var action = POLICY.get(group).get(state);
    return switch (action) {
      case ALLOW -> GuardDecision.allow();
      case REJECT -> GuardDecision.unauthorized();
      case TO_LOGIN ->
          GuardDecision.redirect(location(routeBase, properties.loginPath(), originalPathAndQuery));
      case TO_ONBOARDING ->
          GuardDecision.redirect(
              location(routeBase, properties.onboardingPath(), originalPathAndQuery));
      case TO_DASHBOARD ->
          GuardDecision.redirect(
              location(routeBase, properties.dashboardPath(), originalPathAndQuery));
    };
  }

  private String location(String routeBase, String target, String originalPathAndQuery) {
    var base = routeBase == null ? "" : routeBase;
    return base
        + target
        + "?"
        + properties.returnToParameter()
        + "="
        + URLEncoder.encode(originalPathAndQuery, StandardCharsets.UTF_8);
  }

  private static void row(
      RouteGroup group, Action anonymous, Action notOnboarded, Action onboarded) {
    var actions = new EnumMap<SessionState, Action>(SessionState.class);
    actions.put(SessionState.ANONYMOUS, anonymous);
    actions.put(SessionState.AUTHENTICATED_NOT_ONBOARDED, notOnboarded);
    actions.put(SessionState.AUTHENTICATED_ONBOARDED, onboarded);
    POLICY.put(group, actions);
  }
}
