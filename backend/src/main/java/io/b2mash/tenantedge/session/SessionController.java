package io.b2mash.tenantedge.session;

import io.b2mash.tenantedge.multitenancy.RequestScopes;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/session")
public class SessionController {

  private final SessionResolver sessionResolver;

  public SessionController(SessionResolver sessionResolver) {
    this.sessionResolver = sessionResolver;
  }

  @GetMapping
  public ResponseEntity<SessionView> currentSession() {
    var session = RequestScopes.requireSession();
    var tenant = RequestScopes.requireTenant();
    return ResponseEntity.ok(
        new SessionView(
            session.userId(),
            session.tenantId(),
            tenant.brandName(),
            session.role(),
            session.onboarded(),
            SessionState.of(session)));
  }

  @PostMapping("/logout")
  public ResponseEntity<Void> logout(HttpServletResponse response) {
    sessionResolver.logout(RequestScopes.requireSession(), response);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record SessionView(
      String userId,
      String tenantId,
      String brandName,
      String role,
      boolean onboarded,
      SessionState state) {}
}
