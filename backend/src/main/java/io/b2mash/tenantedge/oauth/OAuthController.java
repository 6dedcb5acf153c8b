package io.b2mash.tenantedge.oauth;

import io.b2mash.tenantedge.exception.OAuthFlowException;
import io.b2mash.tenantedge.multitenancy.RequestScopes;
import java.net.URI;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

@RestController
@RequestMapping("/api/oauth/{provider}")
public class OAuthController {

  private final OAuthBroker broker;
  private final OAuthProperties properties;

  public OAuthController(OAuthBroker broker, OAuthProperties properties) {
    this.broker = broker;
    this.properties = properties;
  }

  @GetMapping("/initiate")
  public ResponseEntity<Map<String, String>> initiate(
      @PathVariable String provider, @RequestParam(required = false) String redirectUrl) {
    var session = RequestScopes.requireOnboardedSession();
    var tenant = RequestScopes.requireTenant();
    var authorizeUrl = broker.initiate(session.userId(), tenant.tenantId(), provider, redirectUrl);
    return ResponseEntity.ok(Map.of("authorizeUrl", authorizeUrl));
  }

  /** Provider redirect target. Always answers with a redirect to the integrations surface. */
  @RequestMapping(
      value = "/callback",
      method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Void> callback(
      @PathVariable String provider,
      @RequestParam(required = false) String code,
      @RequestParam(required = false) String state,
      @RequestParam(required = false) String error,
      @RequestParam(name = "error_description", required = false) String errorDescription) {
    URI location;
    try {
      var redirectUrl = broker.callback(provider, code, state, error, errorDescription);
      location =
          UriComponentsBuilder.fromUriString(redirectUrl)
              .queryParam("success", "true")
              .queryParam("provider", provider)
              .encode()
              .build()
              .toUri();
    } catch (OAuthFlowException e) {
      var target =
          e.getRedirectUrl() != null ? e.getRedirectUrl() : properties.integrationsPath();
      location =
          UriComponentsBuilder.fromUriString(target)
              .queryParam("error", e.getErrorKind().name())
              .queryParam("provider", provider)
              .encode()
              .build()
              .toUri();
    }
    var headers = new HttpHeaders();
    headers.setLocation(location);
    return new ResponseEntity<>(headers, HttpStatus.FOUND);
  }
}
