package io.b2mash.tenantedge.oauth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.tenantedge.credential.CredentialService;
import io.b2mash.tenantedge.exception.ErrorKind;
import io.b2mash.tenantedge.exception.InvalidOAuthStateException;
import io.b2mash.tenantedge.exception.InvalidRequestException;
import io.b2mash.tenantedge.exception.ProviderErrorException;
import io.b2mash.tenantedge.exception.TokenExchangeFailedException;
import io.b2mash.tenantedge.exception.TokenExchangeTimeoutException;
import io.b2mash.tenantedge.exception.UpstreamTimeoutException;
import io.b2mash.tenantedge.oauth.OAuthProperties.ProviderRegistration;
import io.b2mash.tenantedge.oauth.TokenExchangeClient.TokenExchangeRequest;
import io.b2mash.tenantedge.oauth.TokenExchangeClient.TokenExchangeResult;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.util.UriComponentsBuilder;

class OAuthBrokerTest {

  private OAuthStateCodec codec;
  private CaffeineNonceStore nonceStore;
  private TokenExchangeClient exchangeClient;
  private CredentialService credentialService;
  private OAuthBroker broker;

  @BeforeEach
  void setUp() {
    var properties =
        new OAuthProperties(
            "https://edge.example",
            "/dashboard/integrations",
            Duration.ofMinutes(10),
            "test-signing-key",
            Map.of(
                "hubspot",
                new ProviderRegistration("hubspot-client", "hubspot-secret", null, null),
                "google",
                new ProviderRegistration("google-client", "google-secret", null, null)));
    codec = new OAuthStateCodec(new ObjectMapper().findAndRegisterModules(), properties);
    nonceStore = new CaffeineNonceStore(properties);
    exchangeClient = mock(TokenExchangeClient.class);
    credentialService = mock(CredentialService.class);
    broker = new OAuthBroker(properties, codec, nonceStore, exchangeClient, credentialService);
  }

  @Nested
  class Initiate {

    @Test
    void authorizeUrl_carriesDecodableState() {
      var url = broker.initiate("42", "7", "hubspot", "/dashboard/integrations");

      var params = UriComponentsBuilder.fromUriString(url).build().getQueryParams();
      assertThat(url).startsWith("https://app.hubspot.com/oauth/authorize?");
      assertThat(params.getFirst("client_id")).isEqualTo("hubspot-client");
      assertThat(params.getFirst("response_type")).isEqualTo("code");
      assertThat(params.getFirst("redirect_uri"))
          .isEqualTo("https://edge.example/api/oauth/hubspot/callback");

      var state = codec.decode(params.getFirst("state")).orElseThrow();
      assertThat(state.userId()).isEqualTo("42");
      assertThat(state.tenantId()).isEqualTo("7");
      assertThat(state.provider()).isEqualTo("hubspot");
      assertThat(state.redirectUrl()).isEqualTo("/dashboard/integrations");
      assertThat(state.nonce()).isNotBlank();
    }

    @Test
    void absoluteRedirectUrl_isReplacedByIntegrationsPath() {
      var url = broker.initiate("42", "7", "hubspot", "https://evil.example/steal");

      var stateParam =
          UriComponentsBuilder.fromUriString(url).build().getQueryParams().getFirst("state");
      assertThat(codec.decode(stateParam).orElseThrow().redirectUrl())
          .isEqualTo("/dashboard/integrations");
      assertThat(broker.safeRedirectUrl("//evil.example")).isEqualTo("/dashboard/integrations");
    }

    @Test
    void unknownProvider_isRejected() {
      assertThatThrownBy(() -> broker.initiate("42", "7", "myspace", null))
          .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void unconfiguredProvider_isRejected() {
      assertThatThrownBy(() -> broker.initiate("42", "7", "zoho", null))
          .isInstanceOf(InvalidRequestException.class);
    }
  }

  @Nested
  class Callback {

    @Test
    void providerError_isReportedWithoutExchange() {
      var state = initiateState();

      assertThatThrownBy(
              () -> broker.callback("hubspot", null, state, "access_denied", "User said no"))
          .isInstanceOfSatisfying(
              ProviderErrorException.class,
              e -> {
                assertThat(e.getErrorKind()).isEqualTo(ErrorKind.ProviderError);
                assertThat(e.getProviderErrorCode()).isEqualTo("access_denied");
              });
      verifyNoInteractions(exchangeClient);
    }

    @Test
    void missingCode_isInvalidState() {
      var state = initiateState();

      assertThatThrownBy(() -> broker.callback("hubspot", null, state, null, null))
          .isInstanceOf(InvalidOAuthStateException.class);
    }

    @Test
    void tamperedState_isInvalidStateAndNotExchanged() {
      var state = initiateState();
      var tampered = state.substring(0, state.length() - 2) + (state.endsWith("A") ? "BB" : "AA");

      assertThatThrownBy(() -> broker.callback("hubspot", "code-1", tampered, null, null))
          .isInstanceOf(InvalidOAuthStateException.class);
      verifyNoInteractions(exchangeClient);
    }

    @Test
    void stateForOtherProvider_isInvalidState() {
      var state = initiateState();

      assertThatThrownBy(() -> broker.callback("google", "code-1", state, null, null))
          .isInstanceOf(InvalidOAuthStateException.class);
      verifyNoInteractions(exchangeClient);
    }

    @Test
    void success_registersCredentialAndReturnsRedirect() {
      var state = initiateState();
      when(exchangeClient.exchange(any()))
          .thenReturn(new TokenExchangeResult("cred-ref-1", null, 5000L));

      var redirect = broker.callback("hubspot", "code-1", state, null, null);

      assertThat(redirect).isEqualTo("/dashboard/integrations");
      var captor = ArgumentCaptor.forClass(TokenExchangeRequest.class);
      verify(exchangeClient).exchange(captor.capture());
      assertThat(captor.getValue().code()).isEqualTo("code-1");
      assertThat(captor.getValue().redirectUri())
          .isEqualTo("https://edge.example/api/oauth/hubspot/callback");
      assertThat(captor.getValue().tenantId()).isEqualTo("7");
      verify(credentialService)
          .registerOAuthCredential(
              eq("7"), eq("hubspot"), eq("cred-ref-1"), any(), eq(5000L), any());
    }

    @Test
    void replayedState_isInvalidState() {
      var state = initiateState();
      when(exchangeClient.exchange(any()))
          .thenReturn(new TokenExchangeResult("cred-ref-1", null, null));
      broker.callback("hubspot", "code-1", state, null, null);

      assertThatThrownBy(() -> broker.callback("hubspot", "code-1", state, null, null))
          .isInstanceOf(InvalidOAuthStateException.class);
      verify(exchangeClient, times(1)).exchange(any());
    }

    @Test
    void exchangeFailure_carriesRedirectUrlAndIsNotRetried() {
      var state = initiateState();
      when(exchangeClient.exchange(any())).thenThrow(new IllegalStateException("invalid_grant"));

      assertThatThrownBy(() -> broker.callback("hubspot", "code-1", state, null, null))
          .isInstanceOfSatisfying(
              TokenExchangeFailedException.class,
              e -> {
                assertThat(e.getRedirectUrl()).isEqualTo("/dashboard/integrations");
                assertThat(e.getErrorKind()).isEqualTo(ErrorKind.TokenExchangeFailed);
              });
      verify(exchangeClient, times(1)).exchange(any());
      verify(credentialService, never())
          .registerOAuthCredential(anyString(), anyString(), anyString(), any(), any(), any());
    }

    @Test
    void exchangeTimeout_isReportedAsTimeoutAndNotRetried() {
      var state = initiateState();
      when(exchangeClient.exchange(any()))
          .thenThrow(new UpstreamTimeoutException("auth-service", null));

      assertThatThrownBy(() -> broker.callback("hubspot", "code-1", state, null, null))
          .isInstanceOfSatisfying(
              TokenExchangeTimeoutException.class,
              e -> {
                assertThat(e.getErrorKind()).isEqualTo(ErrorKind.UpstreamTimeout);
                assertThat(e.getRedirectUrl()).isEqualTo("/dashboard/integrations");
              });
      verify(exchangeClient, times(1)).exchange(any());
      verify(credentialService, never())
          .registerOAuthCredential(anyString(), anyString(), anyString(), any(), any(), any());
    }

    private String initiateState() {
      var url = broker.initiate("42", "7", "hubspot", "/dashboard/integrations");
      return UriComponentsBuilder.fromUriString(url).build().getQueryParams().getFirst("state");
    }
  }
}
