package io.b2mash.tenantedge.oauth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Optional;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serializes {@link OAuthState} as {@code base64url(json).base64url(tag)}, where the tag is an
 * HMAC-SHA256 of the JSON bytes. Any change to either part makes {@link #decode} return empty.
 */
@Component
public class OAuthStateCodec {

  private static final Logger log = LoggerFactory.getLogger(OAuthStateCodec.class);
  private static final String ALGORITHM = "HmacSHA256";

  private final ObjectMapper objectMapper;
  private final SecretKeySpec signingKey;

  public OAuthStateCodec(ObjectMapper objectMapper, OAuthProperties properties) {
    this.objectMapper = objectMapper;
    var configuredKey = properties.stateSigningKey();
    byte[] keyBytes;
    if (configuredKey == null || configuredKey.isBlank()) {
      log.warn(
          "tenantedge.oauth.state-signing-key not set; using a per-process key. OAuth states will"
              + " not survive a restart or be accepted by other instances.");
      keyBytes = new byte[32];
      new SecureRandom().nextBytes(keyBytes);
    } else {
      keyBytes = configuredKey.getBytes(StandardCharsets.UTF_8);
    }
    this.signingKey = new SecretKeySpec(keyBytes, ALGORITHM);
  }

  public String encode(OAuthState state) {
    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(state);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize OAuth state", e);
    }
    var encoder = Base64.getUrlEncoder().withoutPadding();
    return encoder.encodeToString(json) + "." + encoder.encodeToString(sign(json));
  }

  /** Decodes and verifies a state value. Empty for anything that is not an untouched state. */
  public Optional<OAuthState> decode(String encoded) {
    if (encoded == null || encoded.isBlank()) {
      return Optional.empty();
    }
    int separator = encoded.indexOf('.');
    if (separator <= 0 || separator != encoded.lastIndexOf('.')) {
      return Optional.empty();
    }
    try {
      var decoder = Base64.getUrlDecoder();
      var json = decoder.decode(encoded.substring(0, separator));
      var tag = decoder.decode(encoded.substring(separator + 1));
      if (!MessageDigest.isEqual(sign(json), tag)) {
        return Optional.empty();
      }
      // Base64 tolerates some non-canonical input; require the exact canonical form back
      if (!canonical(json, tag).equals(encoded)) {
        return Optional.empty();
      }
      var state = objectMapper.readValue(json, OAuthState.class);
      return state != null && state.isStructurallyValid() ? Optional.of(state) : Optional.empty();
    } catch (IllegalArgumentException | IOException e) {
      log.debug("Rejected malformed OAuth state: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private static String canonical(byte[] json, byte[] tag) {
    var encoder = Base64.getUrlEncoder().withoutPadding();
    return encoder.encodeToString(json) + "." + encoder.encodeToString(tag);
  }

  private byte[] sign(byte[] payload) {
    try {
      var mac = Mac.getInstance(ALGORITHM);
      mac.init(signingKey);
      return mac.doFinal(payload);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("HMAC unavailable", e);
    }
  }
}
