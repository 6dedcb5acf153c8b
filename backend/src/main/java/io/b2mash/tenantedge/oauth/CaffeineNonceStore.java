package io.b2mash.tenantedge.oauth;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

/** In-process nonce store; entries expire after {@code tenantedge.oauth.nonce-ttl}. */
@Component
public class CaffeineNonceStore implements NonceStore {

  // nonce -> tenantId it was issued for
  private final Cache<String, String> nonces;

  public CaffeineNonceStore(OAuthProperties properties) {
    this.nonces =
        Caffeine.newBuilder().expireAfterWrite(properties.nonceTtl()).maximumSize(100_000).build();
  }

  @Override
  public void register(String nonce, String tenantId) {
    nonces.put(nonce, tenantId);
  }

  @Override
  public boolean consume(String nonce, String tenantId) {
    // asMap().remove(key, value) is atomic: only one concurrent caller can win
    return nonce != null && tenantId != null && nonces.asMap().remove(nonce, tenantId);
  }
}
