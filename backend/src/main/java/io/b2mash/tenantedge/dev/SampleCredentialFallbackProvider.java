package io.b2mash.tenantedge.dev;

import io.b2mash.tenantedge.credential.CredentialCheck;
import io.b2mash.tenantedge.credential.CredentialRecord;
import io.b2mash.tenantedge.health.FallbackProvider;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Dev-only sample health data, used when the auth service is not running locally. Profile-gated
 * and off unless {@code tenantedge.fallback.enabled=true}; never present in production.
 */
@Component
@Profile({"local", "dev"})
@ConditionalOnProperty(name = "tenantedge.fallback.enabled", havingValue = "true")
public class SampleCredentialFallbackProvider implements FallbackProvider {

  private static final Logger log = LoggerFactory.getLogger(SampleCredentialFallbackProvider.class);

  private static final long SAMPLE_QUOTA = 50_000;
  private static final Duration SAMPLE_VALIDITY = Duration.ofDays(90);

  @Override
  public CredentialCheck sampleCheck(CredentialRecord record) {
    log.info(
        "Using sample health data for {} credential {}", record.platformId(), record.recordId());
    var quota = record.quotaRemaining() != null ? record.quotaRemaining() : SAMPLE_QUOTA;
    return new CredentialCheck(true, quota, Instant.now().plus(SAMPLE_VALIDITY), null, true);
  }
}
