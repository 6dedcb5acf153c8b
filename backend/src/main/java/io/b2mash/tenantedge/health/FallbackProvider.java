package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialCheck;
import io.b2mash.tenantedge.credential.CredentialRecord;

/**
 * Sample check results for local development when the auth service is unreachable. Only present in
 * the dev profile; results are applied as degraded.
 */
public interface FallbackProvider {

  CredentialCheck sampleCheck(CredentialRecord record);
}
