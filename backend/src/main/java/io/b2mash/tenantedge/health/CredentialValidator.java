package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialCheck;
import io.b2mash.tenantedge.credential.CredentialRecord;

/**
 * Checks a stored credential against its platform. A rejected credential is a normal result;
 * exceptions mean the check itself could not be made.
 */
public interface CredentialValidator {

  CredentialCheck validate(CredentialRecord record);
}
