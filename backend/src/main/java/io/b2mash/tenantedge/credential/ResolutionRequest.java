package io.b2mash.tenantedge.credential;

/**
 * @param tenantId tenant making the call
 * @param platformId external platform the call goes to
 * @param requiredCapability capability the credential must grant; blank for any
 */
public record ResolutionRequest(String tenantId, String platformId, String requiredCapability) {}
