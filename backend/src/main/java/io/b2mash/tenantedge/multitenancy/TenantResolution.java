package io.b2mash.tenantedge.multitenancy;

/**
 * Result of tenant resolution.
 *
 * @param tenant the resolved tenant
 * @param rewrittenPath path and query to use for downstream routing; equal to the original unless a
 *     path prefix was stripped
 */
public record TenantResolution(TenantContext tenant, String rewrittenPath) {}
