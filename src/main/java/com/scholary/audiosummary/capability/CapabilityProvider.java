package com.scholary.audiosummary.capability;

/**
 * Resolves the backends for one run.
 *
 * <p>This is the only place per-request overrides are interpreted. The pipeline receives the
 * overrides as a plain argument and hands them here; nothing is read from request or thread state.
 */
@FunctionalInterface
public interface CapabilityProvider {

  Capabilities resolve(ProviderOverrides overrides);
}
