/**
 * Quota decision engine.
 *
 * <p>Services contribute a {@link com.ceiling.quota.UsageReporter} and default limits once at
 * startup. The {@link com.ceiling.quota.QuotaService} then answers whether a caller has reached a
 * service's limits, lists limits and usage per scope, and manages administrator overrides held by
 * a {@link com.ceiling.quota.QuotaStore}.
 *
 * <p>This package has no framework dependencies; the hosting service wires it.
 */
package com.ceiling.quota;
