/**
 * Two-tier escalation.
 *
 * <p>The cheap update check runs for every entity; the attachment fetch, which costs
 * materially more, runs only when an {@link com.ryuqq.registry.application.escalation.EscalationPolicy}
 * says so.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.registry.application.escalation;
