/**
 * Contract test support for the registry gateway and the daily check.
 *
 * <p>Concrete contract tests extend
 * {@link com.ryuqq.registry.testkit.contract.AbstractContractTest} and drive the real
 * orchestrators, breakers and limiters against a
 * {@link com.ryuqq.registry.testkit.contract.ScriptedRegistryGateway} with time under test control.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.registry.testkit.contract;
