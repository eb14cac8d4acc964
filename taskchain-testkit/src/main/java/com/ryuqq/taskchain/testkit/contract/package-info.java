/**
 * Reusable contract-test infrastructure.
 *
 * <h2>Base Class</h2>
 * <ul>
 *   <li>{@link com.ryuqq.taskchain.testkit.contract.AbstractExecutionContractTest} - Runners, timeout guard, codec and step factories per test</li>
 *   <li>{@link com.ryuqq.taskchain.testkit.contract.InvocationRecorder} - Ordered log of user-code invocations</li>
 * </ul>
 *
 * @since 1.0.0
 * @author TaskChain Team
 */
package com.ryuqq.taskchain.testkit.contract;
