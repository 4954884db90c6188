/**
 * Reusable test support for code built on the state tree.
 *
 * <ul>
 *   <li>{@link com.ryuqq.statetree.testkit.contract.ChangeRecorder} - listener spy</li>
 *   <li>{@link com.ryuqq.statetree.testkit.contract.AbstractPropagationContractTest} - device fixture tree with scope recorders</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateTree Team
 */
package com.ryuqq.statetree.testkit.contract;
