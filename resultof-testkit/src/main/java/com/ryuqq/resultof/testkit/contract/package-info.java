/**
 * Contract test support for {@link com.ryuqq.resultof.core.result.ResultOf}.
 *
 * <p>{@link com.ryuqq.resultof.testkit.contract.AbstractResultContractTest} provides sample
 * results, a transform call counter and assertion helpers. Suites extending it verify the
 * functor and monad laws, recovery, first-failure short-circuiting and list/fixed-arity
 * combine consistency.</p>
 *
 * @since 1.0.0
 * @author ResultOf Team
 */
package com.ryuqq.resultof.testkit.contract;
