/**
 * Combinators that fold several results into one.
 *
 * <p>{@link com.ryuqq.resultof.core.combine.Results} offers {@code combine} and
 * {@code flatCombine} for 2 to 5 heterogeneous inputs and for a list of same-typed inputs.
 * The first failure in argument order wins; failures are not accumulated.</p>
 *
 * @since 1.0.0
 * @author ResultOf Team
 */
package com.ryuqq.resultof.core.combine;
