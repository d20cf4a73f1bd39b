/**
 * Functional interfaces used by the result combinators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resultof.core.function.Function3},
 *       {@link com.ryuqq.resultof.core.function.Function4},
 *       {@link com.ryuqq.resultof.core.function.Function5} - transforms for 3 to 5 way combine</li>
 *   <li>{@link com.ryuqq.resultof.core.function.CheckedSupplier},
 *       {@link com.ryuqq.resultof.core.function.CheckedFunction} - blocks that may throw any {@link java.lang.Throwable}</li>
 * </ul>
 *
 * <p>Two way combine uses {@link java.util.function.BiFunction}.</p>
 *
 * @since 1.0.0
 * @author ResultOf Team
 */
package com.ryuqq.resultof.core.function;
