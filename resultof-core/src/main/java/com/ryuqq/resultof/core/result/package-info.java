/**
 * Result value package.
 *
 * <p>This package defines the sealed interface hierarchy for success/failure values,
 * providing compile-time exhaustive handling of both cases.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resultof.core.result.ResultOf} - Sealed interface (permits Success, Failure)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.resultof.core.result.Success} - Holds the success value</li>
 *   <li>{@link com.ryuqq.resultof.core.result.Failure} - Holds a caller-typed failure value</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * ResultOf&lt;Integer, String&gt; result = ResultOf.success(21);
 * int doubled = result
 *     .map(value -&gt; value * 2)
 *     .fold(value -&gt; value, error -&gt; -1);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Both variants are records; every operation returns a new value</li>
 *   <li><strong>Typed failures:</strong> The failure type is chosen by the caller, not fixed to Throwable</li>
 *   <li><strong>No hidden catching:</strong> Exceptions thrown by transforms propagate to the caller</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ResultOf Team
 */
package com.ryuqq.resultof.core.result;
