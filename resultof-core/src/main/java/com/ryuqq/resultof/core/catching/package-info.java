/**
 * Bridge from exception-throwing code to {@link com.ryuqq.resultof.core.result.ResultOf}.
 *
 * @since 1.0.0
 * @author ResultOf Team
 */
package com.ryuqq.resultof.core.catching;
