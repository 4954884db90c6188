/**
 * Exceptions raised by the state tree. All extend
 * {@link com.ryuqq.statetree.core.exception.StateTreeException}.
 *
 * @since 1.0.0
 * @author StateTree Team
 */
package com.ryuqq.statetree.core.exception;
