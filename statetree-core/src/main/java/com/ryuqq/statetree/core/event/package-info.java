/**
 * Listener contract, event payload and the process-wide error observer.
 *
 * @since 1.0.0
 * @author StateTree Team
 */
package com.ryuqq.statetree.core.event;
