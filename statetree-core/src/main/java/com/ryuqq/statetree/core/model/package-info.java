/**
 * Value objects shared by every part of the state tree.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statetree.core.model.Path} - Dotted location of a component</li>
 *   <li>{@link com.ryuqq.statetree.core.model.EventKey} - Interned identifier of a change event</li>
 *   <li>{@link com.ryuqq.statetree.core.model.Entry} - Identity-keyed collection record</li>
 *   <li>{@link com.ryuqq.statetree.core.model.EntryDiff} - Key-based diff outcome</li>
 *   <li>{@link com.ryuqq.statetree.core.model.AttributeType} - Attribute type guard</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable</li>
 *   <li><strong>Structural equality:</strong> {@link com.ryuqq.statetree.core.model.Values#deepEquals} decides what counts as a change</li>
 *   <li><strong>Validation:</strong> Constructors reject malformed input</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateTree Team
 */
package com.ryuqq.statetree.core.model;
