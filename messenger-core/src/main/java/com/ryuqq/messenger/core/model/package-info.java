/**
 * Domain model package.
 *
 * <p>Value types shared by every layer: users, groups, recipients and messages.
 * All types are immutable; the types persisted by the store adapters are {@link java.io.Serializable}.</p>
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>{@link com.ryuqq.messenger.core.model.Recipient}: kind first (USER before GROUP), then id</li>
 *   <li>Message lists are always returned in ascending message id order</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Messenger Team
 */
package com.ryuqq.messenger.core.model;
