/**
 * Store contract tests, runnable against any {@link com.ryuqq.messenger.core.spi.MessengerStore}.
 *
 * @author Messenger Team
 * @since 1.0.0
 */
package com.ryuqq.messenger.testkit.contract;
