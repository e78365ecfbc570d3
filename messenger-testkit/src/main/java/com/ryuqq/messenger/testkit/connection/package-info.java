/**
 * In-memory transport doubles for session tests.
 *
 * @author Messenger Team
 * @since 1.0.0
 */
package com.ryuqq.messenger.testkit.connection;
