/**
 * Presence Layer - 접속 사용자 추적.
 *
 * <ul>
 *   <li>{@link com.ryuqq.messenger.application.presence.PresenceRegistry} - userId → 전달 채널 (read/write lock)</li>
 *   <li>{@link com.ryuqq.messenger.application.presence.DeliveryChannel} - 세션별 non-blocking 전달 핸들</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
package com.ryuqq.messenger.application.presence;
