/**
 * Session Layer - 연결별 세션 루프와 서버 진입점.
 *
 * <h2>구성요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.messenger.application.session.MessengerServer} - 스레드 풀 소유, 연결 수락</li>
 *   <li>{@link com.ryuqq.messenger.application.session.ConnectionActor} - 인증, 요청 처리, 이벤트 팬아웃</li>
 *   <li>{@link com.ryuqq.messenger.application.session.SessionState} - UNAUTHENTICATED / AUTHENTICATED</li>
 *   <li>{@link com.ryuqq.messenger.application.session.SessionConfig} - 워커 수, 전달 큐 상한, 종료 대기</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * application/session (ConnectionActor)
 *   ↓ uses
 * application/presence (PresenceRegistry)
 *   ↓ depends on
 * core/spi (MessengerStore, FrameCodec, Connection)
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
package com.ryuqq.messenger.application.session;
