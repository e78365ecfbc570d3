/**
 * MVStore Adapter Layer - MessengerStore 구현체.
 *
 * <p>H2 MVStore 임베디드 트랜잭션 키-값 엔진 위에 사용자, 그룹, 메시지, 전달 인덱스를 저장합니다.
 * 파일 기반과 메모리 전용 모드를 모두 지원합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.messenger.adapter.mvstore.MvStoreMessengerStore} - 트랜잭션 저장소</li>
 *   <li>{@link com.ryuqq.messenger.adapter.mvstore.DeliveryKey} - 전달 인덱스 복합 키</li>
 *   <li>{@link com.ryuqq.messenger.adapter.mvstore.DeliveryKeyType} - 복합 키 직렬화 DataType</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-mvstore (MvStoreMessengerStore)
 *   ↓ implements
 * core/spi (MessengerStore)
 *   ↓ depends on
 * core/model (User, Group, Message, Recipient)
 * </pre>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
package com.ryuqq.messenger.adapter.mvstore;
