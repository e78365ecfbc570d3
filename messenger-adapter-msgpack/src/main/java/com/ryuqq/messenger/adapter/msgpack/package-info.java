/**
 * MessagePack Adapter Layer - FrameCodec 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.messenger.adapter.msgpack.MessagePackFrameCodec} - Jackson + msgpack 기반 프레임 코덱</li>
 * </ul>
 *
 * @author Messenger Team
 * @since 1.0.0
 */
package com.ryuqq.messenger.adapter.msgpack;
