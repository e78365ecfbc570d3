/**
 * Client/server wire protocol.
 *
 * <p>Two sealed families, one record per request or event kind:</p>
 * <ul>
 *   <li>{@link com.ryuqq.messenger.core.protocol.ClientMessage} - requests sent by clients</li>
 *   <li>{@link com.ryuqq.messenger.core.protocol.ServerMessage} - replies and pushed events</li>
 * </ul>
 *
 * <p>One encoded value per transport message; the byte encoding is provided by a
 * {@link com.ryuqq.messenger.core.spi.FrameCodec} adapter.</p>
 *
 * @since 1.0.0
 * @author Messenger Team
 */
package com.ryuqq.messenger.core.protocol;
