/**
 * Error taxonomy.
 *
 * <ul>
 *   <li>Validation errors (invalid username, self message): {@link com.ryuqq.messenger.core.error.ProtocolException}</li>
 *   <li>Referential and permission errors: {@link com.ryuqq.messenger.core.error.StoreException}</li>
 *   <li>Storage engine errors: {@link com.ryuqq.messenger.core.error.StoreException} with
 *       {@link com.ryuqq.messenger.core.error.ErrorCode#STORAGE}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Messenger Team
 */
package com.ryuqq.messenger.core.error;
