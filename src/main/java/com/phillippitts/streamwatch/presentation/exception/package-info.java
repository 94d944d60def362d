/**
 * Exception-to-HTTP mapping for the REST API.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@link com.phillippitts.streamwatch.exception.ChannelNotFoundException} → 404 Not Found</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.InvalidChannelPatchException}, bad arguments and failed
 *       request validation → 400 Bad Request</li>
 *   <li>{@link com.phillippitts.streamwatch.exception.PersistenceException} → 503 Service Unavailable</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "InvalidChannelPatchException",
 *   "message": "Invalid channel configuration",
 *   "details": "Invalid channel patch field 'colour': unknown field",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 */
package com.phillippitts.streamwatch.presentation.exception;
