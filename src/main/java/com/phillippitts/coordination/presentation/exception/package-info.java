/**
 * Global exception handling for REST API responses.
 *
 * <p>Exception Mapping:
 * <ul>
 *   <li>{@code BUSY} → 409 Conflict</li>
 *   <li>{@code OVER_CAPACITY}, {@code BUDGET_EXCEEDED} → 422 Unprocessable Entity</li>
 *   <li>{@code INVALID_COUNT}, invalid request bodies → 400 Bad Request</li>
 *   <li>{@code Exception} (catch-all) → 500 Internal Server Error</li>
 * </ul>
 *
 * <p>Response Format:
 * <pre>
 * {
 *   "errorCode": "BUSY",
 *   "message": "Coordination request rejected",
 *   "details": "Another coordination is already in progress",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * @since 1.0
 */
package com.phillippitts.coordination.presentation.exception;
