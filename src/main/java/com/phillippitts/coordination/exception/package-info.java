/**
 * Coordination-engine exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.coordination.exception.CoordinationException}
 * and expose a {@link com.phillippitts.coordination.exception.CoordinationErrorKind}:
 * <ul>
 *   <li>{@link com.phillippitts.coordination.exception.AdmissionRejectedException} - a request
 *       rejected by admission control, raised only at the REST boundary</li>
 *   <li>{@link com.phillippitts.coordination.exception.PersistenceException} - a collection
 *       could not be written; the engine converts it into a reported failure</li>
 *   <li>{@link com.phillippitts.coordination.exception.InvalidWorkItemException} - malformed input</li>
 * </ul>
 *
 * @see com.phillippitts.coordination.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.coordination.exception;
