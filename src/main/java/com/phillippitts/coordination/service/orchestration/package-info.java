/**
 * Engine facade for coordination decisions and outcome learning.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.coordination.service.orchestration.CoordinationEngine} -
 *       admits, selects, plans and recommends; records START/terminal reports and learns
 *       patterns from them</li>
 *   <li>{@link com.phillippitts.coordination.service.orchestration.CoordinationEngineBuilder} -
 *       assembles the engine from its collaborators</li>
 * </ul>
 *
 * <p>Store write failures never undo in-memory updates. They are returned in
 * {@link com.phillippitts.coordination.service.orchestration.ReportResult}, published as
 * {@link com.phillippitts.coordination.service.events.PersistenceFailureEvent} and counted.
 *
 * @since 1.0
 */
package com.phillippitts.coordination.service.orchestration;
