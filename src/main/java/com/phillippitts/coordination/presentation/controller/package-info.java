/**
 * REST API controllers for HTTP endpoints.
 *
 * <p>Current Endpoints ({@link com.phillippitts.coordination.presentation.controller.CoordinationController}):
 * <ul>
 *   <li>{@code POST /api/coordination/plans} - admit, select and plan a request</li>
 *   <li>{@code GET  /api/coordination/admission} and {@code /batching} - side-effect-free checks</li>
 *   <li>{@code POST /api/coordination/events/{id}/start|complete|timeout} - lifecycle reports</li>
 *   <li>{@code POST /api/coordination/windows/{id}/close} - release a window without reporting</li>
 *   <li>{@code GET  /api/coordination/analytics}, {@code /insights}, {@code /recommendations}</li>
 * </ul>
 *
 * @see com.phillippitts.coordination.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.coordination.presentation.controller;
