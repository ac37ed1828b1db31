/**
 * Presentation layer (REST API controllers, request DTOs and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - REST endpoints under {@code /api/coordination}</li>
 *   <li>{@code presentation.dto} - request bodies converted to domain types</li>
 *   <li>{@code presentation.exception} - Global exception handling for HTTP responses</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; all decisions and learning live in
 * {@link com.phillippitts.coordination.service.orchestration.CoordinationEngine}.
 *
 * @since 1.0
 */
package com.phillippitts.coordination.presentation;
