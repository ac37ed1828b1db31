/**
 * Service layer of the coordination engine.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.admission} - capacity, busy-window and token-budget checks</li>
 *   <li>{@code service.strategy} - strategy selection by item count and domain spread</li>
 *   <li>{@code service.planning} - dependency-aware batch planning</li>
 *   <li>{@code service.learning} - event log, pattern learning and analytics</li>
 *   <li>{@code service.insight} - insight rules and pattern-based recommendations</li>
 *   <li>{@code service.store} - durable JSON storage of the learning collections</li>
 *   <li>{@code service.orchestration} - the engine facade tying the above together</li>
 * </ul>
 *
 * <p>Services never execute work items. They throw domain exceptions, never HTTP ones, and
 * use constructor injection.
 *
 * @since 1.0
 */
package com.phillippitts.coordination.service;
