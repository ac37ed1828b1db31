/**
 * Immutable domain model of the coordination engine.
 *
 * <p>Request side: {@link com.phillippitts.coordination.domain.WorkItem},
 * {@link com.phillippitts.coordination.domain.ResourceBudget} and the resulting
 * {@link com.phillippitts.coordination.domain.CoordinationPlan}. Learning side:
 * {@link com.phillippitts.coordination.domain.CoordinationEvent},
 * {@link com.phillippitts.coordination.domain.Pattern} and
 * {@link com.phillippitts.coordination.domain.Insight}.
 *
 * @since 1.0
 */
package com.phillippitts.coordination.domain;
