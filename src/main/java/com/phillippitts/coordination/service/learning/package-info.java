/**
 * Execution event log, pattern learning and cached analytics.
 */
package com.phillippitts.coordination.service.learning;
