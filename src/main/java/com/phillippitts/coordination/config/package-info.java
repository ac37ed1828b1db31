/**
 * Application-wide configuration beans and properties.
 *
 * <p>{@link com.phillippitts.coordination.config.CoordinationConfig} wires the engine from the
 * {@code coordination.*} properties bound in {@code config.properties}.
 *
 * @since 1.0
 */
package com.phillippitts.coordination.config;
