/**
 * Domain model classes for Bridge Sentinel.
 *
 * <ul>
 * <li>{@link com.bridgesentinel.core.model.SensorReading}: a full source row
 * as inserted into the store</li>
 * <li>{@link com.bridgesentinel.core.model.TelemetryRecord}: a stored record
 * as seen by the scoring loop</li>
 * <li>{@link com.bridgesentinel.core.model.Outcome} and
 * {@link com.bridgesentinel.core.model.OutcomeUpdate}: scoring results</li>
 * <li>{@link com.bridgesentinel.core.model.SplitBoundary}: training/replay
 * split of the historical dataset</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.bridgesentinel.core.model;
