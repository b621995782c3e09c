/**
 * Process entry points and their runtime plumbing.
 *
 * <ul>
 * <li>{@link com.bridgesentinel.pipeline.SeedJob}: load the training prefix</li>
 * <li>{@link com.bridgesentinel.pipeline.TrainingJob}: training dry run</li>
 * <li>{@link com.bridgesentinel.pipeline.ScoringJob}: train, then score
 * continuously</li>
 * <li>{@link com.bridgesentinel.pipeline.ReplayJob}: replay the held-back
 * suffix as a live feed</li>
 * </ul>
 *
 * <p>
 * All jobs are configured by {@link com.bridgesentinel.pipeline.JobSettings}
 * and stop cooperatively through a
 * {@link com.bridgesentinel.pipeline.ShutdownSignal}.
 * </p>
 *
 * @since 1.0.0
 */
package com.bridgesentinel.pipeline;
