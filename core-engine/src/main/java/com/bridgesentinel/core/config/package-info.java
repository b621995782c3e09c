/**
 * Pipeline configuration loading and validation.
 *
 * <p>
 * The table layout, feature channels and estimator settings are defined in
 * YAML and loaded by
 * {@link com.bridgesentinel.core.config.PipelineConfigLoader} into a
 * {@link com.bridgesentinel.core.config.PipelineConfig} instance. Validation
 * runs right after parsing.
 * </p>
 *
 * @since 1.0.0
 */
package com.bridgesentinel.core.config;
