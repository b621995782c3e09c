/**
 * The continuous scoring loop and its observable state.
 *
 * @since 1.0.0
 */
package com.bridgesentinel.pipeline.scoring;
