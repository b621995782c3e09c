/**
 * Historical dataset access: CSV reading, seeding the training prefix and
 * replaying the held-back suffix as a live feed.
 *
 * <p>
 * {@link com.bridgesentinel.pipeline.replay.HistoricalSeeder} and
 * {@link com.bridgesentinel.pipeline.replay.FeedProducer} must be given the
 * same split ratio and the same source order.
 * </p>
 *
 * @since 1.0.0
 */
package com.bridgesentinel.pipeline.replay;
