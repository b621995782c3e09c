/**
 * Record store contract and the in-memory implementation.
 *
 * <p>
 * {@link com.bridgesentinel.core.store.RecordStore} is the only shared
 * mutable resource of the pipeline. The scoring loop is its only writer of
 * outcomes; the feed producer and the seeder are its only writers of new
 * records.
 * </p>
 *
 * @since 1.0.0
 */
package com.bridgesentinel.core.store;
