/**
 * PostgreSQL-backed record store.
 */
package com.bridgesentinel.pipeline.store;
