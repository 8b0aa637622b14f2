/**
 * Manifest scheduling: upsert by external id, batch scheduling with prune, dependent manifests.
 *
 * <p>Every operation runs inside one {@link com.ryuqq.railway.core.spi.DataContextTransaction}; an exception
 * leaves no partial batch behind.</p>
 */
package com.ryuqq.railway.application.scheduler;
