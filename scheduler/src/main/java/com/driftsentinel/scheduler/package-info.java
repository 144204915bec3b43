/**
 * Scheduled drift monitoring: the {@link com.driftsentinel.scheduler.DriftScheduler},
 * its bounded execution history and the result types it reports.
 */
package com.driftsentinel.scheduler;
