/**
 * Service entry point, JSON export and default logging sinks.
 */
package com.driftsentinel.scheduler.app;
