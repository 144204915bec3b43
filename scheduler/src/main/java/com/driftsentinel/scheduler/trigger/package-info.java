/**
 * Fire-time computation for model schedules (fixed interval, daily, weekly, cron).
 */
package com.driftsentinel.scheduler.trigger;
