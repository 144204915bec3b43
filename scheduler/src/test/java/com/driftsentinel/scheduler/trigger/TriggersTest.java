package com.driftsentinel.scheduler.trigger;

import com.driftsentinel.core.config.ConfigValidationException;
import com.driftsentinel.core.config.ModelDriftConfig;
import com.driftsentinel.core.config.ScheduleInterval;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TriggersTest {

    // 2024-03-06 is a Wednesday
    private static final ZonedDateTime START = ZonedDateTime.of(2024, 3, 6, 10, 17, 30, 0, ZoneId.of("UTC"));

    @Test
    @DisplayName("HOURLY fires every hour counted from the anchor")
    void hourly() {
        Trigger trigger = Triggers.forConfig(config(ScheduleInterval.HOURLY, null), START);

        assertThat(trigger).isInstanceOf(FixedIntervalTrigger.class);
        assertThat(trigger.nextFireTime(START)).contains(START.plusHours(1));
        assertThat(trigger.nextFireTime(START.plusHours(1))).contains(START.plusHours(2));
        // a slow check does not shift later fires
        assertThat(trigger.nextFireTime(START.plusHours(1).plusMinutes(40))).contains(START.plusHours(2));
    }

    @Test
    @DisplayName("DAILY fires at the next midnight")
    void daily() {
        Trigger trigger = Triggers.forConfig(config(ScheduleInterval.DAILY, null), START);

        assertThat(trigger.nextFireTime(START)).contains(START.toLocalDate().plusDays(1).atStartOfDay(START.getZone()));
        ZonedDateTime midnight = START.toLocalDate().atStartOfDay(START.getZone());
        assertThat(trigger.nextFireTime(midnight)).contains(midnight.plusDays(1));
    }

    @Test
    @DisplayName("WEEKLY fires at the next Monday midnight")
    void weekly() {
        Trigger trigger = Triggers.forConfig(config(ScheduleInterval.WEEKLY, null), START);
        ZonedDateTime monday = ZonedDateTime.of(2024, 3, 11, 0, 0, 0, 0, ZoneId.of("UTC"));

        assertThat(trigger.nextFireTime(START)).contains(monday);
        assertThat(trigger.nextFireTime(monday)).contains(monday.plusWeeks(1));
    }

    @Test
    @DisplayName("CUSTOM uses the cron expression")
    void custom() {
        Trigger trigger = Triggers.forConfig(config(ScheduleInterval.CUSTOM, "30 */6 * * *"), START);

        assertThat(trigger).isInstanceOf(CronTrigger.class);
        assertThat(trigger.nextFireTime(START)).contains(START.withHour(12).withMinute(30).withSecond(0));
        assertThat(trigger.describe()).contains("30 */6 * * *");
    }

    @Test
    @DisplayName("A cron expression that never fires is rejected")
    void cronThatNeverFires() {
        assertThatThrownBy(() -> Triggers.forConfig(config(ScheduleInterval.CUSTOM, "0 0 31 2 *"), START))
                .isInstanceOf(ConfigValidationException.class)
                .hasMessageContaining("never fires");
    }

    @Test
    @DisplayName("A fixed interval must be positive")
    void intervalMustBePositive() {
        assertThatThrownBy(() -> new FixedIntervalTrigger(Duration.ZERO, START))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---- Helpers ----

    private static ModelDriftConfig config(ScheduleInterval interval, String cron) {
        ModelDriftConfig config = new ModelDriftConfig("m", "1", interval);
        config.setScheduleCron(cron);
        return config;
    }
}
