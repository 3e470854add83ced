package com.watchwise.backend.restriction.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.restriction")
public class RestrictionProperties {

    /** daily limit given to an app the parent chose to monitor from a detection */
    private Duration newAppDefaultLimit = Duration.ofHours(2);

    /** zone for the daily reset when neither the device nor the record has one */
    private String defaultTimezone = "UTC";

    public Duration getNewAppDefaultLimit() { return newAppDefaultLimit; }
    public void setNewAppDefaultLimit(Duration newAppDefaultLimit) { this.newAppDefaultLimit = newAppDefaultLimit; }

    public String getDefaultTimezone() { return defaultTimezone; }
    public void setDefaultTimezone(String defaultTimezone) { this.defaultTimezone = defaultTimezone; }
}
