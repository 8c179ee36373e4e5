package com.calcron.infrastructure.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;

@Component
@ConfigurationProperties(prefix = "calcron.calendar")
@Validated
public class CalendarProperties {

    private String baseUrl = "https://www.googleapis.com/";
    private String calendarId;
    private String apiKey;
    private String accessToken;
    /**
     * Zone for all-day events that carry no zone of their own. Falls back to the calendar's zone, then UTC.
     */
    private String timeZone;
    @Min(1)
    private int maxResults = 250;
    @Min(1)
    private int maxPages = 100;
    /**
     * Script invoked as {@code <wrapper> start end summary location description}. Unset means the
     * description itself is the command.
     */
    private String actionWrapper;
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getCalendarId() {
        return calendarId;
    }

    public void setCalendarId(String calendarId) {
        this.calendarId = calendarId;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(int maxResults) {
        this.maxResults = maxResults;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public void setMaxPages(int maxPages) {
        this.maxPages = maxPages;
    }

    public String getActionWrapper() {
        return actionWrapper;
    }

    public void setActionWrapper(String actionWrapper) {
        this.actionWrapper = actionWrapper;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    @AssertTrue(message = "time-zone must be a known zone id")
    public boolean isTimeZoneKnown() {
        if (timeZone == null || timeZone.isBlank()) {
            return true;
        }
        try {
            ZoneId.of(timeZone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }
}
