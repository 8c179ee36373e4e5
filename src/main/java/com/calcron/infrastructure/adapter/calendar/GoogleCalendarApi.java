package com.calcron.infrastructure.adapter.calendar;

import com.calcron.infrastructure.adapter.calendar.dto.GoogleEventListDto;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Path;
import retrofit2.http.Query;

/**
 * Google Calendar v3 events endpoint.
 */
public interface GoogleCalendarApi {

    /**
     * Lists one page of events of a calendar. {@code null} query values are left out of the request.
     *
     * @param calendarId calendar id, e.g. {@code xxxx@group.calendar.google.com}
     * @param timeMin RFC 3339 lower bound on event end time
     * @param timeMax RFC 3339 upper bound on event start time
     * @param singleEvents expand recurring events into their instances
     * @param orderBy {@code startTime} requires {@code singleEvents}
     * @param maxResults page size
     * @param pageToken token of the page to fetch, {@code null} for the first page
     * @param apiKey API key for calendars readable without OAuth, or {@code null}
     * @return A `Call` object encapsulating the HTTP request and response for one page.
     */
    @GET("calendar/v3/calendars/{calendarId}/events")
    Call<GoogleEventListDto> listEvents(
            @Path("calendarId") String calendarId,
            @Query("timeMin") String timeMin,
            @Query("timeMax") String timeMax,
            @Query("singleEvents") boolean singleEvents,
            @Query("orderBy") String orderBy,
            @Query("maxResults") int maxResults,
            @Query("pageToken") String pageToken,
            @Query("key") String apiKey);
}
