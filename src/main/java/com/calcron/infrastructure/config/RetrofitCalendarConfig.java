package com.calcron.infrastructure.config;

import com.calcron.infrastructure.adapter.calendar.GoogleCalendarApi;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitCalendarConfig {

    @Bean
    public GoogleCalendarApi googleCalendarApi(CalendarProperties properties) {
        ObjectMapper jsonMapper = new ObjectMapper();
        jsonMapper.registerModule(new JavaTimeModule());
        jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        OkHttpClient.Builder httpClient = new OkHttpClient.Builder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout());

        String accessToken = properties.getAccessToken();
        if (accessToken != null && !accessToken.isBlank()) {
            httpClient.addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                    .header("Authorization", "Bearer " + accessToken)
                    .build()));
        }

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(properties.getBaseUrl())
                .client(httpClient.build())
                .addConverterFactory(JacksonConverterFactory.create(jsonMapper))
                .build();

        return retrofit.create(GoogleCalendarApi.class);
    }
}
