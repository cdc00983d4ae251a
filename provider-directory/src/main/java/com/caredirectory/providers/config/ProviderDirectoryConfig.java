package com.caredirectory.providers.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ProviderDirectoryConfig {

    @Bean
    public Clock clock(ProviderDirectoryProperties properties) {
        return Clock.system(ZoneId.of(properties.getScheduling().getZone()));
    }

    @Bean
    public HttpClient feedHttpClient(ProviderDirectoryProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getFeed().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .build();
    }
}
