package com.project.image.bgremover.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/** HTTP client used to fetch model weights from the configured mirrors. */
@Configuration
public class HttpClientConfig {

    @Bean
    public OkHttpClient modelDownloadClient(@Value("${app.model.download-timeout-seconds:30}") long timeoutSeconds) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .followRedirects(true)
                .build();
    }
}
