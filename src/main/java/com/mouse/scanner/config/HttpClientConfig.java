package com.mouse.scanner.config;

import com.mouse.scanner.interceptor.SimpleHttpLoggingInterceptor;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class HttpClientConfig {

    @Value("${http.connect-timeout-ms:5000}")
    private long connectTimeoutMs;

    @Value("${http.read-timeout-ms:15000}")
    private long readTimeoutMs;

    @Value("${http.max-idle-connections:8}")
    private int maxIdleConnections;

    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(connectTimeoutMs))
                .readTimeout(Duration.ofMillis(readTimeoutMs))
                .connectionPool(new ConnectionPool(maxIdleConnections, 5, TimeUnit.MINUTES))
                .retryOnConnectionFailure(true)
                .addInterceptor(new SimpleHttpLoggingInterceptor())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
