package com.gamecatalog.dumpimport.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.igdb.requests-per-second:4.0}") // provider allows 4 requests per second
    private double requestsPerSecond;

    @Bean("dumpApiRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter dumpApiRateLimiter() {
        double effectiveQps = requestsPerSecond > 0 ? requestsPerSecond : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
