package com.cecil.assembler.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${assembler.load.max-opens-per-second:0}") // 0 means unthrottled
    private double maxOpensPerSecond;

    @Bean("rasterOpenRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter rasterOpenRateLimiter() {
        return createOptionalLimiter(maxOpensPerSecond);
    }

    private RateLimiter createOptionalLimiter(double qps) {
        double effectiveQps = qps > 0 ? qps : Double.MAX_VALUE;
        return RateLimiter.create(effectiveQps);
    }
}
