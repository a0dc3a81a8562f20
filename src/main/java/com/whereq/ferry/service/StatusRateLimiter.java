package com.whereq.ferry.service;

import com.google.common.util.concurrent.RateLimiter;
import com.whereq.ferry.config.FerryProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Shared gate for status queries, all pollers draw from the same budget
 */
@Slf4j
@Component
public class StatusRateLimiter {

    private final RateLimiter rateLimiter;

    @Autowired
    public StatusRateLimiter(FerryProperties properties) {
        this(properties.getStatus().getQueriesPerSecond());
    }

    public StatusRateLimiter(double queriesPerSecond) {
        if (queriesPerSecond <= 0) {
            throw new IllegalArgumentException("queriesPerSecond must be positive, was " + queriesPerSecond);
        }
        this.rateLimiter = RateLimiter.create(queriesPerSecond);
    }

    /**
     * Block until a status query may be issued
     */
    public void acquire() {
        double waited = rateLimiter.acquire();
        if (waited > 0) {
            log.trace("Waited {}s for a status query permit", waited);
        }
    }

    public double getRate() {
        return rateLimiter.getRate();
    }
}
