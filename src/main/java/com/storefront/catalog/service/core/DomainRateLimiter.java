package com.storefront.catalog.service.core;

import com.storefront.catalog.config.CatalogProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <h2>DomainRateLimiter</h2>
 *
 * <p>Spaces requests to the same network domain by at least a fixed
 * interval. Each subscriber to {@link #acquire(String)} reserves the next free
 * slot of its domain under a single lock and then waits for that slot on a
 * Reactor timer, so no thread is parked while waiting.</p>
 *
 * <ul>
 *   <li>Slots of one domain are handed out first-come-first-served.</li>
 *   <li>Different domains never wait for each other.</li>
 *   <li>Acquisition never fails, it only delays.</li>
 * </ul>
 */
@Slf4j
@Component
public class DomainRateLimiter {

    private final long intervalMillis;

    private final Scheduler scheduler;

    private final ReentrantLock lock = new ReentrantLock();

    /** domain → earliest instant (scheduler millis) of the next grant; guarded by {@link #lock} */
    private final Map<String, Long> nextAllowed = new HashMap<>();

    @Autowired
    public DomainRateLimiter(final CatalogProperties properties) {
        this(properties.getRateLimit().getMinInterval(), Schedulers.parallel());
    }

    /**
     * @param minInterval minimum spacing between two grants of the same domain; zero disables pacing
     * @param scheduler   source of the clock and of the timer
     */
    public DomainRateLimiter(final Duration minInterval, final Scheduler scheduler) {
        if (minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative: " + minInterval);
        }
        this.intervalMillis = minInterval.toMillis();
        this.scheduler = scheduler;
    }

    /**
     * Completes once the caller may send a request to {@code domain}.
     * The slot is reserved on subscription, not on assembly.
     *
     * @param domain host name, compared ignoring case
     * @return an empty {@link Mono} completing at the granted instant
     */
    public Mono<Void> acquire(final String domain) {
        if (intervalMillis == 0) {
            return Mono.empty();
        }
        String key = domain == null ? "" : domain.toLowerCase(Locale.ROOT);
        return Mono.defer(() -> {
            long waitMillis = reserve(key);
            if (waitMillis <= 0) {
                return Mono.empty();
            }
            log.trace("Rate limit {}: waiting {} ms", key, waitMillis);
            return Mono.delay(Duration.ofMillis(waitMillis), scheduler).then();
        });
    }

    private long reserve(final String key) {
        lock.lock();
        try {
            long now = scheduler.now(TimeUnit.MILLISECONDS);
            long grant = Math.max(now, nextAllowed.getOrDefault(key, now));
            nextAllowed.put(key, grant + intervalMillis);
            return grant - now;
        } finally {
            lock.unlock();
        }
    }
}
