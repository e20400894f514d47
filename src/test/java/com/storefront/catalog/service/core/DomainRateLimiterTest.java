package com.storefront.catalog.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DomainRateLimiterTest {

    private VirtualTimeScheduler clock;

    private DomainRateLimiter limiter;

    private long start;

    @BeforeEach
    void setUp() {
        clock = VirtualTimeScheduler.create();
        limiter = new DomainRateLimiter(Duration.ofSeconds(2), clock);
        start = clock.now(TimeUnit.MILLISECONDS);
    }

    private void acquireInto(final String domain, final List<Long> grants) {
        limiter.acquire(domain)
                .doOnSuccess(v -> grants.add(clock.now(TimeUnit.MILLISECONDS) - start))
                .subscribe();
    }

    @Test
    void should_SpaceGrantsOfOneDomain_When_CallersArriveTogether() {
        List<Long> grants = new CopyOnWriteArrayList<>();

        acquireInto("www.nintendo.com", grants);
        acquireInto("www.nintendo.com", grants);
        acquireInto("www.nintendo.com", grants);

        assertThat(grants).containsExactly(0L);
        clock.advanceTimeBy(Duration.ofMillis(1999));
        assertThat(grants).containsExactly(0L);
        clock.advanceTimeBy(Duration.ofSeconds(3));
        assertThat(grants).containsExactly(0L, 2000L, 4000L);
    }

    @Test
    void should_NotDelay_When_DomainsDiffer() {
        List<Long> grants = new CopyOnWriteArrayList<>();

        acquireInto("www.nintendo.com", grants);
        acquireInto("store.steampowered.com", grants);

        assertThat(grants).containsExactly(0L, 0L);
    }

    @Test
    void should_CompareDomainsIgnoringCase() {
        List<Long> grants = new CopyOnWriteArrayList<>();

        acquireInto("www.nintendo.com", grants);
        acquireInto("WWW.Nintendo.COM", grants);
        clock.advanceTimeBy(Duration.ofSeconds(2));

        assertThat(grants).containsExactly(0L, 2000L);
    }

    @Test
    void should_GrantImmediately_When_IntervalHasElapsed() {
        List<Long> grants = new CopyOnWriteArrayList<>();

        acquireInto("www.nintendo.com", grants);
        clock.advanceTimeBy(Duration.ofSeconds(5));
        acquireInto("www.nintendo.com", grants);

        assertThat(grants).containsExactly(0L, 5000L);
    }

    @Test
    void should_ReserveOnSubscriptionOnly() {
        List<Long> grants = new CopyOnWriteArrayList<>();

        limiter.acquire("www.nintendo.com");
        limiter.acquire("www.nintendo.com");
        acquireInto("www.nintendo.com", grants);

        assertThat(grants).containsExactly(0L);
    }

    @Test
    void should_KeepReservedSlot_When_WaiterIsCancelled() {
        List<Long> grants = new CopyOnWriteArrayList<>();

        acquireInto("www.nintendo.com", grants);
        Disposable cancelled = limiter.acquire("www.nintendo.com").subscribe();
        cancelled.dispose();
        acquireInto("www.nintendo.com", grants);
        clock.advanceTimeBy(Duration.ofSeconds(4));

        assertThat(grants).containsExactly(0L, 4000L);
    }

    @Test
    void should_CompleteAtOnce_When_IntervalIsZero() {
        DomainRateLimiter unpaced = new DomainRateLimiter(Duration.ZERO, clock);

        StepVerifier.create(unpaced.acquire("www.nintendo.com").then(unpaced.acquire("www.nintendo.com")))
                .verifyComplete();
    }
}
