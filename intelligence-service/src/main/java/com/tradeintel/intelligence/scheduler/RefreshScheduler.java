package com.tradeintel.intelligence.scheduler;

import com.tradeintel.intelligence.service.LedgerService;
import com.tradeintel.intelligence.service.RecomputeService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Two independent background loops:
 * <pre>
 *   nightly:  delay(until refresh-time UTC) → full refresh → repeat
 *   poll:     delay(ledger-poll-seconds) → compare ledger fingerprint → mark stale on change → repeat
 * </pre>
 * Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the next one.
 * Neither loop ever stops: failures are logged and the next cycle is scheduled as usual.
 */
@Component
public class RefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(RefreshScheduler.class);

    private final RecomputeService recomputeService;
    private final LedgerService ledgerService;

    @Value("${intelligence.scheduler.enabled:true}")
    private boolean enabled;

    @Value("${intelligence.scheduler.refresh-time:02:00}")
    private String refreshTime;

    @Value("${intelligence.scheduler.ledger-poll-seconds:60}")
    private long ledgerPollSeconds;

    public RefreshScheduler(RecomputeService recomputeService, LedgerService ledgerService) {
        this.recomputeService = recomputeService;
        this.ledgerService    = ledgerService;
    }

    @PostConstruct
    public void start() {
        if (!enabled) {
            log.info("Refresh scheduler disabled");
            return;
        }
        LocalTime at = LocalTime.parse(refreshTime);
        Duration poll = Duration.ofSeconds(Math.max(1, ledgerPollSeconds));
        log.info("Refresh scheduler started. refreshTime={}Z ledgerPollSeconds={}", at, poll.toSeconds());
        scheduleNightly(at);
        schedulePoll(poll);
    }

    /** Time from {@code now} to the next occurrence of {@code at} (UTC); a full day when exactly on it. */
    static Duration delayUntilNext(LocalTime at, Instant now) {
        ZonedDateTime current = now.atZone(ZoneOffset.UTC);
        ZonedDateTime next = current.toLocalDate().atTime(at).atZone(ZoneOffset.UTC);
        if (!next.isAfter(current)) {
            next = next.plusDays(1);
        }
        return Duration.between(current, next);
    }

    // ── nightly refresh ───────────────────────────────────────────────────────

    private void scheduleNightly(LocalTime at) {
        Duration delay = delayUntilNext(at, Instant.now());
        log.info("Next scheduled refresh in {} minutes", delay.toMinutes());
        Mono.delay(delay)
            .then(recomputeService.refresh("scheduler"))
            .subscribe(
                result -> {
                    log.info("Scheduled refresh finished. status={} ledgerVersion={} outcomes={}",
                             result.status(), result.ledgerVersion(), result.outcomesRead());
                    scheduleNightly(at);
                },
                err -> {
                    log.error("Scheduled refresh failed; will retry at next window", err);
                    scheduleNightly(at);
                });
    }

    // ── ledger change detection ───────────────────────────────────────────────

    private void schedulePoll(Duration interval) {
        Mono.delay(interval)
            .then(ledgerService.detectExternalWrites())
            .defaultIfEmpty(false)
            .subscribe(
                changed -> schedulePoll(interval),
                err -> {
                    log.warn("Ledger fingerprint poll failed. reason={}", err.getMessage());
                    schedulePoll(interval);
                });
    }
}
