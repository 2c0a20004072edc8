package com.tradeintel.common.snapshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Single-writer, multi-reader holder of the current {@link IntelligenceSnapshot}.
 *
 * <p>The ledger version is bumped on every ledger write; the snapshot is swapped with a
 * compare-and-set so readers see either the old generation or the new one, never a mix.
 * A snapshot computed from an older ledger version than the installed one is refused.
 */
public class SnapshotCache {

    private final AtomicReference<IntelligenceSnapshot> current = new AtomicReference<>();
    private final AtomicLong ledgerVersion = new AtomicLong();

    /** Records a ledger write. Returns the new version. */
    public long markStale() {
        return ledgerVersion.incrementAndGet();
    }

    public long ledgerVersion() {
        return ledgerVersion.get();
    }

    public Optional<IntelligenceSnapshot> current() {
        return Optional.ofNullable(current.get());
    }

    public DerivedState state() {
        IntelligenceSnapshot snapshot = current.get();
        return snapshot != null && snapshot.ledgerVersion() == ledgerVersion.get()
            ? DerivedState.FRESH
            : DerivedState.STALE;
    }

    /**
     * Installs {@code candidate} after passing it through {@code finisher}, unless a snapshot
     * of a newer ledger version is already installed. {@code finisher} runs inside the CAS
     * loop and may be invoked more than once.
     *
     * @return true when the candidate was installed
     */
    public boolean install(IntelligenceSnapshot candidate, UnaryOperator<IntelligenceSnapshot> finisher) {
        while (true) {
            IntelligenceSnapshot prev = current.get();
            if (prev != null && prev.ledgerVersion() > candidate.ledgerVersion()) {
                return false;
            }
            IntelligenceSnapshot next = finisher.apply(candidate);
            if (current.compareAndSet(prev, next)) {
                return true;
            }
        }
    }

    public boolean install(IntelligenceSnapshot candidate) {
        return install(candidate, UnaryOperator.identity());
    }

    /** Replaces the installed snapshot with a derived copy of itself; no-op when none is installed. */
    public void update(UnaryOperator<IntelligenceSnapshot> fn) {
        current.updateAndGet(s -> s == null ? null : fn.apply(s));
    }
}
