package com.tradeintel.common.snapshot;

/**
 * Freshness of the derived tables. There is no partial state: every table is swapped together.
 *
 * <ul>
 *   <li>STALE: the ledger changed since the installed snapshot was computed, or none exists</li>
 *   <li>FRESH: the installed snapshot was computed from the current ledger version</li>
 * </ul>
 */
public enum DerivedState {
    STALE,
    FRESH
}
