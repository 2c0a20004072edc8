package com.tradeintel.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeintel.common.snapshot.DerivedState;

import java.time.Instant;

/** Freshness of the derived tables. {@code snapshotVersion} is -1 before the first refresh. */
public record SnapshotStatusDTO(
    @JsonProperty("state")             DerivedState state,
    @JsonProperty("ledgerVersion")     long         ledgerVersion,
    @JsonProperty("snapshotVersion")   long         snapshotVersion,
    @JsonProperty("computedAt")        Instant      computedAt,
    @JsonProperty("refreshInProgress") boolean      refreshInProgress
) {}
