package com.tradeintel.intelligence.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeintel.common.exception.RecomputeException;

import java.time.Instant;

/**
 * Outcome of a full refresh.
 *
 * <ul>
 *   <li>{@code COMPLETED}  – new snapshot installed</li>
 *   <li>{@code SUPERSEDED} – computed, but a snapshot of a newer ledger version was already installed</li>
 *   <li>{@code FAILED} / {@code ABORTED} – nothing installed; {@code errorKind} and {@code message} set</li>
 * </ul>
 */
public record RefreshResultDTO(
    @JsonProperty("status")           String  status,
    @JsonProperty("trigger")          String  trigger,
    @JsonProperty("ledgerVersion")    long    ledgerVersion,
    @JsonProperty("outcomesRead")     int     outcomesRead,
    @JsonProperty("malformedRecords") int     malformedRecords,
    @JsonProperty("profilesUpdated")  int     profilesUpdated,
    @JsonProperty("engineGroups")     int     engineGroups,
    @JsonProperty("signalsWeighted")  int     signalsWeighted,
    @JsonProperty("durationMs")       long    durationMs,
    @JsonProperty("completedAt")      Instant completedAt,
    @JsonProperty("errorKind")        String  errorKind,
    @JsonProperty("message")          String  message
) {

    public static RefreshResultDTO failed(RecomputeException e) {
        String status = e.getKind() == RecomputeException.Kind.ABORTED ? "ABORTED" : "FAILED";
        return new RefreshResultDTO(status, null, -1, 0, 0, 0, 0, 0, 0L, Instant.now(),
                                    e.getKind().name(), e.getMessage());
    }
}
