package com.tradeintel.intelligence.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/** Operator-set weight for one signal. Written through an UPSERT; survives restarts. */
@Data
@NoArgsConstructor
@Table("signal_weight_overrides")
public class SignalWeightOverride {

    @Id
    private String signalName;

    private double overrideWeight;

    private String reason;

    private Instant updatedAt;
}
