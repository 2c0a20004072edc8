package com.tradeintel.common.performance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradeintel.common.model.EngineMetrics;

import java.util.List;

/**
 * Output of one grouping run. {@code excluded} counts closed rows that lacked the grouping
 * field and were left out of this grouping only.
 */
public record GroupedMetrics(
    @JsonProperty("groupBy")  GroupingKey         groupBy,
    @JsonProperty("groups")   List<EngineMetrics> groups,
    @JsonProperty("excluded") int                 excluded
) {}
