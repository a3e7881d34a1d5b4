package io.auditchain.core.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Summary of committed events matching a kind and time range. The daily breakdown (UTC dates)
 * and the sample of entries are only filled in for detailed reports.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditReport(
        @JsonProperty("kind") String kind,
        @JsonProperty("start_time") Long startTime,
        @JsonProperty("end_time") Long endTime,
        @JsonProperty("generated_at") long generatedAt,
        @JsonProperty("total_events") long totalEvents,
        @JsonProperty("counts_by_kind") Map<String, Long> countsByKind,
        @JsonProperty("first_event_at") Long firstEventAt,
        @JsonProperty("last_event_at") Long lastEventAt,
        @JsonProperty("daily_counts") Map<String, Long> dailyCounts,
        @JsonProperty("events") List<AuditEntry> events
) {
    public static final int DETAILED_EVENT_LIMIT = 100;
}
