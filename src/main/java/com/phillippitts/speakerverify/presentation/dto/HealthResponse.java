package com.phillippitts.speakerverify.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.speakerverify.domain.RequestRecord;
import com.phillippitts.speakerverify.service.stats.RequestStatsCollector;

import java.util.List;

/**
 * Response of {@code GET /health}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("model") String model,
        @JsonProperty("device") String device,
        @JsonProperty("model_loaded") boolean modelLoaded,
        @JsonProperty("model_state") String modelState,
        @JsonProperty("load_attempts") int loadAttempts,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("uptime_seconds") long uptimeSeconds,
        @JsonProperty("stats") Stats stats,
        @JsonProperty("recent_requests") List<RecentRequest> recentRequests
) {

    public record Stats(
            @JsonProperty("total_requests") long totalRequests,
            @JsonProperty("success_requests") long successRequests,
            @JsonProperty("failed_requests") long failedRequests,
            @JsonProperty("success_rate") double successRate,
            @JsonProperty("avg_response_time_ms") double avgResponseTimeMs,
            @JsonProperty("uptime_seconds") long uptimeSeconds
    ) {
        public static Stats from(RequestStatsCollector.Snapshot s) {
            return new Stats(s.totalRequests(), s.successRequests(), s.failedRequests(),
                    s.successRate(), s.avgResponseTimeMs(), s.uptimeSeconds());
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RecentRequest(
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("endpoint") String endpoint,
            @JsonProperty("duration_ms") long durationMs,
            @JsonProperty("success") boolean success,
            @JsonProperty("error") String error,
            @JsonProperty("client") String client
    ) {
        public static RecentRequest from(RequestRecord r) {
            return new RecentRequest(r.timestamp().toString(), r.endpoint(), r.duration().toMillis(),
                    r.success(), r.error(), r.clientIdentity());
        }
    }
}
