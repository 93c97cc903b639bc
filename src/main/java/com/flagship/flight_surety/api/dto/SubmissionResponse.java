package com.flagship.flight_surety.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.flight_surety.oracle.SubmissionResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SubmissionResponse {

    @JsonProperty("counted")
    boolean counted;

    @JsonProperty("report_count")
    int reportCount;

    @JsonProperty("resolved")
    boolean resolved;

    @JsonProperty("resolved_status")
    String resolvedStatus;

    public static SubmissionResponse from(SubmissionResult result) {
        return SubmissionResponse.builder()
            .counted(result.isCounted())
            .reportCount(result.getReportCount())
            .resolved(result.isResolved())
            .resolvedStatus(result.isResolved() ? result.getResolvedStatus().name() : null)
            .build();
    }
}
