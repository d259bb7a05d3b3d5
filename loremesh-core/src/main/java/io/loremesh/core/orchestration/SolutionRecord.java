package io.loremesh.core.orchestration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SolutionRecord(
    Instant timestamp,
    @JsonProperty("problem_text") String problemText,
    @JsonProperty("problem_type") String problemType,
    @JsonProperty("solved_by") String solvedBy,
    SolutionStatus status
) {
    public SolutionRecord {
        problemText = problemText == null ? "" : problemText;
        problemType = problemType == null ? "" : problemType;
        solvedBy = solvedBy == null ? "" : solvedBy;
        status = status == null ? SolutionStatus.FAILED : status;
    }
}
