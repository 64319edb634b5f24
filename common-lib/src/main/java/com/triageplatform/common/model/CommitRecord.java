package com.triageplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CommitRecord(
    @JsonProperty("sha")         String sha,
    @JsonProperty("message")     String message,
    @JsonProperty("diffSummary") String diffSummary
) {
    public static CommitRecord of(String sha, String message, String diffSummary) {
        return new CommitRecord(sha, message, diffSummary);
    }
}
