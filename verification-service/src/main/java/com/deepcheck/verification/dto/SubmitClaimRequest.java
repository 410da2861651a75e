package com.deepcheck.verification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SubmitClaimRequest(
    @JsonProperty("text")          String text,
    @JsonProperty("sourceUrl")     String sourceUrl,
    @JsonProperty("audienceLevel") String audienceLevel
) {}
