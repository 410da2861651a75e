package com.deepcheck.verification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Aggregate counters across both record kinds.
 *
 * @param mediaByStatus    media records per lifecycle status
 * @param claimsByStatus   claim records per lifecycle status
 * @param manipulatedMedia completed media records whose verdict is MANIPULATED
 * @param falseClaims      completed claim records whose verdict is FALSE
 */
public record StatsDTO(
    @JsonProperty("mediaByStatus")    Map<String, Long> mediaByStatus,
    @JsonProperty("claimsByStatus")   Map<String, Long> claimsByStatus,
    @JsonProperty("totalMedia")       long totalMedia,
    @JsonProperty("totalClaims")      long totalClaims,
    @JsonProperty("manipulatedMedia") long manipulatedMedia,
    @JsonProperty("falseClaims")      long falseClaims
) {}
