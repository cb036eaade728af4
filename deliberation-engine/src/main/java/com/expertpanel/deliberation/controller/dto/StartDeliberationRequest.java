package com.expertpanel.deliberation.controller.dto;

import com.expertpanel.common.model.CaseContext;
import com.expertpanel.deliberation.intake.IntakeAnswers;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/v1/deliberations.
 *
 * <p>Supply either a ready {@code caseContext} or raw {@code intake} answers; when both are
 * present the case context wins. {@code imageBase64} is optional.
 */
public record StartDeliberationRequest(
    @JsonProperty("sessionId")   String sessionId,
    @JsonProperty("maxRounds")   Integer maxRounds,
    @JsonProperty("caseContext") CaseContext caseContext,
    @JsonProperty("intake")      IntakeAnswers intake,
    @JsonProperty("imageBase64") String imageBase64
) {}
