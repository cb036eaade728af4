package com.expertpanel.deliberation.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EmergencyCheckResponse(
    @JsonProperty("emergency")       boolean emergency,
    @JsonProperty("matchedKeywords") List<String> matchedKeywords
) {}
