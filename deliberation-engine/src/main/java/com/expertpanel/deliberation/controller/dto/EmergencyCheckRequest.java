package com.expertpanel.deliberation.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EmergencyCheckRequest(
    @JsonProperty("text") String text
) {}
