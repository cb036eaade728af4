package com.expertpanel.deliberation.generation;

/** Per-role model parameters for the generation backend. */
public record GenerationSettings(String model, int maxTokens, double temperature) {}
