package com.expertpanel.deliberation.imaging;

import reactor.core.publisher.Mono;

/**
 * Turns an uploaded image into a text caption. Implementations never error: when captioning
 * is unavailable they emit a generic demo caption so the case always has a usable finding.
 */
public interface ImagingTool {

    Mono<String> caption(byte[] image);
}
