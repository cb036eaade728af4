package com.expertpanel.deliberation.imaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * {@link ImagingTool} calling an external captioning service ({@code POST /caption}, raw image
 * bytes in, {@code {"caption": "..."}} out).
 *
 * <p>Falls back to {@link DemoCaptions} when the service is not configured, the image is
 * empty, the call fails or times out, or the caption comes back blank.
 */
public class CaptionServiceImagingTool implements ImagingTool {

    private static final Logger log = LoggerFactory.getLogger(CaptionServiceImagingTool.class);

    private final WebClient imagingClient;
    private final ObjectMapper objectMapper;
    private final boolean enabled;
    private final Duration timeout;

    public CaptionServiceImagingTool(WebClient imagingClient, ObjectMapper objectMapper,
                                     boolean enabled, Duration timeout) {
        this.imagingClient = imagingClient;
        this.objectMapper = objectMapper;
        this.enabled = enabled;
        this.timeout = timeout;
    }

    @Override
    public Mono<String> caption(byte[] image) {
        if (image == null || image.length == 0) {
            log.warn("[ImagingTool] Empty image, returning demo caption");
            return Mono.just(DemoCaptions.forImage(image));
        }
        if (!enabled) {
            log.warn("[ImagingTool] No captioning service configured, returning demo caption. bytes={}", image.length);
            return Mono.just(DemoCaptions.forImage(image));
        }

        return imagingClient.post()
            .uri("/caption")
            .contentType(MediaType.APPLICATION_OCTET_STREAM)
            .bodyValue(image)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::extractCaption)
            .filter(caption -> !caption.isBlank())
            .switchIfEmpty(Mono.fromSupplier(() -> {
                log.warn("[ImagingTool] Blank caption received, returning demo caption");
                return DemoCaptions.forImage(image);
            }))
            .doOnSuccess(c -> log.info("[ImagingTool] Caption produced. bytes={} chars={}", image.length, c.length()))
            .onErrorResume(e -> {
                log.error("[ImagingTool] Captioning failed, returning demo caption. reason={}", e.getMessage());
                return Mono.just(DemoCaptions.forImage(image));
            });
    }

    private String extractCaption(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            return root.path("caption").asText("");
        } catch (Exception e) {
            throw new IllegalStateException("Failed to read caption response", e);
        }
    }
}
