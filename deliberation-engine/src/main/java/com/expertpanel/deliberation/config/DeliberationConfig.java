package com.expertpanel.deliberation.config;

import com.expertpanel.common.consensus.ConsensusEvaluator;
import com.expertpanel.common.consensus.OverlapConsensusStrategy;
import com.expertpanel.deliberation.coordinator.CoordinatorAgent;
import com.expertpanel.deliberation.coordinator.LlmCoordinatorAgent;
import com.expertpanel.deliberation.generation.AnthropicGenerationBackend;
import com.expertpanel.deliberation.generation.GenerationBackend;
import com.expertpanel.deliberation.generation.GenerationSettings;
import com.expertpanel.deliberation.imaging.CaptionServiceImagingTool;
import com.expertpanel.deliberation.imaging.ImagingTool;
import com.expertpanel.deliberation.recovery.ResponseRecovery;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class DeliberationConfig {

    /** Full-strength model used for both roles unless overridden. */
    public static final String DEFAULT_MODEL = "claude-sonnet-4-6";

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${anthropic.connect-timeout-ms:10000}")
    private int connectTimeoutMs;

    @Value("${anthropic.response-timeout-ms:60000}")
    private long responseTimeoutMs;

    @Value("${deliberation.experts.model:" + DEFAULT_MODEL + "}")
    private String expertModel;

    @Value("${deliberation.experts.max-tokens:700}")
    private int expertMaxTokens;

    @Value("${deliberation.experts.temperature:0.7}")
    private double expertTemperature;

    @Value("${deliberation.coordinator.model:" + DEFAULT_MODEL + "}")
    private String coordinatorModel;

    @Value("${deliberation.coordinator.max-tokens:600}")
    private int coordinatorMaxTokens;

    @Value("${deliberation.coordinator.temperature:0.3}")
    private double coordinatorTemperature;

    @Value("${deliberation.summary.model:" + DEFAULT_MODEL + "}")
    private String summaryModel;

    @Value("${deliberation.summary.max-tokens:800}")
    private int summaryMaxTokens;

    @Value("${deliberation.summary.temperature:0.3}")
    private double summaryTemperature;

    @Value("${imaging.base-url:}")
    private String imagingBaseUrl;

    @Value("${imaging.timeout-ms:20000}")
    private long imagingTimeoutMs;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ConsensusEvaluator consensusEvaluator() {
        return new OverlapConsensusStrategy();
    }

    @Bean
    public WebClient anthropicClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs)
            .responseTimeout(Duration.ofMillis(responseTimeoutMs));

        return builder
            .baseUrl(anthropicBaseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public GenerationBackend expertGenerationBackend(@Qualifier("anthropicClient") WebClient anthropicClient,
                                                     ObjectMapper objectMapper) {
        return new AnthropicGenerationBackend(anthropicClient, objectMapper, anthropicApiKey,
            new GenerationSettings(expertModel, expertMaxTokens, expertTemperature));
    }

    @Bean
    public GenerationBackend coordinatorGenerationBackend(@Qualifier("anthropicClient") WebClient anthropicClient,
                                                          ObjectMapper objectMapper) {
        return new AnthropicGenerationBackend(anthropicClient, objectMapper, anthropicApiKey,
            new GenerationSettings(coordinatorModel, coordinatorMaxTokens, coordinatorTemperature));
    }

    @Bean
    public GenerationBackend summaryGenerationBackend(@Qualifier("anthropicClient") WebClient anthropicClient,
                                                      ObjectMapper objectMapper) {
        return new AnthropicGenerationBackend(anthropicClient, objectMapper, anthropicApiKey,
            new GenerationSettings(summaryModel, summaryMaxTokens, summaryTemperature));
    }

    @Bean
    public CoordinatorAgent coordinatorAgent(@Qualifier("coordinatorGenerationBackend") GenerationBackend backend,
                                             ResponseRecovery recovery) {
        return new LlmCoordinatorAgent(backend, recovery);
    }

    @Bean
    public WebClient imagingClient(WebClient.Builder builder) {
        String baseUrl = imagingBaseUrl.isBlank() ? "http://localhost" : imagingBaseUrl;
        return builder.baseUrl(baseUrl).build();
    }

    @Bean
    public ImagingTool imagingTool(@Qualifier("imagingClient") WebClient imagingClient, ObjectMapper objectMapper) {
        return new CaptionServiceImagingTool(imagingClient, objectMapper, !imagingBaseUrl.isBlank(),
                                             Duration.ofMillis(imagingTimeoutMs));
    }
}
