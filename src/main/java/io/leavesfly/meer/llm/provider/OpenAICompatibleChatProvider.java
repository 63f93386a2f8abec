package io.leavesfly.meer.llm.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.leavesfly.meer.config.LLMProviderConfig;
import io.leavesfly.meer.exception.ProviderException;
import io.leavesfly.meer.llm.ChatProvider;
import io.leavesfly.meer.llm.RateLimiter;
import io.leavesfly.meer.llm.message.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.util.List;

/**
 * OpenAI 兼容 Chat Provider
 * 支持 OpenAI、DeepSeek、Ollama、OpenRouter 等兼容 /chat/completions 的服务
 */
@Slf4j
public class OpenAICompatibleChatProvider implements ChatProvider {

    private static final String DONE_MARKER = "[DONE]";

    private final String modelName;
    private final String providerName;
    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final RateLimiter rateLimiter;
    private final Double temperature;
    private final Integer maxTokens;

    public OpenAICompatibleChatProvider(String modelName,
                                        String providerName,
                                        LLMProviderConfig providerConfig,
                                        ObjectMapper objectMapper,
                                        Double temperature,
                                        Integer maxTokens) {
        this(modelName, providerName, buildWebClient(providerConfig), objectMapper,
                providerConfig.getRateLimit() != null ? new RateLimiter(providerConfig.getRateLimit()) : null,
                temperature, maxTokens);
        log.info("Created {} ChatProvider: model={}, baseUrl={}", providerName, modelName, providerConfig.resolveBaseUrl());
    }

    private OpenAICompatibleChatProvider(String modelName,
                                         String providerName,
                                         WebClient webClient,
                                         ObjectMapper objectMapper,
                                         RateLimiter rateLimiter,
                                         Double temperature,
                                         Integer maxTokens) {
        this.modelName = modelName;
        this.providerName = providerName;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    private static WebClient buildWebClient(LLMProviderConfig providerConfig) {
        // 使用 JVM 原生 DNS 解析，避免 Netty 解析器在部分内网环境下失败
        HttpClient httpClient = HttpClient.create()
                .resolver(spec -> spec.completeOncePreferredResolved(true));

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(providerConfig.resolveBaseUrl())
                .defaultHeader("Content-Type", "application/json");

        if (providerConfig.getApiKey() != null && !providerConfig.getApiKey().isEmpty()) {
            builder.defaultHeader("Authorization", "Bearer " + providerConfig.getApiKey());
        }
        if (providerConfig.getCustomHeaders() != null) {
            providerConfig.getCustomHeaders().forEach(builder::defaultHeader);
        }
        return builder.build();
    }

    @Override
    public String getModelName() {
        return modelName;
    }

    @Override
    public ChatProvider withTemperature(Double temperature) {
        if (temperature == null || temperature.equals(this.temperature)) {
            return this;
        }
        return new OpenAICompatibleChatProvider(modelName, providerName, webClient, objectMapper,
                rateLimiter, temperature, maxTokens);
    }

    @Override
    public Mono<String> chat(List<Message> history) {
        return acquirePermit()
                .then(Mono.defer(() -> webClient.post()
                        .uri("/chat/completions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(buildRequestBody(history, false))
                        .retrieve()
                        .bodyToMono(JsonNode.class)
                        .map(this::parseResponse)))
                .onErrorMap(this::toProviderException);
    }

    @Override
    public Flux<String> stream(List<Message> history) {
        return acquirePermit()
                .thenMany(Flux.defer(() -> webClient.post()
                        .uri("/chat/completions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(buildRequestBody(history, true))
                        .retrieve()
                        .bodyToFlux(String.class)))
                .map(this::stripSsePrefix)
                .filter(data -> !data.isEmpty() && !DONE_MARKER.equals(data))
                .concatMap(data -> {
                    // 单个块解析失败时跳过，不中断整个流
                    try {
                        return Mono.justOrEmpty(parseStreamChunk(data));
                    } catch (Exception e) {
                        log.warn("Failed to parse stream chunk, skipping: {}", data, e);
                        return Mono.empty();
                    }
                })
                .onErrorMap(this::toProviderException);
    }

    private Mono<Void> acquirePermit() {
        return rateLimiter != null ? rateLimiter.acquire() : Mono.empty();
    }

    ObjectNode buildRequestBody(List<Message> history, boolean stream) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", modelName);
        body.put("stream", stream);
        if (temperature != null) {
            body.put("temperature", temperature);
        }
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }

        ArrayNode messages = body.putArray("messages");
        for (Message msg : history) {
            ObjectNode node = messages.addObject();
            node.put("role", msg.getRole().getValue());
            node.put("content", msg.getContent());
        }
        return body;
    }

    private String stripSsePrefix(String line) {
        String trimmed = line.trim();
        if (trimmed.startsWith("data:")) {
            return trimmed.substring(5).trim();
        }
        return trimmed;
    }

    String parseResponse(JsonNode response) {
        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ProviderException(providerName + " returned no choices");
        }
        return choices.get(0).path("message").path("content").asText("");
    }

    String parseStreamChunk(String data) throws Exception {
        JsonNode chunk = objectMapper.readTree(data);
        JsonNode choices = chunk.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return null;
        }
        JsonNode content = choices.get(0).path("delta").path("content");
        if (content.isMissingNode() || content.isNull()) {
            return null;
        }
        String text = content.asText();
        return text.isEmpty() ? null : text;
    }

    private Throwable toProviderException(Throwable e) {
        if (e instanceof ProviderException) {
            return e;
        }
        if (e instanceof WebClientResponseException webEx) {
            log.error("{} API error: status={}, body={}",
                    providerName, webEx.getStatusCode(), webEx.getResponseBodyAsString());
            return new ProviderException(
                    String.format("%s API error %d: %s", providerName, webEx.getStatusCode().value(),
                            webEx.getResponseBodyAsString()),
                    webEx.getStatusCode().value(), e);
        }
        if (e instanceof WebClientRequestException) {
            log.error("{} request failed: {}", providerName, e.getMessage());
            return new ProviderException(providerName + " request failed: " + e.getMessage(),
                    ProviderException.NETWORK_ERROR, e);
        }
        log.error("{} API error", providerName, e);
        return new ProviderException(providerName + " API error: " + e.getMessage(), -1, e);
    }
}
