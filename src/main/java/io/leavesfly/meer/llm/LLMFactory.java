package io.leavesfly.meer.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.leavesfly.meer.config.LLMModelConfig;
import io.leavesfly.meer.config.LLMProviderConfig;
import io.leavesfly.meer.config.MeerConfig;
import io.leavesfly.meer.exception.ConfigException;
import io.leavesfly.meer.llm.provider.OpenAICompatibleChatProvider;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * ChatProvider 工厂
 * <p>
 * 按模型名缓存提供商实例，子代理声明的模型与主代理共用同一缓存。
 * 未在 models 中声明的模型名沿用默认模型的提供商。
 */
@Slf4j
public class LLMFactory {

    private final MeerConfig config;
    private final ObjectMapper objectMapper;
    private final Cache<String, ChatProvider> providers;

    public LLMFactory(MeerConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.providers = Caffeine.newBuilder()
                .maximumSize(32)
                .expireAfterAccess(Duration.ofHours(1))
                .build();
    }

    /**
     * 获取默认模型的提供商
     *
     * @throws ConfigException 未配置默认模型
     */
    public ChatProvider getDefault() {
        String defaultModel = config.getDefaultModel();
        if (defaultModel == null || defaultModel.isEmpty()) {
            throw new ConfigException("No default model configured. Set default_model in "
                    + "~/.meer/config.json or pass --model.");
        }
        return getOrCreate(defaultModel);
    }

    /**
     * 获取或创建指定模型的提供商
     */
    public ChatProvider getOrCreate(String modelName) {
        return providers.get(modelName, this::create);
    }

    private ChatProvider create(String modelName) {
        LLMModelConfig modelConfig = config.getModels().get(modelName);
        String actualModel;
        String providerKey;
        Double temperature = null;
        Integer maxTokens = null;

        if (modelConfig != null) {
            actualModel = modelConfig.getModel() != null ? modelConfig.getModel() : modelName;
            providerKey = modelConfig.getProvider();
            temperature = modelConfig.getTemperature();
            maxTokens = modelConfig.getMaxTokens();
        } else {
            LLMModelConfig fallback = config.getModels().get(config.getDefaultModel());
            if (fallback == null) {
                throw new ConfigException("Model '" + modelName + "' is not configured and no default model is set");
            }
            log.info("Model '{}' not declared in config, using provider '{}'", modelName, fallback.getProvider());
            actualModel = modelName;
            providerKey = fallback.getProvider();
        }

        LLMProviderConfig providerConfig = config.getProviders().get(providerKey);
        if (providerConfig == null) {
            throw new ConfigException("Provider '" + providerKey + "' is not configured");
        }
        if (providerConfig.resolveBaseUrl() == null) {
            throw new ConfigException("Provider '" + providerKey + "' has no base_url");
        }

        log.info("Creating {} provider '{}' for model '{}'", providerConfig.getType(), providerKey, actualModel);
        ChatProvider provider = new OpenAICompatibleChatProvider(actualModel, providerKey, providerConfig,
                objectMapper, temperature, maxTokens);
        return new RetryingChatProvider(provider, config.getRetry());
    }
}
