package io.leavesfly.meer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.meer.exception.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * 配置加载服务
 * 负责从 ~/.meer/config.json 加载、保存配置，并应用环境变量覆盖
 */
@Slf4j
@Service
public class ConfigLoader {

    static final String ENV_BASE_URL = "MEER_BASE_URL";
    static final String ENV_API_KEY = "MEER_API_KEY";
    static final String ENV_MODEL_NAME = "MEER_MODEL_NAME";

    private static final String CONFIG_FILE_NAME = "config.json";
    private static final String MEER_DIR = ".meer";

    private final ObjectMapper objectMapper;

    public ConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 获取 Meer 用户数据目录
     */
    public static Path getMeerHome() {
        return Paths.get(System.getProperty("user.home"), MEER_DIR);
    }

    public Path getConfigFilePath() {
        return getMeerHome().resolve(CONFIG_FILE_NAME);
    }

    /**
     * 加载配置
     * 优先级：环境变量 > 配置文件 > 内置默认配置
     *
     * @param customConfigFile 自定义配置文件，为 null 时使用默认路径
     */
    public MeerConfig loadConfig(Path customConfigFile) {
        return loadConfig(customConfigFile, System.getenv());
    }

    MeerConfig loadConfig(Path customConfigFile, Map<String, String> env) {
        Path configFile = customConfigFile != null ? customConfigFile : getConfigFilePath();

        MeerConfig config;
        if (Files.exists(configFile)) {
            log.debug("Loading config from file: {}", configFile);
            try {
                config = objectMapper.readValue(configFile.toFile(), MeerConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Failed to load config from file: " + configFile, e);
            }
        } else {
            log.debug("No config file found at {}, creating default config", configFile);
            config = getDefaultConfig();
            try {
                saveConfig(config, configFile);
            } catch (ConfigException e) {
                log.warn("Failed to save default config: {}", e.getMessage());
            }
        }

        applyEnvironmentOverrides(config, env);

        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }
        return config;
    }

    public void saveConfig(MeerConfig config, Path configFile) {
        try {
            Files.createDirectories(configFile.toAbsolutePath().getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(configFile.toFile(), config);
            log.info("Config saved to: {}", configFile);
        } catch (IOException e) {
            throw new ConfigException("Failed to save config to file: " + configFile, e);
        }
    }

    public MeerConfig getDefaultConfig() {
        return MeerConfig.builder().build();
    }

    /**
     * 环境变量只作用于默认模型所使用的提供商
     */
    private void applyEnvironmentOverrides(MeerConfig config, Map<String, String> env) {
        String modelName = env.get(ENV_MODEL_NAME);
        if (modelName != null && !modelName.isEmpty()) {
            if (config.getModels().containsKey(modelName)) {
                log.info("Using {} from environment: {}", ENV_MODEL_NAME, modelName);
                config.setDefaultModel(modelName);
            } else {
                log.warn("{}={} is not defined in models, ignored", ENV_MODEL_NAME, modelName);
            }
        }

        LLMProviderConfig providerConfig = defaultProvider(config);

        String baseUrl = env.get(ENV_BASE_URL);
        if (baseUrl != null && !baseUrl.isEmpty() && providerConfig != null) {
            log.info("Using {} from environment: {}", ENV_BASE_URL, baseUrl);
            providerConfig.setBaseUrl(baseUrl);
        }

        String apiKey = env.get(ENV_API_KEY);
        if (apiKey != null && !apiKey.isEmpty() && providerConfig != null) {
            log.info("Using {} from environment", ENV_API_KEY);
            providerConfig.setApiKey(apiKey);
        }
    }

    private LLMProviderConfig defaultProvider(MeerConfig config) {
        if (config.getDefaultModel() == null || config.getDefaultModel().isEmpty()) {
            return null;
        }
        LLMModelConfig modelConfig = config.getModels().get(config.getDefaultModel());
        if (modelConfig == null) {
            return null;
        }
        return config.getProviders().get(modelConfig.getProvider());
    }
}
