package io.leavesfly.meer.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.leavesfly.meer.agent.AgentRegistry;
import io.leavesfly.meer.agent.AgentStoreLocations;
import io.leavesfly.meer.llm.LLMFactory;
import io.leavesfly.meer.tool.ToolRegistryFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.context.annotation.Primary;

import java.nio.file.Paths;

/**
 * Meer 应用配置类
 * 统一管理核心 Bean 的创建和配置
 */
@Configuration
public class MeerConfiguration {

    /**
     * 全局 JSON ObjectMapper
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * 全局配置，首次使用时从 ~/.meer/config.json 加载
     */
    @Bean
    @Lazy
    public MeerConfig meerConfig(ConfigLoader configLoader) {
        return configLoader.loadConfig(null);
    }

    @Bean
    @ConfigurationProperties(prefix = "meer.shell-ui")
    public ShellUIConfig shellUIConfig() {
        return new ShellUIConfig();
    }

    @Bean
    @Lazy
    public LLMFactory llmFactory(MeerConfig meerConfig, ObjectMapper objectMapper) {
        return new LLMFactory(meerConfig, objectMapper);
    }

    @Bean
    public ToolRegistryFactory toolRegistryFactory(ObjectMapper objectMapper) {
        return new ToolRegistryFactory(objectMapper);
    }

    /**
     * 以启动目录为项目根的默认存储位置；-w 指定其他目录时由 MeerFactory 另建
     */
    @Bean
    public AgentStoreLocations agentStoreLocations() {
        return AgentStoreLocations.defaults(Paths.get(System.getProperty("user.dir")).toAbsolutePath());
    }

    @Bean
    public AgentRegistry agentRegistry(AgentStoreLocations agentStoreLocations) {
        AgentRegistry registry = new AgentRegistry(agentStoreLocations);
        registry.loadAgents();
        return registry;
    }
}
