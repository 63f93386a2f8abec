package io.leavesfly.meer.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 元命令注册表
 * 按名称和别名索引所有 CommandHandler
 */
@Slf4j
@Component
public class CommandRegistry {

    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();
    private final Map<String, CommandHandler> aliases = new LinkedHashMap<>();

    public CommandRegistry(List<CommandHandler> commandHandlers) {
        commandHandlers.stream()
                .sorted(Comparator.comparing(CommandHandler::getName))
                .forEach(this::register);
    }

    public void register(CommandHandler handler) {
        handlers.put(handler.getName(), handler);
        for (String alias : handler.getAliases()) {
            aliases.put(alias, handler);
        }
        log.debug("Registered command /{}", handler.getName());
    }

    public Optional<CommandHandler> find(String name) {
        CommandHandler handler = handlers.get(name);
        if (handler == null) {
            handler = aliases.get(name);
        }
        return Optional.ofNullable(handler);
    }

    public Collection<CommandHandler> getHandlers() {
        return new ArrayList<>(handlers.values());
    }

    /**
     * 所有命令名和别名，带 / 前缀，用于补全
     */
    public List<String> getCompletionCandidates() {
        List<String> candidates = new ArrayList<>();
        handlers.keySet().forEach(name -> candidates.add("/" + name));
        aliases.keySet().forEach(alias -> candidates.add("/" + alias));
        return candidates;
    }

    public int size() {
        return handlers.size();
    }
}
