package com.boardhub.gameservice.engine.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 按 gameType 查找规则引擎（容器内所有 RuleEngine Bean）。
 */
@Slf4j
@Component
public class RuleEngineRegistry {

    private final Map<String, RuleEngine> engines;

    public RuleEngineRegistry(List<RuleEngine> engines) {
        this.engines = engines.stream()
                .collect(Collectors.toMap(e -> normalize(e.gameType()), Function.identity()));
        log.info("已注册规则引擎: {}", this.engines.keySet());
    }

    public Optional<RuleEngine> find(String gameType) {
        if (gameType == null) return Optional.empty();
        return Optional.ofNullable(engines.get(normalize(gameType)));
    }

    public RuleEngine require(String gameType) {
        return find(gameType)
                .orElseThrow(() -> new IllegalArgumentException("Unknown game type: " + gameType + " (available: " + types() + ")"));
    }

    public Set<String> types() {
        return engines.keySet();
    }

    private static String normalize(String gameType) {
        return gameType.trim().toLowerCase().replace('-', '_');
    }
}
