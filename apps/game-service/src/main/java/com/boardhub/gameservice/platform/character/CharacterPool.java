package com.boardhub.gameservice.platform.character;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 可分配角色池（进程级，启动时加载一次，关闭时清空）。
 * 配置为空时启动失败。
 */
@Slf4j
@Component
public class CharacterPool {

    private final String configured;
    // 小写名 -> 配置中的原始写法
    private volatile Map<String, String> byKey = Map.of();

    public CharacterPool(@Value("${boardhub.characters:}") String configured) {
        this.configured = configured;
    }

    @PostConstruct
    public void load() {
        Map<String, String> loaded = new LinkedHashMap<>();
        for (String raw : StringUtils.split(StringUtils.defaultString(configured), ',')) {
            String name = StringUtils.trimToNull(raw);
            if (name != null) {
                loaded.putIfAbsent(name.toLowerCase(), name);
            }
        }
        if (loaded.isEmpty()) {
            throw new IllegalStateException("No characters configured: set boardhub.characters");
        }
        byKey = Collections.unmodifiableMap(loaded);
        log.info("Character pool loaded: {} character(s)", loaded.size());
    }

    @PreDestroy
    public void clear() {
        byKey = Map.of();
        log.info("Character pool cleared");
    }

    /** 不区分大小写查找，返回规范写法 */
    public Optional<String> resolve(String name) {
        if (StringUtils.isBlank(name)) return Optional.empty();
        return Optional.ofNullable(byKey.get(name.trim().toLowerCase()));
    }

    public List<String> names() {
        return List.copyOf(byKey.values());
    }
}
