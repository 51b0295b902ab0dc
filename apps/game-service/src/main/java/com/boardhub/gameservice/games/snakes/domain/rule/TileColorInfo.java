package com.boardhub.gameservice.games.snakes.domain.rule;

import com.boardhub.gameservice.games.snakes.config.SnakesLaddersProperties;

import java.util.Map;
import java.util.Optional;

/**
 * 格子颜色提示（仅供房主参考，不产生自动效果）。
 */
final class TileColorInfo {

    // 旧配置里的 "blue" 统一按 dark_blue 处理
    private static final Map<String, String> ALIASES = Map.of("blue", "dark_blue");

    private static final Map<String, String> EMOJI = Map.of(
            "yellow", "🟡",
            "green", "🟢",
            "pink", "🩷",
            "dark_blue", "🔵",
            "light_blue", "🔵",
            "orange", "🟠",
            "purple", "🟣",
            "red", "🔴");

    private TileColorInfo() {
    }

    static Optional<String> describe(int tile, SnakesLaddersProperties props) {
        String raw = props.getTileColors().get(tile);
        if (raw == null || raw.isBlank()) return Optional.empty();
        String color = ALIASES.getOrDefault(raw.trim().toLowerCase(), raw.trim().toLowerCase());
        String effect = props.getColorEffects().get(color);
        if (effect == null || effect.isBlank()) return Optional.empty();

        String display = titleCase(color.replace('_', ' '));
        String article = "aeiou".indexOf(Character.toLowerCase(display.charAt(0))) >= 0 ? "an" : "a";
        String emoji = EMOJI.getOrDefault(color, "ℹ️");
        return Optional.of(emoji + " Landed on " + article + " " + display + " tile - " + effect);
    }

    private static String titleCase(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean upper = true;
        for (char c : s.toCharArray()) {
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = c == ' ';
        }
        return sb.toString();
    }
}
