package com.boardhub.gameservice.games.snakes.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 蛇梯棋配置（boardhub.games.snakes-ladders.*）。
 * 启动时由 {@link #validate()} 校验，不一致直接阻止启动。
 */
@Data
@ConfigurationProperties(prefix = "boardhub.games.snakes-ladders")
public class SnakesLaddersProperties {

    private int rows = 10;
    private int cols = 10;
    private int goalTile = 100;
    private int startingTile = 1;
    private int dieSides = 6;
    /** 蛇：蛇头格 → 蛇尾格（向下） */
    private Map<Integer, Integer> snakes = new LinkedHashMap<>();
    /** 梯子：梯底格 → 梯顶格（向上） */
    private Map<Integer, Integer> ladders = new LinkedHashMap<>();
    /** 格子颜色：格号 → 颜色名 */
    private Map<Integer, String> tileColors = new LinkedHashMap<>();
    /** 颜色 → 效果说明（仅提示，不自动生效） */
    private Map<String, String> colorEffects = new LinkedHashMap<>();

    public void validate() {
        int max = rows * cols;
        if (rows < 1 || cols < 1 || cols > 26) {
            throw new IllegalStateException("snakes-ladders: invalid grid " + rows + "x" + cols);
        }
        if (goalTile < 2 || goalTile > max) {
            throw new IllegalStateException("snakes-ladders: goal-tile " + goalTile + " outside 2.." + max);
        }
        if (startingTile < 1 || startingTile >= goalTile) {
            throw new IllegalStateException("snakes-ladders: starting-tile " + startingTile + " must be below the goal");
        }
        if (dieSides < 1) {
            throw new IllegalStateException("snakes-ladders: die-sides must be positive");
        }
        snakes.forEach((head, tail) -> {
            if (tail >= head || tail < 1 || head >= goalTile) {
                throw new IllegalStateException("snakes-ladders: snake " + head + "->" + tail + " must lead down inside the board");
            }
        });
        ladders.forEach((base, top) -> {
            if (top <= base || top > goalTile || base < 1) {
                throw new IllegalStateException("snakes-ladders: ladder " + base + "->" + top + " must lead up inside the board");
            }
            if (snakes.containsKey(base)) {
                throw new IllegalStateException("snakes-ladders: tile " + base + " has both a snake and a ladder");
            }
        });
    }
}
