package com.boardhub.gameservice.games.snakes.domain.model;

import com.boardhub.gameservice.engine.core.RuleData;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 蛇梯棋的会话数据。
 * 不变量：
 * - forfeited / actedThisCycle / winners 中的 id 都必须存在于会话参与者中；
 * - turnOrder 无重复，且包含所有分配过序号的参与者；
 * - 弃权只改 forfeited，不动 turnOrder / tiles。
 */
@Getter
public class SnakesLaddersData implements RuleData {

    public static final String TYPE = "snakes_ladders";

    /** 参与者 → 当前格号 */
    private final Map<String, Integer> tiles = new LinkedHashMap<>();
    /** 回合顺序（按加入序号），开局后只追加不重排 */
    private final List<String> turnOrder = new ArrayList<>();
    private final Set<String> forfeited = new LinkedHashSet<>();
    private final Set<String> actedThisCycle = new LinkedHashSet<>();
    private final Set<String> winners = new LinkedHashSet<>();
    /** 参与者 → 首次到达终点时的回合数 */
    private final Map<String, Integer> goalReachedTurn = new LinkedHashMap<>();
    /** 参与者 → 被重新分配角色的次数（跟随身份，不随交换） */
    private final Map<String, Integer> transformationCounts = new HashMap<>();
    /** 参与者 → 第一次分配到的角色 */
    private final Map<String, String> originalRoles = new HashMap<>();
    @Setter private boolean gameEnded;

    @Override
    public String gameType() {
        return TYPE;
    }

    public int tileOf(String participantId, int fallback) {
        return tiles.getOrDefault(participantId, fallback);
    }
}
