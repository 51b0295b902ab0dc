package com.boardhub.gameservice.games.board.domain.rule;

import com.boardhub.gameservice.games.board.domain.model.DisplayMeta;
import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * SwapCoordinator
 * -------------------------------------------------
 * 角色交换的构建与撤销。
 *
 * 交换的内容（跟随“角色”）：role、coordinate、display（背景/服装）。
 * 不交换的内容（跟随“身份”）：sequence、回合顺序位置、弃权/胜者/本轮已行动标记、规则计数器。
 *
 * 每个参与者只保存一个回指 swappedWith（最近一次可逆交换的对方），
 * 链路可能成环，遍历时用 visited 集合终止。
 */
@Slf4j
@Component
public class SwapCoordinator {

    /**
     * 交换两名参与者的角色。
     * @param permanent true 表示不可逆交换：不记录回指，并清除双方已有回指
     * @param onMoved   坐标变化回调（通常是规则引擎同步位置）
     */
    public void exchange(Session session, String firstId, String secondId, boolean permanent,
                         Consumer<Participant> onMoved) {
        if (firstId.equals(secondId)) {
            throw new IllegalArgumentException("Cannot swap a participant with themselves");
        }
        Participant a = session.require(firstId);
        Participant b = session.require(secondId);
        swapWornFields(a, b);
        if (permanent) {
            a.setSwappedWith(a.getId());
            b.setSwappedWith(b.getId());
        } else {
            a.setSwappedWith(b.getId());
            b.setSwappedWith(a.getId());
        }
        log.info("角色交换: session={}, {} <-> {}, permanent={}", session.getId(), firstId, secondId, permanent);
        onMoved.accept(a);
        onMoved.accept(b);
    }

    /**
     * 从 startId 出发沿回指构建交换链。
     * 遇到自环（未交换）、缺失的参与者或指回已访问节点即停止；
     * 互相指向的一对只算一次交换。
     */
    public List<SwapPair> buildChain(Session session, String startId) {
        List<SwapPair> chain = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        String current = startId;
        visited.add(current);
        while (true) {
            Participant p = session.getParticipants().get(current);
            if (p == null || !p.isSwapped()) break;
            String next = p.getSwappedWith();
            if (visited.contains(next)) break;
            if (!session.getParticipants().containsKey(next)) {
                log.warn("交换链指向不存在的参与者，截断: session={}, {} -> {}", session.getId(), current, next);
                break;
            }
            chain.add(new SwapPair(current, next));
            visited.add(next);
            current = next;
        }
        return chain;
    }

    /**
     * 逆序重放交换链以还原，并把链上所有参与者的回指重置为自身。
     */
    public void revertChain(Session session, List<SwapPair> chain, Consumer<Participant> onMoved) {
        Set<String> touched = new LinkedHashSet<>();
        for (int i = chain.size() - 1; i >= 0; i--) {
            SwapPair pair = chain.get(i);
            Participant a = session.getParticipants().get(pair.first());
            Participant b = session.getParticipants().get(pair.second());
            if (a == null || b == null) {
                log.warn("撤销交换时参与者缺失，跳过: session={}, pair={}", session.getId(), pair);
                continue;
            }
            swapWornFields(a, b);
            touched.add(a.getId());
            touched.add(b.getId());
        }
        for (String id : touched) {
            Participant p = session.getParticipants().get(id);
            p.setSwappedWith(id);
            onMoved.accept(p);
        }
        log.info("撤销交换链: session={}, pairs={}", session.getId(), chain.size());
    }

    private static void swapWornFields(Participant a, Participant b) {
        String role = a.getRole();
        a.setRole(b.getRole());
        b.setRole(role);

        String coordinate = a.getCoordinate();
        a.setCoordinate(b.getCoordinate());
        b.setCoordinate(coordinate);

        DisplayMeta display = a.getDisplay();
        a.setDisplay(b.getDisplay());
        b.setDisplay(display);
    }
}
