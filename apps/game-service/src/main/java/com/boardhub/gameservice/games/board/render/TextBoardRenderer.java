package com.boardhub.gameservice.games.board.render;

import com.boardhub.gameservice.games.board.domain.model.Participant;
import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.board.domain.rule.BoardGrid;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 纯文本棋盘：最上面一行是最大行号，每格显示格号和站在上面的玩家序号。
 * 高亮的玩家序号带 *。
 */
@Component
public class TextBoardRenderer implements BoardRenderer {

    private static final int CELL = 9;

    @Override
    public RenderedBoard render(Session session, BoardGrid grid, RenderContext context) {
        RenderContext ctx = context == null ? RenderContext.DEFAULT : context;
        Map<Integer, List<String>> occupants = occupants(session, grid, ctx);

        StringBuilder sb = new StringBuilder();
        sb.append("Board ").append(session.getId())
                .append(" | ").append(session.getGameType())
                .append(" | turn ").append(session.getTurnCount())
                .append(" | ").append(session.getPhase());
        if (StringUtils.isNotBlank(ctx.backgroundOverride())) {
            sb.append(" | background: ").append(ctx.backgroundOverride());
        }
        sb.append('\n');

        String border = "+" + (StringUtils.repeat('-', CELL) + "+").repeat(grid.getCols());
        for (int row = grid.getRows(); row >= 1; row--) {
            sb.append(border).append('\n').append('|');
            for (int col = 0; col < grid.getCols(); col++) {
                String coord = (char) ('A' + col) + String.valueOf(row);
                int tile = grid.alphanumericToTile(coord).orElse(0);
                String who = String.join(",", occupants.getOrDefault(tile, List.of()));
                String cell = who.isEmpty() ? String.valueOf(tile) : tile + ":" + who;
                sb.append(StringUtils.center(StringUtils.abbreviate(cell, CELL), CELL)).append('|');
            }
            sb.append(' ').append(row).append('\n');
        }
        sb.append(border).append('\n').append(' ');
        for (int col = 0; col < grid.getCols(); col++) {
            sb.append(StringUtils.center(String.valueOf((char) ('A' + col)), CELL)).append(' ');
        }
        sb.append('\n');

        for (Participant p : session.bySequence()) {
            sb.append("P").append(p.getSequence()).append(" = ").append(p.displayName());
            if (StringUtils.isNotBlank(p.getDisplay().getBackground())) {
                sb.append(" [bg: ").append(p.getDisplay().getBackground()).append(']');
            }
            if (StringUtils.isNotBlank(p.getDisplay().getOutfit())) {
                sb.append(" [outfit: ").append(p.getDisplay().getOutfit()).append(']');
            }
            sb.append('\n');
        }
        return new RenderedBoard("board-" + session.getId() + ".txt", "text/plain; charset=UTF-8",
                sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    private static Map<Integer, List<String>> occupants(Session session, BoardGrid grid, RenderContext ctx) {
        Map<Integer, List<String>> out = new HashMap<>();
        for (Participant p : session.bySequence()) {
            OptionalInt tile = grid.alphanumericToTile(p.getCoordinate());
            if (tile.isEmpty()) continue;
            String mark = p.getSequence() + (p.getId().equals(ctx.highlightParticipantId()) ? "*" : "");
            out.computeIfAbsent(tile.getAsInt(), k -> new ArrayList<>()).add(mark);
        }
        return out;
    }
}
