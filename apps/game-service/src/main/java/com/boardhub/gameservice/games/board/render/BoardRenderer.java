package com.boardhub.gameservice.games.board.render;

import com.boardhub.gameservice.games.board.domain.model.Session;
import com.boardhub.gameservice.games.board.domain.rule.BoardGrid;

/**
 * 棋盘渲染器。在会话锁内被调用，只读会话状态。
 */
public interface BoardRenderer {

    RenderedBoard render(Session session, BoardGrid grid, RenderContext context);
}
