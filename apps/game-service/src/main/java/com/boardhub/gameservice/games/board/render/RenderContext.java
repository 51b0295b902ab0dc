package com.boardhub.gameservice.games.board.render;

/**
 * 单次渲染的参数（显式传入，不修改任何共享状态）。
 * @param backgroundOverride     覆盖整个棋盘的背景，可空
 * @param highlightParticipantId 需要高亮的参与者，可空
 */
public record RenderContext(String backgroundOverride, String highlightParticipantId) {

    public static final RenderContext DEFAULT = new RenderContext(null, null);

    public static RenderContext highlight(String participantId) {
        return new RenderContext(null, participantId);
    }

    public RenderContext withBackground(String background) {
        return new RenderContext(background, highlightParticipantId);
    }
}
