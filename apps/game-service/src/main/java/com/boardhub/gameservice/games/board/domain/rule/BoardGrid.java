package com.boardhub.gameservice.games.board.domain.rule;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * 蛇形（boustrophedon）棋盘坐标换算。
 * - 格号 1..rows*cols，第 1 行在最下方；
 * - 奇数行从左到右（A→J），偶数行从右到左（J→A）；
 * - 坐标 = 列字母 + 行号，如 10x10 棋盘上 1=A1, 10=J1, 11=J2, 100=A10。
 * alphanumericToTile 是 tileToAlphanumeric 在全部合法格号上的严格左逆。
 */
@Slf4j
@Getter
public final class BoardGrid {

    private final int rows;
    private final int cols;

    public BoardGrid(int rows, int cols) {
        if (rows < 1 || cols < 1 || cols > 26) {
            throw new IllegalArgumentException("Invalid grid " + rows + "x" + cols + " (cols must be 1..26)");
        }
        this.rows = rows;
        this.cols = cols;
    }

    public int maxTile() {
        return rows * cols;
    }

    public boolean isValidTile(int tile) {
        return tile >= 1 && tile <= maxTile();
    }

    /** 格号 → 坐标；越界返回 empty */
    public Optional<String> tileToAlphanumeric(int tile) {
        if (!isValidTile(tile)) return Optional.empty();
        int row = (tile - 1) / cols + 1;
        int positionInRow = (tile - 1) % cols + 1;
        int column = (row % 2 == 1) ? positionInRow : cols - positionInRow + 1;
        String coord = String.valueOf((char) ('A' + column - 1)) + row;
        log.debug("tileToAlphanumeric: tile={} -> row={} column={} ({})", tile, row, column, coord);
        return Optional.of(coord);
    }

    /** 坐标 → 格号；无法解析或越界返回 empty */
    public OptionalInt alphanumericToTile(String coordinate) {
        int[] parsed = parse(coordinate);
        if (parsed == null) return OptionalInt.empty();
        int column = parsed[0];
        int row = parsed[1];
        if (column > cols || row > rows) return OptionalInt.empty();
        int positionInRow = (row % 2 == 1) ? column : cols - column + 1;
        return OptionalInt.of((row - 1) * cols + positionInRow);
    }

    /** 规范化坐标写法（小写转大写、去空白）；非法返回 empty */
    public Optional<String> normalize(String coordinate) {
        OptionalInt tile = alphanumericToTile(coordinate);
        return tile.isPresent() ? tileToAlphanumeric(tile.getAsInt()) : Optional.empty();
    }

    /**
     * 解析 "B7" 形式的坐标。
     * @return {column(1起), row(1起)}；格式不对返回 null
     */
    static int[] parse(String coordinate) {
        if (coordinate == null) return null;
        String s = coordinate.trim().toUpperCase();
        if (s.length() < 2) return null;
        char letter = s.charAt(0);
        if (letter < 'A' || letter > 'Z') return null;
        String digits = s.substring(1);
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) return null;
        }
        if (digits.length() > 4) return null;
        int row = Integer.parseInt(digits);
        if (row < 1) return null;
        return new int[]{letter - 'A' + 1, row};
    }
}
