package io.github.yok.wick.core.algebra;

import lombok.Getter;

/**
 * 統計性の異なる項どうしを結合しようとした場合に発生する例外です。
 */
@Getter
public class StatisticsMismatchException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * 左辺の統計性です。
     */
    private final Statistics left;

    /**
     * 右辺の統計性です。
     */
    private final Statistics right;

    /**
     * 例外を生成します。
     *
     * @param left 左辺の統計性です
     * @param right 右辺の統計性です
     */
    public StatisticsMismatchException(Statistics left, Statistics right) {
        super("統計性が一致しない項は結合できません: " + left + " * " + right);
        this.left = left;
        this.right = right;
    }
}
