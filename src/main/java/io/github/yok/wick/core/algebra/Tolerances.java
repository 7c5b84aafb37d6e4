package io.github.yok.wick.core.algebra;

/**
 * 係数の打ち切りに用いる閾値の定数群です。
 */
public final class Tolerances {

    /**
     * 項の併合・簡約で係数を 0 とみなす閾値です。
     *
     * <p>
     * 追加時は {@code |c| < MERGE_EPSILON} の項を捨て、簡約時は {@code |c| <= MERGE_EPSILON} の項を取り除きます。
     * </p>
     */
    public static final double MERGE_EPSILON = 1e-15;

    /**
     * 正規順序展開の縮約分岐を打ち切る係数の閾値です（{@code |c| <= CONTRACTION_EPSILON} で枝刈り）。
     */
    public static final double CONTRACTION_EPSILON = 1e-12;

    private Tolerances() {}
}
