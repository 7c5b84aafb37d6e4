package io.github.yok.wick.core.algebra;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.wick.core.index.Index;
import lombok.Value;

/**
 * 添字と作用の組で表される第二量子化演算子です。
 */
@Value
public class Operator {

    /**
     * 添字です。
     */
    Index index;

    /**
     * 作用（生成・消滅）です。
     */
    Action action;

    /**
     * 演算子を生成します。
     *
     * @param index 添字です（null 不可）
     * @param action 作用です（null 不可）
     */
    public Operator(Index index, Action action) {
        this.index = checkNotNull(index, "index は null 不可です");
        this.action = checkNotNull(action, "action は null 不可です");
    }

    /**
     * 生成演算子 a^+_index を返します。
     *
     * @param index 添字です
     * @return 生成演算子です
     */
    public static Operator create(Index index) {
        return new Operator(index, Action.CREATE);
    }

    /**
     * 消滅演算子 a_index を返します。
     *
     * @param index 添字です
     * @return 消滅演算子です
     */
    public static Operator annihilate(Index index) {
        return new Operator(index, Action.ANNIHILATE);
    }

    /**
     * 2つの演算子が縮約可能かを返します。
     *
     * <p>
     * a が消滅演算子かつ b が生成演算子のときのみ true です（順序に依存します）。
     * </p>
     *
     * @param a 左側の演算子です
     * @param b 右側の演算子です
     * @return 縮約可能な場合は true です
     */
    public static boolean canContract(Operator a, Operator b) {
        return a.action == Action.ANNIHILATE && b.action == Action.CREATE;
    }

    /**
     * この演算子が右隣の演算子と縮約可能かを返します。
     *
     * @param right 右側の演算子です
     * @return 縮約可能な場合は true です
     */
    public boolean canContractWith(Operator right) {
        return canContract(this, right);
    }

    /**
     * エルミート共役（作用を反転し、添字は維持）を返します。
     *
     * @return 共役演算子です
     */
    public Operator adjoint() {
        return new Operator(index, action.adjoint());
    }

    /**
     * 生成演算子かどうかを返します。
     *
     * @return 生成演算子の場合は true です
     */
    public boolean isCreate() {
        return action == Action.CREATE;
    }

    /**
     * 係数 1・Fermi-Dirac 統計の項として、演算子積 this * right を返します。
     *
     * @param right 右側の演算子です
     * @return 演算子積の項です
     */
    public Term times(Operator right) {
        return Term.of(1.0, this).times(right);
    }
}
