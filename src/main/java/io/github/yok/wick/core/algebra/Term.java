package io.github.yok.wick.core.algebra;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 係数・演算子列・デルタ因子・統計性からなる項（c * δ... * op...）を表す不変クラスです。
 *
 * <p>
 * 演算子列の順序は積の代数的な順序（すなわち符号）を表すため意味を持ちます。 変更系のメソッドはすべて新しいインスタンスを返すため、再帰展開の各分岐が状態を共有することはありません。
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Term {

    /**
     * 係数です。
     */
    private final double coefficient;

    /**
     * 演算子列です（左から右への積の順序）。
     */
    private final ImmutableList<Operator> operators;

    /**
     * デルタ因子です。
     */
    private final ImmutableList<Delta> deltas;

    /**
     * 項内のすべての演算子が従う統計性です。
     */
    private final Statistics statistics;

    private Term(double coefficient, List<Operator> operators, List<Delta> deltas,
            Statistics statistics) {
        this.coefficient = coefficient;
        this.operators = ImmutableList.copyOf(operators);
        this.deltas = ImmutableList.copyOf(deltas);
        this.statistics = checkNotNull(statistics, "statistics は null 不可です");
    }

    /**
     * Fermi-Dirac 統計のスカラー項を返します。
     *
     * @param coefficient 係数です
     * @return スカラー項です
     */
    public static Term scalar(double coefficient) {
        return scalar(coefficient, Statistics.FERMI_DIRAC);
    }

    /**
     * 指定した統計性のスカラー項を返します。
     *
     * @param coefficient 係数です
     * @param statistics 統計性です
     * @return スカラー項です
     */
    public static Term scalar(double coefficient, Statistics statistics) {
        return new Term(coefficient, List.of(), List.of(), statistics);
    }

    /**
     * Fermi-Dirac 統計の演算子積（c * op1 * op2 ...）を返します。
     *
     * @param coefficient 係数です
     * @param operators 演算子列です
     * @return 項です
     */
    public static Term of(double coefficient, Operator... operators) {
        return of(coefficient, Statistics.FERMI_DIRAC, Arrays.asList(operators));
    }

    /**
     * 指定した統計性の演算子積を返します。
     *
     * @param coefficient 係数です
     * @param statistics 統計性です
     * @param operators 演算子列です（null 要素不可）
     * @return 項です
     */
    public static Term of(double coefficient, Statistics statistics, List<Operator> operators) {
        checkNotNull(operators, "operators は null 不可です");
        return new Term(coefficient, operators, List.of(), statistics);
    }

    /**
     * 係数を差し替えた項を返します。
     *
     * @param newCoefficient 新しい係数です
     * @return 新しい項です
     */
    public Term withCoefficient(double newCoefficient) {
        return new Term(newCoefficient, operators, deltas, statistics);
    }

    /**
     * 統計性を差し替えた項を返します。
     *
     * @param newStatistics 新しい統計性です
     * @return 新しい項です
     */
    public Term withStatistics(Statistics newStatistics) {
        return new Term(coefficient, operators, deltas, newStatistics);
    }

    /**
     * 係数の符号を反転した項を返します。
     *
     * @return 新しい項です
     */
    public Term negate() {
        return withCoefficient(-coefficient);
    }

    /**
     * 係数をスカラー倍した項を返します。
     *
     * @param factor 倍率です
     * @return 新しい項です
     */
    public Term times(double factor) {
        return withCoefficient(coefficient * factor);
    }

    /**
     * 演算子列の末尾に演算子を追加した項（this * op）を返します。
     *
     * @param op 追加する演算子です
     * @return 新しい項です
     */
    public Term times(Operator op) {
        checkNotNull(op, "op は null 不可です");
        List<Operator> ops = new ArrayList<>(operators);
        ops.add(op);
        return new Term(coefficient, ops, deltas, statistics);
    }

    /**
     * 項どうしの積（係数は積、演算子列とデルタは連結）を返します。
     *
     * @param right 右側の項です
     * @return 新しい項です
     * @throws StatisticsMismatchException 統計性が異なる場合に発生します
     */
    public Term times(Term right) {
        checkNotNull(right, "right は null 不可です");
        if (statistics != right.statistics) {
            throw new StatisticsMismatchException(statistics, right.statistics);
        }
        List<Operator> ops = new ArrayList<>(operators);
        ops.addAll(right.operators);
        List<Delta> ds = new ArrayList<>(deltas);
        ds.addAll(right.deltas);
        return new Term(coefficient * right.coefficient, ops, ds, statistics);
    }

    /**
     * デルタ因子を追加した項を返します。
     *
     * <p>
     * δ(a, a) は追加しません。既存のデルタ δ(x, y) の x が新しいデルタの b と一致する場合は、 追加せずに既存側の x を新しいデルタの a
     * に置き換えます（デルタの連鎖を作らないため）。
     * </p>
     *
     * @param delta 追加するデルタです
     * @return 新しい項です
     */
    public Term withDelta(Delta delta) {
        checkNotNull(delta, "delta は null 不可です");
        if (delta.isTrivial()) {
            return this;
        }
        List<Delta> ds = new ArrayList<>(deltas);
        for (int k = 0; k < ds.size(); k++) {
            if (ds.get(k).getA().equals(delta.getB())) {
                ds.set(k, ds.get(k).withA(delta.getA()));
                return new Term(coefficient, operators, ds, statistics);
            }
        }
        ds.add(delta);
        return new Term(coefficient, operators, ds, statistics);
    }

    /**
     * デルタ因子を置換なしでそのまま末尾に追加した項を返します。
     *
     * @param delta 追加するデルタです
     * @return 新しい項です
     */
    public Term appendDelta(Delta delta) {
        checkNotNull(delta, "delta は null 不可です");
        List<Delta> ds = new ArrayList<>(deltas);
        ds.add(delta);
        return new Term(coefficient, operators, ds, statistics);
    }

    /**
     * 位置 i と i+1 の演算子を入れ替えた項を返します（係数はそのまま）。
     *
     * @param i 左側の位置です
     * @return 新しい項です
     */
    public Term swapAdjacent(int i) {
        checkElementIndex(i, operators.size() - 1, "i");
        List<Operator> ops = new ArrayList<>(operators);
        Collections.swap(ops, i, i + 1);
        return new Term(coefficient, ops, deltas, statistics);
    }

    /**
     * 位置 i と i+1 の演算子を縮約した項を返します。
     *
     * <p>
     * 2つの演算子の添字間のデルタを追加し、両演算子を演算子列から取り除きます。
     * </p>
     *
     * @param i 左側の位置です
     * @return 新しい項です
     */
    public Term contractAdjacent(int i) {
        checkElementIndex(i, operators.size() - 1, "i");
        Delta delta =
                new Delta(operators.get(i).getIndex(), operators.get(i + 1).getIndex());
        List<Operator> ops = new ArrayList<>(operators);
        ops.subList(i, i + 2).clear();
        return new Term(coefficient, ops, deltas, statistics).withDelta(delta);
    }

    /**
     * 隣接する演算子の組で最初に縮約可能な位置（消滅演算子 → 生成演算子の並び）を返します。
     *
     * @return 左側の位置です。存在しない場合は -1 です
     */
    public int firstContractablePosition() {
        for (int i = 0; i + 1 < operators.size(); i++) {
            if (Operator.canContract(operators.get(i), operators.get(i + 1))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * 正規順序か（消滅演算子の直後に生成演算子が現れないか）を返します。
     *
     * @return 正規順序の場合は true です
     */
    public boolean isNormalOrder() {
        return firstContractablePosition() < 0;
    }

    /**
     * 指定した作用を持つ演算子の個数を返します。
     *
     * @param action 作用です
     * @return 個数です
     */
    public int count(Action action) {
        int n = 0;
        for (Operator op : operators) {
            if (op.getAction() == action) {
                n++;
            }
        }
        return n;
    }

    /**
     * 演算子もデルタも持たないスカラー項かを返します。
     *
     * @return スカラー項の場合は true です
     */
    public boolean isScalar() {
        return operators.isEmpty() && deltas.isEmpty();
    }

    /**
     * Fermi-Dirac 統計かを返します。
     *
     * @return Fermi-Dirac 統計の場合は true です
     */
    public boolean isFermi() {
        return statistics == Statistics.FERMI_DIRAC;
    }

    /**
     * Bose-Einstein 統計かを返します。
     *
     * @return Bose-Einstein 統計の場合は true です
     */
    public boolean isBose() {
        return statistics == Statistics.BOSE_EINSTEIN;
    }

    /**
     * 係数以外が同じ（同類項）かを返します。
     *
     * <p>
     * 統計性と演算子列（位置を含む）が一致し、デルタの集合が正準形と並び順を無視して一致する場合に同類項とみなします。
     * </p>
     *
     * @param other 比較対象です
     * @return 同類項の場合は true です
     */
    public boolean isSimilar(Term other) {
        if (statistics != other.statistics) {
            return false;
        }
        if (!operators.equals(other.operators)) {
            return false;
        }
        if (deltas.size() != other.deltas.size()) {
            return false;
        }
        List<Delta> d1 = new ArrayList<>(deltas);
        List<Delta> d2 = new ArrayList<>(other.deltas);
        Collections.sort(d1);
        Collections.sort(d2);
        return d1.equals(d2);
    }
}
