package io.github.yok.wick.core.algebra;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.wick.core.index.Index;
import java.util.Objects;
import lombok.Getter;

/**
 * Kronecker のデルタ δ(a, b) を表す不変クラスです。
 *
 * <p>
 * 等価性は順序に依存しません。添字名を辞書順に並べた組（正準形）で比較します。
 * </p>
 */
@Getter
public final class Delta implements Comparable<Delta> {

    /**
     * 1つ目の添字です。
     */
    private final Index a;

    /**
     * 2つ目の添字です。
     */
    private final Index b;

    /**
     * デルタを生成します。
     *
     * @param a 1つ目の添字です（null 不可）
     * @param b 2つ目の添字です（null 不可）
     */
    public Delta(Index a, Index b) {
        this.a = checkNotNull(a, "a は null 不可です");
        this.b = checkNotNull(b, "b は null 不可です");
    }

    /**
     * 1つ目の添字を差し替えたデルタを返します。
     *
     * @param newA 新しい1つ目の添字です
     * @return 新しいデルタです
     */
    public Delta withA(Index newA) {
        return new Delta(newA, b);
    }

    /**
     * 両添字が同一（自明なデルタ）かを返します。
     *
     * @return 同一の場合は true です
     */
    public boolean isTrivial() {
        return a.equals(b);
    }

    /**
     * 正準形の先頭側の添字名を返します。
     *
     * @return 辞書順で小さい方の添字名です
     */
    public String firstName() {
        return a.getName().compareTo(b.getName()) < 0 ? a.getName() : b.getName();
    }

    /**
     * 正準形の後方側の添字名を返します。
     *
     * @return 辞書順で大きい方の添字名です
     */
    public String secondName() {
        return a.getName().compareTo(b.getName()) < 0 ? b.getName() : a.getName();
    }

    @Override
    public int compareTo(Delta other) {
        int c = firstName().compareTo(other.firstName());
        return c != 0 ? c : secondName().compareTo(other.secondName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Delta)) {
            return false;
        }
        Delta other = (Delta) o;
        return firstName().equals(other.firstName()) && secondName().equals(other.secondName());
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstName(), secondName());
    }

    @Override
    public String toString() {
        return "δ(" + a.getName() + "," + b.getName() + ")";
    }
}
