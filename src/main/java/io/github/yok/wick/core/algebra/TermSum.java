package io.github.yok.wick.core.algebra;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collector;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 項の和を表すクラスです。
 *
 * <p>
 * 追加時に同類項（{@link Term#isSimilar(Term)}）を探し、見つかった場合は係数を加算して併合します。 唯一の変更操作はこの併合付きの追加です。
 * </p>
 */
@ToString
@EqualsAndHashCode
public final class TermSum implements Iterable<Term> {

    /**
     * 項の一覧です（追加順）。
     */
    private final List<Term> terms = new ArrayList<>();

    /**
     * 空の和（代数的な 0）を生成します。
     */
    public TermSum() {}

    /**
     * 指定した項を併合しながら加えた和を返します。
     *
     * @param terms 項です
     * @return 和です
     */
    public static TermSum of(Term... terms) {
        TermSum sum = new TermSum();
        for (Term t : terms) {
            sum.pushAndMerge(t);
        }
        return sum;
    }

    /**
     * ストリームの項を併合しながら集める Collector を返します。
     *
     * @return Collector です
     */
    public static Collector<Term, ?, TermSum> collector() {
        return Collector.of(TermSum::new, TermSum::pushAndMerge,
                (TermSum left, TermSum right) -> left.plus(right));
    }

    /**
     * 項を追加します。
     *
     * <p>
     * 係数の絶対値が {@link Tolerances#MERGE_EPSILON} 未満の項は捨てます。 同類項が既にある場合はその係数に加算し、なければ末尾に追加します。
     * </p>
     *
     * @param term 追加する項です（null 不可）
     */
    public void pushAndMerge(Term term) {
        checkNotNull(term, "term は null 不可です");
        if (Math.abs(term.getCoefficient()) < Tolerances.MERGE_EPSILON) {
            return;
        }
        for (int k = 0; k < terms.size(); k++) {
            Term existing = terms.get(k);
            if (existing.isSimilar(term)) {
                terms.set(k, existing.withCoefficient(existing.getCoefficient()
                        + term.getCoefficient()));
                return;
            }
        }
        terms.add(term);
    }

    /**
     * 併合で打ち消し合った項（係数の絶対値が {@link Tolerances#MERGE_EPSILON} 以下）を取り除きます。
     *
     * @return この和です
     */
    public TermSum simplify() {
        terms.removeIf(t -> Math.abs(t.getCoefficient()) <= Tolerances.MERGE_EPSILON);
        return this;
    }

    /**
     * 項を併合しながら加えます。
     *
     * @param term 項です
     * @return この和です
     */
    public TermSum plus(Term term) {
        pushAndMerge(term);
        return this;
    }

    /**
     * 右辺の和の各項を順に併合しながら加えます。
     *
     * @param other 右辺の和です
     * @return この和です
     */
    public TermSum plus(TermSum other) {
        checkNotNull(other, "other は null 不可です");
        for (Term t : other.terms) {
            pushAndMerge(t);
        }
        return this;
    }

    /**
     * 項の一覧を返します（読み取り専用）。
     *
     * @return 項の一覧です
     */
    public List<Term> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    /**
     * 項数を返します。
     *
     * @return 項数です
     */
    public int size() {
        return terms.size();
    }

    /**
     * 空の和（0）かを返します。
     *
     * @return 空の場合は true です
     */
    public boolean isEmpty() {
        return terms.isEmpty();
    }

    @Override
    public Iterator<Term> iterator() {
        return getTerms().iterator();
    }
}
