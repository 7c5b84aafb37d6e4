package io.github.yok.wick.core.contraction;

import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.algebra.TermSum;
import io.github.yok.wick.core.algebra.Tolerances;
import lombok.extern.slf4j.Slf4j;

/**
 * 任意の演算子列を、正規順序項とすべての部分縮約項の和に展開するクラスです。
 *
 * <p>
 * 左から見て最初の「消滅演算子 → 生成演算子」の隣接組に対し、交換分岐と縮約分岐の2つを再帰的に展開します。 すべての枝が正規順序になった時点で終了します。
 * </p>
 */
@Slf4j
public final class NormalOrderExpansionEngine implements ContractionEngine {

    /**
     * 項を正規順序項と部分縮約項に展開します。
     *
     * @param term 展開する項です
     * @return 展開結果の和です
     */
    @Override
    public TermSum expand(Term term) {
        TermSum result = expandRecursively(term, 0);
        log.debug("正規順序展開が完了しました。演算子数={}、項数={}", term.getOperators().size(),
                result.size());
        return result;
    }

    /**
     * 1つの枝を再帰的に展開します。
     *
     * @param term 現在の枝の項です
     * @param depth 再帰の深さです（ログ用）
     * @return この枝から得られる和です
     */
    private TermSum expandRecursively(Term term, int depth) {
        int i = term.firstContractablePosition();
        if (term.getOperators().size() <= 1 || i < 0) {
            return TermSum.of(term);
        }

        TermSum result = new TermSum();

        // 交換分岐: a_i a^+_j -> -a^+_j a_i（Fermi-Dirac のみ符号反転）
        Term swapped = term.swapAdjacent(i);
        if (term.isFermi()) {
            swapped = swapped.negate();
        }
        result.plus(expandRecursively(swapped, depth + 1));

        // 縮約分岐: δ(i, j) を付けて両演算子を取り除く
        if (Math.abs(term.getCoefficient()) <= Tolerances.CONTRACTION_EPSILON) {
            log.trace("係数が閾値以下のため縮約分岐を打ち切ります。深さ={}、係数={}", depth,
                    term.getCoefficient());
            return result;
        }
        result.plus(expandRecursively(term.contractAdjacent(i), depth + 1));
        return result;
    }
}
