package io.github.yok.wick.core.contraction;

import io.github.yok.wick.core.algebra.Action;
import io.github.yok.wick.core.algebra.Delta;
import io.github.yok.wick.core.algebra.Operator;
import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.algebra.TermSum;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 完全縮約（真空期待値）を計算するクラスです。
 *
 * <p>
 * すべての完全ペアリングについて、符号付きのデルタ積（演算子を含まない項）を生成し、併合した和を返します。
 * </p>
 */
@Slf4j
public final class FullContractionEngine implements ContractionEngine {

    /**
     * 完全縮約を計算します。
     *
     * <p>
     * 演算子が1個以下、または既に正規順序の項は、そのまま唯一の項として返します。 生成演算子と消滅演算子の個数が異なる場合は空の和（0）を返します。
     * </p>
     *
     * @param term 展開する項です
     * @return 完全縮約の和です
     */
    @Override
    public TermSum expand(Term term) {
        List<Operator> ops = term.getOperators();
        if (ops.size() <= 1 || term.isNormalOrder()) {
            // 正規順序の非空演算子列の期待値は本来 0 だが、入力の項をそのまま返す
            return TermSum.of(term);
        }

        int creates = term.count(Action.CREATE);
        int annihilates = term.count(Action.ANNIHILATE);
        if (creates != annihilates) {
            log.debug("生成/消滅演算子の個数が一致しないため完全縮約は0です。生成={}、消滅={}", creates,
                    annihilates);
            return new TermSum();
        }

        List<List<ContractionPair>> pairings = Pairings.enumerate(ops);
        log.debug("完全ペアリングを列挙しました。演算子数={}、ペアリング数={}", ops.size(), pairings.size());

        TermSum result = new TermSum();
        for (List<ContractionPair> pairing : pairings) {
            double sign = Pairings.sign(pairing, term.getStatistics());
            Term contracted =
                    Term.scalar(sign * term.getCoefficient(), term.getStatistics());
            for (ContractionPair pair : pairing) {
                contracted = contracted.appendDelta(new Delta(ops.get(pair.getLeft()).getIndex(),
                        ops.get(pair.getRight()).getIndex()));
            }
            result.pushAndMerge(contracted);
        }
        return result;
    }
}
