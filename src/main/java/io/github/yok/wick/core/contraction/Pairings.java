package io.github.yok.wick.core.contraction;

import io.github.yok.wick.core.algebra.Action;
import io.github.yok.wick.core.algebra.Operator;
import io.github.yok.wick.core.algebra.Statistics;
import java.util.ArrayList;
import java.util.List;

/**
 * 完全縮約のペアリング列挙と、交差数による符号計算を行うユーティリティです。
 */
public final class Pairings {

    private Pairings() {}

    /**
     * 演算子列のすべての完全ペアリングを列挙します。
     *
     * <p>
     * 残っている位置の先頭 i を取り、それが生成演算子なら枝を捨てます。 消滅演算子なら、後方の位置 j のうち縮約可能なものすべてと組み、 i と j
     * を除いた残りで再帰します。残りが無くなった時点で空のペアリングが1つ得られます。
     * </p>
     *
     * @param operators 演算子列です
     * @return ペアリングの一覧です（各ペアリングは位置の組の列）
     */
    public static List<List<ContractionPair>> enumerate(List<Operator> operators) {
        List<Integer> free = new ArrayList<>(operators.size());
        for (int i = 0; i < operators.size(); i++) {
            free.add(i);
        }
        return enumerate(operators, free);
    }

    private static List<List<ContractionPair>> enumerate(List<Operator> operators,
            List<Integer> free) {
        List<List<ContractionPair>> results = new ArrayList<>();
        if (free.isEmpty()) {
            results.add(new ArrayList<>());
            return results;
        }

        int i = free.get(0);
        Operator a = operators.get(i);
        if (a.getAction() == Action.CREATE) {
            return results;
        }

        for (int k = 1; k < free.size(); k++) {
            int j = free.get(k);
            if (!Operator.canContract(a, operators.get(j))) {
                continue;
            }

            List<Integer> rest = new ArrayList<>(free.size() - 2);
            for (int m = 1; m < free.size(); m++) {
                if (m != k) {
                    rest.add(free.get(m));
                }
            }

            for (List<ContractionPair> sub : enumerate(operators, rest)) {
                List<ContractionPair> p = new ArrayList<>(sub.size() + 1);
                p.add(new ContractionPair(i, j));
                p.addAll(sub);
                results.add(p);
            }
        }
        return results;
    }

    /**
     * ペアリングの交差数を返します。
     *
     * <p>
     * 各組を (min, max) に正規化し、2組 (i, j), (k, l) が {@code i < k < j < l} または
     * {@code k < i < l < j} のとき交差として数えます。
     * </p>
     *
     * @param pairing ペアリングです
     * @return 交差数です
     */
    public static int countCrossings(List<ContractionPair> pairing) {
        int count = 0;
        for (int x = 0; x < pairing.size(); x++) {
            int i = pairing.get(x).lower();
            int j = pairing.get(x).upper();
            for (int y = x + 1; y < pairing.size(); y++) {
                int k = pairing.get(y).lower();
                int l = pairing.get(y).upper();
                if ((i < k && k < j && j < l) || (k < i && i < l && l < j)) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * ペアリングの符号を返します。
     *
     * <p>
     * Fermi-Dirac 統計では (-1)^交差数、それ以外では常に +1 です。
     * </p>
     *
     * @param pairing ペアリングです
     * @param statistics 統計性です
     * @return 符号（+1 または -1）です
     */
    public static double sign(List<ContractionPair> pairing, Statistics statistics) {
        if (statistics != Statistics.FERMI_DIRAC) {
            return 1.0;
        }
        return countCrossings(pairing) % 2 == 0 ? 1.0 : -1.0;
    }
}
