package io.github.yok.wick.core.contraction;

import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.algebra.TermSum;

/**
 * 項を Wick の定理に従って展開するアルゴリズムを表すインタフェースです。
 *
 * <p>
 * 完全縮約と一般展開（正規順序化）を差し替えるための境界です。
 * </p>
 */
public interface ContractionEngine {

    /**
     * 項を展開し、併合済みの和を返します。
     *
     * @param term 展開する項です
     * @return 展開結果の和です
     */
    TermSum expand(Term term);
}
