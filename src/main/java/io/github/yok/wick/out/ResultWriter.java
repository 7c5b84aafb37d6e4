package io.github.yok.wick.out;

import io.github.yok.wick.core.contraction.WickContractor;

/**
 * Wick 展開の結果を出力する処理のインタフェースです。
 */
public interface ResultWriter {

    /**
     * 計算済みの縮約器から、入力の項と結果の和を出力します。
     *
     * @param contractor {@link WickContractor#compute()} 実行済みの縮約器です
     */
    void write(WickContractor contractor);
}
