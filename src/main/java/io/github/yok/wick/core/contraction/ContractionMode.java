package io.github.yok.wick.core.contraction;

/**
 * Wick 展開の計算モードです。
 */
public enum ContractionMode {

    /**
     * 完全縮約（真空期待値）のみを求めます。
     */
    FULL,

    /**
     * 正規順序項とすべての部分縮約項に展開します。
     */
    GENERAL
}
