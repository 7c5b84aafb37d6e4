package io.github.yok.wick.core.contraction;

import lombok.Value;

/**
 * 縮約で結ばれる2つの演算子の位置の組です。
 */
@Value
public class ContractionPair {

    /**
     * 消滅演算子側の位置です。
     */
    int left;

    /**
     * 生成演算子側の位置です。
     */
    int right;

    /**
     * 小さい方の位置を返します。
     *
     * @return 小さい方の位置です
     */
    public int lower() {
        return Math.min(left, right);
    }

    /**
     * 大きい方の位置を返します。
     *
     * @return 大きい方の位置です
     */
    public int upper() {
        return Math.max(left, right);
    }
}
