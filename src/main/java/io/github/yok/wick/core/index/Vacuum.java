package io.github.yok.wick.core.index;

/**
 * 演算子の基準状態（真空）を表す列挙型です。
 *
 * <ul>
 * <li>{@link #PHYSICAL}: 真の真空 |0&gt;（a^+|0&gt; = |a&gt;, a|0&gt; = 0）</li>
 * <li>{@link #FERMI}: Fermi 真空 |HF&gt;</li>
 * <li>{@link #MULTI_REFERENCE}: 多参照真空</li>
 * </ul>
 */
public enum Vacuum {
    PHYSICAL, FERMI, MULTI_REFERENCE
}
