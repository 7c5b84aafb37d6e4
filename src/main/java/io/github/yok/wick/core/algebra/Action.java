package io.github.yok.wick.core.algebra;

/**
 * 第二量子化演算子の作用（生成・消滅）を表す列挙型です。
 */
public enum Action {
    CREATE, ANNIHILATE;

    /**
     * エルミート共役の作用を返します（生成 ↔ 消滅）。
     *
     * @return 共役の作用です
     */
    public Action adjoint() {
        return this == CREATE ? ANNIHILATE : CREATE;
    }
}
