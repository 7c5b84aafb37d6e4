package io.github.yok.wick.core.algebra;

/**
 * 粒子の統計性を表す列挙型です。
 *
 * <p>
 * 符号の扱いが実装されているのは FERMI_DIRAC のみです。BOSE_EINSTEIN の交換子項は未実装で、 ARBITRARY と同様に符号を変えません。
 * </p>
 */
public enum Statistics {

    FERMI_DIRAC("a"), BOSE_EINSTEIN("b"), ARBITRARY("c");

    /**
     * テンソル表記で用いる演算子記号です。
     */
    private final String symbol;

    Statistics(String symbol) {
        this.symbol = symbol;
    }

    /**
     * テンソル表記で用いる演算子記号を返します。
     *
     * @return 演算子記号です
     */
    public String symbol() {
        return symbol;
    }
}
