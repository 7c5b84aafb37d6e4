package io.github.yok.wick.app;

import io.github.yok.wick.core.algebra.Action;
import io.github.yok.wick.core.algebra.Statistics;
import io.github.yok.wick.core.contraction.ContractionMode;
import io.github.yok.wick.core.index.Space;
import io.github.yok.wick.core.index.Vacuum;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * wick-contractor の設定値（wick.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時に展開する項の組み立てに使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "wick")
public class WickProperties {

    /**
     * 展開する項の設定です。
     */
    @Valid
    private Expression expression = new Expression();

    /**
     * 縮約の設定です。
     */
    @Valid
    private Contraction contraction = new Contraction();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "wick")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Expression e = getExpression();
        Contraction c = getContraction();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "expression",
                // coefficient: 項の係数
                "coefficient", e.getCoefficient(),
                // statistics: 粒子の統計性
                "statistics", e.getStatistics(),
                // operators: 演算子列（左から右への積）
                "operators", e.getOperators());

        appendSection(sb, nl, "contraction",
                // mode: FULL（完全縮約）/ GENERAL（正規順序展開）
                "mode", c.getMode());

        appendSection(sb, nl, "output",
                // enabled: CSV 出力の有無
                "enabled", o.isEnabled(),
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Expression {

        /**
         * 係数です。
         */
        private double coefficient = 1.0;

        /**
         * 統計性です。
         */
        @NotNull
        private Statistics statistics = Statistics.FERMI_DIRAC;

        /**
         * 演算子列です。
         */
        @NotEmpty
        @Valid
        private List<OperatorSpec> operators = new ArrayList<>();
    }

    /**
     * 1 つの演算子の指定です。
     */
    @Data
    public static class OperatorSpec {

        /**
         * 添字名です。
         */
        @NotBlank
        private String name;

        /**
         * 軌道空間です。
         */
        @NotNull
        private Space space = Space.GENERAL;

        /**
         * 真空です。
         */
        @NotNull
        private Vacuum vacuum = Vacuum.PHYSICAL;

        /**
         * 作用（CREATE/ANNIHILATE）です。
         */
        @NotNull
        private Action action;

        @Override
        public String toString() {
            return name + (action == Action.CREATE ? "+" : "");
        }
    }

    @Data
    public static class Contraction {

        /**
         * 計算モードです。
         */
        @NotNull
        private ContractionMode mode = ContractionMode.FULL;
    }

    @Data
    public static class Output {

        /**
         * CSV 出力を行うかどうかです。
         */
        private boolean enabled = false;

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
