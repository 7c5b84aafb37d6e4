package io.github.yok.wick.app;

import io.github.yok.wick.core.algebra.Operator;
import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.contraction.FullContractionEngine;
import io.github.yok.wick.core.contraction.NormalOrderExpansionEngine;
import io.github.yok.wick.core.index.Index;
import io.github.yok.wick.out.CsvResultWriter;
import io.github.yok.wick.out.ResultWriter;
import io.github.yok.wick.out.TensorNotationFormatter;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 入力の項・縮約エンジン・出力の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class WickConfiguration {

    /**
     * wick-contractor の設定値（wick.*）です。
     */
    private final WickProperties p;

    /**
     * 設定値から展開対象の項を組み立てます。
     *
     * @return 展開対象の項です
     * @throws io.github.yok.wick.core.index.InvalidIndexException 軌道空間と真空の組み合わせが不正な場合に発生します
     */
    @Bean
    public Term inputTerm() {
        WickProperties.Expression e = p.getExpression();
        List<Operator> ops = new ArrayList<>();
        for (WickProperties.OperatorSpec spec : e.getOperators()) {
            Index index = Index.of(spec.getName(), spec.getSpace(), spec.getVacuum());
            ops.add(new Operator(index, spec.getAction()));
        }
        return Term.of(e.getCoefficient(), e.getStatistics(), ops);
    }

    /**
     * 完全縮約エンジンを生成します。
     *
     * @return 完全縮約エンジンです
     */
    @Bean
    public FullContractionEngine fullContractionEngine() {
        return new FullContractionEngine();
    }

    /**
     * 正規順序展開エンジンを生成します。
     *
     * @return 正規順序展開エンジンです
     */
    @Bean
    public NormalOrderExpansionEngine normalOrderExpansionEngine() {
        return new NormalOrderExpansionEngine();
    }

    /**
     * テンソル表記の整形ロジックを生成します。
     *
     * @return 整形ロジックです
     */
    @Bean
    public TensorNotationFormatter tensorNotationFormatter() {
        return new TensorNotationFormatter();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @param formatter 整形ロジックです
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter(TensorNotationFormatter formatter) {
        return new CsvResultWriter(p.getOutput().getDir(), formatter);
    }
}
