package io.github.yok.wick.app;

import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.contraction.ContractionMode;
import io.github.yok.wick.core.contraction.FullContractionEngine;
import io.github.yok.wick.core.contraction.NormalOrderExpansionEngine;
import io.github.yok.wick.core.contraction.WickContractor;
import io.github.yok.wick.out.ResultWriter;
import io.github.yok.wick.out.TensorNotationFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で wick-contractor を実行するクラスです。
 *
 * <p>
 * 設定された項に Wick の定理を適用し、結果をテンソル表記で表示します（必要に応じて CSV にも出力します）。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class WickCliRunner implements CommandLineRunner {

    /**
     * wick-contractor の設定値（wick.*）です。
     */
    private final WickProperties properties;

    /**
     * 展開対象の項です。
     */
    private final Term inputTerm;

    /**
     * 完全縮約エンジンです。
     */
    private final FullContractionEngine fullContractionEngine;

    /**
     * 正規順序展開エンジンです。
     */
    private final NormalOrderExpansionEngine normalOrderExpansionEngine;

    /**
     * テンソル表記の整形ロジックです。
     */
    private final TensorNotationFormatter formatter;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== wick-contractor start ===");
        System.out.print(properties.toMultilineString());

        ContractionMode mode = properties.getContraction().getMode();
        if (mode == null) {
            throw new IllegalStateException("contraction.mode は必須です（FULL または GENERAL）");
        }

        WickContractor contractor = new WickContractor(inputTerm, fullContractionEngine,
                normalOrderExpansionEngine).mode(mode).compute();

        System.out.println("入力: " + formatter.formatLatex(inputTerm));
        System.out.println("結果: " + formatter.format(contractor.getResult()) + "（項数="
                + contractor.getResult().size() + "）");

        if (properties.getOutput().isEnabled()) {
            resultWriter.write(contractor);
        }
    }
}
