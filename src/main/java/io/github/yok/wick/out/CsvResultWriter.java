package io.github.yok.wick.out;

import io.github.yok.wick.core.algebra.Delta;
import io.github.yok.wick.core.algebra.Operator;
import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.algebra.TermSum;
import io.github.yok.wick.core.contraction.WickContractor;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * Wick 展開の結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は、以下の命名規約に従います（mode は計算モード）。
 * </p>
 *
 * <ul>
 * <li>{@code wick_terms_mode=full.csv}（1 行 1 項）</li>
 * <li>{@code wick_meta_mode=full.csv}（入力の項、真空、統計性、項数など）</li>
 * </ul>
 */
@Slf4j
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "wick";

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * テンソル表記の整形ロジックです。
     */
    private final TensorNotationFormatter formatter;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @param formatter テンソル表記の整形ロジックです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir, TensorNotationFormatter formatter) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        if (formatter == null) {
            throw new IllegalArgumentException("formatter は null 不可です");
        }
        this.outputDir = Paths.get(outputDir);
        this.formatter = formatter;
    }

    /**
     * 入力の項と結果の和を CSV に出力します。
     *
     * @param contractor 計算済みの縮約器です
     * @throws IllegalArgumentException contractor が null の場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(WickContractor contractor) {
        if (contractor == null) {
            throw new IllegalArgumentException("contractor は null 不可です");
        }
        String mode = contractor.getMode().name().toLowerCase(Locale.ROOT);
        try {
            Files.createDirectories(outputDir);
            writeTermsCsv(contractor.getResult(), mode);
            writeMetaCsv(contractor, mode);
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + outputDir, e);
        }
        log.info("CSV を出力しました。出力先={}、項数={}", outputDir, contractor.getResult().size());
    }

    /**
     * 結果の和を 1 行 1 項で出力します。
     *
     * @param sum 結果の和です
     * @param mode 計算モード（ファイル名用）です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeTermsCsv(TermSum sum, String mode) throws IOException {
        Path file = outputDir.resolve(buildFileName("terms", mode));

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("term", "coefficient", "statistics", "operators", "deltas",
                                "tensor")
                        .build().print(w)) {

            int k = 0;
            for (Term t : sum) {
                pr.printRecord(k++, t.getCoefficient(), t.getStatistics(), joinOperators(t),
                        joinDeltas(t), formatter.formatTensor(t));
            }
        }
    }

    /**
     * メタ情報を出力します。
     *
     * @param contractor 計算済みの縮約器です
     * @param mode 計算モード（ファイル名用）です
     * @throws IOException 出力に失敗した場合に発生します
     */
    private void writeMetaCsv(WickContractor contractor, String mode) throws IOException {
        Path file = outputDir.resolve(buildFileName("meta", mode));
        Term input = contractor.getTerm();

        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT)
                        .setHeader("key", "value").build().print(w)) {

            pr.printRecord("input.coefficient", input.getCoefficient());
            pr.printRecord("input.operators", joinOperators(input));
            pr.printRecord("input.tensor", formatter.formatLatex(input));

            pr.printRecord("mode", contractor.getMode());
            pr.printRecord("vacuum", contractor.getVacuum());
            pr.printRecord("statistics", contractor.getStatistics());

            pr.printRecord("result.terms", contractor.getResult().size());
            pr.printRecord("result.tensor", formatter.format(contractor.getResult()));
        }
    }

    /**
     * 演算子列を空白区切りの LaTeX 表記にします。
     *
     * @param t 項です
     * @return 演算子列の文字列です
     */
    private String joinOperators(Term t) {
        return t.getOperators().stream()
                .map((Operator op) -> formatter.formatOperator(op, t.getStatistics()))
                .collect(Collectors.joining(" "));
    }

    /**
     * デルタ因子を {@code a:b} のセミコロン区切りにします。
     *
     * @param t 項です
     * @return デルタの文字列です
     */
    private static String joinDeltas(Term t) {
        return t.getDeltas().stream()
                .map((Delta d) -> d.getA().getName() + ":" + d.getB().getName())
                .collect(Collectors.joining(";"));
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * @param kind 出力の識別子（terms/meta）
     * @param mode 計算モードです
     * @return ファイル名です
     */
    private static String buildFileName(String kind, String mode) {
        return FILE_HEAD + "_" + kind + "_mode=" + mode + ".csv";
    }
}
