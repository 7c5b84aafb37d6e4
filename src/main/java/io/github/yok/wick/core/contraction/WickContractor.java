package io.github.yok.wick.core.contraction;

import static com.google.common.base.Preconditions.checkNotNull;

import io.github.yok.wick.core.algebra.Statistics;
import io.github.yok.wick.core.algebra.Term;
import io.github.yok.wick.core.algebra.TermSum;
import io.github.yok.wick.core.index.Vacuum;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 項に Wick の定理を適用するクラスです。
 *
 * <p>
 * 入力の項・計算モード・真空（先頭演算子の添字から推定）・統計性を保持し、 {@link #compute()} でモードに応じたエンジンへ処理を振り分けます。
 * </p>
 */
@Slf4j
public final class WickContractor {

    /**
     * 入力の項です。
     */
    @Getter
    private final Term term;

    /**
     * 真空です（演算子が無い場合は PHYSICAL）。
     */
    @Getter
    private final Vacuum vacuum;

    /**
     * 統計性です（入力の項から複写）。
     */
    @Getter
    private final Statistics statistics;

    /**
     * 完全縮約に用いるエンジンです。
     */
    private final ContractionEngine fullEngine;

    /**
     * 一般展開に用いるエンジンです。
     */
    private final ContractionEngine generalEngine;

    /**
     * 計算モードです。
     */
    @Getter
    private ContractionMode mode = ContractionMode.GENERAL;

    /**
     * 計算結果です（{@link #compute()} の実行前は空の和）。
     */
    @Getter
    private TermSum result = new TermSum();

    /**
     * 標準のエンジンで縮約器を生成します。
     *
     * @param term 入力の項です（null 不可）
     */
    public WickContractor(Term term) {
        this(term, new FullContractionEngine(), new NormalOrderExpansionEngine());
    }

    /**
     * エンジンを指定して縮約器を生成します。
     *
     * @param term 入力の項です（null 不可）
     * @param fullEngine 完全縮約エンジンです（null 不可）
     * @param generalEngine 一般展開エンジンです（null 不可）
     */
    public WickContractor(Term term, ContractionEngine fullEngine,
            ContractionEngine generalEngine) {
        this.term = checkNotNull(term, "term は null 不可です");
        this.fullEngine = checkNotNull(fullEngine, "fullEngine は null 不可です");
        this.generalEngine = checkNotNull(generalEngine, "generalEngine は null 不可です");
        this.vacuum = term.getOperators().isEmpty() ? Vacuum.PHYSICAL
                : term.getOperators().get(0).getIndex().getVacuum();
        this.statistics = term.getStatistics();
    }

    /**
     * 計算モードを設定します。
     *
     * @param mode 計算モードです（null 不可）
     * @return この縮約器です
     */
    public WickContractor mode(ContractionMode mode) {
        this.mode = checkNotNull(mode, "mode は null 不可です");
        return this;
    }

    /**
     * 完全縮約モードかどうかを設定します。
     *
     * @param fullContractions true の場合は完全縮約、false の場合は一般展開です
     * @return この縮約器です
     */
    public WickContractor fullContractions(boolean fullContractions) {
        return mode(fullContractions ? ContractionMode.FULL : ContractionMode.GENERAL);
    }

    /**
     * Wick 展開を実行し、簡約済みの結果を保持します。
     *
     * @return この縮約器です
     * @throws UnsupportedVacuumException 真空が PHYSICAL 以外の場合に発生します
     */
    public WickContractor compute() {
        if (vacuum != Vacuum.PHYSICAL) {
            throw new UnsupportedVacuumException(vacuum);
        }

        long t0 = System.nanoTime();
        log.info("Wick 展開を開始します。モード={}、演算子数={}、統計性={}", mode,
                term.getOperators().size(), statistics);

        ContractionEngine engine = mode == ContractionMode.FULL ? fullEngine : generalEngine;
        result = engine.expand(term).simplify();

        log.info("Wick 展開が完了しました。項数={}、所要時間={}ms", result.size(),
                (System.nanoTime() - t0) / 1_000_000L);
        return this;
    }
}
