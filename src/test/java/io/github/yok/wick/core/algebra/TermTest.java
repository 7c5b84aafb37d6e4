package io.github.yok.wick.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import io.github.yok.wick.core.index.Index;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class TermTest {

    private final Index p = Index.general("p");
    private final Index q = Index.general("q");
    private final Index r = Index.general("r");
    private final Index s = Index.general("s");

    @Nested
    class NormalOrder {

        @Test
        void creatorBeforeAnnihilatorIsNormalOrdered() {
            assertThat(Operator.create(p).times(Operator.annihilate(q)).isNormalOrder()).isTrue();
        }

        @Test
        void annihilatorBeforeCreatorIsNotNormalOrdered() {
            Term t = Operator.annihilate(q).times(Operator.create(p));
            assertThat(t.isNormalOrder()).isFalse();
            assertThat(t.firstContractablePosition()).isZero();
        }

        @Test
        void onlyAdjacentPairsMatter() {
            // a^+_p a_q a_r a^+_s: 位置 2-3 が消滅→生成
            Term t = Term.of(1.0, Operator.create(p), Operator.annihilate(q),
                    Operator.annihilate(r), Operator.create(s));
            assertThat(t.isNormalOrder()).isFalse();
            assertThat(t.firstContractablePosition()).isEqualTo(2);
        }

        @Test
        void emptyAndSingleOperatorAreNormalOrdered() {
            assertThat(Term.scalar(3.0).isNormalOrder()).isTrue();
            assertThat(Term.of(1.0, Operator.annihilate(p)).isNormalOrder()).isTrue();
        }
    }

    @Nested
    class Deltas {

        @Test
        void selfDeltaIsIgnored() {
            Term t = Term.scalar(1.0).withDelta(new Delta(p, p));
            assertThat(t.getDeltas()).isEmpty();
            assertThat(t.isScalar()).isTrue();
        }

        @Test
        @DisplayName("既存デルタの先頭添字が新デルタの後方添字と一致する場合は置換して連鎖を作らない")
        void transitiveSubstitution() {
            Term t = Term.scalar(1.0).withDelta(new Delta(q, r)).withDelta(new Delta(p, q));
            assertThat(t.getDeltas()).hasSize(1);
            assertThat(t.getDeltas().get(0).getA()).isEqualTo(p);
            assertThat(t.getDeltas().get(0).getB()).isEqualTo(r);
        }

        @Test
        void unrelatedDeltaIsAppended() {
            Term t = Term.scalar(1.0).withDelta(new Delta(p, q)).withDelta(new Delta(r, s));
            assertThat(t.getDeltas()).containsExactly(new Delta(p, q), new Delta(r, s));
        }

        @Test
        void appendDeltaKeepsDeltaAsIs() {
            Term t = Term.scalar(1.0).appendDelta(new Delta(q, r)).appendDelta(new Delta(p, q));
            assertThat(t.getDeltas()).hasSize(2);
        }
    }

    @Nested
    class Composition {

        @Test
        void scalarTimesOperatorThenOperator() {
            Term t = Term.of(2.0, Operator.create(p)).times(Operator.annihilate(q));
            assertThat(t.getCoefficient()).isEqualTo(2.0);
            assertThat(t.getOperators()).containsExactly(Operator.create(p), Operator.annihilate(q));
        }

        @Test
        void termTimesTermMultipliesCoefficientsAndConcatenates() {
            Term left = Term.of(2.0, Operator.create(p)).withDelta(new Delta(r, s));
            Term right = Term.of(-3.0, Operator.annihilate(q));
            Term t = left.times(right);
            assertThat(t.getCoefficient()).isEqualTo(-6.0);
            assertThat(t.getOperators()).containsExactly(Operator.create(p), Operator.annihilate(q));
            assertThat(t.getDeltas()).containsExactly(new Delta(r, s));
        }

        @Test
        @DisplayName("統計性の異なる項の積は例外になる")
        void statisticsMismatchFails() {
            Term fermi = Term.of(1.0, Operator.create(p));
            Term bose = Term.of(1.0, Statistics.BOSE_EINSTEIN, List.of(Operator.create(q)));
            StatisticsMismatchException ex = catchThrowableOfType(() -> fermi.times(bose),
                    StatisticsMismatchException.class);
            assertThat(ex).isNotNull();
            assertThat(ex.getLeft()).isEqualTo(Statistics.FERMI_DIRAC);
            assertThat(ex.getRight()).isEqualTo(Statistics.BOSE_EINSTEIN);
        }

        @Test
        void scalingAndNegation() {
            Term t = Term.of(1.5, Operator.create(p));
            assertThat(t.times(2.0).getCoefficient()).isEqualTo(3.0);
            assertThat(t.negate().getCoefficient()).isEqualTo(-1.5);
            assertThat(t.getCoefficient()).isEqualTo(1.5);
        }

        @Test
        void statisticsPredicates() {
            assertThat(Term.scalar(1.0).isFermi()).isTrue();
            assertThat(Term.scalar(1.0, Statistics.BOSE_EINSTEIN).isBose()).isTrue();
            assertThat(Term.scalar(1.0, Statistics.ARBITRARY).isFermi()).isFalse();
            assertThat(Term.scalar(1.0).withStatistics(Statistics.ARBITRARY).getStatistics())
                    .isEqualTo(Statistics.ARBITRARY);
        }
    }

    @Nested
    class Rewriting {

        @Test
        void swapAdjacentLeavesOriginalUntouched() {
            Term t = Term.of(1.0, Operator.annihilate(p), Operator.create(q));
            Term swapped = t.swapAdjacent(0);
            assertThat(swapped.getOperators()).containsExactly(Operator.create(q),
                    Operator.annihilate(p));
            assertThat(swapped.getCoefficient()).isEqualTo(1.0);
            assertThat(t.getOperators()).containsExactly(Operator.annihilate(p), Operator.create(q));
        }

        @Test
        void contractAdjacentRemovesPairAndAddsDelta() {
            Term t = Term.of(1.0, Operator.create(r), Operator.annihilate(p), Operator.create(q),
                    Operator.annihilate(s));
            Term c = t.contractAdjacent(1);
            assertThat(c.getOperators()).containsExactly(Operator.create(r), Operator.annihilate(s));
            assertThat(c.getDeltas()).containsExactly(new Delta(p, q));
        }

        @Test
        void swapOutOfRangeFails() {
            Term t = Term.of(1.0, Operator.annihilate(p), Operator.create(q));
            assertThatThrownBy(() -> t.swapAdjacent(1))
                    .isInstanceOf(IndexOutOfBoundsException.class);
        }

        @Test
        void countsActions() {
            Term t = Term.of(1.0, Operator.annihilate(p), Operator.annihilate(q),
                    Operator.create(r));
            assertThat(t.count(Action.ANNIHILATE)).isEqualTo(2);
            assertThat(t.count(Action.CREATE)).isEqualTo(1);
        }
    }

    @Nested
    class Similarity {

        @Test
        void deltaOrderAndOrientationAreIgnored() {
            Term a = Term.scalar(1.0).appendDelta(new Delta(p, q)).appendDelta(new Delta(r, s));
            Term b = Term.scalar(-2.0).appendDelta(new Delta(s, r)).appendDelta(new Delta(q, p));
            assertThat(a.isSimilar(b)).isTrue();
        }

        @Test
        void operatorOrderMatters() {
            Term a = Term.of(1.0, Operator.create(p), Operator.create(q));
            Term b = Term.of(1.0, Operator.create(q), Operator.create(p));
            assertThat(a.isSimilar(b)).isFalse();
        }

        @Test
        void statisticsMatter() {
            Term a = Term.scalar(1.0).appendDelta(new Delta(p, q));
            Term b = a.withStatistics(Statistics.ARBITRARY);
            assertThat(a.isSimilar(b)).isFalse();
        }

        @Test
        void deltaCountMatters() {
            Term a = Term.scalar(1.0).appendDelta(new Delta(p, q));
            Term b = a.appendDelta(new Delta(p, q));
            assertThat(a.isSimilar(b)).isFalse();
        }
    }
}
