package io.github.yok.wick.core.contraction;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.yok.wick.core.algebra.Operator;
import io.github.yok.wick.core.algebra.Statistics;
import io.github.yok.wick.core.index.Index;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PairingsTest {

    private static Operator a(String name) {
        return Operator.annihilate(Index.general(name));
    }

    private static Operator c(String name) {
        return Operator.create(Index.general(name));
    }

    private static List<ContractionPair> pairing(int... positions) {
        List<ContractionPair> p = new ArrayList<>();
        for (int k = 0; k < positions.length; k += 2) {
            p.add(new ContractionPair(positions[k], positions[k + 1]));
        }
        return p;
    }

    @Test
    void enumeratesBothMatchingsOfTwoAnnihilatorsThenTwoCreators() {
        List<List<ContractionPair>> pairings =
                Pairings.enumerate(List.of(a("p3"), a("p4"), c("p1"), c("p2")));
        assertThat(pairings).containsExactly(pairing(0, 2, 1, 3), pairing(0, 3, 1, 2));
    }

    @Test
    @DisplayName("先頭が生成演算子の枝は捨てられる")
    void leadingCreatorPrunesBranch() {
        assertThat(Pairings.enumerate(List.of(c("p"), a("q")))).isEmpty();
        // a_p a^+_q a^+_r a_s: (0,1) の後に a^+_r が先頭になる / (0,2) の後に a^+_q が先頭になる
        assertThat(Pairings.enumerate(List.of(a("p"), c("q"), c("r"), a("s")))).isEmpty();
    }

    @Test
    void emptySequenceHasOneEmptyPairing() {
        List<List<ContractionPair>> pairings = Pairings.enumerate(List.of());
        assertThat(pairings).hasSize(1);
        assertThat(pairings.get(0)).isEmpty();
    }

    @Test
    void sixOperatorsGiveSixMatchings() {
        List<List<ContractionPair>> pairings = Pairings
                .enumerate(List.of(a("p"), a("q"), a("r"), c("s"), c("t"), c("u")));
        assertThat(pairings).hasSize(6);
        assertThat(pairings).allSatisfy(p -> assertThat(p).hasSize(3));
    }

    @Test
    void countsOnlyInterleavedPairs() {
        assertThat(Pairings.countCrossings(pairing(0, 2, 1, 3))).isEqualTo(1);
        assertThat(Pairings.countCrossings(pairing(0, 3, 1, 2))).isZero();
        assertThat(Pairings.countCrossings(pairing(0, 1, 2, 3))).isZero();
        assertThat(Pairings.countCrossings(pairing(0, 3, 1, 4, 2, 5))).isEqualTo(3);
    }

    @Test
    void crossingsIgnorePairOrientation() {
        assertThat(Pairings.countCrossings(pairing(2, 0, 3, 1)))
                .isEqualTo(Pairings.countCrossings(pairing(0, 2, 1, 3)));
    }

    @Test
    @DisplayName("左右の相対順序を保つ再ラベルと全体の反転で交差数は変わらない")
    void crossingsAreInvariantUnderOrderPreservingRelabelAndReversal() {
        List<ContractionPair> original = pairing(0, 3, 1, 4, 2, 5);
        int expected = Pairings.countCrossings(original);

        // 0..5 を単調増加な 1,4,5,7,10,11 に写す
        int[] map = {1, 4, 5, 7, 10, 11};
        List<ContractionPair> relabeled = new ArrayList<>();
        for (ContractionPair p : original) {
            relabeled.add(new ContractionPair(map[p.getLeft()], map[p.getRight()]));
        }
        assertThat(Pairings.countCrossings(relabeled)).isEqualTo(expected);

        List<ContractionPair> reversed = new ArrayList<>();
        for (ContractionPair p : original) {
            reversed.add(new ContractionPair(5 - p.getLeft(), 5 - p.getRight()));
        }
        assertThat(Pairings.countCrossings(reversed)).isEqualTo(expected);
    }

    @Test
    void signDependsOnStatistics() {
        List<ContractionPair> crossing = pairing(0, 2, 1, 3);
        assertThat(Pairings.sign(crossing, Statistics.FERMI_DIRAC)).isEqualTo(-1.0);
        assertThat(Pairings.sign(crossing, Statistics.BOSE_EINSTEIN)).isEqualTo(1.0);
        assertThat(Pairings.sign(crossing, Statistics.ARBITRARY)).isEqualTo(1.0);
        assertThat(Pairings.sign(pairing(0, 3, 1, 2), Statistics.FERMI_DIRAC)).isEqualTo(1.0);
    }
}
