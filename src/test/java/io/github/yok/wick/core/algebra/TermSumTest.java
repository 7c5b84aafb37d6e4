package io.github.yok.wick.core.algebra;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.yok.wick.core.index.Index;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TermSumTest {

    private final Index p = Index.general("p");
    private final Index q = Index.general("q");
    private final Index r = Index.general("r");

    private Term deltaTerm(double c, Index a, Index b) {
        return Term.scalar(c).appendDelta(new Delta(a, b));
    }

    @Test
    void similarTermsAreMerged() {
        TermSum sum = TermSum.of(deltaTerm(1.0, p, q), deltaTerm(2.5, q, p));
        assertThat(sum.size()).isEqualTo(1);
        assertThat(sum.getTerms().get(0).getCoefficient()).isEqualTo(3.5);
    }

    @Test
    void differentTermsAreAppendedInOrder() {
        TermSum sum = TermSum.of(deltaTerm(1.0, p, q), deltaTerm(1.0, p, r));
        assertThat(sum.getTerms()).extracting(t -> t.getDeltas().get(0).getB())
                .containsExactly(q, r);
    }

    @Test
    void negligibleTermIsDiscardedOnPush() {
        TermSum sum = new TermSum();
        sum.pushAndMerge(deltaTerm(1e-16, p, q));
        assertThat(sum.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("打ち消し合った項は simplify で取り除かれる")
    void cancelledTermsAreRemovedBySimplify() {
        TermSum sum = TermSum.of(deltaTerm(1.0, p, q), deltaTerm(-1.0, p, q),
                deltaTerm(2.0, p, r));
        assertThat(sum.size()).isEqualTo(2);
        sum.simplify();
        assertThat(sum.size()).isEqualTo(1);
        assertThat(sum).allSatisfy(
                t -> assertThat(Math.abs(t.getCoefficient())).isGreaterThan(Tolerances.MERGE_EPSILON));
    }

    @Test
    void boundaryCoefficientIsRemovedBySimplify() {
        TermSum sum = TermSum.of(deltaTerm(Tolerances.MERGE_EPSILON, p, q));
        assertThat(sum.size()).isEqualTo(1);
        assertThat(sum.simplify().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("挿入順によらず同じ係数になる")
    void mergingIsOrderIndependent() {
        List<Term> terms = new ArrayList<>();
        for (int k = 0; k < 5; k++) {
            terms.add(deltaTerm(0.1 * (k + 1), p, q));
            terms.add(deltaTerm(-0.3 * k, q, r));
            terms.add(Term.of(0.7, Operator.create(p)));
        }

        TermSum reference = new TermSum();
        terms.forEach(reference::pushAndMerge);

        Random random = new Random(42);
        for (int trial = 0; trial < 20; trial++) {
            List<Term> shuffled = new ArrayList<>(terms);
            Collections.shuffle(shuffled, random);
            TermSum sum = new TermSum();
            shuffled.forEach(sum::pushAndMerge);

            assertThat(sum.size()).isEqualTo(reference.size());
            for (Term expected : reference) {
                Term actual = sum.getTerms().stream().filter(expected::isSimilar).findFirst()
                        .orElseThrow();
                assertThat(actual.getCoefficient()).isCloseTo(expected.getCoefficient(),
                        within(1e-12));
            }
        }
    }

    @Test
    void plusIsAssociative() {
        Term a = deltaTerm(1.0, p, q);
        Term b = deltaTerm(2.0, q, p);
        Term c = deltaTerm(4.0, p, r);

        TermSum left = TermSum.of(a).plus(TermSum.of(b)).plus(TermSum.of(c));
        TermSum right = TermSum.of(a).plus(TermSum.of(b).plus(TermSum.of(c)));

        assertThat(left.size()).isEqualTo(2).isEqualTo(right.size());
        assertThat(left.getTerms().get(0).getCoefficient()).isEqualTo(3.0);
        assertThat(right.getTerms().get(0).getCoefficient()).isEqualTo(3.0);
    }

    @Test
    void collectorMergesStream() {
        TermSum sum = Stream.of(deltaTerm(1.0, p, q), deltaTerm(1.0, q, p), deltaTerm(1.0, p, r))
                .collect(TermSum.collector());
        assertThat(sum.size()).isEqualTo(2);
        assertThat(sum.getTerms().get(0).getCoefficient()).isEqualTo(2.0);
    }

    @Test
    void termsViewIsReadOnly() {
        TermSum sum = TermSum.of(deltaTerm(1.0, p, q));
        assertThatThrownBy(() -> sum.getTerms().add(deltaTerm(1.0, p, r)))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
