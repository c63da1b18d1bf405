package io.qcheck.shrink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.qcheck.api.Invariant;
import io.qcheck.api.QCheckConfigurationException;
import io.qcheck.gen.DefaultRandomSource;
import io.qcheck.gen.RandomSource;
import io.qcheck.value.OrderedDocument;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ShrinkerTest {
  private static final int ATTEMPTS = 64;

  private static <T> Shrinker<T> shrinker(long seed) {
    return new Shrinker<>(
        StructuralSimplifier.structural(), ATTEMPTS, new DefaultRandomSource(seed));
  }

  private static int sum(List<Integer> values) {
    int total = 0;
    for (int v : values) {
      total += v;
    }
    return total;
  }

  @Test
  void listShrinksToShortestFailingLength() {
    Invariant<List<Integer>> sumBelowTen = xs -> sum(xs) < 10;
    Reduction<List<Integer>> reduction =
        ShrinkerTest.<List<Integer>>shrinker(1L)
            .reduce(new ArrayList<>(List.of(5, 5, 5)), sumBelowTen);
    assertThat(reduction.minimized()).containsExactly(5, 5);
    assertThat(reduction.reductions()).isEqualTo(1);
    assertThat(reduction.interrupted()).isFalse();
  }

  @Test
  void documentShrinksToThreeKeys() {
    OrderedDocument<Integer> doc = new OrderedDocument<>();
    for (int i = 0; i < 5; i++) {
      doc.put("k" + i, i);
    }
    Reduction<OrderedDocument<Integer>> reduction =
        ShrinkerTest.<OrderedDocument<Integer>>shrinker(2L).reduce(doc, d -> d.size() < 3);
    assertThat(reduction.minimized().size()).isEqualTo(3);
    assertThat(reduction.reductions()).isEqualTo(2);
    assertThat(doc.size()).isEqualTo(5);
  }

  @Test
  void leafIsReturnedUnchangedWithZeroReductions() {
    Reduction<Integer> reduction = ShrinkerTest.<Integer>shrinker(3L).reduce(1, n -> n % 2 == 0);
    assertThat(reduction.reductions()).isZero();
    assertThat(reduction.minimized()).isEqualTo(1);
  }

  @Test
  @SuppressWarnings("unchecked")
  void budgetBoundsUnproductiveAttempts() throws Exception {
    Simplifier<String> simplifier = mock(Simplifier.class);
    when(simplifier.simplify(any(), any())).thenReturn(ShrinkProposal.unchanged("x"));
    Invariant<String> invariant = mock(Invariant.class);
    RandomSource random = new DefaultRandomSource(4L);

    Reduction<String> reduction = new Shrinker<>(simplifier, 7, random).reduce("x", invariant);

    assertThat(reduction.reductions()).isZero();
    verify(simplifier, times(7)).simplify("x", random);
    verify(invariant, times(0)).holds(any());
  }

  @Test
  void rejectedCandidatesAreRetriedFromTheSameValue() {
    Simplifier<Integer> decrement = (n, r) -> ShrinkProposal.changed(n - 1);
    // every candidate satisfies the invariant, so nothing is accepted
    Reduction<Integer> reduction =
        new Shrinker<>(decrement, 5, new DefaultRandomSource(5L)).reduce(10, n -> n < 10);
    assertThat(reduction.minimized()).isEqualTo(10);
    assertThat(reduction.reductions()).isZero();
  }

  @Test
  void acceptedStepsResetTheBudget() {
    Simplifier<Integer> decrement =
        (n, r) -> n > 0 ? ShrinkProposal.changed(n - 1) : ShrinkProposal.unchanged(n);
    Reduction<Integer> reduction =
        new Shrinker<>(decrement, 1, new DefaultRandomSource(6L)).reduce(50, n -> n < 20);
    assertThat(reduction.minimized()).isEqualTo(20);
    assertThat(reduction.reductions()).isEqualTo(30);
  }

  @Test
  void errorOnCandidateInterruptsShrinking() {
    Simplifier<Integer> decrement = (n, r) -> ShrinkProposal.changed(n - 1);
    IllegalStateException failure = new IllegalStateException("boom");
    Reduction<Integer> reduction =
        new Shrinker<>(decrement, 10, new DefaultRandomSource(7L))
            .reduce(
                10,
                n -> {
                  if (n == 8) {
                    throw failure;
                  }
                  return false;
                });
    assertThat(reduction.interrupted()).isTrue();
    assertThat(reduction.error()).isSameAs(failure);
    assertThat(reduction.minimized()).isEqualTo(9);
    assertThat(reduction.reductions()).isEqualTo(1);
  }

  @Test
  void budgetMustBePositive() {
    assertThatThrownBy(
            () -> new Shrinker<>(StructuralSimplifier.structural(), 0, new DefaultRandomSource(1L)))
        .isInstanceOf(QCheckConfigurationException.class);
  }
}
