package io.qcheck.check;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.qcheck.api.Invariant;
import io.qcheck.gen.Gen;
import io.qcheck.gen.Gens;
import io.qcheck.value.DocumentValues;
import io.qcheck.value.OrderedDocument;
import io.qcheck.value.Value;
import io.qcheck.value.Values;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class PropertyCheckerTest {

  private static PropertyChecker checker(int trials) {
    return new PropertyChecker(
        CheckerOptions.builder().trials(trials).reductionAttempts(64).seed(31L).build());
  }

  private static int sum(List<Integer> values) {
    int total = 0;
    for (int v : values) {
      total += v;
    }
    return total;
  }

  @Test
  void evenCheckOnConstantOneReportsOneUnshrinkableCounterexample() {
    List<String> found = checker(1).check(n -> n % 2 == 0, Gens.intRange(1, 1));
    assertThat(found).containsExactly("after 0 reductions: 1");
  }

  @Test
  void fiveKeyDocumentShrinksToThreeKeys() {
    OrderedDocument<Integer> five = new OrderedDocument<>();
    for (int i = 0; i < 5; i++) {
      five.put("k" + i, i);
    }
    CheckReport<OrderedDocument<Integer>> report =
        checker(3).run(doc -> doc.size() < 3, Gens.constant(five));

    assertThat(report.counterexamples()).hasSize(3);
    for (Counterexample<OrderedDocument<Integer>> c : report.counterexamples()) {
      assertThat(c).isInstanceOf(Counterexample.Falsified.class);
      Counterexample.Falsified<OrderedDocument<Integer>> f =
          (Counterexample.Falsified<OrderedDocument<Integer>>) c;
      assertThat(f.value()).isSameAs(five);
      assertThat(f.minimized().size()).isEqualTo(3);
      assertThat(f.reductions()).isEqualTo(2);
    }
    assertThat(five.size()).isEqualTo(5);
  }

  @Test
  void sumOfFivesShrinksToTwoElements() {
    Gen<List<Integer>> fives = Gens.sequence(Gens.chooseValue(5), Gens.intRange(3, 3));
    List<String> found = checker(1).check(xs -> sum(xs) < 10, fives);
    assertThat(found).containsExactly("after 1 reductions: [5, 5]");
  }

  @Test
  void throwingInvariantIsReportedPerTrialWithoutShrinking() {
    AtomicInteger calls = new AtomicInteger();
    Invariant<Integer> broken =
        n -> {
          calls.incrementAndGet();
          throw new IllegalStateException("broken invariant");
        };
    CheckReport<Integer> report = checker(4).run(broken, Gens.intRange(7, 7));

    assertThat(calls).hasValue(4);
    assertThat(report.counterexamples())
        .hasSize(4)
        .allMatch(c -> c instanceof Counterexample.Errored);
    assertThat(report.descriptions())
        .allMatch(d -> d.startsWith("7 : java.lang.IllegalStateException: broken invariant"));
  }

  @Test
  void errorWhileShrinkingIsReportedAgainstTheOriginalValue() {
    Gen<List<Integer>> gen = Gens.sequence(Gens.constant(1), Gens.intRange(4, 4));
    CheckReport<List<Integer>> report =
        checker(1)
            .run(
                xs -> {
                  if (xs.size() < 4) {
                    throw new IllegalArgumentException("too short");
                  }
                  return false;
                },
                gen);

    assertThat(report.counterexamples()).hasSize(1);
    Counterexample<List<Integer>> c = report.counterexamples().get(0);
    assertThat(c).isInstanceOf(Counterexample.Errored.class);
    assertThat(c.value()).containsExactly(1, 1, 1, 1);
    assertThat(c.describe()).contains("too short");
  }

  @Test
  void holdingInvariantProducesEmptyReport() {
    CheckReport<Value> report =
        checker(50).run(v -> Values.depth(v) <= 2, DocumentValues.value(2, true));
    assertThat(report.passed()).isTrue();
    assertThat(report.trials()).isEqualTo(50);
    assertThat(report.seed()).isEqualTo(31L);
  }

  @Test
  void sameSeedReproducesTheReport() {
    Invariant<Value> shallow = v -> Values.depth(v) < 2;
    Gen<Value> gen = DocumentValues.value(3, true);
    assertThat(checker(40).check(shallow, gen)).isEqualTo(checker(40).check(shallow, gen));
  }

  @Test
  void generatorFailuresPropagate() {
    Gen<Integer> failing =
        random -> {
          throw new IllegalStateException("generator bug");
        };
    assertThatThrownBy(() -> checker(1).check(n -> true, failing))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("generator bug");
  }

  @Test
  void checkFailsReportsCountLimitedExamplesAndSeed() {
    TestContext context = mock(TestContext.class);
    PropertyChecker checker =
        new PropertyChecker(CheckerOptions.builder().trials(8).exampleLimit(3).seed(99L).build());

    checker.checkFails(context, n -> n > 100, Gens.intRange(0, 9));

    ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
    verify(context).fail(message.capture());
    String[] lines = message.getValue().split("\n");
    assertThat(lines[0]).isEqualTo("found 8 counter examples, displaying first 3:");
    assertThat(lines).hasSize(5);
    assertThat(lines[1]).matches("    -> after 0 reductions: \\d");
    assertThat(lines[3]).startsWith("    -> ");
    assertThat(lines[4]).isEqualTo("seed: 99 (replay with -Dqcheck.seed=99)");
  }

  @Test
  void checkFailsShowsAllExamplesBelowTheLimit() {
    TestContext context = mock(TestContext.class);
    checker(2).checkFails(context, n -> false, Gens.constant(3));

    ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
    verify(context).fail(message.capture());
    assertThat(message.getValue())
        .startsWith("found 2 counter examples, displaying first 2:\n")
        .contains("    -> after 0 reductions: 3");
  }

  @Test
  void checkFailsStaysQuietWhenNothingIsFound() {
    TestContext context = mock(TestContext.class);
    checker(20).checkFails(context, n -> true, Gens.intFull());
    verify(context, never()).fail(anyString());
  }

  @Test
  void defaultContextThrowsPropertyFailedError() {
    assertThatThrownBy(
            () -> checker(1).checkFails(TestContext.DEFAULT, n -> false, Gens.constant(1)))
        .isInstanceOf(PropertyFailedError.class)
        .isInstanceOf(AssertionError.class)
        .hasMessageStartingWith("found 1 counter examples, displaying first 1:");
  }

  @Test
  void lenientContextDoesNotThrow() {
    checker(1).checkFails(TestContext.lenient(), n -> false, Gens.constant(1));
  }
}
