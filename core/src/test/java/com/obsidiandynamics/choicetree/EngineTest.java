package com.obsidiandynamics.choicetree;

import static org.assertj.core.api.Assertions.*;

import com.obsidiandynamics.choicetree.tree.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.*;

final class EngineTest {
  private static final BooleanConstraints MORE = new BooleanConstraints(0.8);

  private static final TestFunction SUM_OVER_1000 = data -> {
    var sum = 0L;
    while (true) {
      data.openSpan("element");
      if (! data.drawBoolean(MORE)) {
        data.closeSpan();
        break;
      }
      final var element = data.drawInteger(IntegerConstraints.atLeast(0));
      sum = sum > Long.MAX_VALUE - element ? Long.MAX_VALUE : sum + element;
      data.closeSpan();
    }
    if (sum > 1000) {
      data.markInteresting();
    }
  };

  private static Engine.Options seeded(long seed) {
    return new Engine.Options() {{
      this.seed = seed;
      maxShrinkCalls = 10_000;
    }};
  }

  @Test
  void testFindsAndShrinks() {
    final var result = new Engine(SUM_OVER_1000, seeded(1)).run();
    assertThat(result.getStatus()).isEqualTo(Status.INTERESTING);
    assertThat(result.getInteresting().getStatus()).isEqualTo(Status.INTERESTING);
    assertThat(result.getShrunk().getValues()).containsExactly(true, 1001L, false);
    assertThat(result.getExamples()).isPositive();
    assertThat(result.getCalls()).isEqualTo(result.getExamples() + result.getShrinkCalls());
    assertThat(result.isExhausted()).isFalse();
  }

  @Test
  void testReproducibleForSeed() {
    final var first = new Engine(SUM_OVER_1000, seeded(42)).run();
    final var second = new Engine(SUM_OVER_1000, seeded(42)).run();
    assertThat(second.getInteresting().getNodes()).isEqualTo(first.getInteresting().getNodes());
    assertThat(second.getExamples()).isEqualTo(first.getExamples());
  }

  @Test
  void testExhaustsFiniteSpace() {
    final TestFunction function = data -> {
      data.drawBoolean(BooleanConstraints.fair());
      data.drawBoolean(BooleanConstraints.fair());
    };
    final var engine = new Engine(function, seeded(0));
    final var result = engine.run();
    assertThat(result.getStatus()).isEqualTo(Status.VALID);
    assertThat(result.isExhausted()).isTrue();
    assertThat(result.getExamples()).isEqualTo(4);
    assertThat(result.getInteresting()).isNull();
    assertThat(result.getShrunk()).isNull();
    assertThat(engine.getTree().isExhausted()).isTrue();
  }

  @Test
  void testReachesNanBeforeExhaustion() {
    final var constraints = new FloatConstraints(1.0, 1.0, true, Double.MIN_VALUE);
    final TestFunction function = data -> {
      if (Double.isNaN(data.drawFloat(constraints))) {
        data.markInteresting();
      }
    };
    for (var seed = 0; seed < 10; seed++) {
      final var result = new Engine(function, seeded(seed)).run();
      assertThat(result.getStatus()).as("seed %d", seed).isEqualTo(Status.INTERESTING);
      assertThat((Double) result.getShrunk().getValues().get(0)).isNaN();
    }
  }

  @Test
  void testExhaustsHalfBoundedIntegersNearLongLimit() {
    final TestFunction function = data -> data.drawInteger(IntegerConstraints.atLeast(Long.MAX_VALUE - 1));
    final var result = Assertions.assertTimeoutPreemptively(Duration.ofSeconds(5), () -> new Engine(function, seeded(1)).run());
    assertThat(result.isExhausted()).isTrue();
    assertThat(result.getExamples()).isEqualTo(2);
  }

  @Test
  void testStopsAtMaxExamples() {
    final var options = seeded(0);
    options.maxExamples = 50;
    final var result = new Engine(data -> data.drawInteger(IntegerConstraints.unbounded()), options).run();
    assertThat(result.getExamples()).isEqualTo(50);
    assertThat(result.isExhausted()).isFalse();
    assertThat(result.getStatus()).isEqualTo(Status.VALID);
  }

  @Test
  void testInvalidTrials() {
    final var result = new Engine(ChoiceRecorder::markInvalid, seeded(0)).run();
    assertThat(result.getStatus()).isEqualTo(Status.INVALID);
    assertThat(result.getExamples()).isEqualTo(1);
    assertThat(result.isExhausted()).isTrue();
  }

  @Test
  void testForcedValuesSurviveShrinking() {
    final var constraints = IntegerConstraints.between(0, 1000);
    final TestFunction function = data -> {
      data.drawInteger(constraints, Request.force(77L));
      if (data.drawInteger(constraints) > 100) {
        data.markInteresting();
      }
    };
    final var result = new Engine(function, seeded(3)).run();
    assertThat(result.getShrunk().getValues()).containsExactly(77L, 101L);
    assertThat(result.getShrunk().getNode(0).wasForced()).isTrue();
  }

  @Test
  void testNondeterminismIsFlaky() {
    final var calls = new AtomicInteger();
    final TestFunction function = data -> {
      if (calls.getAndIncrement() == 0) {
        data.drawBoolean(BooleanConstraints.fair());
      } else {
        data.drawInteger(IntegerConstraints.unbounded());
      }
    };
    assertThat(catchThrowable(() -> new Engine(function, seeded(0)).run())).isInstanceOf(FlakyGenerationException.class);
  }

  @Test
  void testInvalidOptions() {
    final var options = new Engine.Options() {{
      maxExamples = 0;
    }};
    assertThat(catchThrowable(() -> new Engine(data -> {}, options))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testResultToString() {
    final var result = new Engine(data -> {}, seeded(0)).run();
    assertThat(result.toString()).contains(Engine.Result.class.getSimpleName()).contains("status=VALID").contains("exhausted=true");
  }
}
