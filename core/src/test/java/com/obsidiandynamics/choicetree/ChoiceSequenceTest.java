package com.obsidiandynamics.choicetree;

import static org.assertj.core.api.Assertions.*;

import nl.jqno.equalsverifier.*;
import org.junit.jupiter.api.*;

import java.util.*;

final class ChoiceSequenceTest {
  private static final IntegerConstraints SMALL = IntegerConstraints.between(0, 10);

  private static List<ChoiceNode> nodes(long... values) {
    final var nodes = new ArrayList<ChoiceNode>();
    for (var value : values) {
      nodes.add(new ChoiceNode(SMALL, value, false));
    }
    return nodes;
  }

  @Test
  void testAccessors() {
    final var spans = List.of(new Span("a", 0, 2, 0, -1), new Span("b", 1, 2, 1, 0), new Span("c", 2, 3, 0, -1));
    final var sequence = ChoiceSequence.of(nodes(1, 2, 3), spans, Status.INTERESTING);
    assertThat(sequence.length()).isEqualTo(3);
    assertThat(sequence.getValues()).containsExactly(1L, 2L, 3L);
    assertThat(sequence.getNode(1).getValue()).isEqualTo(2L);
    assertThat(sequence.getSpans()).isEqualTo(spans);
    assertThat(sequence.childrenOf(-1)).containsExactly(0, 2);
    assertThat(sequence.childrenOf(0)).containsExactly(1);
    assertThat(sequence.childrenOf(1)).isEmpty();
    assertThat(sequence.toString()).contains("status=INTERESTING").contains("values=[1, 2, 3]");
  }

  @Test
  void testImmutable() {
    final var source = nodes(1, 2);
    final var sequence = ChoiceSequence.of(source, Status.VALID);
    source.clear();
    assertThat(sequence.length()).isEqualTo(2);
    assertThat(catchThrowable(() -> sequence.getNodes().clear())).isInstanceOf(UnsupportedOperationException.class);
    assertThat(catchThrowable(() -> sequence.getValues().clear())).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void testSpanOutOfRange() {
    assertThat(catchThrowable(() -> ChoiceSequence.of(nodes(1), List.of(new Span("a", 0, 2, 0, -1)), Status.VALID)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testSpanEscapingParent() {
    final var spans = List.of(new Span("a", 0, 1, 0, -1), new Span("b", 0, 2, 1, 0));
    assertThat(catchThrowable(() -> ChoiceSequence.of(nodes(1, 2), spans, Status.VALID))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testOverlappingSiblings() {
    final var spans = List.of(new Span("a", 0, 2, 0, -1), new Span("b", 1, 3, 0, -1));
    assertThat(catchThrowable(() -> ChoiceSequence.of(nodes(1, 2, 3), spans, Status.VALID))).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testInconsistentDepth() {
    final var spans = List.of(new Span("a", 0, 2, 0, -1), new Span("b", 0, 1, 2, 0));
    assertThat(catchThrowable(() -> ChoiceSequence.of(nodes(1, 2), spans, Status.VALID))).isInstanceOf(IllegalArgumentException.class);
  }

  @Nested
  final class ChoiceNodeTests {
    @Test
    void testRejectsUnpermittedValue() {
      assertThat(catchThrowable(() -> new ChoiceNode(SMALL, 11L, false))).isInstanceOf(IllegalArgumentException.class);
      assertThat(catchThrowable(() -> new ChoiceNode(SMALL, "5", false))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testWithValue() {
      final var node = new ChoiceNode(SMALL, 5L, false);
      final var lowered = node.withValue(2L);
      assertThat(lowered.getValue()).isEqualTo(2L);
      assertThat(lowered.getConstraints()).isSameAs(SMALL);
      assertThat(lowered.wasForced()).isFalse();
      assertThat(catchThrowable(() -> new ChoiceNode(SMALL, 5L, true).withValue(2L))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testBytesAreCopied() {
      final var bytes = new byte[] {1, 2};
      final var node = new ChoiceNode(new BytesConstraints(2), bytes, false);
      bytes[0] = 9;
      ((byte[]) node.getValue())[1] = 9;
      assertThat((byte[]) node.getValue()).containsExactly(1, 2);
      assertThat(node).isEqualTo(new ChoiceNode(new BytesConstraints(2), new byte[] {1, 2}, false));
    }

    @Test
    void testForcedFlagTakesPartInEquality() {
      assertThat(new ChoiceNode(SMALL, 5L, true)).isNotEqualTo(new ChoiceNode(SMALL, 5L, false));
    }

    @Test
    void testEqualsAndHashCode() {
      EqualsVerifier.forClass(ChoiceNode.class).verify();
    }

    @Test
    void testToString() {
      final var node = new ChoiceNode(StringConstraints.ofSize(0, 3, "ab"), "ab", true);
      assertThat(node.toString()).contains(ChoiceNode.class.getSimpleName()).contains("value=\"ab\"").contains("wasForced=true");
    }
  }

  @Nested
  final class SpanTests {
    @Test
    void testGeometry() {
      final var outer = new Span("outer", 2, 6, 0, -1);
      final var inner = new Span("inner", 3, 5, 1, 0);
      assertThat(outer.length()).isEqualTo(4);
      assertThat(outer.encloses(inner)).isTrue();
      assertThat(inner.encloses(outer)).isFalse();
      assertThat(new Span("empty", 3, 3, 0, -1).isEmpty()).isTrue();
    }

    @Test
    void testEqualsAndHashCode() {
      EqualsVerifier.forClass(Span.class).verify();
    }

    @Test
    void testToString() {
      assertThat(new Span("x", 1, 2, 0, -1).toString()).isEqualTo("Span[label=x, start=1, end=2, depth=0, parent=-1]");
    }
  }
}
