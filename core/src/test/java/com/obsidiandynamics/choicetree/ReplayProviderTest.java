package com.obsidiandynamics.choicetree;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

import org.junit.jupiter.api.*;

import java.util.*;

final class ReplayProviderTest {
  @Test
  void testReplaysInOrder() throws EntropyExhaustedException {
    final var provider = new ReplayProvider(List.of(true, 3L, "ab"));
    assertThat(provider.drawBoolean(BooleanConstraints.fair())).isTrue();
    assertThat(provider.drawInteger(IntegerConstraints.unbounded())).isEqualTo(3);
    assertThat(provider.drawString(StringConstraints.ofSize(0, 2, "ab"))).isEqualTo("ab");
    assertThat(provider.getIndex()).isEqualTo(3);
    assertThat(provider.getSubstitutions()).isZero();
  }

  @Test
  void testSubstitutesMisfits() throws EntropyExhaustedException {
    final var provider = new ReplayProvider(List.of("wrong type", 50L, 7L));
    assertThat(provider.drawInteger(IntegerConstraints.between(1, 10))).isEqualTo(1);
    assertThat(provider.drawInteger(IntegerConstraints.between(1, 10).shrinkingTowards(4))).isEqualTo(4);
    assertThat(provider.drawInteger(IntegerConstraints.between(1, 10))).isEqualTo(7);
    assertThat(provider.getSubstitutions()).isEqualTo(2);
  }

  @Test
  void testExhaustion() {
    final var provider = new ReplayProvider(List.of());
    assertThat(catchThrowable(() -> provider.drawBoolean(BooleanConstraints.fair()))).isInstanceOf(EntropyExhaustedException.class);
  }

  @Test
  void testFallback() throws EntropyExhaustedException {
    final var fallback = mock(ChoiceProvider.class);
    when(fallback.drawInteger(any())).thenReturn(42L);
    final var provider = new ReplayProvider(List.of(1L), fallback);
    final var constraints = IntegerConstraints.unbounded();
    assertThat(provider.drawInteger(constraints)).isEqualTo(1);
    assertThat(provider.drawInteger(constraints)).isEqualTo(42);
    verify(fallback).drawInteger(constraints);

    provider.observeForced(constraints, 5L);
    verify(fallback).observeForced(constraints, 5L);
  }

  @Test
  void testObserveForcedSkipsPosition() throws EntropyExhaustedException {
    final var provider = new ReplayProvider(List.of(9L, 2L));
    provider.observeForced(IntegerConstraints.unbounded(), 0L);
    assertThat(provider.getIndex()).isEqualTo(1);
    assertThat(provider.drawInteger(IntegerConstraints.unbounded())).isEqualTo(2);
  }

  @Test
  void testToString() {
    assertThat(new ReplayProvider(List.of(1L)).toString()).contains(ReplayProvider.class.getSimpleName()).contains("values.size=1");
  }
}
