/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.libnfa.graph;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class StateTest {

  // ===== Non-consuming nodes =====

  @Test
  void testStartAndTerminationAcceptNothing() {
    assertThat(new State.Start().accepts('a')).isFalse();
    assertThat(new State.Termination().accepts('a')).isFalse();
    assertThat(new State.Start().isZeroWidth()).isFalse();
    assertThat(new State.Termination().isZeroWidth()).isFalse();
  }

  // ===== Consuming nodes =====

  @Test
  void testWildcardAcceptsAnyCodePoint() {
    State wildcard = new State.Wildcard();
    assertThat(wildcard.accepts('a')).isTrue();
    assertThat(wildcard.accepts('\n')).isTrue();
    assertThat(wildcard.accepts(0x1F600)).isTrue();
  }

  @Test
  void testLiteralAcceptsOnlyItsSymbol() {
    State literal = new State.Literal('x');
    assertThat(literal.accepts('x')).isTrue();
    assertThat(literal.accepts('X')).isFalse();
    assertThat(literal.accepts('y')).isFalse();
  }

  @Test
  void testCharClassRangesAndSingles() {
    State.CharClass cls =
        new State.CharClass(List.of(new CodePointRange('a', 'f')), Set.of((int) '_'), false);

    assertThat(cls.accepts('a')).isTrue();
    assertThat(cls.accepts('f')).isTrue();
    assertThat(cls.accepts('_')).isTrue();
    assertThat(cls.accepts('g')).isFalse();
    assertThat(cls.accepts('A')).isFalse();
  }

  @Test
  void testNegatedCharClass() {
    State.CharClass cls =
        new State.CharClass(List.of(new CodePointRange('0', '9')), Set.of(), true);

    assertThat(cls.accepts('5')).isFalse();
    assertThat(cls.accepts('x')).isTrue();
  }

  @Test
  void testEmptyCharClassAcceptsNothingUnlessNegated() {
    assertThat(new State.CharClass(List.of(), Set.of(), false).accepts('a')).isFalse();
    assertThat(new State.CharClass(List.of(), Set.of(), true).accepts('a')).isTrue();
  }

  @Test
  void testOverlappingRangesAreTolerated() {
    State.CharClass cls =
        new State.CharClass(
            List.of(new CodePointRange('a', 'm'), new CodePointRange('f', 'z')),
            Set.of((int) 'k'),
            false);

    assertThat(cls.accepts('k')).isTrue();
    assertThat(cls.accepts('z')).isTrue();
  }

  // ===== Repeat =====

  @Test
  void testRepeatDelegatesToInner() {
    State.Repeat star = new State.Repeat(new State.Literal('a'), State.Repeat.ZERO_OR_MORE);
    State.Repeat plus = new State.Repeat(new State.Literal('a'), State.Repeat.ONE_OR_MORE);

    assertThat(star.accepts('a')).isTrue();
    assertThat(star.accepts('b')).isFalse();
    assertThat(plus.accepts('a')).isTrue();
  }

  @Test
  void testOnlyStarIsZeroWidth() {
    assertThat(new State.Repeat(new State.Wildcard(), 0).isZeroWidth()).isTrue();
    assertThat(new State.Repeat(new State.Wildcard(), 1).isZeroWidth()).isFalse();
  }

  @Test
  void testRepeatRejectsInvalidMinimum() {
    assertThatThrownBy(() -> new State.Repeat(new State.Wildcard(), 2))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("minimum");
  }

  @Test
  void testRepeatRequiresInner() {
    assertThatThrownBy(() -> new State.Repeat(null, 0))
        .isInstanceOf(NullPointerException.class)
        .hasMessageContaining("inner");
  }

  @Test
  void testToString() {
    assertThat(new State.Repeat(new State.Literal('a'), 0)).hasToString("'a'*");
    assertThat(new State.Repeat(new State.Wildcard(), 1)).hasToString(".+");
    assertThat(new State.CharClass(List.of(new CodePointRange('0', '9')), Set.of(), true))
        .hasToString("[^0-9]");
  }

  // ===== CodePointRange =====

  @Test
  void testCodePointRangeBounds() {
    CodePointRange range = new CodePointRange('b', 'd');
    assertThat(range.contains('a')).isFalse();
    assertThat(range.contains('b')).isTrue();
    assertThat(range.contains('d')).isTrue();
    assertThat(range.contains('e')).isFalse();
  }

  @Test
  void testCodePointRangeRejectsReversedBounds() {
    assertThatThrownBy(() -> new CodePointRange('z', 'a'))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
