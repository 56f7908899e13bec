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

package com.axonops.libnfa.engine;

import static org.assertj.core.api.Assertions.*;

import com.axonops.libnfa.api.InputRequiredException;
import com.axonops.libnfa.compiler.PatternCompiler;
import com.axonops.libnfa.graph.State;
import com.axonops.libnfa.graph.StateGraph;
import java.util.BitSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class NfaSimulatorTest {

  private static NfaSimulator simulator(String pattern) {
    return new NfaSimulator(PatternCompiler.compile(pattern));
  }

  private static BitSet setOf(int... indices) {
    BitSet set = new BitSet();
    for (int index : indices) {
      set.set(index);
    }
    return set;
  }

  // ===== Closure =====

  @Test
  void testClosureFollowsChainedStars() {
    // 0:START -> 1:a* -> 2:b* -> 3:'c' -> 4:END
    NfaSimulator sim = simulator("a*b*c");
    StateGraph graph = sim.graph();
    assertThat(graph.state(1).isZeroWidth()).isTrue();
    assertThat(graph.state(2).isZeroWidth()).isTrue();
    assertThat(graph.state(3)).isEqualTo(new State.Literal('c'));

    assertThat(sim.closure(setOf(StateGraph.START))).isEqualTo(setOf(0, 1, 2));
    assertThat(sim.initialStates()).isEqualTo(setOf(0, 1, 2));
  }

  @Test
  void testClosureStopsAtPlus() {
    // 0:START -> 1:a+ -> 2:b* -> 3:END
    NfaSimulator sim = simulator("a+b*");

    assertThat(sim.closure(setOf(StateGraph.START))).isEqualTo(setOf(0));
    assertThat(sim.closure(setOf(1))).isEqualTo(setOf(1, 2));
  }

  @Test
  void testClosureStopsAtConsumingNode() {
    // 0:START -> 1:'a' -> 2:b* -> 3:END
    NfaSimulator sim = simulator("ab*");

    assertThat(sim.closure(setOf(StateGraph.START))).isEqualTo(setOf(0));
    assertThat(sim.closure(setOf(1))).isEqualTo(setOf(1, 2));
  }

  @Test
  void testClosureDoesNotModifyInput() {
    NfaSimulator sim = simulator("a*");
    BitSet seed = setOf(StateGraph.START);

    sim.closure(seed);

    assertThat(seed).isEqualTo(setOf(StateGraph.START));
  }

  @Test
  void testClosureTerminatesOnSelfLoops() {
    NfaSimulator sim = simulator(".*.*.*");
    assertThat(sim.closure(setOf(StateGraph.START)).cardinality()).isEqualTo(4);
  }

  // ===== Termination reachability =====

  @Test
  void testCanTerminateThroughStars() {
    NfaSimulator sim = simulator("a*b*c*");
    assertThat(sim.canTerminate(setOf(StateGraph.START))).isTrue();
  }

  @Test
  void testCannotTerminateBeforeRequiredConstruct() {
    NfaSimulator sim = simulator("a*b*c");

    assertThat(sim.canTerminate(sim.initialStates())).isFalse();
    assertThat(sim.canTerminate(setOf(3))).isTrue();
  }

  @Test
  void testCannotTerminateThroughPlus() {
    NfaSimulator sim = simulator("a+");
    assertThat(sim.canTerminate(sim.initialStates())).isFalse();
  }

  // ===== Step =====

  @Test
  void testStepFollowsEveryAcceptingEdge() {
    // 0:START -> 1:a* -> 2:'a' -> 3:END
    NfaSimulator sim = simulator("a*a");

    BitSet next = sim.step(sim.initialStates(), 'a');

    assertThat(next).isEqualTo(setOf(1, 2));
  }

  @Test
  void testStepRejects() {
    NfaSimulator sim = simulator("abc");
    assertThat(sim.step(sim.initialStates(), 'x').isEmpty()).isTrue();
  }

  // ===== Full runs =====

  @ParameterizedTest
  @CsvSource({
    "a*a, '', false",
    "a*a, a, true",
    "a*a, aaa, true",
    "a*b, b, true",
    "a*b, aab, true",
    "a*b, a, false",
    "x*y*z*, '', true",
    "x*y*z*, xz, true",
    "x*y*z*, zx, false",
    "b+a*, b, true",
    "b+a*, bbaa, true",
    "b+a*, a, false",
    "a+*, '', true",
    "a+*, aaa, true",
    ".*x, abcx, true",
    ".*x, abc, false"
  })
  void testMatches(String pattern, String input, boolean expected) {
    assertThat(simulator(pattern).matches(input)).isEqualTo(expected);
  }

  @Test
  void testSupplementaryInputIsOneCodePoint() {
    assertThat(simulator(".").matches("😀")).isTrue();
    assertThat(simulator("..").matches("😀")).isFalse();
  }

  @Test
  void testNullInputRequired() {
    assertThatThrownBy(() -> simulator("a*").matches(null))
        .isInstanceOf(InputRequiredException.class)
        .hasMessageContaining("Input required");
  }

  @Test
  void testLongInputIsLinear() {
    String input = "a".repeat(100_000) + "b";
    assertThat(simulator("a*a*a*a*b").matches(input)).isTrue();
    assertThat(simulator("a*a*a*a*c").matches(input)).isFalse();
  }
}
