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

package com.axonops.libnfa.compiler;

import com.axonops.libnfa.api.PatternCompilationException;
import com.axonops.libnfa.graph.State;
import com.axonops.libnfa.graph.StateGraph;
import com.axonops.libnfa.util.PatternHasher;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a pattern string into a {@link StateGraph}.
 *
 * <p>Supported syntax: literal code points, {@code .} (any code point), bracketed classes such as
 * {@code [a-z0-9]} and {@code [^0-9]}, and postfix {@code *} / {@code +} applied to the construct
 * immediately before them.
 *
 * <p>The pattern is scanned once, left to right. The compiler keeps the list of top-level
 * constructs built so far; each new construct is linked from the previous one (or from the start
 * node). A quantifier replaces the most recent construct with a {@link State.Repeat} node that
 * wraps it, rewires the parent edge to the repeat and gives the repeat a self-loop.
 *
 * <p>Thread-safe: stateless.
 *
 * @since 1.0.0
 */
public final class PatternCompiler {
  private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

  private PatternCompiler() {
    // Utility class
  }

  /**
   * Compiles a pattern.
   *
   * @param pattern the pattern string
   * @return the frozen graph; its entry node is {@link StateGraph#START}
   * @throws PatternCompilationException if the pattern is null or empty, starts with {@code *} or
   *     {@code +}, or contains a {@code [} with no closing {@code ]}
   */
  public static StateGraph compile(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      throw new PatternCompilationException(pattern, "Pattern is null or empty");
    }

    int[] codePoints = pattern.codePoints().toArray();
    if (isQuantifier(codePoints[0])) {
      throw new PatternCompilationException(
          pattern,
          "'"
              + Character.toString(codePoints[0])
              + "' cannot be used without a preceding construct");
    }

    StateGraph.Builder builder = StateGraph.builder();
    List<Integer> constructs = new ArrayList<>();

    int i = 0;
    while (i < codePoints.length) {
      int c = codePoints[i];

      if (isQuantifier(c)) {
        int minimum = c == '*' ? State.Repeat.ZERO_OR_MORE : State.Repeat.ONE_OR_MORE;
        applyQuantifier(builder, constructs, minimum);
        i++;
      } else if (c == '[') {
        int close = indexOf(codePoints, ']', i + 1);
        if (close < 0) {
          throw new PatternCompilationException(
              pattern, "Unclosed character class starting at index " + i);
        }
        append(builder, constructs, CharClassParser.parse(codePoints, i + 1, close));
        i = close + 1;
      } else {
        append(builder, constructs, c == '.' ? new State.Wildcard() : new State.Literal(c));
        i++;
      }
    }

    int termination = builder.addState(new State.Termination());
    builder.addEdge(last(constructs), termination);

    StateGraph graph = builder.build();
    logger.trace(
        "NFA: Compiled pattern - hash: {}, constructs: {}, states: {}",
        PatternHasher.hash(pattern),
        constructs.size(),
        graph.size());
    return graph;
  }

  /** Adds a construct linked from the previous construct, or from start if there is none. */
  private static void append(StateGraph.Builder builder, List<Integer> constructs, State state) {
    int parent = last(constructs);
    int index = builder.addState(state);
    builder.addEdge(parent, index);
    constructs.add(index);
  }

  /**
   * Wraps the most recent construct in a repeat node.
   *
   * <p>The wrapped construct has no outgoing edges yet (nothing has been appended after it), so
   * once the parent edge is rewired it is unreachable and {@link StateGraph.Builder#build()} drops
   * it.
   */
  private static void applyQuantifier(
      StateGraph.Builder builder, List<Integer> constructs, int minimum) {
    int lastSlot = constructs.size() - 1;
    int previous = constructs.get(lastSlot);
    int parent = lastSlot > 0 ? constructs.get(lastSlot - 1) : StateGraph.START;

    int repeat = builder.addState(new State.Repeat(builder.state(previous), minimum));
    builder.replaceEdge(parent, previous, repeat);
    builder.addEdge(repeat, repeat);
    constructs.set(lastSlot, repeat);
  }

  private static int last(List<Integer> constructs) {
    return constructs.isEmpty() ? StateGraph.START : constructs.get(constructs.size() - 1);
  }

  private static boolean isQuantifier(int c) {
    return c == '*' || c == '+';
  }

  private static int indexOf(int[] codePoints, int target, int from) {
    for (int j = from; j < codePoints.length; j++) {
      if (codePoints[j] == target) {
        return j;
      }
    }
    return -1;
  }
}
