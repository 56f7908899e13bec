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

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A node of the compiled state graph.
 *
 * <p>The variant set is closed: the grammar only produces {@link Start}, {@link Termination},
 * {@link Wildcard}, {@link Literal}, {@link CharClass} and {@link Repeat}. Every variant is an
 * immutable value; edges between nodes live in {@link StateGraph}, not in the nodes themselves.
 *
 * <p>Characters are handled as Unicode code points, so a supplementary character in either the
 * pattern or the input counts as a single position.
 *
 * @since 1.0.0
 */
public sealed interface State
    permits State.Start,
        State.Termination,
        State.Wildcard,
        State.Literal,
        State.CharClass,
        State.Repeat {

  /**
   * Tests whether this node consumes the given code point.
   *
   * @param codePoint the input code point
   * @return true if a transition into this node may consume {@code codePoint}
   */
  boolean accepts(int codePoint);

  /**
   * Whether this node can be passed through without consuming input ({@code *} repetition).
   *
   * @return true only for a {@link Repeat} with minimum 0
   */
  default boolean isZeroWidth() {
    return false;
  }

  /** Entry node. Accepts nothing. */
  record Start() implements State {
    @Override
    public boolean accepts(int codePoint) {
      return false;
    }

    @Override
    public String toString() {
      return "START";
    }
  }

  /** Accepting sink. Accepts nothing and has no outgoing edges. */
  record Termination() implements State {
    @Override
    public boolean accepts(int codePoint) {
      return false;
    }

    @Override
    public String toString() {
      return "END";
    }
  }

  /** The {@code .} construct. */
  record Wildcard() implements State {
    @Override
    public boolean accepts(int codePoint) {
      return true;
    }

    @Override
    public String toString() {
      return ".";
    }
  }

  /** A single literal code point. */
  record Literal(int symbol) implements State {
    @Override
    public boolean accepts(int codePoint) {
      return symbol == codePoint;
    }

    @Override
    public String toString() {
      return "'" + new String(Character.toChars(symbol)) + "'";
    }
  }

  /**
   * A bracketed class such as {@code [a-z0-9_]} or {@code [^0-9]}.
   *
   * @param ranges inclusive ranges, in pattern order (overlap is allowed)
   * @param singles individual code points
   * @param negated true if the body started with {@code ^}
   */
  record CharClass(List<CodePointRange> ranges, Set<Integer> singles, boolean negated)
      implements State {

    public CharClass {
      ranges = List.copyOf(ranges);
      singles = Set.copyOf(singles);
    }

    @Override
    public boolean accepts(int codePoint) {
      boolean inClass = singles.contains(codePoint);
      for (int i = 0; !inClass && i < ranges.size(); i++) {
        inClass = ranges.get(i).contains(codePoint);
      }
      return inClass != negated;
    }

    @Override
    public String toString() {
      StringBuilder sb = new StringBuilder("[");
      if (negated) {
        sb.append('^');
      }
      ranges.forEach(sb::append);
      sb.append(
          singles.stream()
              .sorted()
              .map(cp -> new String(Character.toChars(cp)))
              .collect(Collectors.joining()));
      return sb.append(']').toString();
    }
  }

  /**
   * Postfix repetition of a single construct.
   *
   * <p>The node carries a self-loop edge in the graph so that each further repetition is one more
   * transition into the same node. The wrapped construct is no longer part of the graph; it is
   * only consulted for {@link #accepts(int)}.
   *
   * @param inner the repeated construct
   * @param minimum {@link #ZERO_OR_MORE} for {@code *}, {@link #ONE_OR_MORE} for {@code +}
   */
  record Repeat(State inner, int minimum) implements State {

    public static final int ZERO_OR_MORE = 0;
    public static final int ONE_OR_MORE = 1;

    public Repeat {
      Objects.requireNonNull(inner, "inner cannot be null");
      if (minimum != ZERO_OR_MORE && minimum != ONE_OR_MORE) {
        throw new IllegalArgumentException("minimum must be 0 or 1, got " + minimum);
      }
    }

    @Override
    public boolean accepts(int codePoint) {
      return inner.accepts(codePoint);
    }

    @Override
    public boolean isZeroWidth() {
      return minimum == ZERO_OR_MORE;
    }

    @Override
    public String toString() {
      return inner + (minimum == ZERO_OR_MORE ? "*" : "+");
    }
  }
}
