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

import com.axonops.libnfa.api.InputRequiredException;
import com.axonops.libnfa.graph.StateGraph;
import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Objects;
import java.util.PrimitiveIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a {@link StateGraph} against input by keeping every active node at once.
 *
 * <p>The active set starts as the zero-width closure of the start node. Each input code point
 * moves the set along every edge whose target accepts it, and the result is closed again. When
 * the input is exhausted the match succeeds if the termination node is reachable without
 * consuming anything further. There is no backtracking: the work per code point is bounded by the
 * number of edges, so a match costs {@code O(|pattern| * |input|)}.
 *
 * <p>Only {@code *} repeats (minimum 0) are zero-width. A {@code +} repeat is a closure boundary
 * like any other consuming node.
 *
 * <p>Thread-safe: the graph is immutable and all per-run state is local.
 *
 * @since 1.0.0
 */
public final class NfaSimulator {
  private static final Logger logger = LoggerFactory.getLogger(NfaSimulator.class);

  private final StateGraph graph;
  private final BitSet initial;

  public NfaSimulator(StateGraph graph) {
    this.graph = Objects.requireNonNull(graph, "graph cannot be null");
    BitSet start = new BitSet(graph.size());
    start.set(StateGraph.START);
    this.initial = closure(start);
  }

  public StateGraph graph() {
    return graph;
  }

  /**
   * Tests whether the entire input is accepted.
   *
   * @param input the input; the empty string is allowed
   * @return true if every code point is consumed and termination is reachable afterwards
   * @throws InputRequiredException if {@code input} is null
   */
  public boolean matches(CharSequence input) {
    if (input == null) {
      throw new InputRequiredException("input cannot be null");
    }

    BitSet active = (BitSet) initial.clone();
    PrimitiveIterator.OfInt codePoints = input.codePoints().iterator();
    int position = 0;
    while (codePoints.hasNext()) {
      BitSet next = step(active, codePoints.nextInt());
      if (next.isEmpty()) {
        logger.trace("NFA: Input rejected at code point {}", position);
        return false;
      }
      active = closure(next);
      position++;
    }
    return canTerminate(active);
  }

  /**
   * Returns the nodes entered by consuming one code point.
   *
   * <p>A node is entered if some active node has an edge to it and it accepts the code point. The
   * result is not closed.
   *
   * @param active current active set
   * @param codePoint the code point to consume
   * @return the new set, empty if the code point is rejected
   */
  public BitSet step(BitSet active, int codePoint) {
    BitSet next = new BitSet(graph.size());
    for (int s = active.nextSetBit(0); s >= 0; s = active.nextSetBit(s + 1)) {
      for (int i = 0, n = graph.successorCount(s); i < n; i++) {
        int target = graph.successor(s, i);
        if (!next.get(target) && graph.state(target).accepts(codePoint)) {
          next.set(target);
        }
      }
    }
    return next;
  }

  /**
   * Expands a set with every zero-width repeat reachable from it.
   *
   * <p>Breadth-first from the given nodes. A successor that is a {@code *} repeat is added to the
   * result and explored in turn, which makes the nodes after it available before any input is
   * consumed for it. Other successors are not added. The visited set bounds the search, so repeat
   * self-loops terminate.
   *
   * @param states seed nodes (not modified)
   * @return a new set containing the seeds and every zero-width repeat reachable from them
   */
  public BitSet closure(BitSet states) {
    BitSet result = (BitSet) states.clone();
    BitSet visited = new BitSet(graph.size());
    Deque<Integer> worklist = new ArrayDeque<>();
    states.stream().forEach(worklist::add);

    while (!worklist.isEmpty()) {
      int s = worklist.poll();
      if (visited.get(s)) {
        continue;
      }
      visited.set(s);

      for (int i = 0, n = graph.successorCount(s); i < n; i++) {
        int target = graph.successor(s, i);
        if (graph.state(target).isZeroWidth() && !visited.get(target)) {
          result.set(target);
          worklist.add(target);
        }
      }
    }
    return result;
  }

  /**
   * Tests whether termination is reachable from a set without consuming input.
   *
   * <p>Breadth-first; succeeds as soon as a visited node has a direct edge to termination. The
   * search only continues through {@code *} repeats.
   *
   * @param states nodes to start from (not modified)
   * @return true if termination is reachable
   */
  public boolean canTerminate(BitSet states) {
    BitSet visited = new BitSet(graph.size());
    Deque<Integer> queue = new ArrayDeque<>();
    states.stream().forEach(queue::add);

    while (!queue.isEmpty()) {
      int s = queue.poll();
      if (visited.get(s)) {
        continue;
      }
      visited.set(s);

      for (int i = 0, n = graph.successorCount(s); i < n; i++) {
        if (graph.isTermination(graph.successor(s, i))) {
          return true;
        }
      }
      for (int i = 0, n = graph.successorCount(s); i < n; i++) {
        int target = graph.successor(s, i);
        if (graph.state(target).isZeroWidth() && !visited.get(target)) {
          queue.add(target);
        }
      }
    }
    return false;
  }

  /** Active set before any input is consumed (a copy). */
  public BitSet initialStates() {
    return (BitSet) initial.clone();
  }
}
