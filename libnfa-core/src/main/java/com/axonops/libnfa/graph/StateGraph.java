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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Immutable NFA graph stored as an arena of nodes addressed by index.
 *
 * <p>Index {@link #START} always holds the {@link State.Start} node. Each node owns an ordered
 * array of successor indices; a {@link State.Repeat} node lists itself among its successors. The
 * graph contains exactly one {@link State.Termination} node and it is reachable from the start.
 *
 * <p>Thread-safe: instances are never mutated after {@link Builder#build()}.
 *
 * @since 1.0.0
 */
public final class StateGraph {

  /** Index of the start node in every graph. */
  public static final int START = 0;

  private static final int[] NO_SUCCESSORS = new int[0];

  private final State[] states;
  private final int[][] successors;
  private final int termination;

  private StateGraph(State[] states, int[][] successors, int termination) {
    this.states = states;
    this.successors = successors;
    this.termination = termination;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Number of nodes in the graph, including start and termination. */
  public int size() {
    return states.length;
  }

  public State state(int index) {
    return states[index];
  }

  public int terminationIndex() {
    return termination;
  }

  public boolean isTermination(int index) {
    return index == termination;
  }

  public int successorCount(int index) {
    return successors[index].length;
  }

  public int successor(int index, int position) {
    return successors[index][position];
  }

  /**
   * Returns a copy of the successor indices of a node, in insertion order.
   *
   * @param index node index
   * @return successor indices (may contain {@code index} itself for repeats)
   */
  public int[] successors(int index) {
    return successors[index].clone();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("StateGraph{");
    for (int i = 0; i < states.length; i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(i).append(':').append(states[i]).append(" ->");
      for (int next : successors[i]) {
        sb.append(' ').append(next);
      }
    }
    return sb.append('}').toString();
  }

  /**
   * Mutable builder used while a pattern is being compiled.
   *
   * <p>Not thread-safe. {@link #build()} drops nodes that are no longer reachable from the start
   * (constructs that were wrapped by a repeat) and renumbers the rest in creation order.
   */
  public static final class Builder {
    private final List<State> states = new ArrayList<>();
    private final List<List<Integer>> edges = new ArrayList<>();

    private Builder() {
      addState(new State.Start());
    }

    /**
     * Adds a node with no edges.
     *
     * @param state the node
     * @return index of the new node
     */
    public int addState(State state) {
      states.add(Objects.requireNonNull(state, "state cannot be null"));
      edges.add(new ArrayList<>());
      return states.size() - 1;
    }

    public State state(int index) {
      return states.get(index);
    }

    /** Appends a directed edge. Duplicate edges are kept. */
    public Builder addEdge(int from, int to) {
      checkIndex(from);
      checkIndex(to);
      edges.get(from).add(to);
      return this;
    }

    /**
     * Removes every edge {@code from -> oldTarget} and appends {@code from -> newTarget}.
     *
     * @param from source node
     * @param oldTarget node being replaced
     * @param newTarget replacement node
     * @return this builder
     */
    public Builder replaceEdge(int from, int oldTarget, int newTarget) {
      checkIndex(from);
      checkIndex(newTarget);
      List<Integer> out = edges.get(from);
      out.removeIf(target -> target == oldTarget);
      out.add(newTarget);
      return this;
    }

    /**
     * Freezes the graph.
     *
     * @return the immutable graph
     * @throws IllegalStateException if the graph does not have exactly one reachable termination
     *     node
     */
    public StateGraph build() {
      BitSet reachable = reachableFromStart();

      int[] remap = new int[states.size()];
      int count = 0;
      for (int i = 0; i < states.size(); i++) {
        remap[i] = reachable.get(i) ? count++ : -1;
      }

      State[] frozenStates = new State[count];
      int[][] frozenEdges = new int[count][];
      int termination = -1;
      for (int i = reachable.nextSetBit(0); i >= 0; i = reachable.nextSetBit(i + 1)) {
        int index = remap[i];
        frozenStates[index] = states.get(i);
        List<Integer> out = edges.get(i);
        if (out.isEmpty()) {
          frozenEdges[index] = NO_SUCCESSORS;
        } else {
          frozenEdges[index] = out.stream().mapToInt(target -> remap[target]).toArray();
        }
        if (states.get(i) instanceof State.Termination) {
          if (termination >= 0) {
            throw new IllegalStateException("Graph has more than one termination node");
          }
          termination = index;
        }
      }

      if (termination < 0) {
        throw new IllegalStateException("Termination node is not reachable from start");
      }
      if (frozenEdges[termination].length > 0) {
        throw new IllegalStateException("Termination node must not have outgoing edges");
      }
      return new StateGraph(frozenStates, frozenEdges, termination);
    }

    private BitSet reachableFromStart() {
      BitSet seen = new BitSet(states.size());
      Deque<Integer> queue = new ArrayDeque<>();
      seen.set(START);
      queue.add(START);
      while (!queue.isEmpty()) {
        for (int next : edges.get(queue.poll())) {
          if (!seen.get(next)) {
            seen.set(next);
            queue.add(next);
          }
        }
      }
      return seen;
    }

    private void checkIndex(int index) {
      if (index < 0 || index >= states.size()) {
        throw new IndexOutOfBoundsException(
            "State index " + index + " out of range [0, " + states.size() + ")");
      }
    }
  }
}
