/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.wfst.fst;

import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.InfoStream;

/**
 * Topologically sorts a graph in place, so that every arc leads from a lower to a higher state
 * id.
 *
 * <p>The order comes from a depth-first traversal that colours states white (unvisited), gray
 * (on the current path) and black (finished): an arc into a gray state is a back edge and proves
 * a cycle, self-loops included. The traversal keeps its own stack of (state, next arc) pairs, so
 * its depth is bounded by the heap rather than the thread's call stack. It starts from the start
 * state and then picks up every remaining unvisited state in id order, so disconnected components
 * are classified too.
 *
 * <p>Weights are never inspected; this works for any semiring.
 *
 * @lucene.experimental
 */
public final class TopologicalSort {

  /** {@link InfoStream} component this class logs to. */
  public static final String INFO_COMPONENT = "TOPSORT";

  private static final byte WHITE = 0;
  private static final byte GRAY = 1;
  private static final byte BLACK = 2;

  private TopologicalSort() {}

  /**
   * Sorts the graph's states topologically, logging to the default {@link InfoStream}.
   *
   * @see #topSort(MutableFst, InfoStream)
   */
  public static boolean topSort(MutableFst<?> fst) {
    return topSort(fst, InfoStream.getDefault());
  }

  /**
   * Sorts the graph's states topologically. Returns {@code true} if the graph is acyclic, in
   * which case the states have been renumbered so that every arc leads to a higher id. Returns
   * {@code false} if the graph has a cycle, in which case its structure is left untouched.
   *
   * <p>A graph that is already sorted keeps its numbering, so sorting twice is a no-op.
   */
  public static boolean topSort(MutableFst<?> fst, InfoStream infoStream) {
    final long props = fst.getProperties();
    if ((props & Fst.CYCLIC) != 0) {
      if (infoStream.isEnabled(INFO_COMPONENT)) {
        infoStream.message(INFO_COMPONENT, "graph is known to be cyclic");
      }
      return false;
    }
    if (isTopSorted(fst)) {
      fst.setProperties(Fst.ACYCLIC | Fst.TOP_SORTED, Fst.STRUCTURAL_PROPERTIES);
      if (infoStream.isEnabled(INFO_COMPONENT)) {
        infoStream.message(INFO_COMPONENT, "already sorted: numStates=" + fst.getNumStates());
      }
      return true;
    }

    final int[] order = topOrder(fst);
    if (order == null) {
      fst.setProperties(Fst.CYCLIC | Fst.NOT_TOP_SORTED, Fst.STRUCTURAL_PROPERTIES);
      if (infoStream.isEnabled(INFO_COMPONENT)) {
        infoStream.message(
            INFO_COMPONENT,
            "cycle found: numStates=" + fst.getNumStates() + " numArcs=" + fst.getNumArcs());
      }
      return false;
    }

    fst.permute(order);
    fst.setProperties(Fst.ACYCLIC | Fst.TOP_SORTED, Fst.STRUCTURAL_PROPERTIES);
    if (infoStream.isEnabled(INFO_COMPONENT)) {
      infoStream.message(
          INFO_COMPONENT,
          "sorted: numStates=" + fst.getNumStates() + " numArcs=" + fst.getNumArcs());
    }
    return true;
  }

  /**
   * Returns a topological rank for every state ({@code order[s]} is the new id of state {@code
   * s}), or {@code null} if the graph has a cycle. The graph is not modified.
   */
  public static int[] topOrder(Fst<?> fst) {
    final int numStates = fst.getNumStates();
    final int[] order = new int[numStates];
    final byte[] color = new byte[numStates];

    // explicit DFS stack of (state, index of the next arc to follow)
    int[] stackStates = new int[16];
    int[] stackArcs = new int[16];
    int depth;

    // ranks are handed out in decreasing order as states finish
    int nextRank = numStates - 1;

    final int start = fst.getStart();
    for (int i = -1; i < numStates; i++) {
      final int root = i == -1 ? start : i;
      if (root == Fst.NO_STATE || color[root] != WHITE) {
        continue;
      }
      color[root] = GRAY;
      stackStates[0] = root;
      stackArcs[0] = 0;
      depth = 1;

      while (depth > 0) {
        final int state = stackStates[depth - 1];
        final int arc = stackArcs[depth - 1];
        if (arc < fst.getNumArcs(state)) {
          stackArcs[depth - 1]++;
          final int next = fst.getNextState(state, arc);
          if (color[next] == WHITE) {
            color[next] = GRAY;
            if (depth == stackStates.length) {
              stackStates = ArrayUtil.grow(stackStates, depth + 1);
              stackArcs = ArrayUtil.growExact(stackArcs, stackStates.length);
            }
            stackStates[depth] = next;
            stackArcs[depth] = 0;
            depth++;
          } else if (color[next] == GRAY) {
            // back edge
            return null;
          }
          // black: forward or cross edge, nothing to do
        } else {
          color[state] = BLACK;
          order[state] = nextRank--;
          depth--;
        }
      }
    }
    assert nextRank == -1 : "nextRank=" + nextRank;
    return order;
  }

  /** Returns true if every arc leads from a lower to a higher state id. */
  public static boolean isTopSorted(Fst<?> fst) {
    if ((fst.getProperties() & Fst.TOP_SORTED) != 0) {
      return true;
    }
    if ((fst.getProperties() & Fst.NOT_TOP_SORTED) != 0) {
      return false;
    }
    final int numStates = fst.getNumStates();
    for (int s = 0; s < numStates; s++) {
      final int count = fst.getNumArcs(s);
      for (int i = 0; i < count; i++) {
        if (fst.getNextState(s, i) <= s) {
          return false;
        }
      }
    }
    return true;
  }
}
