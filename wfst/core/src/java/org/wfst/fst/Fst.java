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

import org.wfst.semiring.Semiring;

/**
 * Read access to a weighted finite-state transducer. States are dense integers {@code 0 ..
 * getNumStates()-1}; each has an optional final weight and an ordered list of outgoing {@link Arc
 * arcs}.
 *
 * <p>Implementations are not thread-safe: reading a graph while another thread mutates it is
 * undefined.
 *
 * @param <W> weight value type
 * @lucene.experimental
 */
public interface Fst<W> {

  /** The label meaning "no symbol". */
  int EPSILON = 0;

  /** Returned by {@link #getStart()} when there is no start state. */
  int NO_STATE = -1;

  /** Known to have no cycle. */
  long ACYCLIC = 1L << 0;

  /** Known to have at least one cycle. */
  long CYCLIC = 1L << 1;

  /** Known to have every arc lead from a lower to a higher state id. */
  long TOP_SORTED = 1L << 2;

  /** Known to have an arc that does not lead to a higher state id. */
  long NOT_TOP_SORTED = 1L << 3;

  /** All structural property bits. */
  long STRUCTURAL_PROPERTIES = ACYCLIC | CYCLIC | TOP_SORTED | NOT_TOP_SORTED;

  /** The algebra of this graph's weights. */
  Semiring<W, ?> getSemiring();

  int getNumStates();

  /** Total number of arcs over all states. */
  int getNumArcs();

  /** Start state, or {@link #NO_STATE}. */
  int getStart();

  /** True if a final weight was set for this state, even if that weight is zero. */
  boolean isFinal(int state);

  /** Final weight of this state; the semiring's zero if none was set. */
  W getFinal(int state);

  int getNumArcs(int state);

  /** Returns the arc at {@code index} (in insertion order) leaving {@code state}. */
  Arc<W> getArc(int state, int index);

  /** Destination of the arc at {@code index} leaving {@code state}, without creating an arc. */
  int getNextState(int state, int index);

  /** Arcs leaving {@code state} in insertion order, created lazily. */
  Iterable<Arc<W>> arcs(int state);

  /**
   * Cached structural properties ({@link #ACYCLIC}, {@link #TOP_SORTED}, ...). A bit that is not
   * set means unknown, not false.
   */
  long getProperties();
}
