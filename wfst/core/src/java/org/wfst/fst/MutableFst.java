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

/**
 * A {@link Fst} that can be changed in place. All state arguments must be live state ids,
 * otherwise an {@link IllegalArgumentException} is thrown. Mutations are synchronous and provide
 * no locking.
 *
 * @param <W> weight value type
 * @lucene.experimental
 */
public interface MutableFst<W> extends Fst<W> {

  /** Adds a new state without arcs and returns its id, always the previous state count. */
  int addState();

  /** Adds {@code count} states. */
  void addStates(int count);

  /** Appends an arc to {@code state}. The arc's destination must be a live state. */
  void addArc(int state, Arc<W> arc);

  /** Sets the start state; {@link #NO_STATE} clears it. */
  void setStart(int state);

  /** Makes {@code state} final with the provided weight. */
  void setFinal(int state, W weight);

  /** Removes the final weight of {@code state}. */
  void clearFinal(int state);

  /**
   * Deletes the provided states and every arc leading into them. Surviving states are renumbered
   * densely, keeping their relative order. Deleting the start state clears the start.
   */
  void deleteStates(int[] states);

  /** Deletes all states. */
  void deleteStates();

  /** Deletes all arcs leaving {@code state}. */
  void deleteArcs(int state);

  /** Deletes the arcs at the provided indices of {@code state}; the others keep their order. */
  void deleteArcs(int state, int[] arcIndices);

  /**
   * Relabels every state: state {@code s} becomes {@code order[s]}. Arc destinations, the start
   * state and final weights follow. {@code order} must be a permutation of {@code 0 ..
   * getNumStates()-1}.
   */
  void permute(int[] order);

  /** Sets the structural property bits selected by {@code mask} to those of {@code props}. */
  void setProperties(long props, long mask);
}
