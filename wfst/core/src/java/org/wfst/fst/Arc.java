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

import java.util.Objects;

/**
 * A single arc: input and output labels, a weight and the state it leads to. Arcs are immutable,
 * so a graph never shares mutable storage with its callers.
 *
 * @param <W> weight value type
 */
public final class Arc<W> {

  private final int ilabel;
  private final int olabel;
  private final W weight;
  private final int nextState;

  public Arc(int ilabel, int olabel, W weight, int nextState) {
    if (ilabel < 0) {
      throw new IllegalArgumentException("ilabel must be >= 0, got: " + ilabel);
    }
    if (olabel < 0) {
      throw new IllegalArgumentException("olabel must be >= 0, got: " + olabel);
    }
    if (nextState < 0) {
      throw new IllegalArgumentException("nextState must be >= 0, got: " + nextState);
    }
    this.ilabel = ilabel;
    this.olabel = olabel;
    this.weight = Objects.requireNonNull(weight, "weight");
    this.nextState = nextState;
  }

  /** Input label; {@link Fst#EPSILON} if this arc consumes nothing. */
  public int ilabel() {
    return ilabel;
  }

  /** Output label; {@link Fst#EPSILON} if this arc emits nothing. */
  public int olabel() {
    return olabel;
  }

  public W weight() {
    return weight;
  }

  /** Destination state. */
  public int nextState() {
    return nextState;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof Arc == false) {
      return false;
    }
    Arc<?> that = (Arc<?>) other;
    return ilabel == that.ilabel
        && olabel == that.olabel
        && nextState == that.nextState
        && weight.equals(that.weight);
  }

  @Override
  public int hashCode() {
    int h = ilabel;
    h = 31 * h + olabel;
    h = 31 * h + nextState;
    return 31 * h + weight.hashCode();
  }

  @Override
  public String toString() {
    return "Arc(" + ilabel + ":" + olabel + "/" + weight + " -> " + nextState + ")";
  }
}
