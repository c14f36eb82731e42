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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.store.InputStreamDataInput;
import org.apache.lucene.store.OutputStreamDataOutput;
import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.FixedBitSet;
import org.apache.lucene.util.RamUsageEstimator;
import org.wfst.semiring.Semiring;

// TODO
//   - could use packed int arrays for the labels
//   - could encode dest w/ delta from the source state?

/**
 * A {@link MutableFst} holding its states in an index-addressed arena: state {@code s} lives at
 * slot {@code s}, and each state keeps its arcs in parallel growable arrays. Arcs refer to their
 * destination by id only, so {@link #permute} and {@link #deleteStates} are relabellings of ids
 * rather than edits of linked structures.
 *
 * <p>Use {@link #save} and {@link #read} to serialize a graph. The format records the {@link
 * Semiring#getName() weight type}, so {@link #read(DataInput)} can rebuild a graph over any
 * semiring registered through SPI.
 *
 * @param <W> weight value type
 * @lucene.experimental
 */
public class VectorFst<W> implements MutableFst<W>, Accountable {

  private static final long BASE_RAM_BYTES_USED =
      RamUsageEstimator.shallowSizeOfInstance(VectorFst.class);

  private static final long STATE_RAM_BYTES_USED =
      RamUsageEstimator.shallowSizeOfInstance(State.class);

  static final String FILE_FORMAT_NAME = "wfst";

  static final int VERSION_START = 0;

  static final int VERSION_CURRENT = VERSION_START;

  private static final byte NOT_FINAL = 0;

  private static final byte FINAL = 1;

  /** One slot of the arena. */
  private static final class State<W> {
    // null if not final
    W finalWeight;
    int numArcs;
    int[] ilabels = NO_INTS;
    int[] olabels = NO_INTS;
    int[] nextStates = NO_INTS;
    Object[] weights = NO_OBJECTS;

    void grow(int minSize) {
      if (ilabels.length < minSize) {
        ilabels = ArrayUtil.grow(ilabels, minSize);
        olabels = ArrayUtil.growExact(olabels, ilabels.length);
        nextStates = ArrayUtil.growExact(nextStates, ilabels.length);
        weights = ArrayUtil.growExact(weights, ilabels.length);
      }
    }

    void addArc(int ilabel, int olabel, Object weight, int nextState) {
      grow(numArcs + 1);
      ilabels[numArcs] = ilabel;
      olabels[numArcs] = olabel;
      weights[numArcs] = weight;
      nextStates[numArcs] = nextState;
      numArcs++;
    }

    /** Keeps the arcs whose bit is not set in {@code drop}, preserving order. */
    void compactArcs(FixedBitSet drop) {
      int upto = 0;
      for (int i = 0; i < numArcs; i++) {
        if (drop.get(i) == false) {
          ilabels[upto] = ilabels[i];
          olabels[upto] = olabels[i];
          weights[upto] = weights[i];
          nextStates[upto] = nextStates[i];
          upto++;
        }
      }
      Arrays.fill(weights, upto, numArcs, null);
      numArcs = upto;
    }

    long ramBytesUsed() {
      return STATE_RAM_BYTES_USED
          + RamUsageEstimator.sizeOf(ilabels)
          + RamUsageEstimator.sizeOf(olabels)
          + RamUsageEstimator.sizeOf(nextStates)
          + RamUsageEstimator.shallowSizeOf(weights);
    }
  }

  private static final int[] NO_INTS = new int[0];
  private static final Object[] NO_OBJECTS = new Object[0];

  private final Semiring<W, ?> semiring;

  private State<W>[] states;

  private int numStates;

  private int numArcs;

  private int start = NO_STATE;

  private long properties;

  /** Creates a graph with no states over the provided semiring. */
  public VectorFst(Semiring<W, ?> semiring) {
    this(semiring, 2);
  }

  /** Creates a graph with room for the given number of states before the arena grows. */
  @SuppressWarnings("unchecked")
  public VectorFst(Semiring<W, ?> semiring, int numStates) {
    this.semiring = Objects.requireNonNull(semiring, "semiring");
    this.states = (State<W>[]) new State[Math.max(numStates, 1)];
  }

  /** Copies another graph's states, arcs, start and final weights. */
  public VectorFst(Fst<W> other) {
    this(other.getSemiring(), other.getNumStates());
    addStates(other.getNumStates());
    for (int s = 0; s < numStates; s++) {
      if (other.isFinal(s)) {
        states[s].finalWeight = other.getFinal(s);
      }
      final int count = other.getNumArcs(s);
      states[s].grow(count);
      for (int i = 0; i < count; i++) {
        Arc<W> arc = other.getArc(s, i);
        states[s].addArc(arc.ilabel(), arc.olabel(), arc.weight(), arc.nextState());
      }
      numArcs += count;
    }
    start = other.getStart();
    properties = other.getProperties() & STRUCTURAL_PROPERTIES;
  }

  @Override
  public Semiring<W, ?> getSemiring() {
    return semiring;
  }

  @Override
  public int getNumStates() {
    return numStates;
  }

  @Override
  public int getNumArcs() {
    return numArcs;
  }

  @Override
  public int getStart() {
    return start;
  }

  @Override
  public boolean isFinal(int state) {
    return state(state).finalWeight != null;
  }

  @Override
  public W getFinal(int state) {
    final W weight = state(state).finalWeight;
    return weight == null ? semiring.zero() : weight;
  }

  @Override
  public int getNumArcs(int state) {
    return state(state).numArcs;
  }

  @Override
  public Arc<W> getArc(int state, int index) {
    final State<W> st = state(state);
    Objects.checkIndex(index, st.numArcs);
    return newArc(st, index);
  }

  @Override
  public int getNextState(int state, int index) {
    final State<W> st = state(state);
    Objects.checkIndex(index, st.numArcs);
    return st.nextStates[index];
  }

  @Override
  public Iterable<Arc<W>> arcs(int state) {
    final State<W> st = state(state);
    return () ->
        new Iterator<Arc<W>>() {
          int upto;

          @Override
          public boolean hasNext() {
            return upto < st.numArcs;
          }

          @Override
          public Arc<W> next() {
            if (upto >= st.numArcs) {
              throw new NoSuchElementException();
            }
            return newArc(st, upto++);
          }
        };
  }

  @Override
  public long getProperties() {
    return properties;
  }

  @Override
  public int addState() {
    if (numStates == states.length) {
      states = ArrayUtil.grow(states, numStates + 1);
    }
    states[numStates] = new State<>();
    properties &= ~STRUCTURAL_PROPERTIES;
    return numStates++;
  }

  @Override
  public void addStates(int count) {
    if (count < 0) {
      throw new IllegalArgumentException("count must be >= 0, got: " + count);
    }
    states = ArrayUtil.grow(states, numStates + count);
    for (int i = 0; i < count; i++) {
      addState();
    }
  }

  @Override
  public void addArc(int state, Arc<W> arc) {
    final State<W> st = state(state);
    checkState(arc.nextState());
    st.addArc(arc.ilabel(), arc.olabel(), arc.weight(), arc.nextState());
    numArcs++;
    properties &= ~STRUCTURAL_PROPERTIES;
  }

  /** Sugar for {@code addArc(state, new Arc<>(ilabel, olabel, weight, nextState))}. */
  public void addArc(int state, int ilabel, int olabel, W weight, int nextState) {
    addArc(state, new Arc<>(ilabel, olabel, weight, nextState));
  }

  @Override
  public void setStart(int state) {
    if (state != NO_STATE) {
      checkState(state);
    }
    start = state;
  }

  @Override
  public void setFinal(int state, W weight) {
    state(state).finalWeight = Objects.requireNonNull(weight, "weight");
  }

  @Override
  public void clearFinal(int state) {
    state(state).finalWeight = null;
  }

  @Override
  public void deleteStates(int[] toDelete) {
    final FixedBitSet deleted = new FixedBitSet(Math.max(numStates, 1));
    for (int s : toDelete) {
      checkState(s);
      deleted.set(s);
    }
    // old id -> new id, or NO_STATE
    final int[] newIds = new int[numStates];
    int upto = 0;
    for (int s = 0; s < numStates; s++) {
      if (deleted.get(s)) {
        newIds[s] = NO_STATE;
      } else {
        newIds[s] = upto;
        states[upto++] = states[s];
      }
    }
    Arrays.fill(states, upto, numStates, null);
    numStates = upto;

    numArcs = 0;
    for (int s = 0; s < numStates; s++) {
      final State<W> st = states[s];
      FixedBitSet drop = null;
      for (int i = 0; i < st.numArcs; i++) {
        final int dest = newIds[st.nextStates[i]];
        if (dest == NO_STATE) {
          if (drop == null) {
            drop = new FixedBitSet(st.numArcs);
          }
          drop.set(i);
        } else {
          st.nextStates[i] = dest;
        }
      }
      if (drop != null) {
        st.compactArcs(drop);
      }
      numArcs += st.numArcs;
    }

    if (start != NO_STATE) {
      start = newIds[start];
    }
    // removing states and arcs keeps a graph acyclic, and the renumbering keeps the relative order
    properties &= ACYCLIC | TOP_SORTED;
  }

  @Override
  public void deleteStates() {
    Arrays.fill(states, 0, numStates, null);
    numStates = 0;
    numArcs = 0;
    start = NO_STATE;
    properties = ACYCLIC | TOP_SORTED;
  }

  @Override
  public void deleteArcs(int state) {
    final State<W> st = state(state);
    Arrays.fill(st.weights, 0, st.numArcs, null);
    numArcs -= st.numArcs;
    st.numArcs = 0;
    properties &= ACYCLIC | TOP_SORTED;
  }

  @Override
  public void deleteArcs(int state, int[] arcIndices) {
    final State<W> st = state(state);
    if (st.numArcs == 0) {
      if (arcIndices.length > 0) {
        throw new IllegalArgumentException("state " + state + " has no arcs");
      }
      return;
    }
    final FixedBitSet drop = new FixedBitSet(st.numArcs);
    for (int index : arcIndices) {
      Objects.checkIndex(index, st.numArcs);
      drop.set(index);
    }
    final int before = st.numArcs;
    st.compactArcs(drop);
    numArcs -= before - st.numArcs;
    properties &= ACYCLIC | TOP_SORTED;
  }

  @Override
  @SuppressWarnings("unchecked")
  public void permute(int[] order) {
    if (order.length != numStates) {
      throw new IllegalArgumentException(
          "order has " + order.length + " entries but there are " + numStates + " states");
    }
    final FixedBitSet seen = new FixedBitSet(Math.max(numStates, 1));
    for (int s = 0; s < numStates; s++) {
      final int target = order[s];
      if (target < 0 || target >= numStates || seen.getAndSet(target)) {
        throw new IllegalArgumentException(
            "order is not a permutation: order[" + s + "]=" + target);
      }
    }

    final State<W>[] newStates = (State<W>[]) new State[states.length];
    for (int s = 0; s < numStates; s++) {
      final State<W> st = states[s];
      for (int i = 0; i < st.numArcs; i++) {
        st.nextStates[i] = order[st.nextStates[i]];
      }
      newStates[order[s]] = st;
    }
    states = newStates;
    if (start != NO_STATE) {
      start = order[start];
    }
    properties &= ~STRUCTURAL_PROPERTIES;
  }

  @Override
  public void setProperties(long props, long mask) {
    if ((mask & ~STRUCTURAL_PROPERTIES) != 0) {
      throw new IllegalArgumentException(
          "unknown property bits: " + (mask & ~STRUCTURAL_PROPERTIES));
    }
    properties = (properties & ~mask) | (props & mask);
  }

  @Override
  public long ramBytesUsed() {
    long size = BASE_RAM_BYTES_USED + RamUsageEstimator.shallowSizeOf(states);
    for (int s = 0; s < numStates; s++) {
      final State<W> st = states[s];
      size += st.ramBytesUsed();
      if (st.finalWeight != null) {
        size += semiring.ramBytesUsed(st.finalWeight);
      }
      for (int i = 0; i < st.numArcs; i++) {
        size += semiring.ramBytesUsed(weight(st, i));
      }
    }
    return size;
  }

  /** Writes this graph to the provided output. */
  public void save(DataOutput out) throws IOException {
    CodecUtil.writeHeader(out, FILE_FORMAT_NAME, VERSION_CURRENT);
    out.writeString(semiring.getName());
    out.writeVInt(numStates);
    out.writeZInt(start);
    out.writeVLong(properties);
    for (int s = 0; s < numStates; s++) {
      final State<W> st = states[s];
      if (st.finalWeight == null) {
        out.writeByte(NOT_FINAL);
      } else {
        out.writeByte(FINAL);
        semiring.write(st.finalWeight, out);
      }
      out.writeVInt(st.numArcs);
      for (int i = 0; i < st.numArcs; i++) {
        out.writeVInt(st.ilabels[i]);
        out.writeVInt(st.olabels[i]);
        semiring.write(weight(st, i), out);
        out.writeVInt(st.nextStates[i]);
      }
    }
  }

  /** Writes this graph to a file. */
  public void save(final Path path) throws IOException {
    try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(path))) {
      save(new OutputStreamDataOutput(os));
    }
  }

  /**
   * Reads a graph written by {@link #save}, looking up its weight type through {@link
   * Semiring#forName}.
   *
   * @throws CorruptIndexException if the weight type is unknown or the data is inconsistent
   */
  public static VectorFst<?> read(DataInput in) throws IOException {
    CodecUtil.checkHeader(in, FILE_FORMAT_NAME, VERSION_START, VERSION_CURRENT);
    final String name = in.readString();
    final Semiring<?, ?> semiring;
    try {
      semiring = Semiring.forName(name);
    } catch (IllegalArgumentException e) {
      throw new CorruptIndexException("unknown weight type \"" + name + "\"", in, e);
    }
    return readBody(in, semiring);
  }

  /**
   * Reads a graph written by {@link #save} whose weight type must be the provided semiring's.
   *
   * @throws CorruptIndexException if the weight type differs or the data is inconsistent
   */
  public static <W> VectorFst<W> read(DataInput in, Semiring<W, ?> semiring) throws IOException {
    CodecUtil.checkHeader(in, FILE_FORMAT_NAME, VERSION_START, VERSION_CURRENT);
    final String name = in.readString();
    if (name.equals(semiring.getName()) == false) {
      throw new CorruptIndexException(
          "weight type mismatch: expected \"" + semiring.getName() + "\" but got \"" + name + "\"",
          in);
    }
    return readBody(in, semiring);
  }

  /** Reads a graph from a file; see {@link #read(DataInput)}. */
  public static VectorFst<?> read(Path path) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      return read(new InputStreamDataInput(new BufferedInputStream(is)));
    }
  }

  /** Reads a graph from a file; see {@link #read(DataInput, Semiring)}. */
  public static <W> VectorFst<W> read(Path path, Semiring<W, ?> semiring) throws IOException {
    try (InputStream is = Files.newInputStream(path)) {
      return read(new InputStreamDataInput(new BufferedInputStream(is)), semiring);
    }
  }

  private static <W> VectorFst<W> readBody(DataInput in, Semiring<W, ?> semiring)
      throws IOException {
    final int numStates = in.readVInt();
    if (numStates < 0) {
      throw new CorruptIndexException("invalid state count: " + numStates, in);
    }
    final int start = in.readZInt();
    if (start < NO_STATE || start >= numStates) {
      throw new CorruptIndexException(
          "invalid start state: " + start + " numStates=" + numStates, in);
    }
    final long properties = in.readVLong();
    if ((properties & ~STRUCTURAL_PROPERTIES) != 0) {
      throw new CorruptIndexException("invalid properties: " + properties, in);
    }

    // states are created as they are read, so truncated input fails before a corrupt count
    // can allocate much
    final VectorFst<W> fst = new VectorFst<>(semiring);
    for (int s = 0; s < numStates; s++) {
      final int id = fst.addState();
      final State<W> st = fst.states[id];
      final byte flag = in.readByte();
      if (flag == FINAL) {
        st.finalWeight = semiring.read(in);
      } else if (flag != NOT_FINAL) {
        throw new CorruptIndexException("invalid final flag " + flag + " for state " + s, in);
      }
      final int count = in.readVInt();
      if (count < 0) {
        throw new CorruptIndexException("invalid arc count " + count + " for state " + s, in);
      }
      for (int i = 0; i < count; i++) {
        final int ilabel = in.readVInt();
        final int olabel = in.readVInt();
        final W weight = semiring.read(in);
        final int nextState = in.readVInt();
        if (ilabel < 0 || olabel < 0) {
          throw new CorruptIndexException("invalid label on arc " + i + " of state " + s, in);
        }
        if (nextState < 0 || nextState >= numStates) {
          throw new CorruptIndexException(
              "arc " + i + " of state " + s + " leads to invalid state " + nextState, in);
        }
        st.addArc(ilabel, olabel, weight, nextState);
      }
      fst.numArcs += count;
    }
    fst.start = start;
    fst.properties = properties;
    return fst;
  }

  /** Structural equality: same weight type, start, final weights and arcs, state by state. */
  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof VectorFst == false) {
      return false;
    }
    final VectorFst<?> that = (VectorFst<?>) other;
    if (semiring.getName().equals(that.semiring.getName()) == false
        || numStates != that.numStates
        || numArcs != that.numArcs
        || start != that.start) {
      return false;
    }
    for (int s = 0; s < numStates; s++) {
      final State<W> a = states[s];
      final State<?> b = that.states[s];
      if (a.numArcs != b.numArcs
          || Objects.equals(a.finalWeight, b.finalWeight) == false
          || Arrays.equals(a.ilabels, 0, a.numArcs, b.ilabels, 0, b.numArcs) == false
          || Arrays.equals(a.olabels, 0, a.numArcs, b.olabels, 0, b.numArcs) == false
          || Arrays.equals(a.nextStates, 0, a.numArcs, b.nextStates, 0, b.numArcs) == false
          || Arrays.equals(a.weights, 0, a.numArcs, b.weights, 0, b.numArcs) == false) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int h = semiring.getName().hashCode();
    h = 31 * h + numStates;
    h = 31 * h + numArcs;
    return 31 * h + start;
  }

  /** Returns the graph in a tabular text form: one line per arc, then one per final state. */
  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append("VectorFst(")
        .append(semiring.getName())
        .append(", numStates=")
        .append(numStates)
        .append(", start=")
        .append(start)
        .append(")\n");
    for (int s = 0; s < numStates; s++) {
      final State<W> st = states[s];
      for (int i = 0; i < st.numArcs; i++) {
        b.append(s)
            .append('\t')
            .append(st.nextStates[i])
            .append('\t')
            .append(st.ilabels[i])
            .append('\t')
            .append(st.olabels[i])
            .append('\t')
            .append(semiring.weightToString(weight(st, i)))
            .append('\n');
      }
    }
    for (int s = 0; s < numStates; s++) {
      final W finalWeight = states[s].finalWeight;
      if (finalWeight != null) {
        b.append(s).append('\t').append(semiring.weightToString(finalWeight)).append('\n');
      }
    }
    return b.toString();
  }

  private State<W> state(int state) {
    checkState(state);
    return states[state];
  }

  private void checkState(int state) {
    if (state < 0 || state >= numStates) {
      throw new IllegalArgumentException(
          "invalid state " + state + " (numStates=" + numStates + ")");
    }
  }

  @SuppressWarnings("unchecked")
  private static <W> W weight(State<W> st, int index) {
    return (W) st.weights[index];
  }

  private static <W> Arc<W> newArc(State<W> st, int index) {
    return new Arc<>(st.ilabels[index], st.olabels[index], weight(st, index), st.nextStates[index]);
  }
}
