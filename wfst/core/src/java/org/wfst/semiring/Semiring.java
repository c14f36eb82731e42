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
package org.wfst.semiring;

import java.io.IOException;
import java.util.Set;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.NamedSPILoader;

/**
 * Represents the algebra of a weight type: the values of type {@code W} carried on arcs and final
 * states, and the operations ({@link #plus}, {@link #times}, {@link #zero}, {@link #one}, {@link
 * #divide}, {@link #reverse}) algorithms combine them with.
 *
 * <p>Weights are immutable; a semiring instance is a stateless singleton-like operations object,
 * in the same way {@code Outputs} is for Lucene's FST. No operation throws for inputs outside its
 * domain: instead it returns {@link #noWeight()}, a non-member value that poisons every later
 * {@link #plus} or {@link #times}. Callers check {@link #isMember} before trusting a result.
 *
 * <p>Every semiring declares which algebraic laws it satisfies through {@link #properties()}.
 * Algorithms may rely on those laws, so a semiring must never claim a property it does not have.
 *
 * <p>Semirings with a public no-argument constructor are looked up by {@link #getName() name}
 * through Java's SPI mechanism; see {@link #forName(String)}.
 *
 * @param <W> weight value type
 * @param <R> weight value type of the {@link #reverseSemiring() reverse semiring}
 * @lucene.experimental
 */
public abstract class Semiring<W, R> implements NamedSPILoader.NamedSPI {

  /** Times distributes over plus from the left: {@code a*(b+c) = a*b + a*c}. */
  public static final int LEFT_SEMIRING = 0x01;

  /** Times distributes over plus from the right: {@code (a+b)*c = a*c + b*c}. */
  public static final int RIGHT_SEMIRING = 0x02;

  /** Both left and right distributive. */
  public static final int SEMIRING = LEFT_SEMIRING | RIGHT_SEMIRING;

  /** Times is commutative. */
  public static final int COMMUTATIVE = 0x04;

  /** Plus is idempotent: {@code a+a = a}. */
  public static final int IDEMPOTENT = 0x08;

  /** Plus always returns one of its two arguments. */
  public static final int PATH = 0x10;

  /** Tolerance used by {@link #approxEqual(Object, Object)}. */
  public static final float DELTA = 1.0f / 1024.0f;

  private static final class Holder {
    @SuppressWarnings("rawtypes")
    private static final NamedSPILoader<Semiring> LOADER = new NamedSPILoader<>(Semiring.class);

    private Holder() {}

    @SuppressWarnings("rawtypes")
    static NamedSPILoader<Semiring> getLoader() {
      if (LOADER == null) {
        throw new IllegalStateException(
            "You tried to lookup a Semiring by name before all Semirings could be initialized. "
                + "This likely happens if you call Semiring#forName from a Semiring's ctor.");
      }
      return LOADER;
    }
  }

  /** Looks up a registered semiring by name. */
  public static Semiring<?, ?> forName(String name) {
    return Holder.getLoader().lookup(name);
  }

  /** Returns the names of all semirings available through SPI. */
  public static Set<String> availableSemirings() {
    return Holder.getLoader().availableServices();
  }

  /**
   * Reloads the semiring list from the given {@link ClassLoader}. Only new semirings are added,
   * existing ones are never removed or replaced.
   *
   * <p><em>This method is expensive and should only be called for discovery of new semirings on
   * the given classpath/classloader!</em>
   */
  public static void reloadSemirings(ClassLoader classloader) {
    Holder.getLoader().reload(classloader);
  }

  private final String name;

  /**
   * Creates a new semiring. The provided name is written into serialized graphs and, for
   * semirings registered through SPI, used by {@link #forName(String)}.
   */
  protected Semiring(String name) {
    this.name = name;
  }

  /** Returns this semiring's name, the weight type identifier of serialized graphs. */
  @Override
  public final String getName() {
    return name;
  }

  /** Additive identity; annihilates {@link #times}. */
  public abstract W zero();

  /** Multiplicative identity. */
  public abstract W one();

  /** The non-member sentinel, distinct from {@link #zero()} and {@link #one()}. */
  public abstract W noWeight();

  /** Returns false for {@link #noWeight()} and every other value outside the semiring. */
  public abstract boolean isMember(W w);

  public abstract W plus(W w1, W w2);

  public abstract W times(W w1, W w2);

  /**
   * Partial inverse of {@link #times}: returns {@code q} such that {@code times(w2, q)} ({@link
   * DivideType#LEFT}) or {@code times(q, w2)} ({@link DivideType#RIGHT}) equals {@code w1}, or
   * {@link #noWeight()} when no quotient exists.
   */
  public abstract W divide(W w1, W w2, DivideType type);

  /** Returns {@code w} times itself {@code n} times; {@link #one()} when {@code n == 0}. */
  public W power(W w, int n) {
    if (n < 0) {
      throw new IllegalArgumentException("n must be >= 0, got: " + n);
    }
    W result = one();
    for (int i = 0; i < n; i++) {
      result = times(w, result);
    }
    return result;
  }

  /** Bitmask of {@link #LEFT_SEMIRING}, {@link #RIGHT_SEMIRING}, {@link #COMMUTATIVE}, etc. */
  public abstract int properties();

  /** Returns the semiring {@link #reverse} maps into. */
  public abstract Semiring<R, W> reverseSemiring();

  /**
   * Maps a weight into the reverse semiring. Reversal is an involution, and {@code
   * reverse(times(a, b)) == times(reverse(b), reverse(a))}.
   */
  public abstract R reverse(W w);

  /**
   * Equality relation over weights. Non-members compare equal to each other so the relation stays
   * reflexive.
   */
  public boolean isEqual(W w1, W w2) {
    return w1.equals(w2);
  }

  /** Equality up to {@link #DELTA}. */
  public boolean approxEqual(W w1, W w2) {
    return approxEqual(w1, w2, DELTA);
  }

  /** Equality up to the provided tolerance; exact for non-numeric weights. */
  public abstract boolean approxEqual(W w1, W w2, float delta);

  /** Rounds a weight to a multiple of {@code delta}; identity for non-numeric weights. */
  public W quantize(W w, float delta) {
    return w;
  }

  /** Encodes a weight; {@link #read} must reproduce an {@link #isEqual equal} value. */
  public abstract void write(W w, DataOutput out) throws IOException;

  /** Decodes a weight written by {@link #write}. */
  public abstract W read(DataInput in) throws IOException;

  /** Text form of a weight; {@link #parseWeight} reproduces an approximately equal value. */
  public abstract String weightToString(W w);

  /**
   * Parses the text form of a weight.
   *
   * @throws IllegalArgumentException if the text is not a weight of this semiring
   */
  public abstract W parseWeight(String text);

  /** Approximate heap size of one weight. */
  public abstract long ramBytesUsed(W w);

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + name + ")";
  }
}
