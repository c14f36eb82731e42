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
import java.util.Objects;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.RamUsageEstimator;

/**
 * The product of two semirings: weights are {@link Pair pairs} and every operation applies
 * componentwise. The product keeps the distributivity, commutativity and idempotence both
 * components share; it never has the path property, since plus may pick different sides in the
 * two components.
 *
 * <p>Product semirings are not registered through SPI. Their name, {@code <first>_X_<second>},
 * is still recorded in serialized graphs, which must then be read with an explicit semiring.
 *
 * @lucene.experimental
 */
public final class ProductSemiring<W1, R1, W2, R2>
    extends Semiring<ProductSemiring.Pair<W1, W2>, ProductSemiring.Pair<R1, R2>> {

  private static final long BASE_RAM_BYTES_USED =
      RamUsageEstimator.shallowSizeOfInstance(Pair.class);

  /** Holds a single pair of weights. */
  public static class Pair<A, B> {
    public final A value1;
    public final B value2;

    // use newPair
    private Pair(A value1, B value2) {
      this.value1 = value1;
      this.value2 = value2;
    }

    @Override
    public boolean equals(Object other) {
      if (other == this) {
        return true;
      } else if (other instanceof Pair) {
        Pair<?, ?> pair = (Pair<?, ?>) other;
        return Objects.equals(value1, pair.value1) && Objects.equals(value2, pair.value2);
      } else {
        return false;
      }
    }

    @Override
    public int hashCode() {
      return 31 * Objects.hashCode(value1) + Objects.hashCode(value2);
    }

    @Override
    public String toString() {
      return "Pair(" + value1 + "," + value2 + ")";
    }
  }

  private final Semiring<W1, R1> first;
  private final Semiring<W2, R2> second;
  private final Pair<W1, W2> zero;
  private final Pair<W1, W2> one;
  private final Pair<W1, W2> noWeight;
  private ProductSemiring<R1, W1, R2, W2> reverse;

  public ProductSemiring(Semiring<W1, R1> first, Semiring<W2, R2> second) {
    super(first.getName() + "_X_" + second.getName());
    this.first = first;
    this.second = second;
    this.zero = new Pair<>(first.zero(), second.zero());
    this.one = new Pair<>(first.one(), second.one());
    this.noWeight = new Pair<>(first.noWeight(), second.noWeight());
  }

  /** Create a new Pair */
  public Pair<W1, W2> newPair(W1 a, W2 b) {
    return new Pair<>(Objects.requireNonNull(a), Objects.requireNonNull(b));
  }

  public Semiring<W1, R1> getFirst() {
    return first;
  }

  public Semiring<W2, R2> getSecond() {
    return second;
  }

  @Override
  public Pair<W1, W2> zero() {
    return zero;
  }

  @Override
  public Pair<W1, W2> one() {
    return one;
  }

  @Override
  public Pair<W1, W2> noWeight() {
    return noWeight;
  }

  @Override
  public boolean isMember(Pair<W1, W2> w) {
    return first.isMember(w.value1) && second.isMember(w.value2);
  }

  @Override
  public Pair<W1, W2> plus(Pair<W1, W2> w1, Pair<W1, W2> w2) {
    return new Pair<>(first.plus(w1.value1, w2.value1), second.plus(w1.value2, w2.value2));
  }

  @Override
  public Pair<W1, W2> times(Pair<W1, W2> w1, Pair<W1, W2> w2) {
    return new Pair<>(first.times(w1.value1, w2.value1), second.times(w1.value2, w2.value2));
  }

  @Override
  public Pair<W1, W2> divide(Pair<W1, W2> w1, Pair<W1, W2> w2, DivideType type) {
    return new Pair<>(
        first.divide(w1.value1, w2.value1, type), second.divide(w1.value2, w2.value2, type));
  }

  @Override
  public int properties() {
    return first.properties() & second.properties() & (SEMIRING | COMMUTATIVE | IDEMPOTENT);
  }

  @Override
  public ProductSemiring<R1, W1, R2, W2> reverseSemiring() {
    if (reverse == null) {
      reverse = new ProductSemiring<>(first.reverseSemiring(), second.reverseSemiring());
    }
    return reverse;
  }

  @Override
  public Pair<R1, R2> reverse(Pair<W1, W2> w) {
    return new Pair<>(first.reverse(w.value1), second.reverse(w.value2));
  }

  @Override
  public boolean isEqual(Pair<W1, W2> w1, Pair<W1, W2> w2) {
    return first.isEqual(w1.value1, w2.value1) && second.isEqual(w1.value2, w2.value2);
  }

  @Override
  public boolean approxEqual(Pair<W1, W2> w1, Pair<W1, W2> w2, float delta) {
    return first.approxEqual(w1.value1, w2.value1, delta)
        && second.approxEqual(w1.value2, w2.value2, delta);
  }

  @Override
  public Pair<W1, W2> quantize(Pair<W1, W2> w, float delta) {
    return new Pair<>(first.quantize(w.value1, delta), second.quantize(w.value2, delta));
  }

  @Override
  public void write(Pair<W1, W2> w, DataOutput out) throws IOException {
    first.write(w.value1, out);
    second.write(w.value2, out);
  }

  @Override
  public Pair<W1, W2> read(DataInput in) throws IOException {
    W1 value1 = first.read(in);
    W2 value2 = second.read(in);
    return new Pair<>(value1, value2);
  }

  @Override
  public String weightToString(Pair<W1, W2> w) {
    return "(" + first.weightToString(w.value1) + "," + second.weightToString(w.value2) + ")";
  }

  @Override
  public Pair<W1, W2> parseWeight(String text) {
    final String s = text.trim();
    if (s.length() < 2 || s.charAt(0) != '(' || s.charAt(s.length() - 1) != ')') {
      throw new IllegalArgumentException("invalid " + getName() + " weight: \"" + text + "\"");
    }
    // split at the one comma not nested inside a component
    int depth = 0;
    int split = -1;
    for (int i = 1; i < s.length() - 1; i++) {
      char c = s.charAt(i);
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        depth--;
      } else if (c == ',' && depth == 0) {
        if (split != -1) {
          throw new IllegalArgumentException(
              "invalid " + getName() + " weight: \"" + text + "\"");
        }
        split = i;
      }
    }
    if (split == -1) {
      throw new IllegalArgumentException("invalid " + getName() + " weight: \"" + text + "\"");
    }
    return new Pair<>(
        first.parseWeight(s.substring(1, split)),
        second.parseWeight(s.substring(split + 1, s.length() - 1)));
  }

  @Override
  public long ramBytesUsed(Pair<W1, W2> w) {
    return BASE_RAM_BYTES_USED + first.ramBytesUsed(w.value1) + second.ramBytesUsed(w.value2);
  }
}
