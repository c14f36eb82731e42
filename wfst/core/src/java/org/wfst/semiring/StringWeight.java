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

import java.util.Arrays;
import org.apache.lucene.util.IntsRef;

/**
 * An immutable string of labels, the weight type of {@link StringSemiring}. Besides ordinary
 * strings (including the empty string, which is the multiplicative identity) there are two special
 * values: {@link #INFINITY}, the additive identity, and {@link #BAD}, the non-member sentinel.
 *
 * @lucene.experimental
 */
public final class StringWeight {

  private static final int[] NO_LABELS = new int[0];

  private static final byte KIND_LABELS = 0;
  private static final byte KIND_INFINITY = 1;
  private static final byte KIND_BAD = 2;

  /** The empty string. */
  public static final StringWeight EMPTY = new StringWeight(NO_LABELS, KIND_LABELS);

  /** The infinite string: zero of the string semirings. */
  public static final StringWeight INFINITY = new StringWeight(NO_LABELS, KIND_INFINITY);

  /** The non-member string. */
  public static final StringWeight BAD = new StringWeight(NO_LABELS, KIND_BAD);

  private final int[] labels;
  private final byte kind;

  private StringWeight(int[] labels, byte kind) {
    this.labels = labels;
    this.kind = kind;
  }

  /**
   * Returns the string of the provided labels. Labels must be positive: the epsilon label {@code
   * 0} never appears inside a string weight.
   */
  public static StringWeight of(int... labels) {
    if (labels.length == 0) {
      return EMPTY;
    }
    for (int label : labels) {
      if (label <= 0) {
        throw new IllegalArgumentException("string labels must be > 0, got: " + label);
      }
    }
    return new StringWeight(labels.clone(), KIND_LABELS);
  }

  /** Returns the string of the labels in the provided range. */
  public static StringWeight of(IntsRef ints) {
    return of(Arrays.copyOfRange(ints.ints, ints.offset, ints.offset + ints.length));
  }

  // no validation or copy: callers own the array
  static StringWeight wrap(int[] labels) {
    return labels.length == 0 ? EMPTY : new StringWeight(labels, KIND_LABELS);
  }

  public boolean isInfinity() {
    return kind == KIND_INFINITY;
  }

  public boolean isBad() {
    return kind == KIND_BAD;
  }

  /** True for ordinary strings, including the empty string. */
  public boolean isString() {
    return kind == KIND_LABELS;
  }

  /** Number of labels; {@code 0} for the special values. */
  public int length() {
    return labels.length;
  }

  public int labelAt(int index) {
    return labels[index];
  }

  /** Returns a new {@link IntsRef} holding a copy of the labels. */
  public IntsRef toIntsRef() {
    return new IntsRef(labels.clone(), 0, labels.length);
  }

  int[] labels() {
    return labels;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof StringWeight == false) {
      return false;
    }
    StringWeight that = (StringWeight) other;
    return kind == that.kind && Arrays.equals(labels, that.labels);
  }

  @Override
  public int hashCode() {
    return 31 * kind + Arrays.hashCode(labels);
  }

  @Override
  public String toString() {
    switch (kind) {
      case KIND_INFINITY:
        return "Infinity";
      case KIND_BAD:
        return "BadString";
      default:
        if (labels.length == 0) {
          return "Epsilon";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < labels.length; i++) {
          if (i > 0) {
            sb.append('_');
          }
          sb.append(labels[i]);
        }
        return sb.toString();
    }
  }
}
