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
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.RamUsageEstimator;

/**
 * The string semirings over {@link StringWeight}: times is concatenation and plus is the longest
 * common prefix ({@link LeftStringSemiring}) or the longest common suffix ({@link
 * RightStringSemiring}). The two are each other's reverse. Only one side of distributivity holds,
 * and division is only defined on that side.
 *
 * @lucene.experimental
 */
public abstract class StringSemiring extends Semiring<StringWeight, StringWeight> {

  private static final long BASE_RAM_BYTES_USED =
      RamUsageEstimator.shallowSizeOfInstance(StringWeight.class);

  // written in place of the length for the special values
  private static final int INFINITY_LENGTH = -1;
  private static final int BAD_LENGTH = -2;

  private final boolean left;

  StringSemiring(String name, boolean left) {
    super(name);
    this.left = left;
  }

  @Override
  public StringWeight zero() {
    return StringWeight.INFINITY;
  }

  @Override
  public StringWeight one() {
    return StringWeight.EMPTY;
  }

  @Override
  public StringWeight noWeight() {
    return StringWeight.BAD;
  }

  @Override
  public boolean isMember(StringWeight w) {
    return w.isBad() == false;
  }

  @Override
  public StringWeight plus(StringWeight w1, StringWeight w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return StringWeight.BAD;
    }
    if (w1.isInfinity()) {
      return w2;
    } else if (w2.isInfinity()) {
      return w1;
    }
    final int[] a = w1.labels();
    final int[] b = w2.labels();
    final int limit = Math.min(a.length, b.length);
    int common = 0;
    if (left) {
      while (common < limit && a[common] == b[common]) {
        common++;
      }
      if (common == a.length) {
        return w1;
      }
      int[] prefix = new int[common];
      System.arraycopy(a, 0, prefix, 0, common);
      return StringWeight.wrap(prefix);
    } else {
      while (common < limit && a[a.length - 1 - common] == b[b.length - 1 - common]) {
        common++;
      }
      if (common == a.length) {
        return w1;
      }
      int[] suffix = new int[common];
      System.arraycopy(a, a.length - common, suffix, 0, common);
      return StringWeight.wrap(suffix);
    }
  }

  @Override
  public StringWeight times(StringWeight w1, StringWeight w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return StringWeight.BAD;
    }
    if (w1.isInfinity() || w2.isInfinity()) {
      return StringWeight.INFINITY;
    }
    if (w1.length() == 0) {
      return w2;
    } else if (w2.length() == 0) {
      return w1;
    }
    final int[] a = w1.labels();
    final int[] b = w2.labels();
    int[] result = new int[a.length + b.length];
    System.arraycopy(a, 0, result, 0, a.length);
    System.arraycopy(b, 0, result, a.length, b.length);
    return StringWeight.wrap(result);
  }

  /**
   * Removes {@code w2} from the front ({@link LeftStringSemiring}, {@link DivideType#LEFT}) or
   * the back ({@link RightStringSemiring}, {@link DivideType#RIGHT}) of {@code w1}. Any other
   * combination, or a divisor that is not a prefix (suffix) of the dividend, has no quotient.
   */
  @Override
  public StringWeight divide(StringWeight w1, StringWeight w2, DivideType type) {
    if (type != (left ? DivideType.LEFT : DivideType.RIGHT)) {
      return StringWeight.BAD;
    }
    if (isMember(w1) == false || isMember(w2) == false || w2.isInfinity()) {
      return StringWeight.BAD;
    }
    if (w1.isInfinity()) {
      return StringWeight.INFINITY;
    }
    final int[] a = w1.labels();
    final int[] b = w2.labels();
    if (b.length > a.length) {
      return StringWeight.BAD;
    }
    final int offset = left ? 0 : a.length - b.length;
    for (int i = 0; i < b.length; i++) {
      if (a[offset + i] != b[i]) {
        return StringWeight.BAD;
      }
    }
    int[] quotient = new int[a.length - b.length];
    System.arraycopy(a, left ? b.length : 0, quotient, 0, quotient.length);
    return StringWeight.wrap(quotient);
  }

  @Override
  public int properties() {
    return (left ? LEFT_SEMIRING : RIGHT_SEMIRING) | IDEMPOTENT;
  }

  @Override
  public StringWeight reverse(StringWeight w) {
    if (w.isString() == false || w.length() < 2) {
      return w;
    }
    final int[] labels = w.labels();
    int[] reversed = new int[labels.length];
    for (int i = 0; i < labels.length; i++) {
      reversed[i] = labels[labels.length - 1 - i];
    }
    return StringWeight.wrap(reversed);
  }

  @Override
  public boolean approxEqual(StringWeight w1, StringWeight w2, float delta) {
    return w1.equals(w2);
  }

  @Override
  public void write(StringWeight w, DataOutput out) throws IOException {
    if (w.isInfinity()) {
      out.writeZInt(INFINITY_LENGTH);
    } else if (w.isBad()) {
      out.writeZInt(BAD_LENGTH);
    } else {
      out.writeZInt(w.length());
      for (int i = 0; i < w.length(); i++) {
        out.writeVInt(w.labelAt(i));
      }
    }
  }

  @Override
  public StringWeight read(DataInput in) throws IOException {
    final int length = in.readZInt();
    if (length == INFINITY_LENGTH) {
      return StringWeight.INFINITY;
    } else if (length == BAD_LENGTH) {
      return StringWeight.BAD;
    } else if (length < 0) {
      throw new CorruptIndexException("invalid string weight length: " + length, in);
    }
    int[] labels = new int[length];
    for (int i = 0; i < length; i++) {
      labels[i] = in.readVInt();
    }
    return StringWeight.wrap(labels);
  }

  @Override
  public String weightToString(StringWeight w) {
    return w.toString();
  }

  @Override
  public StringWeight parseWeight(String text) {
    final String s = text.trim();
    switch (s) {
      case "Infinity":
        return StringWeight.INFINITY;
      case "BadString":
        return StringWeight.BAD;
      case "Epsilon":
        return StringWeight.EMPTY;
      default:
        String[] parts = s.split("_", -1);
        int[] labels = new int[parts.length];
        try {
          for (int i = 0; i < parts.length; i++) {
            labels[i] = Integer.parseInt(parts[i]);
          }
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              "invalid " + getName() + " weight: \"" + text + "\"", e);
        }
        return StringWeight.of(labels);
    }
  }

  @Override
  public long ramBytesUsed(StringWeight w) {
    return BASE_RAM_BYTES_USED + RamUsageEstimator.sizeOf(w.labels());
  }
}
