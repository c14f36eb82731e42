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
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.DataOutput;
import org.apache.lucene.util.RamUsageEstimator;

/**
 * Base class for semirings whose weights are single {@code float} values. The non-member sentinel
 * is {@link Float#NaN}; {@link Float#NEGATIVE_INFINITY} is not a member unless a subclass says
 * otherwise. Float weights are their own reverse.
 *
 * @lucene.experimental
 */
public abstract class FloatSemiring extends Semiring<Float, Float> {

  static final Float POSITIVE_INFINITY = Float.POSITIVE_INFINITY;
  static final Float NEGATIVE_INFINITY = Float.NEGATIVE_INFINITY;
  static final Float NO_WEIGHT = Float.NaN;

  private static final long BYTES_PER_WEIGHT = RamUsageEstimator.shallowSizeOfInstance(Float.class);

  protected FloatSemiring(String name) {
    super(name);
  }

  @Override
  public Float noWeight() {
    return NO_WEIGHT;
  }

  @Override
  public boolean isMember(Float w) {
    final float v = w;
    return v == v && v != Float.NEGATIVE_INFINITY;
  }

  @Override
  public Semiring<Float, Float> reverseSemiring() {
    return this;
  }

  @Override
  public Float reverse(Float w) {
    return w;
  }

  @Override
  public boolean isEqual(Float w1, Float w2) {
    final float v1 = w1;
    final float v2 = w2;
    // == alone is not reflexive for NaN
    return v1 == v2 || (v1 != v1 && v2 != v2);
  }

  @Override
  public boolean approxEqual(Float w1, Float w2, float delta) {
    final float v1 = w1;
    final float v2 = w2;
    if (v1 != v1 || v2 != v2) {
      return v1 != v1 && v2 != v2;
    }
    return v1 <= v2 + delta && v2 <= v1 + delta;
  }

  @Override
  public Float quantize(Float w, float delta) {
    final float v = w;
    if (v != v || Float.isInfinite(v)) {
      return w;
    }
    return (float) Math.floor(v / delta + 0.5f) * delta;
  }

  @Override
  public void write(Float w, DataOutput out) throws IOException {
    out.writeInt(Float.floatToIntBits(w));
  }

  @Override
  public Float read(DataInput in) throws IOException {
    return Float.intBitsToFloat(in.readInt());
  }

  @Override
  public String weightToString(Float w) {
    return Float.toString(w);
  }

  @Override
  public Float parseWeight(String text) {
    try {
      return Float.parseFloat(text.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          "invalid " + getName() + " weight: \"" + text + "\"", e);
    }
  }

  @Override
  public long ramBytesUsed(Float w) {
    return BYTES_PER_WEIGHT;
  }

  /**
   * Division shared by the semirings whose times is addition: {@code w1 - w2}, with {@link
   * #zero()} (positive infinity) handled as the annihilator.
   */
  final Float subtract(Float w1, Float w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return NO_WEIGHT;
    }
    final float v1 = w1;
    final float v2 = w2;
    if (v2 == Float.POSITIVE_INFINITY) {
      return NO_WEIGHT;
    } else if (v1 == Float.POSITIVE_INFINITY) {
      return POSITIVE_INFINITY;
    }
    return v1 - v2;
  }
}
