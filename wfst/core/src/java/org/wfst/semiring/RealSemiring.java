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

/**
 * The real (probability) semiring: ordinary {@code +} and {@code *} over finite floats, with zero
 * {@code 0} and one {@code 1}.
 *
 * @lucene.experimental
 */
public final class RealSemiring extends FloatSemiring {

  public static final String NAME = "real";

  private static final Float ZERO = 0f;
  private static final Float ONE = 1f;

  /** Sole constructor; also invoked by SPI. */
  public RealSemiring() {
    super(NAME);
  }

  @Override
  public Float zero() {
    return ZERO;
  }

  @Override
  public Float one() {
    return ONE;
  }

  @Override
  public boolean isMember(Float w) {
    final float v = w;
    return v == v && Float.isInfinite(v) == false;
  }

  @Override
  public Float plus(Float w1, Float w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return NO_WEIGHT;
    }
    return w1 + w2;
  }

  @Override
  public Float times(Float w1, Float w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return NO_WEIGHT;
    }
    return w1 * w2;
  }

  @Override
  public Float divide(Float w1, Float w2, DivideType type) {
    if (isMember(w1) == false || isMember(w2) == false || w2 == 0f) {
      return NO_WEIGHT;
    }
    return w1 / w2;
  }

  @Override
  public int properties() {
    return SEMIRING | COMMUTATIVE;
  }
}
