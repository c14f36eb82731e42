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
 * The min-max semiring: plus is {@code min}, times is {@code max}, zero is positive infinity and
 * one is negative infinity (which is therefore a member here). Division only exists when the
 * dividend is not smaller than the divisor.
 *
 * @lucene.experimental
 */
public final class MinMaxSemiring extends FloatSemiring {

  public static final String NAME = "minmax";

  /** Sole constructor; also invoked by SPI. */
  public MinMaxSemiring() {
    super(NAME);
  }

  @Override
  public Float zero() {
    return POSITIVE_INFINITY;
  }

  @Override
  public Float one() {
    return NEGATIVE_INFINITY;
  }

  @Override
  public boolean isMember(Float w) {
    final float v = w;
    return v == v;
  }

  @Override
  public Float plus(Float w1, Float w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return NO_WEIGHT;
    }
    return w1 < w2 ? w1 : w2;
  }

  @Override
  public Float times(Float w1, Float w2) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return NO_WEIGHT;
    }
    return w1 >= w2 ? w1 : w2;
  }

  @Override
  public Float divide(Float w1, Float w2, DivideType type) {
    if (isMember(w1) == false || isMember(w2) == false) {
      return NO_WEIGHT;
    }
    return w1 >= w2 ? w1 : NO_WEIGHT;
  }

  @Override
  public int properties() {
    return SEMIRING | COMMUTATIVE | IDEMPOTENT | PATH;
  }
}
