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
 * The tropical semiring: plus is {@code min}, times is {@code +}, zero is positive infinity and
 * one is {@code 0}. Weights are usually interpreted as costs, such as negative log probabilities
 * along the best path.
 *
 * @lucene.experimental
 */
public final class TropicalSemiring extends FloatSemiring {

  public static final String NAME = "tropical";

  private static final Float ONE = 0f;

  /** Sole constructor; also invoked by SPI. */
  public TropicalSemiring() {
    super(NAME);
  }

  @Override
  public Float zero() {
    return POSITIVE_INFINITY;
  }

  @Override
  public Float one() {
    return ONE;
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
    return w1 + w2;
  }

  @Override
  public Float divide(Float w1, Float w2, DivideType type) {
    return subtract(w1, w2);
  }

  @Override
  public int properties() {
    return SEMIRING | COMMUTATIVE | IDEMPOTENT | PATH;
  }
}
