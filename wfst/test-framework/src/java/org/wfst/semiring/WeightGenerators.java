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

import java.util.Random;
import java.util.function.Supplier;

/**
 * Random weight generators for {@link WeightTester}, one per shipped weight type. Numeric
 * generators draw small integers, so sums and products stay exact and only the log semiring's
 * plus is inexact. When zero is allowed it is drawn about once every {@link #NUM_RANDOM_WEIGHTS}+1
 * draws.
 */
public final class WeightGenerators {

  /** Number of distinct non-zero values the numeric generators draw from. */
  public static final int NUM_RANDOM_WEIGHTS = 5;

  /** Longest string drawn by {@link #strings}. */
  public static final int MAX_STRING_LENGTH = 5;

  /** String labels are drawn from {@code 1 .. ALPHABET_SIZE}; small, so prefixes are shared. */
  public static final int ALPHABET_SIZE = 2;

  private WeightGenerators() {}

  /**
   * Returns a generator of integer-valued weights {@code 0 .. NUM_RANDOM_WEIGHTS-1} for the
   * tropical, log and real semirings, plus zero when allowed.
   */
  public static Supplier<Float> floats(Random random, FloatSemiring semiring, boolean allowZero) {
    return () -> {
      if (allowZero && random.nextInt(NUM_RANDOM_WEIGHTS + 1) == NUM_RANDOM_WEIGHTS) {
        return semiring.zero();
      }
      return (float) random.nextInt(NUM_RANDOM_WEIGHTS);
    };
  }

  /**
   * Returns a generator for {@link MinMaxSemiring}: integers in {@code [-NUM_RANDOM_WEIGHTS,
   * NUM_RANDOM_WEIGHTS]}, one (negative infinity), and zero when allowed.
   */
  public static Supplier<Float> minMax(Random random, boolean allowZero) {
    return () -> {
      final int draw = random.nextInt(2 * NUM_RANDOM_WEIGHTS + 3);
      if (draw == 2 * NUM_RANDOM_WEIGHTS + 2) {
        return allowZero ? Float.POSITIVE_INFINITY : 0f;
      } else if (draw == 2 * NUM_RANDOM_WEIGHTS + 1) {
        return Float.NEGATIVE_INFINITY;
      }
      return (float) (draw - NUM_RANDOM_WEIGHTS);
    };
  }

  /** Returns a generator of short strings over a small alphabet, plus infinity when allowed. */
  public static Supplier<StringWeight> strings(Random random, boolean allowZero) {
    return () -> {
      if (allowZero && random.nextInt(MAX_STRING_LENGTH + 2) == 0) {
        return StringWeight.INFINITY;
      }
      final int[] labels = new int[random.nextInt(MAX_STRING_LENGTH + 1)];
      for (int i = 0; i < labels.length; i++) {
        labels[i] = 1 + random.nextInt(ALPHABET_SIZE);
      }
      return StringWeight.of(labels);
    };
  }

  /** Returns a generator of pairs drawn from two component generators. */
  public static <W1, R1, W2, R2> Supplier<ProductSemiring.Pair<W1, W2>> pairs(
      ProductSemiring<W1, R1, W2, R2> semiring, Supplier<W1> first, Supplier<W2> second) {
    return () -> semiring.newPair(first.get(), second.get());
  }
}
