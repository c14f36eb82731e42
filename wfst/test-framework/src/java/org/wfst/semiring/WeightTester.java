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
import java.util.function.Supplier;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.util.InfoStream;

/**
 * Checks that a {@link Semiring} really satisfies the laws its {@link Semiring#properties()}
 * claim, together with the identities every weight type must honour: identity and annihilator
 * elements, non-member propagation, associativity, commutativity of plus, {@link Semiring#power},
 * division (optional), reversal, the equality relation, binary and text round trips and copying.
 *
 * <p>Each round draws three fresh weights from the caller's generator. A violated law throws an
 * {@link AssertionError} naming the law, the weight type and the sampled weights; this is an
 * oracle for authors of weight types, not a runtime check.
 *
 * <pre class="prettyprint">
 * TropicalSemiring semiring = new TropicalSemiring();
 * new WeightTester&lt;&gt;(semiring, WeightGenerators.floats(random, semiring, true))
 *     .test(1000, false);
 * </pre>
 *
 * @param <W> weight value type
 * @param <R> reverse weight value type
 */
public final class WeightTester<W, R> {

  /** {@link InfoStream} component this class logs to. */
  public static final String INFO_COMPONENT = "WT";

  private final Semiring<W, R> semiring;
  private final Supplier<W> generator;
  private InfoStream infoStream = InfoStream.getDefault();

  // the weights of the current round, for failure messages
  private String samples = "";

  public WeightTester(Semiring<W, R> semiring, Supplier<W> generator) {
    this.semiring = Objects.requireNonNull(semiring, "semiring");
    this.generator = Objects.requireNonNull(generator, "generator");
  }

  /** Sets where per-round diagnostics go; defaults to {@link InfoStream#getDefault()}. */
  public WeightTester<W, R> setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream, "infoStream");
    return this;
  }

  /** Runs all checks, division included, for the given number of rounds. */
  public void test(int iterations) {
    test(iterations, true);
  }

  /** Runs all checks for the given number of rounds. */
  public void test(int iterations, boolean testDivision) {
    for (int i = 0; i < iterations; i++) {
      final W w1 = generator.get();
      final W w2 = generator.get();
      final W w3 = generator.get();

      samples =
          "w1="
              + semiring.weightToString(w1)
              + " w2="
              + semiring.weightToString(w2)
              + " w3="
              + semiring.weightToString(w3);
      if (infoStream.isEnabled(INFO_COMPONENT)) {
        infoStream.message(
            INFO_COMPONENT, "round " + i + " weight type=" + semiring.getName() + " " + samples);
      }

      testSemiring(w1, w2, w3);
      if (testDivision) {
        testDivision(w1, w2);
      }
      testReverse(w1, w2);
      testEquality(w1, w2, w3);
      testIO(w1);
      testCopy(w1);
    }
  }

  // approxEqual is used wherever floating point weights may be inexact
  private void testSemiring(W w1, W w2, W w3) {
    final Semiring<W, R> s = semiring;
    final int props = s.properties();

    check(s.isMember(s.plus(w1, w2)), "plus is closed");
    check(s.isMember(s.times(w1, w2)), "times is closed");

    check(
        s.approxEqual(s.plus(w1, s.plus(w2, w3)), s.plus(s.plus(w1, w2), w3)),
        "plus is associative");
    check(
        s.approxEqual(s.times(w1, s.times(w2, w3)), s.times(s.times(w1, w2), w3)),
        "times is associative");

    check(s.isEqual(s.plus(w1, s.zero()), w1), "zero is a right identity of plus");
    check(s.isEqual(s.plus(s.zero(), w1), w1), "zero is a left identity of plus");
    check(s.isEqual(s.times(w1, s.one()), w1), "one is a right identity of times");
    check(s.isEqual(s.times(s.one(), w1), w1), "one is a left identity of times");

    check(s.isMember(s.noWeight()) == false, "noWeight is not a member");
    check(s.isMember(s.plus(w1, s.noWeight())) == false, "plus(w, noWeight) is not a member");
    check(s.isMember(s.plus(s.noWeight(), w1)) == false, "plus(noWeight, w) is not a member");
    check(s.isMember(s.times(w1, s.noWeight())) == false, "times(w, noWeight) is not a member");
    check(s.isMember(s.times(s.noWeight(), w1)) == false, "times(noWeight, w) is not a member");

    check(s.approxEqual(s.plus(w1, w2), s.plus(w2, w1)), "plus is commutative");
    if ((props & Semiring.COMMUTATIVE) != 0) {
      check(s.approxEqual(s.times(w1, w2), s.times(w2, w1)), "times is commutative");
    }

    check(s.isEqual(s.times(w1, s.zero()), s.zero()), "zero is a right annihilator");
    check(s.isEqual(s.times(s.zero(), w1), s.zero()), "zero is a left annihilator");

    check(s.isEqual(s.power(w1, 0), s.one()), "power(w, 0) is one");
    check(s.isEqual(s.power(w1, 1), w1), "power(w, 1) is w");
    check(s.isEqual(s.power(w1, 3), s.times(w1, s.times(w1, w1))), "power(w, 3) is w*(w*w)");

    if ((props & Semiring.LEFT_SEMIRING) != 0) {
      check(
          s.approxEqual(s.times(w1, s.plus(w2, w3)), s.plus(s.times(w1, w2), s.times(w1, w3))),
          "times left distributes over plus");
    }
    if ((props & Semiring.RIGHT_SEMIRING) != 0) {
      check(
          s.approxEqual(s.times(s.plus(w1, w2), w3), s.plus(s.times(w1, w3), s.times(w2, w3))),
          "times right distributes over plus");
    }

    if ((props & Semiring.IDEMPOTENT) != 0) {
      check(s.isEqual(s.plus(w1, w1), w1), "plus is idempotent");
    }

    if ((props & Semiring.PATH) != 0) {
      final W sum = s.plus(w1, w2);
      check(s.isEqual(sum, w1) || s.isEqual(sum, w2), "plus returns one of its arguments");
    }

    check(
        (props & (Semiring.LEFT_SEMIRING | Semiring.RIGHT_SEMIRING)) != 0,
        "properties declare a left or a right semiring");
    if ((props & Semiring.COMMUTATIVE) != 0) {
      check(
          (props & Semiring.SEMIRING) == Semiring.SEMIRING,
          "commutative times implies a two-sided semiring");
    }
  }

  private void testDivision(W w1, W w2) {
    final Semiring<W, R> s = semiring;
    final int props = s.properties();
    final W p = s.times(w1, w2);

    if ((props & Semiring.LEFT_SEMIRING) != 0) {
      final W d = s.divide(p, w1, DivideType.LEFT);
      if (s.isMember(d)) {
        check(s.approxEqual(p, s.times(w1, d)), "left division inverts times");
      }
      check(
          s.isMember(s.divide(w1, s.noWeight(), DivideType.LEFT)) == false,
          "left division by noWeight is not a member");
      check(
          s.isMember(s.divide(s.noWeight(), w1, DivideType.LEFT)) == false,
          "left division of noWeight is not a member");
    }

    if ((props & Semiring.RIGHT_SEMIRING) != 0) {
      final W d = s.divide(p, w2, DivideType.RIGHT);
      if (s.isMember(d)) {
        check(s.approxEqual(p, s.times(d, w2)), "right division inverts times");
      }
      check(
          s.isMember(s.divide(w1, s.noWeight(), DivideType.RIGHT)) == false,
          "right division by noWeight is not a member");
      check(
          s.isMember(s.divide(s.noWeight(), w1, DivideType.RIGHT)) == false,
          "right division of noWeight is not a member");
    }

    if ((props & Semiring.COMMUTATIVE) != 0) {
      final W right = s.divide(p, w1, DivideType.RIGHT);
      if (s.isMember(right)) {
        check(s.approxEqual(p, s.times(right, w1)), "commutative right division inverts times");
      }
      final W left = s.divide(p, w1, DivideType.LEFT);
      check(
          s.isMember(left) == s.isMember(right),
          "commutative left and right division agree on membership");
      if (s.isMember(left) && s.isMember(right)) {
        check(s.approxEqual(left, right), "commutative left and right division agree");
      }
    }
  }

  private void testReverse(W w1, W w2) {
    final Semiring<W, R> s = semiring;
    final Semiring<R, W> rs = s.reverseSemiring();
    final R rw1 = s.reverse(w1);
    final R rw2 = s.reverse(w2);

    check(s.isEqual(rs.reverse(rw1), w1), "reverse is an involution");
    check(
        rs.isEqual(s.reverse(s.plus(w1, w2)), rs.plus(rw1, rw2)), "reverse distributes over plus");
    check(
        rs.isEqual(s.reverse(s.times(w1, w2)), rs.times(rw2, rw1)),
        "reverse distributes over times with operands swapped");
  }

  private void testEquality(W w1, W w2, W w3) {
    final Semiring<W, R> s = semiring;
    check(s.isEqual(w1, w1), "equality is reflexive");
    check(s.isEqual(w1, w2) == s.isEqual(w2, w1), "equality is symmetric");
    if (s.isEqual(w1, w2) && s.isEqual(w2, w3)) {
      check(s.isEqual(w1, w3), "equality is transitive");
    }
  }

  private void testIO(W w) {
    final Semiring<W, R> s = semiring;
    check(s.isEqual(w, binaryCopy(w)), "binary write then read is exact");

    final W parsed;
    try {
      parsed = s.parseWeight(s.weightToString(w));
    } catch (IllegalArgumentException e) {
      throw failure("text write then read", e);
    }
    check(s.approxEqual(w, parsed), "text write then read is approximately equal");
  }

  private void testCopy(W w) {
    final Semiring<W, R> s = semiring;
    W x = w;
    check(s.isEqual(w, x), "a copied reference is equal");

    x = binaryCopy(w);
    check(s.isEqual(w, x), "a deep copy is equal");
    if (w.equals(x)) {
      check(w.hashCode() == x.hashCode(), "equal weights have equal hash codes");
    }

    x = binaryCopy(x);
    check(s.isEqual(w, x), "a copy of a copy is equal");
  }

  private W binaryCopy(W w) {
    final ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    try {
      semiring.write(w, out);
      return semiring.read(out.toDataInput());
    } catch (IOException e) {
      throw failure("binary write then read", e);
    }
  }

  private void check(boolean ok, String law) {
    if (ok == false) {
      throw new AssertionError(
          "weight type " + semiring.getName() + ": check failed: " + law + " (" + samples + ")");
    }
  }

  private AssertionError failure(String law, Throwable cause) {
    return new AssertionError(
        "weight type " + semiring.getName() + ": " + law + " threw (" + samples + ")", cause);
  }
}
