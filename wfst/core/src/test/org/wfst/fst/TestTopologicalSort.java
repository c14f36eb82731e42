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
package org.wfst.fst;

import static org.junit.Assert.*;

import com.carrotsearch.randomizedtesting.RandomizedTest;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.lucene.util.InfoStream;
import org.junit.Test;
import org.wfst.semiring.LeftStringSemiring;
import org.wfst.semiring.StringWeight;

public class TestTopologicalSort extends RandomizedTest {

  @Test
  public void testCycle() {
    VectorFst<Float> fst = FstTestUtil.fstOf(3, new int[][] {{0, 1}, {1, 2}, {2, 0}});
    VectorFst<Float> copy = new VectorFst<>(fst);

    assertFalse(TopologicalSort.topSort(fst));
    assertEquals(copy, fst);
    assertEquals(Fst.CYCLIC | Fst.NOT_TOP_SORTED, fst.getProperties());
    assertNull(TopologicalSort.topOrder(fst));
  }

  @Test
  public void testDiamond() {
    VectorFst<Float> fst = FstTestUtil.fstOf(3, new int[][] {{0, 1}, {0, 2}, {1, 2}});

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(0, fst.getStart());
    assertEquals(1, fst.getNextState(0, 0));
    assertEquals(2, fst.getNextState(0, 1));
    assertEquals(2, fst.getNextState(1, 0));
    assertTrue(FstTestUtil.arcsIncrease(fst));
  }

  @Test
  public void testDiamondOutOfOrder() {
    // the diamond 0 -> 1 -> 2, 0 -> 2 with ids 2, 0, 1
    VectorFst<Float> fst = FstTestUtil.fstOf(3, new int[][] {{2, 0}, {2, 1}, {0, 1}});
    fst.setStart(2);

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(0, fst.getStart());
    assertEquals(2, fst.getNumArcs(0));
    assertEquals(1, fst.getNumArcs(1));
    assertEquals(0, fst.getNumArcs(2));
    assertEquals(2, fst.getNextState(1, 0));
    assertTrue(FstTestUtil.arcsIncrease(fst));
  }

  @Test
  public void testSingleFinalState() {
    VectorFst<Float> fst = FstTestUtil.fstOf(1, new int[0][]);
    fst.setFinal(0, 0f);
    VectorFst<Float> copy = new VectorFst<>(fst);

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(copy, fst);
    assertTrue(fst.isFinal(0));
  }

  @Test
  public void testEmpty() {
    VectorFst<Float> fst = FstTestUtil.fstOf(0, new int[0][]);
    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(0, fst.getNumStates());
    assertEquals(0, TopologicalSort.topOrder(fst).length);
  }

  @Test
  public void testIsolatedStates() {
    VectorFst<Float> fst = FstTestUtil.fstOf(4, new int[0][]);
    fst.setStart(Fst.NO_STATE);
    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(4, fst.getNumStates());
  }

  @Test
  public void testSelfLoop() {
    VectorFst<Float> fst = FstTestUtil.fstOf(2, new int[][] {{0, 1}, {1, 1}});
    VectorFst<Float> copy = new VectorFst<>(fst);

    assertFalse(TopologicalSort.topSort(fst));
    assertEquals(copy, fst);
  }

  @Test
  public void testCycleInUnreachableComponent() {
    // start component is acyclic, the cycle is only found by the id-order sweep
    VectorFst<Float> fst = FstTestUtil.fstOf(5, new int[][] {{0, 1}, {2, 3}, {3, 4}, {4, 2}});
    VectorFst<Float> copy = new VectorFst<>(fst);

    assertFalse(TopologicalSort.topSort(fst));
    assertEquals(copy, fst);
  }

  @Test
  public void testDisconnectedComponents() {
    VectorFst<Float> fst = FstTestUtil.fstOf(6, new int[][] {{1, 0}, {3, 2}, {5, 4}, {5, 3}});

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(4, fst.getNumArcs());
    assertTrue(FstTestUtil.arcsIncrease(fst));
  }

  @Test
  public void testStartStateComesFirst() {
    VectorFst<Float> fst = FstTestUtil.fstOf(3, new int[][] {{2, 1}, {1, 0}});
    fst.setStart(2);

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(0, fst.getStart());
    assertEquals(1, fst.getNextState(0, 0));
    assertEquals(2, fst.getNextState(1, 0));
  }

  @Test
  public void testFinalWeightsFollowStates() {
    VectorFst<Float> fst = FstTestUtil.fstOf(2, new int[][] {{1, 0}});
    fst.setStart(1);
    fst.setFinal(0, 3f);

    assertTrue(TopologicalSort.topSort(fst));
    assertFalse(fst.isFinal(0));
    assertTrue(fst.isFinal(1));
    assertEquals(3f, fst.getFinal(1), 0f);
  }

  @Test
  public void testRandomAcyclic() {
    final int iters = atLeast(20);
    for (int iter = 0; iter < iters; iter++) {
      final int numStates = randomIntBetween(1, 200);
      VectorFst<Float> fst =
          FstTestUtil.randomAcyclicFst(getRandom(), numStates, randomIntBetween(0, 4));
      VectorFst<Float> expected = new VectorFst<>(fst);
      if (TopologicalSort.isTopSorted(expected) == false) {
        expected.permute(TopologicalSort.topOrder(expected));
      }

      assertTrue(TopologicalSort.topSort(fst));
      assertTrue(FstTestUtil.arcsIncrease(fst));
      assertEquals(expected, fst);
      assertEquals(Fst.ACYCLIC | Fst.TOP_SORTED, fst.getProperties());
    }
  }

  @Test
  public void testRandomCyclic() {
    final int iters = atLeast(20);
    for (int iter = 0; iter < iters; iter++) {
      final int numStates = randomIntBetween(1, 200);
      VectorFst<Float> fst = FstTestUtil.randomAcyclicFst(getRandom(), numStates, 3);
      TopologicalSort.topSort(fst);
      // close a cycle from some state back to one of its ancestors (or itself)
      final int to = randomIntBetween(0, numStates - 1);
      final int from = randomIntBetween(to, numStates - 1);
      fst.addArc(from, 1, 1, 0f, to);
      if (from != to) {
        fst.addArc(to, 1, 1, 0f, from);
      }
      VectorFst<Float> copy = new VectorFst<>(fst);

      assertFalse(TopologicalSort.topSort(fst));
      assertEquals(copy, fst);
    }
  }

  @Test
  public void testSortTwiceIsNoOp() {
    VectorFst<Float> fst = FstTestUtil.randomAcyclicFst(getRandom(), 50, 3);
    assertTrue(TopologicalSort.topSort(fst));
    VectorFst<Float> sorted = new VectorFst<>(fst);

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(sorted, fst);

    // also without the cached properties
    fst.setProperties(0, Fst.STRUCTURAL_PROPERTIES);
    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(sorted, fst);
  }

  @Test
  public void testDeepChain() {
    // deeper than any thread stack would allow with recursion
    final int numStates = 200_000;
    VectorFst<Float> fst = FstTestUtil.fstOf(numStates, new int[0][]);
    for (int s = numStates - 1; s > 0; s--) {
      fst.addArc(s, 1, 1, 0f, s - 1);
    }
    fst.setStart(numStates - 1);

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(0, fst.getStart());
    assertTrue(FstTestUtil.arcsIncrease(fst));
  }

  @Test
  public void testWeightsAreCargo() throws IOException {
    VectorFst<StringWeight> fst = new VectorFst<>(new LeftStringSemiring());
    fst.addStates(3);
    fst.setStart(2);
    fst.addArc(2, 1, 2, StringWeight.of(1, 2), 1);
    fst.addArc(1, 3, 4, StringWeight.INFINITY, 0);
    fst.setFinal(0, StringWeight.EMPTY);

    assertTrue(TopologicalSort.topSort(fst));
    assertEquals(StringWeight.of(1, 2), fst.getArc(0, 0).weight());
    assertEquals(StringWeight.INFINITY, fst.getArc(1, 0).weight());
    assertEquals(StringWeight.EMPTY, fst.getFinal(2));
  }

  @Test
  public void testInfoStream() {
    final List<String> messages = new ArrayList<>();
    InfoStream infoStream =
        new InfoStream() {
          @Override
          public void message(String component, String message) {
            messages.add(component + ": " + message);
          }

          @Override
          public boolean isEnabled(String component) {
            return TopologicalSort.INFO_COMPONENT.equals(component);
          }

          @Override
          public void close() {}
        };

    VectorFst<Float> fst = FstTestUtil.fstOf(2, new int[][] {{0, 1}, {1, 0}});
    assertFalse(TopologicalSort.topSort(fst, infoStream));
    assertEquals(1, messages.size());
    assertTrue(messages.get(0), messages.get(0).startsWith("TOPSORT: cycle found"));

    // the verdict is cached until the next mutation
    assertFalse(TopologicalSort.topSort(fst, infoStream));
    assertTrue(messages.get(1), messages.get(1).contains("known to be cyclic"));
  }
}
