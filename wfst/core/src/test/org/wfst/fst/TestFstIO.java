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
import java.io.ByteArrayInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.lucene.codecs.CodecUtil;
import org.apache.lucene.index.CorruptIndexException;
import org.apache.lucene.store.ByteBuffersDataOutput;
import org.apache.lucene.store.DataInput;
import org.apache.lucene.store.InputStreamDataInput;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.wfst.semiring.LeftStringSemiring;
import org.wfst.semiring.LogSemiring;
import org.wfst.semiring.ProductSemiring;
import org.wfst.semiring.ProductSemiring.Pair;
import org.wfst.semiring.Semiring;
import org.wfst.semiring.StringWeight;
import org.wfst.semiring.TropicalSemiring;

public class TestFstIO extends RandomizedTest {

  @Rule public final TemporaryFolder tempDir = new TemporaryFolder();

  private static byte[] toBytes(VectorFst<?> fst) throws IOException {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    fst.save(out);
    return out.toArrayCopy();
  }

  private static DataInput input(byte[] bytes) {
    return new InputStreamDataInput(new ByteArrayInputStream(bytes));
  }

  private static ByteBuffersDataOutput header(String weightType) throws IOException {
    ByteBuffersDataOutput out = new ByteBuffersDataOutput();
    CodecUtil.writeHeader(out, VectorFst.FILE_FORMAT_NAME, VectorFst.VERSION_CURRENT);
    out.writeString(weightType);
    return out;
  }

  @Test
  public void testTropical() throws IOException {
    VectorFst<Float> fst = FstTestUtil.randomAcyclicFst(getRandom(), 40, 3);
    fst.setFinal(0, 1.5f);

    VectorFst<Float> read = VectorFst.read(input(toBytes(fst)), new TropicalSemiring());
    assertEquals(fst, read);

    // the weight type is found by name too
    VectorFst<?> looked = VectorFst.read(input(toBytes(fst)));
    assertEquals(TropicalSemiring.NAME, looked.getSemiring().getName());
    assertEquals(fst, looked);
  }

  @Test
  public void testEmpty() throws IOException {
    VectorFst<Float> fst = new VectorFst<>(new TropicalSemiring());
    VectorFst<Float> read = VectorFst.read(input(toBytes(fst)), new TropicalSemiring());
    assertEquals(0, read.getNumStates());
    assertEquals(Fst.NO_STATE, read.getStart());
  }

  @Test
  public void testPropertiesSurvive() throws IOException {
    VectorFst<Float> fst = FstTestUtil.randomAcyclicFst(getRandom(), 10, 2);
    assertTrue(TopologicalSort.topSort(fst));
    VectorFst<Float> read = VectorFst.read(input(toBytes(fst)), new TropicalSemiring());
    assertEquals(Fst.ACYCLIC | Fst.TOP_SORTED, read.getProperties());
  }

  @Test
  public void testStringWeights() throws IOException {
    VectorFst<StringWeight> fst = new VectorFst<>(new LeftStringSemiring());
    fst.addStates(3);
    fst.setStart(0);
    fst.addArc(0, 1, 1, StringWeight.of(3, 1, 4), 1);
    fst.addArc(0, 2, 0, StringWeight.EMPTY, 2);
    fst.addArc(1, 0, 0, StringWeight.INFINITY, 2);
    fst.setFinal(2, StringWeight.of(7));

    VectorFst<?> read = VectorFst.read(input(toBytes(fst)));
    assertEquals(LeftStringSemiring.NAME, read.getSemiring().getName());
    assertEquals(fst, read);
    assertEquals(StringWeight.of(3, 1, 4), read.getArc(0, 0).weight());
  }

  @Test
  public void testProductWeights() throws IOException {
    ProductSemiring<Float, Float, StringWeight, StringWeight> semiring =
        new ProductSemiring<>(new TropicalSemiring(), new LeftStringSemiring());
    VectorFst<Pair<Float, StringWeight>> fst = new VectorFst<>(semiring);
    fst.addStates(2);
    fst.setStart(0);
    fst.addArc(0, 1, 2, semiring.newPair(2f, StringWeight.of(5)), 1);
    fst.setFinal(1, semiring.one());

    byte[] bytes = toBytes(fst);
    assertEquals(fst, VectorFst.read(input(bytes), semiring));

    // products are not registered by name
    CorruptIndexException e =
        assertThrows(CorruptIndexException.class, () -> VectorFst.read(input(bytes)));
    assertTrue(e.getMessage(), e.getMessage().contains("unknown weight type"));
  }

  @Test
  public void testFiles() throws IOException {
    Path path = tempDir.newFolder().toPath().resolve("graph.fst");
    VectorFst<Float> fst = FstTestUtil.randomAcyclicFst(getRandom(), 25, 3);
    fst.save(path);

    assertEquals(fst, VectorFst.read(path, new TropicalSemiring()));
    assertEquals(fst, VectorFst.read(path));
  }

  @Test
  public void testTruncated() throws IOException {
    VectorFst<Float> fst = FstTestUtil.fstOf(3, new int[][] {{0, 1}, {1, 2}});
    fst.setFinal(2, 0f);
    byte[] bytes = toBytes(fst);

    for (int len = 0; len < bytes.length; len++) {
      byte[] truncated = Arrays.copyOf(bytes, len);
      assertThrows(
          "len=" + len,
          EOFException.class,
          () -> VectorFst.read(input(truncated), new TropicalSemiring()));
    }
  }

  @Test
  public void testNotAGraph() {
    byte[] bytes = new byte[32];
    Arrays.fill(bytes, (byte) 0x2a);
    assertThrows(CorruptIndexException.class, () -> VectorFst.read(input(bytes)));
  }

  @Test
  public void testUnknownWeightType() throws IOException {
    byte[] bytes = header("nosuchweight").toArrayCopy();
    CorruptIndexException e =
        assertThrows(CorruptIndexException.class, () -> VectorFst.read(input(bytes)));
    assertTrue(e.getMessage(), e.getMessage().contains("unknown weight type \"nosuchweight\""));
  }

  @Test
  public void testWeightTypeMismatch() throws IOException {
    byte[] bytes = toBytes(FstTestUtil.fstOf(1, new int[0][]));
    CorruptIndexException e =
        assertThrows(
            CorruptIndexException.class, () -> VectorFst.read(input(bytes), new LogSemiring()));
    assertTrue(e.getMessage(), e.getMessage().contains("weight type mismatch"));
  }

  @Test
  public void testArcToMissingState() throws IOException {
    Semiring<Float, Float> semiring = new TropicalSemiring();
    ByteBuffersDataOutput out = header(semiring.getName());
    out.writeVInt(1); // numStates
    out.writeZInt(0); // start
    out.writeVLong(0); // properties
    out.writeByte((byte) 0); // not final
    out.writeVInt(1); // numArcs
    out.writeVInt(1);
    out.writeVInt(1);
    semiring.write(0f, out);
    out.writeVInt(5);

    byte[] bytes = out.toArrayCopy();
    CorruptIndexException e =
        assertThrows(CorruptIndexException.class, () -> VectorFst.read(input(bytes)));
    assertTrue(e.getMessage(), e.getMessage().contains("leads to invalid state 5"));
  }

  @Test
  public void testInvalidStart() throws IOException {
    ByteBuffersDataOutput out = header(TropicalSemiring.NAME);
    out.writeVInt(2);
    out.writeZInt(2);
    byte[] bytes = out.toArrayCopy();
    assertThrows(CorruptIndexException.class, () -> VectorFst.read(input(bytes)));
  }

  @Test
  public void testInvalidFinalFlag() throws IOException {
    ByteBuffersDataOutput out = header(TropicalSemiring.NAME);
    out.writeVInt(1);
    out.writeZInt(0);
    out.writeVLong(0);
    out.writeByte((byte) 7);
    byte[] bytes = out.toArrayCopy();
    assertThrows(CorruptIndexException.class, () -> VectorFst.read(input(bytes)));
  }
}
