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
package org.wfst.tools;

import static org.junit.Assert.*;

import com.carrotsearch.randomizedtesting.RandomizedRunner;
import com.carrotsearch.randomizedtesting.RandomizedTest;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.apache.lucene.store.InputStreamDataInput;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.wfst.fst.TopologicalSort;
import org.wfst.fst.VectorFst;
import org.wfst.semiring.TropicalSemiring;

@RunWith(RandomizedRunner.class)
public class TestFstTopSort extends RandomizedTest {

  @Rule public final TemporaryFolder tempDir = new TemporaryFolder();

  private Path dir;
  private ByteArrayOutputStream stdout;
  private ByteArrayOutputStream stderr;

  @Before
  public void setUpStreams() throws IOException {
    dir = tempDir.newFolder().toPath();
    stdout = new ByteArrayOutputStream();
    stderr = new ByteArrayOutputStream();
  }

  private int run(byte[] stdin, String... args) {
    PrintStream err = new PrintStream(stderr, true, StandardCharsets.UTF_8);
    return FstTopSort.run(args, new ByteArrayInputStream(stdin), stdout, err);
  }

  private String errText() {
    return new String(stderr.toByteArray(), StandardCharsets.UTF_8);
  }

  private static VectorFst<Float> cyclic() {
    VectorFst<Float> fst = new VectorFst<>(new TropicalSemiring());
    fst.addStates(3);
    fst.setStart(0);
    fst.addArc(0, 1, 1, 1f, 1);
    fst.addArc(1, 2, 2, 2f, 2);
    fst.addArc(2, 3, 3, 3f, 0);
    fst.setFinal(2, 0f);
    return fst;
  }

  private static VectorFst<Float> unsorted() {
    VectorFst<Float> fst = new VectorFst<>(new TropicalSemiring());
    fst.addStates(3);
    fst.setStart(2);
    fst.addArc(2, 1, 1, 1f, 0);
    fst.addArc(0, 2, 2, 2f, 1);
    fst.setFinal(1, 0.5f);
    return fst;
  }

  @Test
  public void testCyclicFileIsCopiedWithWarning() throws IOException {
    Path in = dir.resolve("in.fst");
    Path out = dir.resolve("out.fst");
    VectorFst<Float> fst = cyclic();
    fst.save(in);

    assertEquals(0, run(new byte[0], in.toString(), out.toString()));
    assertTrue(errText(), errText().contains("WARNING: fsttopsort: Input FST is cyclic"));
    assertEquals(fst, VectorFst.read(out, new TropicalSemiring()));
  }

  @Test
  public void testAcyclicFileIsSorted() throws IOException {
    Path in = dir.resolve("in.fst");
    Path out = dir.resolve("out.fst");
    unsorted().save(in);

    assertEquals(0, run(new byte[0], in.toString(), out.toString()));
    assertEquals("", errText());

    VectorFst<Float> sorted = VectorFst.read(out, new TropicalSemiring());
    assertTrue(TopologicalSort.isTopSorted(sorted));
    assertEquals(0, sorted.getStart());
    assertEquals(2, sorted.getNumArcs());
    assertTrue(sorted.isFinal(2));
  }

  @Test
  public void testStdinToStdout() throws IOException {
    Path in = dir.resolve("in.fst");
    unsorted().save(in);
    byte[] bytes = Files.readAllBytes(in);

    assertEquals(0, run(bytes));
    VectorFst<?> sorted =
        VectorFst.read(new InputStreamDataInput(new ByteArrayInputStream(stdout.toByteArray())));
    assertTrue(TopologicalSort.isTopSorted(sorted));

    // "-" also names standard input
    stdout.reset();
    assertEquals(0, run(bytes, "-"));
    assertEquals(
        sorted,
        VectorFst.read(new InputStreamDataInput(new ByteArrayInputStream(stdout.toByteArray()))));
  }

  @Test
  public void testFileToStdout() throws IOException {
    Path in = dir.resolve("in.fst");
    unsorted().save(in);

    assertEquals(0, run(new byte[0], in.toString()));
    assertTrue(stdout.size() > 0);
  }

  @Test
  public void testTooManyArguments() {
    assertEquals(1, run(new byte[0], "a.fst", "b.fst", "c.fst"));
    assertTrue(errText(), errText().contains("Usage: fsttopsort"));
    assertEquals(0, stdout.size());
  }

  @Test
  public void testTruncatedInput() throws IOException {
    Path in = dir.resolve("in.fst");
    Path out = dir.resolve("out.fst");
    unsorted().save(in);
    byte[] bytes = Files.readAllBytes(in);
    Files.write(in, Arrays.copyOf(bytes, bytes.length / 2));

    assertEquals(1, run(new byte[0], in.toString(), out.toString()));
    assertTrue(errText(), errText().startsWith("ERROR: fsttopsort: Could not read FST from file"));
    assertFalse(Files.exists(out));
  }

  @Test
  public void testMissingInput() {
    Path in = dir.resolve("missing.fst");
    assertEquals(1, run(new byte[0], in.toString()));
    assertTrue(errText(), errText().contains("Could not read FST"));
    assertEquals(0, stdout.size());
  }

  @Test
  public void testEmptyStdin() {
    assertEquals(1, run(new byte[0]));
    assertTrue(errText(), errText().contains("Could not read FST from standard input"));
  }

  @Test
  public void testUnwritableOutput() throws IOException {
    Path in = dir.resolve("in.fst");
    unsorted().save(in);
    Path out = dir.resolve("no-such-dir").resolve("out.fst");

    assertEquals(1, run(new byte[0], in.toString(), out.toString()));
    assertTrue(errText(), errText().contains("Could not write FST to file"));
  }
}
