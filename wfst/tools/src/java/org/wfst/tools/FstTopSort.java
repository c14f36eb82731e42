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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.lucene.store.InputStreamDataInput;
import org.apache.lucene.store.OutputStreamDataOutput;
import org.apache.lucene.util.IOUtils;
import org.apache.lucene.util.InfoStream;
import org.apache.lucene.util.PrintStreamInfoStream;
import org.wfst.fst.TopologicalSort;
import org.wfst.fst.VectorFst;

/**
 * Command-line tool that topologically sorts a serialized graph.
 *
 * <pre>
 *   fsttopsort [in.fst|- [out.fst]]
 * </pre>
 *
 * <p>Reads from standard input when the input is {@code -} or missing and writes to standard
 * output when the output is missing. A cyclic input is not an error: the tool warns on standard
 * error and writes the graph unchanged. Exits with {@code 0} on success and {@code 1} on a usage
 * error or a read or write failure; nothing is written when the input cannot be read.
 *
 * <p>Set the system property {@code wfst.verbose} to {@code true} to log diagnostics to standard
 * error.
 */
public final class FstTopSort {

  static final String PROGRAM = "fsttopsort";

  static final String USAGE =
      "Topologically sorts an FST.\n\n  Usage: " + PROGRAM + " [in.fst [out.fst]]\n";

  /** System property enabling diagnostics on standard error. */
  public static final String VERBOSE_PROPERTY = "wfst.verbose";

  private FstTopSort() {}

  public static void main(String[] args) {
    if (Boolean.getBoolean(VERBOSE_PROPERTY)) {
      // must be installed before any graph is read
      InfoStream.setDefault(new PrintStreamInfoStream(System.err));
    }
    final int exitCode = run(args, System.in, System.out, System.err);
    System.out.flush();
    System.exit(exitCode);
  }

  /** Runs the tool and returns its exit code. */
  static int run(String[] args, InputStream stdin, OutputStream stdout, PrintStream stderr) {
    if (args.length > 2) {
      stderr.print(USAGE);
      return 1;
    }
    final String inName = args.length > 0 && "-".equals(args[0]) == false ? args[0] : null;
    final String outName = args.length > 1 ? args[1] : null;

    final VectorFst<?> fst;
    try {
      if (inName == null) {
        fst = VectorFst.read(new InputStreamDataInput(new BufferedInputStream(stdin)));
      } else {
        fst = VectorFst.read(Paths.get(inName));
      }
    } catch (IOException e) {
      stderr.println(
          "ERROR: "
              + PROGRAM
              + ": Could not read FST from "
              + (inName == null ? "standard input" : "file \"" + inName + "\"")
              + ": "
              + e);
      return 1;
    }

    final boolean acyclic = TopologicalSort.topSort(fst);
    if (acyclic == false) {
      stderr.println("WARNING: " + PROGRAM + ": Input FST is cyclic");
    }

    if (outName == null) {
      try {
        final BufferedOutputStream os = new BufferedOutputStream(stdout);
        fst.save(new OutputStreamDataOutput(os));
        os.flush();
      } catch (IOException e) {
        stderr.println("ERROR: " + PROGRAM + ": Could not write FST to standard output: " + e);
        return 1;
      }
    } else {
      final Path out = Paths.get(outName);
      try {
        fst.save(out);
      } catch (IOException e) {
        IOUtils.deleteFilesIgnoringExceptions(out);
        stderr.println(
            "ERROR: " + PROGRAM + ": Could not write FST to file \"" + outName + "\": " + e);
        return 1;
      }
    }
    return 0;
  }
}
