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

/**
 * Weighted finite-state transducers and algorithms over them.
 *
 * <p>{@link org.wfst.fst.Fst} is the read side of a graph and {@link org.wfst.fst.MutableFst} the
 * mutation side; {@link org.wfst.fst.VectorFst} implements both and reads and writes the binary
 * format. {@link org.wfst.fst.TopologicalSort} renumbers the states of an acyclic graph so every
 * arc leads to a higher state id.
 *
 * <pre class="prettyprint">
 * VectorFst&lt;Float&gt; fst = new VectorFst&lt;&gt;(new TropicalSemiring());
 * int s0 = fst.addState();
 * int s1 = fst.addState();
 * fst.setStart(s1);
 * fst.addArc(s1, 1, 1, 0.5f, s0);
 * fst.setFinal(s0, 0f);
 * boolean acyclic = TopologicalSort.topSort(fst); // true, and now 0 -&gt; 1
 * </pre>
 */
package org.wfst.fst;
