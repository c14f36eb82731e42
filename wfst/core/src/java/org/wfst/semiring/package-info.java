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
 * Weight types for weighted finite-state transducers.
 *
 * <p>A {@link org.wfst.semiring.Semiring} is the operations object for one weight type: it
 * supplies the identities, {@code plus}, {@code times}, division, reversal and (de)serialization
 * of immutable weight values, and declares through {@link
 * org.wfst.semiring.Semiring#properties()} which algebraic laws hold. Shipped weight types:
 *
 * <ul>
 *   <li>{@link org.wfst.semiring.TropicalSemiring}: min and +, for best-path costs
 *   <li>{@link org.wfst.semiring.LogSemiring}: log-add and +, for negative log probabilities
 *   <li>{@link org.wfst.semiring.RealSemiring}: + and *, for probabilities
 *   <li>{@link org.wfst.semiring.MinMaxSemiring}: min and max
 *   <li>{@link org.wfst.semiring.LeftStringSemiring} and {@link
 *       org.wfst.semiring.RightStringSemiring}: longest common prefix (suffix) and concatenation
 *   <li>{@link org.wfst.semiring.ProductSemiring}: componentwise pairs of two weight types
 * </ul>
 *
 * <p>Invalid results are not exceptions: operations return {@link
 * org.wfst.semiring.Semiring#noWeight()}, which every later operation propagates.
 */
package org.wfst.semiring;
