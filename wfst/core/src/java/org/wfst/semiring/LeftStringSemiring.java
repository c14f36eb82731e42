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
 * String semiring whose plus is the longest common prefix. Left distributive only; its reverse
 * is {@link RightStringSemiring}.
 *
 * @lucene.experimental
 */
public final class LeftStringSemiring extends StringSemiring {

  public static final String NAME = "leftstring";

  static final LeftStringSemiring INSTANCE = new LeftStringSemiring();

  /** Sole constructor; also invoked by SPI. */
  public LeftStringSemiring() {
    super(NAME, true);
  }

  @Override
  public Semiring<StringWeight, StringWeight> reverseSemiring() {
    return RightStringSemiring.INSTANCE;
  }
}
