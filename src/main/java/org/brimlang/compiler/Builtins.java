/*
 * Copyright 2025 The Brim Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.brimlang.compiler;

import org.brimlang.Ids;
import org.brimlang.Ids.ApplicationId;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;

/**
 * The functions targeted by applications that the compiler synthesizes. The runtime must provide
 * implementations for them (see {@link org.brimlang.natives.StandardNatives}).
 */
public final class Builtins {

  /** Constructs an array whose elements are the values of its stream arguments, in order. */
  public static final FunctionId ARRAY = FunctionId.of("F-array");

  /** Returns the value of its single stream argument. */
  public static final FunctionId IDENTITY = FunctionId.of("F-identity");

  private static final String SYNTHETIC_APPLICATION_PREFIX = Ids.APPLICATION_ID_PREFIX + "syn-";

  private Builtins() {}

  /**
   * Returns the id of the application synthesized to compute {@code output} (from an array
   * literal or indirection). It depends only on the stream id, so edits elsewhere in the tree leave
   * it unchanged.
   */
  static ApplicationId syntheticApplicationId(StreamId output) {
    return ApplicationId.of(
        SYNTHETIC_APPLICATION_PREFIX + output.text().substring(Ids.STREAM_ID_PREFIX.length()));
  }
}
