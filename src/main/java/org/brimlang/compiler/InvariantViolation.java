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

import com.google.common.base.Preconditions;

/**
 * An InvariantViolation reports a program tree that the editor should never be able to construct,
 * e.g. one that defines the same id twice in a scope. It indicates a bug elsewhere, but is thrown
 * (rather than producing a malformed CompiledDefinition) so that the caller can recover.
 */
public class InvariantViolation extends RuntimeException {

  /** The invariants that can be violated. */
  public enum Kind {
    DUPLICATE_STREAM_ID,
    DUPLICATE_FUNCTION_ID,

    /** A yield's index is outside the range declared by its definition's signature. */
    YIELD_OUT_OF_RANGE,

    /** Two yields in the same definition have the same index. */
    DUPLICATE_YIELD,

    /** Some index declared by a definition's signature has no corresponding yield. */
    YIELD_GAP,

    /** The main definition refers to streams outside of itself. */
    UNCLOSED_ROOT,

    /** A compiled application consumes a stream defined by a later application. */
    UNORDERED_APPLICATION
  }

  public final Kind kind;

  /** The identifier most closely associated with the violation. */
  public final String subject;

  public InvariantViolation(Kind kind, Object subject, String msg) {
    super(String.format("%s (%s)", msg, subject));
    this.kind = Preconditions.checkNotNull(kind);
    this.subject = String.valueOf(subject);
  }
}
