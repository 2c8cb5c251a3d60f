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
 * A CompileError reports a problem with the program tree that a user's edit can legitimately
 * produce, such as a half-built reference. The editor is expected to catch it and show it inline;
 * see {@link Compiler#tryCompile}.
 */
public class CompileError extends RuntimeException {

  /** The classes of compile error. */
  public enum Kind {
    /** A stream expression depends, directly or indirectly, on itself. */
    CYCLE,

    /** A stream reference whose target is not defined in any visible scope. */
    UNRESOLVED_STREAM,

    /** An application or function argument whose function is not defined in any visible scope. */
    UNRESOLVED_FUNCTION,

    /** An application with no unnamed output was used where a stream value is needed. */
    NO_RETURNED_STREAM,

    /** Reserved for argument-count and signature checks, which are not yet implemented. */
    SIGNATURE_MISMATCH
  }

  public final Kind kind;

  /** The identifier (stream, function, or application id) of the node that caused the error. */
  public final String subject;

  public final String msg;

  public CompileError(Kind kind, Object subject, String msg) {
    super(msg);
    this.kind = Preconditions.checkNotNull(kind);
    this.subject = String.valueOf(subject);
    this.msg = msg;
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s)", msg, subject);
  }
}
