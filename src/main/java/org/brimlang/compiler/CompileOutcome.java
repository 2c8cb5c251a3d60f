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
import org.jspecify.annotations.Nullable;

/**
 * The result of {@link Compiler#tryCompile}: a definition that is always safe to hand to the
 * runtime, and the error (if any) that the editor should display.
 */
public final class CompileOutcome {
  /** The compiled program, or {@link CompiledDefinition#empty} if compilation failed. */
  public final CompiledDefinition definition;

  /** Either a {@link CompileError} or an {@link InvariantViolation}; null on success. */
  public final @Nullable RuntimeException error;

  private CompileOutcome(CompiledDefinition definition, @Nullable RuntimeException error) {
    this.definition = Preconditions.checkNotNull(definition);
    this.error = error;
  }

  static CompileOutcome success(CompiledDefinition definition) {
    return new CompileOutcome(definition, null);
  }

  static CompileOutcome failure(RuntimeException error) {
    Preconditions.checkArgument(
        error instanceof CompileError || error instanceof InvariantViolation);
    return new CompileOutcome(CompiledDefinition.empty(), error);
  }

  public boolean succeeded() {
    return error == null;
  }

  /**
   * Returns the id of the node that caused the failure, so that the editor can show the error next
   * to it; returns null on success.
   */
  public @Nullable String errorSubject() {
    if (error instanceof CompileError compileError) {
      return compileError.subject;
    } else if (error instanceof InvariantViolation violation) {
      return violation.subject;
    }
    return null;
  }
}
