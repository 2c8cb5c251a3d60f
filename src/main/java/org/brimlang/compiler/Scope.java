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

import java.util.LinkedHashSet;
import java.util.Set;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.brimlang.compiler.InvariantViolation.Kind;
import org.brimlang.tree.FunctionDefinition;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.TreeFunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * A Scope holds what the compiler knows about the body of one tree function definition: an
 * Environment frame for each namespace, chained to the frames of the enclosing scope, and the sets
 * of ids that are defined locally (as opposed to inherited from an enclosing scope).
 *
 * <p>A stream id maps to the expression that defines it (for an application, the same node is
 * bound to each of its outputs), or to null if it is a stream parameter. Similarly a function id
 * maps to its definition, or to null for a function parameter.
 */
final class Scope {
  final TreeFunctionDefinition definition;
  final Environment<StreamId, StreamExpression> streams;
  final Environment<FunctionId, FunctionDefinition> functions;

  /** The stream ids defined in this scope, in the order they were found. */
  final Set<StreamId> localStreamIds = new LinkedHashSet<>();

  /** The function ids defined in this scope, in the order they were found. */
  final Set<FunctionId> localFunctionIds = new LinkedHashSet<>();

  Scope(
      TreeFunctionDefinition definition,
      Environment<StreamId, StreamExpression> outerStreams,
      Environment<FunctionId, FunctionDefinition> outerFunctions) {
    this.definition = definition;
    this.streams = new Environment<>(outerStreams);
    this.functions = new Environment<>(outerFunctions);
  }

  /** Returns true if {@code id} is defined in this scope (rather than an enclosing one). */
  boolean isLocal(StreamId id) {
    return localStreamIds.contains(id);
  }

  /**
   * Records that {@code id} is defined in this scope, by {@code definedBy} or (if null) as a
   * parameter. Throws an InvariantViolation if it has already been defined in this scope.
   */
  void addStream(StreamId id, @Nullable StreamExpression definedBy) {
    if (streams.hasLocal(id)) {
      throw Compiler.violation(
          Kind.DUPLICATE_STREAM_ID, id, "Stream defined twice in %s", definition.id);
    }
    streams.set(id, definedBy);
    localStreamIds.add(id);
  }

  /**
   * Records that {@code id} is defined in this scope, by {@code definition} or (if null) as a
   * parameter. Throws an InvariantViolation if it has already been defined in this scope.
   */
  void addFunction(FunctionId id, @Nullable FunctionDefinition definedBy) {
    if (functions.hasLocal(id)) {
      throw Compiler.violation(
          Kind.DUPLICATE_FUNCTION_ID, id, "Function defined twice in %s", definition.id);
    }
    functions.set(id, definedBy);
    localFunctionIds.add(id);
  }
}
