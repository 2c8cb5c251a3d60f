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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.brimlang.compiler.CompiledDefinition.LocalDefinition;
import org.brimlang.tree.FunctionDefinition;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.TreeFunctionDefinition;

/**
 * A ScopeCompiler compiles each scope of one compilation by running {@link LocalCollector}, then
 * recursively compiling every locally defined tree function, then running {@link GraphCompiler}.
 *
 * <p>Every local tree function is compiled, whether or not anything in the scope applies it, so
 * that a function the user has defined but not yet used is still a valid state. Compiling a
 * nested scope has no effect on the enclosing scope's output.
 */
final class ScopeCompiler {
  private final Compiler.Options options;

  ScopeCompiler(Compiler.Options options) {
    this.options = options;
  }

  /** The result of compiling one scope. */
  static final class Result {
    final CompiledDefinition definition;

    /**
     * The streams referred to by this scope (or by the scopes nested within it) that are defined
     * outside of it.
     */
    final ImmutableSet<StreamId> externalStreamIds;

    Result(CompiledDefinition definition, Set<StreamId> externalStreamIds) {
      this.definition = definition;
      this.externalStreamIds = ImmutableSet.copyOf(externalStreamIds);
    }
  }

  /**
   * Compiles {@code definition} as a scope nested within the scope whose environments are {@code
   * outerStreams} and {@code outerFunctions}.
   */
  Result compile(
      TreeFunctionDefinition definition,
      Environment<StreamId, StreamExpression> outerStreams,
      Environment<FunctionId, FunctionDefinition> outerFunctions) {
    Scope scope = new Scope(definition, outerStreams, outerFunctions);
    LocalCollector.apply(scope);

    Set<StreamId> externalStreamIds = new LinkedHashSet<>();
    List<LocalDefinition> localDefs = new ArrayList<>();
    for (FunctionId id : scope.localFunctionIds) {
      // Function parameters map to null and native definitions have no body; neither is compiled.
      if (scope.functions.get(id) instanceof TreeFunctionDefinition local) {
        Result inner = compile(local, scope.streams, scope.functions);
        localDefs.add(new LocalDefinition(id, inner.definition));
        // Anything the nested scope gets from us is resolved; anything it gets from further out
        // is external to us too.
        for (StreamId external : inner.externalStreamIds) {
          if (!scope.isLocal(external)) {
            externalStreamIds.add(external);
          }
        }
      }
    }

    GraphCompiler graph = new GraphCompiler(scope, externalStreamIds);
    ImmutableList<StreamId> yieldIds = graph.compileBody();
    CompiledDefinition result =
        new CompiledDefinition(
            definition.streamParams,
            definition.functionParams,
            graph.constStreams,
            graph.apps,
            localDefs,
            yieldIds);
    if (options.verify) {
      DefinitionVerifier.verify(result);
    }
    return new Result(result, externalStreamIds);
  }
}
