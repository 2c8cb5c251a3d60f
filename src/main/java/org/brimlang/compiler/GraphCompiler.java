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
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.brimlang.compiler.CompileError.Kind;
import org.brimlang.compiler.CompiledDefinition.AppSpec;
import org.brimlang.compiler.CompiledDefinition.ConstStream;
import org.brimlang.tree.Application;
import org.brimlang.tree.ArrayLiteral;
import org.brimlang.tree.BodyExpression;
import org.brimlang.tree.BooleanLiteral;
import org.brimlang.tree.FunctionDefinition;
import org.brimlang.tree.FunctionExpression;
import org.brimlang.tree.Nodes;
import org.brimlang.tree.NumberLiteral;
import org.brimlang.tree.SimpleLiteral;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.StreamIndirection;
import org.brimlang.tree.StreamReference;
import org.brimlang.tree.TextLiteral;
import org.brimlang.tree.UndefinedLiteral;
import org.brimlang.tree.YieldExpression;

/**
 * The second pass over a scope linearizes its stream expressions into constant streams and a
 * topologically ordered list of applications, using the depth-first search formulation of
 * topological sorting.
 *
 * <p>Each stream expression node is in one of three states: unmarked, temporarily marked (its
 * resolution is in progress, i.e. it is on the current DFS path), or permanently marked (it and
 * everything it depends on have been emitted). An application is appended to {@link #apps} only
 * after all of its arguments have been resolved, which is what makes the list a valid evaluation
 * order. Reaching a temporarily marked node again means the graph has a cycle.
 *
 * <p>Must be run after {@link LocalCollector} has populated the Scope. References to streams
 * defined in an enclosing scope are not followed; they are recorded in {@code externalStreamIds}.
 */
final class GraphCompiler implements StreamExpression.Visitor<Void> {
  private final Scope scope;

  private final Set<StreamId> externalStreamIds;

  private final Set<StreamExpression> temporary = Sets.newIdentityHashSet();
  private final Set<StreamExpression> permanent = Sets.newIdentityHashSet();

  final List<ConstStream> constStreams = new ArrayList<>();
  final List<AppSpec> apps = new ArrayList<>();

  /** Indexed by output position; filled in by yields. */
  private final StreamId[] yieldIds;

  GraphCompiler(Scope scope, Set<StreamId> externalStreamIds) {
    this.scope = scope;
    this.externalStreamIds = externalStreamIds;
    this.yieldIds = new StreamId[scope.definition.signature.numYields()];
  }

  /**
   * Resolves each entry of the scope's body in order, and returns the yielded stream ids. Entries
   * that are neither yields nor function definitions are still resolved, so that their
   * applications are emitted.
   */
  ImmutableList<StreamId> compileBody() {
    for (BodyExpression entry : scope.definition.body) {
      entry.accept(bodyVisitor);
    }
    for (int i = 0; i < yieldIds.length; i++) {
      if (yieldIds[i] == null) {
        throw Compiler.violation(
            InvariantViolation.Kind.YIELD_GAP, scope.definition.id, "No yield for output %s", i);
      }
    }
    return ImmutableList.copyOf(Arrays.asList(yieldIds));
  }

  private final BodyExpression.Visitor<Void> bodyVisitor =
      new BodyExpression.Visitor<Void>() {
        @Override
        public Void visitStreamExpression(StreamExpression expression) {
          resolve(expression);
          return null;
        }

        @Override
        public Void visitYield(YieldExpression yield) {
          int index = yield.index;
          if (index >= yieldIds.length) {
            throw Compiler.violation(
                InvariantViolation.Kind.YIELD_OUT_OF_RANGE,
                scope.definition.id,
                "Yield to output %s of %s",
                index,
                yieldIds.length);
          } else if (yieldIds[index] != null) {
            throw Compiler.violation(
                InvariantViolation.Kind.DUPLICATE_YIELD,
                scope.definition.id,
                "Output %s yielded twice",
                index);
          }
          yieldIds[index] = resolveValue(yield.expression);
          return null;
        }

        @Override
        public Void visitFunctionDefinition(FunctionDefinition definition) {
          // Local definitions are compiled separately, by ScopeCompiler.
          return null;
        }
      };

  /**
   * Emits whatever is needed to compute {@code node}, if it hasn't already been emitted. Throws a
   * CYCLE CompileError if {@code node} is already being resolved.
   */
  void resolve(StreamExpression node) {
    if (permanent.contains(node)) {
      return;
    } else if (temporary.contains(node)) {
      throw Compiler.error(Kind.CYCLE, subject(node), "Stream depends on itself");
    }
    node.accept(this);
    permanent.add(node);
  }

  /** Resolves {@code node} and returns the id of the stream that holds its value. */
  StreamId resolveValue(StreamExpression node) {
    resolve(node);
    StreamId result = Nodes.returnedStreamId(node);
    if (result == null) {
      throw Compiler.error(
          Kind.NO_RETURNED_STREAM, subject(node), "Application has no unnamed output");
    }
    return result;
  }

  /** Returns an id that can be used to identify {@code node} in an error. */
  private static Object subject(StreamExpression node) {
    if (node instanceof Application application) {
      return application.id;
    }
    return Nodes.returnedStreamId(node);
  }

  private Void emitConst(SimpleLiteral node) {
    constStreams.add(new ConstStream(node.id, node.value()));
    return null;
  }

  @Override
  public Void visitUndefined(UndefinedLiteral node) {
    return emitConst(node);
  }

  @Override
  public Void visitNumber(NumberLiteral node) {
    return emitConst(node);
  }

  @Override
  public Void visitText(TextLiteral node) {
    return emitConst(node);
  }

  @Override
  public Void visitBoolean(BooleanLiteral node) {
    return emitConst(node);
  }

  @Override
  public Void visitArray(ArrayLiteral node) {
    checkFunction(Builtins.ARRAY);
    temporary.add(node);
    ImmutableList.Builder<StreamId> elementIds = ImmutableList.builder();
    for (StreamExpression element : node.elements) {
      elementIds.add(resolveValue(element));
    }
    temporary.remove(node);
    apps.add(
        new AppSpec(
            ImmutableList.of(node.id),
            Builtins.syntheticApplicationId(node.id),
            Builtins.ARRAY,
            elementIds.build(),
            ImmutableList.of()));
    return null;
  }

  @Override
  public Void visitIndirection(StreamIndirection node) {
    checkFunction(Builtins.IDENTITY);
    temporary.add(node);
    StreamId source = resolveValue(node.expression);
    temporary.remove(node);
    apps.add(
        new AppSpec(
            ImmutableList.of(node.id),
            Builtins.syntheticApplicationId(node.id),
            Builtins.IDENTITY,
            ImmutableList.of(source),
            ImmutableList.of()));
    return null;
  }

  @Override
  public Void visitReference(StreamReference node) {
    StreamId target = node.target;
    if (scope.isLocal(target)) {
      StreamExpression definedBy = scope.streams.get(target);
      // A null definedBy is a parameter, which is available without computing anything.
      if (definedBy != null) {
        temporary.add(node);
        resolve(definedBy);
        temporary.remove(node);
      }
    } else if (scope.streams.has(target)) {
      // Defined in an enclosing scope; the dependency is the enclosing scope's concern.
      externalStreamIds.add(target);
    } else {
      throw Compiler.error(Kind.UNRESOLVED_STREAM, target, "Reference to undefined stream");
    }
    return null;
  }

  @Override
  public Void visitApplication(Application node) {
    checkFunction(node.function);
    temporary.add(node);
    ImmutableList.Builder<StreamId> streamArgIds = ImmutableList.builder();
    for (StreamExpression arg : node.streamArgs) {
      streamArgIds.add(resolveValue(arg));
    }
    ImmutableList.Builder<FunctionId> functionArgIds = ImmutableList.builder();
    for (FunctionExpression arg : node.functionArgs) {
      // Don't compile the function here; every local definition is compiled exactly once, by
      // ScopeCompiler, however many times it is referenced.
      functionArgIds.add(checkFunction(arg.functionId()));
    }
    temporary.remove(node);
    apps.add(
        new AppSpec(
            node.outs.stream().map(out -> out.id).collect(ImmutableList.toImmutableList()),
            node.id,
            node.function,
            streamArgIds.build(),
            functionArgIds.build()));
    return null;
  }

  /** Throws an UNRESOLVED_FUNCTION CompileError if {@code id} is not visible in this scope. */
  private FunctionId checkFunction(FunctionId id) {
    if (!scope.functions.has(id)) {
      throw Compiler.error(Kind.UNRESOLVED_FUNCTION, id, "Reference to undefined function");
    }
    return id;
  }
}
