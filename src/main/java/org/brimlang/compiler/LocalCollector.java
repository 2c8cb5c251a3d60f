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

import org.brimlang.tree.Application;
import org.brimlang.tree.ArrayLiteral;
import org.brimlang.tree.BodyExpression;
import org.brimlang.tree.BooleanLiteral;
import org.brimlang.tree.FunctionDefinition;
import org.brimlang.tree.FunctionExpression;
import org.brimlang.tree.NumberLiteral;
import org.brimlang.tree.SimpleLiteral;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.StreamIndirection;
import org.brimlang.tree.StreamReference;
import org.brimlang.tree.TextLiteral;
import org.brimlang.tree.UndefinedLiteral;
import org.brimlang.tree.YieldExpression;

/**
 * The first pass over a scope does only one thing: it adds every stream id and function id defined
 * in the scope to the Scope's environments, in pre-order. That includes the definition's
 * parameters, the ids of literals, arrays and indirections, the outputs of applications, and
 * function definitions appearing either as body entries or as function arguments.
 *
 * <p>The pass never descends into the body of a function definition; that body is a separate scope
 * and is collected when the definition itself is compiled.
 */
final class LocalCollector implements StreamExpression.Visitor<Void> {

  /** Runs the first pass over the given scope. */
  static void apply(Scope scope) {
    scope.definition.streamParams.forEach(id -> scope.addStream(id, null));
    scope.definition.functionParams.forEach(id -> scope.addFunction(id, null));
    LocalCollector collector = new LocalCollector(scope);
    for (BodyExpression entry : scope.definition.body) {
      entry.accept(collector.bodyVisitor);
    }
  }

  private final Scope scope;

  private LocalCollector(Scope scope) {
    this.scope = scope;
  }

  private final BodyExpression.Visitor<Void> bodyVisitor =
      new BodyExpression.Visitor<Void>() {
        @Override
        public Void visitStreamExpression(StreamExpression expression) {
          return expression.accept(LocalCollector.this);
        }

        @Override
        public Void visitYield(YieldExpression yield) {
          return yield.expression.accept(LocalCollector.this);
        }

        @Override
        public Void visitFunctionDefinition(FunctionDefinition definition) {
          scope.addFunction(definition.id, definition);
          return null;
        }
      };

  private Void addLiteral(SimpleLiteral node) {
    scope.addStream(node.id, node);
    return null;
  }

  @Override
  public Void visitUndefined(UndefinedLiteral node) {
    return addLiteral(node);
  }

  @Override
  public Void visitNumber(NumberLiteral node) {
    return addLiteral(node);
  }

  @Override
  public Void visitText(TextLiteral node) {
    return addLiteral(node);
  }

  @Override
  public Void visitBoolean(BooleanLiteral node) {
    return addLiteral(node);
  }

  @Override
  public Void visitArray(ArrayLiteral node) {
    scope.addStream(node.id, node);
    node.elements.forEach(e -> e.accept(this));
    return null;
  }

  @Override
  public Void visitIndirection(StreamIndirection node) {
    scope.addStream(node.id, node);
    return node.expression.accept(this);
  }

  @Override
  public Void visitReference(StreamReference node) {
    // A reference consumes an id; it doesn't define one.
    return null;
  }

  @Override
  public Void visitApplication(Application node) {
    node.outs.forEach(out -> scope.addStream(out.id, node));
    node.streamArgs.forEach(arg -> arg.accept(this));
    for (FunctionExpression arg : node.functionArgs) {
      if (arg instanceof FunctionDefinition definition) {
        scope.addFunction(definition.id, definition);
      }
    }
    return null;
  }
}
