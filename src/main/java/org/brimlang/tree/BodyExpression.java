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

package org.brimlang.tree;

/**
 * An entry in the body of a {@link TreeFunctionDefinition}: a stream expression, a yield, or a
 * nested function definition.
 */
public interface BodyExpression extends Node {

  <T> T accept(Visitor<T> visitor);

  /** A Visitor has one method for each kind of body entry. */
  interface Visitor<T> {
    T visitStreamExpression(StreamExpression expression);

    T visitYield(YieldExpression yield);

    T visitFunctionDefinition(FunctionDefinition definition);
  }
}
