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

import com.google.common.base.Preconditions;

/** Declares that output {@code index} of the enclosing definition is the value of an expression. */
public final class YieldExpression implements BodyExpression {
  public final int index;
  public final StreamExpression expression;

  public YieldExpression(int index, StreamExpression expression) {
    Preconditions.checkArgument(index >= 0);
    this.index = index;
    this.expression = Preconditions.checkNotNull(expression);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitYield(this);
  }

  @Override
  public String toString() {
    return "yield " + index + " " + expression;
  }
}
