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
import org.brimlang.Ids.FunctionId;

/**
 * A function definition binds a function id. There are two concrete subclasses: {@link
 * TreeFunctionDefinition} (whose body is part of the tree) and {@link NativeFunctionDefinition}
 * (whose implementation is supplied from outside and is not visible to the compiler).
 */
public abstract class FunctionDefinition implements BodyExpression, FunctionExpression {
  public final FunctionId id;
  public final FunctionSignature signature;

  // Subclasses are all in this package.
  FunctionDefinition(FunctionId id, FunctionSignature signature) {
    this.id = Preconditions.checkNotNull(id);
    this.signature = Preconditions.checkNotNull(signature);
  }

  @Override
  public FunctionId functionId() {
    return id;
  }

  @Override
  public final <T> T accept(Visitor<T> visitor) {
    return visitor.visitFunctionDefinition(this);
  }
}
