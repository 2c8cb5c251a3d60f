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

import org.brimlang.Ids.FunctionId;

/**
 * A function with no inspectable body. Only its interface is part of the tree; the implementation
 * is looked up by id in a {@link org.brimlang.natives.NativeRegistry}.
 */
public final class NativeFunctionDefinition extends FunctionDefinition {

  public NativeFunctionDefinition(FunctionId id, FunctionSignature signature) {
    super(id, signature);
  }

  @Override
  public String toString() {
    return "native " + id;
  }
}
