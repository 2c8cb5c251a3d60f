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

package org.brimlang.natives;

import com.google.common.base.Preconditions;
import java.util.List;
import org.brimlang.Ids.FunctionId;
import org.brimlang.tree.NativeFunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * A native function pairs the definition node that the compiler sees (an id and a signature) with
 * the Java code that the runtime calls. The implementation is kept here rather than on the tree
 * node, so program trees contain only data.
 */
public final class NativeFunction {
  public final NativeFunctionDefinition definition;

  /** A human-readable name, for the editor's function chooser. */
  public final String displayName;

  public final Impl impl;

  /**
   * The implementation of a native function. It is called with the current value of each stream
   * argument (null for an undefined value) and returns the value of the function's first yield, or
   * null if it has none.
   */
  @FunctionalInterface
  public interface Impl {
    @Nullable Object apply(List<@Nullable Object> args);
  }

  public NativeFunction(NativeFunctionDefinition definition, String displayName, Impl impl) {
    this.definition = Preconditions.checkNotNull(definition);
    this.displayName = Preconditions.checkNotNull(displayName);
    this.impl = Preconditions.checkNotNull(impl);
  }

  public FunctionId id() {
    return definition.id;
  }

  @Override
  public String toString() {
    return displayName + " (" + definition.id + ")";
  }
}
