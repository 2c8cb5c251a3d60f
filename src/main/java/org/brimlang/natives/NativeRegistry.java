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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;
import org.brimlang.Ids;
import org.brimlang.Ids.FunctionId;
import org.brimlang.tree.FunctionSignature;
import org.brimlang.tree.NativeFunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * An immutable table of native functions, keyed by function id. The editor passes {@link
 * #definitions} to the compiler as the program's global functions, and the runtime uses {@link
 * #lookup} to find the code to run for an application.
 */
public final class NativeRegistry {
  private final ImmutableMap<FunctionId, NativeFunction> functions;

  private NativeRegistry(ImmutableMap<FunctionId, NativeFunction> functions) {
    this.functions = functions;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the native function with the given id, or null if there is none. */
  public @Nullable NativeFunction lookup(FunctionId id) {
    return functions.get(id);
  }

  /** Returns the definition of each native function, keyed by id, in registration order. */
  public ImmutableMap<FunctionId, NativeFunctionDefinition> definitions() {
    ImmutableMap.Builder<FunctionId, NativeFunctionDefinition> builder = ImmutableMap.builder();
    functions.forEach((id, f) -> builder.put(id, f.definition));
    return builder.buildOrThrow();
  }

  public int size() {
    return functions.size();
  }

  /** Collects native functions for a new NativeRegistry. */
  public static final class Builder {
    private final Map<FunctionId, NativeFunction> functions = new LinkedHashMap<>();

    private Builder() {}

    /** Adds a function; throws an IllegalArgumentException if its id has already been added. */
    @CanIgnoreReturnValue
    public Builder add(NativeFunction function) {
      NativeFunction prev = functions.putIfAbsent(function.id(), function);
      Preconditions.checkArgument(prev == null, "Duplicate native function %s", function.id());
      return this;
    }

    /** Adds a function whose id is {@code "F-"} followed by {@code name}. */
    @CanIgnoreReturnValue
    public Builder define(
        String name, String displayName, FunctionSignature signature, NativeFunction.Impl impl) {
      FunctionId id = FunctionId.of(Ids.FUNCTION_ID_PREFIX + name);
      NativeFunctionDefinition definition = new NativeFunctionDefinition(id, signature);
      return add(new NativeFunction(definition, displayName, impl));
    }

    public NativeRegistry build() {
      return new NativeRegistry(ImmutableMap.copyOf(functions));
    }
  }
}
