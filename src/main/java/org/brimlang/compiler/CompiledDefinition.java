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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import org.brimlang.Ids.ApplicationId;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.jspecify.annotations.Nullable;

/**
 * The compiled form of one function definition scope: a flat list of constant streams and a
 * dependency-ordered list of applications, plus the compiled forms of the functions defined
 * locally within the scope.
 *
 * <p>This is the contract between the compiler and the execution runtime. A CompiledDefinition is
 * immutable and is always complete: every application appears after the applications that define
 * the streams it consumes, and there is a yield id for every output declared by the definition's
 * signature.
 */
public final class CompiledDefinition {
  public final ImmutableList<StreamId> streamParamIds;
  public final ImmutableList<FunctionId> functionParamIds;
  public final ImmutableList<ConstStream> constStreams;

  /** In topological order. */
  public final ImmutableList<AppSpec> apps;

  /** In the order the local functions appear in the definition body. */
  public final ImmutableList<LocalDefinition> localDefs;

  /** The stream yielded for each output, indexed by output position. */
  public final ImmutableList<StreamId> yieldIds;

  private static final CompiledDefinition EMPTY =
      new CompiledDefinition(
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of(),
          ImmutableList.of());

  public CompiledDefinition(
      List<StreamId> streamParamIds,
      List<FunctionId> functionParamIds,
      List<ConstStream> constStreams,
      List<AppSpec> apps,
      List<LocalDefinition> localDefs,
      List<StreamId> yieldIds) {
    this.streamParamIds = ImmutableList.copyOf(streamParamIds);
    this.functionParamIds = ImmutableList.copyOf(functionParamIds);
    this.constStreams = ImmutableList.copyOf(constStreams);
    this.apps = ImmutableList.copyOf(apps);
    this.localDefs = ImmutableList.copyOf(localDefs);
    // copyOf() rejects nulls, so a definition with a gap in its yields can't be constructed.
    this.yieldIds = ImmutableList.copyOf(yieldIds);
  }

  /**
   * Returns a definition with no parameters, streams, or yields. The editor hands this to the
   * runtime in place of a program that failed to compile.
   */
  public static CompiledDefinition empty() {
    return EMPTY;
  }

  /** Returns the compiled form of the local function with the given id, or null if none. */
  public @Nullable CompiledDefinition localDefinition(FunctionId id) {
    for (LocalDefinition local : localDefs) {
      if (local.id().equals(id)) {
        return local.definition();
      }
    }
    return null;
  }

  /** A stream with a constant value; an undefined literal has a null value. */
  public record ConstStream(StreamId id, @Nullable Object value) {
    public ConstStream {
      Preconditions.checkNotNull(id);
    }
  }

  /**
   * An application of a function: the streams it defines, the application's id, the applied
   * function, and the (already resolved) ids of its stream and function arguments.
   */
  public record AppSpec(
      ImmutableList<StreamId> outputs,
      ApplicationId id,
      FunctionId function,
      ImmutableList<StreamId> streamArgs,
      ImmutableList<FunctionId> functionArgs) {}

  /** The compiled form of a tree function defined within a scope. */
  public record LocalDefinition(FunctionId id, CompiledDefinition definition) {}

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof CompiledDefinition other)) {
      return false;
    }
    return streamParamIds.equals(other.streamParamIds)
        && functionParamIds.equals(other.functionParamIds)
        && constStreams.equals(other.constStreams)
        && apps.equals(other.apps)
        && localDefs.equals(other.localDefs)
        && yieldIds.equals(other.yieldIds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(streamParamIds, functionParamIds, constStreams, apps, localDefs, yieldIds);
  }

  /**
   * Returns a multi-line summary of this definition, e.g.
   *
   * <pre>
   *   params (S-a; )
   *   const S-x = 3.0
   *   A-1: S-y = F-add(S-x, S-a; )
   *   def F-g {
   *     ...
   *   }
   *   yield S-y
   * </pre>
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    render(sb, "");
    return sb.toString();
  }

  private static final Joiner COMMA = Joiner.on(", ");

  private void render(StringBuilder sb, String indent) {
    sb.append(indent)
        .append(
            String.format(
                "params (%s; %s)\n", COMMA.join(streamParamIds), COMMA.join(functionParamIds)));
    for (ConstStream c : constStreams) {
      sb.append(indent).append("const ").append(c.id()).append(" = ");
      if (c.value() instanceof String) {
        sb.append('"').append(c.value()).append('"');
      } else {
        sb.append(c.value() == null ? "undefined" : c.value());
      }
      sb.append('\n');
    }
    for (AppSpec app : apps) {
      sb.append(indent)
          .append(
              String.format(
                  "%s: %s = %s(%s; %s)\n",
                  app.id(),
                  COMMA.join(app.outputs()),
                  app.function(),
                  COMMA.join(app.streamArgs()),
                  COMMA.join(app.functionArgs())));
    }
    for (LocalDefinition local : localDefs) {
      sb.append(indent).append("def ").append(local.id()).append(" {\n");
      local.definition().render(sb, indent + "  ");
      sb.append(indent).append("}\n");
    }
    if (!yieldIds.isEmpty()) {
      sb.append(indent).append("yield ").append(COMMA.join(yieldIds)).append('\n');
    }
  }
}
