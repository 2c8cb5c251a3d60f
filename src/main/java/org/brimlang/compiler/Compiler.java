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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.FormatMethod;
import java.util.Map;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;
import org.brimlang.tree.FunctionDefinition;
import org.brimlang.tree.StreamExpression;
import org.brimlang.tree.TreeFunctionDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a program tree into a {@link CompiledDefinition} for the execution runtime.
 *
 * <p>Compilation is synchronous and keeps no state between calls; the editor recompiles the whole
 * tree after every edit.
 */
public final class Compiler {

  private static final Logger logger = LoggerFactory.getLogger(Compiler.class);

  // Static methods only
  private Compiler() {}

  /** Settings for a compilation. Instances are immutable. */
  public static final class Options {
    /** No verification. */
    public static final Options DEFAULT = new Options(false);

    /**
     * If true, each compiled definition is re-checked for topological order and unique stream
     * definitions before it is returned.
     */
    final boolean verify;

    private Options(boolean verify) {
      this.verify = verify;
    }

    public Options withVerify(boolean verify) {
      return new Options(verify);
    }
  }

  /** Equivalent to {@code compileGlobal(main, globals, Options.DEFAULT)}. */
  public static CompiledDefinition compileGlobal(
      TreeFunctionDefinition main, Map<FunctionId, ? extends FunctionDefinition> globals) {
    return compileGlobal(main, globals, Options.DEFAULT);
  }

  /**
   * Compiles a program's main definition.
   *
   * @param main the program's main definition; it must not refer to any stream that it doesn't
   *     define itself
   * @param globals the functions visible to the whole program (usually the native functions),
   *     keyed by id
   * @throws CompileError if the tree is one that the user can construct but is not yet a valid
   *     program, e.g. because it contains a dependency cycle or a reference to an undefined stream
   * @throws InvariantViolation if the tree is one that the editor should never construct
   */
  public static CompiledDefinition compileGlobal(
      TreeFunctionDefinition main,
      Map<FunctionId, ? extends FunctionDefinition> globals,
      Options options) {
    Environment<StreamId, StreamExpression> rootStreams = new Environment<>();
    Environment<FunctionId, FunctionDefinition> rootFunctions = new Environment<>();
    globals.forEach(
        (id, definition) -> {
          Preconditions.checkArgument(id.equals(definition.id), "%s keyed as %s", definition, id);
          rootFunctions.set(id, definition);
        });
    ScopeCompiler.Result result =
        new ScopeCompiler(options).compile(main, rootStreams, rootFunctions);
    if (!result.externalStreamIds.isEmpty()) {
      // Since the root stream environment is empty any such reference should have been reported as
      // UNRESOLVED_STREAM, so this would be a compiler bug.
      throw violation(
          InvariantViolation.Kind.UNCLOSED_ROOT,
          result.externalStreamIds.iterator().next(),
          "Main definition %s is not closed",
          main.id);
    }
    return result.definition;
  }

  /**
   * Like {@link #compileGlobal}, but never throws a CompileError or InvariantViolation; instead
   * the error is logged and returned with an empty definition, which the runtime can safely run in
   * place of the program.
   */
  public static CompileOutcome tryCompile(
      TreeFunctionDefinition main,
      Map<FunctionId, ? extends FunctionDefinition> globals,
      Options options) {
    try {
      CompiledDefinition result = compileGlobal(main, globals, options);
      if (logger.isDebugEnabled()) {
        logger.debug("Compiled {}:\n{}", main.id, result);
      }
      return CompileOutcome.success(result);
    } catch (CompileError e) {
      logger.warn("Cannot compile {}: {}", main.id, e.getMessage());
      return CompileOutcome.failure(e);
    } catch (InvariantViolation e) {
      logger.error("Malformed program tree {}", main.id, e);
      return CompileOutcome.failure(e);
    }
  }

  /** Returns a new CompileError of the given kind. */
  @FormatMethod
  static CompileError error(
      CompileError.Kind kind, Object subject, String fmt, Object... fmtArgs) {
    return new CompileError(kind, subject, String.format(fmt, fmtArgs));
  }

  /** Returns a new InvariantViolation of the given kind. */
  @FormatMethod
  static InvariantViolation violation(
      InvariantViolation.Kind kind, Object subject, String fmt, Object... fmtArgs) {
    return new InvariantViolation(kind, subject, String.format(fmt, fmtArgs));
  }
}
