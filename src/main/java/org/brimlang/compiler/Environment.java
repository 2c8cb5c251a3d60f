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
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * An Environment maps keys to values, falling back to a parent Environment for keys it does not
 * have. The compiler creates one frame per scope for each of its two namespaces (streams and
 * functions), chained to the frames of the enclosing scope.
 *
 * <p>Values may be null; a key bound to null is still present (the compiler uses null to mark a
 * stream or function that is a parameter rather than being defined by a node).
 *
 * <p>There is no way to remove a binding; frames live exactly as long as the compilation of their
 * scope.
 */
final class Environment<K, V> {

  /** The bindings made in this frame. */
  private final Map<K, @Nullable V> entries = new HashMap<>();

  /** If non-null, lookups that miss in this frame continue here. */
  private final @Nullable Environment<K, V> parent;

  /** Creates a root frame. */
  Environment() {
    this.parent = null;
  }

  /** Creates a frame whose lookups fall back to {@code parent}. */
  Environment(Environment<K, V> parent) {
    this.parent = Preconditions.checkNotNull(parent);
  }

  /** Returns true if {@code key} is bound in this frame or any of its ancestors. */
  boolean has(K key) {
    for (Environment<K, V> env = this; env != null; env = env.parent) {
      if (env.entries.containsKey(key)) {
        return true;
      }
    }
    return false;
  }

  /** Returns true if {@code key} is bound in this frame, ignoring ancestors. */
  boolean hasLocal(K key) {
    return entries.containsKey(key);
  }

  /**
   * Returns the value bound to {@code key} in the nearest frame that binds it; throws a
   * NoSuchElementException if no frame does.
   */
  @Nullable V get(K key) {
    for (Environment<K, V> env = this; env != null; env = env.parent) {
      if (env.entries.containsKey(key)) {
        return env.entries.get(key);
      }
    }
    throw new NoSuchElementException(String.valueOf(key));
  }

  /**
   * Binds {@code key} in this frame. Throws an IllegalStateException if this frame already binds
   * it; a binding of the same key in an ancestor frame is shadowed, which is not an error.
   */
  void set(K key, @Nullable V value) {
    Preconditions.checkState(!entries.containsKey(key), "Already bound: %s", key);
    entries.put(key, value);
  }
}
