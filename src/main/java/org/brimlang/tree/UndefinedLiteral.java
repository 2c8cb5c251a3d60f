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

import org.brimlang.Ids.StreamId;
import org.jspecify.annotations.Nullable;

/** A placeholder stream with no value, e.g. an argument the user has not filled in yet. */
public final class UndefinedLiteral extends SimpleLiteral {

  public UndefinedLiteral(StreamId id) {
    super(id);
  }

  @Override
  public @Nullable Object value() {
    return null;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitUndefined(this);
  }

  @Override
  public String toString() {
    return id + "=undefined";
  }
}
