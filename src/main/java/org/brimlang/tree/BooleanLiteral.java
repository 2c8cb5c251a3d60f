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

public final class BooleanLiteral extends SimpleLiteral {
  public final boolean value;

  public BooleanLiteral(StreamId id, boolean value) {
    super(id);
    this.value = value;
  }

  @Override
  public Boolean value() {
    return value;
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitBoolean(this);
  }

  @Override
  public String toString() {
    return id + "=" + value;
  }
}
