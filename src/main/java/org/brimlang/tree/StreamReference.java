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
import org.brimlang.Ids.StreamId;

/** Refers to a stream defined elsewhere, in this scope or an enclosing one. */
public final class StreamReference extends StreamExpression {
  /** The id of the referenced stream. */
  public final StreamId target;

  public StreamReference(StreamId target) {
    this.target = Preconditions.checkNotNull(target);
  }

  @Override
  public <T> T accept(Visitor<T> visitor) {
    return visitor.visitReference(this);
  }

  @Override
  public String toString() {
    return "&" + target;
  }
}
