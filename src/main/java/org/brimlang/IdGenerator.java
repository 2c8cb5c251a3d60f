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

package org.brimlang;

import com.google.common.base.Preconditions;
import java.util.concurrent.ThreadLocalRandom;
import org.brimlang.Ids.ApplicationId;
import org.brimlang.Ids.FunctionId;
import org.brimlang.Ids.StreamId;

/**
 * An IdGenerator allocates new identifiers. There is no global generator; whoever needs fresh ids
 * (usually the editor, when constructing nodes) is given one explicitly. The compiler needs none:
 * the ids of the applications it synthesizes are derived from the ids of existing streams.
 */
public interface IdGenerator {

  /** Returns the next uid text, without any prefix. */
  String nextUid();

  default StreamId newStreamId() {
    return StreamId.of(Ids.STREAM_ID_PREFIX + nextUid());
  }

  default FunctionId newFunctionId() {
    return FunctionId.of(Ids.FUNCTION_ID_PREFIX + nextUid());
  }

  default ApplicationId newApplicationId() {
    return ApplicationId.of(Ids.APPLICATION_ID_PREFIX + nextUid());
  }

  /**
   * Returns a generator of random uids, suitable for ids that must be unique across edits and
   * sessions (e.g. ids attached to newly constructed tree nodes).
   */
  static IdGenerator random() {
    return () -> {
      ThreadLocalRandom random = ThreadLocalRandom.current();
      // Two longs give 128 random bits; collisions are not a practical concern.
      return Long.toUnsignedString(random.nextLong(), 36)
          + Long.toUnsignedString(random.nextLong(), 36);
    };
  }

  /**
   * Returns a new generator whose uids are {@code tag} followed by 1, 2, 3, ... Two generators
   * created with the same tag produce the same sequence, so a computation that draws its ids from
   * a fresh sequential generator is deterministic.
   */
  static IdGenerator sequential(String tag) {
    Preconditions.checkArgument(!tag.isEmpty(), "Empty tag");
    return new IdGenerator() {
      private int next = 1;

      @Override
      public String nextUid() {
        return tag + next++;
      }
    };
  }
}
