/*
 * Copyright 2025 The Stackframe Authors
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

package org.stackframe.cfg;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Identifies a single {@link Instruction} within its {@link Cfg}. Ids are handed out by the
 * function's {@link Allocator} and are never reused.
 */
public record InstructionId(int value) implements Comparable<InstructionId> {

  /** Ids are printed padded to at least this many digits, so that listings line up. */
  private static final int PADDED_WIDTH = 4;

  public InstructionId {
    Preconditions.checkArgument(value >= 0, "Negative instruction id %s", value);
  }

  /** Returns the id as a zero-padded string, e.g. {@code "0042"}. */
  public String toStringPadded() {
    return Strings.padStart(Integer.toString(value), PADDED_WIDTH, '0');
  }

  @Override
  public int compareTo(InstructionId other) {
    return Integer.compare(value, other.value);
  }

  @Override
  public String toString() {
    return Integer.toString(value);
  }

  /**
   * A monotonically increasing source of fresh InstructionIds. Each {@link Cfg} owns exactly one;
   * passes that add instructions must allocate their ids from it.
   */
  public static final class Allocator {
    private int next;

    public Allocator() {
      this(0);
    }

    /** Creates an Allocator whose first id will be {@code first}. */
    public Allocator(int first) {
      Preconditions.checkArgument(first >= 0);
      this.next = first;
    }

    /** Returns a new id, distinct from all ids previously returned by this Allocator. */
    public InstructionId getAndIncrement() {
      return new InstructionId(next++);
    }

    /** The id that the next call to {@link #getAndIncrement} will return. */
    public int peek() {
      return next;
    }
  }
}
