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

package org.stackframe.prologue;

import com.google.common.base.Joiner;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * An immutable set of {@link FrameState}s, represented as a bitset. This is the abstract value
 * computed by {@link PrologueValidator}: the set of frame states that some execution path can be
 * in at a given point.
 *
 * <p>A set with both states means the frame state depends on how the point was reached. That is
 * only legal where nothing that follows cares, e.g. in an exception handler that does not touch
 * the stack but is reached by raises from both before and after the prologue.
 *
 * <p>There are only four possible values and each has a single canonical instance, so sets can be
 * compared with {@code ==}.
 */
public final class FrameStateSet {

  private static final FrameStateSet[] ALL = {
    new FrameStateSet(0), new FrameStateSet(1), new FrameStateSet(2), new FrameStateSet(3)
  };

  public static final FrameStateSet EMPTY = ALL[0];

  /** {NO_PROLOGUE_ON_STACK}; the state on entry to the function. */
  public static final FrameStateSet NO_PROLOGUE = of(FrameState.NO_PROLOGUE_ON_STACK);

  /** {PROLOGUE_ON_STACK} */
  public static final FrameStateSet PROLOGUE = of(FrameState.PROLOGUE_ON_STACK);

  /** Both states. */
  public static final FrameStateSet EITHER = ALL[3];

  private final int bits;

  private FrameStateSet(int bits) {
    this.bits = bits;
  }

  public static FrameStateSet of(FrameState... states) {
    int bits = 0;
    for (FrameState s : states) {
      bits |= s.bit();
    }
    return ALL[bits];
  }

  public boolean contains(FrameState state) {
    return (bits & state.bit()) != 0;
  }

  public boolean isEmpty() {
    return bits == 0;
  }

  public int size() {
    return Integer.bitCount(bits);
  }

  public FrameStateSet union(FrameStateSet other) {
    return ALL[bits | other.bits];
  }

  public boolean isSubsetOf(FrameStateSet other) {
    return (bits & ~other.bits) == 0;
  }

  /**
   * Returns the set of results of applying {@code fn} to each element of this set, in declaration
   * order. Any exception thrown by {@code fn} is propagated.
   */
  public FrameStateSet map(UnaryOperator<FrameState> fn) {
    int result = 0;
    for (FrameState s : FrameState.values()) {
      if (contains(s)) {
        result |= fn.apply(s).bit();
      }
    }
    return ALL[result];
  }

  @Override
  public String toString() {
    List<FrameState> elements = new ArrayList<>();
    for (FrameState s : FrameState.values()) {
      if (contains(s)) {
        elements.add(s);
      }
    }
    return "{" + Joiner.on(", ").join(elements) + "}";
  }
}
