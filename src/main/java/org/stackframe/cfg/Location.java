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

/**
 * Where the register allocator placed a {@link Register}: a hardware register, one of the stack
 * areas, or nowhere yet.
 */
public record Location(Kind kind, int index) {

  /**
   * The possible kinds of location. Of the stack kinds only {@link #STACK_LOCAL} lives in the
   * function's own frame; incoming and outgoing arguments live in the caller's and callee's areas,
   * and domain state slots are addressed through a dedicated register.
   */
  public enum Kind {
    REGISTER,
    STACK_LOCAL,
    STACK_INCOMING,
    STACK_OUTGOING,
    STACK_DOMAIN_STATE,
    UNKNOWN
  }

  public static final Location UNKNOWN = new Location(Kind.UNKNOWN, 0);

  public Location {
    Preconditions.checkArgument(index >= 0);
  }

  public static Location register(int index) {
    return new Location(Kind.REGISTER, index);
  }

  public static Location local(int slot) {
    return new Location(Kind.STACK_LOCAL, slot);
  }

  public static Location incoming(int offset) {
    return new Location(Kind.STACK_INCOMING, offset);
  }

  public static Location outgoing(int offset) {
    return new Location(Kind.STACK_OUTGOING, offset);
  }

  public static Location domainState(int offset) {
    return new Location(Kind.STACK_DOMAIN_STATE, offset);
  }

  /** True if this location is a slot in the current function's stack frame. */
  public boolean isLocalStackSlot() {
    return switch (kind) {
      case STACK_LOCAL -> true;
      case REGISTER, STACK_INCOMING, STACK_OUTGOING, STACK_DOMAIN_STATE, UNKNOWN -> false;
    };
  }

  @Override
  public String toString() {
    return switch (kind) {
      case REGISTER -> "%r" + index;
      case STACK_LOCAL -> "s[local " + index + "]";
      case STACK_INCOMING -> "s[in " + index + "]";
      case STACK_OUTGOING -> "s[out " + index + "]";
      case STACK_DOMAIN_STATE -> "s[ds " + index + "]";
      case UNKNOWN -> "?";
    };
  }
}
