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

import com.google.common.base.Ascii;

/** The operations that can end a {@link BasicBlock}. */
public enum TerminatorOp {
  /** Control never reaches the end of the block. */
  NEVER,
  ALWAYS,
  PARITY_TEST,
  TRUTH_TEST,
  FLOAT_TEST,
  INT_TEST,
  SWITCH,
  RETURN,
  RAISE,
  /** A tail call back to the start of the current function. */
  TAILCALL_SELF,
  /** A tail call through a register. */
  TAILCALL_INDIRECT,
  /** A tail call to the function named by {@link Instruction#symbol()}. */
  TAILCALL_DIRECT,
  CALL_NO_RETURN,
  CALL,
  /** A call to an external function or runtime primitive that returns to its successor. */
  PRIM;

  /** True if this terminator calls another function and expects control to come back. */
  public boolean isNonTailCall() {
    return switch (this) {
      case CALL, CALL_NO_RETURN, PRIM -> true;
      case NEVER,
          ALWAYS,
          PARITY_TEST,
          TRUTH_TEST,
          FLOAT_TEST,
          INT_TEST,
          SWITCH,
          RETURN,
          RAISE,
          TAILCALL_SELF,
          TAILCALL_INDIRECT,
          TAILCALL_DIRECT ->
          false;
    };
  }

  /** The name used for this operation in printed listings. */
  public String mnemonic() {
    return Ascii.toLowerCase(name());
  }
}
