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

/**
 * The operations that may appear in the body of a {@link BasicBlock}. None of these transfer
 * control; that is left to the block's {@link TerminatorOp terminator}.
 *
 * <p>Code that must treat every operation explicitly should {@code switch} over this enum without
 * a {@code default}, so that adding a constant here forces each such site to be revisited.
 */
public enum BasicOp {
  MOVE,
  SPILL,
  RELOAD,
  CONST_INT,
  CONST_FLOAT32,
  CONST_FLOAT,
  CONST_SYMBOL,
  CONST_VEC128,
  CONST_VEC256,
  CONST_VEC512,
  /** Adjusts the stack pointer by {@link Instruction#immediate()} bytes. */
  STACK_OFFSET,
  LOAD,
  STORE,
  INTOP,
  INTOP_IMM,
  INTOP_ATOMIC,
  FLOATOP,
  CSEL,
  REINTERPRET_CAST,
  STATIC_CAST,
  PROBE_IS_ENABLED,
  OPAQUE,
  BEGIN_REGION,
  END_REGION,
  SPECIFIC,
  NAME_FOR_DEBUGGER,
  DLS_GET,
  POLL,
  PAUSE,
  ALLOC,
  PUSHTRAP,
  POPTRAP,
  RELOAD_RETADDR,
  STACK_CHECK,
  /** Sets up the function's stack frame; only inserted by the prologue pass. */
  PROLOGUE,
  /** Tears down the function's stack frame; only inserted by the prologue pass. */
  EPILOGUE;

  /** True for the frame setup and teardown markers. */
  public boolean isFrameMarker() {
    return this == PROLOGUE || this == EPILOGUE;
  }

  /** The name used for this operation in printed listings. */
  public String mnemonic() {
    return Ascii.toLowerCase(name());
  }
}
