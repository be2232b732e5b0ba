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

import org.stackframe.cfg.BasicOp;
import org.stackframe.cfg.Instruction;
import org.stackframe.cfg.Register;
import org.stackframe.cfg.TerminatorOp;

/** Static-only class that classifies instructions by their {@link Requirement}. */
public class InstructionRequirements {

  private InstructionRequirements() {}

  /**
   * True if the instruction reads or writes a local stack slot, or executes with the stack pointer
   * displaced from its position on entry.
   */
  public static boolean instrUsesStack(Instruction<?> instr) {
    return anyOnLocalStack(instr.args())
        || anyOnLocalStack(instr.results())
        || instr.stackOffset() != 0;
  }

  private static boolean anyOnLocalStack(Iterable<Register> registers) {
    for (Register r : registers) {
      if (r.isOnLocalStack()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Classifies a body instruction. The result is always one of {@link Requirement#PROLOGUE},
   * {@link Requirement#EPILOGUE}, {@link Requirement#NO_REQUIREMENTS}, or {@link
   * Requirement#REQUIRES_PROLOGUE}.
   */
  public static Requirement basic(Instruction<BasicOp> instr) {
    if (instrUsesStack(instr)) {
      return Requirement.REQUIRES_PROLOGUE;
    }
    return switch (instr.desc()) {
      case PROLOGUE -> Requirement.PROLOGUE;
      case EPILOGUE -> Requirement.EPILOGUE;
      case STACK_OFFSET -> Requirement.REQUIRES_PROLOGUE;
      case MOVE,
          SPILL,
          RELOAD,
          CONST_INT,
          CONST_FLOAT32,
          CONST_FLOAT,
          CONST_SYMBOL,
          CONST_VEC128,
          CONST_VEC256,
          CONST_VEC512,
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
          STACK_CHECK ->
          Requirement.NO_REQUIREMENTS;
    };
  }

  /**
   * Classifies a terminator of a block in the function named {@code functionName}. The result is
   * always one of {@link Requirement#NO_REQUIREMENTS}, {@link Requirement#REQUIRES_PROLOGUE}, or
   * {@link Requirement#REQUIRES_NO_PROLOGUE}.
   *
   * <p>Returns and tail calls to other functions run after the frame has been torn down. A direct
   * tail call to the current function reuses the existing frame, so it has no requirement.
   */
  public static Requirement terminator(Instruction<TerminatorOp> instr, String functionName) {
    if (instrUsesStack(instr)) {
      return Requirement.REQUIRES_PROLOGUE;
    }
    TerminatorOp op = instr.desc();
    if (op == TerminatorOp.RETURN || op == TerminatorOp.TAILCALL_INDIRECT) {
      return Requirement.REQUIRES_NO_PROLOGUE;
    } else if (op == TerminatorOp.TAILCALL_DIRECT && !functionName.equals(instr.symbol())) {
      return Requirement.REQUIRES_NO_PROLOGUE;
    } else if (op.isNonTailCall()) {
      return Requirement.REQUIRES_PROLOGUE;
    }
    return Requirement.NO_REQUIREMENTS;
  }
}
