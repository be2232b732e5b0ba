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

import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import org.stackframe.cfg.BasicOp;
import org.stackframe.cfg.Cfg;
import org.stackframe.cfg.Instruction;
import org.stackframe.cfg.TerminatorOp;
import org.stackframe.dataflow.Domain;
import org.stackframe.dataflow.ForwardDataflow;
import org.stackframe.dataflow.ForwardTransfer;

/**
 * Checks, by a forward dataflow analysis, that prologues and epilogues have been placed correctly:
 * on every execution path, each instruction that needs a stack frame runs while one is set up, each
 * return or tail call to another function runs after it has been torn down, and frames are never
 * set up twice or torn down when absent.
 *
 * <p>The analysis tracks, at each point, the {@link FrameStateSet set of frame states} reachable
 * there. The function starts with {@link FrameStateSet#NO_PROLOGUE}; exception handlers are
 * reached only through the exceptional edges that lead to them, and receive the same value as the
 * raising block's normal successors.
 */
public final class PrologueValidator {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The length of the longest strictly increasing chain of {@link FrameStateSet}s. */
  private static final int LATTICE_HEIGHT = 2;

  private PrologueValidator() {}

  /** The per-run context for {@link #TRANSFER}. */
  record Context(String functionName) {}

  static final Domain<FrameStateSet> DOMAIN =
      new Domain<>() {
        @Override
        public FrameStateSet bot() {
          return FrameStateSet.EMPTY;
        }

        @Override
        public FrameStateSet join(FrameStateSet left, FrameStateSet right) {
          return left.union(right);
        }

        @Override
        public boolean lessEqual(FrameStateSet left, FrameStateSet right) {
          return left.isSubsetOf(right);
        }
      };

  static final ForwardTransfer<FrameStateSet, Context> TRANSFER =
      new ForwardTransfer<>() {
        @Override
        public FrameStateSet basic(
            FrameStateSet value, Instruction<BasicOp> instr, Context context) {
          Requirement requirement = InstructionRequirements.basic(instr);
          return value.map(state -> basicTransition(state, requirement, instr));
        }

        @Override
        public Image<FrameStateSet> terminator(
            FrameStateSet value, Instruction<TerminatorOp> instr, Context context) {
          Requirement requirement =
              InstructionRequirements.terminator(instr, context.functionName());
          return Image.uniform(value.map(state -> terminatorTransition(state, requirement, instr)));
        }
      };

  /** Returns the frame state after a body instruction that executes in {@code state}. */
  static FrameState basicTransition(
      FrameState state, Requirement requirement, Instruction<BasicOp> instr) {
    switch (state) {
      case NO_PROLOGUE_ON_STACK:
        switch (requirement) {
          case PROLOGUE:
            return FrameState.PROLOGUE_ON_STACK;
          case EPILOGUE:
            throw PrologueError.atInstruction(
                PrologueError.Violation.EPILOGUE_WITHOUT_PROLOGUE, instr);
          case REQUIRES_PROLOGUE:
            throw PrologueError.atInstruction(PrologueError.Violation.NEEDS_PROLOGUE, instr);
          case NO_REQUIREMENTS:
          case REQUIRES_NO_PROLOGUE:
            return FrameState.NO_PROLOGUE_ON_STACK;
        }
        break;
      case PROLOGUE_ON_STACK:
        switch (requirement) {
          case PROLOGUE:
            throw PrologueError.atInstruction(PrologueError.Violation.DUPLICATE_PROLOGUE, instr);
          case EPILOGUE:
            return FrameState.NO_PROLOGUE_ON_STACK;
          case NO_REQUIREMENTS:
          case REQUIRES_PROLOGUE:
            return FrameState.PROLOGUE_ON_STACK;
          case REQUIRES_NO_PROLOGUE:
            throw PrologueError.atInstruction(
                PrologueError.Violation.BASIC_REQUIRES_NO_PROLOGUE, instr);
        }
        break;
    }
    throw new AssertionError();
  }

  /** Returns the frame state after a terminator that executes in {@code state}. */
  static FrameState terminatorTransition(
      FrameState state, Requirement requirement, Instruction<TerminatorOp> instr) {
    // The terminator classifier never returns the marker requirements.
    assert !(requirement == Requirement.PROLOGUE || requirement == Requirement.EPILOGUE);
    switch (state) {
      case NO_PROLOGUE_ON_STACK:
        if (requirement == Requirement.REQUIRES_PROLOGUE) {
          throw PrologueError.atInstruction(PrologueError.Violation.NEEDS_PROLOGUE, instr);
        }
        return FrameState.NO_PROLOGUE_ON_STACK;
      case PROLOGUE_ON_STACK:
        if (requirement == Requirement.REQUIRES_NO_PROLOGUE) {
          throw PrologueError.atInstruction(PrologueError.Violation.PROLOGUE_NOT_REMOVED, instr);
        }
        return FrameState.PROLOGUE_ON_STACK;
    }
    throw new AssertionError();
  }

  /**
   * Runs the analysis on {@code cfg}. Returns the set of frame states on entry to each reachable
   * block if every instruction's requirement is met; throws a {@link PrologueError} identifying the
   * first offending instruction found otherwise, or if the analysis fails to converge.
   */
  public static ImmutableMap<Integer, FrameStateSet> run(Cfg cfg) {
    return run(cfg, visitBound(cfg));
  }

  /**
   * A block is visited once for each distinct entry value it takes, and entry values only grow,
   * so no block is visited more than {@code LATTICE_HEIGHT + 1} times.
   */
  static int visitBound(Cfg cfg) {
    return Math.multiplyExact(cfg.numBlocks(), LATTICE_HEIGHT + 1);
  }

  static ImmutableMap<Integer, FrameStateSet> run(Cfg cfg, int maxIterations) {
    ForwardDataflow.Result<FrameStateSet> result =
        new ForwardDataflow<>(DOMAIN, TRANSFER, maxIterations)
            .run(
                cfg,
                FrameStateSet.NO_PROLOGUE,
                /* handlersAreEntryPoints= */ false,
                new Context(cfg.functionName()));
    if (!result.isOk()) {
      throw PrologueError.forFunction(
          PrologueError.Violation.DATAFLOW_FAILED, cfg.functionName());
    }
    logger.atFine().log("%s: block entry states %s", cfg.functionName(), result.entryValues());
    return result.entryValues();
  }
}
