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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A BasicBlock is a straight-line sequence of instructions (its {@link #body}) followed by exactly
 * one {@link #terminator}, which decides where control goes next.
 *
 * <p>Control leaves a block either normally, to one of its {@link #successors}, or by raising an
 * exception, to its {@link #exceptionalSuccessor} (if any). A block that is the target of some
 * exceptional edge is marked as a {@link #isTrapHandler trap handler}.
 *
 * <p>The body is mutable so that passes can insert instructions in place; the terminator and the
 * edges are fixed once the block is built.
 */
public final class BasicBlock {
  private final int label;
  private final List<Instruction<BasicOp>> body;
  private final Instruction<TerminatorOp> terminator;
  private final ImmutableList<Integer> successors;
  private final @Nullable Integer exceptionalSuccessor;
  private final boolean isTrapHandler;

  BasicBlock(
      int label,
      List<Instruction<BasicOp>> body,
      Instruction<TerminatorOp> terminator,
      ImmutableList<Integer> successors,
      @Nullable Integer exceptionalSuccessor,
      boolean isTrapHandler) {
    this.label = label;
    this.body = new ArrayList<>(body);
    this.terminator = terminator;
    this.successors = successors;
    this.exceptionalSuccessor = exceptionalSuccessor;
    this.isTrapHandler = isTrapHandler;
  }

  public int label() {
    return label;
  }

  /** The block's non-terminating instructions, in execution order. Callers may modify this list. */
  public List<Instruction<BasicOp>> body() {
    return body;
  }

  public Instruction<TerminatorOp> terminator() {
    return terminator;
  }

  /** The labels of the blocks that may follow this one when no exception is raised. */
  public ImmutableList<Integer> successors() {
    return successors;
  }

  /** The label of the handler that receives exceptions raised in this block, or null. */
  public @Nullable Integer exceptionalSuccessor() {
    return exceptionalSuccessor;
  }

  /** {@link #exceptionalSuccessor} as a list of zero or one labels. */
  public ImmutableList<Integer> exceptionalSuccessors() {
    return exceptionalSuccessor == null
        ? ImmutableList.of()
        : ImmutableList.of(exceptionalSuccessor);
  }

  public boolean isTrapHandler() {
    return isTrapHandler;
  }

  @Override
  public String toString() {
    return "block " + label;
  }
}
