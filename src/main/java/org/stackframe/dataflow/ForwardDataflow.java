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

package org.stackframe.dataflow;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.stackframe.cfg.BasicBlock;
import org.stackframe.cfg.BasicOp;
import org.stackframe.cfg.Cfg;
import org.stackframe.cfg.Instruction;

/**
 * Computes the least fixpoint of a forward dataflow analysis over the blocks of a {@link Cfg}.
 *
 * <p>Each block has an entry value, initially {@link Domain#bot}. Running a block applies the
 * {@link ForwardTransfer#basic basic} transfer to each body instruction in turn and the {@link
 * ForwardTransfer#terminator terminator} transfer to the result; the terminator's normal image is
 * joined into the entry value of each normal successor and its exceptional image into the entry
 * value of the exceptional successor. A block is (re)queued whenever its entry value grows. The
 * result does not depend on the order in which queued blocks are run.
 */
public final class ForwardDataflow<D, C> {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** The bound used when none is given; in effect, no bound. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  private final Domain<D> domain;
  private final ForwardTransfer<D, C> transfer;
  private final int maxIterations;

  public ForwardDataflow(Domain<D> domain, ForwardTransfer<D, C> transfer) {
    this(domain, transfer, UNBOUNDED);
  }

  public ForwardDataflow(Domain<D> domain, ForwardTransfer<D, C> transfer, int maxIterations) {
    Preconditions.checkArgument(maxIterations > 0);
    this.domain = domain;
    this.transfer = transfer;
    this.maxIterations = maxIterations;
  }

  /**
   * Runs the analysis to a fixpoint.
   *
   * @param init the value on entry to the function's entry block
   * @param handlersAreEntryPoints if true, every trap handler block is also seeded with {@code
   *     init}; otherwise handlers are only reached through exceptional edges
   * @param context passed to each call of the transfer functions
   */
  public Result<D> run(Cfg cfg, D init, boolean handlersAreEntryPoints, C context) {
    Map<Integer, D> entryValues = new LinkedHashMap<>();
    ArrayDeque<Integer> queue = new ArrayDeque<>();
    Set<Integer> queued = new HashSet<>();
    propagate(cfg.entryLabel(), init, entryValues, queue, queued);
    if (handlersAreEntryPoints) {
      for (BasicBlock block : cfg.blocks()) {
        if (block.isTrapHandler()) {
          propagate(block.label(), init, entryValues, queue, queued);
        }
      }
    }
    int iterations = 0;
    while (!queue.isEmpty()) {
      if (iterations == maxIterations) {
        logger.atFine().log(
            "%s: no fixpoint after %s block visits", cfg.functionName(), maxIterations);
        return new Result<>(null);
      }
      ++iterations;
      int label = queue.poll();
      queued.remove(label);
      BasicBlock block = cfg.block(label);
      D value = entryValues.get(label);
      for (Instruction<BasicOp> instr : block.body()) {
        value = transfer.basic(value, instr, context);
      }
      ForwardTransfer.Image<D> image = transfer.terminator(value, block.terminator(), context);
      propagateAll(block.successors(), image.normal(), entryValues, queue, queued);
      propagateAll(block.exceptionalSuccessors(), image.exceptional(), entryValues, queue, queued);
    }
    logger.atFine().log("%s: fixpoint after %s block visits", cfg.functionName(), iterations);
    return new Result<>(ImmutableMap.copyOf(entryValues));
  }

  private void propagateAll(
      ImmutableList<Integer> targets,
      D value,
      Map<Integer, D> entryValues,
      ArrayDeque<Integer> queue,
      Set<Integer> queued) {
    for (int target : targets) {
      propagate(target, value, entryValues, queue, queued);
    }
  }

  /**
   * Joins {@code value} into the entry value of {@code target}; queues {@code target} if this is
   * the first value it has received or if its entry value changed.
   */
  private void propagate(
      int target,
      D value,
      Map<Integer, D> entryValues,
      ArrayDeque<Integer> queue,
      Set<Integer> queued) {
    D prev = entryValues.get(target);
    D next;
    if (prev == null) {
      next = domain.join(domain.bot(), value);
    } else {
      next = domain.join(prev, value);
      if (domain.lessEqual(next, prev)) {
        return;
      }
    }
    entryValues.put(target, next);
    if (queued.add(target)) {
      queue.add(target);
    }
  }

  /**
   * The outcome of {@link #run}: either the entry value of each block that was reached, or failure
   * if no fixpoint was found within the iteration bound.
   */
  public static final class Result<D> {
    private final @Nullable ImmutableMap<Integer, D> entryValues;

    private Result(@Nullable ImmutableMap<Integer, D> entryValues) {
      this.entryValues = entryValues;
    }

    public boolean isOk() {
      return entryValues != null;
    }

    /**
     * Returns the value on entry to each reached block, keyed by label; blocks that were never
     * reached are absent. Should only be called if {@link #isOk} is true.
     */
    public ImmutableMap<Integer, D> entryValues() {
      Preconditions.checkState(entryValues != null, "Dataflow analysis failed");
      return entryValues;
    }
  }
}
