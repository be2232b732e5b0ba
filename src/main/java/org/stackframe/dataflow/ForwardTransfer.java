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

import org.stackframe.cfg.BasicOp;
import org.stackframe.cfg.Instruction;
import org.stackframe.cfg.TerminatorOp;

/**
 * The transfer functions of a forward analysis: given the abstract value before an instruction,
 * return the value after it. Both methods must be monotone in their first argument.
 *
 * <p>Implementations may throw an unchecked exception to reject an instruction outright; {@link
 * ForwardDataflow} does not catch it.
 *
 * @param <D> the abstract value type
 * @param <C> a per-run context, passed unchanged to each call
 */
public interface ForwardTransfer<D, C> {

  D basic(D value, Instruction<BasicOp> instr, C context);

  /**
   * Returns the values that flow along the block's normal outlinks and along its exceptional
   * outlink.
   */
  Image<D> terminator(D value, Instruction<TerminatorOp> instr, C context);

  /** The result of a terminator's transfer function. */
  record Image<D>(D normal, D exceptional) {
    /** Returns an Image that sends the same value along both kinds of outlink. */
    public static <D> Image<D> uniform(D value) {
      return new Image<>(value, value);
    }
  }
}
