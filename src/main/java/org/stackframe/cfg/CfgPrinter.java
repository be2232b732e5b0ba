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

import com.google.common.base.Joiner;

/** Static-only class that renders a {@link Cfg} as a human-readable listing, for logs and tests. */
public class CfgPrinter {

  private CfgPrinter() {}

  private static final String INDENT = "    ";

  /**
   * Returns a listing of the given Cfg: a header line, then each block (in the order they were
   * built) as a label line followed by one line per instruction. For example
   *
   * <pre>
   * caml_f (entry 1, calls: false, stack slots: 1)
   * 1:
   *     0002 prologue
   *     0000 move x:%r0 -&gt; y:s[local 0]
   *     0003 epilogue
   *     0001 return
   * </pre>
   */
  public static String print(Cfg cfg) {
    StringBuilder sb = new StringBuilder();
    sb.append(cfg.functionName())
        .append(" (entry ")
        .append(cfg.entryLabel())
        .append(", calls: ")
        .append(cfg.containsCalls())
        .append(", stack slots: ")
        .append(cfg.numStackSlots())
        .append(")\n");
    for (BasicBlock block : cfg.blocks()) {
      printBlock(block, sb);
    }
    return sb.toString();
  }

  /** Appends the listing of a single block to {@code sb}. */
  public static void printBlock(BasicBlock block, StringBuilder sb) {
    sb.append(block.label());
    if (block.isTrapHandler()) {
      sb.append(" (handler)");
    }
    sb.append(":\n");
    for (Instruction<BasicOp> instr : block.body()) {
      sb.append(INDENT).append(instr).append('\n');
    }
    sb.append(INDENT).append(block.terminator());
    if (!block.successors().isEmpty()) {
      sb.append("; goto ");
      Joiner.on(", ").appendTo(sb, block.successors());
    }
    if (block.exceptionalSuccessor() != null) {
      sb.append("; exn ").append(block.exceptionalSuccessor());
    }
    sb.append('\n');
  }
}
