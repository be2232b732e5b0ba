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

/** A pseudo-register read or written by an {@link Instruction}, with its allocated location. */
public record Register(String name, Location loc) {

  /** Returns a Register that has not been assigned a location. */
  public static Register unallocated(String name) {
    return new Register(name, Location.UNKNOWN);
  }

  public boolean isOnLocalStack() {
    return loc.isLocalStackSlot();
  }

  @Override
  public String toString() {
    return name + ":" + loc;
  }
}
