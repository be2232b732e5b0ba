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

/**
 * The abstract values of a dataflow analysis, as a join semi-lattice of finite height. Values must
 * be immutable.
 *
 * <p>{@link #join} must be commutative, associative and idempotent, {@link #bot} must be its
 * identity, and {@code lessEqual(a, b)} must hold exactly when {@code join(a, b)} equals {@code
 * b}.
 */
public interface Domain<D> {
  /** The least value; the value at program points that have not (yet) been reached. */
  D bot();

  /** The least upper bound of two values. */
  D join(D left, D right);

  boolean lessEqual(D left, D right);
}
