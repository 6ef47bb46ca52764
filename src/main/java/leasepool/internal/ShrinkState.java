/*
 * Copyright © 2011-2024 Chris Vest (mr.chrisvest@gmail.com)
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
package leasepool.internal;

/**
 * Whether a {@link BoundedQuantityPool} still owes part of a decrement of its
 * bound.
 *
 * @param <N> The type of amounts in the pool.
 */
sealed interface ShrinkState<N> {
  /**
   * Get the stable state.
   * @param <N> The type of amounts in the pool.
   * @return The state with no pending decrement.
   */
  @SuppressWarnings("unchecked")
  static <N> ShrinkState<N> stable() {
    return (ShrinkState<N>) Stable.INSTANCE;
  }

  /**
   * The bound is fully reflected in the accounting of the pool.
   */
  final class Stable<N> implements ShrinkState<N> {
    private static final Stable<?> INSTANCE = new Stable<>();

    private Stable() {
    }

    @Override
    public String toString() {
      return "Stable";
    }
  }

  /**
   * The bound was lowered by more than was available at the time, and the
   * given amount must still be absorbed by future releases.
   * @param amount The outstanding decrement. Always positive.
   * @param <N> The type of amounts in the pool.
   */
  record PendingShrink<N>(N amount) implements ShrinkState<N> {
  }
}
