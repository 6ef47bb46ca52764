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
package leasepool;

import java.math.BigDecimal;

/**
 * A {@link ResourcePool} with an upper bound on its total capacity.
 * <p>
 * The bound is the most the pool may ever account for, counting both the
 * available value and everything currently acquired. Releasing more than
 * the bound allows causes an {@link OverReleaseException}. A bounded pool is
 * by default created with a bound equal to its initial value, so releasing
 * into a pool that nothing has been acquired from is an error.
 * <p>
 * The bound can be changed at any time with
 * {@link #updateBoundValue(Object)}, even while amounts are acquired. Raising
 * the bound makes the extra capacity available right away. Lowering it takes
 * what it can from the available value, and defers the rest: the remaining
 * decrement is taken out of future releases, until it has been absorbed.
 * <p>
 * Since the bookkeeping of bound changes relies on exact arithmetic, bounded
 * pools should use {@link Arithmetic#decimals()}, or another exact
 * arithmetic, if they are ever resized to fractional bounds.
 *
 * @param <N> The type of amounts in the pool.
 */
public interface BoundedResourcePool<N> extends ResourcePool<N> {
  /**
   * Create a bounded pool with the given initial value, which is also its
   * bound.
   * @param value The initial value and bound of the pool. Cannot be negative.
   * @param arithmetic The arithmetic of the pool amounts.
   * @param <N> The type of amounts in the pool.
   * @return The new pool.
   */
  static <N> BoundedResourcePool<N> of(N value, Arithmetic<N> arithmetic) {
    return ResourcePool.from(arithmetic).setValue(value).buildBounded();
  }

  /**
   * Create a bounded pool of {@code long} amounts.
   * @param value The initial value and bound of the pool. Cannot be negative.
   * @return The new pool.
   */
  static BoundedResourcePool<Long> of(long value) {
    return of(value, Arithmetic.longs());
  }

  /**
   * Create a bounded pool of {@code double} amounts.
   * @param value The initial value and bound of the pool. Cannot be negative.
   * @return The new pool.
   */
  static BoundedResourcePool<Double> of(double value) {
    return of(value, Arithmetic.doubles());
  }

  /**
   * Create a bounded pool of exact decimal amounts.
   * @param value The initial value and bound of the pool. Cannot be negative.
   * @return The new pool.
   */
  static BoundedResourcePool<BigDecimal> of(BigDecimal value) {
    return of(value, Arithmetic.decimals());
  }

  /**
   * Return the given amount to the pool.
   * <p>
   * If a decrement of the bound is pending, then as much of the amount as the
   * pending decrement calls for is absorbed by it, and does not become
   * available. The rest is added to the available value, and passed on to
   * the first waiter that it can satisfy, if any.
   *
   * @param amount The amount to release. Must be positive.
   * @throws OverReleaseException if the release would make the pool account
   * for more than its bound.
   * @throws IllegalArgumentException if the amount is not positive.
   */
  @Override
  void release(N amount);

  /**
   * Change the bound of the pool.
   * <p>
   * Raising the bound adds the difference to the available value, and grants
   * queued waiters what they can now be given. It also cancels any decrement
   * that was still pending.
   * <p>
   * Lowering the bound removes as much of the difference as it can from the
   * available value. If the available value does not cover it, because too
   * much is currently acquired, the rest is left pending, and the returned
   * {@link BoundUpdate} reports how much. The pending decrement is then
   * absorbed by future {@link #release(Object) releases}.
   * <p>
   * Setting the bound to its current value cancels any pending decrement.
   *
   * @param newBound The new bound. Cannot be negative.
   * @return The outcome of the update.
   * @throws IllegalArgumentException if the new bound is negative.
   * @throws ImpreciseArithmeticException if the arithmetic of the pool
   * turns out to be too imprecise to carry out the update.
   */
  BoundUpdate<N> updateBoundValue(N newBound);

  /**
   * Get the current bound of the pool.
   * @return The bound.
   */
  N getBoundValue();

  /**
   * Get how much of the last decrement of the bound is still waiting to be
   * absorbed by releases.
   * @return The pending decrement, or zero if there is none.
   */
  N getPendingDecrement();
}
