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

import leasepool.internal.ResourcePoolBuilderImpl;

import java.math.BigDecimal;

/**
 * A ResourcePool holds a quantity of some abstract resource, from which
 * threads can acquire arbitrary positive amounts, and later release them
 * again.
 * <p>
 * Think of it as a {@link java.util.concurrent.Semaphore} where the permits
 * need not be whole numbers: a pool of network bandwidth can hand out
 * 2.5 units to one caller and 0.75 units to another. The type of the amounts
 * is decided by the {@link Arithmetic} the pool is built with.
 * <p>
 * Pools are thread-safe, and all of their methods can be called concurrently
 * from multiple threads. When you acquire an amount, you also take upon
 * yourself the responsibility of eventually releasing that amount again. By
 * far the most common idiom to achieve this is with the
 * {@link #use(Object)} method, and a try-with-resources clause:
 *
 * <pre>{@code
 * try (Lease<Double> lease = pool.use(2.5)) {
 *   // Use the 2.5 units...
 * }
 * }</pre>
 *
 * An {@link #acquire(Object) acquire} call that cannot be satisfied from the
 * currently available value will block, and join a first-in-first-out queue
 * of waiters. Released amounts are granted to the waiters in queue order.
 * However, an acquire that <em>can</em> be satisfied immediately never
 * blocks, even if larger requests are already queued. Callers that want to
 * respect the queue can ask {@link #isLockedFor(Object)} first.
 * <p>
 * This pool does not limit how much can be released into it. See
 * {@link BoundedResourcePool} for a pool with an upper bound.
 * <p>
 * Blocked acquire calls can be cancelled by interrupting the blocked thread.
 * There is no support for timeouts beyond this.
 * @param <N> The type of amounts in the pool.
 * @see BoundedResourcePool
 */
public interface ResourcePool<N> {
  /**
   * Get a {@link ResourcePoolBuilder} for pools of the given
   * {@link Arithmetic}, which can then be used to
   * {@linkplain ResourcePoolBuilder#build() build} a pool with the desired
   * initial value.
   *
   * @param arithmetic The arithmetic of the pool amounts. Never {@code null}.
   * @param <N> The type of amounts in the pool.
   * @return A {@link ResourcePoolBuilder} with an initial value of zero.
   */
  static <N> ResourcePoolBuilder<N> from(Arithmetic<N> arithmetic) {
    return new ResourcePoolBuilderImpl<>(arithmetic);
  }

  /**
   * Create a pool with the given initial value.
   * @param value The initial value of the pool. Cannot be negative.
   * @param arithmetic The arithmetic of the pool amounts.
   * @param <N> The type of amounts in the pool.
   * @return The new pool.
   */
  static <N> ResourcePool<N> of(N value, Arithmetic<N> arithmetic) {
    return from(arithmetic).setValue(value).build();
  }

  /**
   * Create a pool of {@code long} amounts with the given initial value.
   * @param value The initial value of the pool. Cannot be negative.
   * @return The new pool.
   */
  static ResourcePool<Long> of(long value) {
    return of(value, Arithmetic.longs());
  }

  /**
   * Create a pool of {@code double} amounts with the given initial value.
   * @param value The initial value of the pool. Cannot be negative.
   * @return The new pool.
   */
  static ResourcePool<Double> of(double value) {
    return of(value, Arithmetic.doubles());
  }

  /**
   * Create a pool of exact decimal amounts with the given initial value.
   * @param value The initial value of the pool. Cannot be negative.
   * @return The new pool.
   */
  static ResourcePool<BigDecimal> of(BigDecimal value) {
    return of(value, Arithmetic.decimals());
  }

  /**
   * Acquire the given amount from the pool, blocking if necessary until it
   * becomes available.
   * <p>
   * If the currently available value covers the amount, then it is
   * subtracted and the method returns right away, even if other threads are
   * queued up waiting for larger amounts. Otherwise, the thread joins the
   * back of the queue of waiters, and blocks until the amount is granted to
   * it by a {@link #release(Object) release}.
   * <p>
   * If the thread is interrupted while blocked, it leaves the queue and
   * the method throws {@link InterruptedException}. Any amount that may
   * have been granted to the thread concurrently with the interruption is
   * returned to the pool, and passed on to other waiters. The interrupt is
   * never swallowed.
   *
   * @param amount The amount to acquire. Must be positive.
   * @return {@code true} once the amount has been acquired.
   * @throws InterruptedException if the thread was interrupted while waiting.
   * @throws IllegalArgumentException if the amount is not positive.
   */
  boolean acquire(N amount) throws InterruptedException;

  /**
   * Return the given amount to the pool, and hand it to the first waiter in
   * the queue whose request can now be satisfied, if any.
   * <p>
   * This method never blocks.
   *
   * @param amount The amount to release. Must be positive.
   * @throws IllegalArgumentException if the amount is not positive.
   */
  void release(N amount);

  /**
   * Acquire the given amount, and wrap it in a {@link Lease} that releases
   * it again when {@linkplain Lease#close() closed}.
   *
   * @param amount The amount to acquire. Must be positive.
   * @return A lease for the acquired amount.
   * @throws InterruptedException if the thread was interrupted while waiting.
   * @throws IllegalArgumentException if the amount is not positive.
   * @see #acquire(Object)
   */
  default Lease<N> use(N amount) throws InterruptedException {
    acquire(amount);
    return new Lease<>(this, amount);
  }

  /**
   * Check if the pool is exhausted, or has waiters that are about to be
   * granted their amounts.
   * <p>
   * This is advisory only. It does not change how
   * {@link #acquire(Object) acquire} behaves.
   *
   * @return {@code true} if the available value is zero, or a queued
   * waiter can be satisfied by it, otherwise {@code false}.
   */
  boolean isLocked();

  /**
   * Check if an acquire of the given amount would have to block, or would
   * get ahead of waiters that are about to be granted their amounts.
   * <p>
   * This is advisory only. It does not change how
   * {@link #acquire(Object) acquire} behaves.
   *
   * @param amount The amount a caller intends to acquire.
   * @return {@code true} if the available value is less than the amount, or
   * a queued waiter can be satisfied by it, otherwise {@code false}.
   */
  boolean isLockedFor(N amount);

  /**
   * Get the currently available value of the pool.
   * @return The available value.
   */
  N getValue();

  /**
   * Get the number of threads currently queued up in blocked acquire calls.
   * @return The number of waiters.
   */
  int getWaiterCount();

  /**
   * Get the arithmetic this pool was built with.
   * @return The arithmetic of the pool amounts.
   */
  Arithmetic<N> getArithmetic();

  /**
   * Get the {@link ManagedResourcePool} instance that represents this pool.
   * @return The {@link ManagedResourcePool} instance for this pool.
   */
  ManagedResourcePool getManagedPool();
}
