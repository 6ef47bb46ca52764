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

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;

/**
 * A Lease represents an amount that has been acquired from a
 * {@link ResourcePool}, and which must be released back to it exactly once.
 * <p>
 * Leases are obtained from {@link ResourcePool#use(Object)}, and implement
 * {@link AutoCloseable}, so the try-with-resources syntax guarantees that the
 * amount is released no matter how the block is left:
 *
 * <pre>{@code
 * try (Lease<BigDecimal> lease = pool.use(new BigDecimal("1.5"))) {
 *   // ...
 * }
 * }</pre>
 *
 * A lease can only be released once. Releasing it again is a usage error,
 * and throws an {@link IllegalStateException}, rather than releasing the
 * amount a second time.
 *
 * @param <N> The type of amounts in the pool.
 */
public final class Lease<N> implements AutoCloseable {
  private static final VarHandle RELEASED;

  static {
    try {
      RELEASED = MethodHandles.lookup().findVarHandle(Lease.class, "released", boolean.class);
    } catch (Exception e) {
      throw new ExceptionInInitializerError(e);
    }
  }

  private final ResourcePool<N> pool;
  private final N amount;
  @SuppressWarnings("unused") // Assigned via VarHandle.
  private volatile boolean released;

  /**
   * Create a lease for an amount that has already been acquired from the
   * given pool.
   * @param pool The pool the amount was acquired from.
   * @param amount The acquired amount.
   */
  public Lease(ResourcePool<N> pool, N amount) {
    this.pool = Objects.requireNonNull(pool, "Pool cannot be null.");
    this.amount = Objects.requireNonNull(amount, "Amount cannot be null.");
  }

  /**
   * Get the amount held by this lease.
   * @return The leased amount.
   */
  public N getAmount() {
    return amount;
  }

  /**
   * Get the pool this lease was acquired from.
   * @return The pool.
   */
  public ResourcePool<N> getPool() {
    return pool;
  }

  /**
   * Check if this lease has been released.
   * @return {@code true} if the lease has been released, otherwise
   * {@code false}.
   */
  public boolean isReleased() {
    return released;
  }

  /**
   * Release the leased amount back to the pool.
   * <p>
   * If the pool rejects the release, for instance with an
   * {@link OverReleaseException}, the lease is not considered released.
   * @throws IllegalStateException if the lease has already been released.
   */
  public void release() {
    if (!RELEASED.compareAndSet(this, false, true)) {
      throw new IllegalStateException("Lease of " + amount + " has already been released.");
    }
    try {
      pool.release(amount);
    } catch (RuntimeException e) {
      released = false;
      throw e;
    }
  }

  /**
   * Synonym for {@link #release()}, for use with try-with-resources.
   * @throws IllegalStateException if the lease has already been released.
   */
  @Override
  public void close() {
    release();
  }

  @Override
  public String toString() {
    return "Lease[" + amount + (released ? ", released]" : "]");
  }
}
