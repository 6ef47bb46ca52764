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

import leasepool.Arithmetic;
import leasepool.ManagedResourcePool;
import leasepool.ResourcePool;

import java.util.ArrayDeque;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * The {@link ResourcePool} implementation.
 * <p>
 * All state is guarded by the monitor of the pool instance. The monitor is
 * held for the duration of each operation, except while an acquiring thread
 * is parked waiting for its {@link Waiter} to be granted.
 * <p>
 * Waiters are granted in queue order. A release makes a single attempt at
 * granting a waiter, and the granted thread then continues the cascade on
 * behalf of the rest of the queue once it wakes up, if there is any value
 * left.
 *
 * @param <N> The type of amounts in the pool.
 */
public class QuantityPool<N> implements ResourcePool<N>, ManagedResourcePool {
  private static final Logger LOGGER = Logger.getLogger(QuantityPool.class.getName());

  final Arithmetic<N> arithmetic;
  private final ArrayDeque<Waiter<N>> waiters;

  N value;

  private long acquireCount;
  private long blockedAcquireCount;
  private long cancelledAcquireCount;
  private long releaseCount;

  /**
   * Construct a new pool instance based on the given {@link ResourcePoolBuilderImpl}.
   * @param builder The pool configuration to use.
   */
  public QuantityPool(ResourcePoolBuilderImpl<N> builder) {
    synchronized (builder) {
      arithmetic = builder.getArithmetic();
      value = builder.getValue();
    }
    waiters = new ArrayDeque<>();
  }

  @Override
  public boolean acquire(N amount) throws InterruptedException {
    checkAmount(amount);
    Waiter<N> waiter;
    synchronized (this) {
      if (arithmetic.compare(value, amount) >= 0) {
        value = arithmetic.subtract(value, amount);
        acquireCount++;
        return true;
      }
      waiter = new Waiter<>(amount, Thread.currentThread());
      waiters.addLast(waiter);
      blockedAcquireCount++;
    }

    boolean granted = waiter.await();

    synchronized (this) {
      waiters.remove(waiter);
      if (granted) {
        acquireCount++;
        wakeUpAll();
        return true;
      }
      if (waiter.isGranted()) {
        // The grant raced with the interrupt. Give the amount back, and let
        // the cascade below pass it on to someone else.
        value = arithmetic.add(value, amount);
        LOGGER.log(Level.FINE, "Rolled back grant of {0} to interrupted waiter", amount);
      } else {
        waiter.cancel();
      }
      cancelledAcquireCount++;
      wakeUpAll();
    }
    throw new InterruptedException();
  }

  @Override
  public synchronized void release(N amount) {
    checkAmount(amount);
    credit(amount);
  }

  /**
   * Add the amount to the value, and make one attempt at waking up a waiter.
   * Must be called while holding the monitor.
   */
  final void credit(N amount) {
    value = arithmetic.add(value, amount);
    releaseCount++;
    wakeUpNext();
  }

  /**
   * Grant the first pending waiter whose amount is covered by the value.
   * Must be called while holding the monitor.
   * @return {@code true} if a waiter was granted, otherwise {@code false}.
   */
  final boolean wakeUpNext() {
    for (Waiter<N> waiter : waiters) {
      if (waiter.isPending() && arithmetic.compare(waiter.amount, value) <= 0) {
        value = arithmetic.subtract(value, waiter.amount);
        waiter.grant();
        LOGGER.log(Level.FINER, "Granted {0}", waiter);
        return true;
      }
    }
    return false;
  }

  /**
   * Grant waiters, in queue order, for as long as the value can cover them.
   * Must be called while holding the monitor.
   */
  final void wakeUpAll() {
    while (arithmetic.isPositive(value) && wakeUpNext()) {
      // Keep going until the value runs out, or nobody fits.
    }
  }

  @Override
  public synchronized boolean isLocked() {
    return arithmetic.isZero(value) || hasWaiterCoveredBy(value);
  }

  @Override
  public boolean isLockedFor(N amount) {
    requireNonNull(amount, "Amount cannot be null.");
    synchronized (this) {
      return arithmetic.compare(value, amount) < 0 || hasWaiterCoveredBy(value);
    }
  }

  private boolean hasWaiterCoveredBy(N available) {
    for (Waiter<N> waiter : waiters) {
      if (!waiter.isCancelled() && arithmetic.compare(available, waiter.amount) >= 0) {
        return true;
      }
    }
    return false;
  }

  final void checkAmount(N amount) {
    requireNonNull(amount, "Amount cannot be null.");
    if (!arithmetic.isValid(amount) || !arithmetic.isPositive(amount)) {
      throw new IllegalArgumentException(
          "Amount must be positive, but was " + arithmetic.toString(amount) + ".");
    }
  }

  @Override
  public synchronized N getValue() {
    return value;
  }

  @Override
  public synchronized int getWaiterCount() {
    return waiters.size();
  }

  @Override
  public Arithmetic<N> getArithmetic() {
    return arithmetic;
  }

  @Override
  public ManagedResourcePool getManagedPool() {
    return this;
  }

  @Override
  public String getAvailableValue() {
    return arithmetic.toString(getValue());
  }

  @Override
  public double getApproximateAvailableValue() {
    return arithmetic.toDouble(getValue());
  }

  @Override
  public String getBound() {
    return null;
  }

  @Override
  public String getPendingBoundDecrement() {
    return null;
  }

  @Override
  public synchronized long getAcquireCount() {
    return acquireCount;
  }

  @Override
  public synchronized long getBlockedAcquireCount() {
    return blockedAcquireCount;
  }

  @Override
  public synchronized long getCancelledAcquireCount() {
    return cancelledAcquireCount;
  }

  @Override
  public synchronized long getReleaseCount() {
    return releaseCount;
  }

  @Override
  public long getOverReleaseCount() {
    return 0;
  }

  @Override
  public synchronized String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append('[');
    if (isLocked()) {
      sb.append("locked");
    } else {
      sb.append("unlocked, value:").append(arithmetic.toString(value));
    }
    if (!waiters.isEmpty()) {
      sb.append(", waiters:").append(waiters.size());
    }
    return sb.append(']').toString();
  }
}
