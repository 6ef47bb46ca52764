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

import leasepool.BoundUpdate;
import leasepool.BoundedResourcePool;
import leasepool.ImpreciseArithmeticException;
import leasepool.OverReleaseException;

import java.util.logging.Level;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * The {@link BoundedResourcePool} implementation.
 * <p>
 * On top of the {@link QuantityPool} accounting, this keeps track of the
 * bound, and of whether a decrement of the bound is still pending. A pending
 * decrement is absorbed by releases before anything else, which is what lets
 * the holders of outstanding amounts release them cleanly into a pool that
 * has shrunk below what they hold.
 *
 * @param <N> The type of amounts in the pool.
 */
public final class BoundedQuantityPool<N> extends QuantityPool<N> implements BoundedResourcePool<N> {
  private static final Logger LOGGER = Logger.getLogger(BoundedQuantityPool.class.getName());

  private N bound;
  private ShrinkState<N> shrink;
  private long overReleaseCount;

  /**
   * Construct a new bounded pool instance based on the given {@link ResourcePoolBuilderImpl}.
   * @param builder The pool configuration to use.
   */
  public BoundedQuantityPool(ResourcePoolBuilderImpl<N> builder) {
    super(builder);
    N configured = builder.getBound();
    if (arithmetic.compare(configured, value) < 0) {
      throw new IllegalArgumentException("The bound (" + arithmetic.toString(configured) +
          ") cannot be less than the initial value (" + arithmetic.toString(value) + ").");
    }
    bound = configured;
    shrink = ShrinkState.stable();
  }

  @Override
  public synchronized void release(N amount) {
    checkAmount(amount);
    N newValue = value;
    ShrinkState<N> newShrink = shrink;
    if (shrink instanceof ShrinkState.PendingShrink<N> pending) {
      N absorbed = arithmetic.min(amount, pending.amount());
      N remaining = arithmetic.subtract(pending.amount(), absorbed);
      newValue = arithmetic.subtract(newValue, absorbed);
      newShrink = arithmetic.isPositive(remaining) ?
          new ShrinkState.PendingShrink<>(remaining) : ShrinkState.stable();
    }
    if (arithmetic.compare(newValue, bound) >= 0) {
      overReleaseCount++;
      throw new OverReleaseException("Released too much: " + arithmetic.toString(amount) +
          " does not fit under the bound of " + arithmetic.toString(bound) +
          " with " + arithmetic.toString(newValue) + " available.");
    }
    value = newValue;
    if (newShrink != shrink) {
      shrink = newShrink;
      LOGGER.log(Level.FINE, "Release of {0} absorbed into bound decrement, now {1}",
          new Object[] {amount, shrink});
    }
    credit(amount);
  }

  @Override
  public BoundUpdate<N> updateBoundValue(N newBound) {
    requireNonNull(newBound, "Bound cannot be null.");
    if (!arithmetic.isValid(newBound) || arithmetic.isNegative(newBound)) {
      throw new IllegalArgumentException(
          "Bound must be at least 0, but was " + arithmetic.toString(newBound) + ".");
    }
    synchronized (this) {
      int cmp = arithmetic.compare(newBound, bound);
      if (cmp == 0) {
        shrink = ShrinkState.stable();
        return applied();
      }
      if (cmp > 0) {
        return raise(newBound);
      }
      return lower(newBound);
    }
  }

  private BoundUpdate<N> raise(N newBound) {
    N diff = arithmetic.subtract(newBound, bound);
    bound = newBound;
    value = arithmetic.add(value, diff);
    shrink = ShrinkState.stable();
    wakeUpAll();
    return applied();
  }

  private BoundUpdate<N> lower(N newBound) {
    N leased = arithmetic.subtract(bound, value);
    N wanted = arithmetic.subtract(bound, newBound);
    N reclaimable = arithmetic.max(arithmetic.zero(), arithmetic.subtract(bound, leased));
    N taken = arithmetic.zero();
    if (arithmetic.isPositive(reclaimable)) {
      taken = arithmetic.min(wanted, reclaimable);
      wanted = arithmetic.subtract(wanted, taken);
    }
    if (arithmetic.isNegative(wanted)) {
      throw new ImpreciseArithmeticException("Bound decrement to " + arithmetic.toString(newBound) +
          " left a negative deficit of " + arithmetic.toString(wanted) +
          "; use an exact arithmetic, such as Arithmetic.decimals(), instead of " + arithmetic + ".");
    }
    value = arithmetic.subtract(value, taken);
    bound = newBound;
    if (arithmetic.isZero(wanted)) {
      shrink = ShrinkState.stable();
      return applied();
    }
    shrink = new ShrinkState.PendingShrink<>(wanted);
    LOGGER.log(Level.FINE, "Bound lowered to {0}, deferring decrement of {1} to future releases",
        new Object[] {arithmetic.toString(newBound), arithmetic.toString(wanted)});
    return new BoundUpdate<>(false, wanted);
  }

  private BoundUpdate<N> applied() {
    return new BoundUpdate<>(true, arithmetic.zero());
  }

  @Override
  public synchronized N getBoundValue() {
    return bound;
  }

  @Override
  public synchronized N getPendingDecrement() {
    if (shrink instanceof ShrinkState.PendingShrink<N> pending) {
      return pending.amount();
    }
    return arithmetic.zero();
  }

  @Override
  public String getBound() {
    return arithmetic.toString(getBoundValue());
  }

  @Override
  public String getPendingBoundDecrement() {
    return arithmetic.toString(getPendingDecrement());
  }

  @Override
  public synchronized long getOverReleaseCount() {
    return overReleaseCount;
  }
}
