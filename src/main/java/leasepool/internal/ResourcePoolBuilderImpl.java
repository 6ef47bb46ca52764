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
import leasepool.BoundedResourcePool;
import leasepool.ResourcePool;
import leasepool.ResourcePoolBuilder;

import static java.util.Objects.requireNonNull;

/**
 * The {@link ResourcePoolBuilder} implementation.
 * @param <N> The type of amounts in the pools.
 */
public final class ResourcePoolBuilderImpl<N> implements ResourcePoolBuilder<N> {
  private final Arithmetic<N> arithmetic;
  private N value;
  private N bound;

  /**
   * Build a new {@code ResourcePoolBuilder} with an initial value of zero.
   * @param arithmetic The arithmetic of the pool amounts.
   */
  public ResourcePoolBuilderImpl(Arithmetic<N> arithmetic) {
    requireNonNull(arithmetic, "The Arithmetic cannot be null.");
    this.arithmetic = arithmetic;
    this.value = requireNonNull(arithmetic.zero(), "The Arithmetic must have a zero.");
  }

  @Override
  public synchronized ResourcePoolBuilder<N> setValue(N value) {
    checkNotNegative(value, "Initial value");
    this.value = value;
    return this;
  }

  @Override
  public synchronized N getValue() {
    return value;
  }

  @Override
  public synchronized ResourcePoolBuilder<N> setBound(N bound) {
    if (bound != null) {
      checkNotNegative(bound, "Bound");
    }
    this.bound = bound;
    return this;
  }

  @Override
  public synchronized N getBound() {
    return bound == null ? value : bound;
  }

  @Override
  public Arithmetic<N> getArithmetic() {
    return arithmetic;
  }

  private void checkNotNegative(N amount, String description) {
    requireNonNull(amount, description + " cannot be null.");
    if (!arithmetic.isValid(amount) || arithmetic.isNegative(amount)) {
      throw new IllegalArgumentException(
          description + " must be at least 0, but was " + arithmetic.toString(amount) + ".");
    }
  }

  @SuppressWarnings("unchecked")
  @Override
  public synchronized ResourcePoolBuilderImpl<N> clone() {
    try {
      return (ResourcePoolBuilderImpl<N>) super.clone();
    } catch (CloneNotSupportedException e) {
      throw new AssertionError(e);
    }
  }

  @Override
  public synchronized ResourcePool<N> build() {
    if (bound != null) {
      throw new IllegalStateException(
          "A bound of " + arithmetic.toString(bound) + " was configured, " +
          "but only bounded pools can have a bound. Use buildBounded() instead.");
    }
    return new QuantityPool<>(this);
  }

  @Override
  public synchronized BoundedResourcePool<N> buildBounded() {
    return new BoundedQuantityPool<>(this);
  }
}
