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

/**
 * A builder for {@link ResourcePool} and {@link BoundedResourcePool}
 * instances.
 * <p>
 * Builders are obtained from {@link ResourcePool#from(Arithmetic)}. They are
 * thread-safe, and can be used to build any number of pools.
 *
 * @param <N> The type of amounts in the pools.
 */
public interface ResourcePoolBuilder<N> extends Cloneable {
  /**
   * Set the initial value of the pools. The default is zero.
   * @param value The initial value. Cannot be negative.
   * @return This {@code ResourcePoolBuilder} instance.
   * @throws IllegalArgumentException if the value is negative.
   */
  ResourcePoolBuilder<N> setValue(N value);

  /**
   * Get the configured initial value.
   * @return The initial value.
   */
  N getValue();

  /**
   * Set the bound of the pools. This only applies to pools built with
   * {@link #buildBounded()}. By default, the bound is the same as the initial
   * value. Setting the bound to {@code null} restores the default.
   * @param bound The bound. Cannot be negative.
   * @return This {@code ResourcePoolBuilder} instance.
   * @throws IllegalArgumentException if the bound is negative.
   */
  ResourcePoolBuilder<N> setBound(N bound);

  /**
   * Get the configured bound.
   * @return The configured bound, or the initial value if no bound has been
   * configured.
   */
  N getBound();

  /**
   * Get the arithmetic of the pool amounts.
   * @return The arithmetic.
   */
  Arithmetic<N> getArithmetic();

  /**
   * Returns a shallow copy of this {@code ResourcePoolBuilder} object.
   * @return A new {@code ResourcePoolBuilder} object of the exact same type
   * as this one, with identical values in all its fields.
   */
  ResourcePoolBuilder<N> clone();

  /**
   * Build a new unbounded {@link ResourcePool} with the initial value of this
   * builder.
   * @return A new pool.
   * @throws IllegalStateException if a bound has been configured.
   */
  ResourcePool<N> build();

  /**
   * Build a new {@link BoundedResourcePool} with the initial value and bound
   * of this builder.
   * @return A new bounded pool.
   * @throws IllegalArgumentException if the bound is less than the initial
   * value.
   */
  BoundedResourcePool<N> buildBounded();
}
