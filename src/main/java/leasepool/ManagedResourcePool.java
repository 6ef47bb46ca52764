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

import javax.management.MXBean;

/**
 * This is the JMX management interface for resource pools.
 * <p>
 * Using this interface, pools can be exposed to external management as an
 * MXBean. Since its an MXBean, and not just an MBean, it imposes no
 * special requirements on 3rd party JMX integrators.
 * <p>
 * Amounts are reported both as strings, in the exact form given by the
 * {@link Arithmetic} of the pool, and as approximate {@code double} values
 * for use in graphs and alerts.
 */
@MXBean
public interface ManagedResourcePool {
  /**
   * Get the currently available value of the pool.
   * @return The exact available value.
   * @see ResourcePool#getValue()
   */
  String getAvailableValue();

  /**
   * @return The available value, as an approximate number.
   */
  double getApproximateAvailableValue();

  /**
   * Get the bound of the pool, if it is a {@link BoundedResourcePool}.
   * @return The exact bound, or {@code null} if the pool is not bounded.
   * @see BoundedResourcePool#getBoundValue()
   */
  String getBound();

  /**
   * Get the decrement of the bound that is still waiting to be absorbed.
   * @return The exact pending decrement, zero if there is none, or
   * {@code null} if the pool is not bounded.
   * @see BoundedResourcePool#getPendingDecrement()
   */
  String getPendingBoundDecrement();

  /**
   * @return The number of threads blocked in acquire calls.
   */
  int getWaiterCount();

  /**
   * @return {@code true} if the pool is {@linkplain ResourcePool#isLocked() locked}.
   */
  boolean isLocked();

  /**
   * Return the number of acquire calls that have completed successfully,
   * since the pool was created.
   * @return The number of successful acquisitions.
   */
  long getAcquireCount();

  /**
   * Return the number of acquire calls that had to block, whether they were
   * eventually successful or not.
   * @return The number of acquisitions that had to wait.
   */
  long getBlockedAcquireCount();

  /**
   * Return the number of blocked acquire calls that were interrupted.
   * @return The number of cancelled acquisitions.
   */
  long getCancelledAcquireCount();

  /**
   * Return the number of successful release calls.
   * @return The number of releases.
   */
  long getReleaseCount();

  /**
   * Return the number of releases rejected with an
   * {@link OverReleaseException}. Always zero for unbounded pools.
   * @return The number of failed releases.
   */
  long getOverReleaseCount();
}
