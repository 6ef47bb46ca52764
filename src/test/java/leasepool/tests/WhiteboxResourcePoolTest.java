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
package leasepool.tests;

import leasepool.ManagedResourcePool;
import leasepool.ResourcePool;
import leasepool.internal.QuantityPool;
import leasepool.tests.extensions.FailurePrinterExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static testkits.UnitKit.$acquire;
import static testkits.UnitKit.forkBlocked;
import static testkits.UnitKit.join;
import static testkits.UnitKit.joinFailure;
import static testkits.UnitKit.waitForThreadState;

/**
 * These tests hold the monitor of the pool, to force the interleavings where
 * an interrupt and a grant hit the same waiter.
 */
@ExtendWith(FailurePrinterExtension.class)
class WhiteboxResourcePoolTest {
  @Test
  void poolsMustBeMonitorGuarded() {
    assertThat(ResourcePool.of(1)).isInstanceOf(QuantityPool.class);
  }

  @Test
  void grantRacingWithInterruptMustBeRolledBack() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(0);
    Thread waiter = forkBlocked($acquire(pool, 2L));

    synchronized (pool) {
      waiter.interrupt();
      pool.release(2L);
      // The waiter has been granted, but cannot observe it before it has
      // noticed the interrupt.
      assertEquals(0L, pool.getValue());
      waitForThreadState(waiter, Thread.State.BLOCKED);
    }

    assertThat(joinFailure(waiter)).isInstanceOf(InterruptedException.class);
    assertEquals(2L, pool.getValue());
    assertEquals(0, pool.getWaiterCount());
    ManagedResourcePool managed = pool.getManagedPool();
    assertEquals(0L, managed.getAcquireCount());
    assertEquals(1L, managed.getCancelledAcquireCount());
  }

  @Test
  void rolledBackGrantMustBePassedOnToNextWaiter() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(0);
    Thread first = forkBlocked($acquire(pool, 2L));
    Thread second = forkBlocked($acquire(pool, 1L));

    synchronized (pool) {
      first.interrupt();
      pool.release(2L);
      assertThat(second.isAlive()).isTrue();
      waitForThreadState(first, Thread.State.BLOCKED);
    }

    assertThat(joinFailure(first)).isInstanceOf(InterruptedException.class);
    join(second);
    assertEquals(1L, pool.getValue());
    assertEquals(0, pool.getWaiterCount());
  }

  @Test
  void interruptedWaiterThatWasNotGrantedMustLeaveValueAlone() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(1);
    Thread first = forkBlocked($acquire(pool, 3L));
    Thread second = forkBlocked($acquire(pool, 2L));

    synchronized (pool) {
      first.interrupt();
      pool.release(1L);
      waitForThreadState(first, Thread.State.BLOCKED);
    }

    assertThat(joinFailure(first)).isInstanceOf(InterruptedException.class);
    join(second);
    assertEquals(0L, pool.getValue());
  }
}
