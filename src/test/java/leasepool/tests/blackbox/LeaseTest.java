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
package leasepool.tests.blackbox;

import leasepool.BoundedResourcePool;
import leasepool.Lease;
import leasepool.OverReleaseException;
import leasepool.ResourcePool;
import leasepool.tests.extensions.FailurePrinterExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static testkits.UnitKit.$use;
import static testkits.UnitKit.forkBlocked;
import static testkits.UnitKit.joinFailure;

@ExtendWith(FailurePrinterExtension.class)
class LeaseTest {
  @Test
  void leaseMustReleaseWhenClosed() throws Exception {
    ResourcePool<BigDecimal> pool = ResourcePool.of(new BigDecimal("3.5"));
    try (Lease<BigDecimal> lease = pool.use(BigDecimal.ONE)) {
      assertThat(pool.getValue()).isEqualByComparingTo("2.5");
      assertThat(lease.getAmount()).isEqualByComparingTo("1");
      assertThat(lease.getPool()).isSameAs(pool);
    }
    assertThat(pool.getValue()).isEqualByComparingTo("3.5");
  }

  @Test
  void nestedLeasesMustReleaseInReverseOrder() throws Exception {
    ResourcePool<BigDecimal> pool = ResourcePool.of(new BigDecimal("3.5"));
    try (Lease<BigDecimal> outer = pool.use(BigDecimal.ONE)) {
      assertThat(pool.getValue()).isEqualByComparingTo("2.5");
      try (Lease<BigDecimal> inner = pool.use(new BigDecimal("1.2"))) {
        assertThat(pool.getValue()).isEqualByComparingTo("1.3");
      }
      assertThat(pool.getValue()).isEqualByComparingTo("2.5");
    }
    assertThat(pool.getValue()).isEqualByComparingTo("3.5");
  }

  @Test
  void leaseMustReleaseWhenBlockThrows() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(3);
    assertThatThrownBy(() -> {
      try (Lease<Long> lease = pool.use(2L)) {
        assertEquals(1L, pool.getValue());
        throw new IllegalStateException("boom");
      }
    }).hasMessage("boom");
    assertEquals(3L, pool.getValue());
  }

  @Test
  void secondReleaseMustThrow() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(2);
    Lease<Long> lease = pool.use(2L);
    assertFalse(lease.isReleased());
    lease.close();
    assertTrue(lease.isReleased());
    assertEquals(2L, pool.getValue());

    assertThatThrownBy(lease::close)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("already been released");
    assertThatThrownBy(lease::release).isInstanceOf(IllegalStateException.class);
    assertEquals(2L, pool.getValue());
  }

  @Test
  void secondReleaseOfBoundedLeaseMustNotReachPool() throws Exception {
    BoundedResourcePool<Long> pool = BoundedResourcePool.of(2);
    Lease<Long> lease = pool.use(1L);
    lease.release();
    assertThatThrownBy(lease::release).isInstanceOf(IllegalStateException.class);
    assertEquals(0L, pool.getManagedPool().getOverReleaseCount());
  }

  @Test
  void rejectedReleaseMustLeaveLeaseUnreleased() throws Exception {
    BoundedResourcePool<Long> pool = BoundedResourcePool.of(2);
    Lease<Long> lease = pool.use(1L);
    pool.release(1L);
    assertThatThrownBy(lease::close).isInstanceOf(OverReleaseException.class);
    assertFalse(lease.isReleased());
    assertThat(lease.toString()).isEqualTo("Lease[1]");

    pool.acquire(1L);
    lease.close();
    assertTrue(lease.isReleased());
    assertEquals(2L, pool.getValue());
  }

  @Test
  void interruptedUseMustNotLeaseAnything() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(1);
    Thread thread = forkBlocked($use(pool, 2L));
    thread.interrupt();
    assertThat(joinFailure(thread)).isInstanceOf(InterruptedException.class);
    assertEquals(1L, pool.getValue());
  }

  @Test
  void toStringMustShowAmountAndState() throws Exception {
    ResourcePool<Long> pool = ResourcePool.of(2);
    Lease<Long> lease = pool.use(2L);
    assertThat(lease.toString()).isEqualTo("Lease[2]");
    lease.close();
    assertThat(lease.toString()).isEqualTo("Lease[2, released]");
  }
}
