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
package examples;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import leasepool.BoundedResourcePool;
import leasepool.OverReleaseException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MicrometerBinderExampleTest {
  @Test
  void metersMustFollowThePool() throws Exception {
    BoundedResourcePool<Double> pool = BoundedResourcePool.of(3.5);
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    new MicrometerBinderExample("bandwidth", pool).bindTo(registry);

    assertThat(registry.get("bandwidth.available").gauge().value()).isEqualTo(3.5);
    pool.acquire(2.0);
    assertThat(registry.get("bandwidth.available").gauge().value()).isEqualTo(1.5);
    assertThat(registry.get("bandwidth.acquires").functionCounter().count()).isEqualTo(1.0);
    assertThat(registry.get("bandwidth.waiters").gauge().value()).isZero();

    pool.release(2.0);
    assertThatThrownBy(() -> pool.release(1.0)).isInstanceOf(OverReleaseException.class);
    assertThat(registry.get("bandwidth.overReleases").functionCounter().count()).isEqualTo(1.0);
    assertThat(registry.get("bandwidth.cancelledAcquires").functionCounter().count()).isZero();
  }
}
