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

/**
 * The {@link Arithmetic} of {@link Long} amounts.
 */
public final class LongArithmetic implements Arithmetic<Long> {
  /**
   * The shared instance.
   */
  public static final LongArithmetic INSTANCE = new LongArithmetic();
  private static final Long ZERO = 0L;

  private LongArithmetic() {
  }

  @Override
  public Long zero() {
    return ZERO;
  }

  @Override
  public Long add(Long a, Long b) {
    return Math.addExact(a, b);
  }

  @Override
  public Long subtract(Long a, Long b) {
    return Math.subtractExact(a, b);
  }

  @Override
  public int compare(Long a, Long b) {
    return Long.compare(a, b);
  }

  @Override
  public double toDouble(Long amount) {
    return amount.doubleValue();
  }

  @Override
  public String toString() {
    return "LongArithmetic";
  }
}
