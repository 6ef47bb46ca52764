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
 * The {@link Arithmetic} of {@link Integer} amounts.
 */
public final class IntegerArithmetic implements Arithmetic<Integer> {
  /**
   * The shared instance.
   */
  public static final IntegerArithmetic INSTANCE = new IntegerArithmetic();
  private static final Integer ZERO = 0;

  private IntegerArithmetic() {
  }

  @Override
  public Integer zero() {
    return ZERO;
  }

  @Override
  public Integer add(Integer a, Integer b) {
    return Math.addExact(a, b);
  }

  @Override
  public Integer subtract(Integer a, Integer b) {
    return Math.subtractExact(a, b);
  }

  @Override
  public int compare(Integer a, Integer b) {
    return Integer.compare(a, b);
  }

  @Override
  public double toDouble(Integer amount) {
    return amount.doubleValue();
  }

  @Override
  public String toString() {
    return "IntegerArithmetic";
  }
}
