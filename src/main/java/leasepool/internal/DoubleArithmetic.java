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
 * The {@link Arithmetic} of {@link Double} amounts.
 * <p>
 * Only finite values are valid. Note that this arithmetic is subject to
 * rounding errors, so a sequence of additions and subtractions that should
 * cancel out might not leave the pool at exactly its starting value.
 */
public final class DoubleArithmetic implements Arithmetic<Double> {
  /**
   * The shared instance.
   */
  public static final DoubleArithmetic INSTANCE = new DoubleArithmetic();
  private static final Double ZERO = 0.0;

  private DoubleArithmetic() {
  }

  @Override
  public Double zero() {
    return ZERO;
  }

  @Override
  public Double add(Double a, Double b) {
    return a + b;
  }

  @Override
  public Double subtract(Double a, Double b) {
    return a - b;
  }

  @Override
  public int compare(Double a, Double b) {
    // Not Double.compare, which would order -0.0 below 0.0.
    double x = a;
    double y = b;
    return x < y ? -1 : x > y ? 1 : 0;
  }

  @Override
  public boolean isValid(Double amount) {
    return amount != null && Double.isFinite(amount);
  }

  @Override
  public double toDouble(Double amount) {
    return amount;
  }

  @Override
  public String toString() {
    return "DoubleArithmetic";
  }
}
