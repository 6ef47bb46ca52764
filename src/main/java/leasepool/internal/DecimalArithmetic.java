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

import java.math.BigDecimal;

/**
 * The exact {@link Arithmetic} of {@link BigDecimal} amounts.
 * <p>
 * Amounts are compared by value, so {@code 2.0} and {@code 2.00} are the same
 * amount, even though they are not {@link BigDecimal#equals(Object) equal}.
 */
public final class DecimalArithmetic implements Arithmetic<BigDecimal> {
  /**
   * The shared instance.
   */
  public static final DecimalArithmetic INSTANCE = new DecimalArithmetic();

  private DecimalArithmetic() {
  }

  @Override
  public BigDecimal zero() {
    return BigDecimal.ZERO;
  }

  @Override
  public BigDecimal add(BigDecimal a, BigDecimal b) {
    return a.add(b);
  }

  @Override
  public BigDecimal subtract(BigDecimal a, BigDecimal b) {
    return a.subtract(b);
  }

  @Override
  public int compare(BigDecimal a, BigDecimal b) {
    return a.compareTo(b);
  }

  @Override
  public boolean isZero(BigDecimal amount) {
    return amount.signum() == 0;
  }

  @Override
  public String toString(BigDecimal amount) {
    return amount.toPlainString();
  }

  @Override
  public double toDouble(BigDecimal amount) {
    return amount.doubleValue();
  }

  @Override
  public String toString() {
    return "DecimalArithmetic";
  }
}
