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

import leasepool.internal.DecimalArithmetic;
import leasepool.internal.DoubleArithmetic;
import leasepool.internal.IntegerArithmetic;
import leasepool.internal.LongArithmetic;

import java.math.BigDecimal;
import java.util.Comparator;

/**
 * The arithmetic of the amounts handed out by a {@link ResourcePool}.
 * <p>
 * Pools are generic in the type of their amounts, so they can count whole
 * permits, fractional units of bandwidth, or exact decimal quantities. The
 * pool itself never does arithmetic directly on the amounts, but always goes
 * through the {@code Arithmetic} it was built with. An implementation must
 * behave as an ordered field over the values the pool will see: addition and
 * subtraction must be exact inverses of each other, and
 * {@link #compare(Object, Object)} must be a total order consistent with
 * them.
 * <p>
 * The built-in {@link #doubles()} arithmetic does not fulfil this contract
 * exactly, because of floating point rounding. It is fine for pools whose
 * amounts are all small multiples of a power of two, but pools that are
 * {@linkplain BoundedResourcePool#updateBoundValue(Object) resized}, or that
 * deal in decimal fractions, should use {@link #decimals()} instead.
 * <p>
 * Implementations must be thread-safe, and should be stateless.
 *
 * @param <N> The type of amounts.
 */
public interface Arithmetic<N> extends Comparator<N> {
  /**
   * Get the arithmetic for {@link Integer} amounts.
   * Overflow is reported as an {@link ArithmeticException}.
   * @return The integer arithmetic.
   */
  static Arithmetic<Integer> integers() {
    return IntegerArithmetic.INSTANCE;
  }

  /**
   * Get the arithmetic for {@link Long} amounts.
   * Overflow is reported as an {@link ArithmeticException}.
   * @return The long arithmetic.
   */
  static Arithmetic<Long> longs() {
    return LongArithmetic.INSTANCE;
  }

  /**
   * Get the arithmetic for {@link Double} amounts.
   * NaN and infinite amounts are rejected by the pools.
   * @return The floating point arithmetic.
   */
  static Arithmetic<Double> doubles() {
    return DoubleArithmetic.INSTANCE;
  }

  /**
   * Get the arithmetic for {@link BigDecimal} amounts.
   * This is the exact arithmetic, and the recommended one for bounded pools.
   * @return The decimal arithmetic.
   */
  static Arithmetic<BigDecimal> decimals() {
    return DecimalArithmetic.INSTANCE;
  }

  /**
   * Get the additive identity.
   * @return The zero amount.
   */
  N zero();

  /**
   * Add two amounts.
   * @param a The first amount.
   * @param b The second amount.
   * @return The sum {@code a + b}.
   */
  N add(N a, N b);

  /**
   * Subtract one amount from another.
   * @param a The amount to subtract from.
   * @param b The amount to subtract.
   * @return The difference {@code a - b}, which may be negative.
   */
  N subtract(N a, N b);

  /**
   * Compare two amounts.
   * @param a The first amount.
   * @param b The second amount.
   * @return A negative number, zero, or a positive number, if {@code a} is
   * less than, equal to, or greater than {@code b}, respectively.
   */
  @Override
  int compare(N a, N b);

  /**
   * Check if the given amount is a value the pool can work with.
   * The default implementation accepts any non-null amount.
   * @param amount The amount to check.
   * @return {@code true} if the amount is usable, otherwise {@code false}.
   */
  default boolean isValid(N amount) {
    return amount != null;
  }

  default boolean isZero(N amount) {
    return compare(amount, zero()) == 0;
  }

  default boolean isPositive(N amount) {
    return compare(amount, zero()) > 0;
  }

  default boolean isNegative(N amount) {
    return compare(amount, zero()) < 0;
  }

  default N min(N a, N b) {
    return compare(a, b) <= 0 ? a : b;
  }

  default N max(N a, N b) {
    return compare(a, b) >= 0 ? a : b;
  }

  /**
   * Turn the given amount into a string, for use in diagnostics and in the
   * {@link ManagedResourcePool} management interface.
   * @param amount The amount to format.
   * @return The string representation of the amount.
   */
  default String toString(N amount) {
    return String.valueOf(amount);
  }

  /**
   * Approximate the given amount as a {@code double}, for use in metrics.
   * @param amount The amount to convert.
   * @return The amount as a floating point number, possibly with loss of
   * precision.
   */
  double toDouble(N amount);
}
