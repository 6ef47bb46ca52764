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

import java.io.Serial;

/**
 * Thrown when the accounting of a {@link BoundedResourcePool} arrives at an
 * amount that is impossible under exact arithmetic, such as a negative
 * pending decrement of the bound.
 * <p>
 * This means the {@link Arithmetic} of the pool is not precise enough for the
 * amounts involved. Typically, it is {@link Arithmetic#doubles()} accumulating
 * rounding errors. The pool cannot recover from this on its own; use
 * {@link Arithmetic#decimals()} or another exact arithmetic instead.
 */
public class ImpreciseArithmeticException extends PoolException {
  @Serial
  private static final long serialVersionUID = -6207117465912379540L;

  /**
   * Construct a new ImpreciseArithmeticException with the given message.
   * @param message A description of the inconsistency.
   */
  public ImpreciseArithmeticException(String message) {
    super(message);
  }
}
