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
 * Thrown by {@link BoundedResourcePool#release(Object)} when the released
 * amount does not fit under the bound of the pool, meaning that more has been
 * released than was ever acquired.
 * <p>
 * A release that fails with this exception does not change the pool.
 * <p>
 * Note that a pool cannot tell which caller released too much. If a release
 * without a matching acquire happens while a
 * {@linkplain BoundedResourcePool#updateBoundValue(Object) shrink} of the
 * bound is still pending, the pending shrink absorbs it, and it is then some
 * later, legitimate, release that fails with this exception.
 */
public class OverReleaseException extends PoolException {
  @Serial
  private static final long serialVersionUID = 3710246618234572901L;

  /**
   * Construct a new OverReleaseException with the given message.
   * @param message A description of the failed release.
   */
  public OverReleaseException(String message) {
    super(message);
  }
}
