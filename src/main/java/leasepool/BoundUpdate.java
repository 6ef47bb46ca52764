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

/**
 * The outcome of {@link BoundedResourcePool#updateBoundValue(Object)}.
 *
 * @param fullyApplied {@code true} if the pool now reflects the new bound in
 *                     full, or {@code false} if part of a decrement of the
 *                     bound had to be deferred to future releases.
 * @param remainingDeferred The part of the decrement that is still pending.
 *                          Zero if the update was fully applied.
 * @param <N> The type of amounts in the pool.
 */
public record BoundUpdate<N>(boolean fullyApplied, N remainingDeferred) {
}
