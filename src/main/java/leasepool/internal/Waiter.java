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

import java.util.concurrent.locks.LockSupport;

/**
 * The queue entry of a thread that is blocked in an acquire call, and the
 * handle through which that thread is woken up.
 * <p>
 * A waiter starts out pending, and moves to either granted or cancelled
 * exactly once. The transitions are made by the pool, while holding its
 * monitor. The thread that owns the waiter parks in {@link #await()} without
 * holding the monitor.
 *
 * @param <N> The type of amounts in the pool.
 */
final class Waiter<N> {
  private static final int PENDING = 0;
  private static final int GRANTED = 1;
  private static final int CANCELLED = 2;

  final N amount;
  private final Thread thread;
  private volatile int state;

  Waiter(N amount, Thread thread) {
    this.amount = amount;
    this.thread = thread;
  }

  boolean isPending() {
    return state == PENDING;
  }

  boolean isGranted() {
    return state == GRANTED;
  }

  boolean isCancelled() {
    return state == CANCELLED;
  }

  /**
   * Mark the waiter as granted, and wake up its thread.
   * The amount must already have been taken out of the pool on its behalf.
   */
  void grant() {
    assert state == PENDING : "Waiter " + this + " is not pending.";
    state = GRANTED;
    LockSupport.unpark(thread);
  }

  void cancel() {
    assert state == PENDING : "Waiter " + this + " is not pending.";
    state = CANCELLED;
  }

  /**
   * Block the owning thread until the waiter is granted, or the thread is
   * interrupted. An interrupt takes precedence over a grant, so the caller
   * must check {@link #isGranted()} again, under the pool monitor, before it
   * gives up.
   * @return {@code true} if the waiter was granted, or {@code false} if the
   * thread was interrupted, in which case the interrupt status is cleared.
   */
  boolean await() {
    for (;;) {
      if (Thread.interrupted()) {
        return false;
      }
      if (state == GRANTED) {
        return true;
      }
      LockSupport.park(this);
    }
  }

  @Override
  public String toString() {
    String s = switch (state) {
      case PENDING -> "pending";
      case GRANTED -> "granted";
      default -> "cancelled";
    };
    return "Waiter(" + amount + ", " + s + ", " + thread.getName() + ")";
  }
}
