/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package statepump;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Utilities for running concurrency tests.
 */
public class ConcurrencyTestUtil {

  public static void runNTimesAndWaitForAllToComplete(int nTimes, ExecutorService executor,
                                                      IndexedExceptionThrowingRunnable runnable) throws Exception {
    final List<ListenableFuture<Boolean>> completionFutureList = new ArrayList<>(nTimes);

    for (int i = 0; i < nTimes; i++) {
      completionFutureList.add(runAndReturnCompletionFuture(executor, runnable, i));
    }

    Futures.allAsList(completionFutureList).get(30, TimeUnit.SECONDS);
  }

  /**
   * Poll the condition until it holds, failing with an AssertionError after the timeout.
   */
  public static void waitUntil(BooleanSupplier condition, long timeout, TimeUnit unit, String description)
      throws InterruptedException {
    final long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Timed out waiting until " + description);
      }
      Thread.sleep(5);
    }
  }

  private static ListenableFuture<Boolean> runAndReturnCompletionFuture(ExecutorService executor,
                                                                        IndexedExceptionThrowingRunnable runnable,
                                                                        int invocationIndex) {
    final SettableFuture<Boolean> setWhenFinished = SettableFuture.create();

    executor.execute(() -> {
      try {
        runnable.run(invocationIndex);
        setWhenFinished.set(true);
      } catch (Throwable t) {
        setWhenFinished.setException(t);
      }
    });
    return setWhenFinished;
  }

  public interface IndexedExceptionThrowingRunnable {
    void run(int indexIdentifyingThisInvocation) throws Exception;
  }
}
