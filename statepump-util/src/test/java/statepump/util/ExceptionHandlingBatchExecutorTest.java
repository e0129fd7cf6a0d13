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

package statepump.util;

import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.fibers.Fiber;
import org.junit.After;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class ExceptionHandlingBatchExecutorTest {
  private final MemoryChannel<Long> channel = new MemoryChannel<>();
  private final SettableFuture<Throwable> caught = SettableFuture.create();
  private final SettableFuture<Long> laterMessage = SettableFuture.create();

  private final Fiber fiber = new ThreadFiberSupplier("batch-executor-test").getFiber(caught::set);

  @After
  public void disposeFiber() {
    fiber.dispose();
  }

  @Test
  public void passesExceptionsThrownByFiberTasksToTheHandler() throws Exception {
    channel.subscribe(fiber, (val) -> {
      throw new IndexOutOfBoundsException();
    });
    fiber.start();

    channel.publish(4L);

    assertThat(caught.get(10, TimeUnit.SECONDS), is(instanceOf(IndexOutOfBoundsException.class)));
  }

  @Test
  public void keepsTheFiberRunningAfterATaskThrows() throws Exception {
    channel.subscribe(fiber, (val) -> {
      if (val == 1L) {
        throw new IllegalStateException();
      }
      laterMessage.set(val);
    });
    fiber.start();

    channel.publish(1L);
    channel.publish(2L);

    assertThat(laterMessage.get(10, TimeUnit.SECONDS), is(2L));
    assertThat(caught.get(10, TimeUnit.SECONDS), is(instanceOf(IllegalStateException.class)));
  }
}
