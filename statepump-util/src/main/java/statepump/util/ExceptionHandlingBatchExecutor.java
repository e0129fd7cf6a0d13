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

import org.jetlang.core.BatchExecutor;
import org.jetlang.core.EventReader;

import java.util.function.Consumer;

/**
 * BatchExecutor that hands any Throwable escaping a task to a handler, then carries on with the rest
 * of the batch. Jetlang's default executor lets such a Throwable kill the fiber's thread.
 */
public class ExceptionHandlingBatchExecutor implements BatchExecutor {
  private final Consumer<Throwable> handler;

  /**
   * @param handler Receives Throwables thrown by tasks; it runs on the failing fiber, so it may take
   *                remedial action against that fiber's state directly.
   */
  public ExceptionHandlingBatchExecutor(Consumer<Throwable> handler) {
    this.handler = handler;
  }

  @Override
  public void execute(EventReader toExecute) {
    for (int i = 0; i < toExecute.size(); i++) {
      try {
        toExecute.get(i).run();
      } catch (Throwable throwable) {
        handler.accept(throwable);
      }
    }
  }
}
