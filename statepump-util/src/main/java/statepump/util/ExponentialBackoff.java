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

import com.google.common.math.LongMath;

/**
 * Bounded exponential backoff: the first delay is the base delay, each subsequent delay doubles,
 * and no delay exceeds the maximum. Retries are unlimited; {@link #reset()} after a success.
 * <p>
 * Not thread safe; intended to be owned by a single fiber.
 */
public class ExponentialBackoff {
  private final long baseDelayMillis;
  private final long maxDelayMillis;
  private int attempts = 0;

  public ExponentialBackoff(long baseDelayMillis, long maxDelayMillis) {
    if (baseDelayMillis <= 0 || maxDelayMillis < baseDelayMillis) {
      throw new IllegalArgumentException("Backoff requires 0 < base <= max; got base=" + baseDelayMillis
          + ", max=" + maxDelayMillis);
    }
    this.baseDelayMillis = baseDelayMillis;
    this.maxDelayMillis = maxDelayMillis;
  }

  /**
   * Return the delay to wait before the next attempt, and count the attempt.
   */
  public long nextDelayMillis() {
    final int exponent = Math.min(attempts, 62);
    attempts++;
    return Math.min(maxDelayMillis, LongMath.saturatedMultiply(baseDelayMillis, 1L << exponent));
  }

  public int getAttempts() {
    return attempts;
  }

  public void reset() {
    attempts = 0;
  }
}
