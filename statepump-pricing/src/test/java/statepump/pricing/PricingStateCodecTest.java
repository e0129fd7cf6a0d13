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

package statepump.pricing;

import org.junit.Test;
import statepump.interfaces.replication.Event;
import statepump.interfaces.replication.StateCodec;
import statepump.interfaces.snapshot.CorruptSnapshotException;

import java.nio.ByteBuffer;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static statepump.pricing.PricingTestUtil.reduce;
import static statepump.pricing.PricingTestUtil.someEvents;

public class PricingStateCodecTest {
  private final StateCodec<PricingState> codec = new PricingStateCodec();

  @Test
  public void resumingFromASnapshotYieldsTheSameStateAsReplayingFromTheStart() throws Exception {
    List<Event<PricingPayload>> events = someEvents(300, 7);
    PricingState replayedFromStart = reduce(PricingState.EMPTY, events);

    for (int k : new int[]{0, 1, 150, 298, 299}) {
      PricingState atK = reduce(PricingState.EMPTY, events.subList(0, k + 1));
      PricingState loaded = codec.decode(codec.encode(atK));

      assertThat(loaded, is(equalTo(atK)));
      assertThat(reduce(loaded, events.subList(k + 1, events.size())), is(equalTo(replayedFromStart)));
    }
  }

  @Test
  public void encodesEqualStatesIdentically() {
    List<Event<PricingPayload>> events = someEvents(100, 3);

    assertThat(codec.encode(reduce(PricingState.EMPTY, events)),
        is(equalTo(codec.encode(reduce(PricingState.EMPTY, events)))));
  }

  @Test
  public void providesAnEmptyStateAtSequenceNumberMinusOne() {
    assertThat(codec.emptyState().getSeqNum(), is(equalTo(-1L)));
    assertThat(codec.emptyState().getMarkups().isEmpty(), is(true));
  }

  @Test(expected = CorruptSnapshotException.class)
  public void rejectsBytesThatAreNotAState() throws Exception {
    codec.decode(ByteBuffer.wrap(new byte[]{(byte) 0x0a, (byte) 0xff, (byte) 0xff}));
  }
}
