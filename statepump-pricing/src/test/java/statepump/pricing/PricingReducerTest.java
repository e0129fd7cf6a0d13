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

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import statepump.interfaces.replication.Event;
import statepump.interfaces.replication.StateReducer;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.collection.IsMapContaining.hasKey;
import static statepump.pricing.PricingPayload.BrandUpdate;
import static statepump.pricing.PricingPayload.MarkupUpdate;
import static statepump.pricing.PricingPayload.SetDefaultMarkup;
import static statepump.pricing.PricingTestUtil.event;
import static statepump.pricing.PricingTestUtil.reduce;
import static statepump.pricing.PricingTestUtil.someEvents;

public class PricingReducerTest {
  private final StateReducer<PricingState, PricingPayload> reducer = new PricingReducer();

  private final PricingState stateWithTShirt = new PricingState(
      6,
      ImmutableMap.of("T-Shirt", 2.0, "Jeans", 1.5),
      ImmutableMap.of("B1", "Acme"),
      1.1);

  @Test
  public void removesTheCategoryWhenItsRateIsSetToANegativeValue() {
    PricingState next = reducer.apply(stateWithTShirt, event(7, new MarkupUpdate("T-Shirt", -1)));

    assertThat(next.getMarkups(), not(hasKey("T-Shirt")));
    assertThat(next.getMarkups(), hasEntry("Jeans", 1.5));
    assertThat(next.getSeqNum(), is(equalTo(7L)));
  }

  @Test
  public void removesTheCategoryWhenItsRateIsSetToZero() {
    PricingState next = reducer.apply(stateWithTShirt, event(7, new MarkupUpdate("Jeans", 0)));

    assertThat(next.getMarkups(), not(hasKey("Jeans")));
  }

  @Test
  public void setsOrOverwritesTheRateOfACategory() {
    PricingState next = reducer.apply(stateWithTShirt, event(7, new MarkupUpdate("T-Shirt", 3.0)));
    PricingState added = reducer.apply(next, event(8, new MarkupUpdate("Hoodie", 0.7)));

    assertThat(next.getMarkups(), hasEntry("T-Shirt", 3.0));
    assertThat(added.getMarkups(), hasEntry("Hoodie", 0.7));
    assertThat(added.effectiveMarkup("Hoodie"), is(equalTo(0.7)));
    assertThat(added.effectiveMarkup("Socks"), is(equalTo(1.1)));
  }

  @Test
  public void leavesTheInputStateUnchangedAndSharesTheMapsItDidNotUpdate() {
    PricingState next = reducer.apply(stateWithTShirt, event(7, new BrandUpdate("B2", "Zenith")));

    assertThat(stateWithTShirt.getBrandNames(), is(equalTo(ImmutableMap.of("B1", "Acme"))));
    assertThat(stateWithTShirt.getSeqNum(), is(equalTo(6L)));
    assertThat(next.getBrandNames(), hasEntry("B2", "Zenith"));
    assertThat(next.getMarkups(), is(sameInstance(stateWithTShirt.getMarkups())));
  }

  @Test
  public void removesABrandWhoseNameIsSetEmpty() {
    PricingState next = reducer.apply(stateWithTShirt, event(7, new BrandUpdate("B1", "")));

    assertThat(next.getBrandNames().isEmpty(), is(true));
  }

  @Test
  public void setsTheDefaultMarkup() {
    PricingState next = reducer.apply(stateWithTShirt, event(7, new SetDefaultMarkup(2.5)));

    assertThat(next.getDefaultMarkup(), is(equalTo(2.5)));
    assertThat(next.getMarkups(), is(sameInstance(stateWithTShirt.getMarkups())));
  }

  @Test
  public void skippingAnEventAdvancesOnlyTheSequenceNumber() {
    PricingState next = reducer.skip(stateWithTShirt, 7);

    assertThat(next.getSeqNum(), is(equalTo(7L)));
    assertThat(next.getMarkups(), is(equalTo(stateWithTShirt.getMarkups())));
    assertThat(next.getBrandNames(), is(equalTo(stateWithTShirt.getBrandNames())));
    assertThat(next.getDefaultMarkup(), is(equalTo(stateWithTShirt.getDefaultMarkup())));
  }

  @Test
  public void replayingTheSameEventsFromTheEmptyStateYieldsEqualStates() {
    List<Event<PricingPayload>> events = someEvents(500, 42);

    PricingState first = reduce(PricingState.EMPTY, events);
    PricingState second = reduce(PricingState.EMPTY, events);

    assertThat(first, is(equalTo(second)));
    assertThat(first.getSeqNum(), is(equalTo(499L)));
  }
}
