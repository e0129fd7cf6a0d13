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

import statepump.interfaces.replication.Event;
import statepump.interfaces.replication.StateReducer;

import static statepump.pricing.PricingPayload.BrandUpdate;
import static statepump.pricing.PricingPayload.MarkupUpdate;
import static statepump.pricing.PricingPayload.SetDefaultMarkup;

public class PricingReducer implements StateReducer<PricingState, PricingPayload> {

  @Override
  public PricingState apply(PricingState state, Event<PricingPayload> event) {
    final long seqNum = event.getSeqNum();

    return event.getPayload().accept(new PricingPayload.Visitor<PricingState>() {
      @Override
      public PricingState visit(MarkupUpdate update) {
        // A non-positive rate is never stored
        final Double newRate = update.getPrice() > 0 ? update.getPrice() : null;
        return state.withMarkups(seqNum, PricingState.updated(state.getMarkups(), update.getCategory(), newRate));
      }

      @Override
      public PricingState visit(BrandUpdate update) {
        final String newName = update.getName().isEmpty() ? null : update.getName();
        return state.withBrandNames(seqNum, PricingState.updated(state.getBrandNames(), update.getCode(), newName));
      }

      @Override
      public PricingState visit(SetDefaultMarkup update) {
        return state.withDefaultMarkup(seqNum, update.getPrice());
      }
    });
  }

  @Override
  public PricingState skip(PricingState state, long seqNum) {
    return state.withSeqNum(seqNum);
  }
}
