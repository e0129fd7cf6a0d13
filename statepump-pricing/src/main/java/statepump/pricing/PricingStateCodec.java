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
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import statepump.interfaces.replication.StateCodec;
import statepump.interfaces.snapshot.CorruptSnapshotException;
import statepump.pricing.messages.PricingStateMessage;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static statepump.pricing.messages.PricingStateMessage.BrandEntry;
import static statepump.pricing.messages.PricingStateMessage.MarkupEntry;

/**
 * Serializes pricing states as protostuff {@link PricingStateMessage}s, with map entries in key order so
 * that equal states serialize identically.
 */
public class PricingStateCodec implements StateCodec<PricingState> {
  private static final Schema<PricingStateMessage> SCHEMA = RuntimeSchema.getSchema(PricingStateMessage.class);

  @Override
  public PricingState emptyState() {
    return PricingState.EMPTY;
  }

  @Override
  public ByteBuffer encode(PricingState state) {
    final List<MarkupEntry> markups = new ArrayList<>();
    new TreeMap<>(state.getMarkups()).forEach((category, price) -> markups.add(new MarkupEntry(category, price)));

    final List<BrandEntry> brands = new ArrayList<>();
    new TreeMap<>(state.getBrandNames()).forEach((code, name) -> brands.add(new BrandEntry(code, name)));

    final PricingStateMessage message =
        new PricingStateMessage(state.getSeqNum(), markups, brands, state.getDefaultMarkup());
    return ByteBuffer.wrap(ProtostuffIOUtil.toByteArray(message, SCHEMA, LinkedBuffer.allocate()));
  }

  @Override
  public PricingState decode(ByteBuffer serialized) throws CorruptSnapshotException {
    final byte[] bytes = new byte[serialized.remaining()];
    serialized.duplicate().get(bytes);

    final PricingStateMessage message = SCHEMA.newMessage();
    try {
      ProtostuffIOUtil.mergeFrom(new ByteArrayInputStream(bytes), message, SCHEMA);
    } catch (IOException | RuntimeException e) {
      throw new CorruptSnapshotException("Unparseable pricing state", e);
    }

    final Map<String, Double> markups = new TreeMap<>();
    if (message.getMarkups() != null) {
      for (MarkupEntry entry : message.getMarkups()) {
        if (entry.getCategory() == null || !(entry.getPrice() > 0)
            || markups.put(entry.getCategory(), entry.getPrice()) != null) {
          throw new CorruptSnapshotException("Invalid markup entry for category " + entry.getCategory());
        }
      }
    }

    final Map<String, String> brands = new TreeMap<>();
    if (message.getBrands() != null) {
      for (BrandEntry entry : message.getBrands()) {
        if (entry.getCode() == null || entry.getName() == null
            || brands.put(entry.getCode(), entry.getName()) != null) {
          throw new CorruptSnapshotException("Invalid brand entry for code " + entry.getCode());
        }
      }
    }

    return new PricingState(message.getSeqNum(), ImmutableMap.copyOf(markups), ImmutableMap.copyOf(brands),
        message.getDefaultMarkup());
  }
}
