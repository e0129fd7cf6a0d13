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

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import statepump.interfaces.replication.MalformedEventException;
import statepump.interfaces.replication.PayloadCodec;
import statepump.pricing.messages.PricingPayloadMessage;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.ByteBuffer;

import static statepump.pricing.PricingPayload.BrandUpdate;
import static statepump.pricing.PricingPayload.MarkupUpdate;
import static statepump.pricing.PricingPayload.SetDefaultMarkup;
import static statepump.pricing.messages.PricingPayloadMessage.KIND_BRAND_UPDATE;
import static statepump.pricing.messages.PricingPayloadMessage.KIND_MARKUP_UPDATE;
import static statepump.pricing.messages.PricingPayloadMessage.KIND_SET_DEFAULT_MARKUP;

/**
 * Encodes pricing events as protostuff {@link PricingPayloadMessage}s. Unknown fields are ignored when
 * decoding, but an unknown kind, or a variant missing a field it needs, is malformed.
 */
public class PricingPayloadCodec implements PayloadCodec<PricingPayload> {
  private static final Schema<PricingPayloadMessage> SCHEMA = RuntimeSchema.getSchema(PricingPayloadMessage.class);

  @Override
  public ByteBuffer encode(PricingPayload payload) {
    final PricingPayloadMessage message = payload.accept(new PricingPayload.Visitor<PricingPayloadMessage>() {
      @Override
      public PricingPayloadMessage visit(MarkupUpdate update) {
        return new PricingPayloadMessage(KIND_MARKUP_UPDATE, update.getCategory(), update.getPrice(), null, null);
      }

      @Override
      public PricingPayloadMessage visit(BrandUpdate update) {
        return new PricingPayloadMessage(KIND_BRAND_UPDATE, null, 0, update.getCode(), update.getName());
      }

      @Override
      public PricingPayloadMessage visit(SetDefaultMarkup update) {
        return new PricingPayloadMessage(KIND_SET_DEFAULT_MARKUP, null, update.getPrice(), null, null);
      }
    });

    return ByteBuffer.wrap(ProtostuffIOUtil.toByteArray(message, SCHEMA, LinkedBuffer.allocate()));
  }

  @Override
  public PricingPayload decode(ByteBuffer body) throws MalformedEventException {
    final byte[] bytes = new byte[body.remaining()];
    body.duplicate().get(bytes);

    final PricingPayloadMessage message = SCHEMA.newMessage();
    try {
      ProtostuffIOUtil.mergeFrom(new ByteArrayInputStream(bytes), message, SCHEMA);
    } catch (IOException | RuntimeException e) {
      throw new MalformedEventException("Unparseable pricing event", e);
    }

    switch (message.getKind()) {
      case KIND_MARKUP_UPDATE:
        return new MarkupUpdate(required(message.getCategory(), "category"), message.getPrice());
      case KIND_BRAND_UPDATE:
        return new BrandUpdate(required(message.getCode(), "code"), required(message.getName(), "name"));
      case KIND_SET_DEFAULT_MARKUP:
        return new SetDefaultMarkup(message.getPrice());
      default:
        throw new MalformedEventException("Unknown pricing event kind " + message.getKind());
    }
  }

  private static String required(String field, String fieldName) throws MalformedEventException {
    if (field == null) {
      throw new MalformedEventException("Pricing event lacks its " + fieldName);
    }
    return field;
  }
}
