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

package statepump.pricing.messages;

import io.protostuff.Tag;

/**
 * Wire form of every pricing event. The kind selects the variant; fields a variant does not use are
 * left unset. Tag numbers are never reused.
 */
public class PricingPayloadMessage {
  public static final int KIND_MARKUP_UPDATE = 1;
  public static final int KIND_BRAND_UPDATE = 2;
  public static final int KIND_SET_DEFAULT_MARKUP = 3;

  @Tag(1)
  private int kind;
  @Tag(2)
  private String category;
  @Tag(3)
  private double price;
  @Tag(4)
  private String code;
  @Tag(5)
  private String name;

  public PricingPayloadMessage() {
  }

  public PricingPayloadMessage(int kind, String category, double price, String code, String name) {
    this.kind = kind;
    this.category = category;
    this.price = price;
    this.code = code;
    this.name = name;
  }

  public int getKind() {
    return kind;
  }

  public String getCategory() {
    return category;
  }

  public double getPrice() {
    return price;
  }

  public String getCode() {
    return code;
  }

  public String getName() {
    return name;
  }
}
