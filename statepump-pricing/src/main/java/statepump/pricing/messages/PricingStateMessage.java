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

import java.util.List;

/**
 * Serialized pricing state, as held in a snapshot. Tag numbers are never reused.
 */
public class PricingStateMessage {
  @Tag(1)
  private long seqNum;
  @Tag(2)
  private List<MarkupEntry> markups;
  @Tag(3)
  private List<BrandEntry> brands;
  @Tag(4)
  private double defaultMarkup;

  public PricingStateMessage() {
  }

  public PricingStateMessage(long seqNum, List<MarkupEntry> markups, List<BrandEntry> brands, double defaultMarkup) {
    this.seqNum = seqNum;
    this.markups = markups;
    this.brands = brands;
    this.defaultMarkup = defaultMarkup;
  }

  public long getSeqNum() {
    return seqNum;
  }

  public List<MarkupEntry> getMarkups() {
    return markups;
  }

  public List<BrandEntry> getBrands() {
    return brands;
  }

  public double getDefaultMarkup() {
    return defaultMarkup;
  }

  public static class MarkupEntry {
    @Tag(1)
    private String category;
    @Tag(2)
    private double price;

    public MarkupEntry() {
    }

    public MarkupEntry(String category, double price) {
      this.category = category;
      this.price = price;
    }

    public String getCategory() {
      return category;
    }

    public double getPrice() {
      return price;
    }
  }

  public static class BrandEntry {
    @Tag(1)
    private String code;
    @Tag(2)
    private String name;

    public BrandEntry() {
    }

    public BrandEntry(String code, String name) {
      this.code = code;
      this.name = name;
    }

    public String getCode() {
      return code;
    }

    public String getName() {
      return name;
    }
  }
}
