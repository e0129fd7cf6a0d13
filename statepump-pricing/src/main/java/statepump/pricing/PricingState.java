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
import statepump.interfaces.replication.ReplicaState;

import java.util.Map;
import java.util.Objects;

/**
 * Fully reduced pricing configuration as of one sequence number. Every update returns a new instance that
 * shares whichever maps the update left unchanged.
 */
public final class PricingState implements ReplicaState {
  public static final PricingState EMPTY = new PricingState(-1, ImmutableMap.of(), ImmutableMap.of(), 0.0);

  private final long seqNum;
  private final ImmutableMap<String, Double> markups;
  private final ImmutableMap<String, String> brandNames;
  private final double defaultMarkup;

  public PricingState(long seqNum,
                      ImmutableMap<String, Double> markups,
                      ImmutableMap<String, String> brandNames,
                      double defaultMarkup) {
    this.seqNum = seqNum;
    this.markups = markups;
    this.brandNames = brandNames;
    this.defaultMarkup = defaultMarkup;
  }

  @Override
  public long getSeqNum() {
    return seqNum;
  }

  public ImmutableMap<String, Double> getMarkups() {
    return markups;
  }

  public ImmutableMap<String, String> getBrandNames() {
    return brandNames;
  }

  public double getDefaultMarkup() {
    return defaultMarkup;
  }

  /**
   * @return The category's own markup rate, or the default rate if it has none.
   */
  public double effectiveMarkup(String category) {
    final Double markup = markups.get(category);
    return markup == null ? defaultMarkup : markup;
  }

  PricingState withSeqNum(long newSeqNum) {
    return new PricingState(newSeqNum, markups, brandNames, defaultMarkup);
  }

  PricingState withMarkups(long newSeqNum, ImmutableMap<String, Double> newMarkups) {
    return new PricingState(newSeqNum, newMarkups, brandNames, defaultMarkup);
  }

  PricingState withBrandNames(long newSeqNum, ImmutableMap<String, String> newBrandNames) {
    return new PricingState(newSeqNum, markups, newBrandNames, defaultMarkup);
  }

  PricingState withDefaultMarkup(long newSeqNum, double newDefaultMarkup) {
    return new PricingState(newSeqNum, markups, brandNames, newDefaultMarkup);
  }

  /**
   * Copy of a map with one key set, replaced, or removed (when value is null).
   */
  static <V> ImmutableMap<String, V> updated(ImmutableMap<String, V> map, String key, V value) {
    final ImmutableMap.Builder<String, V> builder = ImmutableMap.builder();
    for (Map.Entry<String, V> entry : map.entrySet()) {
      if (!entry.getKey().equals(key)) {
        builder.put(entry);
      }
    }
    if (value != null) {
      builder.put(key, value);
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || (o.getClass() != this.getClass())) {
      return false;
    }
    PricingState that = (PricingState) o;
    return this.seqNum == that.seqNum
        && Double.compare(this.defaultMarkup, that.defaultMarkup) == 0
        && this.markups.equals(that.markups)
        && this.brandNames.equals(that.brandNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(seqNum, markups, brandNames, defaultMarkup);
  }

  @Override
  public String toString() {
    return "PricingState{" +
        "seqNum=" + seqNum +
        ", markups=" + markups +
        ", brandNames=" + brandNames +
        ", defaultMarkup=" + defaultMarkup +
        '}';
  }
}
