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

import java.util.Objects;

/**
 * The closed set of pricing events. Each variant is dispatched on through {@link Visitor}; adding an
 * event means adding a variant and a visitor method.
 */
public abstract class PricingPayload {

  public interface Visitor<R> {
    R visit(MarkupUpdate update);

    R visit(BrandUpdate update);

    R visit(SetDefaultMarkup update);
  }

  private PricingPayload() {
  }

  public abstract <R> R accept(Visitor<R> visitor);

  /**
   * Set the markup rate of a product category. A non-positive rate removes the category's entry.
   */
  public static final class MarkupUpdate extends PricingPayload {
    private final String category;
    private final double price;

    public MarkupUpdate(String category, double price) {
      this.category = Objects.requireNonNull(category);
      this.price = price;
    }

    public String getCategory() {
      return category;
    }

    public double getPrice() {
      return price;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof MarkupUpdate)) {
        return false;
      }
      MarkupUpdate that = (MarkupUpdate) o;
      return category.equals(that.category) && Double.compare(price, that.price) == 0;
    }

    @Override
    public int hashCode() {
      return Objects.hash(category, price);
    }

    @Override
    public String toString() {
      return "MarkupUpdate{" + category + "=" + price + "}";
    }
  }

  /**
   * Set the display name of a brand. An empty name removes the brand's entry.
   */
  public static final class BrandUpdate extends PricingPayload {
    private final String code;
    private final String name;

    public BrandUpdate(String code, String name) {
      this.code = Objects.requireNonNull(code);
      this.name = Objects.requireNonNull(name);
    }

    public String getCode() {
      return code;
    }

    public String getName() {
      return name;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof BrandUpdate)) {
        return false;
      }
      BrandUpdate that = (BrandUpdate) o;
      return code.equals(that.code) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(code, name);
    }

    @Override
    public String toString() {
      return "BrandUpdate{" + code + "=" + name + "}";
    }
  }

  /**
   * Set the markup rate applied to categories without one of their own.
   */
  public static final class SetDefaultMarkup extends PricingPayload {
    private final double price;

    public SetDefaultMarkup(double price) {
      this.price = price;
    }

    public double getPrice() {
      return price;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
      return (o instanceof SetDefaultMarkup) && Double.compare(price, ((SetDefaultMarkup) o).price) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(price);
    }

    @Override
    public String toString() {
      return "SetDefaultMarkup{" + price + "}";
    }
  }
}
