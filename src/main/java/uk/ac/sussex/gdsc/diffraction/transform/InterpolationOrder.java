/*-
 * #%L
 * Genome Damage and Stability Centre Diffraction Analysis
 *
 * Software for electron diffraction image analysis
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.diffraction.transform;

/**
 * The interpolation used to resample a frame.
 */
public enum InterpolationOrder {
  /** Use the nearest pixel. */
  NEAREST("Nearest neighbour", 0),
  /** Use bilinear interpolation of the 2x2 neighbourhood. */
  LINEAR("Bilinear", 1),
  /** Use bicubic convolution of the 4x4 neighbourhood. */
  CUBIC("Bicubic", 3);

  /** The description. */
  private final String description;
  /** The order of the interpolating polynomial. */
  private final int order;

  InterpolationOrder(String description, int order) {
    this.description = description;
    this.order = order;
  }

  @Override
  public String toString() {
    return getDescription();
  }

  /**
   * Gets the description.
   *
   * @return the description
   */
  public String getDescription() {
    return description;
  }

  /**
   * Gets the order of the interpolating polynomial.
   *
   * @return the order
   */
  public int getOrder() {
    return order;
  }

  /**
   * Get the interpolation from the order.
   *
   * @param order the order
   * @return the interpolation
   * @throws IllegalArgumentException if the order is not 0, 1 or 3
   */
  public static InterpolationOrder forOrder(int order) {
    for (final InterpolationOrder value : values()) {
      if (value.order == order) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unsupported interpolation order: " + order);
  }
}
