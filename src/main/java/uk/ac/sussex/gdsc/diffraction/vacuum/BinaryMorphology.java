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

package uk.ac.sussex.gdsc.diffraction.vacuum;

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Binary dilation and erosion on a 2D grid using the 4-connected cross structuring element.
 *
 * <p>Positions outside the grid take a fixed border value. For a grid with a single row or
 * column the out-of-grid neighbours always take the border value and the element acts as a
 * 3-element line.
 */
public final class BinaryMorphology {

  /** No public construction. */
  private BinaryMorphology() {}

  /**
   * Perform a binary dilation. A position is set if it or any 4-connected neighbour is set.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @param border the value of positions outside the grid
   * @return the dilated data
   */
  public static boolean[] dilate(boolean[] data, int width, int height, boolean border) {
    return apply(data, width, height, border, true);
  }

  /**
   * Perform a binary erosion. A position is set if it and all 4-connected neighbours are set.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @param border the value of positions outside the grid
   * @return the eroded data
   */
  public static boolean[] erode(boolean[] data, int width, int height, boolean border) {
    return apply(data, width, height, border, false);
  }

  /**
   * Apply the cross element. Dilation is an OR over the neighbourhood; erosion is an AND.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @param border the border value
   * @param dilate true to dilate; false to erode
   * @return the result
   */
  private static boolean[] apply(boolean[] data, int width, int height, boolean border,
      boolean dilate) {
    ValidationUtils.checkArgument(data.length == width * height,
        "Data length (%d) does not match the grid size (%d)", data.length, width * height);
    // @formatter:off
    // +---+---+---+
    // |   | 2 |   |
    // +---+---+---+
    // | 4 | 5 | 6 |
    // +---+---+---+
    // |   | 8 |   |
    // +---+---+---+
    // @formatter:on
    final boolean[] result = new boolean[data.length];
    final int lastX = width - 1;
    final int lastY = height - 1;
    for (int y = 0, i = 0; y < height; y++) {
      for (int x = 0; x < width; x++, i++) {
        final boolean p2 = y == 0 ? border : data[i - width];
        final boolean p4 = x == 0 ? border : data[i - 1];
        final boolean p5 = data[i];
        final boolean p6 = x == lastX ? border : data[i + 1];
        final boolean p8 = y == lastY ? border : data[i + width];
        result[i] = dilate ? p2 || p4 || p5 || p6 || p8 : p2 && p4 && p5 && p6 && p8;
      }
    }
    return result;
  }

  /**
   * Perform a binary closing: dilation with a false border followed by erosion with a true border.
   * This fills gaps smaller than the structuring element.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @return the closed data
   */
  public static boolean[] close(boolean[] data, int width, int height) {
    return erode(dilate(data, width, height, false), width, height, true);
  }

  /**
   * Perform a binary opening: erosion with a true border followed by dilation with a false border.
   * This removes objects smaller than the structuring element.
   *
   * @param data the data
   * @param width the width
   * @param height the height
   * @return the opened data
   */
  public static boolean[] open(boolean[] data, int width, int height) {
    return dilate(erode(data, width, height, true), width, height, false);
  }
}
