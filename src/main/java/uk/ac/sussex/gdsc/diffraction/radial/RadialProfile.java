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

package uk.ac.sussex.gdsc.diffraction.radial;

import java.util.Arrays;
import uk.ac.sussex.gdsc.diffraction.geometry.Centre;

/**
 * The mean intensity of a frame as a function of the integer distance from a centre.
 *
 * <p>Bin {@code r} holds pixels with a truncated distance of {@code r}. Bins without pixels
 * have a value of NaN.
 */
public final class RadialProfile {
  /** The centre. */
  private final Centre centre;
  /** The mean intensity in each bin. */
  private final double[] values;
  /** The number of pixels in each bin. */
  private final int[] counts;

  /**
   * Create a new instance.
   *
   * @param centre the centre
   * @param values the values
   * @param counts the counts
   */
  RadialProfile(Centre centre, double[] values, int[] counts) {
    this.centre = centre;
    this.values = values;
    this.counts = counts;
  }

  /**
   * Gets the centre of the profile.
   *
   * @return the centre
   */
  public Centre getCentre() {
    return centre;
  }

  /**
   * Gets the number of bins. This is the maximum radius plus 1.
   *
   * @return the length
   */
  public int length() {
    return values.length;
  }

  /**
   * Gets the mean intensity of the bin.
   *
   * @param radius the radius bin
   * @return the value (NaN if the bin has no pixels)
   */
  public double getValue(int radius) {
    return values[radius];
  }

  /**
   * Gets the number of pixels in the bin.
   *
   * @param radius the radius bin
   * @return the count
   */
  public int getCount(int radius) {
    return counts[radius];
  }

  /**
   * Checks if the bin has no pixels.
   *
   * @param radius the radius bin
   * @return true if missing
   */
  public boolean isMissing(int radius) {
    return counts[radius] == 0;
  }

  /**
   * Copy the mean intensity values.
   *
   * @return the values
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * Pad the profiles to the same length using NaN and arrange as rows of a matrix.
   *
   * @param profiles the profiles
   * @return the matrix {@code [profiles.length][max length]}
   */
  public static double[][] toMatrix(RadialProfile... profiles) {
    int length = 0;
    for (final RadialProfile profile : profiles) {
      length = Math.max(length, profile.length());
    }
    final double[][] matrix = new double[profiles.length][];
    for (int i = 0; i < profiles.length; i++) {
      final double[] row = Arrays.copyOf(profiles[i].values, length);
      Arrays.fill(row, profiles[i].length(), length, Double.NaN);
      matrix[i] = row;
    }
    return matrix;
  }

  @Override
  public String toString() {
    return "RadialProfile" + centre + Arrays.toString(values);
  }
}
