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

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Create 3x3 matrices for affine transforms of homogeneous 2D coordinates {@code (x, y, 1)}.
 */
public final class AffineMatrices {

  /** No public construction. */
  private AffineMatrices() {}

  /**
   * Create the identity matrix.
   *
   * @return the matrix
   */
  public static double[][] identity() {
    return new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0, 1}};
  }

  /**
   * Create a translation.
   *
   * @param dx the x translation
   * @param dy the y translation
   * @return the matrix
   */
  public static double[][] translation(double dx, double dy) {
    return new double[][] {{1, 0, dx}, {0, 1, dy}, {0, 0, 1}};
  }

  /**
   * Create a rotation. With the y axis pointing down the image a positive angle rotates
   * counter-clockwise.
   *
   * @param angleDegrees the angle in degrees
   * @return the matrix
   */
  public static double[][] rotation(double angleDegrees) {
    final double a = Math.toRadians(angleDegrees);
    final double cos = Math.cos(a);
    final double sin = Math.sin(a);
    return new double[][] {{cos, sin, 0}, {-sin, cos, 0}, {0, 0, 1}};
  }

  /**
   * Check the matrix is 3x3 and finite.
   *
   * @param matrix the matrix
   * @return the matrix
   * @throws IllegalArgumentException if the matrix is invalid
   */
  public static double[][] checkMatrix(double[][] matrix) {
    ValidationUtils.checkArgument(matrix.length == 3, "Matrix must have 3 rows: %d",
        matrix.length);
    for (final double[] row : matrix) {
      ValidationUtils.checkArgument(row.length == 3, "Matrix must have 3 columns: %d",
          row.length);
      for (final double value : row) {
        ValidationUtils.checkArgument(Double.isFinite(value), "Matrix must be finite: %s", value);
      }
    }
    return matrix;
  }
}
