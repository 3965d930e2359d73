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

package uk.ac.sussex.gdsc.diffraction.geometry;

import java.util.Optional;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Coordinate geometry for diffraction frames.
 */
public final class GeometryUtils {

  /** No public construction. */
  private GeometryUtils() {}

  /**
   * Gets the geometric centre of a frame: {@code ((width - 1) / 2, (height - 1) / 2)}.
   *
   * <p>This is the centre of the pixel grid and is used as the default beam position.
   *
   * @param width the width
   * @param height the height
   * @return the centre
   */
  public static Centre defaultCentre(int width, int height) {
    return new Centre((width - 1) / 2.0, (height - 1) / 2.0);
  }

  /**
   * Gets the centre of the frame extent in continuous coordinates:
   * {@code (width / 2, height / 2)}. This is the origin for affine transforms of the frame.
   *
   * @param width the width
   * @param height the height
   * @return the centre
   */
  public static Centre transformCentre(int width, int height) {
    return new Centre(width / 2.0, height / 2.0);
  }

  /**
   * Build a circular mask. A pixel {@code (x, y)} is included if
   * {@code (x - cx)^2 + (y - cy)^2 <= radius^2}.
   *
   * @param width the width
   * @param height the height
   * @param radius the radius
   * @param centre the centre
   * @return the circular mask
   * @throws IllegalArgumentException if the radius is not strictly positive or the centre is
   *         outside the frame
   */
  public static CircularMask buildCircularMask(int width, int height, double radius,
      Centre centre) {
    checkDimensions(width, height);
    checkRadius(radius);
    checkCentre(centre, width, height);
    return CircularMask.create(width, height, radius, centre);
  }

  /**
   * Build a circular mask. If the centre is not present the {@link #defaultCentre(int, int)} is
   * used.
   *
   * @param width the width
   * @param height the height
   * @param radius the radius
   * @param centre the centre
   * @return the circular mask
   * @throws IllegalArgumentException if the radius is not strictly positive or the centre is
   *         outside the frame
   * @see #buildCircularMask(int, int, double, Centre)
   */
  public static CircularMask buildCircularMask(int width, int height, double radius,
      Optional<Centre> centre) {
    return buildCircularMask(width, height, radius,
        centre.orElseGet(() -> defaultCentre(width, height)));
  }

  /**
   * Check the radius is finite and strictly positive.
   *
   * @param radius the radius
   * @return the radius
   * @throws IllegalArgumentException if the radius is invalid
   */
  public static double checkRadius(double radius) {
    ValidationUtils.checkArgument(radius > 0 && radius < Double.POSITIVE_INFINITY,
        "Radius must be strictly positive and finite: %s", radius);
    return radius;
  }

  /**
   * Check the centre is within the frame: {@code [0, width) x [0, height)}.
   *
   * @param centre the centre
   * @param width the width
   * @param height the height
   * @return the centre
   * @throws IllegalArgumentException if the centre is outside the frame
   */
  public static Centre checkCentre(Centre centre, int width, int height) {
    ValidationUtils.checkNotNull(centre, "centre");
    ValidationUtils.checkArgument(
        centre.getX() >= 0 && centre.getX() < width && centre.getY() >= 0
            && centre.getY() < height,
        "Centre %s is outside the frame %s", centre, width + "x" + height);
    return centre;
  }

  private static void checkDimensions(int width, int height) {
    ValidationUtils.checkStrictlyPositive(width, "width");
    ValidationUtils.checkStrictlyPositive(height, "height");
  }
}
