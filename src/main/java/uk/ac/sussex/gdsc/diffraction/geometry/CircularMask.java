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

import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.awt.Rectangle;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A mask of the pixels within a radius of a centre.
 *
 * <p>The mask may be inverted to select the pixels outside the circle.
 *
 * @see GeometryUtils#buildCircularMask(int, int, double, Centre)
 */
public final class CircularMask {
  private final int width;
  private final int height;
  private final double radius;
  private final Centre centre;
  private final boolean inverted;
  /** The mask. True for pixels within the radius, irrespective of inversion. */
  private final boolean[] mask;
  /** The bounds of the pixels selected by the mask. */
  private final Rectangle bounds;

  /**
   * Create a new instance.
   *
   * @param width the width
   * @param height the height
   * @param radius the radius
   * @param centre the centre
   * @param inverted the inverted flag
   * @param mask the mask
   * @param bounds the bounds
   */
  private CircularMask(int width, int height, double radius, Centre centre, boolean inverted,
      boolean[] mask, Rectangle bounds) {
    this.width = width;
    this.height = height;
    this.radius = radius;
    this.centre = centre;
    this.inverted = inverted;
    this.mask = mask;
    this.bounds = bounds;
  }

  /**
   * Create the mask. Arguments are assumed to be valid.
   *
   * @param width the width
   * @param height the height
   * @param radius the radius
   * @param centre the centre
   * @return the circular mask
   */
  static CircularMask create(int width, int height, double radius, Centre centre) {
    final boolean[] mask = new boolean[width * height];
    final double cx = centre.getX();
    final double cy = centre.getY();
    final double r2 = radius * radius;
    // Only rows and columns within the radius can be inside
    final int minY = Math.max(0, (int) Math.floor(cy - radius));
    final int maxY = Math.min(height - 1, (int) Math.ceil(cy + radius));
    final int minX = Math.max(0, (int) Math.floor(cx - radius));
    final int maxX = Math.min(width - 1, (int) Math.ceil(cx + radius));
    int lowerX = width;
    int upperX = -1;
    int lowerY = height;
    int upperY = -1;
    for (int y = minY; y <= maxY; y++) {
      final double dy = y - cy;
      final double dy2 = dy * dy;
      for (int x = minX, i = y * width + minX; x <= maxX; x++, i++) {
        final double dx = x - cx;
        if (dx * dx + dy2 <= r2) {
          mask[i] = true;
          lowerX = Math.min(lowerX, x);
          upperX = Math.max(upperX, x);
          lowerY = Math.min(lowerY, y);
          upperY = Math.max(upperY, y);
        }
      }
    }
    final Rectangle bounds = upperX < 0 ? new Rectangle()
        : new Rectangle(lowerX, lowerY, upperX - lowerX + 1, upperY - lowerY + 1);
    return new CircularMask(width, height, radius, centre, false, mask, bounds);
  }

  /**
   * Create a mask selecting the complement of this mask.
   *
   * @return the inverted mask
   */
  public CircularMask invert() {
    final Rectangle newBounds = inverted ? createBounds() : new Rectangle(width, height);
    return new CircularMask(width, height, radius, centre, !inverted, mask, newBounds);
  }

  private Rectangle createBounds() {
    return create(width, height, radius, centre).bounds;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the radius.
   *
   * @return the radius
   */
  public double getRadius() {
    return radius;
  }

  /**
   * Gets the centre.
   *
   * @return the centre
   */
  public Centre getCentre() {
    return centre;
  }

  /**
   * Checks if the mask is inverted, i.e. selects the pixels outside the radius.
   *
   * @return true if inverted
   */
  public boolean isInverted() {
    return inverted;
  }

  /**
   * Gets the bounding rectangle of the selected pixels. This is empty if no pixels are selected.
   *
   * <p>The inverted mask uses the entire frame.
   *
   * @return the bounds
   */
  public Rectangle getBounds() {
    return new Rectangle(bounds);
  }

  /**
   * Checks if the pixel index is selected.
   *
   * @param index the index ({@code x + y * width})
   * @return true if selected
   */
  public boolean contains(int index) {
    return mask[index] != inverted;
  }

  /**
   * Checks if the pixel is selected.
   *
   * @param x the x position
   * @param y the y position
   * @return true if selected
   */
  public boolean contains(int x, int y) {
    return contains(x + y * width);
  }

  /**
   * Count the selected pixels.
   *
   * @return the count
   */
  public int count() {
    int count = 0;
    for (final boolean b : mask) {
      if (b) {
        count++;
      }
    }
    return inverted ? mask.length - count : count;
  }

  /**
   * Multiply the frame by the mask. Pixels not selected are set to zero.
   *
   * @param frame the frame
   * @return the masked frame
   * @throws IllegalArgumentException if the frame dimensions do not match the mask
   */
  public FloatProcessor apply(ImageProcessor frame) {
    checkDimensions(frame);
    final float[] pixels = new float[mask.length];
    for (int i = 0; i < pixels.length; i++) {
      if (contains(i)) {
        pixels[i] = frame.getf(i);
      }
    }
    return new FloatProcessor(width, height, pixels);
  }

  /**
   * Find the maximum of the frame within the selected pixels. NaN values are ignored.
   *
   * @param frame the frame
   * @return the maximum (or negative infinity if there are no selected pixels)
   * @throws IllegalArgumentException if the frame dimensions do not match the mask
   */
  public float max(ImageProcessor frame) {
    checkDimensions(frame);
    float max = Float.NEGATIVE_INFINITY;
    for (int y = bounds.y, maxy = bounds.y + bounds.height; y < maxy; y++) {
      for (int x = bounds.x, i = y * width + x, maxx = bounds.x + bounds.width; x < maxx;
          x++, i++) {
        if (contains(i)) {
          final float value = frame.getf(i);
          if (max < value) {
            max = value;
          }
        }
      }
    }
    return max;
  }

  /**
   * Copy the selection state of each pixel.
   *
   * @return the mask
   */
  public boolean[] toArray() {
    final boolean[] result = new boolean[mask.length];
    for (int i = 0; i < result.length; i++) {
      result[i] = contains(i);
    }
    return result;
  }

  /**
   * Convert to an ImageJ binary mask. Selected pixels are 255.
   *
   * @return the mask processor
   */
  public ByteProcessor toByteProcessor() {
    final byte[] pixels = new byte[mask.length];
    for (int i = 0; i < pixels.length; i++) {
      if (contains(i)) {
        pixels[i] = (byte) 255;
      }
    }
    return new ByteProcessor(width, height, pixels);
  }

  private void checkDimensions(ImageProcessor frame) {
    ValidationUtils.checkArgument(frame.getWidth() == width && frame.getHeight() == height,
        "Frame dimensions %s do not match the mask",
        frame.getWidth() + "x" + frame.getHeight());
  }
}
