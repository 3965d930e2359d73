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

package uk.ac.sussex.gdsc.diffraction.background;

import ij.process.FloatProcessor;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Greyscale morphological reconstruction using a 3x3 (8-connected) neighbourhood.
 *
 * <p>Reconstruction by dilation of a seed under a mask is the fixed point of repeatedly dilating
 * the seed and taking the pixelwise minimum with the mask. This is computed using alternating
 * raster and anti-raster scans that propagate values in place until no pixel changes.
 *
 * @see <a href="https://doi.org/10.1109/83.217222">Vincent (1993) Morphological grayscale
 *      reconstruction in image analysis: applications and efficient algorithms</a>
 */
public final class GreyscaleReconstruction {

  /** No public construction. */
  private GreyscaleReconstruction() {}

  /**
   * Compute the reconstruction by dilation of the seed under the mask.
   *
   * <p>The inputs are not modified.
   *
   * @param seed the seed (marker)
   * @param mask the mask
   * @return the reconstruction
   * @throws IllegalArgumentException if the dimensions differ or the seed is above the mask
   */
  public static FloatProcessor reconstructByDilation(FloatProcessor seed, FloatProcessor mask) {
    final int width = mask.getWidth();
    final int height = mask.getHeight();
    ValidationUtils.checkArgument(seed.getWidth() == width && seed.getHeight() == height,
        "Seed dimensions %s do not match the mask %s", seed.getWidth() + "x" + seed.getHeight(),
        width + "x" + height);
    final float[] limit = (float[]) mask.getPixels();
    final float[] result = ((float[]) seed.getPixels()).clone();
    for (int i = 0; i < result.length; i++) {
      if (result[i] > limit[i]) {
        throw new IllegalArgumentException(String.format(
            "Seed is above the mask at (%d,%d): %s > %s", i % width, i / width, result[i],
            limit[i]));
      }
    }

    boolean changed = true;
    while (changed) {
      changed = forwardScan(result, limit, width, height);
      changed |= backwardScan(result, limit, width, height);
    }
    return new FloatProcessor(width, height, result);
  }

  /**
   * Raster scan (top-left to bottom-right) using the causal half of the neighbourhood.
   *
   * @param data the data
   * @param limit the limit
   * @param width the width
   * @param height the height
   * @return true if any value changed
   */
  private static boolean forwardScan(float[] data, float[] limit, int width, int height) {
    // @formatter:off
    // +---+---+---+
    // | 1 | 2 | 3 |
    // +---+---+---+
    // | 4 | p |   |
    // +---+---+---+
    // @formatter:on
    boolean changed = false;
    for (int y = 0, i = 0; y < height; y++) {
      final boolean hasUp = y > 0;
      for (int x = 0; x < width; x++, i++) {
        float max = data[i];
        if (x > 0) {
          max = Math.max(max, data[i - 1]);
        }
        if (hasUp) {
          final int up = i - width;
          max = Math.max(max, data[up]);
          if (x > 0) {
            max = Math.max(max, data[up - 1]);
          }
          if (x + 1 < width) {
            max = Math.max(max, data[up + 1]);
          }
        }
        changed |= update(data, limit, i, max);
      }
    }
    return changed;
  }

  /**
   * Anti-raster scan (bottom-right to top-left) using the anti-causal half of the neighbourhood.
   *
   * @param data the data
   * @param limit the limit
   * @param width the width
   * @param height the height
   * @return true if any value changed
   */
  private static boolean backwardScan(float[] data, float[] limit, int width, int height) {
    // @formatter:off
    // +---+---+---+
    // |   | p | 6 |
    // +---+---+---+
    // | 7 | 8 | 9 |
    // +---+---+---+
    // @formatter:on
    boolean changed = false;
    final int lastY = height - 1;
    for (int y = lastY, i = data.length - 1; y >= 0; y--) {
      final boolean hasDown = y < lastY;
      for (int x = width - 1; x >= 0; x--, i--) {
        float max = data[i];
        if (x + 1 < width) {
          max = Math.max(max, data[i + 1]);
        }
        if (hasDown) {
          final int down = i + width;
          max = Math.max(max, data[down]);
          if (x > 0) {
            max = Math.max(max, data[down - 1]);
          }
          if (x + 1 < width) {
            max = Math.max(max, data[down + 1]);
          }
        }
        changed |= update(data, limit, i, max);
      }
    }
    return changed;
  }

  private static boolean update(float[] data, float[] limit, int index, float max) {
    final float value = Math.min(max, limit[index]);
    if (value > data[index]) {
      data[index] = value;
      return true;
    }
    return false;
  }
}
