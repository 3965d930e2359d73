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

import ij.process.ByteProcessor;

/**
 * A mask over the navigation positions of a stack marking frames that contain no sample signal
 * outside the direct beam.
 */
public final class VacuumMask {
  /** The navigation width. */
  private final int width;
  /** The navigation height. */
  private final int height;
  /** The vacuum flag for each navigation index. */
  private final boolean[] vacuum;

  /**
   * Create a new instance.
   *
   * @param width the navigation width
   * @param height the navigation height
   * @param vacuum the vacuum flags
   */
  VacuumMask(int width, int height, boolean[] vacuum) {
    this.width = width;
    this.height = height;
    this.vacuum = vacuum;
  }

  /**
   * Gets the navigation width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the navigation height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the number of navigation positions.
   *
   * @return the size
   */
  public int size() {
    return vacuum.length;
  }

  /**
   * Checks if the frame at the navigation index is vacuum.
   *
   * @param index the navigation index
   * @return true if vacuum
   */
  public boolean isVacuum(int index) {
    return vacuum[index];
  }

  /**
   * Checks if the frame at the navigation position is vacuum.
   *
   * @param x the navigation x position
   * @param y the navigation y position
   * @return true if vacuum
   */
  public boolean isVacuum(int x, int y) {
    return vacuum[x + y * width];
  }

  /**
   * Count the vacuum frames.
   *
   * @return the count
   */
  public int count() {
    int count = 0;
    for (final boolean b : vacuum) {
      if (b) {
        count++;
      }
    }
    return count;
  }

  /**
   * Copy the vacuum flags.
   *
   * @return the flags
   */
  public boolean[] toArray() {
    return vacuum.clone();
  }

  /**
   * Convert to an ImageJ binary mask over the navigation grid. Vacuum positions are 255.
   *
   * @return the mask processor
   */
  public ByteProcessor toByteProcessor() {
    final byte[] pixels = new byte[vacuum.length];
    for (int i = 0; i < pixels.length; i++) {
      if (vacuum[i]) {
        pixels[i] = (byte) 255;
      }
    }
    return new ByteProcessor(width, height, pixels);
  }
}
