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

package uk.ac.sussex.gdsc.diffraction;

import ij.ImageStack;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * An ordered collection of diffraction frames indexed by a navigation coordinate.
 *
 * <p>All frames have the same dimensions. The navigation may be linear or a 2D grid of
 * positions stored in row-major order, i.e. {@code index = x + y * navigationWidth}.
 *
 * <p>Frames are held as {@link FloatProcessor} instances. The processors returned by
 * {@link #getFrame(int)} are shared with the stack and must be treated as read-only. All
 * processing operations in this library return new frames.
 */
public final class FrameStack {
  /** The frame width. */
  private final int width;
  /** The frame height. */
  private final int height;
  /** The navigation width. */
  private final int navigationWidth;
  /** The navigation height. */
  private final int navigationHeight;
  /** The frames. */
  private final FloatProcessor[] frames;

  /**
   * Create a new instance.
   *
   * @param navigationWidth the navigation width
   * @param navigationHeight the navigation height
   * @param frames the frames
   */
  private FrameStack(int navigationWidth, int navigationHeight, FloatProcessor[] frames) {
    ValidationUtils.checkStrictlyPositive(frames.length, "frames");
    ValidationUtils.checkStrictlyPositive(navigationWidth, "navigationWidth");
    ValidationUtils.checkStrictlyPositive(navigationHeight, "navigationHeight");
    ValidationUtils.checkArgument(navigationWidth * navigationHeight == frames.length,
        "Navigation size (%d) does not match the number of frames (%d)",
        navigationWidth * navigationHeight, frames.length);
    final FloatProcessor first = ValidationUtils.checkNotNull(frames[0], "frame %d", 0);
    this.width = first.getWidth();
    this.height = first.getHeight();
    for (int i = 1; i < frames.length; i++) {
      final FloatProcessor fp = ValidationUtils.checkNotNull(frames[i], "frame %d", i);
      ValidationUtils.checkArgument(fp.getWidth() == width && fp.getHeight() == height,
          "Frame %d dimensions do not match the first frame", i);
    }
    this.navigationWidth = navigationWidth;
    this.navigationHeight = navigationHeight;
    this.frames = frames;
  }

  /**
   * Create a stack with a linear navigation.
   *
   * @param frames the frames
   * @return the frame stack
   * @throws IllegalArgumentException if there are no frames or the frame dimensions differ
   */
  public static FrameStack of(FloatProcessor... frames) {
    return new FrameStack(frames.length, 1, frames.clone());
  }

  /**
   * Create a stack with a 2D navigation grid.
   *
   * @param navigationWidth the navigation width
   * @param navigationHeight the navigation height
   * @param frames the frames in row-major navigation order
   * @return the frame stack
   * @throws IllegalArgumentException if the navigation shape does not match the number of frames
   *         or the frame dimensions differ
   */
  public static FrameStack of(int navigationWidth, int navigationHeight,
      FloatProcessor... frames) {
    return new FrameStack(navigationWidth, navigationHeight, frames.clone());
  }

  /**
   * Create a stack with a linear navigation from an ImageJ image stack. Non-float slices are
   * converted to float.
   *
   * @param stack the stack
   * @return the frame stack
   */
  public static FrameStack of(ImageStack stack) {
    return of(stack, stack.getSize(), 1);
  }

  /**
   * Create a stack with a 2D navigation grid from an ImageJ image stack. Non-float slices are
   * converted to float.
   *
   * @param stack the stack
   * @param navigationWidth the navigation width
   * @param navigationHeight the navigation height
   * @return the frame stack
   */
  public static FrameStack of(ImageStack stack, int navigationWidth, int navigationHeight) {
    final FloatProcessor[] frames = new FloatProcessor[stack.getSize()];
    for (int i = 0; i < frames.length; i++) {
      // ImageJ stacks are 1-indexed
      final ImageProcessor ip = stack.getProcessor(i + 1);
      frames[i] = ip instanceof FloatProcessor ? (FloatProcessor) ip : ip.convertToFloatProcessor();
    }
    return new FrameStack(navigationWidth, navigationHeight, frames);
  }

  /**
   * Create a new stack with the same navigation shape holding the given frames.
   *
   * @param newFrames the new frames
   * @return the frame stack
   * @throws IllegalArgumentException if the number of frames differs from this stack
   */
  public FrameStack derive(FloatProcessor[] newFrames) {
    ValidationUtils.checkArgument(newFrames.length == frames.length,
        "Number of frames (%d) must match the navigation size (%d)", newFrames.length,
        frames.length);
    return new FrameStack(navigationWidth, navigationHeight, newFrames.clone());
  }

  /**
   * Gets the frame width.
   *
   * @return the width
   */
  public int getWidth() {
    return width;
  }

  /**
   * Gets the frame height.
   *
   * @return the height
   */
  public int getHeight() {
    return height;
  }

  /**
   * Gets the navigation width.
   *
   * @return the navigation width
   */
  public int getNavigationWidth() {
    return navigationWidth;
  }

  /**
   * Gets the navigation height. This is 1 for a linear navigation.
   *
   * @return the navigation height
   */
  public int getNavigationHeight() {
    return navigationHeight;
  }

  /**
   * Gets the navigation size (the number of frames).
   *
   * @return the size
   */
  public int size() {
    return frames.length;
  }

  /**
   * Gets the frame at the navigation index.
   *
   * @param index the index
   * @return the frame
   */
  public FloatProcessor getFrame(int index) {
    return frames[index];
  }

  /**
   * Gets the frame at the navigation grid position.
   *
   * @param x the navigation x position
   * @param y the navigation y position
   * @return the frame
   */
  public FloatProcessor getFrame(int x, int y) {
    return frames[getNavigationIndex(x, y)];
  }

  /**
   * Gets the navigation index of the grid position.
   *
   * @param x the navigation x position
   * @param y the navigation y position
   * @return the index
   */
  public int getNavigationIndex(int x, int y) {
    ValidationUtils.checkIndex(x, navigationWidth, "x");
    ValidationUtils.checkIndex(y, navigationHeight, "y");
    return x + y * navigationWidth;
  }

  /**
   * Sum all frames elementwise.
   *
   * @return the aggregate frame pixels
   */
  public double[] sum() {
    final double[] sum = new double[width * height];
    for (final FloatProcessor fp : frames) {
      final float[] pixels = (float[]) fp.getPixels();
      for (int i = 0; i < sum.length; i++) {
        sum[i] += pixels[i];
      }
    }
    return sum;
  }

  /**
   * Gets the maximum pixel value across all frames. NaN values are ignored.
   *
   * @return the maximum (or negative infinity if all values are NaN)
   */
  public float max() {
    float max = Float.NEGATIVE_INFINITY;
    for (final FloatProcessor fp : frames) {
      for (final float value : (float[]) fp.getPixels()) {
        if (max < value) {
          max = value;
        }
      }
    }
    return max;
  }

  /**
   * Convert to an ImageJ stack. The frame pixels are shared with this stack.
   *
   * @return the image stack
   */
  public ImageStack toImageStack() {
    final ImageStack stack = new ImageStack(width, height);
    for (int i = 0; i < frames.length; i++) {
      stack.addSlice(Integer.toString(i), frames[i].getPixels());
    }
    return stack;
  }
}
