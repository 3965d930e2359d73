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
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.annotation.Nullable;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;

/**
 * Remove the diffuse background from diffraction patterns using an h-dome transform.
 *
 * <p>Each frame has the greyscale reconstruction of {@code frame - h} under the frame subtracted.
 * This retains peaks that rise more than {@code h} above their surroundings. The stack is
 * normalised to a maximum of 1 before and after the transform and each result is smoothed with a
 * 3x3 mean filter.
 */
public class BackgroundSubtractor {
  /** The frame mapper. */
  private final FrameMapper mapper;
  /** The logger. */
  private Logger logger = Logger.getLogger(BackgroundSubtractor.class.getName());

  /**
   * Create a new instance with default settings.
   */
  public BackgroundSubtractor() {
    this(new FrameMapper());
  }

  /**
   * Create a new instance.
   *
   * @param mapper the mapper used to process the frames of a stack
   */
  public BackgroundSubtractor(FrameMapper mapper) {
    this.mapper = ValidationUtils.checkNotNull(mapper, "mapper");
  }

  /**
   * Sets the logger.
   *
   * @param logger the new logger
   */
  public void setLogger(@Nullable Logger logger) {
    this.logger =
        logger == null ? Logger.getLogger(BackgroundSubtractor.class.getName()) : logger;
  }

  /**
   * Remove the background from every frame of the stack.
   *
   * @param stack the stack
   * @param h the dome height (must be positive or zero)
   * @return the background subtracted stack
   * @throws IllegalArgumentException if {@code h} is negative or not finite
   */
  public FrameStack removeBackground(FrameStack stack, double h) {
    ValidationUtils.checkArgument(h >= 0 && h < Double.POSITIVE_INFINITY,
        "h must be positive and finite: %s", h);
    final float height = (float) h;
    logger.fine(() -> "Removing background from " + stack.size() + " patterns using h=" + h);

    final FrameStack normalised = normalise(stack);
    final FrameStack smoothed = mapper.mapFrames(normalised, (index, frame) -> {
      final FloatProcessor dome = subtractReconstruction(frame, height);
      return meanFilter3x3(dome);
    });
    return normalise(smoothed);
  }

  /**
   * Compute the h-dome of the frame: {@code frame - reconstruction(frame - h, frame)}.
   *
   * @param frame the frame
   * @param h the dome height
   * @return the h-dome
   */
  static FloatProcessor subtractReconstruction(FloatProcessor frame, float h) {
    final float[] pixels = (float[]) frame.getPixels();
    final float[] seed = new float[pixels.length];
    for (int i = 0; i < seed.length; i++) {
      seed[i] = pixels[i] - h;
    }
    final FloatProcessor background = GreyscaleReconstruction.reconstructByDilation(
        new FloatProcessor(frame.getWidth(), frame.getHeight(), seed), frame);
    final float[] result = (float[]) background.getPixels();
    for (int i = 0; i < result.length; i++) {
      result[i] = pixels[i] - result[i];
    }
    return background;
  }

  /**
   * Divide the stack by its global maximum. The stack is returned unchanged if the maximum is not
   * strictly positive.
   *
   * @param stack the stack
   * @return the normalised stack
   */
  FrameStack normalise(FrameStack stack) {
    final float max = stack.max();
    if (!(max > 0)) {
      logger.fine(() -> "Skipping normalisation with maximum " + max);
      return stack;
    }
    return mapper.mapFrames(stack, (index, frame) -> {
      final float[] pixels = ((float[]) frame.getPixels()).clone();
      for (int i = 0; i < pixels.length; i++) {
        pixels[i] /= max;
      }
      return new FloatProcessor(frame.getWidth(), frame.getHeight(), pixels);
    });
  }

  /**
   * Apply a 3x3 mean filter. Each output is the mean of the neighbours that are inside the
   * frame.
   *
   * @param frame the frame
   * @return the filtered frame
   */
  public static FloatProcessor meanFilter3x3(FloatProcessor frame) {
    final int width = frame.getWidth();
    final int height = frame.getHeight();
    final float[] pixels = (float[]) frame.getPixels();
    final float[] result = new float[pixels.length];
    for (int y = 0, i = 0; y < height; y++) {
      final int minY = Math.max(0, y - 1);
      final int maxY = Math.min(height - 1, y + 1);
      for (int x = 0; x < width; x++, i++) {
        final int minX = Math.max(0, x - 1);
        final int maxX = Math.min(width - 1, x + 1);
        double sum = 0;
        for (int yy = minY; yy <= maxY; yy++) {
          for (int xx = minX, j = yy * width + minX; xx <= maxX; xx++, j++) {
            sum += pixels[j];
          }
        }
        result[i] = (float) (sum / ((maxY - minY + 1) * (maxX - minX + 1)));
      }
    }
    return new FloatProcessor(width, height, result);
  }
}
