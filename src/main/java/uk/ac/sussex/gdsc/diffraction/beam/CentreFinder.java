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

package uk.ac.sussex.gdsc.diffraction.beam;

import ij.process.ImageProcessor;
import java.awt.Rectangle;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.annotation.Nullable;
import uk.ac.sussex.gdsc.core.data.VisibleForTesting;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;
import uk.ac.sussex.gdsc.diffraction.geometry.Centre;
import uk.ac.sussex.gdsc.diffraction.geometry.CircularMask;
import uk.ac.sussex.gdsc.diffraction.geometry.GeometryUtils;
import uk.ac.sussex.gdsc.diffraction.geometry.Shift;

/**
 * Locate the direct (undiffracted) beam in diffraction frames.
 *
 * <p>The beam is found by a hill-climbing search within a circular region. The search moves to
 * the brightest pixel within the radius of the current position until the current position is
 * the maximum of its own neighbourhood. The sub-pixel position is then the intensity-weighted
 * centre of mass of the final region.
 *
 * <p>The search for each frame of a stack is seeded with the position of the maximum of the sum
 * of all frames.
 *
 * <p>Based on the method presented by Thomas White in his PhD thesis (2009) which itself built
 * on Zaefferer (2000).
 */
public class CentreFinder {
  /** The default maximum number of moves of the search centre. */
  public static final int DEFAULT_MAX_ITERATIONS = 100;

  /** The options. */
  private final Options options;
  /** The frame mapper. */
  private final FrameMapper mapper;
  /** The logger. */
  private Logger logger = Logger.getLogger(CentreFinder.class.getName());

  /**
   * Provides the options for the {@link CentreFinder}.
   */
  public static class Options {
    /** The maximum number of moves of the search centre. */
    private int maxIterations = DEFAULT_MAX_ITERATIONS;

    /** Set to true to use the global estimate for frames that do not converge. */
    private boolean fallbackToSeed = true;

    /**
     * Create a new instance with the default options.
     */
    public Options() {
      // Do nothing
    }

    /**
     * Copy constructor.
     *
     * @param source the source
     */
    private Options(Options source) {
      maxIterations = source.maxIterations;
      fallbackToSeed = source.fallbackToSeed;
    }

    /**
     * Copy the options.
     *
     * @return the options
     */
    public Options copy() {
      return new Options(this);
    }

    /**
     * Gets the maximum number of moves of the search centre.
     *
     * @return the max iterations
     */
    public int getMaxIterations() {
      return maxIterations;
    }

    /**
     * Sets the maximum number of moves of the search centre.
     *
     * @param maxIterations the new max iterations
     * @throws IllegalArgumentException if not strictly positive
     */
    public void setMaxIterations(int maxIterations) {
      this.maxIterations = ValidationUtils.checkStrictlyPositive(maxIterations, "maxIterations");
    }

    /**
     * Checks if frames that do not converge use the global estimate as the beam position. If
     * false the {@link BeamNotConvergedException} is thrown from the stack operation.
     *
     * @return true if using the global estimate
     */
    public boolean isFallbackToSeed() {
      return fallbackToSeed;
    }

    /**
     * Set to true to use the global estimate as the beam position of frames that do not
     * converge.
     *
     * @param fallbackToSeed the new fallback to seed flag
     */
    public void setFallbackToSeed(boolean fallbackToSeed) {
      this.fallbackToSeed = fallbackToSeed;
    }
  }

  /**
   * Create a new instance with the default options.
   */
  public CentreFinder() {
    this(new Options(), new FrameMapper());
  }

  /**
   * Create a new instance.
   *
   * @param options the options (copied)
   * @param mapper the mapper used to process the frames of a stack
   */
  public CentreFinder(Options options, FrameMapper mapper) {
    this.options = options.copy();
    this.mapper = ValidationUtils.checkNotNull(mapper, "mapper");
  }

  /**
   * Gets a copy of the options.
   *
   * @return the options
   */
  public Options getOptions() {
    return options.copy();
  }

  /**
   * Sets the logger.
   *
   * @param logger the new logger
   */
  public void setLogger(@Nullable Logger logger) {
    this.logger = logger == null ? Logger.getLogger(CentreFinder.class.getName()) : logger;
  }

  /**
   * Estimate the beam centre of the stack. The frames are summed and the centroid of the
   * positions attaining the maximum is rounded to the nearest pixel.
   *
   * <p>This is a coarse estimate used to seed the refinement of each frame.
   *
   * @param stack the stack
   * @return the centre
   */
  public Centre estimateGlobalCentre(FrameStack stack) {
    final double[] sum = stack.sum();
    final Centre centre = findMaximaCentroid(sum, stack.getWidth()).round();
    logger.fine(() -> "Global beam estimate " + centre);
    return centre;
  }

  /**
   * Find the centroid of all positions attaining the maximum. NaN values are ignored.
   *
   * @param data the data
   * @param width the width
   * @return the centroid
   */
  @VisibleForTesting
  static Centre findMaximaCentroid(double[] data, int width) {
    double max = Double.NEGATIVE_INFINITY;
    long sumX = 0;
    long sumY = 0;
    int count = 0;
    for (int i = 0; i < data.length; i++) {
      final double value = data[i];
      if (value > max) {
        max = value;
        sumX = i % width;
        sumY = i / width;
        count = 1;
      } else if (value == max) {
        sumX += i % width;
        sumY += i / width;
        count++;
      }
    }
    if (count == 0) {
      // All NaN
      return GeometryUtils.defaultCentre(width, data.length / width);
    }
    return new Centre((double) sumX / count, (double) sumY / count);
  }

  /**
   * Refine the position of the direct beam in the frame.
   *
   * @param frame the frame
   * @param start the start position (rounded to the nearest pixel)
   * @param radius the radius of the search region
   * @return the sub-pixel beam position
   * @throws IllegalArgumentException if the radius is not strictly positive or the start is
   *         not finite or outside the frame
   * @throws BeamNotConvergedException if the search does not reach a local maximum
   * @see #refineBeamPosition(ImageProcessor, int, int, double)
   */
  public Centre refineBeamPosition(ImageProcessor frame, Centre start, double radius) {
    GeometryUtils.checkCentre(start, frame.getWidth(), frame.getHeight());
    final Centre pixel = start.round();
    return refineBeamPosition(frame, (int) pixel.getX(), (int) pixel.getY(), radius);
  }

  /**
   * Refine the position of the direct beam in the frame.
   *
   * <p>The search moves the centre to the maximum within the radius until the intensity at the
   * centre is at least the maximum within its own circular neighbourhood. Tied maxima are
   * averaged and rounded to the nearest pixel. The result is the centre of mass of the final
   * neighbourhood.
   *
   * @param frame the frame
   * @param startX the start x position
   * @param startY the start y position
   * @param radius the radius of the search region
   * @return the sub-pixel beam position
   * @throws IllegalArgumentException if the radius is not strictly positive or the start is
   *         outside the frame
   * @throws BeamNotConvergedException if the search does not reach a local maximum within the
   *         maximum number of iterations, or cannot move
   */
  public Centre refineBeamPosition(ImageProcessor frame, int startX, int startY, double radius) {
    final int width = frame.getWidth();
    final int height = frame.getHeight();
    GeometryUtils.checkRadius(radius);
    GeometryUtils.checkCentre(new Centre(startX, startY), width, height);

    final int maxIterations = options.getMaxIterations();
    int cx = startX;
    int cy = startY;
    for (int iteration = 0;; iteration++) {
      final CircularMask mask =
          GeometryUtils.buildCircularMask(width, height, radius, new Centre(cx, cy));

      // Find the maximum within the mask and the centroid of all positions that attain it
      final Rectangle bounds = mask.getBounds();
      float max = Float.NEGATIVE_INFINITY;
      long sumX = 0;
      long sumY = 0;
      int count = 0;
      for (int y = bounds.y, maxy = bounds.y + bounds.height; y < maxy; y++) {
        for (int x = bounds.x, i = y * width + x, maxx = bounds.x + bounds.width; x < maxx;
            x++, i++) {
          if (mask.contains(i)) {
            final float value = frame.getf(i);
            if (value > max) {
              max = value;
              sumX = x;
              sumY = y;
              count = 1;
            } else if (value == max) {
              sumX += x;
              sumY += y;
              count++;
            }
          }
        }
      }

      if (frame.getf(cx + cy * width) >= max) {
        return centreOfMass(frame, mask, cx, cy);
      }

      if (iteration == maxIterations) {
        throw new BeamNotConvergedException(
            "Beam search did not converge after " + maxIterations + " iterations", cx, cy,
            iteration);
      }

      final int nextX = (int) Math.rint((double) sumX / count);
      final int nextY = (int) Math.rint((double) sumY / count);
      if (nextX == cx && nextY == cy) {
        // Tied maxima are symmetric around the centre
        throw new BeamNotConvergedException(
            "Beam search cannot move from (" + cx + ", " + cy + "): maxima are centred on a"
                + " lower intensity pixel",
            cx, cy, iteration);
      }
      cx = nextX;
      cy = nextY;
    }
  }

  /**
   * Compute the intensity-weighted centre of mass of the frame within the mask.
   *
   * @param frame the frame
   * @param mask the mask
   * @param cx the current x centre
   * @param cy the current y centre
   * @return the centre of mass (or the current centre if the region has no intensity)
   */
  private static Centre centreOfMass(ImageProcessor frame, CircularMask mask, int cx, int cy) {
    final int width = frame.getWidth();
    final Rectangle bounds = mask.getBounds();
    double sum = 0;
    double sumX = 0;
    double sumY = 0;
    for (int y = bounds.y, maxy = bounds.y + bounds.height; y < maxy; y++) {
      for (int x = bounds.x, i = y * width + x, maxx = bounds.x + bounds.width; x < maxx;
          x++, i++) {
        if (mask.contains(i)) {
          final double value = frame.getf(i);
          sum += value;
          sumX += x * value;
          sumY += y * value;
        }
      }
    }
    if (sum == 0 || Double.isNaN(sum)) {
      return new Centre(cx, cy);
    }
    return new Centre(sumX / sum, sumY / sum);
  }

  /**
   * Gets the direct beam position in each frame of the stack.
   *
   * <p>The search in each frame starts from the {@link #estimateGlobalCentre(FrameStack) global
   * estimate}. Frames are processed in parallel.
   *
   * @param stack the stack
   * @param radius the radius of the search region
   * @return the beam positions in navigation order
   * @throws IllegalArgumentException if the radius is not strictly positive
   * @throws BeamNotConvergedException if a frame does not converge and the fallback option is
   *         disabled
   * @see #refineBeamPosition(ImageProcessor, int, int, double)
   */
  public Centre[] getDirectBeamPositions(FrameStack stack, double radius) {
    GeometryUtils.checkRadius(radius);
    final Centre seed = estimateGlobalCentre(stack);
    final int startX = (int) seed.getX();
    final int startY = (int) seed.getY();
    final boolean fallback = options.isFallbackToSeed();
    final Centre[] centres = mapper.map(stack, (index, frame) -> {
      try {
        return refineBeamPosition(frame, startX, startY, radius);
      } catch (final BeamNotConvergedException ex) {
        if (!fallback) {
          throw ex;
        }
        logger.log(Level.WARNING,
            () -> "Frame " + index + ": " + ex.getMessage() + ". Using global estimate " + seed);
        return seed;
      }
    }).toArray(new Centre[0]);
    logger.fine(() -> "Located the direct beam in " + centres.length + " frames");
    return centres;
  }

  /**
   * Gets the shift of the direct beam from the geometric centre of each frame of the stack.
   *
   * <p>If the beam positions are not provided they are computed using
   * {@link #getDirectBeamPositions(FrameStack, double)}.
   *
   * @param stack the stack
   * @param centres the beam positions (optional)
   * @param radius the radius of the search region (used if computing the positions)
   * @return the shifts in navigation order
   * @throws IllegalArgumentException if the number of positions does not match the navigation
   *         size
   * @see GeometryUtils#defaultCentre(int, int)
   */
  public Shift[] getDirectBeamShifts(FrameStack stack, Optional<Centre[]> centres,
      double radius) {
    final Centre[] positions;
    if (centres.isPresent()) {
      positions = checkCentres(centres.get(), stack);
    } else {
      positions = getDirectBeamPositions(stack, radius);
    }
    final Centre reference = GeometryUtils.defaultCentre(stack.getWidth(), stack.getHeight());
    final Shift[] shifts = new Shift[positions.length];
    for (int i = 0; i < shifts.length; i++) {
      shifts[i] = Shift.between(positions[i], reference);
    }
    return shifts;
  }

  /**
   * Check the number of beam positions matches the navigation size of the stack.
   *
   * @param centres the centres
   * @param stack the stack
   * @return the centres
   * @throws IllegalArgumentException if the number of positions does not match the navigation
   *         size
   */
  public static Centre[] checkCentres(Centre[] centres, FrameStack stack) {
    ValidationUtils.checkArgument(centres.length == stack.size(),
        "The number of centre positions provided (%d) must match the navigation size (%d)",
        centres.length, stack.size());
    return centres;
  }
}
