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

import ij.process.ImageProcessor;
import java.util.Optional;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.annotation.Nullable;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;
import uk.ac.sussex.gdsc.diffraction.beam.CentreFinder;
import uk.ac.sussex.gdsc.diffraction.geometry.Centre;
import uk.ac.sussex.gdsc.diffraction.geometry.GeometryUtils;

/**
 * Reduce diffraction frames to rotationally averaged radial intensity profiles.
 */
public class RadialProfiler {
  /** The radius of the beam search used when the profile centres are not provided. */
  public static final double DEFAULT_SEARCH_RADIUS = 10;

  /** The frame mapper. */
  private final FrameMapper mapper;
  /** The centre finder used when the profile centres are not provided. */
  private final CentreFinder centreFinder;
  /** The logger. */
  private Logger logger = Logger.getLogger(RadialProfiler.class.getName());

  /**
   * Create a new instance with default settings.
   */
  public RadialProfiler() {
    this(new FrameMapper());
  }

  /**
   * Create a new instance.
   *
   * @param mapper the mapper used to process the frames of a stack
   */
  public RadialProfiler(FrameMapper mapper) {
    this(mapper, new CentreFinder(new CentreFinder.Options(), mapper));
  }

  /**
   * Create a new instance.
   *
   * @param mapper the mapper used to process the frames of a stack
   * @param centreFinder the centre finder used when the profile centres are not provided
   */
  public RadialProfiler(FrameMapper mapper, CentreFinder centreFinder) {
    this.mapper = ValidationUtils.checkNotNull(mapper, "mapper");
    this.centreFinder = ValidationUtils.checkNotNull(centreFinder, "centreFinder");
  }

  /**
   * Sets the logger.
   *
   * @param logger the new logger
   */
  public void setLogger(@Nullable Logger logger) {
    this.logger = logger == null ? Logger.getLogger(RadialProfiler.class.getName()) : logger;
  }

  /**
   * Compute the radial average of the frame around the centre.
   *
   * <p>Each pixel is assigned to the bin of its Euclidean distance from the centre truncated to
   * an integer. The profile has a bin for each radius from zero to the maximum. Bins with no
   * pixels are NaN.
   *
   * @param frame the frame
   * @param centre the centre
   * @return the radial profile
   * @throws IllegalArgumentException if the centre is outside the frame
   */
  public static RadialProfile radialAverage(ImageProcessor frame, Centre centre) {
    final int width = frame.getWidth();
    final int height = frame.getHeight();
    GeometryUtils.checkCentre(centre, width, height);
    final double cx = centre.getX();
    final double cy = centre.getY();

    // The furthest pixel is a corner
    final int maxR = (int) Math.max(
        Math.max(distance(0 - cx, 0 - cy), distance(width - 1 - cx, 0 - cy)),
        Math.max(distance(0 - cx, height - 1 - cy), distance(width - 1 - cx, height - 1 - cy)));

    final double[] sum = new double[maxR + 1];
    final int[] count = new int[maxR + 1];
    for (int y = 0, i = 0; y < height; y++) {
      final double dy = y - cy;
      for (int x = 0; x < width; x++, i++) {
        // Truncation toward zero
        final int r = (int) distance(x - cx, dy);
        sum[r] += frame.getf(i);
        count[r]++;
      }
    }

    final double[] values = new double[sum.length];
    for (int r = 0; r < values.length; r++) {
      values[r] = count[r] == 0 ? Double.NaN : sum[r] / count[r];
    }
    return new RadialProfile(centre, values, count);
  }

  private static double distance(double dx, double dy) {
    return Math.sqrt(dx * dx + dy * dy);
  }

  /**
   * Compute the radial profile of each frame in the stack using the centre of each frame.
   *
   * <p>If the centres are not provided they are computed using
   * {@link CentreFinder#getDirectBeamPositions(FrameStack, double)} with a radius of
   * {@value #DEFAULT_SEARCH_RADIUS}.
   *
   * <p>Profiles may have different lengths.
   *
   * @param stack the stack
   * @param centres the centres (optional)
   * @return the radial profiles in navigation order
   * @throws IllegalArgumentException if the number of centres does not match the navigation
   *         size, or a centre is outside the frame
   */
  public RadialProfile[] getRadialProfiles(FrameStack stack, Optional<Centre[]> centres) {
    final Centre[] c = centres.isPresent() ? CentreFinder.checkCentres(centres.get(), stack)
        : centreFinder.getDirectBeamPositions(stack, DEFAULT_SEARCH_RADIUS);
    // Validate all centres before any per-frame work
    for (final Centre centre : c) {
      GeometryUtils.checkCentre(centre, stack.getWidth(), stack.getHeight());
    }
    final RadialProfile[] profiles = mapper.map(stack, (index, frame) -> radialAverage(frame,
        c[index])).toArray(new RadialProfile[0]);
    logger.fine(() -> "Computed " + profiles.length + " radial profiles");
    return profiles;
  }
}
