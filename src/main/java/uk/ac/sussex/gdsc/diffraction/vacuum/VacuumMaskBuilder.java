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

import ij.process.FloatProcessor;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.annotation.Nullable;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;
import uk.ac.sussex.gdsc.diffraction.geometry.Centre;
import uk.ac.sussex.gdsc.diffraction.geometry.CircularMask;
import uk.ac.sussex.gdsc.diffraction.geometry.GeometryUtils;

/**
 * Identify frames of a stack that contain no signal outside the direct beam.
 *
 * <p>The direct beam is excluded from each frame using a circular mask. A frame is vacuum if its
 * maximum outside the beam is at or below a threshold. The result can be cleaned using binary
 * morphology in navigation space.
 */
public class VacuumMaskBuilder {
  /** The frame mapper. */
  private final FrameMapper mapper;
  /** The logger. */
  private Logger logger = Logger.getLogger(VacuumMaskBuilder.class.getName());

  /**
   * Create a new instance with default settings.
   */
  public VacuumMaskBuilder() {
    this(new FrameMapper());
  }

  /**
   * Create a new instance.
   *
   * @param mapper the mapper used to process the frames of a stack
   */
  public VacuumMaskBuilder(FrameMapper mapper) {
    this.mapper = ValidationUtils.checkNotNull(mapper, "mapper");
  }

  /**
   * Sets the logger.
   *
   * @param logger the new logger
   */
  public void setLogger(@Nullable Logger logger) {
    this.logger = logger == null ? Logger.getLogger(VacuumMaskBuilder.class.getName()) : logger;
  }

  /**
   * Gets a mask of the direct beam. If the centre is not present the geometric centre of the
   * frame is used.
   *
   * @param width the frame width
   * @param height the frame height
   * @param radius the beam radius
   * @param centre the beam centre (optional)
   * @return the direct beam mask
   * @throws IllegalArgumentException if the radius is not strictly positive or the centre is
   *         outside the frame
   * @see GeometryUtils#buildCircularMask(int, int, double, Optional)
   */
  public static CircularMask getDirectBeamMask(int width, int height, double radius,
      Optional<Centre> centre) {
    return GeometryUtils.buildCircularMask(width, height, radius, centre);
  }

  /**
   * Gets the vacuum mask of the stack.
   *
   * <p>Closing fills isolated non-vacuum positions inside vacuum regions. Opening removes isolated
   * vacuum positions. If both are requested closing is applied first.
   *
   * @param stack the stack
   * @param radius the direct beam radius
   * @param centre the direct beam centre (optional)
   * @param threshold the maximum intensity outside the beam for a vacuum frame
   * @param closing set to true to apply a binary closing
   * @param opening set to true to apply a binary opening
   * @return the vacuum mask
   * @throws IllegalArgumentException if the radius is not strictly positive or the centre is
   *         outside the frame
   */
  public VacuumMask getVacuumMask(FrameStack stack, double radius, Optional<Centre> centre,
      double threshold, boolean closing, boolean opening) {
    final CircularMask outsideBeam =
        getDirectBeamMask(stack.getWidth(), stack.getHeight(), radius, centre).invert();

    final List<Float> max = mapper.map(stack, (index, frame) -> max(outsideBeam.apply(frame)));
    final boolean[] vacuum = new boolean[max.size()];
    for (int i = 0; i < vacuum.length; i++) {
      vacuum[i] = max.get(i) <= threshold;
    }

    boolean[] result = vacuum;
    final int width = stack.getNavigationWidth();
    final int height = stack.getNavigationHeight();
    if (closing) {
      result = BinaryMorphology.close(result, width, height);
    }
    if (opening) {
      result = BinaryMorphology.open(result, width, height);
    }
    final VacuumMask mask = new VacuumMask(width, height, result);
    logger.fine(() -> "Identified " + mask.count() + " / " + mask.size() + " vacuum frames");
    return mask;
  }

  /**
   * Find the maximum of the masked frame. The frame is zero outside the mask. NaN values are
   * ignored.
   *
   * @param frame the masked frame
   * @return the maximum
   */
  private static float max(FloatProcessor frame) {
    float max = Float.NEGATIVE_INFINITY;
    for (final float value : (float[]) frame.getPixels()) {
      if (max < value) {
        max = value;
      }
    }
    return max;
  }
}
