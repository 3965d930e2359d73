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

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import uk.ac.sussex.gdsc.core.annotation.Nullable;
import uk.ac.sussex.gdsc.core.data.VisibleForTesting;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;
import uk.ac.sussex.gdsc.diffraction.beam.CentreFinder;
import uk.ac.sussex.gdsc.diffraction.geometry.Centre;
import uk.ac.sussex.gdsc.diffraction.geometry.GeometryUtils;
import uk.ac.sussex.gdsc.diffraction.geometry.Shift;

/**
 * Apply affine transforms to diffraction frames to correct geometric distortion, rotate and
 * align patterns.
 *
 * <p>Transforms are applied about the centre of the frame extent {@code (width / 2, height / 2)}.
 * Output pixels that map outside the source frame are zero.
 */
public class GeometricTransformer {
  /** Tolerance for sample positions at the frame edge. */
  private static final double EDGE_TOLERANCE = 1e-9;

  /** The frame mapper. */
  private final FrameMapper mapper;
  /** The interpolation. */
  private InterpolationOrder interpolationOrder = InterpolationOrder.CUBIC;
  /** The logger. */
  private Logger logger = Logger.getLogger(GeometricTransformer.class.getName());

  /**
   * Create a new instance with default settings.
   */
  public GeometricTransformer() {
    this(new FrameMapper());
  }

  /**
   * Create a new instance.
   *
   * @param mapper the mapper used to process the frames of a stack
   */
  public GeometricTransformer(FrameMapper mapper) {
    this.mapper = ValidationUtils.checkNotNull(mapper, "mapper");
  }

  /**
   * Gets the interpolation order. The default is {@link InterpolationOrder#CUBIC}.
   *
   * @return the interpolation order
   */
  public InterpolationOrder getInterpolationOrder() {
    return interpolationOrder;
  }

  /**
   * Sets the interpolation order.
   *
   * @param interpolationOrder the new interpolation order
   */
  public void setInterpolationOrder(InterpolationOrder interpolationOrder) {
    this.interpolationOrder =
        ValidationUtils.checkNotNull(interpolationOrder, "interpolationOrder");
  }

  /**
   * Sets the logger.
   *
   * @param logger the new logger
   */
  public void setLogger(@Nullable Logger logger) {
    this.logger =
        logger == null ? Logger.getLogger(GeometricTransformer.class.getName()) : logger;
  }

  /**
   * Apply an affine transform to the frame.
   *
   * <p>The composite transform translates the centre of the frame extent to the origin, applies
   * the matrix and translates back. Each output pixel is sampled from the input at the inverse
   * of the composite transform.
   *
   * @param frame the frame
   * @param matrix the 3x3 matrix for homogeneous coordinates {@code (x, y, 1)}
   * @param order the interpolation order
   * @return the transformed frame
   * @throws IllegalArgumentException if the matrix is not a finite invertible 3x3 matrix
   */
  public static FloatProcessor applyAffine(ImageProcessor frame, double[][] matrix,
      InterpolationOrder order) {
    return applyInverse(frame, createInverseTransform(frame.getWidth(), frame.getHeight(), matrix),
        order);
  }

  /**
   * Create the inverse of the composite transform of the matrix about the centre of the frame
   * extent.
   *
   * @param width the width
   * @param height the height
   * @param matrix the matrix
   * @return the inverse transform
   * @throws IllegalArgumentException if the matrix is not a finite invertible 3x3 matrix
   */
  @VisibleForTesting
  static double[][] createInverseTransform(int width, int height, double[][] matrix) {
    AffineMatrices.checkMatrix(matrix);
    final Centre c = GeometryUtils.transformCentre(width, height);
    final RealMatrix toOrigin =
        MatrixUtils.createRealMatrix(AffineMatrices.translation(-c.getX(), -c.getY()));
    final RealMatrix fromOrigin =
        MatrixUtils.createRealMatrix(AffineMatrices.translation(c.getX(), c.getY()));
    final RealMatrix inverse;
    try {
      inverse = MatrixUtils.inverse(MatrixUtils.createRealMatrix(matrix));
    } catch (final SingularMatrixException ex) {
      throw new IllegalArgumentException("Matrix is not invertible", ex);
    }
    // (fromOrigin * A * toOrigin)^-1 = fromOrigin * A^-1 * toOrigin
    return fromOrigin.multiply(inverse).multiply(toOrigin).getData();
  }

  /**
   * Resample the frame. Each output pixel is sampled from the input at the position given by the
   * inverse transform.
   *
   * @param frame the frame
   * @param inverse the inverse transform
   * @param order the interpolation order
   * @return the transformed frame
   */
  private static FloatProcessor applyInverse(ImageProcessor frame, double[][] inverse,
      InterpolationOrder order) {
    final int width = frame.getWidth();
    final int height = frame.getHeight();
    final FloatProcessor source = toFloat(frame);
    final float[] pixels = new float[width * height];
    final double[] r0 = inverse[0];
    final double[] r1 = inverse[1];
    final double[] r2 = inverse[2];
    for (int y = 0, i = 0; y < height; y++) {
      for (int x = 0; x < width; x++, i++) {
        double sx = r0[0] * x + r0[1] * y + r0[2];
        double sy = r1[0] * x + r1[1] * y + r1[2];
        final double w = r2[0] * x + r2[1] * y + r2[2];
        if (w != 1) {
          sx /= w;
          sy /= w;
        }
        pixels[i] = (float) sample(source, sx, sy, order);
      }
    }
    return new FloatProcessor(width, height, pixels);
  }

  private static FloatProcessor toFloat(ImageProcessor frame) {
    if (frame instanceof FloatProcessor) {
      return (FloatProcessor) frame;
    }
    return frame.convertToFloatProcessor();
  }

  /**
   * Sample the image at the position. Positions outside the image return zero.
   *
   * <p>Interpolation uses the ImageJ processor methods. The interpolation method of the processor
   * is not changed as frames are shared between threads. Linear interpolation clamps neighbours
   * outside the image to the edge. Cubic interpolation uses the ImageJ Catmull-Rom kernel where
   * all 4x4 neighbours are inside the image, otherwise linear interpolation.
   *
   * @param fp the image
   * @param x the x position
   * @param y the y position
   * @param order the interpolation order
   * @return the value
   */
  @VisibleForTesting
  static double sample(FloatProcessor fp, double x, double y, InterpolationOrder order) {
    final int width = fp.getWidth();
    final int height = fp.getHeight();
    if (!(x >= -EDGE_TOLERANCE && x <= width - 1 + EDGE_TOLERANCE && y >= -EDGE_TOLERANCE
        && y <= height - 1 + EDGE_TOLERANCE)) {
      return 0;
    }
    switch (order) {
      case NEAREST:
        // Same rounding as ImageProcessor.rotate with no interpolation
        return fp.getPixelValue(Math.min((int) (x + 0.5), width - 1),
            Math.min((int) (y + 0.5), height - 1));
      case LINEAR:
        return fp.getInterpolatedValue(x, y);
      case CUBIC:
      default:
        final int u0 = (int) Math.floor(x);
        final int v0 = (int) Math.floor(y);
        if (u0 > 0 && v0 > 0 && u0 < width - 2 && v0 < height - 2) {
          return fp.getBicubicInterpolatedPixel(x, y, fp);
        }
        return fp.getInterpolatedValue(x, y);
    }
  }

  /**
   * Rotate every frame of the stack about the centre of the frame extent.
   *
   * @param stack the stack
   * @param angleDegrees the angle in degrees (counter-clockwise positive)
   * @return the rotated stack
   * @see AffineMatrices#rotation(double)
   */
  public FrameStack rotatePatterns(FrameStack stack, double angleDegrees) {
    logger.fine(() -> "Rotating " + stack.size() + " patterns by " + angleDegrees + " degrees");
    return transform(stack, AffineMatrices.rotation(angleDegrees));
  }

  /**
   * Apply the affine transform to every frame of the stack to correct geometric distortion.
   *
   * @param stack the stack
   * @param matrix the 3x3 matrix
   * @return the corrected stack
   * @throws IllegalArgumentException if the matrix is not a finite invertible 3x3 matrix
   */
  public FrameStack correctGeometricDistortion(FrameStack stack, double[][] matrix) {
    logger.fine(() -> "Correcting geometric distortion in " + stack.size() + " patterns");
    return transform(stack, matrix);
  }

  private FrameStack transform(FrameStack stack, double[][] matrix) {
    // Validate before any per-frame work
    final double[][] inverse =
        createInverseTransform(stack.getWidth(), stack.getHeight(), matrix);
    final InterpolationOrder order = interpolationOrder;
    return mapper.mapFrames(stack, (index, frame) -> applyInverse(frame, inverse, order));
  }

  /**
   * Translate every frame of the stack by the negative of its shift. This moves the direct beam
   * at {@code centre + shift} to the centre.
   *
   * @param stack the stack
   * @param shifts the shifts
   * @return the aligned stack
   * @throws IllegalArgumentException if the number of shifts does not match the navigation size
   * @see CentreFinder#getDirectBeamShifts(FrameStack, java.util.Optional, double)
   */
  public FrameStack shiftPatterns(FrameStack stack, Shift[] shifts) {
    ValidationUtils.checkArgument(shifts.length == stack.size(),
        "The number of shifts provided (%d) must match the navigation size (%d)", shifts.length,
        stack.size());
    final int width = stack.getWidth();
    final int height = stack.getHeight();
    final double[][][] inverse = new double[shifts.length][][];
    for (int i = 0; i < shifts.length; i++) {
      inverse[i] = createInverseTransform(width, height,
          AffineMatrices.translation(-shifts[i].getX(), -shifts[i].getY()));
    }
    final InterpolationOrder order = interpolationOrder;
    logger.fine(() -> "Aligning " + stack.size() + " patterns");
    return mapper.mapFrames(stack, (index, frame) -> applyInverse(frame, inverse[index], order));
  }
}
