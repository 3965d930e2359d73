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
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;
import uk.ac.sussex.gdsc.diffraction.geometry.Shift;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class GeometricTransformerTest {
  @Test
  void checkInterpolationOrder() {
    Assertions.assertEquals(InterpolationOrder.NEAREST, InterpolationOrder.forOrder(0));
    Assertions.assertEquals(InterpolationOrder.LINEAR, InterpolationOrder.forOrder(1));
    Assertions.assertEquals(InterpolationOrder.CUBIC, InterpolationOrder.forOrder(3));
    Assertions.assertThrows(IllegalArgumentException.class, () -> InterpolationOrder.forOrder(2));
    Assertions.assertEquals(InterpolationOrder.CUBIC,
        new GeometricTransformer().getInterpolationOrder());
  }

  @Test
  void checkSampleOutsideIsZero() {
    final FloatProcessor fp = new FloatProcessor(3, 2, new float[] {1, 2, 3, 4, 5, 6});
    for (final InterpolationOrder order : InterpolationOrder.values()) {
      Assertions.assertEquals(0, GeometricTransformer.sample(fp, -0.01, 0, order));
      Assertions.assertEquals(0, GeometricTransformer.sample(fp, 2.01, 0, order));
      Assertions.assertEquals(0, GeometricTransformer.sample(fp, 1, 1.01, order));
      Assertions.assertEquals(0, GeometricTransformer.sample(fp, 1, Double.NaN, order));
      Assertions.assertEquals(6, GeometricTransformer.sample(fp, 2, 1, order));
      Assertions.assertEquals(1, GeometricTransformer.sample(fp, 0, 0, order));
      // Within tolerance of the edge
      Assertions.assertEquals(6, GeometricTransformer.sample(fp, 2 + 1e-10, 1 + 1e-10, order),
          1e-6);
      Assertions.assertEquals(1, GeometricTransformer.sample(fp, -1e-10, -1e-10, order), 1e-6);
    }
    Assertions.assertEquals(4,
        GeometricTransformer.sample(fp, 1.5, 0.5, InterpolationOrder.LINEAR));
    Assertions.assertEquals(5,
        GeometricTransformer.sample(fp, 1.4, 0.6, InterpolationOrder.NEAREST));
  }

  @Test
  void checkCubicUsesBicubicInInterior() {
    //@formatter:off
    final FloatProcessor fp = new FloatProcessor(5, 5, new float[] {
        0, 0, 0, 0, 0,
        0, 1, 2, 1, 0,
        0, 2, 8, 2, 0,
        0, 1, 2, 1, 0,
        0, 0, 0, 0, 0,
    });
    //@formatter:on
    final double x = 2.3;
    final double y = 1.6;
    final double cubic = GeometricTransformer.sample(fp, x, y, InterpolationOrder.CUBIC);
    Assertions.assertEquals(fp.getBicubicInterpolatedPixel(x, y, fp), cubic);
    Assertions.assertEquals(fp.getInterpolatedValue(x, y),
        GeometricTransformer.sample(fp, x, y, InterpolationOrder.LINEAR));
    Assertions.assertNotEquals(fp.getInterpolatedValue(x, y), cubic, 0.5);
    // Neighbours outside the frame use linear interpolation
    Assertions.assertEquals(fp.getInterpolatedValue(0.5, 2.5),
        GeometricTransformer.sample(fp, 0.5, 2.5, InterpolationOrder.CUBIC));
  }

  @SeededTest
  void checkIdentityIsExact(RandomSeed seed) {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final FloatProcessor fp = randomFrame(rng, 13, 10);
    for (final InterpolationOrder order : InterpolationOrder.values()) {
      final FloatProcessor out =
          GeometricTransformer.applyAffine(fp, AffineMatrices.identity(), order);
      Assertions.assertArrayEquals((float[]) fp.getPixels(), (float[]) out.getPixels(),
          order::toString);
    }
  }

  @ParameterizedTest
  @EnumSource(InterpolationOrder.class)
  void checkIntegerShiftIsExact(InterpolationOrder order) {
    final UniformRandomProvider rng = RngFactory.createWithFixedSeed();
    final int width = 12;
    final int height = 9;
    final FloatProcessor fp = randomFrame(rng, width, height);
    final GeometricTransformer transformer = new GeometricTransformer(new FrameMapper(1));
    transformer.setInterpolationOrder(order);
    final FrameStack out = transformer.shiftPatterns(FrameStack.of(fp),
        new Shift[] {new Shift(2, 1)});
    final FloatProcessor result = out.getFrame(0);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        final float expected = x + 2 < width && y + 1 < height ? fp.getf(x + 2, y + 1) : 0;
        Assertions.assertEquals(expected, result.getf(x, y));
      }
    }
  }

  @ParameterizedTest
  @EnumSource(value = InterpolationOrder.class, names = {"LINEAR", "CUBIC"})
  void checkSubPixelShiftOfRamp(InterpolationOrder order) {
    final int width = 16;
    final int height = 6;
    final FloatProcessor fp = new FloatProcessor(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        fp.setf(x, y, 2 * x + y);
      }
    }
    // Moving the pattern by -0.5 samples at x + 0.5
    final double[][] m = AffineMatrices.translation(-0.5, 0);
    final FloatProcessor out = GeometricTransformer.applyAffine(fp, m, order);
    for (int y = 0; y < height; y++) {
      // Interior pixels have all interpolation neighbours inside the frame
      for (int x = 1; x < width - 3; x++) {
        Assertions.assertEquals(2 * (x + 0.5) + y, out.getf(x, y), 1e-4);
      }
      // The last column samples outside
      Assertions.assertEquals(0, out.getf(width - 1, y));
    }
  }

  @ParameterizedTest
  @CsvSource({"LINEAR, 5", "CUBIC, 0.5"})
  void checkSubPixelShiftRoundTrip(InterpolationOrder order, double delta) {
    final int size = 40;
    final FloatProcessor fp = new FloatProcessor(size, size);
    for (int y = 0; y < size; y++) {
      for (int x = 0; x < size; x++) {
        final double dx = x - 19.6;
        final double dy = y - 20.2;
        fp.setf(x, y, (float) (100 * Math.exp(-(dx * dx + dy * dy) / 18)));
      }
    }
    final GeometricTransformer transformer = new GeometricTransformer(new FrameMapper(1));
    transformer.setInterpolationOrder(order);
    final Shift shift = new Shift(1.3, -0.7);
    final FrameStack moved = transformer.shiftPatterns(FrameStack.of(fp), new Shift[] {shift});
    Assertions.assertNotEquals(fp.getf(20, 20), moved.getFrame(0).getf(20, 20), 10);
    final FloatProcessor out =
        transformer.shiftPatterns(moved, new Shift[] {shift.negate()}).getFrame(0);
    // Linear interpolation smooths the peak on each pass
    final int margin = 4;
    for (int y = margin; y < size - margin; y++) {
      for (int x = margin; x < size - margin; x++) {
        Assertions.assertEquals(fp.getf(x, y), out.getf(x, y), delta, order::toString);
      }
    }
  }

  @Test
  void checkRotation90() {
    final int size = 8;
    final FloatProcessor fp = new FloatProcessor(size, size);
    for (int i = 0; i < fp.getPixelCount(); i++) {
      fp.setf(i, i + 1);
    }
    final GeometricTransformer transformer = new GeometricTransformer(new FrameMapper(1));
    transformer.setInterpolationOrder(InterpolationOrder.NEAREST);
    final FloatProcessor out = transformer.rotatePatterns(FrameStack.of(fp), 90).getFrame(0);
    // Rotation about (size/2, size/2): output (x, y) samples input (size - y, x)
    for (int y = 0; y < size; y++) {
      for (int x = 0; x < size; x++) {
        final float expected = y == 0 ? 0 : fp.getf(size - y, x);
        Assertions.assertEquals(expected, out.getf(x, y));
      }
    }
  }

  @Test
  void checkRotation360IsIdentity() {
    final FloatProcessor fp = randomFrame(RngFactory.createWithFixedSeed(), 9, 7);
    final GeometricTransformer transformer = new GeometricTransformer(new FrameMapper(1));
    transformer.setInterpolationOrder(InterpolationOrder.NEAREST);
    final FloatProcessor out = transformer.rotatePatterns(FrameStack.of(fp), 360).getFrame(0);
    Assertions.assertArrayEquals((float[]) fp.getPixels(), (float[]) out.getPixels());
  }

  @Test
  void canCorrectGeometricDistortion() {
    final FloatProcessor fp1 = randomFrame(RngFactory.createWithFixedSeed(), 8, 6);
    final FloatProcessor fp2 = randomFrame(RngFactory.createWithFixedSeed(), 8, 6);
    final FrameStack stack = FrameStack.of(2, 1, fp1, fp2);
    final GeometricTransformer transformer = new GeometricTransformer(new FrameMapper(2));
    final FrameStack out =
        transformer.correctGeometricDistortion(stack, AffineMatrices.identity());
    Assertions.assertEquals(2, out.getNavigationWidth());
    Assertions.assertEquals(1, out.getNavigationHeight());
    Assertions.assertArrayEquals((float[]) fp1.getPixels(), (float[]) out.getFrame(0).getPixels());
    Assertions.assertArrayEquals((float[]) fp2.getPixels(), (float[]) out.getFrame(1).getPixels());

    // Scaling by 2 about the centre: output (x, y) samples input (2 + x / 2, 1.5 + y / 2)
    final double[][] scale = {{2, 0, 0}, {0, 2, 0}, {0, 0, 1}};
    transformer.setInterpolationOrder(InterpolationOrder.LINEAR);
    final FloatProcessor scaled = transformer.correctGeometricDistortion(stack, scale).getFrame(0);
    Assertions.assertEquals(fp1.getf(3, 2), scaled.getf(2, 1), 1e-6);
    Assertions.assertEquals(fp1.getf(4, 3), scaled.getf(4, 3), 1e-6);
  }

  @Test
  void checkInvalidMatrixThrows() {
    final FrameStack stack = FrameStack.of(new FloatProcessor(5, 5));
    final GeometricTransformer transformer = new GeometricTransformer();
    Assertions.assertThrows(IllegalArgumentException.class, () -> transformer
        .correctGeometricDistortion(stack, new double[][] {{1, 0, 0}, {2, 0, 0}, {0, 0, 1}}));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> transformer.correctGeometricDistortion(stack, new double[][] {{1, 0}, {0, 1}}));
    Assertions.assertThrows(IllegalArgumentException.class, () -> transformer
        .correctGeometricDistortion(stack, new double[][] {{1, 0, 0}, {0, 1, 0}, {0, 0}}));
    final double[][] nonFinite = {{1, 0, 0}, {0, Double.NaN, 0}, {0, 0, 1}};
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> transformer.correctGeometricDistortion(stack, nonFinite));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> transformer.rotatePatterns(stack, Double.POSITIVE_INFINITY));
  }

  @Test
  void checkShiftCountMismatchThrows() {
    final FrameStack stack =
        FrameStack.of(new FloatProcessor(5, 5), new FloatProcessor(5, 5));
    final GeometricTransformer transformer = new GeometricTransformer();
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> transformer.shiftPatterns(stack, new Shift[] {new Shift(0, 0)}));
  }

  private static FloatProcessor randomFrame(UniformRandomProvider rng, int width, int height) {
    final float[] pixels = new float[width * height];
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = rng.nextFloat();
    }
    return new FloatProcessor(width, height, pixels);
  }
}
