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
import java.util.Arrays;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class GreyscaleReconstructionTest {
  // To allow pixel array layouts to be custom formatted
  //@formatter:off

  @Test
  void checkSeedFillsConnectedPlateau() {
    assertReconstruction(
        5, 3,
        new float[] {0, 0, 0, 0, 0,
                     0, 0, 0, 0, 0,
                     0, 0, 0, 0, 3},
        new float[] {5, 5, 0, 4, 4,
                     5, 5, 0, 4, 4,
                     5, 5, 0, 4, 4},
        new float[] {0, 0, 0, 3, 3,
                     0, 0, 0, 3, 3,
                     0, 0, 0, 3, 3}
    );
  }

  @Test
  void checkDiagonalConnectivity() {
    assertReconstruction(
        3, 3,
        new float[] {2, 0, 0,
                     0, 0, 0,
                     0, 0, 0},
        new float[] {2, 0, 0,
                     0, 2, 0,
                     0, 0, 2},
        new float[] {2, 0, 0,
                     0, 2, 0,
                     0, 0, 2}
    );
  }

  @Test
  void checkPropagationAgainstScanDirection() {
    // A spiral path requires multiple raster/anti-raster passes
    assertReconstruction(
        5, 5,
        new float[] {0, 0, 0, 0, 0,
                     0, 0, 0, 0, 0,
                     0, 0, 1, 0, 0,
                     0, 0, 0, 0, 0,
                     0, 0, 0, 0, 0},
        new float[] {1, 1, 1, 1, 1,
                     1, 0, 0, 0, 0,
                     1, 0, 1, 1, 0,
                     1, 0, 0, 1, 0,
                     1, 1, 1, 1, 0},
        new float[] {1, 1, 1, 1, 1,
                     1, 0, 0, 0, 0,
                     1, 0, 1, 1, 0,
                     1, 0, 0, 1, 0,
                     1, 1, 1, 1, 0}
    );
  }

  //@formatter:on

  @SeededTest
  void checkMatchesIterativeDilation(RandomSeed seed) {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    for (int n = 0; n < 5; n++) {
      final int width = 5 + rng.nextInt(20);
      final int height = 5 + rng.nextInt(20);
      final float[] mask = new float[width * height];
      final float[] marker = new float[mask.length];
      for (int i = 0; i < mask.length; i++) {
        mask[i] = rng.nextFloat();
        marker[i] = mask[i] - 0.25f;
      }
      final FloatProcessor result = GreyscaleReconstruction.reconstructByDilation(
          new FloatProcessor(width, height, marker), new FloatProcessor(width, height, mask));
      final float[] expected = iterativeReconstruction(marker, mask, width, height);
      Assertions.assertArrayEquals(expected, (float[]) result.getPixels());
    }
  }

  @Test
  void checkInputsAreNotModified() {
    final float[] mask = {1, 2, 3, 4};
    final float[] marker = {0, 0, 0, 4};
    GreyscaleReconstruction.reconstructByDilation(new FloatProcessor(2, 2, marker),
        new FloatProcessor(2, 2, mask));
    Assertions.assertArrayEquals(new float[] {1, 2, 3, 4}, mask);
    Assertions.assertArrayEquals(new float[] {0, 0, 0, 4}, marker);
  }

  @Test
  void checkInvalidInputThrows() {
    final FloatProcessor mask = new FloatProcessor(3, 3);
    final FloatProcessor marker = new FloatProcessor(3, 3);
    marker.setf(4, 1);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> GreyscaleReconstruction.reconstructByDilation(marker, mask));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> GreyscaleReconstruction.reconstructByDilation(new FloatProcessor(3, 2), mask));
  }

  private static void assertReconstruction(int width, int height, float[] marker, float[] mask,
      float[] expected) {
    final FloatProcessor result = GreyscaleReconstruction.reconstructByDilation(
        new FloatProcessor(width, height, marker), new FloatProcessor(width, height, mask));
    Assertions.assertArrayEquals(expected, (float[]) result.getPixels());
    Assertions.assertArrayEquals(expected, iterativeReconstruction(marker, mask, width, height));
  }

  /**
   * Reconstruction by repeated 3x3 dilation clipped to the mask until stable.
   */
  private static float[] iterativeReconstruction(float[] marker, float[] mask, int width,
      int height) {
    float[] current = marker.clone();
    for (;;) {
      final float[] next = new float[current.length];
      for (int y = 0; y < height; y++) {
        for (int x = 0; x < width; x++) {
          float max = Float.NEGATIVE_INFINITY;
          for (int yy = Math.max(0, y - 1); yy <= Math.min(height - 1, y + 1); yy++) {
            for (int xx = Math.max(0, x - 1); xx <= Math.min(width - 1, x + 1); xx++) {
              max = Math.max(max, current[yy * width + xx]);
            }
          }
          final int i = y * width + x;
          next[i] = Math.min(max, mask[i]);
        }
      }
      if (Arrays.equals(next, current)) {
        return next;
      }
      current = next;
    }
  }
}
