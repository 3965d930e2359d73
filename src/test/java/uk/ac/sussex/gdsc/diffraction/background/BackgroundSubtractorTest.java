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
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import uk.ac.sussex.gdsc.diffraction.FrameMapper;
import uk.ac.sussex.gdsc.diffraction.FrameStack;
import uk.ac.sussex.gdsc.test.junit5.SeededTest;
import uk.ac.sussex.gdsc.test.rng.RngFactory;
import uk.ac.sussex.gdsc.test.utils.RandomSeed;

@SuppressWarnings({"javadoc"})
class BackgroundSubtractorTest {
  @Test
  void checkMeanFilter3x3() {
    final FloatProcessor fp = new FloatProcessor(3, 3, new float[] {1, 2, 3, 4, 5, 6, 7, 8, 9});
    final float[] out = (float[]) BackgroundSubtractor.meanFilter3x3(fp).getPixels();
    // Corners use 4 pixels, edges 6 and the centre 9
    Assertions.assertEquals((1 + 2 + 4 + 5) / 4f, out[0]);
    Assertions.assertEquals((1 + 2 + 3 + 4 + 5 + 6) / 6f, out[1]);
    Assertions.assertEquals(5, out[4]);
    Assertions.assertEquals((5 + 6 + 8 + 9) / 4f, out[8]);
  }

  @Test
  void checkMeanFilterUsesInBoundsNeighbours() {
    //@formatter:off
    final FloatProcessor fp = new FloatProcessor(3, 3, new float[] {
        9, 0, 0,
        0, 0, 0,
        0, 0, 0,
    });
    //@formatter:on
    final FloatProcessor out = BackgroundSubtractor.meanFilter3x3(fp);
    // Padding with the edge values would count the corner 4 times (4) and twice beside it (2)
    Assertions.assertEquals(9 / 4f, out.getf(0, 0));
    Assertions.assertEquals(9 / 6f, out.getf(1, 0));
    Assertions.assertEquals(9 / 6f, out.getf(0, 1));
    Assertions.assertEquals(1, out.getf(1, 1));
    Assertions.assertEquals(0, out.getf(2, 2));
  }

  @Test
  void checkMeanFilterSinglePixel() {
    final FloatProcessor fp = new FloatProcessor(1, 1, new float[] {3});
    Assertions.assertEquals(3, BackgroundSubtractor.meanFilter3x3(fp).getf(0));
  }

  @Test
  void checkHDomeOfSinglePeak() {
    final FloatProcessor fp = new FloatProcessor(7, 7);
    fp.set(2);
    fp.setf(3, 3, 10);
    fp.setf(4, 3, 4);
    final FloatProcessor dome = BackgroundSubtractor.subtractReconstruction(fp, 5);
    // The peak rises by 8 above the background: the top 5 is retained
    Assertions.assertEquals(5, dome.getf(3, 3));
    // Lower shoulder is below the cut
    Assertions.assertEquals(0, dome.getf(4, 3));
    // Background connected to the peak is fully reconstructed
    Assertions.assertEquals(0, dome.getf(0, 0));
  }

  @SeededTest
  void checkOutputIsNormalised(RandomSeed seed) {
    final UniformRandomProvider rng = RngFactory.create(seed.get());
    final FloatProcessor[] frames = new FloatProcessor[4];
    for (int i = 0; i < frames.length; i++) {
      final FloatProcessor fp = new FloatProcessor(16, 12);
      for (int j = 0; j < fp.getPixelCount(); j++) {
        fp.setf(j, 10 + rng.nextFloat());
      }
      fp.setf(3 + i, 4, 200);
      frames[i] = fp;
    }
    final FrameStack stack = FrameStack.of(2, 2, frames);
    // h is relative to the normalised intensity
    final FrameStack out =
        new BackgroundSubtractor(new FrameMapper(2)).removeBackground(stack, 0.1);
    Assertions.assertEquals(2, out.getNavigationWidth());
    Assertions.assertEquals(2, out.getNavigationHeight());
    Assertions.assertEquals(1f, out.max());
    for (int i = 0; i < frames.length; i++) {
      final FloatProcessor fp = out.getFrame(i);
      int maxIndex = 0;
      for (int j = 0; j < fp.getPixelCount(); j++) {
        Assertions.assertTrue(fp.getf(j) >= 0);
        if (fp.getf(j) > fp.getf(maxIndex)) {
          maxIndex = j;
        }
      }
      // The smoothed peak holds the maximum of each frame
      final int x = maxIndex % fp.getWidth();
      final int y = maxIndex / fp.getWidth();
      Assertions.assertTrue(Math.abs(x - (3 + i)) <= 1 && Math.abs(y - 4) <= 1,
          () -> "maximum at " + x + "," + y);
    }
    // Input is not modified
    Assertions.assertEquals(200, frames[0].getf(3, 4));
  }

  @Test
  void checkZeroHeightRemovesAllSignal() {
    final FloatProcessor fp = new FloatProcessor(5, 4);
    for (int i = 0; i < fp.getPixelCount(); i++) {
      fp.setf(i, i % 3);
    }
    final FrameStack out = new BackgroundSubtractor(new FrameMapper(1))
        .removeBackground(FrameStack.of(fp), 0);
    for (final float value : (float[]) out.getFrame(0).getPixels()) {
      Assertions.assertEquals(0, value);
    }
  }

  @Test
  void checkInvalidHeightThrows() {
    final FrameStack stack = FrameStack.of(new FloatProcessor(3, 3));
    final BackgroundSubtractor subtractor = new BackgroundSubtractor();
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> subtractor.removeBackground(stack, -1));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> subtractor.removeBackground(stack, Double.NaN));
  }
}
