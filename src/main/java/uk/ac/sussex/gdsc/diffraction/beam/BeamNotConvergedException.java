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

import uk.ac.sussex.gdsc.core.data.ComputationException;
import uk.ac.sussex.gdsc.diffraction.geometry.Centre;

/**
 * Exception thrown when the iterative search for the direct beam does not reach a local maximum.
 */
public class BeamNotConvergedException extends ComputationException {
  private static final long serialVersionUID = 20220315L;

  /** The x position of the last search centre. */
  private final int lastX;
  /** The y position of the last search centre. */
  private final int lastY;
  /** The number of moves performed. */
  private final int iterations;

  /**
   * Create a new instance.
   *
   * @param message the message
   * @param lastX the x position of the last search centre
   * @param lastY the y position of the last search centre
   * @param iterations the number of moves performed
   */
  public BeamNotConvergedException(String message, int lastX, int lastY, int iterations) {
    super(message);
    this.lastX = lastX;
    this.lastY = lastY;
    this.iterations = iterations;
  }

  /**
   * Gets the last search centre.
   *
   * @return the last centre
   */
  public Centre getLastCentre() {
    return new Centre(lastX, lastY);
  }

  /**
   * Gets the number of moves performed before the search stopped.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }
}
