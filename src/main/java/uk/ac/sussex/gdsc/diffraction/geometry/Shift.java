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

package uk.ac.sussex.gdsc.diffraction.geometry;

/**
 * The offset of a beam centre from a reference position, used to re-register frames.
 */
public final class Shift {
  /** The x shift. */
  private final double x;
  /** The y shift. */
  private final double y;

  /**
   * Create a new instance.
   *
   * @param x the x shift
   * @param y the y shift
   */
  public Shift(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /**
   * Compute the shift of the position from the reference: {@code position - reference}.
   *
   * @param position the position
   * @param reference the reference
   * @return the shift
   */
  public static Shift between(Centre position, Centre reference) {
    return new Shift(position.getX() - reference.getX(), position.getY() - reference.getY());
  }

  /**
   * Gets the x shift.
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y shift.
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Create the shift in the opposite direction.
   *
   * @return the shift
   */
  public Shift negate() {
    return new Shift(-x, -y);
  }

  /**
   * Apply the shift to the position.
   *
   * @param position the position
   * @return the shifted position
   */
  public Centre apply(Centre position) {
    return new Centre(position.getX() + x, position.getY() + y);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Shift)) {
      return false;
    }
    final Shift other = (Shift) obj;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
