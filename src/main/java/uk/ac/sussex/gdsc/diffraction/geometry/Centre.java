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
 * A position in the coordinate system of a frame.
 *
 * <p>The x coordinate is the column and the y coordinate is the row. Pixel {@code (x, y)} is
 * centred on the integer coordinates.
 */
public final class Centre {
  /** The x coordinate (column). */
  private final double x;
  /** The y coordinate (row). */
  private final double y;

  /**
   * Create a new instance.
   *
   * @param x the x coordinate (column)
   * @param y the y coordinate (row)
   */
  public Centre(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /**
   * Create a new instance from the row and column.
   *
   * @param row the row
   * @param column the column
   * @return the centre
   */
  public static Centre ofRowColumn(double row, double column) {
    return new Centre(column, row);
  }

  /**
   * Gets the x coordinate (column).
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y coordinate (row).
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the row.
   *
   * @return the row
   */
  public double getRow() {
    return y;
  }

  /**
   * Gets the column.
   *
   * @return the column
   */
  public double getColumn() {
    return x;
  }

  /**
   * Round to the nearest pixel. Halfway cases round to the even integer.
   *
   * @return the rounded centre
   */
  public Centre round() {
    return new Centre(Math.rint(x), Math.rint(y));
  }

  /**
   * Checks if both coordinates are finite.
   *
   * @return true if finite
   */
  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Centre)) {
      return false;
    }
    final Centre other = (Centre) obj;
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
