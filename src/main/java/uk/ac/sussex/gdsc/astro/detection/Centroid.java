/*-
 * #%L
 * Genome Damage and Stability Centre ImageJ Plugins
 *
 * Software for microscopy image analysis
 * %%
 * Copyright (C) 2011 - 2020 Alex Herbert
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

package uk.ac.sussex.gdsc.astro.detection;

/**
 * The sub-pixel centre of a detected source. Pixel centres are at integer coordinates.
 *
 * <p>Centroids are ordered by ascending y then x.
 */
public final class Centroid implements Comparable<Centroid> {
  private final double x;
  private final double y;

  /**
   * Create a new instance.
   *
   * @param x the x
   * @param y the y
   */
  public Centroid(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /**
   * Gets the x coordinate.
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y coordinate.
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the x pixel index (the coordinate truncated to the pixel).
   *
   * @return the x index
   */
  public int getXpixel() {
    return (int) Math.floor(x);
  }

  /**
   * Gets the y pixel index (the coordinate truncated to the pixel).
   *
   * @return the y index
   */
  public int getYpixel() {
    return (int) Math.floor(y);
  }

  /**
   * Get the Euclidean distance to the point.
   *
   * @param px the x coordinate
   * @param py the y coordinate
   * @return the distance
   */
  public double distance(double px, double py) {
    final double dx = x - px;
    final double dy = y - py;
    return Math.sqrt(dx * dx + dy * dy);
  }

  @Override
  public int compareTo(Centroid other) {
    final int result = Double.compare(y, other.y);
    return result == 0 ? Double.compare(x, other.x) : result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Centroid)) {
      return false;
    }
    final Centroid other = (Centroid) obj;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + "," + y + ")";
  }
}
