package org.javai.planning.model;

/**
 * A point or vector in a Cartesian frame.
 */
public record Point(double x, double y, double z) {

	public static final Point ORIGIN = new Point(0.0, 0.0, 0.0);
}
