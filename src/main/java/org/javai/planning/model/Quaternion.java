package org.javai.planning.model;

public record Quaternion(double x, double y, double z, double w) {

	public static final Quaternion IDENTITY = new Quaternion(0.0, 0.0, 0.0, 1.0);
}
