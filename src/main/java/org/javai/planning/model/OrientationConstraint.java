package org.javai.planning.model;

public record OrientationConstraint(String linkName, String frameId, Quaternion orientation,
		double absoluteXAxisTolerance, double absoluteYAxisTolerance, double absoluteZAxisTolerance, double weight) {
}
