package org.javai.planning.model;

public record PositionConstraint(String linkName, String frameId, Point target, double tolerance, double weight) {
}
