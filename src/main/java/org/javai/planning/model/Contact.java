package org.javai.planning.model;

/**
 * A contact between two bodies found while re-checking a computed path.
 *
 * @param bodyA name of the first body (robot link or world object)
 * @param bodyB name of the second body
 * @param position contact position in the planning frame
 * @param normal contact normal
 * @param depth penetration depth
 */
public record Contact(String bodyA, String bodyB, Point position, Point normal, double depth) {
}
