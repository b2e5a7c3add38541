package com.helios.sketchbook.model.network;

/**
 * Layout coordinates of a variable node.
 */
public record NodePosition(double x, double y) {
}
