package com.github.micycle1.curvefit.conic;

/** Immutable point in the plane. */
public final class Point {

	public final double x;
	public final double y;

	public Point(double x, double y) {
		this.x = x;
		this.y = y;
	}

	public double distance(Point other) {
		return Math.hypot(x - other.x, y - other.y);
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}
}
