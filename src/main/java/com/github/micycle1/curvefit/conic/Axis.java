package com.github.micycle1.curvefit.conic;

import java.util.Objects;

/**
 * One axis of a fitted ellipse: the segment between its two vertices on the
 * curve.
 */
public final class Axis {

	private final Point start;
	private final Point end;
	private final double angle;
	private final double length;

	public Axis(Point start, Point end) {
		this.start = Objects.requireNonNull(start, "start must not be null");
		this.end = Objects.requireNonNull(end, "end must not be null");
		this.length = start.distance(end);

		// slope angle, in (-pi/2, pi/2]
		double a = Math.atan((end.y - start.y) / (end.x - start.x));
		this.angle = a == -Math.PI / 2 ? Math.PI / 2 : a;
	}

	public Point start() {
		return start;
	}

	public Point end() {
		return end;
	}

	/** Angle of the axis line against the x axis, in radians. */
	public double angle() {
		return angle;
	}

	public double length() {
		return length;
	}

	@Override
	public String toString() {
		return "Axis[" + start + " -> " + end + ", length=" + length + ", angle=" + angle + "]";
	}
}
