package com.github.micycle1.curvefit.linalg;

/**
 * The two real roots of a quadratic, ascending. {@link #NONE} (both
 * {@code NaN}) stands for "no real solution" in per-query lookups.
 */
public final class RootPair {

	public static final RootPair NONE = new RootPair(Double.NaN, Double.NaN);

	public final double first;
	public final double second;

	public RootPair(double first, double second) {
		this.first = first;
		this.second = second;
	}

	public boolean exists() {
		return !Double.isNaN(first) && !Double.isNaN(second);
	}

	public double min() {
		return Math.min(first, second);
	}

	public double max() {
		return Math.max(first, second);
	}

	@Override
	public String toString() {
		return exists() ? "(" + first + ", " + second + ")" : "(none)";
	}
}
