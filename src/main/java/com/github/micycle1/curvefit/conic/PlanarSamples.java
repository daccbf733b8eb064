package com.github.micycle1.curvefit.conic;

import com.github.micycle1.curvefit.ShapeException;
import com.github.micycle1.curvefit.Table;

/**
 * Normalized (x, y) sample columns for a conic fit.
 */
final class PlanarSamples {

	final double[] x;
	final double[] y;

	private PlanarSamples(double[] x, double[] y) {
		this.x = x;
		this.y = y;
	}

	static PlanarSamples of(Object y, Object x, int minPoints, String shape) {
		Table yt = Table.from(y, "Y");
		Table xt = Table.from(x, "X");
		if (xt.rows() != yt.rows()) {
			throw new ShapeException("'x' and 'y' number of rows must be identical (" + xt.rows() + " vs " + yt.rows() + ")");
		}
		if (xt.cols() != 1) {
			throw new ShapeException("x can be unidimensional only, got " + xt.cols() + " columns");
		}
		if (yt.cols() != 1) {
			throw new ShapeException("y can be unidimensional only, got " + yt.cols() + " columns");
		}
		if (xt.rows() < minPoints) {
			throw new ShapeException("At least " + minPoints + " points are required to fit a " + shape + ", got " + xt.rows());
		}
		return new PlanarSamples(xt.column(0), yt.column(0));
	}

	int size() {
		return x.length;
	}
}
