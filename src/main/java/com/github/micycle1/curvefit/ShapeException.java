package com.github.micycle1.curvefit;

/**
 * Input does not have the shape a model requires: mismatched row counts,
 * ragged or higher-dimensional data, or the wrong number of columns.
 */
public class ShapeException extends CurveFitException {

	private static final long serialVersionUID = 1L;

	public ShapeException(String message) {
		super(message);
	}
}
