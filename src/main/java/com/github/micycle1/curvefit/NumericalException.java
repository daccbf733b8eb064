package com.github.micycle1.curvefit;

/**
 * A solve produced coefficients that are not finite real numbers.
 */
public class NumericalException extends CurveFitException {

	private static final long serialVersionUID = 1L;

	public NumericalException(String message) {
		super(message);
	}
}
