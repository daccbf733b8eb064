package com.github.micycle1.curvefit;

/**
 * Raised when a quadratic that must have real roots does not.
 */
public class NoRealRootException extends CurveFitException {

	private static final long serialVersionUID = 1L;

	public NoRealRootException(String message) {
		super(message);
	}
}
