package com.github.micycle1.curvefit;

/**
 * A conic fit could not produce a valid shape: no unique ellipse eigenvector,
 * a singular scatter matrix, or axes that cannot be determined.
 */
public class DegenerateGeometryException extends CurveFitException {

	private static final long serialVersionUID = 1L;

	public DegenerateGeometryException(String message) {
		super(message);
	}

	public DegenerateGeometryException(String message, Throwable cause) {
		super(message, cause);
	}
}
