package com.github.micycle1.curvefit;

/**
 * Base type of every failure raised while fitting or querying a model. All
 * subclasses are unchecked; a model whose construction throws is never
 * returned to the caller.
 */
public class CurveFitException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CurveFitException(String message) {
		super(message);
	}

	public CurveFitException(String message, Throwable cause) {
		super(message, cause);
	}
}
