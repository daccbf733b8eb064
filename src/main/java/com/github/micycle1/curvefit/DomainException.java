package com.github.micycle1.curvefit;

/**
 * Input values lie outside the domain of a model's transform (e.g. a
 * non-positive value given to a log-space fit).
 */
public class DomainException extends CurveFitException {

	private static final long serialVersionUID = 1L;

	public DomainException(String message) {
		super(message);
	}
}
