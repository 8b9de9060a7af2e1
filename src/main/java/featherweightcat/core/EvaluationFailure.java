// This file is part of the Featherweight Cat Interpreter (fci).
//
// The Featherweight Cat Interpreter is free software; you can redistribute
// it and/or modify it under the terms of the GNU General Public
// License as published by the Free Software Foundation; either
// version 3 of the License, or (at your option) any later version.
//
// The Featherweight Cat Interpreter is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the
// implied warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR
// PURPOSE. See the GNU General Public License for more details.
//
// You should have received a copy of the GNU General Public
// License along with the Featherweight Cat Interpreter. If not, see
// <http://www.gnu.org/licenses/>
//
// Copyright 2018, David James Pearce.

package featherweightcat.core;

import featherweightcat.util.SyntacticElement;

/**
 * Signals that the evaluation of a model has failed at some location. The
 * failure has already been reported (unless evaluation was silent) by the
 * time this is thrown. Failures unwind to the nearest enclosing
 * <code>try</code> expression, or otherwise terminate the interpretation.
 *
 * @author David J. Pearce
 *
 */
public class EvaluationFailure extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final SyntacticElement element;

	public EvaluationFailure(String msg, SyntacticElement element) {
		super(msg);
		this.element = element;
	}

	/**
	 * Get the element where the failure arose, which may be <code>null</code>.
	 *
	 * @return
	 */
	public SyntacticElement element() {
		return element;
	}

	/**
	 * Get a description of the location where this failure arose.
	 *
	 * @return
	 */
	public String location() {
		return SyntacticElement.location(element);
	}
}
