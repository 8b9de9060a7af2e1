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

/**
 * Signals a fatal error in a model, such as calling something which is not a
 * procedure. Unlike an {@link EvaluationFailure}, a user error cannot be caught
 * by a <code>try</code> expression and always terminates the interpretation.
 *
 * @author David J. Pearce
 *
 */
public class UserError extends RuntimeException {
	private static final long serialVersionUID = 1L;

	public UserError(String msg) {
		super(msg);
	}
}
