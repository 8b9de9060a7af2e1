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

import java.util.List;

import featherweightcat.core.Syntax.Model;

/**
 * Checks a model against every candidate execution of a test, and aggregates
 * the outcomes into a verdict. Candidates are supplied by the caller.
 *
 * @author David J. Pearce
 *
 */
public class ModelChecker {
	private final Interpreter interpreter;
	private final Model model;

	public ModelChecker(Interpreter interpreter, Model model) {
		this.interpreter = interpreter;
		this.model = model;
	}

	/**
	 * A candidate execution, along with whether the final-state condition of the
	 * test holds in it.
	 */
	public static class Candidate {
		private final ExecutionContext context;
		private final Environment environment;
		private final boolean condition;

		public Candidate(ExecutionContext context, Environment environment, boolean condition) {
			this.context = context;
			this.environment = environment;
			this.condition = condition;
		}

		public ExecutionContext context() {
			return context;
		}

		public Environment environment() {
			return environment;
		}

		public boolean condition() {
			return condition;
		}
	}

	public static class Verdict {
		private final int positive;
		private final int negative;
		private final boolean undefined;

		public Verdict(int positive, int negative, boolean undefined) {
			this.positive = positive;
			this.negative = negative;
			this.undefined = undefined;
		}

		public int positive() {
			return positive;
		}

		public int negative() {
			return negative;
		}

		/**
		 * Check whether some consistent candidate lies outside the domain of the
		 * model.
		 *
		 * @return
		 */
		public boolean undefined() {
			return undefined;
		}

		public boolean isAllowed() {
			return positive > 0;
		}

		@Override
		public String toString() {
			String r = (isAllowed() ? "Allowed" : "Forbidden") + ", " + positive + " positive / " + negative
					+ " negative";
			return undefined ? r + ", undefined" : r;
		}
	}

	/**
	 * The outcome of checking a single candidate.
	 */
	public enum Outcome {
		/**
		 * No branch of the model ran to completion.
		 */
		REJECTED,
		/**
		 * Some branch ran to completion, and none of those was undefined.
		 */
		CONSISTENT,
		/**
		 * Some branch ran to completion and was marked undefined.
		 */
		UNDEFINED;

		public boolean isConsistent() {
			return this != REJECTED;
		}
	}

	public Outcome check(Candidate candidate) {
		return interpreter.interpret(model, candidate.context(), candidate.environment(), (st, r) -> {
			return st.undefined() || r == Outcome.UNDEFINED ? Outcome.UNDEFINED : Outcome.CONSISTENT;
		}, Outcome.REJECTED);
	}

	public Verdict check(List<Candidate> candidates) {
		int positive = 0;
		int negative = 0;
		boolean undefined = false;
		for (Candidate c : candidates) {
			Outcome outcome = check(c);
			if (!outcome.isConsistent()) {
				continue;
			}
			undefined |= outcome == Outcome.UNDEFINED;
			if (c.condition()) {
				positive++;
			} else {
				negative++;
			}
		}
		return new Verdict(positive, negative, undefined);
	}
}
