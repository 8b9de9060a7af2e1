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

import java.util.ArrayList;
import java.util.List;

import featherweightcat.core.Evaluator.Scope;
import featherweightcat.core.Syntax.Binding;
import featherweightcat.core.Syntax.Expr;
import featherweightcat.util.SyntacticElement;

/**
 * Resolves groups of mutually recursive bindings. Function bindings are tied
 * together directly, by patching the environment of each closure with its
 * siblings. Other bindings are computed by iteration from the empty set until
 * no binding grows any further.
 *
 * @author David J. Pearce
 *
 */
public class Fixpoint {
	private final Evaluator evaluator;

	public Fixpoint(Evaluator evaluator) {
		this.evaluator = evaluator;
	}

	/**
	 * Evaluate a group of recursive bindings in a given scope, producing the
	 * extended environment.
	 *
	 * @param scope
	 * @param element  The construct introducing the bindings, used for error
	 *                 reporting
	 * @param bindings
	 * @return
	 */
	public Environment bind(Scope scope, SyntacticElement element, List<Binding> bindings) {
		ArrayList<Binding> functions = new ArrayList<>();
		ArrayList<Binding> values = new ArrayList<>();
		for (Binding b : bindings) {
			if (b.expr() instanceof Expr.Function) {
				functions.add(b);
			} else {
				values.add(b);
			}
		}
		if (values.isEmpty()) {
			return bindFunctions(scope, functions);
		} else {
			return iterate(scope, element, functions, values);
		}
	}

	/**
	 * Bind a group of recursive functions. Each closure captures those siblings
	 * which occur free in its body.
	 *
	 * @param scope
	 * @param functions
	 * @return
	 */
	private Environment bindFunctions(Scope scope, List<Binding> functions) {
		ArrayList<Value.Closure> closures = new ArrayList<>();
		for (Binding b : functions) {
			closures.add(evaluator.closure(scope, (Expr.Function) b.expr(), true));
		}
		for (int i = 0; i != closures.size(); ++i) {
			Value.Closure clo = closures.get(i);
			Expr.Function f = (Expr.Function) functions.get(i).expr();
			Environment env = clo.environment();
			for (int j = 0; j != closures.size(); ++j) {
				String sibling = functions.get(j).name();
				if (f.freeVariables().contains(sibling)) {
					env = env.bind(sibling, closures.get(j));
				}
			}
			clo.setEnvironment(env);
		}
		Environment env = scope.environment();
		for (int i = 0; i != closures.size(); ++i) {
			env = env.bind(functions.get(i).name(), closures.get(i));
		}
		return env;
	}

	private Environment iterate(Scope scope, SyntacticElement element, List<Binding> functions,
			List<Binding> values) {
		Configuration config = evaluator.configuration();
		Environment env = scope.environment();
		ArrayList<Value> olds = new ArrayList<>();
		for (Binding b : values) {
			env = env.bind(b.name(), Value.EMPTY);
			olds.add(Value.EMPTY);
		}
		env = bindFunctions(scope.withEnvironment(env), functions);
		for (int k = 0;; ++k) {
			if (config.debug() && config.verbose() > 1) {
				trace(k, values, olds);
			}
			// Evaluate each binding in turn, seeing those before it
			ArrayList<Value> news = new ArrayList<>();
			for (Binding b : values) {
				Value v = evaluator.apply(scope.withEnvironment(env), b.expr());
				env = env.bind(b.name(), v);
				news.add(v);
			}
			if (stabilised(scope, element, olds, news)) {
				break;
			}
			env = bindFunctions(scope.withEnvironment(env), functions);
			olds = news;
		}
		if (config.debug()) {
			evaluator.warn(element, "Fix point over");
		}
		return env;
	}

	/**
	 * Check whether a new approximation adds nothing to the previous one. Every
	 * binding must keep the same kind of value from one iteration to the next,
	 * otherwise the recursion is illegal.
	 *
	 * @param scope
	 * @param element
	 * @param olds
	 * @param news
	 * @return
	 */
	public boolean stabilised(Scope scope, SyntacticElement element, List<Value> olds, List<Value> news) {
		ExecutionContext context = evaluator.context();
		for (int i = 0; i != olds.size(); ++i) {
			Value v = olds.get(i);
			Value w = news.get(i);
			boolean ok;
			if (w == Value.EMPTY || v == Value.UNIVERSE) {
				ok = true;
			} else if (v == Value.EMPTY && w == Value.UNIVERSE) {
				// Must go round once more to confirm
				ok = false;
			} else if (w instanceof Value.Rel && v == Value.EMPTY) {
				ok = ((Value.Rel) w).relation().isEmpty();
			} else if (v instanceof Value.Rel && w == Value.UNIVERSE) {
				ok = context.universe().isSubsetOf(((Value.Rel) v).relation());
			} else if (v instanceof Value.Rel && w instanceof Value.Rel) {
				ok = ((Value.Rel) w).relation().isSubsetOf(((Value.Rel) v).relation());
			} else if (w instanceof Value.Events && v == Value.EMPTY) {
				ok = ((Value.Events) w).events().isEmpty();
			} else if (v instanceof Value.Events && w == Value.UNIVERSE) {
				ok = context.events().isSubsetOf(((Value.Events) v).events());
			} else if (v instanceof Value.Events && w instanceof Value.Events) {
				ok = ((Value.Events) w).events().isSubsetOf(((Value.Events) v).events());
			} else if (w instanceof Value.TypedSet && v == Value.EMPTY) {
				ok = ((Value.TypedSet) w).values().isEmpty();
			} else if (isTagSet(v) && w == Value.UNIVERSE) {
				Value.TypedSet s = (Value.TypedSet) v;
				String enumeration = ((Type.Tag) s.element()).enumeration();
				ok = Evaluator.tagsUniverse(scope.environment(), enumeration).isSubsetOf(s.values());
			} else if (v instanceof Value.TypedSet && w instanceof Value.TypedSet) {
				ok = ((Value.TypedSet) w).values().isSubsetOf(((Value.TypedSet) v).values());
			} else {
				Type t = (w == Value.UNIVERSE ? v : w).type();
				throw evaluator.error(scope.silent(), element, "illegal recursion on type '" + t + "'");
			}
			if (!ok) {
				return false;
			}
		}
		return true;
	}

	private static boolean isTagSet(Value v) {
		return v instanceof Value.TypedSet && ((Value.TypedSet) v).element() instanceof Type.Tag;
	}

	private void trace(int k, List<Binding> values, List<Value> current) {
		StringBuilder r = new StringBuilder("Fix " + k + ":");
		for (int i = 0; i != values.size(); ++i) {
			Value v = current.get(i);
			if (v instanceof Value.Rel) {
				r.append(" ").append(values.get(i).name()).append("=").append(((Value.Rel) v).relation());
			}
		}
		evaluator.diagnostics().println(r);
	}
}
