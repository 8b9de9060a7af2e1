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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

import featherweightcat.core.Syntax.Binding;
import featherweightcat.core.Syntax.Expr;
import featherweightcat.util.AbstractTransformer;
import featherweightcat.util.Lazy;
import featherweightcat.util.Pair;
import featherweightcat.util.SyntacticElement;

/**
 * Evaluates expressions of the model language for a given candidate
 * execution. Evaluation is a function of the environment and the execution
 * context only, and either produces a value or fails with an
 * {@link EvaluationFailure}. Failures are reported on the diagnostic stream,
 * unless evaluation is silent (i.e. occurs within a <code>try</code>).
 *
 * @author David J. Pearce
 *
 */
public class Evaluator extends AbstractTransformer<Evaluator.Scope, Value> {
	private final ExecutionContext context;
	private final Configuration config;
	private final Fixpoint fixpoint;

	public Evaluator(ExecutionContext context, Configuration config) {
		this.context = context;
		this.config = config;
		this.fixpoint = new Fixpoint(this);
	}

	public ExecutionContext context() {
		return context;
	}

	public Configuration configuration() {
		return config;
	}

	public Fixpoint fixpoint() {
		return fixpoint;
	}

	/**
	 * The state in which an expression is evaluated, consisting of the
	 * environment and whether or not failures should be reported.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static final class Scope {
		private final Environment environment;
		private final boolean silent;

		public Scope(Environment environment, boolean silent) {
			this.environment = environment;
			this.silent = silent;
		}

		public Environment environment() {
			return environment;
		}

		public boolean silent() {
			return silent;
		}

		public Scope withEnvironment(Environment environment) {
			return new Scope(environment, silent);
		}

		public Scope withSilent(boolean silent) {
			return new Scope(environment, silent);
		}
	}

	// ==============================================================
	// Diagnostics
	// ==============================================================

	/**
	 * Report an evaluation error at a given element (unless silent), and return
	 * the failure which should be thrown.
	 *
	 * @param silent
	 * @param element
	 * @param msg
	 * @return
	 */
	public EvaluationFailure error(boolean silent, SyntacticElement element, String msg) {
		if (config.debug() || !silent) {
			config.diagnostics().println(SyntacticElement.location(element) + ": " + msg);
		}
		return new EvaluationFailure(msg, element);
	}

	/**
	 * Report a warning at a given element. Warnings are always printed.
	 *
	 * @param element
	 * @param msg
	 */
	public void warn(SyntacticElement element, String msg) {
		config.diagnostics().println(SyntacticElement.location(element) + ": " + msg);
	}

	private EvaluationFailure errorRelation(boolean silent, SyntacticElement element, Value v) {
		return error(silent, element, "type " + Type.RELATION + " expected, " + v.type() + " found");
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	/**
	 * Evaluate an expression which must produce a relation. Unlike sets, the
	 * polymorphic values <code>{}</code> and <code>_</code> are not accepted
	 * here, so <code>0</code> must be used for the empty relation.
	 *
	 * @param scope
	 * @param e
	 * @return
	 */
	public Relation evalRelation(Scope scope, Expr e) {
		Value v = apply(scope, e);
		if (v instanceof Value.Rel) {
			return ((Value.Rel) v).relation();
		}
		throw error(scope.silent(), e, "relation expected");
	}

	/**
	 * Evaluate an expression which must produce a set of events.
	 *
	 * @param scope
	 * @param e
	 * @return
	 */
	public EventSet evalSet(Scope scope, Expr e) {
		Value v = apply(scope, e);
		if (v instanceof Value.Events) {
			return ((Value.Events) v).events();
		} else if (v == Value.EMPTY) {
			return EventSet.EMPTY;
		} else if (v == Value.UNIVERSE) {
			return context.events();
		}
		throw error(scope.silent(), e, "set expected");
	}

	private Predicate<Event> evalMembership(Scope scope, Expr e) {
		Value v = apply(scope, e);
		if (v instanceof Value.Events) {
			EventSet s = ((Value.Events) v).events();
			return s::contains;
		} else if (v == Value.EMPTY) {
			return x -> false;
		} else if (v == Value.UNIVERSE) {
			return x -> true;
		}
		throw error(scope.silent(), e, "set expected");
	}

	/**
	 * Look up a name in the environment, forcing its value.
	 *
	 * @param scope
	 * @param element Element responsible for the lookup, used for error reporting
	 * @param name
	 * @return
	 */
	public Value find(Scope scope, SyntacticElement element, String name) {
		Lazy<Value> v = scope.environment().lookup(name);
		if (v == null) {
			throw error(scope.silent(), element, "unbound var: " + name);
		}
		return v.get();
	}

	/**
	 * Construct the set of all tags in a given enumeration.
	 *
	 * @param env
	 * @param enumeration
	 * @return
	 */
	public static ValueSet tagsUniverse(Environment env, String enumeration) {
		List<String> names = env.enumTags(enumeration);
		if (names == null) {
			throw new IllegalStateException("unknown enumeration " + enumeration);
		}
		ArrayList<Value> tags = new ArrayList<>();
		for (String n : names) {
			tags.add(new Value.Tag(enumeration, n));
		}
		return ValueSet.of(tags);
	}

	private static boolean isFunction(Value v) {
		return v instanceof Value.Closure || v instanceof Value.Primitive || v instanceof Value.Procedure;
	}

	private static boolean isCollection(Value v) {
		return v instanceof Value.Rel || v instanceof Value.Events || v instanceof Value.TypedSet;
	}

	/**
	 * Construct a typed set using a given operation, converting any illegal
	 * comparison between elements into an evaluation error.
	 */
	private Value setOp(Scope scope, SyntacticElement element, Type elementType, Supplier<ValueSet> op) {
		try {
			return new Value.TypedSet(elementType, op.get());
		} catch (Value.ComparisonError e) {
			throw error(scope.silent(), element, e.getMessage());
		}
	}

	/**
	 * Determine the common type of a list of values, reporting an error against
	 * the first expression whose value does not fit.
	 */
	private Type typeList(Scope scope, List<Expr> exprs, List<Value> values) {
		Type t0 = values.get(0).type();
		for (int i = 1; i < values.size(); ++i) {
			Type t1 = values.get(i).type();
			Type t = Type.unify(t0, t1);
			if (t == null) {
				throw error(scope.silent(), exprs.get(i), "type " + t0 + " expected, " + t1 + " found");
			}
			t0 = t;
		}
		return t0;
	}

	private Relation asRelation(Value v) {
		if (v instanceof Value.Rel) {
			return ((Value.Rel) v).relation();
		} else if (v == Value.UNIVERSE) {
			return context.universe();
		} else if (v == Value.EMPTY) {
			return Relation.EMPTY;
		}
		throw new IllegalArgumentException("not a relation: " + v);
	}

	private EventSet asEvents(Value v) {
		if (v instanceof Value.Events) {
			return ((Value.Events) v).events();
		} else if (v == Value.UNIVERSE) {
			return context.events();
		} else if (v == Value.EMPTY) {
			return EventSet.EMPTY;
		}
		throw new IllegalArgumentException("not a set of events: " + v);
	}

	// ==============================================================
	// Atoms
	// ==============================================================

	@Override
	public Value apply(Scope scope, Expr.Constant term) {
		switch (term.kind()) {
		case EMPTY_SET:
			return Value.EMPTY;
		case EMPTY_RELATION:
			return new Value.Rel(Relation.EMPTY);
		default:
			return Value.UNIVERSE;
		}
	}

	@Override
	public Value apply(Scope scope, Expr.TagLiteral term) {
		String enumeration = scope.environment().tagEnum(term.name());
		if (enumeration == null) {
			throw error(scope.silent(), term, "tag '" + term.name() + " is undefined");
		}
		return new Value.Tag(enumeration, term.name());
	}

	@Override
	public Value apply(Scope scope, Expr.Variable term) {
		return find(scope, term, term.name());
	}

	@Override
	public Value apply(Scope scope, Expr.ExplicitSet term) {
		ArrayList<Value> values = new ArrayList<>();
		for (Expr e : term.elements()) {
			values.add(apply(scope, e));
		}
		for (int i = 0; i != values.size(); ++i) {
			if (values.get(i) == Value.UNIVERSE) {
				throw error(scope.silent(), term.elements().get(i), "universe in explicit set");
			}
		}
		if (values.isEmpty()) {
			return Value.EMPTY;
		}
		Type t = typeList(scope, term.elements(), values);
		return setOp(scope, term, t, () -> ValueSet.of(values));
	}

	// ==============================================================
	// Unary operators
	// ==============================================================

	@Override
	public Value apply(Scope scope, Expr.Unary term) {
		Value v = apply(scope, term.operand());
		switch (term.op()) {
		case PLUS:
			if (v == Value.EMPTY || v == Value.UNIVERSE) {
				return v;
			} else if (v instanceof Value.Rel) {
				return new Value.Rel(((Value.Rel) v).relation().transitiveClosure());
			}
			throw errorRelation(scope.silent(), term.operand(), v);
		case STAR:
			if (v == Value.EMPTY) {
				return new Value.Rel(context.identity());
			} else if (v == Value.UNIVERSE) {
				return v;
			} else if (v instanceof Value.Rel) {
				Relation r = ((Value.Rel) v).relation();
				return new Value.Rel(r.transitiveClosure().union(context.identity()));
			}
			throw errorRelation(scope.silent(), term.operand(), v);
		case OPT:
			if (v == Value.EMPTY) {
				return new Value.Rel(context.identity());
			} else if (v == Value.UNIVERSE) {
				return v;
			} else if (v instanceof Value.Rel) {
				return new Value.Rel(((Value.Rel) v).relation().union(context.identity()));
			}
			throw errorRelation(scope.silent(), term.operand(), v);
		case COMPLEMENT:
			return complement(scope, term, v);
		default:
			if (v == Value.EMPTY || v == Value.UNIVERSE) {
				return v;
			} else if (v instanceof Value.Rel) {
				return new Value.Rel(((Value.Rel) v).relation().inverse());
			}
			throw errorRelation(scope.silent(), term.operand(), v);
		}
	}

	private Value complement(Scope scope, Expr.Unary term, Value v) {
		if (v == Value.EMPTY) {
			return Value.UNIVERSE;
		} else if (v == Value.UNIVERSE) {
			return Value.EMPTY;
		} else if (v instanceof Value.Events) {
			return new Value.Events(context.events().difference(((Value.Events) v).events()));
		} else if (v instanceof Value.Rel) {
			return new Value.Rel(context.universe().difference(((Value.Rel) v).relation()));
		} else if (v instanceof Value.TypedSet && ((Value.TypedSet) v).element() instanceof Type.Tag) {
			Value.TypedSet s = (Value.TypedSet) v;
			String enumeration = ((Type.Tag) s.element()).enumeration();
			ValueSet all = tagsUniverse(scope.environment(), enumeration);
			return new Value.TypedSet(s.element(), all.difference(s.values()));
		}
		throw error(scope.silent(), term.operand(), "set or relation expected, " + v.type() + " found");
	}

	// ==============================================================
	// N-ary operators
	// ==============================================================

	@Override
	public Value apply(Scope scope, Expr.Nary term) {
		switch (term.op()) {
		case UNION:
			return union(scope, term);
		case SEQ:
			return sequence(scope, term);
		case INTER:
			return intersection(scope, term);
		case DIFF:
			return difference(scope, term);
		case CARTESIAN: {
			EventSet s1 = evalSet(scope, term.operands().get(0));
			EventSet s2 = evalSet(scope, term.operands().get(1));
			return new Value.Rel(Relation.cartesian(s1, s2));
		}
		default:
			return add(scope, term);
		}
	}

	private Value union(Scope scope, Expr.Nary term) {
		ArrayList<Value> values = new ArrayList<>();
		for (Expr e : term.operands()) {
			values.add(apply(scope, e));
		}
		ArrayList<Expr> exprs = new ArrayList<>();
		ArrayList<Value> operands = new ArrayList<>();
		for (int i = 0; i != values.size(); ++i) {
			Value v = values.get(i);
			if (v == Value.UNIVERSE) {
				return Value.UNIVERSE;
			} else if (v != Value.EMPTY) {
				exprs.add(term.operands().get(i));
				operands.add(v.tagToSet());
			}
		}
		if (operands.isEmpty()) {
			return Value.EMPTY;
		}
		Type t = typeList(scope, exprs, operands);
		if (t == Type.RELATION) {
			ArrayList<Relation> rs = new ArrayList<>();
			for (Value v : operands) {
				rs.add(asRelation(v));
			}
			return new Value.Rel(Relation.unions(rs));
		} else if (t == Type.EVENTS) {
			ArrayList<EventSet> ss = new ArrayList<>();
			for (Value v : operands) {
				ss.add(asEvents(v));
			}
			return new Value.Events(EventSet.unions(ss));
		} else if (t instanceof Type.Set) {
			ArrayList<ValueSet> ss = new ArrayList<>();
			for (Value v : operands) {
				ss.add(((Value.TypedSet) v).values());
			}
			return setOp(scope, term, ((Type.Set) t).element(), () -> ValueSet.unions(ss));
		}
		throw error(scope.silent(), term, "cannot perform union on type '" + t + "'");
	}

	private Value sequence(Scope scope, Expr.Nary term) {
		ArrayList<Value> values = new ArrayList<>();
		for (Expr e : term.operands()) {
			values.add(apply(scope, e));
		}
		ArrayList<Relation> rs = new ArrayList<>();
		for (int i = 0; i != values.size(); ++i) {
			Value v = values.get(i);
			if (v == Value.EMPTY) {
				return new Value.Rel(Relation.EMPTY);
			} else if (v == Value.UNIVERSE) {
				rs.add(context.universe());
			} else if (v instanceof Value.Rel) {
				rs.add(((Value.Rel) v).relation());
			} else {
				throw errorRelation(scope.silent(), term.operands().get(i), v);
			}
		}
		if (rs.isEmpty()) {
			return new Value.Rel(context.identity());
		}
		return new Value.Rel(Relation.sequence(rs));
	}

	private static boolean isCartesian(Expr e) {
		return e instanceof Expr.Nary && ((Expr.Nary) e).op() == Expr.Nary.Op.CARTESIAN;
	}

	private Value intersection(Scope scope, Expr.Nary term) {
		Expr lhs = term.operands().get(0);
		Expr rhs = term.operands().get(1);
		// Filter rather than construct a potentially large cartesian product
		if (isCartesian(rhs) || isCartesian(lhs)) {
			Expr.Nary product = (Expr.Nary) (isCartesian(rhs) ? rhs : lhs);
			Expr other = isCartesian(rhs) ? lhs : rhs;
			Relation r = evalRelation(scope, other);
			Predicate<Event> f1 = evalMembership(scope, product.operands().get(0));
			Predicate<Event> f2 = evalMembership(scope, product.operands().get(1));
			return new Value.Rel(r.filter((x, y) -> f1.test(x) && f2.test(y)));
		}
		Value v1 = apply(scope, lhs);
		Value v2 = apply(scope, rhs);
		Value s1 = v1.tagToSet();
		Value s2 = v2.tagToSet();
		if (s1 instanceof Value.Rel && s2 instanceof Value.Rel) {
			return new Value.Rel(((Value.Rel) s1).relation().intersect(((Value.Rel) s2).relation()));
		} else if (s1 instanceof Value.Events && s2 instanceof Value.Events) {
			return new Value.Events(((Value.Events) s1).events().intersect(((Value.Events) s2).events()));
		} else if (s1 instanceof Value.TypedSet && s2 instanceof Value.TypedSet) {
			Value.TypedSet t1 = (Value.TypedSet) s1;
			Value.TypedSet t2 = (Value.TypedSet) s2;
			return setOp(scope, term, t1.element(), () -> t1.values().intersect(t2.values()));
		} else if (s1 == Value.UNIVERSE) {
			return s2;
		} else if (s2 == Value.UNIVERSE) {
			return s1;
		} else if (s1 == Value.EMPTY || s2 == Value.EMPTY) {
			return Value.EMPTY;
		} else if (isFunction(s1)) {
			throw error(scope.silent(), lhs, "intersection on " + v1.type());
		} else if (isFunction(s2)) {
			throw error(scope.silent(), rhs, "intersection on " + v2.type());
		} else if (s1 instanceof Value.Rel || s2 instanceof Value.Rel) {
			throw error(scope.silent(), term, "mixing sets and relations in intersection");
		} else {
			throw error(scope.silent(), term, "mixing event sets and sets in intersection");
		}
	}

	private Value difference(Scope scope, Expr.Nary term) {
		Expr lhs = term.operands().get(0);
		Expr rhs = term.operands().get(1);
		Value v1 = apply(scope, lhs);
		Value v2 = apply(scope, rhs);
		Value s1 = v1.tagToSet();
		Value s2 = v2.tagToSet();
		if (s1 instanceof Value.Rel && s2 instanceof Value.Rel) {
			return new Value.Rel(((Value.Rel) s1).relation().difference(((Value.Rel) s2).relation()));
		} else if (s1 instanceof Value.Events && s2 instanceof Value.Events) {
			return new Value.Events(((Value.Events) s1).events().difference(((Value.Events) s2).events()));
		} else if (s1 instanceof Value.TypedSet && s2 instanceof Value.TypedSet) {
			Value.TypedSet t1 = (Value.TypedSet) s1;
			Value.TypedSet t2 = (Value.TypedSet) s2;
			return setOp(scope, term, t1.element(), () -> t1.values().difference(t2.values()));
		} else if (s1 == Value.UNIVERSE && s2 instanceof Value.Rel) {
			return new Value.Rel(context.universe().difference(((Value.Rel) s2).relation()));
		} else if (s1 == Value.UNIVERSE && s2 instanceof Value.Events) {
			return new Value.Events(context.events().difference(((Value.Events) s2).events()));
		} else if (s1 == Value.UNIVERSE && s2 instanceof Value.TypedSet) {
			Value.TypedSet t2 = (Value.TypedSet) s2;
			if (t2.element() instanceof Type.Tag) {
				ValueSet all = tagsUniverse(scope.environment(), ((Type.Tag) t2.element()).enumeration());
				return new Value.TypedSet(t2.element(), all.difference(t2.values()));
			}
			throw error(scope.silent(), lhs, "cannot build universe for element type " + t2.element());
		} else if (s1 == Value.UNIVERSE && s2 == Value.EMPTY) {
			return Value.UNIVERSE;
		} else if ((isCollection(s1) || s1 == Value.EMPTY || s1 == Value.UNIVERSE) && s2 == Value.UNIVERSE) {
			return Value.EMPTY;
		} else if (s1 == Value.EMPTY && (isCollection(s2) || s2 == Value.EMPTY)) {
			return Value.EMPTY;
		} else if (isCollection(s1) && s2 == Value.EMPTY) {
			return v1;
		} else if (isFunction(s1)) {
			throw error(scope.silent(), lhs, "difference on " + v1.type());
		} else if (isFunction(s2)) {
			throw error(scope.silent(), rhs, "difference on " + v2.type());
		} else if (s1 instanceof Value.Rel || s2 instanceof Value.Rel) {
			throw error(scope.silent(), term, "mixing set and relation in difference");
		} else {
			throw error(scope.silent(), term, "mixing event set and set in difference");
		}
	}

	private Value add(Scope scope, Expr.Nary term) {
		Value v1 = apply(scope, term.operands().get(0));
		Value v2 = apply(scope, term.operands().get(1));
		if (v1 == Value.UNIVERSE) {
			throw error(scope.silent(), term, "universe in set ++");
		} else if (v2 == Value.UNIVERSE) {
			return Value.UNIVERSE;
		} else if (v2 == Value.EMPTY) {
			return setOp(scope, term, v1.type(), () -> ValueSet.of(v1));
		} else if (v2 instanceof Value.TypedSet) {
			Value.TypedSet s2 = (Value.TypedSet) v2;
			if (v1 == Value.EMPTY && s2.element() instanceof Type.Set) {
				Value e = new Value.TypedSet(((Type.Set) s2.element()).element(), ValueSet.EMPTY);
				return setOp(scope, term, s2.type(), () -> s2.values().add(e));
			}
			return setOp(scope, term, v1.type(), () -> s2.values().add(v1));
		}
		throw error(scope.silent(), term.operands().get(1),
				"this expression of type '" + v2.type() + "' should be a set");
	}

	// ==============================================================
	// Functions & bindings
	// ==============================================================

	@Override
	public Value apply(Scope scope, Expr.Application term) {
		Value f = apply(scope, term.function());
		ArrayList<Value> args = new ArrayList<>();
		for (Expr e : term.arguments()) {
			args.add(apply(scope, e));
		}
		return call(scope, term, f, args);
	}

	/**
	 * Apply a function value to some arguments.
	 *
	 * @param scope    The scope of the call site
	 * @param element  The call site, used for error reporting
	 * @param function The function being called
	 * @param args     The actual arguments
	 * @return
	 */
	public Value call(Scope scope, SyntacticElement element, Value function, List<Value> args) {
		if (function instanceof Value.Closure) {
			Value.Closure f = (Value.Closure) function;
			Environment env = bindArguments(scope, element, f.parameters(), args, f.environment());
			try {
				return apply(scope.withEnvironment(env), f.body());
			} catch (EvaluationFailure e) {
				throw error(scope.silent(), element, "Calling");
			}
		} else if (function instanceof Value.Primitive) {
			Value.Primitive p = (Value.Primitive) function;
			try {
				return p.apply(args);
			} catch (Primitives.PrimitiveError e) {
				throw error(scope.silent(), element, "primitive " + p.name() + ": " + e.getMessage());
			} catch (EvaluationFailure e) {
				throw error(scope.silent(), element, "Calling primitive " + p.name());
			}
		}
		throw error(scope.silent(), element, "closure or primitive expected");
	}

	/**
	 * Bind formal parameters to actual arguments within a given environment.
	 *
	 * @param scope   The scope of the call site
	 * @param element The call site, used for error reporting
	 * @param params
	 * @param args
	 * @param env     The environment to extend
	 * @return
	 */
	public Environment bindArguments(Scope scope, SyntacticElement element, List<String> params, List<Value> args,
			Environment env) {
		if (params.size() != args.size()) {
			throw error(scope.silent(), element, "argument_mismatch");
		}
		ArrayList<Pair<String, Lazy<Value>>> bindings = new ArrayList<>();
		for (int i = 0; i != params.size(); ++i) {
			bindings.add(new Pair<>(params.get(i), Lazy.value(args.get(i))));
		}
		return env.bindAll(bindings);
	}

	@Override
	public Value apply(Scope scope, Expr.Function term) {
		return closure(scope, term, false);
	}

	/**
	 * Construct a closure for a given function. Only the free variables of the
	 * body are captured. When the function is one of a group of recursive
	 * definitions, free variables which are not yet bound are permitted since
	 * they will be patched in later.
	 *
	 * @param scope
	 * @param f
	 * @param recursive
	 * @return
	 */
	public Value.Closure closure(Scope scope, Expr.Function f, boolean recursive) {
		Environment env = scope.environment();
		if (config.debug()) {
			config.diagnostics().println("Closure " + f.name() + ", env=" + env.names().size() + ", free={"
					+ String.join(",", f.freeVariables()) + "}");
		}
		HashMap<String, Lazy<Value>> captured = new HashMap<>();
		for (String x : f.freeVariables()) {
			Lazy<Value> v = env.lookup(x);
			if (v != null) {
				captured.put(x, v);
			} else if (!recursive) {
				throw error(scope.silent(), f, "unbound var: " + x);
			}
		}
		return new Value.Closure(f.parameters(), env.withValues(captured), f.body(), f.name());
	}

	/**
	 * Evaluate a list of simultaneous bindings, producing the extended
	 * environment. Each right-hand side is evaluated lazily in the enclosing scope.
	 *
	 * @param scope
	 * @param bindings
	 * @return
	 */
	public Environment bind(Scope scope, List<Binding> bindings) {
		ArrayList<Pair<String, Lazy<Value>>> bs = new ArrayList<>();
		for (Binding b : bindings) {
			bs.add(new Pair<>(b.name(), Lazy.of(() -> apply(scope, b.expr()))));
		}
		return scope.environment().bindAll(bs);
	}

	@Override
	public Value apply(Scope scope, Expr.Bind term) {
		Environment env = bind(scope, term.bindings());
		return apply(scope.withEnvironment(env), term.body());
	}

	@Override
	public Value apply(Scope scope, Expr.BindRec term) {
		Environment env = fixpoint.bind(scope, term, term.bindings());
		return apply(scope.withEnvironment(env), term.body());
	}

	// ==============================================================
	// Control
	// ==============================================================

	@Override
	public Value apply(Scope scope, Expr.Match term) {
		Value v = apply(scope, term.subject());
		if (v instanceof Value.Tag) {
			String name = ((Value.Tag) v).name();
			for (Pair<String, Expr> c : term.cases()) {
				if (c.first().equals(name)) {
					return apply(scope, c.second());
				}
			}
			if (term.defaultCase() != null) {
				return apply(scope, term.defaultCase());
			}
			throw error(scope.silent(), term, "pattern matching failed on value '" + name + "'");
		} else if (v == Value.EMPTY) {
			throw error(scope.silent(), term.subject(), "matching on empty");
		} else if (v == Value.UNIVERSE) {
			throw error(scope.silent(), term.subject(), "matching on universe");
		}
		throw error(scope.silent(), term.subject(), "matching on non-tag value of type '" + v.type() + "'");
	}

	@Override
	public Value apply(Scope scope, Expr.MatchSet term) {
		Value v = apply(scope, term.subject());
		if (v == Value.EMPTY) {
			return apply(scope, term.ifEmpty());
		} else if (v == Value.UNIVERSE) {
			throw error(scope.silent(), term, "Cannot set-match on universe");
		} else if (v instanceof Value.TypedSet) {
			Value.TypedSet s = (Value.TypedSet) v;
			if (s.values().isEmpty()) {
				return apply(scope, term.ifEmpty());
			}
			Lazy<Value> element = Lazy.of(() -> s.values().choose());
			Lazy<Value> rest = Lazy.of(() -> new Value.TypedSet(s.element(), s.values().remove(element.get())));
			Environment env = scope.environment().bind(term.element(), element).bind(term.rest(), rest);
			return apply(scope.withEnvironment(env), term.body());
		}
		throw error(scope.silent(), term.subject(), "set-matching on non-set value of type '" + v.type() + "'");
	}

	@Override
	public Value apply(Scope scope, Expr.Try term) {
		try {
			return apply(scope.withSilent(true), term.body());
		} catch (EvaluationFailure e) {
			if (config.debug()) {
				warn(term, "caught failure");
			}
			return apply(scope, term.fallback());
		}
	}

	/**
	 * Get the stream to which diagnostics are written.
	 *
	 * @return
	 */
	public PrintStream diagnostics() {
		return config.diagnostics();
	}
}
