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

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import featherweightcat.core.Evaluator.Scope;
import featherweightcat.core.Syntax.Binding;
import featherweightcat.core.Syntax.Expr;
import featherweightcat.core.Syntax.Instruction;
import featherweightcat.core.Syntax.Model;
import featherweightcat.io.ModelLoader;
import featherweightcat.util.Lazy;
import featherweightcat.util.Pair;
import featherweightcat.util.SyntacticElement;
import featherweightcat.util.SyntacticElement.Attribute;
import featherweightcat.util.SyntaxError;

/**
 * Executes the instructions of a model. Execution is in continuation passing
 * style: each instruction is given the remainder of the model as a
 * continuation, which it may call zero times (e.g. a failed check), once (most
 * instructions) or many times (e.g. <code>with x from S</code>). Results are
 * accumulated by the continuation supplied by the caller.
 *
 * @author David J. Pearce
 *
 */
public class Executor {

	/**
	 * The remainder of a computation, which accepts the current state and the
	 * result accumulated so far.
	 *
	 * @param <R>
	 */
	public interface Continuation<R> {
		R apply(State state, R result);
	}

	private final Evaluator evaluator;
	private final Configuration config;
	private final ModelLoader loader;

	public Executor(Evaluator evaluator, ModelLoader loader) {
		this.evaluator = evaluator;
		this.config = evaluator.configuration();
		this.loader = loader;
	}

	/**
	 * Execute a sequence of instructions, calling the continuation for each
	 * outcome which reaches the end.
	 *
	 * @param st
	 * @param instructions
	 * @param kont
	 * @param res
	 * @return
	 */
	public <R> R run(State st, List<Instruction> instructions, Continuation<R> kont, R res) {
		return run(st, instructions, 0, kont, res);
	}

	private <R> R run(State st, List<Instruction> instructions, int index, Continuation<R> kont, R res) {
		if (index == instructions.size()) {
			return kont.apply(st, res);
		}
		return execute(st, instructions.get(index), (s, r) -> run(s, instructions, index + 1, kont, r), res);
	}

	/**
	 * Execute a single instruction.
	 *
	 * @param st
	 * @param i
	 * @param kont
	 * @param res
	 * @return
	 */
	public <R> R execute(State st, Instruction i, Continuation<R> kont, R res) {
		switch (i.getOpcode()) {
		case Syntax.INS_debug:
			return execute(st, (Instruction.Debug) i, kont, res);
		case Syntax.INS_let:
			return execute(st, (Instruction.Let) i, kont, res);
		case Syntax.INS_rec:
			return execute(st, (Instruction.Rec) i, kont, res);
		case Syntax.INS_include:
			return include(st, i, ((Instruction.Include) i).filename(), kont, res);
		case Syntax.INS_procedure:
			return execute(st, (Instruction.Procedure) i, kont, res);
		case Syntax.INS_enum:
			return execute(st, (Instruction.Enum) i, kont, res);
		case Syntax.INS_latex:
			return kont.apply(st, res);
		}
		if (config.bell()) {
			switch (i.getOpcode()) {
			case Syntax.INS_eventdec:
				return execute(st, (Instruction.EventDec) i, kont, res);
			case Syntax.INS_relationdec:
			case Syntax.INS_orderdec:
				evaluator.warn(i, "deprecated");
				return kont.apply(st, res);
			default:
				// Checks and display are meaningless in an annotation file
				return kont.apply(st, res);
			}
		}
		switch (i.getOpcode()) {
		case Syntax.INS_show:
			return execute(st, (Instruction.Show) i, kont, res);
		case Syntax.INS_unshow:
			return execute(st, (Instruction.UnShow) i, kont, res);
		case Syntax.INS_showas:
			return execute(st, (Instruction.ShowAs) i, kont, res);
		case Syntax.INS_proceduretest:
			return execute(st, (Instruction.ProcedureTest) i, kont, res);
		case Syntax.INS_test:
			return execute(st, (Instruction.Test) i, kont, res);
		case Syntax.INS_call:
			return execute(st, (Instruction.Call) i, kont, res);
		case Syntax.INS_forall:
			return execute(st, (Instruction.Forall) i, kont, res);
		case Syntax.INS_withfrom:
			return execute(st, (Instruction.WithFrom) i, kont, res);
		case Syntax.INS_eventdec:
		case Syntax.INS_relationdec:
		case Syntax.INS_orderdec:
			// Annotation declarations are ignored when executing a model
			return kont.apply(st, res);
		}
		throw new IllegalArgumentException("Invalid instruction encountered: " + i);
	}

	// ==============================================================
	// Bindings
	// ==============================================================

	private <R> R execute(State st, Instruction.Let i, Continuation<R> kont, R res) {
		Environment env = evaluator.bind(st.scope(), i.bindings());
		State nst = st.withEnvironment(env);
		nst = doShow(i.bindings(), nst);
		nst = checkBellOrder(i.bindings(), nst);
		return kont.apply(nst, res);
	}

	private <R> R execute(State st, Instruction.Rec i, Continuation<R> kont, R res) {
		Environment env = evaluator.fixpoint().bind(st.scope(), i, i.bindings());
		State nst = st.withEnvironment(env);
		nst = doShow(i.bindings(), nst);
		nst = checkBellOrder(i.bindings(), nst);
		return kont.apply(nst, res);
	}

	private <R> R execute(State st, Instruction.Procedure i, Continuation<R> kont, R res) {
		Value p = new Value.Procedure(i.parameters(), st.environment(), i.body());
		return kont.apply(st.withEnvironment(st.environment().bind(i.name(), p)), res);
	}

	private <R> R execute(State st, Instruction.Enum i, Continuation<R> kont, R res) {
		String name = i.name();
		Environment env = st.environment().declareEnum(name, i.tags());
		// Bind the enumeration name to the set of all its tags
		env = env.bind(name, Lazy.of(() -> {
			ArrayList<Value> tags = new ArrayList<>();
			for (String t : i.tags()) {
				tags.add(new Value.Tag(name, t));
			}
			return new Value.TypedSet(new Type.Tag(name), ValueSet.of(tags));
		}));
		if (config.debug()) {
			evaluator.warn(i, "adding set of all tags for " + name);
		}
		State nst = checkBellEnum(i, st.withEnvironment(env), name, i.tags());
		return kont.apply(nst, res);
	}

	// ==============================================================
	// Checks
	// ==============================================================

	private boolean isSkipped(String name) {
		return name != null && config.skipChecks().contains(name);
	}

	private <R> R execute(State st, Instruction.Test i, Continuation<R> kont, R res) {
		boolean skip = isSkipped(i.name());
		if (config.debug() && skip) {
			evaluator.warn(i, "skipping check: " + i.name());
		}
		if (!config.strictSkip() && skip) {
			config.diagnostics().println("Warning: Skipping check " + i.name());
			return kont.apply(st, res);
		}
		Relation r = evaluator.evalRelation(st.scope(), i.operand());
		boolean ok;
		switch (i.kind()) {
		case ACYCLIC:
			ok = r.isAcyclic();
			break;
		case IRREFLEXIVE:
			ok = r.isIrreflexive();
			break;
		default:
			ok = r.isEmpty();
		}
		ok = config.checkThrough(ok);
		if (ok) {
			return kont.apply(st, res);
		} else if (skip) {
			// Strict skipping: record the failure but carry on regardless
			return kont.apply(st.withSkipped(i.name()), res);
		}
		if (config.debug() && config.verbose() > 0) {
			reportFailure(st, i, r);
		}
		switch (i.severity()) {
		case PROVIDES:
			return res;
		default:
			return kont.apply(st.withUndefined(), res);
		}
	}

	private void reportFailure(State st, Instruction.Test i, Relation r) {
		Object concrete = evaluator.context().concrete();
		String name = concrete == null ? "test" : concrete.toString();
		Attribute.Text text = i.attribute(Attribute.Text.class);
		String description = text == null ? i.toString() : text.text;
		config.diagnostics().println(name + ": Failure of '" + description + "'");
		List<Event> cycle = r.findCycle();
		if (cycle != null) {
			config.diagnostics().println("CY: " + Relation.ofCycle(cycle));
		}
		for (Map.Entry<String, Relation> e : new TreeMap<>(st.show()).entrySet()) {
			config.diagnostics().println(e.getKey() + ": " + e.getValue());
		}
	}

	private <R> R execute(State st, Instruction.ProcedureTest i, Continuation<R> kont, R res) {
		boolean skip = isSkipped(i.name());
		if (!config.strictSkip() && skip) {
			config.diagnostics().println("Warning: Skipping check " + i.name());
			return kont.apply(st, res);
		}
		Scope scope = st.scope();
		Value.Procedure p = findProcedure(scope, i, i.procedure());
		List<Value> args = evaluateAll(scope, i.arguments());
		Environment env = evaluator.bindArguments(scope, i, p.parameters(), args, p.environment());
		Environment saved = st.environment();
		return run(st.withEnvironment(env), p.body(), (s, r) -> kont.apply(s.withEnvironment(saved), r), res);
	}

	// ==============================================================
	// Procedures
	// ==============================================================

	private Value.Procedure findProcedure(Scope scope, SyntacticElement element, String name) {
		Value v = evaluator.find(scope, element, name);
		if (v instanceof Value.Procedure) {
			return (Value.Procedure) v;
		}
		throw new UserError("procedure expected");
	}

	private List<Value> evaluateAll(Scope scope, List<Expr> exprs) {
		ArrayList<Value> vs = new ArrayList<>();
		for (Expr e : exprs) {
			vs.add(evaluator.apply(scope, e));
		}
		return vs;
	}

	private <R> R execute(State st, Instruction.Call i, Continuation<R> kont, R res) {
		Scope scope = st.scope();
		Value.Procedure p;
		Environment env;
		try {
			p = findProcedure(scope, i, i.name());
			env = evaluator.bindArguments(scope, i, p.parameters(), evaluateAll(scope, i.arguments()),
					p.environment());
		} catch (EvaluationFailure e) {
			for (SyntacticElement callSite : st.stack()) {
				if (config.debug() || !st.silent()) {
					config.diagnostics().println(SyntacticElement.location(callSite) + ": Calling procedure");
				}
			}
			throw e;
		}
		Environment savedEnv = st.environment();
		Lazy<Map<String, Relation>> savedShow = st.lazyShow();
		State nst = st.push(i).withEnvironment(env);
		return run(nst, p.body(), (s, r) -> kont.apply(s.pop().withEnvironment(savedEnv).withShow(savedShow), r),
				res);
	}

	private <R> R include(State st, SyntacticElement element, String filename, Continuation<R> kont, R res) {
		if (config.debug()) {
			evaluator.warn(element, "include \"" + filename + "\"");
		}
		Model model;
		try {
			model = loader.load(filename);
		} catch (IOException e) {
			throw evaluator.error(st.silent(), element, e.getMessage());
		} catch (SyntaxError e) {
			if (config.debug() || !st.silent()) {
				e.outputSourceError(config.diagnostics());
			}
			throw evaluator.error(st.silent(), element, "syntax error in \"" + filename + "\"");
		}
		return run(st, model.instructions(), kont, res);
	}

	/**
	 * Execute a complete model file, as though it were included.
	 *
	 * @param st
	 * @param filename
	 * @param kont
	 * @param res
	 * @return
	 */
	public <R> R include(State st, String filename, Continuation<R> kont, R res) {
		return include(st, null, filename, kont, res);
	}

	// ==============================================================
	// Iteration
	// ==============================================================

	private <R> R execute(State st, Instruction.Forall i, Continuation<R> kont, R res) {
		Environment env0 = st.environment();
		Value v = evaluator.apply(st.scope(), i.set()).tagToSet();
		if (v == Value.EMPTY) {
			return kont.apply(st, res);
		} else if (v instanceof Value.TypedSet) {
			return forall(st, i, env0, ((Value.TypedSet) v).values(), kont, res);
		}
		throw evaluator.error(st.silent(), i.set(), "forall instruction applied to non-set value");
	}

	private <R> R forall(State st, Instruction.Forall i, Environment env0, ValueSet remaining, Continuation<R> kont,
			R res) {
		if (remaining.isEmpty()) {
			return kont.apply(st, res);
		}
		Value v = remaining.choose();
		State nst = st.withEnvironment(env0.bind(i.variable(), v));
		return run(nst, i.body(),
				(s, r) -> forall(s.withEnvironment(env0), i, env0, remaining.remove(v), kont, r), res);
	}

	private <R> R execute(State st, Instruction.WithFrom i, Continuation<R> kont, R res) {
		Environment env0 = st.environment();
		Value v = evaluator.apply(st.scope(), i.set());
		if (v == Value.EMPTY) {
			return res;
		} else if (v instanceof Value.TypedSet) {
			for (Value x : ((Value.TypedSet) v).values()) {
				State nst = st.withEnvironment(env0.bind(i.variable(), x));
				res = kont.apply(doShowOne(i.variable(), nst), res);
			}
			return res;
		}
		throw evaluator.error(st.silent(), i.set(), "set expected");
	}

	// ==============================================================
	// Display
	// ==============================================================

	private <R> R execute(State st, Instruction.Debug i, Continuation<R> kont, R res) {
		Value v = evaluator.apply(st.scope(), i.operand());
		config.diagnostics().println(SyntacticElement.location(i.operand()) + ": value is " + v.pretty());
		return kont.apply(st, res);
	}

	private <R> R execute(State st, Instruction.Show i, Continuation<R> kont, R res) {
		if (!config.showSome()) {
			return kont.apply(st, res);
		}
		Lazy<Map<String, Relation>> old = st.lazyShow();
		Lazy<Map<String, Relation>> show = Lazy.of(() -> {
			HashMap<String, Relation> m = new HashMap<>(old.get());
			for (String x : i.names()) {
				m.put(x, findShowRelation(st.environment(), x));
			}
			return m;
		});
		return kont.apply(st.withShow(show), res);
	}

	private <R> R execute(State st, Instruction.UnShow i, Continuation<R> kont, R res) {
		if (!config.showSome()) {
			return kont.apply(st, res);
		}
		Lazy<Map<String, Relation>> old = st.lazyShow();
		Lazy<Map<String, Relation>> show = Lazy.of(() -> {
			HashMap<String, Relation> m = new HashMap<>(old.get());
			for (String x : i.names()) {
				m.remove(x);
			}
			return m;
		});
		return kont.apply(st.withShow(show), res);
	}

	private <R> R execute(State st, Instruction.ShowAs i, Continuation<R> kont, R res) {
		if (!config.showSome()) {
			return kont.apply(st, res);
		}
		Lazy<Map<String, Relation>> old = st.lazyShow();
		Scope scope = st.scope();
		Lazy<Map<String, Relation>> show = Lazy.of(() -> {
			HashMap<String, Relation> m = new HashMap<>(old.get());
			m.put(i.name(), reduce(i.name(), evaluator.evalRelation(scope, i.operand())));
			return m;
		});
		return kont.apply(st.withShow(show), res);
	}

	/**
	 * Remove transitive edges from a relation to be displayed, unless instructed
	 * otherwise.
	 *
	 * @param name
	 * @param r
	 * @return
	 */
	public Relation reduce(String name, Relation r) {
		if (config.verbose() <= 1 && !config.symmetric().contains(name) && !config.showRaw().contains(name)) {
			return r.transitiveReduction();
		}
		return r;
	}

	/**
	 * Find the relation bound to a given name for display. A name which is
	 * unbound, or which is bound to something other than a relation, displays as
	 * the empty relation.
	 *
	 * @param env
	 * @param name
	 * @return
	 */
	public Relation findShowRelation(Environment env, String name) {
		Lazy<Value> binding = env.lookup(name);
		if (binding == null) {
			return Relation.EMPTY;
		}
		Value v = binding.get();
		Relation r;
		if (v instanceof Value.Rel) {
			r = ((Value.Rel) v).relation();
		} else if (v == Value.EMPTY) {
			r = Relation.EMPTY;
		} else if (v == Value.UNIVERSE) {
			r = evaluator.context().universe();
		} else {
			config.diagnostics().println("Warning show: " + name + " is not a relation: '" + v.pretty() + "'");
			return Relation.EMPTY;
		}
		return reduce(name, r);
	}

	private State doShowOne(String name, State st) {
		if (config.showSome() && config.doShow().contains(name)) {
			Lazy<Map<String, Relation>> old = st.lazyShow();
			Environment env = st.environment();
			return st.withShow(Lazy.of(() -> {
				HashMap<String, Relation> m = new HashMap<>(old.get());
				m.put(name, findShowRelation(env, name));
				return m;
			}));
		}
		return st;
	}

	private State doShow(List<Binding> bindings, State st) {
		HashSet<String> names = new HashSet<>();
		for (Binding b : bindings) {
			if (config.doShow().contains(b.name())) {
				names.add(b.name());
			}
		}
		if (names.isEmpty()) {
			return st;
		}
		Lazy<Map<String, Relation>> old = st.lazyShow();
		Environment env = st.environment();
		return st.withShow(Lazy.of(() -> {
			HashMap<String, Relation> m = new HashMap<>(old.get());
			for (String x : names) {
				m.put(x, findShowRelation(env, x));
			}
			return m;
		}));
	}

	// ==============================================================
	// Annotations
	// ==============================================================

	private <R> R execute(State st, Instruction.EventDec i, Continuation<R> kont, R res) {
		ArrayList<Set<String>> annotations = new ArrayList<>();
		for (Expr e : i.annotations()) {
			Value v = evaluator.apply(st.scope(), e);
			if (!isTagSet(v)) {
				throw evaluator.error(false, e, "event declaration expected a set of tags, found " + v.pretty());
			}
			annotations.add(tagNames(((Value.TypedSet) v).values()));
		}
		return kont.apply(st.withBellInfo(st.bellInfo().withEvents(i.name(), annotations)), res);
	}

	private State checkBellEnum(SyntacticElement element, State st, String name, List<String> tags) {
		if (!config.bell()) {
			return st;
		}
		try {
			if (name.equals(BellInfo.SCOPES)) {
				return st.withBellInfo(st.bellInfo().withScopes(tags));
			} else if (name.equals(BellInfo.REGIONS)) {
				return st.withBellInfo(st.bellInfo().withRegions(tags));
			}
			return st;
		} catch (BellInfo.AlreadyDefined e) {
			throw evaluator.error(st.silent(), element, "second definition of bell enum " + name);
		}
	}

	/**
	 * Check whether a binding defines the order between scopes and, if so,
	 * compute that order by calling the function for every scope.
	 *
	 * @param bindings
	 * @param st
	 * @return
	 */
	private State checkBellOrder(List<Binding> bindings, State st) {
		if (!config.bell()) {
			return st;
		}
		for (Binding b : bindings) {
			if (b.name().equals(BellInfo.NARROWER)) {
				st = checkBellOrder(b, st);
			}
		}
		return st;
	}

	private State checkBellOrder(Binding b, State st) {
		Expr loc = b.expr();
		Scope scope = st.scope();
		Value narrower = evaluator.find(scope, loc, BellInfo.NARROWER);
		Lazy<Value> binding = st.environment().lookup(BellInfo.SCOPES);
		if (binding == null) {
			throw evaluator.error(false, loc, "tag set " + BellInfo.SCOPES + " must be defined while defining "
					+ BellInfo.NARROWER);
		}
		Value scopes = binding.get();
		if (!isTagSet(scopes)) {
			throw evaluator.error(false, loc, BellInfo.SCOPES + " must be a tag set, found " + scopes.type());
		}
		HashSet<Pair<String, String>> order = new HashSet<>();
		for (Value tag : ((Value.TypedSet) scopes).values()) {
			String name = ((Value.Tag) tag).name();
			Value tgt;
			try {
				tgt = evaluator.call(scope.withSilent(true), loc, narrower, List.of(tag));
			} catch (EvaluationFailure e) {
				tgt = Value.EMPTY;
			}
			if (tgt instanceof Value.Tag) {
				order.add(new Pair<>(((Value.Tag) tgt).name(), name));
			} else if (tgt instanceof Value.TypedSet) {
				for (String t : tagNames(((Value.TypedSet) tgt).values())) {
					order.add(new Pair<>(t, name));
				}
			} else if (tgt != Value.EMPTY) {
				throw evaluator.error(false, loc, "implicit call " + BellInfo.NARROWER + "('" + name
						+ ") must return a tag or a set of tags, found " + tgt.type());
			}
		}
		if (!BellInfo.isHierarchy(tagNames(((Value.TypedSet) scopes).values()), order)) {
			throw evaluator.error(false, loc,
					BellInfo.NARROWER + " defines the non-hierarchical relation " + BellInfo.toString(order));
		}
		try {
			return st.withBellInfo(st.bellInfo().withScopeOrder(order));
		} catch (BellInfo.AlreadyDefined e) {
			throw evaluator.error(st.silent(), loc, "second definition of " + BellInfo.NARROWER);
		}
	}

	private static boolean isTagSet(Value v) {
		return v instanceof Value.TypedSet && ((Value.TypedSet) v).element().isTag();
	}

	private static Set<String> tagNames(ValueSet tags) {
		HashSet<String> names = new HashSet<>();
		for (Value t : tags) {
			if (t instanceof Value.Tag) {
				names.add(((Value.Tag) t).name());
			}
		}
		return names;
	}
}
