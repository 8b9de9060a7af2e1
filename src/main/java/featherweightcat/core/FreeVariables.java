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

import java.util.HashSet;
import java.util.Set;

import featherweightcat.core.Syntax.Binding;
import featherweightcat.core.Syntax.Expr;
import featherweightcat.util.AbstractTransformer;
import featherweightcat.util.Pair;

/**
 * Computes the free variables of an expression. The state is the set of names
 * bound by enclosing constructs, which are not considered free.
 *
 * @author David J. Pearce
 *
 */
public class FreeVariables extends AbstractTransformer<Set<String>, Set<String>> {
	private static final FreeVariables INSTANCE = new FreeVariables();

	/**
	 * Determine the free variables of a function, that is those names used in its
	 * body other than its parameters.
	 *
	 * @param f
	 * @return
	 */
	public static Set<String> of(Expr.Function f) {
		return INSTANCE.apply(new HashSet<>(), f);
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Constant term) {
		return new HashSet<>();
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.TagLiteral term) {
		return new HashSet<>();
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Variable term) {
		HashSet<String> r = new HashSet<>();
		if (!bound.contains(term.name())) {
			r.add(term.name());
		}
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.ExplicitSet term) {
		HashSet<String> r = new HashSet<>();
		for (Expr e : term.elements()) {
			r.addAll(apply(bound, e));
		}
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Unary term) {
		return apply(bound, term.operand());
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Nary term) {
		HashSet<String> r = new HashSet<>();
		for (Expr e : term.operands()) {
			r.addAll(apply(bound, e));
		}
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Application term) {
		Set<String> r = apply(bound, term.function());
		for (Expr e : term.arguments()) {
			r.addAll(apply(bound, e));
		}
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Bind term) {
		HashSet<String> r = new HashSet<>();
		HashSet<String> inner = new HashSet<>(bound);
		for (Binding b : term.bindings()) {
			// Right-hand sides are evaluated in the enclosing scope
			r.addAll(apply(bound, b.expr()));
			inner.add(b.name());
		}
		r.addAll(apply(inner, term.body()));
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.BindRec term) {
		HashSet<String> r = new HashSet<>();
		HashSet<String> inner = new HashSet<>(bound);
		for (Binding b : term.bindings()) {
			inner.add(b.name());
		}
		for (Binding b : term.bindings()) {
			r.addAll(apply(inner, b.expr()));
		}
		r.addAll(apply(inner, term.body()));
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Function term) {
		HashSet<String> inner = new HashSet<>(bound);
		inner.addAll(term.parameters());
		return apply(inner, term.body());
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Match term) {
		Set<String> r = apply(bound, term.subject());
		for (Pair<String, Expr> c : term.cases()) {
			r.addAll(apply(bound, c.second()));
		}
		if (term.defaultCase() != null) {
			r.addAll(apply(bound, term.defaultCase()));
		}
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.MatchSet term) {
		Set<String> r = apply(bound, term.subject());
		r.addAll(apply(bound, term.ifEmpty()));
		HashSet<String> inner = new HashSet<>(bound);
		inner.add(term.element());
		inner.add(term.rest());
		r.addAll(apply(inner, term.body()));
		return r;
	}

	@Override
	public Set<String> apply(Set<String> bound, Expr.Try term) {
		Set<String> r = apply(bound, term.body());
		r.addAll(apply(bound, term.fallback()));
		return r;
	}
}
