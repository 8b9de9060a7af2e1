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

package featherweightcat.util;

import featherweightcat.core.Syntax;
import featherweightcat.core.Syntax.Expr;

/**
 * Dispatches over the syntactic forms of an expression. Each form is handled
 * by a dedicated method which is given some state (e.g. an environment, or the
 * set of names currently bound) and which produces a result.
 *
 * @author David J. Pearce
 *
 * @param <T> The state carried through the transformation.
 * @param <S> The result of transforming an expression.
 */
public abstract class AbstractTransformer<T, S> {

	public S apply(T state, Expr term) {
		switch (term.getOpcode()) {
		case Syntax.EXPR_constant:
			return apply(state, (Expr.Constant) term);
		case Syntax.EXPR_tag:
			return apply(state, (Expr.TagLiteral) term);
		case Syntax.EXPR_variable:
			return apply(state, (Expr.Variable) term);
		case Syntax.EXPR_explicitset:
			return apply(state, (Expr.ExplicitSet) term);
		case Syntax.EXPR_unary:
			return apply(state, (Expr.Unary) term);
		case Syntax.EXPR_nary:
			return apply(state, (Expr.Nary) term);
		case Syntax.EXPR_application:
			return apply(state, (Expr.Application) term);
		case Syntax.EXPR_bind:
			return apply(state, (Expr.Bind) term);
		case Syntax.EXPR_bindrec:
			return apply(state, (Expr.BindRec) term);
		case Syntax.EXPR_function:
			return apply(state, (Expr.Function) term);
		case Syntax.EXPR_match:
			return apply(state, (Expr.Match) term);
		case Syntax.EXPR_matchset:
			return apply(state, (Expr.MatchSet) term);
		case Syntax.EXPR_try:
			return apply(state, (Expr.Try) term);
		}
		// Give up
		throw new IllegalArgumentException("Invalid term encountered: " + term);
	}

	/**
	 * Apply this transformer to the empty set, the empty relation or the universe.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Constant term);

	/**
	 * Apply this transformer to a tag constant.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.TagLiteral term);

	/**
	 * Apply this transformer to a variable.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Variable term);

	/**
	 * Apply this transformer to an explicit set.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.ExplicitSet term);

	/**
	 * Apply this transformer to a unary operator.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Unary term);

	/**
	 * Apply this transformer to an n-ary operator.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Nary term);

	/**
	 * Apply this transformer to a function application.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Application term);

	/**
	 * Apply this transformer to a local binding.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Bind term);

	/**
	 * Apply this transformer to a local recursive binding.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.BindRec term);

	/**
	 * Apply this transformer to a function.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Function term);

	/**
	 * Apply this transformer to a match over tags.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Match term);

	/**
	 * Apply this transformer to a match over a set.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.MatchSet term);

	/**
	 * Apply this transformer to a try expression.
	 *
	 * @param state The current state (e.g. environment)
	 * @param term  The term being transformed.
	 * @return
	 */
	public abstract S apply(T state, Expr.Try term);
}
