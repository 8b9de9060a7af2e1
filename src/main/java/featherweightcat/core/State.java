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
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import featherweightcat.util.Lazy;
import featherweightcat.util.SyntacticElement;

/**
 * The state threaded through the execution of a model. States are immutable;
 * each instruction produces an updated state which is passed to the remainder
 * of the model.
 *
 * @author David J. Pearce
 *
 */
public final class State {
	private final Environment environment;
	private final Lazy<Map<String, Relation>> show;
	private final Set<String> skipped;
	private final boolean silent;
	private final boolean undefined;
	private final BellInfo bellInfo;
	private final List<SyntacticElement> stack;

	public State(Environment environment, Lazy<Map<String, Relation>> show, Set<String> skipped, boolean silent,
			boolean undefined, BellInfo bellInfo, List<SyntacticElement> stack) {
		this.environment = environment;
		this.show = show;
		this.skipped = skipped;
		this.silent = silent;
		this.undefined = undefined;
		this.bellInfo = bellInfo;
		this.stack = stack;
	}

	/**
	 * Construct the state in which a model begins.
	 *
	 * @param environment
	 * @param show
	 * @return
	 */
	public static State initial(Environment environment, Lazy<Map<String, Relation>> show) {
		return new State(environment, show, Collections.emptySet(), false, false, BellInfo.EMPTY,
				Collections.emptyList());
	}

	public Environment environment() {
		return environment;
	}

	/**
	 * Get the relations which have been selected for display, by name.
	 *
	 * @return
	 */
	public Map<String, Relation> show() {
		return show.get();
	}

	Lazy<Map<String, Relation>> lazyShow() {
		return show;
	}

	/**
	 * Get the names of skipped checks which would have failed.
	 *
	 * @return
	 */
	public Set<String> skipped() {
		return skipped;
	}

	public boolean silent() {
		return silent;
	}

	/**
	 * Determine whether some required check has failed, meaning the execution is
	 * outside the domain of the model.
	 *
	 * @return
	 */
	public boolean undefined() {
		return undefined;
	}

	public BellInfo bellInfo() {
		return bellInfo;
	}

	/**
	 * Get the call sites of the procedures currently executing, innermost first.
	 *
	 * @return
	 */
	public List<SyntacticElement> stack() {
		return stack;
	}

	/**
	 * Construct the scope in which expressions are evaluated in this state.
	 *
	 * @return
	 */
	public Evaluator.Scope scope() {
		return new Evaluator.Scope(environment, silent);
	}

	public State withEnvironment(Environment environment) {
		return new State(environment, show, skipped, silent, undefined, bellInfo, stack);
	}

	public State withShow(Lazy<Map<String, Relation>> show) {
		return new State(environment, show, skipped, silent, undefined, bellInfo, stack);
	}

	public State withSkipped(String name) {
		HashSet<String> nskipped = new HashSet<>(skipped);
		nskipped.add(name);
		return new State(environment, show, Collections.unmodifiableSet(nskipped), silent, undefined, bellInfo,
				stack);
	}

	public State withUndefined() {
		return new State(environment, show, skipped, silent, true, bellInfo, stack);
	}

	public State withBellInfo(BellInfo bellInfo) {
		return new State(environment, show, skipped, silent, undefined, bellInfo, stack);
	}

	public State push(SyntacticElement callSite) {
		ArrayList<SyntacticElement> nstack = new ArrayList<>();
		nstack.add(callSite);
		nstack.addAll(stack);
		return new State(environment, show, skipped, silent, undefined, bellInfo,
				Collections.unmodifiableList(nstack));
	}

	public State pop() {
		if (stack.isEmpty()) {
			throw new IllegalStateException("empty call stack");
		}
		return new State(environment, show, skipped, silent, undefined, bellInfo,
				Collections.unmodifiableList(new ArrayList<>(stack.subList(1, stack.size()))));
	}
}
