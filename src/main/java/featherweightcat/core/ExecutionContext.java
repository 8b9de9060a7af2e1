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

import featherweightcat.util.Lazy;

/**
 * The fixed data of the candidate execution being checked. This is supplied
 * once per interpretation and never changes during it.
 *
 * @author David J. Pearce
 *
 */
public final class ExecutionContext {
	private final Lazy<Relation> identity;
	private final Lazy<Relation> universe;
	private final EventSet events;
	private final Object concrete;

	/**
	 * Construct a context from its constituent parts.
	 *
	 * @param identity The identity relation over all events.
	 * @param universe The relation which contains every pair of events which the
	 *                 model may relate.
	 * @param events   The set of all events.
	 * @param concrete The candidate execution itself, which is used only for
	 *                 diagnostics and may be <code>null</code>.
	 */
	public ExecutionContext(Lazy<Relation> identity, Lazy<Relation> universe, EventSet events, Object concrete) {
		this.identity = identity;
		this.universe = universe;
		this.events = events;
		this.concrete = concrete;
	}

	/**
	 * Construct a context over a given set of events, where the universe relates
	 * every pair of events.
	 *
	 * @param events
	 * @param concrete
	 * @return
	 */
	public static ExecutionContext of(EventSet events, Object concrete) {
		return new ExecutionContext(Lazy.of(() -> Relation.identity(events)),
				Lazy.of(() -> Relation.cartesian(events, events)), events, concrete);
	}

	public Relation identity() {
		return identity.get();
	}

	public Relation universe() {
		return universe.get();
	}

	public EventSet events() {
		return events;
	}

	public Object concrete() {
		return concrete;
	}
}
