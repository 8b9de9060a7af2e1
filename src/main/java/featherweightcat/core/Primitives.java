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
import java.util.TreeMap;

import featherweightcat.util.Lazy;
import featherweightcat.util.Pair;

/**
 * The built-in functions which are available to every model. These are
 * implemented natively, rather than in the standard library, either because
 * they require information not otherwise available to a model (e.g. memory
 * locations) or because they cannot be expressed efficiently.
 *
 * @author David J. Pearce
 *
 */
public class Primitives {

	/**
	 * Signals that a primitive was applied to unsuitable arguments.
	 */
	public static class PrimitiveError extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public PrimitiveError(String msg) {
			super(msg);
		}
	}

	/**
	 * Determine the name of the event set associated with a given tag, as used by
	 * <code>tag2events</code>.
	 *
	 * @param tag
	 * @return
	 */
	public static String eventsOf(String tag) {
		return "__" + tag + "_events";
	}

	/**
	 * Bind all primitives in a given environment. Primitives which look up names
	 * (e.g. <code>tag2scope</code>) do so in the environment given here, rather
	 * than in the environment at the point of call.
	 *
	 * @param env
	 * @return
	 */
	public static Environment bind(Environment env) {
		ArrayList<Pair<String, Lazy<Value>>> prims = new ArrayList<>();
		prims.add(primitive("partition", Primitives::partition));
		prims.add(primitive("linearisations", Primitives::linearisations));
		prims.add(primitive("tag2scope", args -> tag2scope(env, args)));
		prims.add(primitive("tag2events", args -> tag2events(env, args)));
		prims.add(primitive("domain", Primitives::domain));
		prims.add(primitive("range", Primitives::range));
		return env.bindAll(prims);
	}

	private static Pair<String, Lazy<Value>> primitive(String name, Value.Primitive.Implementation impl) {
		return new Pair<>(name, Lazy.value(new Value.Primitive(name, impl)));
	}

	/**
	 * Partition a set of events according to the memory location they access.
	 * Events which access no location (e.g. fences) are not included.
	 *
	 * @param args
	 * @return
	 */
	public static Value partition(List<Value> args) {
		if (args.size() != 1 || !(args.get(0) instanceof Value.Events)) {
			throw argumentMismatch();
		}
		EventSet events = ((Value.Events) args.get(0)).events();
		TreeMap<String, List<Event>> groups = new TreeMap<>();
		for (Event e : events) {
			String loc = e.location();
			if (loc != null) {
				groups.computeIfAbsent(loc, k -> new ArrayList<>()).add(e);
			}
		}
		ArrayList<Value> parts = new ArrayList<>();
		for (List<Event> group : groups.values()) {
			parts.add(new Value.Events(EventSet.of(group)));
		}
		return new Value.TypedSet(Type.EVENTS, ValueSet.of(parts));
	}

	/**
	 * Compute every strict total order over a set of events which is consistent
	 * with a given relation (restricted to those events). If there are none,
	 * because the restricted relation is cyclic, then the result is the singleton
	 * set containing the restricted relation.
	 *
	 * @param args
	 * @return
	 */
	public static Value linearisations(List<Value> args) {
		if (args.size() != 2 || !(args.get(0) instanceof Value.Events) || !(args.get(1) instanceof Value.Rel)) {
			throw argumentMismatch();
		}
		EventSet events = ((Value.Events) args.get(0)).events();
		Relation order = ((Value.Rel) args.get(1)).relation().restrict(events);
		ArrayList<Value> orders = new ArrayList<>();
		if (!order.isAcyclic()) {
			orders.add(new Value.Rel(order));
		} else {
			linearise(new ArrayList<>(), events, order, orders);
		}
		return new Value.TypedSet(Type.RELATION, ValueSet.of(orders));
	}

	private static void linearise(List<Event> prefix, EventSet remaining, Relation order, List<Value> orders) {
		if (remaining.isEmpty()) {
			ArrayList<Pair<Event, Event>> edges = new ArrayList<>();
			for (int i = 0; i < prefix.size(); ++i) {
				for (int j = i + 1; j < prefix.size(); ++j) {
					edges.add(new Pair<>(prefix.get(i), prefix.get(j)));
				}
			}
			orders.add(new Value.Rel(Relation.of(edges)));
			return;
		}
		for (Event e : remaining) {
			if (isMinimal(e, remaining, order)) {
				prefix.add(e);
				linearise(prefix, remaining.filter(x -> !x.equals(e)), order, orders);
				prefix.remove(prefix.size() - 1);
			}
		}
	}

	private static boolean isMinimal(Event e, EventSet remaining, Relation order) {
		for (Event x : remaining) {
			if (!x.equals(e) && order.contains(x, e)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Get the relation whose name is that of a given tag.
	 *
	 * @param env
	 * @param args
	 * @return
	 */
	public static Value tag2scope(Environment env, List<Value> args) {
		if (args.size() != 1 || !(args.get(0) instanceof Value.Tag)) {
			throw argumentMismatch();
		}
		String tag = ((Value.Tag) args.get(0)).name();
		Lazy<Value> binding = env.lookup(tag);
		if (binding == null) {
			throw new PrimitiveError("cannot find scope instance " + tag);
		}
		Value v = binding.get();
		if (v == Value.EMPTY || v == Value.UNIVERSE || v instanceof Value.Rel) {
			return v;
		}
		throw new PrimitiveError("value " + tag + " is not a relation, found " + v.type());
	}

	/**
	 * Get the set of events associated with a given tag.
	 *
	 * @param env
	 * @param args
	 * @return
	 */
	public static Value tag2events(Environment env, List<Value> args) {
		if (args.size() != 1 || !(args.get(0) instanceof Value.Tag)) {
			throw argumentMismatch();
		}
		String name = eventsOf(((Value.Tag) args.get(0)).name());
		Lazy<Value> binding = env.lookup(name);
		if (binding == null) {
			throw new PrimitiveError("cannot find event set " + name);
		}
		Value v = binding.get();
		if (v == Value.EMPTY || v == Value.UNIVERSE || v instanceof Value.Events) {
			return v;
		}
		throw new PrimitiveError("value " + name + " is not a set of events, found " + v.type());
	}

	public static Value domain(List<Value> args) {
		Value v = single(args);
		if (v == Value.EMPTY || v == Value.UNIVERSE) {
			return v;
		} else if (v instanceof Value.Rel) {
			return new Value.Events(((Value.Rel) v).relation().domain());
		}
		throw argumentMismatch();
	}

	public static Value range(List<Value> args) {
		Value v = single(args);
		if (v == Value.EMPTY || v == Value.UNIVERSE) {
			return v;
		} else if (v instanceof Value.Rel) {
			return new Value.Events(((Value.Rel) v).relation().codomain());
		}
		throw argumentMismatch();
	}

	private static Value single(List<Value> args) {
		if (args.size() != 1) {
			throw argumentMismatch();
		}
		return args.get(0);
	}

	private static PrimitiveError argumentMismatch() {
		return new PrimitiveError("argument mismatch");
	}
}
