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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiPredicate;

import featherweightcat.util.Pair;

/**
 * An immutable binary relation over events, represented as an ordered set of
 * edges. Every operation produces a fresh relation, leaving its operands
 * untouched.
 *
 * @author David J. Pearce
 *
 */
public final class Relation implements Iterable<Pair<Event, Event>>, Comparable<Relation> {
	/**
	 * The order on edges, which is lexicographic on source then target.
	 */
	public static final Comparator<Pair<Event, Event>> EDGE_ORDER = Pair.lexicographic(Comparator.naturalOrder(),
			Comparator.naturalOrder());

	public static final Relation EMPTY = new Relation(new TreeSet<>(EDGE_ORDER));

	private final SortedSet<Pair<Event, Event>> edges;

	private Relation(SortedSet<Pair<Event, Event>> edges) {
		this.edges = Collections.unmodifiableSortedSet(edges);
	}

	@SafeVarargs
	public static Relation of(Pair<Event, Event>... edges) {
		return of(Arrays.asList(edges));
	}

	public static Relation of(Collection<Pair<Event, Event>> edges) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		r.addAll(edges);
		return new Relation(r);
	}

	/**
	 * Construct the identity relation over a given set of events.
	 *
	 * @param events
	 * @return
	 */
	public static Relation identity(EventSet events) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Event e : events) {
			r.add(new Pair<>(e, e));
		}
		return new Relation(r);
	}

	/**
	 * Construct the relation which connects every event of one set to every event
	 * of another.
	 *
	 * @param from
	 * @param to
	 * @return
	 */
	public static Relation cartesian(EventSet from, EventSet to) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Event e1 : from) {
			for (Event e2 : to) {
				r.add(new Pair<>(e1, e2));
			}
		}
		return new Relation(r);
	}

	public boolean isEmpty() {
		return edges.isEmpty();
	}

	public int size() {
		return edges.size();
	}

	public boolean contains(Event from, Event to) {
		return edges.contains(new Pair<>(from, to));
	}

	public Relation union(Relation other) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(edges);
		r.addAll(other.edges);
		return new Relation(r);
	}

	public static Relation unions(Collection<Relation> relations) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Relation s : relations) {
			r.addAll(s.edges);
		}
		return new Relation(r);
	}

	public Relation intersect(Relation other) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(edges);
		r.retainAll(other.edges);
		return new Relation(r);
	}

	public Relation difference(Relation other) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(edges);
		r.removeAll(other.edges);
		return new Relation(r);
	}

	public Relation filter(BiPredicate<Event, Event> p) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Pair<Event, Event> edge : edges) {
			if (p.test(edge.first(), edge.second())) {
				r.add(edge);
			}
		}
		return new Relation(r);
	}

	/**
	 * Restrict this relation to those edges whose endpoints are both in a given
	 * set.
	 *
	 * @param events
	 * @return
	 */
	public Relation restrict(EventSet events) {
		return filter((e1, e2) -> events.contains(e1) && events.contains(e2));
	}

	public boolean isSubsetOf(Relation other) {
		return other.edges.containsAll(edges);
	}

	public Relation inverse() {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Pair<Event, Event> edge : edges) {
			r.add(new Pair<>(edge.second(), edge.first()));
		}
		return new Relation(r);
	}

	/**
	 * Compose this relation with another. That is, <code>(a,c)</code> is in the
	 * result iff there is some <code>b</code> such that <code>(a,b)</code> is in
	 * this relation and <code>(b,c)</code> is in the other.
	 *
	 * @param other
	 * @return
	 */
	public Relation compose(Relation other) {
		Map<Event, List<Event>> succs = other.successors();
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Pair<Event, Event> edge : edges) {
			for (Event c : succs.getOrDefault(edge.second(), Collections.emptyList())) {
				r.add(new Pair<>(edge.first(), c));
			}
		}
		return new Relation(r);
	}

	/**
	 * Compose a non-empty sequence of relations from left to right.
	 *
	 * @param relations
	 * @return
	 */
	public static Relation sequence(List<Relation> relations) {
		Relation r = relations.get(0);
		for (int i = 1; i < relations.size(); ++i) {
			r = r.compose(relations.get(i));
		}
		return r;
	}

	/**
	 * Compute the (non-reflexive) transitive closure of this relation.
	 *
	 * @return
	 */
	public Relation transitiveClosure() {
		Map<Event, List<Event>> succs = successors();
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (Event from : succs.keySet()) {
			// Everything reachable in one or more steps
			Deque<Event> worklist = new ArrayDeque<>(succs.get(from));
			TreeSet<Event> visited = new TreeSet<>();
			while (!worklist.isEmpty()) {
				Event e = worklist.pop();
				if (visited.add(e)) {
					r.add(new Pair<>(from, e));
					worklist.addAll(succs.getOrDefault(e, Collections.emptyList()));
				}
			}
		}
		return new Relation(r);
	}

	/**
	 * Remove every edge implied by transitivity, i.e. those edges also obtained by
	 * a path of two or more steps. This is used only for display.
	 *
	 * @return
	 */
	public Relation transitiveReduction() {
		return difference(compose(transitiveClosure()));
	}

	public boolean isIrreflexive() {
		for (Pair<Event, Event> edge : edges) {
			if (edge.first().equals(edge.second())) {
				return false;
			}
		}
		return true;
	}

	public boolean isAcyclic() {
		return findCycle() == null;
	}

	/**
	 * Find a cycle in this relation, if one exists. The cycle is returned as the
	 * sequence of events visited, where the last event is related to the first.
	 *
	 * @return A cycle or <code>null</code> if the relation is acyclic.
	 */
	public List<Event> findCycle() {
		Map<Event, List<Event>> succs = successors();
		// 1 = on the current path, 2 = fully explored
		Map<Event, Integer> status = new HashMap<>();
		for (Event root : succs.keySet()) {
			if (!status.containsKey(root)) {
				ArrayList<Event> path = new ArrayList<>();
				List<Event> cycle = findCycle(root, succs, status, path);
				if (cycle != null) {
					return cycle;
				}
			}
		}
		return null;
	}

	private static List<Event> findCycle(Event e, Map<Event, List<Event>> succs, Map<Event, Integer> status,
			ArrayList<Event> path) {
		status.put(e, 1);
		path.add(e);
		for (Event s : succs.getOrDefault(e, Collections.emptyList())) {
			Integer st = status.get(s);
			if (st == null) {
				List<Event> cycle = findCycle(s, succs, status, path);
				if (cycle != null) {
					return cycle;
				}
			} else if (st == 1) {
				return new ArrayList<>(path.subList(path.indexOf(s), path.size()));
			}
		}
		path.remove(path.size() - 1);
		status.put(e, 2);
		return null;
	}

	/**
	 * Get the set of events which appear as the source of some edge.
	 *
	 * @return
	 */
	public EventSet domain() {
		ArrayList<Event> r = new ArrayList<>();
		for (Pair<Event, Event> edge : edges) {
			r.add(edge.first());
		}
		return EventSet.of(r);
	}

	/**
	 * Get the set of events which appear as the target of some edge.
	 *
	 * @return
	 */
	public EventSet codomain() {
		ArrayList<Event> r = new ArrayList<>();
		for (Pair<Event, Event> edge : edges) {
			r.add(edge.second());
		}
		return EventSet.of(r);
	}

	/**
	 * Construct the relation containing the consecutive edges of a given cycle,
	 * including the edge closing it.
	 *
	 * @param cycle
	 * @return
	 */
	public static Relation ofCycle(List<Event> cycle) {
		TreeSet<Pair<Event, Event>> r = new TreeSet<>(EDGE_ORDER);
		for (int i = 0; i != cycle.size(); ++i) {
			r.add(new Pair<>(cycle.get(i), cycle.get((i + 1) % cycle.size())));
		}
		return new Relation(r);
	}

	private Map<Event, List<Event>> successors() {
		TreeMap<Event, List<Event>> succs = new TreeMap<>();
		for (Pair<Event, Event> edge : edges) {
			succs.computeIfAbsent(edge.first(), k -> new ArrayList<>()).add(edge.second());
		}
		return succs;
	}

	@Override
	public Iterator<Pair<Event, Event>> iterator() {
		return edges.iterator();
	}

	@Override
	public int compareTo(Relation o) {
		return EventSet.compareSorted(edges, o.edges, EDGE_ORDER);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Relation && ((Relation) o).edges.equals(edges);
	}

	@Override
	public int hashCode() {
		return edges.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder("{");
		for (Pair<Event, Event> edge : edges) {
			if (r.length() > 1) {
				r.append(',');
			}
			r.append(edge.first()).append("->").append(edge.second());
		}
		return r.append('}').toString();
	}
}
