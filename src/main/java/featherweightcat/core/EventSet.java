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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * An immutable, ordered set of events. Every operation produces a fresh set,
 * leaving its operands untouched.
 *
 * @author David J. Pearce
 *
 */
public final class EventSet implements Iterable<Event>, Comparable<EventSet> {
	public static final EventSet EMPTY = new EventSet(new TreeSet<>());

	private final SortedSet<Event> events;

	private EventSet(SortedSet<Event> events) {
		this.events = Collections.unmodifiableSortedSet(events);
	}

	public static EventSet of(Event... events) {
		return of(Arrays.asList(events));
	}

	public static EventSet of(Collection<Event> events) {
		return new EventSet(new TreeSet<>(events));
	}

	public boolean isEmpty() {
		return events.isEmpty();
	}

	public int size() {
		return events.size();
	}

	public boolean contains(Event e) {
		return events.contains(e);
	}

	public EventSet union(EventSet other) {
		TreeSet<Event> r = new TreeSet<>(events);
		r.addAll(other.events);
		return new EventSet(r);
	}

	public static EventSet unions(Collection<EventSet> sets) {
		TreeSet<Event> r = new TreeSet<>();
		for (EventSet s : sets) {
			r.addAll(s.events);
		}
		return new EventSet(r);
	}

	public EventSet intersect(EventSet other) {
		TreeSet<Event> r = new TreeSet<>(events);
		r.retainAll(other.events);
		return new EventSet(r);
	}

	public EventSet difference(EventSet other) {
		TreeSet<Event> r = new TreeSet<>(events);
		r.removeAll(other.events);
		return new EventSet(r);
	}

	public EventSet filter(Predicate<Event> p) {
		TreeSet<Event> r = new TreeSet<>();
		for (Event e : events) {
			if (p.test(e)) {
				r.add(e);
			}
		}
		return new EventSet(r);
	}

	/**
	 * Check whether every element of this set is contained in another.
	 *
	 * @param other
	 * @return
	 */
	public boolean isSubsetOf(EventSet other) {
		return other.events.containsAll(events);
	}

	@Override
	public Iterator<Event> iterator() {
		return events.iterator();
	}

	@Override
	public int compareTo(EventSet o) {
		return compareSorted(events, o.events, Comparator.naturalOrder());
	}

	/**
	 * Compare two sorted sets as ordered sequences, such that a proper prefix comes
	 * first.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	static <T> int compareSorted(Iterable<T> lhs, Iterable<T> rhs, Comparator<? super T> order) {
		Iterator<T> i = lhs.iterator();
		Iterator<T> j = rhs.iterator();
		while (i.hasNext() && j.hasNext()) {
			int c = order.compare(i.next(), j.next());
			if (c != 0) {
				return c;
			}
		}
		return i.hasNext() ? 1 : (j.hasNext() ? -1 : 0);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof EventSet && ((EventSet) o).events.equals(events);
	}

	@Override
	public int hashCode() {
		return events.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder r = new StringBuilder("{");
		for (Event e : events) {
			if (r.length() > 1) {
				r.append(',');
			}
			r.append(e);
		}
		return r.append('}').toString();
	}
}
