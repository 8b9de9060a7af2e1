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

/**
 * An immutable, ordered set of values. The order is the natural order on
 * values, hence constructing a set whose elements cannot be compared (e.g. a
 * relation and a set of events) raises a {@link Value.ComparisonError}.
 *
 * @author David J. Pearce
 *
 */
public final class ValueSet implements Iterable<Value>, Comparable<ValueSet> {
	public static final ValueSet EMPTY = new ValueSet(new TreeSet<>());

	private final SortedSet<Value> values;

	private ValueSet(SortedSet<Value> values) {
		this.values = Collections.unmodifiableSortedSet(values);
	}

	public static ValueSet of(Value... values) {
		return of(Arrays.asList(values));
	}

	public static ValueSet of(Collection<Value> values) {
		return new ValueSet(new TreeSet<>(values));
	}

	public boolean isEmpty() {
		return values.isEmpty();
	}

	public int size() {
		return values.size();
	}

	public boolean contains(Value v) {
		return values.contains(v);
	}

	/**
	 * Choose an arbitrary element of this (non-empty) set. The choice is
	 * deterministic.
	 *
	 * @return
	 */
	public Value choose() {
		return values.first();
	}

	public ValueSet add(Value v) {
		TreeSet<Value> r = new TreeSet<>(values);
		r.add(v);
		return new ValueSet(r);
	}

	public ValueSet remove(Value v) {
		TreeSet<Value> r = new TreeSet<>(values);
		r.remove(v);
		return new ValueSet(r);
	}

	public ValueSet union(ValueSet other) {
		TreeSet<Value> r = new TreeSet<>(values);
		r.addAll(other.values);
		return new ValueSet(r);
	}

	public static ValueSet unions(Collection<ValueSet> sets) {
		TreeSet<Value> r = new TreeSet<>();
		for (ValueSet s : sets) {
			r.addAll(s.values);
		}
		return new ValueSet(r);
	}

	public ValueSet intersect(ValueSet other) {
		TreeSet<Value> r = new TreeSet<>(values);
		r.retainAll(other.values);
		return new ValueSet(r);
	}

	public ValueSet difference(ValueSet other) {
		TreeSet<Value> r = new TreeSet<>(values);
		r.removeAll(other.values);
		return new ValueSet(r);
	}

	public boolean isSubsetOf(ValueSet other) {
		return other.values.containsAll(values);
	}

	@Override
	public Iterator<Value> iterator() {
		return values.iterator();
	}

	@Override
	public int compareTo(ValueSet o) {
		return EventSet.compareSorted(values, o.values, Comparator.naturalOrder());
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ValueSet && ((ValueSet) o).values.equals(values);
	}

	@Override
	public int hashCode() {
		return values.hashCode();
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
