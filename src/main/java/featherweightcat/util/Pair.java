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

import java.util.Comparator;

/**
 * This class represents a pair of items. Pairs are used throughout the
 * interpreter to represent the edges of a relation, as well as name/value
 * bindings.
 *
 * @author David J. Pearce
 *
 * @param <FIRST> Type of first item
 * @param <SECOND> Type of second item
 */
public class Pair<FIRST,SECOND> {
	protected final FIRST first;
	protected final SECOND second;

	public Pair(FIRST f, SECOND s) {
		first=f;
		second=s;
	}

	public FIRST first() { return first; }
	public SECOND second() { return second; }

	/**
	 * Construct a comparator which orders pairs lexicographically, first by their
	 * first component and then by their second.
	 *
	 * @param fst Comparator for first components
	 * @param snd Comparator for second components
	 * @return
	 */
	public static <S, T> Comparator<Pair<S, T>> lexicographic(Comparator<? super S> fst,
			Comparator<? super T> snd) {
		return (p1, p2) -> {
			int c = fst.compare(p1.first, p2.first);
			return c != 0 ? c : snd.compare(p1.second, p2.second);
		};
	}

	@Override
	public int hashCode() {
		int fhc = first == null ? 0 : first.hashCode();
		int shc = second == null ? 0 : second.hashCode();
		return (31 * fhc) ^ shc;
	}

	@Override
	public boolean equals(Object o) {
		if(o instanceof Pair) {
			Pair<?, ?> p = (Pair<?, ?>) o;
			boolean r = false;
			if(first != null) { r = first.equals(p.first()); }
			else { r = p.first() == first; }
			if(second != null) { r &= second.equals(p.second()); }
			else { r &= p.second() == second; }
			return r;
		}
		return false;
	}

	@Override
	public String toString() {
		String fstr = first != null ? first.toString() : "null";
		String sstr = second != null ? second.toString() : "null";
		return "(" + fstr + ", " + sstr + ")";
	}
}
