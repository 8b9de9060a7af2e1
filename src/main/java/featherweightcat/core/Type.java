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

/**
 * The internal types of values. These are not visible in the model language,
 * but are used to check that the elements of a set are homogeneous and that
 * operators are applied to operands of the right kind.
 *
 * @author David J. Pearce
 *
 */
public abstract class Type {
	public static final Type EMPTY = new Atom("{}");
	public static final Type EVENTS = new Atom("event set");
	public static final Type RELATION = new Atom("rel");
	public static final Type CLOSURE = new Atom("closure");
	public static final Type PROCEDURE = new Atom("procedure");
	public static final Type ANY_TAG = new Atom("anytag");

	/**
	 * Unify two types, returning their common type or <code>null</code> if they
	 * are incompatible. The empty set unifies with any set type, and tags of
	 * distinct enumerations unify to the "any tag" type.
	 *
	 * @param t1
	 * @param t2
	 * @return
	 */
	public static Type unify(Type t1, Type t2) {
		if (t1 == EMPTY && t2 instanceof Set) {
			return t2;
		} else if (t1 instanceof Set && t2 == EMPTY) {
			return t1;
		} else if ((t1 == ANY_TAG && t2 instanceof Tag) || (t1 instanceof Tag && t2 == ANY_TAG)) {
			return ANY_TAG;
		} else if (t1 instanceof Tag && t2 instanceof Tag && !t1.equals(t2)) {
			return ANY_TAG;
		} else if (t1 instanceof Set && t2 instanceof Set) {
			Type elt = unify(((Set) t1).element, ((Set) t2).element);
			return elt == null ? null : new Set(elt);
		} else {
			return t1.equals(t2) ? t1 : null;
		}
	}

	/**
	 * Check whether two types are compatible.
	 *
	 * @param t1
	 * @param t2
	 * @return
	 */
	public static boolean compatible(Type t1, Type t2) {
		return unify(t1, t2) != null;
	}

	/**
	 * Check whether this is a type of tags (from some specific enumeration or
	 * not).
	 *
	 * @return
	 */
	public boolean isTag() {
		return this == ANY_TAG || this instanceof Tag;
	}

	private static final class Atom extends Type {
		private final String name;

		private Atom(String name) {
			this.name = name;
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * The type of tags declared by a given enumeration.
	 */
	public static final class Tag extends Type {
		private final String enumeration;

		public Tag(String enumeration) {
			this.enumeration = enumeration;
		}

		public String enumeration() {
			return enumeration;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Tag && ((Tag) o).enumeration.equals(enumeration);
		}

		@Override
		public int hashCode() {
			return enumeration.hashCode();
		}

		@Override
		public String toString() {
			return enumeration;
		}
	}

	/**
	 * The type of sets of values of a given element type.
	 */
	public static final class Set extends Type {
		private final Type element;

		public Set(Type element) {
			this.element = element;
		}

		public Type element() {
			return element;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Set && ((Set) o).element.equals(element);
		}

		@Override
		public int hashCode() {
			return element.hashCode() * 7;
		}

		@Override
		public String toString() {
			return element + " set";
		}
	}
}
