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

import java.util.List;

import featherweightcat.core.Syntax.Expr;
import featherweightcat.core.Syntax.Instruction;

/**
 * The runtime values manipulated by the interpreter. Values are immutable,
 * except that the captured environment of a closure is patched once after
 * construction when closures are defined recursively.
 *
 * @author David J. Pearce
 *
 */
public abstract class Value implements Comparable<Value> {
	/**
	 * The polymorphic empty set, which can be used as an empty relation, an empty
	 * set of events or an empty set of values depending upon context.
	 */
	public static final Value EMPTY = new Empty();

	/**
	 * The polymorphic universe, whose meaning is determined by the context in
	 * which it is used.
	 */
	public static final Value UNIVERSE = new Universe();

	/**
	 * Get the internal type of this value.
	 *
	 * @return
	 */
	public abstract Type type();

	/**
	 * Produce a human readable representation of this value.
	 *
	 * @return
	 */
	public String pretty() {
		return "<" + type() + ">";
	}

	@Override
	public String toString() {
		return pretty();
	}

	/**
	 * Lift a tag into the singleton set containing it. Any other value is returned
	 * unchanged.
	 *
	 * @return
	 */
	public Value tagToSet() {
		return this;
	}

	/**
	 * Compare two values which are elements of the same set. The empty value
	 * behaves as the empty instance of whatever it is compared against. Values of
	 * different types cannot be compared, and neither can the universe.
	 */
	@Override
	public int compareTo(Value o) {
		if (this == UNIVERSE || o == UNIVERSE) {
			throw new IllegalStateException("Universe in compare");
		} else if (this == o) {
			return 0;
		} else if (this == EMPTY) {
			return -o.compareEmpty(true);
		} else if (o == EMPTY) {
			return compareEmpty(false);
		} else if (this instanceof Tag && o instanceof Tag) {
			return ((Tag) this).name.compareTo(((Tag) o).name);
		} else if (this instanceof TypedSet && o instanceof TypedSet) {
			return ((TypedSet) this).values.compareTo(((TypedSet) o).values);
		} else if (this instanceof Rel && o instanceof Rel) {
			return ((Rel) this).relation.compareTo(((Rel) o).relation);
		} else if (this instanceof Events && o instanceof Events) {
			return ((Events) this).events.compareTo(((Events) o).events);
		}
		Type t1 = type();
		Type t2 = o.type();
		if (Type.compatible(t1, t2)) {
			throw new ComparisonError("Sets of " + t1 + " are illegal");
		} else {
			throw new ComparisonError("Heterogeneous set elements: types " + t1 + " and " + t2);
		}
	}

	/**
	 * Compare this value against the empty instance of its own kind. This is only
	 * defined for collections.
	 *
	 * @param emptyFirst Whether the empty value was the left operand, which
	 *                   determines how an illegal comparison is reported.
	 * @return
	 */
	protected int compareEmpty(boolean emptyFirst) {
		Type t = type();
		if (emptyFirst) {
			throw new ComparisonError("Heterogeneous set elements: types " + Type.EMPTY + " and " + t);
		}
		throw new ComparisonError("Heterogeneous set elements: types " + t + " and " + Type.EMPTY);
	}

	/**
	 * Signals an illegal comparison between values, such as between a relation and
	 * a set of events.
	 */
	public static class ComparisonError extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public ComparisonError(String msg) {
			super(msg);
		}
	}

	// ==============================================================
	// Sentinels
	// ==============================================================

	private static final class Empty extends Value {
		@Override
		public Type type() {
			return Type.EMPTY;
		}

		@Override
		public String pretty() {
			return "{}";
		}
	}

	private static final class Universe extends Value {
		@Override
		public Type type() {
			// The universe must be resolved before its type is required
			throw new IllegalStateException("universe has no type");
		}

		@Override
		public String pretty() {
			return "<universe>";
		}
	}

	// ==============================================================
	// Collections
	// ==============================================================

	/**
	 * A relation between events.
	 */
	public static final class Rel extends Value {
		private final Relation relation;

		public Rel(Relation relation) {
			this.relation = relation;
		}

		public Relation relation() {
			return relation;
		}

		@Override
		public Type type() {
			return Type.RELATION;
		}

		@Override
		public String pretty() {
			return relation.toString();
		}

		@Override
		protected int compareEmpty(boolean emptyFirst) {
			return relation.isEmpty() ? 0 : 1;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Rel && ((Rel) o).relation.equals(relation);
		}

		@Override
		public int hashCode() {
			return relation.hashCode();
		}
	}

	/**
	 * A set of events.
	 */
	public static final class Events extends Value {
		private final EventSet events;

		public Events(EventSet events) {
			this.events = events;
		}

		public EventSet events() {
			return events;
		}

		@Override
		public Type type() {
			return Type.EVENTS;
		}

		@Override
		public String pretty() {
			return events.toString();
		}

		@Override
		protected int compareEmpty(boolean emptyFirst) {
			return events.isEmpty() ? 0 : 1;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Events && ((Events) o).events.equals(events);
		}

		@Override
		public int hashCode() {
			return events.hashCode();
		}
	}

	/**
	 * A set of values, all of which have the same element type.
	 */
	public static final class TypedSet extends Value {
		private final Type element;
		private final ValueSet values;

		public TypedSet(Type element, ValueSet values) {
			this.element = element;
			this.values = values;
		}

		public Type element() {
			return element;
		}

		public ValueSet values() {
			return values;
		}

		@Override
		public Type type() {
			return new Type.Set(element);
		}

		@Override
		public String pretty() {
			StringBuilder r = new StringBuilder("{");
			for (Value v : values) {
				if (r.length() > 1) {
					r.append(',');
				}
				r.append(v.pretty());
			}
			return r.append('}').toString();
		}

		@Override
		protected int compareEmpty(boolean emptyFirst) {
			return values.isEmpty() ? 0 : 1;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof TypedSet && ((TypedSet) o).values.equals(values);
		}

		@Override
		public int hashCode() {
			return values.hashCode();
		}
	}

	// ==============================================================
	// Tags
	// ==============================================================

	/**
	 * A constant of some enumeration.
	 */
	public static final class Tag extends Value {
		private final String enumeration;
		private final String name;

		public Tag(String enumeration, String name) {
			this.enumeration = enumeration;
			this.name = name;
		}

		public String enumeration() {
			return enumeration;
		}

		public String name() {
			return name;
		}

		@Override
		public Type type() {
			return new Type.Tag(enumeration);
		}

		@Override
		public Value tagToSet() {
			return new TypedSet(type(), ValueSet.of(this));
		}

		@Override
		public String pretty() {
			return "'" + name;
		}

		@Override
		public boolean equals(Object o) {
			if (o instanceof Tag) {
				Tag t = (Tag) o;
				return t.name.equals(name) && t.enumeration.equals(enumeration);
			}
			return false;
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}
	}

	// ==============================================================
	// Functions
	// ==============================================================

	/**
	 * A user-defined function. The captured environment contains only the free
	 * variables of the body.
	 */
	public static final class Closure extends Value {
		private final List<String> parameters;
		private Environment environment;
		private final Expr body;
		private final String name;

		public Closure(List<String> parameters, Environment environment, Expr body, String name) {
			this.parameters = parameters;
			this.environment = environment;
			this.body = body;
			this.name = name;
		}

		public List<String> parameters() {
			return parameters;
		}

		public Environment environment() {
			return environment;
		}

		/**
		 * Patch the captured environment. This is needed only to tie the knot for
		 * recursively defined functions.
		 *
		 * @param environment
		 */
		void setEnvironment(Environment environment) {
			this.environment = environment;
		}

		public Expr body() {
			return body;
		}

		public String name() {
			return name;
		}

		@Override
		public Type type() {
			return Type.CLOSURE;
		}
	}

	/**
	 * A built-in function implemented natively.
	 */
	public static final class Primitive extends Value {
		private final String name;
		private final Implementation implementation;

		public Primitive(String name, Implementation implementation) {
			this.name = name;
			this.implementation = implementation;
		}

		public String name() {
			return name;
		}

		public Value apply(List<Value> arguments) {
			return implementation.apply(arguments);
		}

		@Override
		public Type type() {
			return Type.CLOSURE;
		}

		public interface Implementation {
			/**
			 * Apply this primitive to a given list of arguments.
			 *
			 * @param arguments
			 * @return
			 * @throws Primitives.PrimitiveError if the arguments are unsuitable.
			 */
			Value apply(List<Value> arguments);
		}
	}

	/**
	 * A named sequence of instructions.
	 */
	public static final class Procedure extends Value {
		private final List<String> parameters;
		private final Environment environment;
		private final List<Instruction> body;

		public Procedure(List<String> parameters, Environment environment, List<Instruction> body) {
			this.parameters = parameters;
			this.environment = environment;
			this.body = body;
		}

		public List<String> parameters() {
			return parameters;
		}

		public Environment environment() {
			return environment;
		}

		public List<Instruction> body() {
			return body;
		}

		@Override
		public Type type() {
			return Type.PROCEDURE;
		}
	}
}
