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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import featherweightcat.util.Lazy;
import featherweightcat.util.Pair;

/**
 * Represents the bindings visible at some point in a model. This consists of
 * three mappings: from variable names to lazily evaluated values; from
 * enumeration names to their tags; and, from tag names to the enumeration
 * declaring them. An environment is never modified. Instead, binding a name
 * produces an updated environment and the original binding (if any) is simply
 * shadowed.
 *
 * @author djp
 *
 */
public final class Environment {
	public static final Environment EMPTY = new Environment(new HashMap<>(), new HashMap<>(), new HashMap<>());

	private final HashMap<String, Lazy<Value>> values;
	private final HashMap<String, List<String>> enums;
	private final HashMap<String, String> tags;

	private Environment(HashMap<String, Lazy<Value>> values, HashMap<String, List<String>> enums,
			HashMap<String, String> tags) {
		this.values = values;
		this.enums = enums;
		this.tags = tags;
	}

	/**
	 * Get the (unevaluated) binding for a given name.
	 *
	 * @param name
	 * @return The binding or <code>null</code> if the name is unbound.
	 */
	public Lazy<Value> lookup(String name) {
		return values.get(name);
	}

	/**
	 * Get the value bound to a given name, evaluating it if necessary.
	 *
	 * @param name
	 * @return
	 * @throws UserError if the name is unbound.
	 */
	public Value find(String name) {
		Lazy<Value> v = values.get(name);
		if (v == null) {
			throw new UserError("unbound var: " + name);
		}
		return v.get();
	}

	public boolean isBound(String name) {
		return values.containsKey(name);
	}

	/**
	 * Bind a given name to a given (lazy) value, producing an updated environment.
	 * Observe that the name may already be bound, in which case the original
	 * binding is simply shadowed.
	 *
	 * @param name
	 * @param value
	 * @return
	 */
	public Environment bind(String name, Lazy<Value> value) {
		// Clone the values map in order to update it
		HashMap<String, Lazy<Value>> nvalues = new HashMap<>(values);
		nvalues.put(name, value);
		return new Environment(nvalues, enums, tags);
	}

	public Environment bind(String name, Value value) {
		return bind(name, Lazy.value(value));
	}

	/**
	 * Bind several names at once.
	 *
	 * @param bindings
	 * @return
	 */
	public Environment bindAll(Collection<Pair<String, Lazy<Value>>> bindings) {
		HashMap<String, Lazy<Value>> nvalues = new HashMap<>(values);
		for (Pair<String, Lazy<Value>> b : bindings) {
			nvalues.put(b.first(), b.second());
		}
		return new Environment(nvalues, enums, tags);
	}

	/**
	 * Bind a list of relations, each of which is computed on demand.
	 *
	 * @param bindings
	 * @return
	 */
	public Environment bindRelations(Collection<Pair<String, Lazy<Relation>>> bindings) {
		HashMap<String, Lazy<Value>> nvalues = new HashMap<>(values);
		for (Pair<String, Lazy<Relation>> b : bindings) {
			Lazy<Relation> r = b.second();
			nvalues.put(b.first(), Lazy.of(() -> new Value.Rel(r.get())));
		}
		return new Environment(nvalues, enums, tags);
	}

	/**
	 * Bind a list of event sets, each of which is computed on demand.
	 *
	 * @param bindings
	 * @return
	 */
	public Environment bindSets(Collection<Pair<String, Lazy<EventSet>>> bindings) {
		HashMap<String, Lazy<Value>> nvalues = new HashMap<>(values);
		for (Pair<String, Lazy<EventSet>> b : bindings) {
			Lazy<EventSet> s = b.second();
			nvalues.put(b.first(), Lazy.of(() -> new Value.Events(s.get())));
		}
		return new Environment(nvalues, enums, tags);
	}

	/**
	 * Construct an environment with the same enumerations as this, but whose
	 * values are exactly those given.
	 *
	 * @param nvalues
	 * @return
	 */
	public Environment withValues(Map<String, Lazy<Value>> nvalues) {
		return new Environment(new HashMap<>(nvalues), enums, tags);
	}

	/**
	 * Declare an enumeration along with its tags. Any tags previously declared by
	 * another enumeration are reassigned.
	 *
	 * @param name
	 * @param tagNames
	 * @return
	 */
	public Environment declareEnum(String name, List<String> tagNames) {
		HashMap<String, List<String>> nenums = new HashMap<>(enums);
		nenums.put(name, Collections.unmodifiableList(tagNames));
		HashMap<String, String> ntags = new HashMap<>(tags);
		for (String tag : tagNames) {
			ntags.put(tag, name);
		}
		return new Environment(values, nenums, ntags);
	}

	/**
	 * Get the tags declared by a given enumeration.
	 *
	 * @param name
	 * @return The list of tags, or <code>null</code> if no such enumeration.
	 */
	public List<String> enumTags(String name) {
		return enums.get(name);
	}

	/**
	 * Get the enumeration which declares a given tag.
	 *
	 * @param tag
	 * @return The enumeration name, or <code>null</code> if the tag is undeclared.
	 */
	public String tagEnum(String tag) {
		return tags.get(tag);
	}

	/**
	 * Get the set of all names bound in this environment.
	 *
	 * @return
	 */
	public Set<String> names() {
		return Collections.unmodifiableSet(values.keySet());
	}

	@Override
	public String toString() {
		return values.keySet().toString();
	}
}
