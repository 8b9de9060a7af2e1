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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import featherweightcat.util.Pair;

/**
 * The information gathered whilst interpreting an annotation file. This
 * records the scope and region enumerations, the annotations permitted on each
 * kind of event and the order between scopes.
 *
 * @author David J. Pearce
 *
 */
public final class BellInfo {
	public static final String SCOPES = "scopes";
	public static final String REGIONS = "regions";
	public static final String NARROWER = "narrower";

	public static final BellInfo EMPTY = new BellInfo(null, null, Collections.emptyMap(), null);

	/**
	 * Signals that some piece of information is given more than once.
	 */
	public static class AlreadyDefined extends RuntimeException {
		private static final long serialVersionUID = 1L;

		public AlreadyDefined(String name) {
			super(name);
		}
	}

	private final List<String> scopes;
	private final List<String> regions;
	private final Map<String, List<Set<String>>> events;
	private final Set<Pair<String, String>> scopeOrder;

	private BellInfo(List<String> scopes, List<String> regions, Map<String, List<Set<String>>> events,
			Set<Pair<String, String>> scopeOrder) {
		this.scopes = scopes;
		this.regions = regions;
		this.events = events;
		this.scopeOrder = scopeOrder;
	}

	/**
	 * Get the declared scopes, or <code>null</code> if none.
	 *
	 * @return
	 */
	public List<String> scopes() {
		return scopes;
	}

	/**
	 * Get the declared regions, or <code>null</code> if none.
	 *
	 * @return
	 */
	public List<String> regions() {
		return regions;
	}

	/**
	 * Get the sets of annotations permitted on each kind of event.
	 *
	 * @return
	 */
	public Map<String, List<Set<String>>> events() {
		return events;
	}

	/**
	 * Get the order between scopes, as pairs <code>(narrower,wider)</code>, or
	 * <code>null</code> if none.
	 *
	 * @return
	 */
	public Set<Pair<String, String>> scopeOrder() {
		return scopeOrder;
	}

	public BellInfo withScopes(List<String> tags) {
		if (scopes != null) {
			throw new AlreadyDefined(SCOPES);
		}
		return new BellInfo(Collections.unmodifiableList(new ArrayList<>(tags)), regions, events, scopeOrder);
	}

	public BellInfo withRegions(List<String> tags) {
		if (regions != null) {
			throw new AlreadyDefined(REGIONS);
		}
		return new BellInfo(scopes, Collections.unmodifiableList(new ArrayList<>(tags)), events, scopeOrder);
	}

	public BellInfo withEvents(String kind, List<Set<String>> annotations) {
		HashMap<String, List<Set<String>>> nevents = new HashMap<>(events);
		nevents.put(kind, Collections.unmodifiableList(new ArrayList<>(annotations)));
		return new BellInfo(scopes, regions, Collections.unmodifiableMap(nevents), scopeOrder);
	}

	public BellInfo withScopeOrder(Set<Pair<String, String>> order) {
		if (scopeOrder != null) {
			throw new AlreadyDefined(NARROWER);
		}
		return new BellInfo(scopes, regions, events, Collections.unmodifiableSet(new HashSet<>(order)));
	}

	/**
	 * Check whether a given order, consisting of pairs <code>(child,parent)</code>
	 * over a given set of nodes, forms a tree. That is, there is exactly one root
	 * without a parent, every other node has exactly one parent and following
	 * parents from any node never returns to it.
	 *
	 * @param nodes
	 * @param order
	 * @return
	 */
	public static boolean isHierarchy(Set<String> nodes, Set<Pair<String, String>> order) {
		HashMap<String, String> parents = new HashMap<>();
		for (Pair<String, String> p : order) {
			if (!nodes.contains(p.first()) || !nodes.contains(p.second())) {
				return false;
			} else if (parents.put(p.first(), p.second()) != null) {
				return false;
			}
		}
		int roots = 0;
		for (String n : nodes) {
			if (!parents.containsKey(n)) {
				roots++;
			}
			HashSet<String> visited = new HashSet<>();
			for (String m = n; m != null; m = parents.get(m)) {
				if (!visited.add(m)) {
					return false;
				}
			}
		}
		return nodes.isEmpty() || roots == 1;
	}

	/**
	 * Format an order for display, e.g. <code>{wi &lt; wg, wg &lt; dev}</code>.
	 *
	 * @param order
	 * @return
	 */
	public static String toString(Set<Pair<String, String>> order) {
		ArrayList<String> items = new ArrayList<>();
		for (Pair<String, String> p : order) {
			items.add(p.first() + " < " + p.second());
		}
		Collections.sort(items);
		return "{" + String.join(", ", items) + "}";
	}
}
