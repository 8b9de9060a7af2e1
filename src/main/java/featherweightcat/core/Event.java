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
 * An event in a candidate execution (e.g. a read, a write or a fence). Events
 * are opaque as far as the interpreter is concerned: they are identified by a
 * unique integer and ordered accordingly. The name and location are used only
 * for display and by the <code>partition</code> primitive.
 *
 * @author David J. Pearce
 *
 */
public final class Event implements Comparable<Event> {
	private final int id;
	private final String name;
	private final String location;

	public Event(int id, String name) {
		this(id, name, null);
	}

	public Event(int id, String name, String location) {
		this.id = id;
		this.name = name;
		this.location = location;
	}

	/**
	 * Get the unique identifier of this event within its execution.
	 *
	 * @return
	 */
	public int id() {
		return id;
	}

	public String name() {
		return name;
	}

	/**
	 * Get the memory location accessed by this event, or <code>null</code> if it
	 * accesses none (e.g. a fence).
	 *
	 * @return
	 */
	public String location() {
		return location;
	}

	@Override
	public int compareTo(Event o) {
		return Integer.compare(id, o.id);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Event && ((Event) o).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	public String toString() {
		return name;
	}
}
