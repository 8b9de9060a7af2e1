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

import java.util.function.Supplier;

/**
 * A deferred computation which is evaluated at most once. The first call to
 * <code>get()</code> runs the underlying computation and caches its result;
 * subsequent calls return the cached result. Should the computation raise an
 * exception then nothing is cached, and the next call will try again.
 *
 * @author David J. Pearce
 *
 * @param <T>
 */
public final class Lazy<T> implements Supplier<T> {
	private Supplier<? extends T> computation;
	private T value;
	private boolean forcing;

	private Lazy(Supplier<? extends T> computation, T value) {
		this.computation = computation;
		this.value = value;
	}

	/**
	 * Construct a cell whose value will be computed on demand.
	 *
	 * @param computation
	 * @return
	 */
	public static <T> Lazy<T> of(Supplier<? extends T> computation) {
		return new Lazy<>(computation, null);
	}

	/**
	 * Construct a cell which has already been evaluated.
	 *
	 * @param value
	 * @return
	 */
	public static <T> Lazy<T> value(T value) {
		return new Lazy<>(null, value);
	}

	/**
	 * Check whether this cell has been evaluated yet.
	 *
	 * @return
	 */
	public boolean isForced() {
		return computation == null;
	}

	@Override
	public T get() {
		if (computation != null) {
			if (forcing) {
				throw new IllegalStateException("lazy value depends upon itself");
			}
			forcing = true;
			try {
				value = computation.get();
				computation = null;
			} finally {
				forcing = false;
			}
		}
		return value;
	}

	@Override
	public String toString() {
		return computation == null ? String.valueOf(value) : "<lazy>";
	}
}
