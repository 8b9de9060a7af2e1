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

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The options which control a run of the interpreter. A configuration is
 * immutable, and is constructed using a {@link Builder}.
 *
 * @author David J. Pearce
 *
 */
public final class Configuration {
	/**
	 * Determines whether failing checks are honoured.
	 */
	public enum Through {
		/**
		 * Failing checks reject the execution as normal.
		 */
		NONE,
		/**
		 * Failing checks are ignored, so that every execution is accepted.
		 */
		INVALID,
		/**
		 * Everything is let through.
		 */
		ALL
	}

	public static final Configuration DEFAULT = new Builder().build();

	private final boolean debug;
	private final int verbose;
	private final Set<String> skipChecks;
	private final boolean strictSkip;
	private final Set<String> doShow;
	private final boolean showAll;
	private final Set<String> symmetric;
	private final Set<String> showRaw;
	private final Through through;
	private final boolean bell;
	private final String bellFile;
	private final List<File> includePath;
	private final PrintStream diagnostics;

	private Configuration(Builder b) {
		this.debug = b.debug;
		this.verbose = b.verbose;
		this.skipChecks = Collections.unmodifiableSet(new HashSet<>(b.skipChecks));
		this.strictSkip = b.strictSkip;
		this.doShow = Collections.unmodifiableSet(new HashSet<>(b.doShow));
		this.showAll = b.showAll;
		this.symmetric = Collections.unmodifiableSet(new HashSet<>(b.symmetric));
		this.showRaw = Collections.unmodifiableSet(new HashSet<>(b.showRaw));
		this.through = b.through;
		this.bell = b.bell;
		this.bellFile = b.bellFile;
		this.includePath = Collections.unmodifiableList(new ArrayList<>(b.includePath));
		this.diagnostics = b.diagnostics;
	}

	public boolean debug() {
		return debug;
	}

	public int verbose() {
		return verbose;
	}

	/**
	 * Get the names of checks which should be skipped.
	 *
	 * @return
	 */
	public Set<String> skipChecks() {
		return skipChecks;
	}

	/**
	 * Determine whether skipped checks are still evaluated, such that failures are
	 * recorded rather than ignored.
	 *
	 * @return
	 */
	public boolean strictSkip() {
		return strictSkip;
	}

	public Set<String> doShow() {
		return doShow;
	}

	/**
	 * Determine whether anything is to be displayed at all.
	 *
	 * @return
	 */
	public boolean showSome() {
		return showAll || !doShow.isEmpty();
	}

	public Set<String> symmetric() {
		return symmetric;
	}

	public Set<String> showRaw() {
		return showRaw;
	}

	public Through through() {
		return through;
	}

	/**
	 * Determine whether we are interpreting an annotation file, rather than a
	 * model.
	 *
	 * @return
	 */
	public boolean bell() {
		return bell;
	}

	/**
	 * Get the annotation file to be included before the model, or
	 * <code>null</code> if none.
	 *
	 * @return
	 */
	public String bellFile() {
		return bellFile;
	}

	public List<File> includePath() {
		return includePath;
	}

	/**
	 * Get the stream to which errors, warnings and debug output are written.
	 *
	 * @return
	 */
	public PrintStream diagnostics() {
		return diagnostics;
	}

	/**
	 * Adjust the outcome of a check according to the <code>through</code> option.
	 *
	 * @param ok
	 * @return
	 */
	public boolean checkThrough(boolean ok) {
		return ok || through != Through.NONE;
	}

	public static class Builder {
		private boolean debug = false;
		private int verbose = 0;
		private Set<String> skipChecks = new HashSet<>();
		private boolean strictSkip = false;
		private Set<String> doShow = new HashSet<>();
		private boolean showAll = false;
		private Set<String> symmetric = new HashSet<>();
		private Set<String> showRaw = new HashSet<>();
		private Through through = Through.NONE;
		private boolean bell = false;
		private String bellFile = null;
		private List<File> includePath = new ArrayList<>();
		private PrintStream diagnostics = System.err;

		public Builder() {
		}

		public Builder(Configuration c) {
			this.debug = c.debug;
			this.verbose = c.verbose;
			this.skipChecks = new HashSet<>(c.skipChecks);
			this.strictSkip = c.strictSkip;
			this.doShow = new HashSet<>(c.doShow);
			this.showAll = c.showAll;
			this.symmetric = new HashSet<>(c.symmetric);
			this.showRaw = new HashSet<>(c.showRaw);
			this.through = c.through;
			this.bell = c.bell;
			this.bellFile = c.bellFile;
			this.includePath = new ArrayList<>(c.includePath);
			this.diagnostics = c.diagnostics;
		}

		public Builder debug(boolean flag) {
			this.debug = flag;
			return this;
		}

		public Builder verbose(int level) {
			this.verbose = level;
			return this;
		}

		public Builder skipChecks(String... names) {
			return skipChecks(Arrays.asList(names));
		}

		public Builder skipChecks(Collection<String> names) {
			this.skipChecks.addAll(names);
			return this;
		}

		public Builder strictSkip(boolean flag) {
			this.strictSkip = flag;
			return this;
		}

		public Builder doShow(String... names) {
			this.doShow.addAll(Arrays.asList(names));
			return this;
		}

		public Builder showAll(boolean flag) {
			this.showAll = flag;
			return this;
		}

		public Builder symmetric(String... names) {
			this.symmetric.addAll(Arrays.asList(names));
			return this;
		}

		public Builder showRaw(String... names) {
			this.showRaw.addAll(Arrays.asList(names));
			return this;
		}

		public Builder through(Through through) {
			this.through = through;
			return this;
		}

		public Builder bell(boolean flag) {
			this.bell = flag;
			return this;
		}

		public Builder bellFile(String filename) {
			this.bellFile = filename;
			return this;
		}

		public Builder includePath(File... dirs) {
			this.includePath.addAll(Arrays.asList(dirs));
			return this;
		}

		public Builder diagnostics(PrintStream output) {
			this.diagnostics = output;
			return this;
		}

		public Configuration build() {
			return new Configuration(this);
		}
	}
}
