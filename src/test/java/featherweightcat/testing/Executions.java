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

package featherweightcat.testing;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import featherweightcat.core.Configuration;
import featherweightcat.core.Environment;
import featherweightcat.core.Event;
import featherweightcat.core.EventSet;
import featherweightcat.core.ExecutionContext;
import featherweightcat.core.Interpreter;
import featherweightcat.core.Relation;
import featherweightcat.core.State;
import featherweightcat.core.Syntax.Model;
import featherweightcat.core.Value;
import featherweightcat.io.ModelLoader;
import featherweightcat.util.Pair;

/**
 * Helpers for constructing small candidate executions and running models over
 * them.
 *
 * @author David J. Pearce
 *
 */
public class Executions {
	public static final Event e1 = new Event(1, "e1", "x");
	public static final Event e2 = new Event(2, "e2", "y");
	public static final Event e3 = new Event(3, "e3", "x");
	public static final Event e4 = new Event(4, "e4");

	public static final EventSet ALL = EventSet.of(e1, e2, e3, e4);

	/**
	 * Construct a relation from a flat list of events, taken two at a time as
	 * <code>(from,to)</code> pairs.
	 *
	 * @param events
	 * @return
	 */
	public static Relation rel(Event... events) {
		ArrayList<Pair<Event, Event>> edges = new ArrayList<>();
		for (int i = 0; i + 1 < events.length; i += 2) {
			edges.add(new Pair<>(events[i], events[i + 1]));
		}
		return Relation.of(edges);
	}

	public static ExecutionContext context() {
		return ExecutionContext.of(ALL, null);
	}

	/**
	 * The environment describing the candidate execution used throughout: a
	 * chain <code>e1 -&gt; e2 -&gt; e3</code> in program order, with
	 * <code>e4</code> as a fence.
	 *
	 * @return
	 */
	public static Environment environment() {
		return Environment.EMPTY.bind("po", new Value.Rel(rel(e1, e2, e2, e3)))
				.bind("ctrl", new Value.Rel(Relation.EMPTY))
				.bind("rf", new Value.Rel(rel(e1, e3)))
				.bind("W", new Value.Events(EventSet.of(e1, e2)))
				.bind("R", new Value.Events(EventSet.of(e3)))
				.bind("F", new Value.Events(EventSet.of(e4)))
				.bind("M", new Value.Events(EventSet.of(e1, e2, e3)));
	}

	public static Model parse(String text) {
		return ModelLoader.parse("test.cat", text);
	}

	/**
	 * Run a given model over the standard execution, returning the final state of
	 * every branch reaching the end.
	 *
	 * @param config
	 * @param text
	 * @return
	 */
	public static List<State> run(Configuration config, String text) {
		Interpreter interpreter = new Interpreter(config);
		return interpreter.interpret(parse(text), context(), environment());
	}

	public static List<State> run(String text) {
		return run(new Configuration.Builder().diagnostics(sink()).build(), text);
	}

	/**
	 * Evaluate a single expression over the standard execution.
	 *
	 * @param expr
	 * @return
	 */
	public static Value evaluate(String expr) {
		List<State> states = run("let it = " + expr);
		return states.get(0).environment().find("it");
	}

	/**
	 * A diagnostic stream which captures its output.
	 */
	public static class Capture {
		private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		private final PrintStream stream = new PrintStream(bytes, true, StandardCharsets.UTF_8);

		public PrintStream stream() {
			return stream;
		}

		@Override
		public String toString() {
			stream.flush();
			return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		}
	}

	public static PrintStream sink() {
		return new Capture().stream();
	}
}
