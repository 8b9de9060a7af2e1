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
import java.util.List;
import java.util.Map;

import featherweightcat.core.Executor.Continuation;
import featherweightcat.core.Syntax.Model;
import featherweightcat.io.ModelLoader;
import featherweightcat.util.Lazy;

/**
 * The entry point for checking one candidate execution against a model. The
 * built-in primitives are bound first, then the standard library is included,
 * followed by the annotation file (if any) and finally the model itself. The
 * annotations recorded whilst reading the annotation file remain available to
 * the model.
 *
 * @author David J. Pearce
 *
 */
public class Interpreter {
	public static final String STDLIB = "stdlib.cat";

	private final Configuration config;
	private final ModelLoader loader;

	public Interpreter(Configuration config) {
		this(config, new ModelLoader(config.includePath()));
	}

	public Interpreter(Configuration config, ModelLoader loader) {
		this.config = config;
		this.loader = loader;
	}

	public Configuration configuration() {
		return config;
	}

	/**
	 * Interpret a model over a given candidate execution. The continuation is
	 * applied to the final state of every branch of the model which runs to
	 * completion, threading the accumulated result through.
	 *
	 * @param model   The model to check.
	 * @param context The candidate execution.
	 * @param initial The relations and sets describing the candidate, along with
	 *                any other predefined names.
	 * @param kont
	 * @param res     The initial result.
	 * @return
	 */
	public <R> R interpret(Model model, ExecutionContext context, Environment initial, Continuation<R> kont, R res) {
		Evaluator evaluator = new Evaluator(context, config);
		Executor executor = new Executor(evaluator, loader);
		Environment env = Primitives.bind(initial);
		State st = State.initial(env, initialShow(executor, env));
		return executor.include(st, STDLIB, (st1, r1) -> {
			if (config.bellFile() != null) {
				// The annotation file is always read in annotation mode
				Configuration bellConfig = new Configuration.Builder(config).bell(true).build();
				Executor bell = new Executor(new Evaluator(context, bellConfig), loader);
				return bell.include(st1, config.bellFile(), (st2, r2) -> executor.run(st2, model.instructions(), kont, r2),
						r1);
			} else {
				return executor.run(st1, model.instructions(), kont, r1);
			}
		}, res);
	}

	/**
	 * Interpret a model, collecting the final state of every branch which runs to
	 * completion. An empty list means the candidate is rejected by the model.
	 *
	 * @param model
	 * @param context
	 * @param initial
	 * @return
	 */
	public List<State> interpret(Model model, ExecutionContext context, Environment initial) {
		List<State> states = interpret(model, context, initial, (st, r) -> {
			ArrayList<State> nr = new ArrayList<>(r);
			nr.add(st);
			return nr;
		}, new ArrayList<State>());
		return Collections.unmodifiableList(states);
	}

	private Lazy<Map<String, Relation>> initialShow(Executor executor, Environment env) {
		if (!config.showSome()) {
			return Lazy.value(Collections.emptyMap());
		}
		return Lazy.of(() -> {
			HashMap<String, Relation> m = new HashMap<>();
			for (String name : config.doShow()) {
				if (env.isBound(name)) {
					m.put(name, executor.findShowRelation(env, name));
				}
			}
			return m;
		});
	}
}
