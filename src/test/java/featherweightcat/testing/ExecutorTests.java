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

import static featherweightcat.testing.EvaluatorTests.relation;
import static featherweightcat.testing.Executions.e1;
import static featherweightcat.testing.Executions.e2;
import static featherweightcat.testing.Executions.e3;
import static featherweightcat.testing.Executions.rel;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import featherweightcat.core.Configuration;
import featherweightcat.core.EvaluationFailure;
import featherweightcat.core.Relation;
import featherweightcat.core.State;
import featherweightcat.core.UserError;

/**
 * Tests for the execution of model instructions. Each test checks how many
 * branches of the model run to completion, and what state they finish in.
 *
 * @author David J. Pearce
 *
 */
public class ExecutorTests {

	// ==============================================================
	// Checks
	// ==============================================================

	@Test
	public void test_check_01() {
		checkAccepted("acyclic po");
	}

	@Test
	public void test_check_02() {
		checkAccepted("irreflexive po");
	}

	@Test
	public void test_check_03() {
		checkAccepted("empty po & rf");
	}

	@Test
	public void test_check_04() {
		checkRejected("acyclic po | po^-1");
	}

	@Test
	public void test_check_05() {
		checkRejected("irreflexive po?");
	}

	@Test
	public void test_check_06() {
		checkRejected("empty po");
	}

	@Test
	public void test_check_07() {
		// Only the failing check matters
		checkRejected("acyclic po\nempty rf\nirreflexive po");
	}

	@Test
	public void test_check_08() {
		List<State> states = Executions.run("undefined_unless empty po");
		assertEquals(1, states.size());
		assertTrue(states.get(0).undefined());
	}

	@Test
	public void test_check_09() {
		List<State> states = Executions.run("undefined_unless empty rf & po");
		assertEquals(1, states.size());
		assertFalse(states.get(0).undefined());
	}

	@Test
	public void test_check_10() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> Executions.run("acyclic W"));
		assertEquals("relation expected", e.getMessage());
	}

	@Test
	public void test_check_11() {
		// Only relations may be checked, so 0 rather than {} is the empty relation
		checkAccepted("acyclic 0");
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> Executions.run("acyclic {}"));
		assertEquals("relation expected", e.getMessage());
		e = assertThrows(EvaluationFailure.class, () -> Executions.run("empty _"));
		assertEquals("relation expected", e.getMessage());
	}

	@Test
	public void test_skip_01() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().skipChecks("sc").diagnostics(out.stream()).build();
		List<State> states = Executions.run(config, "empty po as sc");
		assertEquals(1, states.size());
		assertTrue(out.toString().contains("Warning: Skipping check sc"));
	}

	@Test
	public void test_skip_02() {
		Configuration config = new Configuration.Builder().skipChecks("sc").strictSkip(true)
				.diagnostics(Executions.sink()).build();
		List<State> states = Executions.run(config, "empty po as sc");
		assertEquals(1, states.size());
		assertTrue(states.get(0).skipped().contains("sc"));
	}

	@Test
	public void test_skip_03() {
		// Strict skipping of a check which holds records nothing
		Configuration config = new Configuration.Builder().skipChecks("sc").strictSkip(true)
				.diagnostics(Executions.sink()).build();
		List<State> states = Executions.run(config, "acyclic po as sc");
		assertEquals(1, states.size());
		assertTrue(states.get(0).skipped().isEmpty());
	}

	@Test
	public void test_skip_04() {
		Configuration config = new Configuration.Builder().skipChecks("other").diagnostics(Executions.sink())
				.build();
		assertEquals(0, Executions.run(config, "empty po as sc").size());
	}

	@Test
	public void test_through_01() {
		Configuration config = new Configuration.Builder().through(Configuration.Through.ALL)
				.diagnostics(Executions.sink()).build();
		assertEquals(1, Executions.run(config, "empty po").size());
	}

	@Test
	public void test_failure_01() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().debug(true).verbose(1).diagnostics(out.stream()).build();
		assertEquals(0, Executions.run(config, "acyclic po | po^-1").size());
		String output = out.toString();
		assertTrue(output.contains("test: Failure of 'acyclic po | po^-1'"));
		assertTrue(output.contains("CY: "));
	}

	// ==============================================================
	// Iteration
	// ==============================================================

	@Test
	public void test_forall_01() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().diagnostics(out.stream()).build();
		List<State> states = Executions.run(config, "enum C = 'a || 'b || 'c\nforall x in C do debug x end");
		assertEquals(1, states.size());
		assertEquals(3, count(out.toString(), "value is"));
	}

	@Test
	public void test_forall_02() {
		String input = "enum C = 'a || 'b || 'c\nforall x in C do empty (match x with 'b -> po || _ -> 0 end) end";
		checkRejected(input);
	}

	@Test
	public void test_forall_03() {
		// The loop variable is not visible afterwards
		List<State> states = Executions.run("enum C = 'a || 'b\nforall x in C do let y = x end");
		assertEquals(1, states.size());
		assertFalse(states.get(0).environment().isBound("x"));
		assertFalse(states.get(0).environment().isBound("y"));
	}

	@Test
	public void test_forall_04() {
		checkAccepted("forall x in {} do empty po end");
	}

	@Test
	public void test_withfrom_01() {
		List<State> states = Executions.run("with x from {po, rf}\nacyclic x");
		assertEquals(2, states.size());
	}

	@Test
	public void test_withfrom_02() {
		List<State> states = Executions.run("with x from {po, rf}\nempty x & rf");
		assertEquals(1, states.size());
		assertEquals(rel(e1, e2, e2, e3), relation(states.get(0).environment().find("x")));
	}

	@Test
	public void test_withfrom_03() {
		checkRejected("with x from {}");
	}

	// ==============================================================
	// Procedures
	// ==============================================================

	@Test
	public void test_procedure_01() {
		checkAccepted("procedure p(r) = acyclic r end\ncall p(po)");
	}

	@Test
	public void test_procedure_02() {
		checkRejected("procedure p(r) = acyclic r end\ncall p(po | po^-1)");
	}

	@Test
	public void test_procedure_03() {
		List<State> states = Executions.run("procedure p(r) = let z = r end\ncall p(po)");
		assertEquals(1, states.size());
		assertFalse(states.get(0).environment().isBound("z"));
		assertTrue(states.get(0).stack().isEmpty());
	}

	@Test
	public void test_procedure_04() {
		// Procedures see the names bound where they are declared
		String input = "let r = po\nprocedure p() = empty r & rf end\nlet r = rf\ncall p()";
		checkAccepted(input);
	}

	@Test
	public void test_procedure_05() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class,
				() -> Executions.run("procedure p(r) = acyclic r end\ncall p(po, rf)"));
		assertEquals("argument_mismatch", e.getMessage());
	}

	@Test
	public void test_procedure_06() {
		assertThrows(UserError.class, () -> Executions.run("let p = po\ncall p(po)"));
	}

	@Test
	public void test_proceduretest_01() {
		checkRejected("procedure p(r) = acyclic r end\ncall p(po | po^-1) as chk");
	}

	@Test
	public void test_proceduretest_02() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().skipChecks("chk").diagnostics(out.stream()).build();
		String input = "procedure p(r) = acyclic r end\ncall p(po | po^-1) as chk";
		assertEquals(1, Executions.run(config, input).size());
		assertTrue(out.toString().contains("Warning: Skipping check chk"));
	}

	// ==============================================================
	// Include
	// ==============================================================

	@Test
	public void test_include_01() {
		List<State> states = Executions.run("include \"extra.cat\"\nempty extra \\ (po;po)");
		assertEquals(1, states.size());
		assertEquals(rel(e1, e3), relation(states.get(0).environment().find("extra")));
	}

	@Test
	public void test_include_02() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class,
				() -> Executions.run("include \"missing.cat\""));
		assertEquals("cannot find file missing.cat", e.getMessage());
	}

	@Test
	public void test_include_03() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().diagnostics(out.stream()).build();
		EvaluationFailure e = assertThrows(EvaluationFailure.class,
				() -> Executions.run(config, "include \"broken.cat\""));
		assertEquals("syntax error in \"broken.cat\"", e.getMessage());
		assertTrue(out.toString().contains("unexpected end-of-file"));
	}

	// ==============================================================
	// Display
	// ==============================================================

	@Test
	public void test_debug_01() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().diagnostics(out.stream()).build();
		Executions.run(config, "debug po");
		assertTrue(out.toString().contains("File \"test.cat\", line 1, characters 6-8: value is {e1->e2,e2->e3}"));
	}

	@Test
	public void test_show_01() {
		Configuration config = new Configuration.Builder().doShow("po").diagnostics(Executions.sink()).build();
		List<State> states = Executions.run(config, "show po");
		Map<String, Relation> show = states.get(0).show();
		assertEquals(rel(e1, e2, e2, e3), show.get("po"));
	}

	@Test
	public void test_show_02() {
		// Transitive edges are omitted from display
		Configuration config = new Configuration.Builder().doShow("t").diagnostics(Executions.sink()).build();
		List<State> states = Executions.run(config, "let t = po+");
		assertEquals(rel(e1, e2, e2, e3), states.get(0).show().get("t"));
	}

	@Test
	public void test_show_03() {
		Configuration config = new Configuration.Builder().doShow("t").showRaw("t").diagnostics(Executions.sink())
				.build();
		List<State> states = Executions.run(config, "let t = po+");
		assertEquals(rel(e1, e2, e2, e3, e1, e3), states.get(0).show().get("t"));
	}

	@Test
	public void test_show_04() {
		Configuration config = new Configuration.Builder().showAll(true).diagnostics(Executions.sink()).build();
		List<State> states = Executions.run(config, "show po;po as pp\nshow rf\nunshow rf");
		Map<String, Relation> show = states.get(0).show();
		assertEquals(rel(e1, e3), show.get("pp"));
		assertFalse(show.containsKey("rf"));
	}

	@Test
	public void test_show_05() {
		Executions.Capture out = new Executions.Capture();
		Configuration config = new Configuration.Builder().showAll(true).diagnostics(out.stream()).build();
		List<State> states = Executions.run(config, "show W");
		assertTrue(states.get(0).show().get("W").isEmpty());
		assertTrue(out.toString().contains("Warning show: W is not a relation"));
	}

	@Test
	public void test_show_06() {
		// Nothing is displayed unless requested
		List<State> states = Executions.run("show po");
		assertTrue(states.get(0).show().isEmpty());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static void checkAccepted(String input) {
		List<State> states = Executions.run(input);
		assertEquals(1, states.size());
		assertFalse(states.get(0).undefined());
	}

	private static void checkRejected(String input) {
		assertEquals(0, Executions.run(input).size());
	}

	private static int count(String text, String word) {
		int n = 0;
		for (int i = text.indexOf(word); i >= 0; i = text.indexOf(word, i + 1)) {
			n++;
		}
		return n;
	}
}
