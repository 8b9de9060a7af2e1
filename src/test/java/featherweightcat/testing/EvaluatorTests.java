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

import static featherweightcat.testing.Executions.ALL;
import static featherweightcat.testing.Executions.e1;
import static featherweightcat.testing.Executions.e2;
import static featherweightcat.testing.Executions.e3;
import static featherweightcat.testing.Executions.e4;
import static featherweightcat.testing.Executions.evaluate;
import static featherweightcat.testing.Executions.rel;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import featherweightcat.core.EvaluationFailure;
import featherweightcat.core.EventSet;
import featherweightcat.core.Relation;
import featherweightcat.core.State;
import featherweightcat.core.Value;

/**
 * Tests for the evaluation of expressions over a small candidate execution.
 *
 * @author David J. Pearce
 *
 */
public class EvaluatorTests {

	// ==============================================================
	// Relations
	// ==============================================================

	@Test
	public void test_seq_01() {
		checkRelation("po;po", rel(e1, e3));
	}

	@Test
	public void test_seq_02() {
		checkRelation("po;rf", Relation.EMPTY);
	}

	@Test
	public void test_inter_01() {
		checkRelation("po & rf", Relation.EMPTY);
	}

	@Test
	public void test_inter_02() {
		// Intersection with a cartesian product filters the relation
		checkRelation("po & (W * R)", rel(e2, e3));
	}

	@Test
	public void test_union_01() {
		checkRelation("po | rf", rel(e1, e2, e2, e3, e1, e3));
	}

	@Test
	public void test_diff_01() {
		checkRelation("(po | rf) \\ rf", rel(e1, e2, e2, e3));
	}

	@Test
	public void test_plus_01() {
		checkRelation("po+", rel(e1, e2, e2, e3, e1, e3));
	}

	@Test
	public void test_star_01() {
		Relation id = Relation.identity(ALL);
		checkRelation("po*", rel(e1, e2, e2, e3, e1, e3).union(id));
	}

	@Test
	public void test_opt_01() {
		Relation id = Relation.identity(ALL);
		checkRelation("po?", rel(e1, e2, e2, e3).union(id));
	}

	@Test
	public void test_inverse_01() {
		checkRelation("po^-1", rel(e2, e1, e3, e2));
	}

	@Test
	public void test_cartesian_01() {
		checkRelation("W * R", rel(e1, e3, e2, e3));
	}

	@Test
	public void test_complement_01() {
		checkRelation("~po & (M * M)", rel(e1, e1, e1, e3, e2, e1, e2, e2, e3, e1, e3, e2, e3, e3));
	}

	@Test
	public void test_empty_01() {
		checkRelation("0", Relation.EMPTY);
	}

	// ==============================================================
	// Sets
	// ==============================================================

	@Test
	public void test_set_01() {
		checkEvents("~W", EventSet.of(e3, e4));
	}

	@Test
	public void test_set_02() {
		checkEvents("~~W", EventSet.of(e1, e2));
	}

	@Test
	public void test_set_03() {
		checkEvents("W | {}", EventSet.of(e1, e2));
	}

	@Test
	public void test_set_04() {
		assertSame(Value.UNIVERSE, evaluate("W | _"));
	}

	@Test
	public void test_set_05() {
		assertEquals(evaluate("{po}"), evaluate("{po} | {}"));
	}

	@Test
	public void test_set_06() {
		checkEvents("M \\ W", EventSet.of(e3));
	}

	@Test
	public void test_set_07() {
		assertSame(Value.EMPTY, evaluate("{}"));
	}

	@Test
	public void test_domain_01() {
		checkEvents("domain(po)", EventSet.of(e1, e2));
	}

	@Test
	public void test_range_01() {
		checkEvents("range(po)", EventSet.of(e2, e3));
	}

	@Test
	public void test_add_01() {
		Value v = evaluate("po ++ {rf}");
		assertTrue(v instanceof Value.TypedSet);
		assertEquals(2, ((Value.TypedSet) v).values().size());
	}

	// ==============================================================
	// Functions
	// ==============================================================

	@Test
	public void test_function_01() {
		checkRelation("let f(x) = x ; x in f(po)", rel(e1, e3));
	}

	@Test
	public void test_function_02() {
		checkRelation("(fun x -> x | rf)(po)", rel(e1, e2, e2, e3, e1, e3));
	}

	@Test
	public void test_function_03() {
		checkRelation("(fun (x,y) -> x & y)(po, po+)", rel(e1, e2, e2, e3));
	}

	@Test
	public void test_function_04() {
		// A closure sees the bindings in scope where it was defined
		checkRelation("let r = po in let f(x) = x | r in let r = rf in f(0)", rel(e1, e2, e2, e3));
	}

	@Test
	public void test_stdlib_01() {
		checkRelation("fencerel(W)", rel(e1, e3));
	}

	@Test
	public void test_stdlib_02() {
		checkRelation("singlestep(po+)", rel(e1, e2, e2, e3));
	}

	@Test
	public void test_matchset_01() {
		String input = "let rec all(S) = match S with {} -> 0 || x ++ xs -> x | all(xs) end in all({po, rf})";
		checkRelation(input, rel(e1, e2, e2, e3, e1, e3));
	}

	@Test
	public void test_try_01() {
		checkRelation("try nothing with po", rel(e1, e2, e2, e3));
	}

	@Test
	public void test_try_02() {
		checkRelation("try po with rf", rel(e1, e2, e2, e3));
	}

	// ==============================================================
	// Tags
	// ==============================================================

	@Test
	public void test_match_01() {
		List<State> states = Executions.run("enum Colour = 'red || 'green\nlet it = match 'green with 'red -> po || 'green -> rf end");
		assertEquals(rel(e1, e3), relation(states.get(0).environment().find("it")));
	}

	@Test
	public void test_match_02() {
		List<State> states = Executions.run("enum Colour = 'red || 'green\nlet it = match 'green with 'red -> po || _ -> 0 end");
		assertEquals(Relation.EMPTY, relation(states.get(0).environment().find("it")));
	}

	@Test
	public void test_tags_01() {
		List<State> states = Executions.run("enum C = 'a || 'b || 'c\nlet it = ~{'a}");
		Value v = states.get(0).environment().find("it");
		assertEquals(2, ((Value.TypedSet) v).values().size());
	}

	@Test
	public void test_tags_02() {
		List<State> states = Executions.run("enum C = 'a || 'b || 'c\nlet it = C");
		Value v = states.get(0).environment().find("it");
		assertEquals("{'a,'b,'c}", v.pretty());
	}

	// ==============================================================
	// Errors
	// ==============================================================

	@Test
	public void test_error_01() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("nothing"));
		assertEquals("unbound var: nothing", e.getMessage());
	}

	@Test
	public void test_error_02() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("po | W"));
		assertEquals("type rel expected, event set found", e.getMessage());
	}

	@Test
	public void test_error_03() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("W+"));
		assertEquals("type rel expected, event set found", e.getMessage());
	}

	@Test
	public void test_error_04() {
		// Failures within a function are reported again at the call site
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("(fun x -> x+)(W)"));
		assertEquals("Calling", e.getMessage());
	}

	@Test
	public void test_error_05() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("(fun x -> x)(po, rf)"));
		assertEquals("argument_mismatch", e.getMessage());
	}

	@Test
	public void test_error_06() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("domain(W)"));
		assertEquals("primitive domain: argument mismatch", e.getMessage());
	}

	@Test
	public void test_error_07() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("{_}"));
		assertEquals("universe in explicit set", e.getMessage());
	}

	@Test
	public void test_error_08() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("_ ++ {po}"));
		assertEquals("universe in set ++", e.getMessage());
	}

	@Test
	public void test_error_09() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("{po, W}"));
		assertEquals("type rel expected, event set found", e.getMessage());
	}

	@Test
	public void test_error_10() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("W ++ {po}"));
		assertEquals("Heterogeneous set elements: types event set and rel", e.getMessage());
	}

	@Test
	public void test_error_11() {
		// Types are reported in the order of the operands
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("{} ++ {fun x -> x}"));
		assertEquals("Heterogeneous set elements: types {} and closure", e.getMessage());
		e = assertThrows(EvaluationFailure.class, () -> evaluate("(fun x -> x) ++ {{}}"));
		assertEquals("Heterogeneous set elements: types closure and {}", e.getMessage());
	}

	@Test
	public void test_error_12() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("po & W"));
		assertEquals("mixing sets and relations in intersection", e.getMessage());
	}

	@Test
	public void test_error_13() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("po \\ W"));
		assertEquals("mixing set and relation in difference", e.getMessage());
	}

	@Test
	public void test_error_14() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class,
				() -> evaluate("match _ with {} -> 0 || x ++ xs -> x end"));
		assertEquals("Cannot set-match on universe", e.getMessage());
	}

	@Test
	public void test_error_15() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("match po with 'a -> po end"));
		assertEquals("matching on non-tag value of type 'rel'", e.getMessage());
	}

	@Test
	public void test_error_16() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class,
				() -> evaluateWith("enum C = 'a || 'b", "match 'b with 'a -> po end"));
		assertEquals("pattern matching failed on value 'b'", e.getMessage());
	}

	@Test
	public void test_error_17() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class, () -> evaluate("{fun x -> x, fun y -> y}"));
		assertEquals("Sets of closure are illegal", e.getMessage());
	}

	// ==============================================================
	// Sets of functions
	// ==============================================================

	@Test
	public void test_functions_01() {
		Value v = evaluate("{fun x -> x}");
		assertEquals(1, ((Value.TypedSet) v).values().size());
	}

	@Test
	public void test_functions_02() {
		Value v = evaluate("(fun x -> x) ++ {}");
		assertEquals(1, ((Value.TypedSet) v).values().size());
	}

	@Test
	public void test_functions_03() {
		// Illegal comparisons are ordinary failures, so can be recovered from
		checkRelation("try {fun x -> x, fun y -> y} with 0", Relation.EMPTY);
		checkRelation("try {} ++ {fun x -> x} with po", rel(e1, e2, e2, e3));
	}

	@Test
	public void test_tags_03() {
		Value v = evaluateWith("enum C = 'a || 'b || 'c", "~(~{'a,'b})");
		assertEquals(evaluateWith("enum C = 'a || 'b || 'c", "{'a,'b}"), v);
		assertEquals("{'a,'b}", v.pretty());
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Value evaluateWith(String declarations, String expr) {
		List<State> states = Executions.run(declarations + "\nlet it = " + expr);
		return states.get(0).environment().find("it");
	}

	private static void checkRelation(String input, Relation expected) {
		assertEquals(expected, relation(evaluate(input)));
	}

	private static void checkEvents(String input, EventSet expected) {
		Value v = evaluate(input);
		if (!(v instanceof Value.Events)) {
			fail("expected event set, found " + v.pretty());
		}
		assertEquals(expected, ((Value.Events) v).events());
	}

	static Relation relation(Value v) {
		if (!(v instanceof Value.Rel)) {
			fail("expected relation, found " + v.pretty());
		}
		return ((Value.Rel) v).relation();
	}
}
