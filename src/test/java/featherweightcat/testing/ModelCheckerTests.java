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

import static featherweightcat.testing.Executions.e1;
import static featherweightcat.testing.Executions.e2;
import static featherweightcat.testing.Executions.e3;
import static featherweightcat.testing.Executions.rel;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import featherweightcat.core.Configuration;
import featherweightcat.core.Environment;
import featherweightcat.core.Interpreter;
import featherweightcat.core.ModelChecker;
import featherweightcat.core.ModelChecker.Candidate;
import featherweightcat.core.ModelChecker.Outcome;
import featherweightcat.core.ModelChecker.Verdict;
import featherweightcat.core.Value;

/**
 * Tests for checking a model against several candidate executions.
 *
 * @author David J. Pearce
 *
 */
public class ModelCheckerTests {

	@Test
	public void test_candidate_01() {
		assertEquals(Outcome.CONSISTENT, checker("acyclic po").check(consistent(true)));
	}

	@Test
	public void test_candidate_02() {
		Outcome outcome = checker("acyclic po").check(cyclic(true));
		assertEquals(Outcome.REJECTED, outcome);
		assertFalse(outcome.isConsistent());
	}

	@Test
	public void test_candidate_03() {
		assertEquals(Outcome.UNDEFINED, checker("undefined_unless empty rf").check(consistent(true)));
	}

	@Test
	public void test_candidate_04() {
		// Only one of two branches is consistent
		assertEquals(Outcome.CONSISTENT, checker("with x from {po, po | po^-1}\nacyclic x").check(consistent(true)));
	}

	@Test
	public void test_verdict_01() {
		Verdict v = checker("acyclic po").check(Arrays.asList(consistent(true), cyclic(true), consistent(false)));
		assertTrue(v.isAllowed());
		assertEquals(1, v.positive());
		assertEquals(1, v.negative());
		assertFalse(v.undefined());
		assertEquals("Allowed, 1 positive / 1 negative", v.toString());
	}

	@Test
	public void test_verdict_02() {
		Verdict v = checker("acyclic po").check(Arrays.asList(cyclic(true), consistent(false)));
		assertFalse(v.isAllowed());
		assertEquals("Forbidden, 0 positive / 1 negative", v.toString());
	}

	@Test
	public void test_verdict_03() {
		Verdict v = checker("undefined_unless empty rf").check(Arrays.asList(consistent(true)));
		assertTrue(v.undefined());
		assertEquals("Allowed, 1 positive / 0 negative, undefined", v.toString());
	}

	@Test
	public void test_verdict_04() {
		Verdict v = checker("acyclic po").check(Arrays.asList());
		assertEquals("Forbidden, 0 positive / 0 negative", v.toString());
	}

	private static ModelChecker checker(String text) {
		Configuration config = new Configuration.Builder().diagnostics(Executions.sink()).build();
		return new ModelChecker(new Interpreter(config), Executions.parse(text));
	}

	private static Candidate consistent(boolean condition) {
		return new Candidate(Executions.context(), Executions.environment(), condition);
	}

	private static Candidate cyclic(boolean condition) {
		Environment env = Executions.environment().bind("po", new Value.Rel(rel(e1, e2, e2, e3, e3, e1)));
		return new Candidate(Executions.context(), env, condition);
	}
}
