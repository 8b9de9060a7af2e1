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
import static featherweightcat.testing.Executions.evaluate;
import static featherweightcat.testing.Executions.rel;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import featherweightcat.core.Environment;
import featherweightcat.core.EvaluationFailure;
import featherweightcat.core.EventSet;
import featherweightcat.core.Primitives;
import featherweightcat.core.Relation;
import featherweightcat.core.Value;

/**
 * Tests for the built-in functions available to every model.
 *
 * @author David J. Pearce
 *
 */
public class PrimitivesTests {
	private static final Value.Events E123 = new Value.Events(EventSet.of(e1, e2, e3));

	@Test
	public void test_partition_01() {
		Value.TypedSet parts = (Value.TypedSet) Primitives.partition(List.of(new Value.Events(ALL)));
		// e4 accesses no location
		assertEquals(2, parts.values().size());
		assertTrue(parts.values().contains(new Value.Events(EventSet.of(e1, e3))));
		assertTrue(parts.values().contains(new Value.Events(EventSet.of(e2))));
	}

	@Test
	public void test_partition_02() {
		Value.TypedSet parts = (Value.TypedSet) evaluate("partition(W)");
		assertEquals(2, parts.values().size());
	}

	@Test
	public void test_linearisations_01() {
		List<Value> args = Arrays.asList(E123, new Value.Rel(Relation.EMPTY));
		Value.TypedSet orders = (Value.TypedSet) Primitives.linearisations(args);
		assertEquals(6, orders.values().size());
	}

	@Test
	public void test_linearisations_02() {
		List<Value> args = Arrays.asList(E123, new Value.Rel(rel(e1, e2, e2, e3)));
		Value.TypedSet orders = (Value.TypedSet) Primitives.linearisations(args);
		assertEquals(1, orders.values().size());
		assertTrue(orders.values().contains(new Value.Rel(rel(e1, e2, e2, e3, e1, e3))));
	}

	@Test
	public void test_linearisations_03() {
		// Only the part of the relation between the given events matters
		List<Value> args = Arrays.asList(new Value.Events(EventSet.of(e1, e2)), new Value.Rel(rel(e2, e1, e2, e3)));
		Value.TypedSet orders = (Value.TypedSet) Primitives.linearisations(args);
		assertEquals(1, orders.values().size());
		assertTrue(orders.values().contains(new Value.Rel(rel(e2, e1))));
	}

	@Test
	public void test_linearisations_04() {
		// A cyclic relation cannot be linearised
		Relation cycle = rel(e1, e2, e2, e1);
		List<Value> args = Arrays.asList(E123, new Value.Rel(cycle));
		Value.TypedSet orders = (Value.TypedSet) Primitives.linearisations(args);
		assertEquals(1, orders.values().size());
		assertTrue(orders.values().contains(new Value.Rel(cycle)));
	}

	@Test
	public void test_linearisations_05() {
		assertThrows(Primitives.PrimitiveError.class, () -> Primitives.linearisations(List.of(E123)));
	}

	@Test
	public void test_tag2scope_01() {
		Environment env = Executions.environment();
		Value v = Primitives.tag2scope(env, List.of(new Value.Tag("scopes", "po")));
		assertEquals(new Value.Rel(rel(e1, e2, e2, e3)), v);
	}

	@Test
	public void test_tag2scope_02() {
		Environment env = Executions.environment();
		Primitives.PrimitiveError e = assertThrows(Primitives.PrimitiveError.class,
				() -> Primitives.tag2scope(env, List.of(new Value.Tag("scopes", "wg"))));
		assertEquals("cannot find scope instance wg", e.getMessage());
	}

	@Test
	public void test_tag2scope_03() {
		EvaluationFailure e = assertThrows(EvaluationFailure.class,
				() -> Executions.run("enum scopes = 'wg || 'dev\ndebug tag2scope('wg)"));
		assertEquals("primitive tag2scope: cannot find scope instance wg", e.getMessage());
	}

	@Test
	public void test_tag2events_01() {
		Environment env = Executions.environment().bind(Primitives.eventsOf("acq"),
				new Value.Events(EventSet.of(e3)));
		Value v = Primitives.tag2events(env, List.of(new Value.Tag("C", "acq")));
		assertEquals(new Value.Events(EventSet.of(e3)), v);
	}

	@Test
	public void test_tag2events_02() {
		Environment env = Executions.environment();
		Primitives.PrimitiveError e = assertThrows(Primitives.PrimitiveError.class,
				() -> Primitives.tag2events(env, List.of(new Value.Tag("C", "t"))));
		assertEquals("cannot find event set __t_events", e.getMessage());
	}

	@Test
	public void test_tag2events_03() {
		Environment env = Executions.environment().bind(Primitives.eventsOf("t"), Value.EMPTY);
		assertSame(Value.EMPTY, Primitives.tag2events(env, List.of(new Value.Tag("C", "t"))));
	}

	@Test
	public void test_domain_01() {
		assertSame(Value.EMPTY, Primitives.domain(List.of(Value.EMPTY)));
		assertEquals(new Value.Events(EventSet.of(e1)), Primitives.domain(List.of(new Value.Rel(rel(e1, e3)))));
		assertEquals(new Value.Events(EventSet.of(e3)), Primitives.range(List.of(new Value.Rel(rel(e1, e3)))));
	}
}
