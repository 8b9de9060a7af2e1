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
import static featherweightcat.testing.Executions.e4;
import static featherweightcat.testing.Executions.rel;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

import featherweightcat.core.Event;
import featherweightcat.core.EventSet;
import featherweightcat.core.Relation;

/**
 * Tests for the basic operations on relations and event sets.
 *
 * @author David J. Pearce
 *
 */
public class RelationTests {

	@Test
	public void test_compose_01() {
		Relation r = rel(e1, e2, e2, e3);
		assertEquals(rel(e1, e3), r.compose(r));
	}

	@Test
	public void test_compose_02() {
		assertEquals(Relation.EMPTY, rel(e1, e2).compose(rel(e1, e2)));
	}

	@Test
	public void test_sequence_01() {
		Relation r = Relation.sequence(Arrays.asList(rel(e1, e2), rel(e2, e3), rel(e3, e4)));
		assertEquals(rel(e1, e4), r);
	}

	@Test
	public void test_closure_01() {
		Relation r = rel(e1, e2, e2, e3, e3, e4);
		assertEquals(rel(e1, e2, e1, e3, e1, e4, e2, e3, e2, e4, e3, e4), r.transitiveClosure());
	}

	@Test
	public void test_closure_02() {
		// A cycle relates everything on it to itself
		Relation r = rel(e1, e2, e2, e1).transitiveClosure();
		assertTrue(r.contains(e1, e1));
		assertTrue(r.contains(e2, e2));
		assertEquals(4, r.size());
	}

	@Test
	public void test_reduction_01() {
		Relation r = rel(e1, e2, e2, e3, e1, e3);
		assertEquals(rel(e1, e2, e2, e3), r.transitiveReduction());
	}

	@Test
	public void test_inverse_01() {
		assertEquals(rel(e2, e1, e3, e2), rel(e1, e2, e2, e3).inverse());
	}

	@Test
	public void test_acyclic_01() {
		Relation r = rel(e1, e2, e2, e3);
		assertTrue(r.isAcyclic());
		assertNull(r.findCycle());
	}

	@Test
	public void test_acyclic_02() {
		Relation r = rel(e1, e2, e2, e3, e3, e1);
		assertFalse(r.isAcyclic());
		List<Event> cycle = r.findCycle();
		assertEquals(3, cycle.size());
		assertEquals(rel(e1, e2, e2, e3, e3, e1), Relation.ofCycle(cycle));
	}

	@Test
	public void test_irreflexive_01() {
		assertTrue(rel(e1, e2).isIrreflexive());
		assertFalse(rel(e1, e2, e3, e3).isIrreflexive());
	}

	@Test
	public void test_identity_01() {
		EventSet s = EventSet.of(e1, e2);
		assertEquals(rel(e1, e1, e2, e2), Relation.identity(s));
	}

	@Test
	public void test_cartesian_01() {
		Relation r = Relation.cartesian(EventSet.of(e1, e2), EventSet.of(e3));
		assertEquals(rel(e1, e3, e2, e3), r);
	}

	@Test
	public void test_domain_01() {
		Relation r = rel(e1, e2, e2, e3);
		assertEquals(EventSet.of(e1, e2), r.domain());
		assertEquals(EventSet.of(e2, e3), r.codomain());
	}

	@Test
	public void test_restrict_01() {
		Relation r = rel(e1, e2, e2, e3, e1, e3);
		assertEquals(rel(e1, e3), r.restrict(EventSet.of(e1, e3)));
	}

	@Test
	public void test_eventset_01() {
		EventSet s1 = EventSet.of(e1, e2);
		EventSet s2 = EventSet.of(e2, e3);
		assertEquals(EventSet.of(e1, e2, e3), s1.union(s2));
		assertEquals(EventSet.of(e2), s1.intersect(s2));
		assertEquals(EventSet.of(e1), s1.difference(s2));
		assertTrue(EventSet.of(e2).isSubsetOf(s1));
	}

	@Test
	public void test_toString_01() {
		assertEquals("{e1->e2,e2->e3}", rel(e2, e3, e1, e2).toString());
	}
}
