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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import featherweightcat.core.Syntax.Expr;
import featherweightcat.core.Syntax.Instruction;
import featherweightcat.core.Syntax.Model;
import featherweightcat.io.ModelLoader;
import featherweightcat.util.SyntacticElement.Attribute;
import featherweightcat.util.SyntaxError;

/**
 * Tests for reading model files.
 *
 * @author David J. Pearce
 *
 */
public class ParserTests {

	// ==============================================================
	// Precedence
	// ==============================================================

	@Test
	public void test_precedence_01() {
		check("a | b ; c", "(a | (b ; c))");
	}

	@Test
	public void test_precedence_02() {
		check("a ; b & c", "(a ; (b & c))");
	}

	@Test
	public void test_precedence_03() {
		check("a \\ b & c", "(a \\ (b & c))");
	}

	@Test
	public void test_precedence_04() {
		check("a & b * c", "(a & (b * c))");
	}

	@Test
	public void test_precedence_05() {
		check("a ++ b | c", "((a ++ b) | c)");
	}

	@Test
	public void test_precedence_06() {
		check("a ; b ++ c", "((a ; b) ++ c)");
	}

	@Test
	public void test_precedence_07() {
		check("a | b | c", "(a | b | c)");
	}

	@Test
	public void test_associativity_01() {
		check("a ++ b ++ c", "(a ++ (b ++ c))");
	}

	@Test
	public void test_associativity_02() {
		check("a \\ b \\ c", "((a \\ b) \\ c)");
	}

	@Test
	public void test_postfix_01() {
		check("~a+", "~(a)+");
	}

	@Test
	public void test_postfix_02() {
		check("a^-1 ; b", "((a)^-1 ; b)");
	}

	@Test
	public void test_postfix_03() {
		check("a+*", "((a)+)*");
	}

	@Test
	public void test_postfix_04() {
		check("a^+ | a^*", "((a)+ | (a)*)");
	}

	@Test
	public void test_star_01() {
		// Cartesian product rather than closure
		check("a * b", "(a * b)");
	}

	@Test
	public void test_star_02() {
		check("a* ; b", "((a)* ; b)");
	}

	@Test
	public void test_star_03() {
		check("(a*)", "(a)*");
	}

	@Test
	public void test_star_04() {
		check("_ * ~b", "(_ * ~b)");
	}

	@Test
	public void test_atoms_01() {
		check("{}", "{}");
		check("0", "0");
		check("_", "_");
	}

	@Test
	public void test_application_01() {
		check("f(a, b ; c)", "f(a, (b ; c))");
	}

	@Test
	public void test_application_02() {
		check("f(a)(b)", "f(a)(b)");
	}

	@Test
	public void test_identifier_01() {
		// Identifiers may contain dots and dashes
		check("po-loc | ca.x", "(po-loc | ca.x)");
	}

	@Test
	public void test_comment_01() {
		check("a (* b (* nested *) *) | c // d", "(a | c)");
	}

	// ==============================================================
	// Compound expressions
	// ==============================================================

	@Test
	public void test_fun_01() {
		Expr e = parseExpr("fun x -> x");
		assertTrue(e instanceof Expr.Function);
		assertEquals("*fun*", ((Expr.Function) e).name());
	}

	@Test
	public void test_fun_02() {
		Expr.Function f = (Expr.Function) parseExpr("fun (x, y) -> x | y | z");
		assertEquals(2, f.parameters().size());
		assertEquals(1, f.freeVariables().size());
		assertTrue(f.freeVariables().contains("z"));
	}

	@Test
	public void test_binding_01() {
		Model m = parse("let f(x, y) = x ; y");
		Instruction.Let let = (Instruction.Let) m.instructions().get(0);
		Expr.Function f = (Expr.Function) let.bindings().get(0).expr();
		assertEquals("f", f.name());
		assertTrue(f.freeVariables().isEmpty());
	}

	@Test
	public void test_binding_02() {
		Model m = parse("let rec a = b and b = a");
		Instruction.Rec rec = (Instruction.Rec) m.instructions().get(0);
		assertEquals(2, rec.bindings().size());
	}

	@Test
	public void test_let_01() {
		Expr e = parseExpr("let x = a and y = b in x ; y");
		assertTrue(e instanceof Expr.Bind);
	}

	@Test
	public void test_let_02() {
		Expr e = parseExpr("let rec x = a | x in x");
		assertTrue(e instanceof Expr.BindRec);
	}

	@Test
	public void test_match_01() {
		Expr.Match e = (Expr.Match) parseExpr("match s with 'wg -> a || 'wi -> b || _ -> 0 end");
		assertEquals(2, e.cases().size());
		assertEquals("wi", e.cases().get(1).first());
		assertEquals("0", e.defaultCase().toString());
	}

	@Test
	public void test_match_02() {
		Expr.Match e = (Expr.Match) parseExpr("match s with || 'wg -> a end");
		assertNull(e.defaultCase());
	}

	@Test
	public void test_matchset_01() {
		Expr.MatchSet e = (Expr.MatchSet) parseExpr("match S with {} -> 0 || x ++ xs -> x | f(xs) end");
		assertEquals("x", e.element());
		assertEquals("xs", e.rest());
		assertEquals("(x | f(xs))", e.body().toString());
	}

	@Test
	public void test_try_01() {
		Expr.Try e = (Expr.Try) parseExpr("try a with b");
		assertEquals("a", e.body().toString());
		assertEquals("b", e.fallback().toString());
	}

	@Test
	public void test_set_01() {
		Expr.ExplicitSet e = (Expr.ExplicitSet) parseExpr("{a, b ; c, 'x}");
		assertEquals(3, e.elements().size());
	}

	// ==============================================================
	// Instructions
	// ==============================================================

	@Test
	public void test_title_01() {
		Model m = parse("\"X86 TSO\"\nacyclic po");
		assertEquals("X86 TSO", m.title());
		assertEquals(1, m.instructions().size());
	}

	@Test
	public void test_title_02() {
		Model m = parse("SC\nacyclic po");
		assertEquals("SC", m.title());
	}

	@Test
	public void test_test_01() {
		Instruction.Test t = (Instruction.Test) parse("acyclic po | rf as sc").instructions().get(0);
		assertEquals(Instruction.Test.Kind.ACYCLIC, t.kind());
		assertEquals(Instruction.Test.Severity.PROVIDES, t.severity());
		assertEquals("sc", t.name());
		assertEquals("acyclic po | rf as sc", t.attribute(Attribute.Text.class).text);
	}

	@Test
	public void test_test_02() {
		Instruction.Test t = (Instruction.Test) parse("undefined_unless empty rmw & (fre;coe)").instructions()
				.get(0);
		assertEquals(Instruction.Test.Kind.EMPTY, t.kind());
		assertEquals(Instruction.Test.Severity.REQUIRES, t.severity());
		assertNull(t.name());
	}

	@Test
	public void test_show_01() {
		List<Instruction> is = parse("show a, b\nshow a;b as c\nshow a as d\nunshow a").instructions();
		assertEquals(2, ((Instruction.Show) is.get(0)).names().size());
		assertEquals("c", ((Instruction.ShowAs) is.get(1)).name());
		assertEquals("d", ((Instruction.ShowAs) is.get(2)).name());
		assertTrue(is.get(3) instanceof Instruction.UnShow);
	}

	@Test
	public void test_procedure_01() {
		List<Instruction> is = parse("procedure p(a, b) = acyclic a\nempty b end\ncall p(po, rf)\ncall p(po, rf) as q")
				.instructions();
		Instruction.Procedure p = (Instruction.Procedure) is.get(0);
		assertEquals(2, p.parameters().size());
		assertEquals(2, p.body().size());
		assertTrue(is.get(1) instanceof Instruction.Call);
		assertEquals("q", ((Instruction.ProcedureTest) is.get(2)).name());
	}

	@Test
	public void test_enum_01() {
		Instruction.Enum e = (Instruction.Enum) parse("enum scopes = || 'wi || 'wg || 'dev").instructions().get(0);
		assertEquals("scopes", e.name());
		assertEquals(3, e.tags().size());
	}

	@Test
	public void test_forall_01() {
		Instruction.Forall f = (Instruction.Forall) parse("forall s in S do debug s\nacyclic s end").instructions()
				.get(0);
		assertEquals("s", f.variable());
		assertEquals(2, f.body().size());
	}

	@Test
	public void test_misc_01() {
		String input = "include \"x.cat\"\nwith co from generate(W)\ndebug a\nlatex \"\\\\alpha\"";
		List<Instruction> is = parse(input).instructions();
		assertEquals("x.cat", ((Instruction.Include) is.get(0)).filename());
		assertEquals("co", ((Instruction.WithFrom) is.get(1)).variable());
		assertTrue(is.get(2) instanceof Instruction.Debug);
		assertTrue(is.get(3) instanceof Instruction.Latex);
	}

	@Test
	public void test_annotations_01() {
		List<Instruction> is = parse("events R[{'once}, {'acquire}]\nrelation rmw po\norder co po").instructions();
		assertEquals(2, ((Instruction.EventDec) is.get(0)).annotations().size());
		assertTrue(is.get(1) instanceof Instruction.RelationDec);
		assertTrue(is.get(2) instanceof Instruction.OrderDec);
	}

	@Test
	public void test_source_01() {
		Instruction i = parse("let a = po\n  acyclic a").instructions().get(1);
		Attribute.Source src = i.attribute(Attribute.Source.class);
		assertEquals(2, src.line);
		assertEquals("File \"test.cat\", line 2, characters 2-11", src.toString());
	}

	// ==============================================================
	// Syntax errors
	// ==============================================================

	@Test
	public void test_error_01() {
		checkError("let = po", "identifier expected");
	}

	@Test
	public void test_error_02() {
		checkError("let x = po |", "unexpected end-of-file");
	}

	@Test
	public void test_error_03() {
		checkError("let x = po $", "syntax error");
	}

	@Test
	public void test_error_04() {
		checkError("(* never closed", "unterminated comment");
	}

	@Test
	public void test_error_05() {
		checkError("let x = 5", "only 0 is permitted as a constant");
	}

	@Test
	public void test_error_06() {
		checkError("acyclic po as 'x", "identifier expected");
	}

	@Test
	public void test_error_07() {
		checkError("forall x in S do acyclic x", "unexpected end-of-file");
	}

	@Test
	public void test_error_08() {
		checkError("SC po", "instruction expected, found 'po'");
	}

	@Test
	public void test_error_09() {
		SyntaxError e = assertThrows(SyntaxError.class, () -> parse("let x = po\nlet y = ) "));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		e.outputSourceError(new PrintStream(bytes, true, StandardCharsets.UTF_8));
		String output = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertEquals("test.cat:2: expression expected, found ')'\nlet y = ) \n        ^\n", output);
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private static Model parse(String input) {
		return ModelLoader.parse("test.cat", input);
	}

	private static Expr parseExpr(String input) {
		Model m = parse("let it = " + input);
		return ((Instruction.Let) m.instructions().get(0)).bindings().get(0).expr();
	}

	private static void check(String input, String expected) {
		assertEquals(expected, parseExpr(input).toString());
	}

	private static void checkError(String input, String message) {
		SyntaxError e = assertThrows(SyntaxError.class, () -> parse(input));
		assertEquals(message, e.getMessage());
	}
}
