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

package featherweightcat.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import featherweightcat.core.Syntax.Binding;
import featherweightcat.core.Syntax.Expr;
import featherweightcat.core.Syntax.Instruction;
import featherweightcat.core.Syntax.Model;
import featherweightcat.io.Lexer.Identifier;
import featherweightcat.io.Lexer.Int;
import featherweightcat.io.Lexer.Keyword;
import featherweightcat.io.Lexer.Operator;
import featherweightcat.io.Lexer.StringLiteral;
import featherweightcat.io.Lexer.Tag;
import featherweightcat.io.Lexer.Token;
import featherweightcat.util.Pair;
import featherweightcat.util.SyntacticElement.Attribute;
import featherweightcat.util.SyntaxError;

/**
 * A recursive descent parser for model files. Binary operators bind, from
 * loosest to tightest: <code>|</code>, <code>++</code>, <code>;</code>,
 * <code>\</code>, <code>&amp;</code> and <code>*</code>, followed by prefix
 * complement and the postfix closure operators.
 *
 * @author David J. Pearce
 *
 */
public class Parser {
	/**
	 * The name given to functions introduced with <code>fun</code>.
	 */
	public static final String ANONYMOUS = "*fun*";

	private final String sourcefile;
	private final String text;
	private final ArrayList<Token> tokens;
	private int index;

	public Parser(String sourcefile, String text, List<Token> tokens) {
		this.sourcefile = sourcefile;
		this.text = text;
		this.tokens = new ArrayList<>(tokens);
	}

	/**
	 * Parse a complete model, of the form:
	 *
	 * <pre>
	 * Model ::= [String | Ident] Ins*
	 * </pre>
	 *
	 * The optional leading title is ignored by the interpreter.
	 *
	 * @return
	 */
	public Model parseModel() {
		String title = null;
		if (index < tokens.size()) {
			Token t = tokens.get(index);
			if (t instanceof StringLiteral) {
				title = ((StringLiteral) t).value;
				index++;
			} else if (t instanceof Identifier) {
				title = t.text;
				index++;
			}
		}
		ArrayList<Instruction> instructions = new ArrayList<>();
		while (index < tokens.size()) {
			instructions.add(parseInstruction());
		}
		return new Model(sourcefile, title, instructions);
	}

	/**
	 * Parse instructions up to (but not including) the matching
	 * <code>end</code>.
	 *
	 * @return
	 */
	private List<Instruction> parseInstructionBlock() {
		ArrayList<Instruction> body = new ArrayList<>();
		while (!lookaheadKeyword("end")) {
			checkNotEof();
			body.add(parseInstruction());
		}
		matchKeyword("end");
		return body;
	}

	public Instruction parseInstruction() {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (!(lookahead instanceof Keyword)) {
			syntaxError("instruction expected, found '" + lookahead.text + "'", lookahead);
		}
		switch (lookahead.text) {
		case "let":
			return parseLetInstruction();
		case "undefined_unless":
		case "acyclic":
		case "irreflexive":
		case "empty":
			return parseTest();
		case "show":
			return parseShow();
		case "unshow": {
			index++;
			List<String> names = parseIdentifierList();
			return new Instruction.UnShow(names, sourceAttr(start, index - 1));
		}
		case "debug": {
			index++;
			Expr e = parseExpr();
			return new Instruction.Debug(e, sourceAttr(start, index - 1));
		}
		case "include": {
			index++;
			StringLiteral s = match(StringLiteral.class, "a file name");
			return new Instruction.Include(s.value, sourceAttr(start, index - 1));
		}
		case "procedure":
			return parseProcedure();
		case "call":
			return parseCall();
		case "enum":
			return parseEnum();
		case "forall":
			return parseForall();
		case "with": {
			index++;
			String var = matchIdentifier().text;
			matchKeyword("from");
			Expr e = parseExpr();
			return new Instruction.WithFrom(var, e, sourceAttr(start, index - 1));
		}
		case "events": {
			index++;
			String name = matchIdentifier().text;
			match("[");
			List<Expr> annotations = parseExprList("]");
			match("]");
			return new Instruction.EventDec(name, annotations, sourceAttr(start, index - 1));
		}
		case "relation": {
			index++;
			String name = matchIdentifier().text;
			Expr e = parseExpr();
			return new Instruction.RelationDec(name, e, sourceAttr(start, index - 1));
		}
		case "order": {
			index++;
			String name = matchIdentifier().text;
			Expr e = parseExpr();
			return new Instruction.OrderDec(name, e, sourceAttr(start, index - 1));
		}
		case "latex": {
			index++;
			StringLiteral s = match(StringLiteral.class, "a string");
			return new Instruction.Latex(s.value, sourceAttr(start, index - 1));
		}
		default:
			syntaxError("instruction expected, found '" + lookahead.text + "'", lookahead);
			return null;
		}
	}

	/**
	 * Parse a top-level binding instruction, of the form:
	 *
	 * <pre>
	 * Ins ::= 'let' ['rec'] Binding ('and' Binding)*
	 * </pre>
	 *
	 * @return
	 */
	private Instruction parseLetInstruction() {
		int start = index;
		matchKeyword("let");
		boolean rec = tryMatchKeyword("rec");
		List<Binding> bindings = parseBindings();
		if (rec) {
			return new Instruction.Rec(bindings, sourceAttr(start, index - 1));
		} else {
			return new Instruction.Let(bindings, sourceAttr(start, index - 1));
		}
	}

	private Instruction parseTest() {
		int start = index;
		Instruction.Test.Severity severity = Instruction.Test.Severity.PROVIDES;
		if (tryMatchKeyword("undefined_unless")) {
			severity = Instruction.Test.Severity.REQUIRES;
		}
		Keyword k = (Keyword) match("acyclic", "irreflexive", "empty");
		Instruction.Test.Kind kind;
		switch (k.text) {
		case "acyclic":
			kind = Instruction.Test.Kind.ACYCLIC;
			break;
		case "irreflexive":
			kind = Instruction.Test.Kind.IRREFLEXIVE;
			break;
		default:
			kind = Instruction.Test.Kind.EMPTY;
		}
		Expr operand = parseExpr();
		String name = null;
		if (tryMatchKeyword("as")) {
			name = matchIdentifier().text;
		}
		Attribute.Source src = sourceAttr(start, index - 1);
		Attribute.Text txt = new Attribute.Text(sourceText(start, index - 1));
		return new Instruction.Test(kind, operand, name, severity, src, txt);
	}

	/**
	 * Parse a show instruction, which either lists names to display or gives a
	 * name to an expression:
	 *
	 * <pre>
	 * Ins ::= 'show' Ident (',' Ident)*
	 *       | 'show' Exp 'as' Ident
	 * </pre>
	 *
	 * @return
	 */
	private Instruction parseShow() {
		int start = index;
		matchKeyword("show");
		// Try the list form first, and fall back on an expression
		int mark = index;
		if (index < tokens.size() && tokens.get(index) instanceof Identifier) {
			List<String> names = parseIdentifierList();
			if (!lookaheadKeyword("as") && !lookaheadOperatorStartingExpr()) {
				return new Instruction.Show(names, sourceAttr(start, index - 1));
			}
			index = mark;
		}
		Expr e = parseExpr();
		matchKeyword("as");
		String name = matchIdentifier().text;
		return new Instruction.ShowAs(e, name, sourceAttr(start, index - 1));
	}

	private Instruction parseProcedure() {
		int start = index;
		matchKeyword("procedure");
		String name = matchIdentifier().text;
		match("(");
		List<String> parameters = parseParameters();
		match(")");
		match("=");
		List<Instruction> body = parseInstructionBlock();
		return new Instruction.Procedure(name, parameters, body, sourceAttr(start, index - 1));
	}

	private Instruction parseCall() {
		int start = index;
		matchKeyword("call");
		String name = matchIdentifier().text;
		match("(");
		List<Expr> arguments = parseExprList(")");
		match(")");
		if (tryMatchKeyword("as")) {
			String check = matchIdentifier().text;
			return new Instruction.ProcedureTest(name, arguments, check, sourceAttr(start, index - 1));
		}
		return new Instruction.Call(name, arguments, sourceAttr(start, index - 1));
	}

	private Instruction parseEnum() {
		int start = index;
		matchKeyword("enum");
		String name = matchIdentifier().text;
		match("=");
		ArrayList<String> tags = new ArrayList<>();
		// A leading separator is permitted
		tryMatch("||");
		do {
			tags.add(match(Tag.class, "a tag").name);
		} while (tryMatch("||"));
		return new Instruction.Enum(name, tags, sourceAttr(start, index - 1));
	}

	private Instruction parseForall() {
		int start = index;
		matchKeyword("forall");
		String var = matchIdentifier().text;
		matchKeyword("in");
		Expr set = parseExpr();
		matchKeyword("do");
		List<Instruction> body = parseInstructionBlock();
		return new Instruction.Forall(var, set, body, sourceAttr(start, index - 1));
	}

	/**
	 * Parse one or more bindings separated by <code>and</code>, where each is of
	 * the form:
	 *
	 * <pre>
	 * Binding ::= Ident '=' Exp
	 *           | Ident '(' Ident (',' Ident)* ')' '=' Exp
	 * </pre>
	 *
	 * @return
	 */
	private List<Binding> parseBindings() {
		ArrayList<Binding> bindings = new ArrayList<>();
		do {
			bindings.add(parseBinding());
		} while (tryMatchKeyword("and"));
		return bindings;
	}

	private Binding parseBinding() {
		int start = index;
		String name = matchIdentifier().text;
		if (tryMatch("(")) {
			List<String> parameters = parseParameters();
			match(")");
			match("=");
			Expr body = parseExpr();
			Attribute.Source src = sourceAttr(start, index - 1);
			return new Binding(name, new Expr.Function(parameters, body, name, src), src);
		}
		match("=");
		Expr e = parseExpr();
		return new Binding(name, e, sourceAttr(start, index - 1));
	}

	private List<String> parseParameters() {
		ArrayList<String> parameters = new ArrayList<>();
		if (lookahead(")")) {
			return parameters;
		}
		do {
			parameters.add(matchIdentifier().text);
		} while (tryMatch(","));
		return parameters;
	}

	private List<String> parseIdentifierList() {
		ArrayList<String> names = new ArrayList<>();
		do {
			names.add(matchIdentifier().text);
		} while (tryMatch(","));
		return names;
	}

	private List<Expr> parseExprList(String terminator) {
		ArrayList<Expr> exprs = new ArrayList<>();
		if (lookahead(terminator)) {
			return exprs;
		}
		do {
			exprs.add(parseExpr());
		} while (tryMatch(","));
		return exprs;
	}

	// ==============================================================
	// Expressions
	// ==============================================================

	public Expr parseExpr() {
		checkNotEof();
		int start = index;
		Token lookahead = tokens.get(index);
		if (lookahead instanceof Keyword) {
			switch (lookahead.text) {
			case "let": {
				index++;
				boolean rec = tryMatchKeyword("rec");
				List<Binding> bindings = parseBindings();
				matchKeyword("in");
				Expr body = parseExpr();
				if (rec) {
					return new Expr.BindRec(bindings, body, sourceAttr(start, index - 1));
				} else {
					return new Expr.Bind(bindings, body, sourceAttr(start, index - 1));
				}
			}
			case "fun": {
				index++;
				List<String> parameters;
				if (tryMatch("(")) {
					parameters = parseParameters();
					match(")");
				} else {
					parameters = Collections.singletonList(matchIdentifier().text);
				}
				match("->");
				Expr body = parseExpr();
				return new Expr.Function(parameters, body, ANONYMOUS, sourceAttr(start, index - 1));
			}
			case "match":
				return parseMatch();
			case "try": {
				index++;
				Expr body = parseExpr();
				matchKeyword("with");
				Expr fallback = parseExpr();
				return new Expr.Try(body, fallback, sourceAttr(start, index - 1));
			}
			}
		}
		return parseUnion();
	}

	/**
	 * Parse a match expression, whose clauses either discriminate between tags
	 * or split a set:
	 *
	 * <pre>
	 * Exp     ::= 'match' Exp 'with' Clauses 'end'
	 * Clauses ::= Tag '-&gt;' Exp ('||' Tag '-&gt;' Exp)* ['||' '_' '-&gt;' Exp]
	 *           | '{' '}' '-&gt;' Exp '||' Ident '++' Ident '-&gt;' Exp
	 * </pre>
	 *
	 * @return
	 */
	private Expr parseMatch() {
		int start = index;
		matchKeyword("match");
		Expr subject = parseExpr();
		matchKeyword("with");
		tryMatch("||");
		if (lookahead("{")) {
			match("{");
			match("}");
			match("->");
			Expr ifEmpty = parseExpr();
			match("||");
			String element = matchIdentifier().text;
			match("++");
			String rest = matchIdentifier().text;
			match("->");
			Expr body = parseExpr();
			matchKeyword("end");
			return new Expr.MatchSet(subject, ifEmpty, element, rest, body, sourceAttr(start, index - 1));
		}
		ArrayList<Pair<String, Expr>> cases = new ArrayList<>();
		Expr defaultCase = null;
		do {
			if (tryMatchKeyword("_")) {
				match("->");
				defaultCase = parseExpr();
				break;
			}
			String tag = match(Tag.class, "a tag").name;
			match("->");
			cases.add(new Pair<>(tag, parseExpr()));
		} while (tryMatch("||"));
		matchKeyword("end");
		return new Expr.Match(subject, cases, defaultCase, sourceAttr(start, index - 1));
	}

	private Expr parseUnion() {
		int start = index;
		Expr lhs = parseAdd();
		if (!lookahead("|")) {
			return lhs;
		}
		ArrayList<Expr> operands = new ArrayList<>();
		operands.add(lhs);
		while (tryMatch("|")) {
			operands.add(parseAdd());
		}
		return new Expr.Nary(Expr.Nary.Op.UNION, operands, sourceAttr(start, index - 1));
	}

	private Expr parseAdd() {
		int start = index;
		Expr lhs = parseSequence();
		if (tryMatch("++")) {
			Expr rhs = parseAdd();
			return binary(Expr.Nary.Op.ADD, lhs, rhs, start);
		}
		return lhs;
	}

	private Expr parseSequence() {
		int start = index;
		Expr lhs = parseDifference();
		if (!lookahead(";")) {
			return lhs;
		}
		ArrayList<Expr> operands = new ArrayList<>();
		operands.add(lhs);
		while (tryMatch(";")) {
			operands.add(parseDifference());
		}
		return new Expr.Nary(Expr.Nary.Op.SEQ, operands, sourceAttr(start, index - 1));
	}

	private Expr parseDifference() {
		int start = index;
		Expr lhs = parseIntersection();
		while (tryMatch("\\")) {
			lhs = binary(Expr.Nary.Op.DIFF, lhs, parseIntersection(), start);
		}
		return lhs;
	}

	private Expr parseIntersection() {
		int start = index;
		Expr lhs = parseCartesian();
		while (tryMatch("&")) {
			lhs = binary(Expr.Nary.Op.INTER, lhs, parseCartesian(), start);
		}
		return lhs;
	}

	private Expr parseCartesian() {
		int start = index;
		Expr lhs = parseUnary();
		if (lookahead("*") && startsAtom(index + 1)) {
			match("*");
			return binary(Expr.Nary.Op.CARTESIAN, lhs, parseUnary(), start);
		}
		return lhs;
	}

	private Expr parseUnary() {
		int start = index;
		if (tryMatch("~")) {
			Expr operand = parseUnary();
			return new Expr.Unary(Expr.Unary.Op.COMPLEMENT, operand, sourceAttr(start, index - 1));
		}
		return parsePostfix();
	}

	private Expr parsePostfix() {
		int start = index;
		Expr e = parseApplication();
		while (index < tokens.size() && tokens.get(index) instanceof Operator) {
			Expr.Unary.Op op;
			switch (tokens.get(index).text) {
			case "+":
			case "^+":
				op = Expr.Unary.Op.PLUS;
				break;
			case "*":
				if (startsAtom(index + 1)) {
					// this is a cartesian product
					return e;
				}
			case "^*":
				op = Expr.Unary.Op.STAR;
				break;
			case "?":
			case "^?":
				op = Expr.Unary.Op.OPT;
				break;
			case "^-1":
				op = Expr.Unary.Op.INVERSE;
				break;
			default:
				return e;
			}
			index++;
			e = new Expr.Unary(op, e, sourceAttr(start, index - 1));
		}
		return e;
	}

	private Expr parseApplication() {
		int start = index;
		Expr e = parseAtom();
		while (lookahead("(")) {
			match("(");
			List<Expr> arguments = parseExprList(")");
			match(")");
			e = new Expr.Application(e, arguments, sourceAttr(start, index - 1));
		}
		return e;
	}

	private Expr parseAtom() {
		checkNotEof();
		int start = index;
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			index++;
			return new Expr.Variable(t.text, sourceAttr(start, start));
		} else if (t instanceof Tag) {
			index++;
			return new Expr.TagLiteral(((Tag) t).name, sourceAttr(start, start));
		} else if (t instanceof Int) {
			if (((Int) t).value != 0) {
				syntaxError("only 0 is permitted as a constant", t);
			}
			index++;
			return new Expr.Constant(Expr.Constant.Kind.EMPTY_RELATION, sourceAttr(start, start));
		} else if (t instanceof Keyword) {
			switch (t.text) {
			case "_":
				index++;
				return new Expr.Constant(Expr.Constant.Kind.UNIVERSE, sourceAttr(start, start));
			case "let":
			case "fun":
			case "match":
			case "try":
				return parseExpr();
			}
		} else if (t.text.equals("(")) {
			match("(");
			Expr e = parseExpr();
			match(")");
			return e;
		} else if (t.text.equals("{")) {
			match("{");
			if (tryMatch("}")) {
				return new Expr.Constant(Expr.Constant.Kind.EMPTY_SET, sourceAttr(start, index - 1));
			}
			List<Expr> elements = parseExprList("}");
			match("}");
			return new Expr.ExplicitSet(elements, sourceAttr(start, index - 1));
		}
		syntaxError("expression expected, found '" + t.text + "'", t);
		return null;
	}

	private Expr binary(Expr.Nary.Op op, Expr lhs, Expr rhs, int start) {
		ArrayList<Expr> operands = new ArrayList<>();
		operands.add(lhs);
		operands.add(rhs);
		return new Expr.Nary(op, operands, sourceAttr(start, index - 1));
	}

	/**
	 * Check whether the token at a given position can begin an operand. This
	 * distinguishes a cartesian product <code>R * W</code> from the reflexive
	 * transitive closure <code>R*</code>.
	 *
	 * @param i
	 * @return
	 */
	private boolean startsAtom(int i) {
		if (i >= tokens.size()) {
			return false;
		}
		Token t = tokens.get(i);
		if (t instanceof Identifier || t instanceof Tag || t instanceof Int) {
			return true;
		} else if (t instanceof Keyword) {
			switch (t.text) {
			case "_":
			case "let":
			case "fun":
			case "match":
			case "try":
				return true;
			default:
				return false;
			}
		} else {
			return t.text.equals("(") || t.text.equals("{") || t.text.equals("~");
		}
	}

	private boolean lookaheadOperatorStartingExpr() {
		if (index >= tokens.size()) {
			return false;
		}
		Token t = tokens.get(index);
		if (!(t instanceof Operator)) {
			return false;
		}
		// A comma continues a name list, anything else binds to an expression
		return !t.text.equals(",");
	}

	// ==============================================================
	// Helpers
	// ==============================================================

	private void checkNotEof() {
		if (index >= tokens.size()) {
			int end = text.length() - 1;
			throw new SyntaxError("unexpected end-of-file", sourcefile, text, end, end);
		}
	}

	private boolean lookahead(String op) {
		return index < tokens.size() && tokens.get(index) instanceof Operator && tokens.get(index).text.equals(op);
	}

	private boolean lookaheadKeyword(String keyword) {
		return index < tokens.size() && tokens.get(index) instanceof Keyword
				&& tokens.get(index).text.equals(keyword);
	}

	private boolean tryMatch(String op) {
		if (lookahead(op)) {
			index++;
			return true;
		}
		return false;
	}

	private boolean tryMatchKeyword(String keyword) {
		if (lookaheadKeyword(keyword)) {
			index++;
			return true;
		}
		return false;
	}

	private Token match(String op) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!t.text.equals(op)) {
			syntaxError("expecting '" + op + "', found '" + t.text + "'", t);
		}
		index = index + 1;
		return t;
	}

	private Token match(String... options) {
		checkNotEof();
		Token t = tokens.get(index);
		for (int i = 0; i != options.length; ++i) {
			if (t.text.equals(options[i])) {
				index = index + 1;
				return t;
			}
		}
		String s = "";
		for (int i = 0; i != options.length; ++i) {
			if (i != 0) {
				s += " or ";
			}
			s += "'" + options[i] + "'";
		}
		syntaxError("expecting " + s + ", found '" + t.text + "'", t);
		return null;
	}

	@SuppressWarnings("unchecked")
	private <T extends Token> T match(Class<T> c, String name) {
		checkNotEof();
		Token t = tokens.get(index);
		if (!c.isInstance(t)) {
			syntaxError("expecting " + name + ", found '" + t.text + "'", t);
		}
		index = index + 1;
		return (T) t;
	}

	private Identifier matchIdentifier() {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Identifier) {
			Identifier i = (Identifier) t;
			index = index + 1;
			return i;
		}
		syntaxError("identifier expected", t);
		return null; // unreachable.
	}

	private Keyword matchKeyword(String keyword) {
		checkNotEof();
		Token t = tokens.get(index);
		if (t instanceof Keyword) {
			if (t.text.equals(keyword)) {
				index = index + 1;
				return (Keyword) t;
			}
		}
		syntaxError("keyword " + keyword + " expected.", t);
		return null;
	}

	/**
	 * Construct the source attribute spanning a given range of tokens. The line
	 * is that of the first token, and both character positions are columns
	 * within that line.
	 *
	 * @param start
	 * @param end
	 * @return
	 */
	private Attribute.Source sourceAttr(int start, int end) {
		Token t1 = tokens.get(start);
		Token t2 = tokens.get(end);
		int line = 1;
		int lineStart = 0;
		for (int i = 0; i < t1.start; ++i) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		return new Attribute.Source(sourcefile, line, t1.start - lineStart, t2.end() - lineStart);
	}

	private String sourceText(int start, int end) {
		return text.substring(tokens.get(start).start, tokens.get(end).end() + 1);
	}

	private void syntaxError(String msg, Token t) {
		throw new SyntaxError(msg, sourcefile, text, t.start, t.end());
	}
}
