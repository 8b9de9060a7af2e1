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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import featherweightcat.util.Pair;
import featherweightcat.util.SyntacticElement;

/**
 * The abstract syntax of the model language. A model is a sequence of
 * instructions, each of which may contain expressions.
 *
 * @author David J. Pearce
 *
 */
public class Syntax {
	public final static int EXPR_constant = 0;
	public final static int EXPR_tag = 1;
	public final static int EXPR_variable = 2;
	public final static int EXPR_explicitset = 3;
	public final static int EXPR_unary = 4;
	public final static int EXPR_nary = 5;
	public final static int EXPR_application = 6;
	public final static int EXPR_bind = 7;
	public final static int EXPR_bindrec = 8;
	public final static int EXPR_function = 9;
	public final static int EXPR_match = 10;
	public final static int EXPR_matchset = 11;
	public final static int EXPR_try = 12;

	public final static int INS_let = 20;
	public final static int INS_rec = 21;
	public final static int INS_test = 22;
	public final static int INS_proceduretest = 23;
	public final static int INS_forall = 24;
	public final static int INS_withfrom = 25;
	public final static int INS_include = 26;
	public final static int INS_procedure = 27;
	public final static int INS_call = 28;
	public final static int INS_enum = 29;
	public final static int INS_show = 30;
	public final static int INS_showas = 31;
	public final static int INS_unshow = 32;
	public final static int INS_debug = 33;
	public final static int INS_latex = 34;
	public final static int INS_eventdec = 35;
	public final static int INS_relationdec = 36;
	public final static int INS_orderdec = 37;

	/**
	 * Any syntactic form which is identified by an opcode.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Term extends SyntacticElement {

		/**
		 * Get the opcode associated with the syntactic form of this term.
		 *
		 * @return
		 */
		public int getOpcode();
	}

	/**
	 * An abstract term to be implemented by all other terms.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class AbstractTerm extends SyntacticElement.Impl implements Term {
		private final int opcode;

		public AbstractTerm(int opcode, Attribute... attributes) {
			super(attributes);
			this.opcode = opcode;
		}

		@Override
		public int getOpcode() {
			return opcode;
		}
	}

	/**
	 * A parsed model file.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Model {
		private final String filename;
		private final String title;
		private final List<Instruction> instructions;

		public Model(String filename, String title, List<Instruction> instructions) {
			this.filename = filename;
			this.title = title;
			this.instructions = Collections.unmodifiableList(instructions);
		}

		public String filename() {
			return filename;
		}

		/**
		 * Get the title given at the head of the model, or <code>null</code> if none.
		 *
		 * @return
		 */
		public String title() {
			return title;
		}

		public List<Instruction> instructions() {
			return instructions;
		}
	}

	/**
	 * Binds a name to an expression, as found in <code>let</code> and
	 * <code>let rec</code>.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Binding extends SyntacticElement.Impl {
		private final String name;
		private final Expr expr;

		public Binding(String name, Expr expr, Attribute... attributes) {
			super(attributes);
			this.name = name;
			this.expr = expr;
		}

		public String name() {
			return name;
		}

		public Expr expr() {
			return expr;
		}

		@Override
		public String toString() {
			return name + " = " + expr;
		}
	}

	// ==============================================================
	// Expressions
	// ==============================================================

	public interface Expr extends Term {

		/**
		 * Represents a constant, which is either the empty set, the empty relation or
		 * the universe:
		 *
		 * <pre>
		 * {}   0   _
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Constant extends AbstractTerm implements Expr {
			public enum Kind {
				EMPTY_SET, EMPTY_RELATION, UNIVERSE
			}

			private final Kind kind;

			public Constant(Kind kind, Attribute... attributes) {
				super(EXPR_constant, attributes);
				this.kind = kind;
			}

			public Kind kind() {
				return kind;
			}

			@Override
			public String toString() {
				switch (kind) {
				case EMPTY_SET:
					return "{}";
				case EMPTY_RELATION:
					return "0";
				default:
					return "_";
				}
			}
		}

		/**
		 * Represents a tag constant, such as <code>'wg</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class TagLiteral extends AbstractTerm implements Expr {
			private final String name;

			public TagLiteral(String name, Attribute... attributes) {
				super(EXPR_tag, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return "'" + name;
			}
		}

		/**
		 * Represents a variable, such as <code>po</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Variable extends AbstractTerm implements Expr {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(EXPR_variable, attributes);
				this.name = name;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return name;
			}
		}

		/**
		 * Represents a set given by enumerating its elements:
		 *
		 * <pre>
		 * { 'wg, 'wi }
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class ExplicitSet extends AbstractTerm implements Expr {
			private final List<Expr> elements;

			public ExplicitSet(List<Expr> elements, Attribute... attributes) {
				super(EXPR_explicitset, attributes);
				this.elements = Collections.unmodifiableList(elements);
			}

			public List<Expr> elements() {
				return elements;
			}

			@Override
			public String toString() {
				return "{" + join(elements, ", ") + "}";
			}
		}

		/**
		 * Represents the application of a unary operator, such as <code>po+</code>,
		 * <code>rf^-1</code> or <code>~W</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Unary extends AbstractTerm implements Expr {
			public enum Op {
				PLUS("+"), STAR("*"), OPT("?"), COMPLEMENT("~"), INVERSE("^-1");

				private final String text;

				Op(String text) {
					this.text = text;
				}

				@Override
				public String toString() {
					return text;
				}
			}

			private final Op op;
			private final Expr operand;

			public Unary(Op op, Expr operand, Attribute... attributes) {
				super(EXPR_unary, attributes);
				this.op = op;
				this.operand = operand;
			}

			public Op op() {
				return op;
			}

			public Expr operand() {
				return operand;
			}

			@Override
			public String toString() {
				if (op == Op.COMPLEMENT) {
					return "~" + operand;
				} else {
					return "(" + operand + ")" + op;
				}
			}
		}

		/**
		 * Represents the application of an operator to one or more operands. Union and
		 * sequence accept any number of operands, whilst the remaining operators are
		 * binary:
		 *
		 * <pre>
		 * po | rf | co
		 * po ; rf
		 * po \ rf
		 * po &amp; (W * R)
		 * 'a ++ S
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Nary extends AbstractTerm implements Expr {
			public enum Op {
				UNION("|"), SEQ(";"), INTER("&"), DIFF("\\"), CARTESIAN("*"), ADD("++");

				private final String text;

				Op(String text) {
					this.text = text;
				}

				@Override
				public String toString() {
					return text;
				}
			}

			private final Op op;
			private final List<Expr> operands;

			public Nary(Op op, List<Expr> operands, Attribute... attributes) {
				super(EXPR_nary, attributes);
				this.op = op;
				this.operands = Collections.unmodifiableList(operands);
			}

			public Op op() {
				return op;
			}

			public List<Expr> operands() {
				return operands;
			}

			@Override
			public String toString() {
				return "(" + join(operands, " " + op + " ") + ")";
			}
		}

		/**
		 * Represents the application of a function to zero or more arguments, such as
		 * <code>fencerel(F)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Application extends AbstractTerm implements Expr {
			private final Expr function;
			private final List<Expr> arguments;

			public Application(Expr function, List<Expr> arguments, Attribute... attributes) {
				super(EXPR_application, attributes);
				this.function = function;
				this.arguments = Collections.unmodifiableList(arguments);
			}

			public Expr function() {
				return function;
			}

			public List<Expr> arguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return function + "(" + join(arguments, ", ") + ")";
			}
		}

		/**
		 * Represents a local (non-recursive) binding:
		 *
		 * <pre>
		 * let x = po ; po in x | rf
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Bind extends AbstractTerm implements Expr {
			private final List<Binding> bindings;
			private final Expr body;

			public Bind(List<Binding> bindings, Expr body, Attribute... attributes) {
				super(EXPR_bind, attributes);
				this.bindings = Collections.unmodifiableList(bindings);
				this.body = body;
			}

			public List<Binding> bindings() {
				return bindings;
			}

			public Expr body() {
				return body;
			}

			@Override
			public String toString() {
				return "let " + join(bindings, " and ") + " in " + body;
			}
		}

		/**
		 * Represents a local recursive binding:
		 *
		 * <pre>
		 * let rec r = po | (r ; r) in r
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class BindRec extends AbstractTerm implements Expr {
			private final List<Binding> bindings;
			private final Expr body;

			public BindRec(List<Binding> bindings, Expr body, Attribute... attributes) {
				super(EXPR_bindrec, attributes);
				this.bindings = Collections.unmodifiableList(bindings);
				this.body = body;
			}

			public List<Binding> bindings() {
				return bindings;
			}

			public Expr body() {
				return body;
			}

			@Override
			public String toString() {
				return "let rec " + join(bindings, " and ") + " in " + body;
			}
		}

		/**
		 * Represents a function, either anonymous or as introduced by a binding such
		 * as <code>let f(x,y) = x ; y</code>. The set of free variables of the body is
		 * computed on demand, and determines what a closure captures.
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Function extends AbstractTerm implements Expr {
			private final List<String> parameters;
			private final Expr body;
			private final String name;
			private Set<String> freeVariables;

			public Function(List<String> parameters, Expr body, String name, Attribute... attributes) {
				super(EXPR_function, attributes);
				this.parameters = Collections.unmodifiableList(parameters);
				this.body = body;
				this.name = name;
			}

			public List<String> parameters() {
				return parameters;
			}

			public Expr body() {
				return body;
			}

			public String name() {
				return name;
			}

			/**
			 * Get the variables used in the body which are not parameters.
			 *
			 * @return
			 */
			public Set<String> freeVariables() {
				if (freeVariables == null) {
					freeVariables = Collections.unmodifiableSet(FreeVariables.of(this));
				}
				return freeVariables;
			}

			@Override
			public String toString() {
				return "fun (" + String.join(",", parameters) + ") -> " + body;
			}
		}

		/**
		 * Represents pattern matching over the tags of an enumeration:
		 *
		 * <pre>
		 * match s with 'wg -> wg || 'wi -> wi || _ -> 0 end
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Match extends AbstractTerm implements Expr {
			private final Expr subject;
			private final List<Pair<String, Expr>> cases;
			private final Expr defaultCase;

			public Match(Expr subject, List<Pair<String, Expr>> cases, Expr defaultCase, Attribute... attributes) {
				super(EXPR_match, attributes);
				this.subject = subject;
				this.cases = Collections.unmodifiableList(cases);
				this.defaultCase = defaultCase;
			}

			public Expr subject() {
				return subject;
			}

			public List<Pair<String, Expr>> cases() {
				return cases;
			}

			/**
			 * Get the default case, or <code>null</code> if there is none.
			 *
			 * @return
			 */
			public Expr defaultCase() {
				return defaultCase;
			}

			@Override
			public String toString() {
				StringBuilder r = new StringBuilder("match " + subject + " with ");
				for (int i = 0; i != cases.size(); ++i) {
					if (i != 0) {
						r.append(" || ");
					}
					r.append("'").append(cases.get(i).first()).append(" -> ").append(cases.get(i).second());
				}
				if (defaultCase != null) {
					r.append(" || _ -> ").append(defaultCase);
				}
				return r.append(" end").toString();
			}
		}

		/**
		 * Represents the destructuring of a set into one element and the rest:
		 *
		 * <pre>
		 * match S with {} -> 0 || x ++ xs -> f(x) | g(xs) end
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class MatchSet extends AbstractTerm implements Expr {
			private final Expr subject;
			private final Expr ifEmpty;
			private final String element;
			private final String rest;
			private final Expr body;

			public MatchSet(Expr subject, Expr ifEmpty, String element, String rest, Expr body,
					Attribute... attributes) {
				super(EXPR_matchset, attributes);
				this.subject = subject;
				this.ifEmpty = ifEmpty;
				this.element = element;
				this.rest = rest;
				this.body = body;
			}

			public Expr subject() {
				return subject;
			}

			public Expr ifEmpty() {
				return ifEmpty;
			}

			public String element() {
				return element;
			}

			public String rest() {
				return rest;
			}

			public Expr body() {
				return body;
			}

			@Override
			public String toString() {
				return "match " + subject + " with {} -> " + ifEmpty + " || " + element + " ++ " + rest + " -> " + body
						+ " end";
			}
		}

		/**
		 * Represents a computation with a fallback:
		 *
		 * <pre>
		 * try e1 with e2
		 * </pre>
		 *
		 * @author David J. Pearce
		 *
		 */
		public class Try extends AbstractTerm implements Expr {
			private final Expr body;
			private final Expr fallback;

			public Try(Expr body, Expr fallback, Attribute... attributes) {
				super(EXPR_try, attributes);
				this.body = body;
				this.fallback = fallback;
			}

			public Expr body() {
				return body;
			}

			public Expr fallback() {
				return fallback;
			}

			@Override
			public String toString() {
				return "try " + body + " with " + fallback;
			}
		}
	}

	// ==============================================================
	// Instructions
	// ==============================================================

	public interface Instruction extends Term {

		/**
		 * Represents a sequence of simultaneous, non-recursive bindings.
		 */
		public class Let extends AbstractTerm implements Instruction {
			private final List<Binding> bindings;

			public Let(List<Binding> bindings, Attribute... attributes) {
				super(INS_let, attributes);
				this.bindings = Collections.unmodifiableList(bindings);
			}

			public List<Binding> bindings() {
				return bindings;
			}

			@Override
			public String toString() {
				return "let " + join(bindings, " and ");
			}
		}

		/**
		 * Represents a group of mutually recursive bindings.
		 */
		public class Rec extends AbstractTerm implements Instruction {
			private final List<Binding> bindings;

			public Rec(List<Binding> bindings, Attribute... attributes) {
				super(INS_rec, attributes);
				this.bindings = Collections.unmodifiableList(bindings);
			}

			public List<Binding> bindings() {
				return bindings;
			}

			@Override
			public String toString() {
				return "let rec " + join(bindings, " and ");
			}
		}

		/**
		 * Represents a check on a relation, such as:
		 *
		 * <pre>
		 * acyclic po | com as sc
		 * undefined_unless empty rmw &amp; (fre ; coe) as atomic
		 * </pre>
		 */
		public class Test extends AbstractTerm implements Instruction {
			public enum Kind {
				ACYCLIC("acyclic"), IRREFLEXIVE("irreflexive"), EMPTY("empty");

				private final String text;

				Kind(String text) {
					this.text = text;
				}

				@Override
				public String toString() {
					return text;
				}
			}

			/**
			 * Determines what happens when a check fails. A failed
			 * <code>PROVIDES</code> check rejects the execution, whilst a failed
			 * <code>REQUIRES</code> check marks the execution as undefined.
			 */
			public enum Severity {
				PROVIDES, REQUIRES
			}

			private final Kind kind;
			private final Expr operand;
			private final String name;
			private final Severity severity;

			public Test(Kind kind, Expr operand, String name, Severity severity, Attribute... attributes) {
				super(INS_test, attributes);
				this.kind = kind;
				this.operand = operand;
				this.name = name;
				this.severity = severity;
			}

			public Kind kind() {
				return kind;
			}

			public Expr operand() {
				return operand;
			}

			/**
			 * Get the name of this check, or <code>null</code> if it is anonymous.
			 *
			 * @return
			 */
			public String name() {
				return name;
			}

			public Severity severity() {
				return severity;
			}

			@Override
			public String toString() {
				return kind + " " + operand + (name == null ? "" : " as " + name);
			}
		}

		/**
		 * Represents a named check which is performed by calling a procedure:
		 *
		 * <pre>
		 * call consistent(po, rf) as sc
		 * </pre>
		 */
		public class ProcedureTest extends AbstractTerm implements Instruction {
			private final String procedure;
			private final List<Expr> arguments;
			private final String name;

			public ProcedureTest(String procedure, List<Expr> arguments, String name, Attribute... attributes) {
				super(INS_proceduretest, attributes);
				this.procedure = procedure;
				this.arguments = Collections.unmodifiableList(arguments);
				this.name = name;
			}

			public String procedure() {
				return procedure;
			}

			public List<Expr> arguments() {
				return arguments;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return "call " + procedure + "(" + join(arguments, ", ") + ") as " + name;
			}
		}

		/**
		 * Represents the execution of a body once for every element of a set:
		 *
		 * <pre>
		 * forall s in scopes do ... end
		 * </pre>
		 */
		public class Forall extends AbstractTerm implements Instruction {
			private final String variable;
			private final Expr set;
			private final List<Instruction> body;

			public Forall(String variable, Expr set, List<Instruction> body, Attribute... attributes) {
				super(INS_forall, attributes);
				this.variable = variable;
				this.set = set;
				this.body = Collections.unmodifiableList(body);
			}

			public String variable() {
				return variable;
			}

			public Expr set() {
				return set;
			}

			public List<Instruction> body() {
				return body;
			}

			@Override
			public String toString() {
				return "forall " + variable + " in " + set + " do ... end";
			}
		}

		/**
		 * Represents a choice of one element of a set, such that the remainder of the
		 * model is executed once for every choice:
		 *
		 * <pre>
		 * with co from generate_cos(co0)
		 * </pre>
		 */
		public class WithFrom extends AbstractTerm implements Instruction {
			private final String variable;
			private final Expr set;

			public WithFrom(String variable, Expr set, Attribute... attributes) {
				super(INS_withfrom, attributes);
				this.variable = variable;
				this.set = set;
			}

			public String variable() {
				return variable;
			}

			public Expr set() {
				return set;
			}

			@Override
			public String toString() {
				return "with " + variable + " from " + set;
			}
		}

		/**
		 * Represents the inclusion of another model file.
		 */
		public class Include extends AbstractTerm implements Instruction {
			private final String filename;

			public Include(String filename, Attribute... attributes) {
				super(INS_include, attributes);
				this.filename = filename;
			}

			public String filename() {
				return filename;
			}

			@Override
			public String toString() {
				return "include \"" + filename + "\"";
			}
		}

		/**
		 * Represents the definition of a procedure.
		 */
		public class Procedure extends AbstractTerm implements Instruction {
			private final String name;
			private final List<String> parameters;
			private final List<Instruction> body;

			public Procedure(String name, List<String> parameters, List<Instruction> body, Attribute... attributes) {
				super(INS_procedure, attributes);
				this.name = name;
				this.parameters = Collections.unmodifiableList(parameters);
				this.body = Collections.unmodifiableList(body);
			}

			public String name() {
				return name;
			}

			public List<String> parameters() {
				return parameters;
			}

			public List<Instruction> body() {
				return body;
			}

			@Override
			public String toString() {
				return "procedure " + name + "(" + String.join(", ", parameters) + ") = ... end";
			}
		}

		/**
		 * Represents the invocation of a procedure.
		 */
		public class Call extends AbstractTerm implements Instruction {
			private final String name;
			private final List<Expr> arguments;

			public Call(String name, List<Expr> arguments, Attribute... attributes) {
				super(INS_call, attributes);
				this.name = name;
				this.arguments = Collections.unmodifiableList(arguments);
			}

			public String name() {
				return name;
			}

			public List<Expr> arguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return "call " + name + "(" + join(arguments, ", ") + ")";
			}
		}

		/**
		 * Represents the declaration of an enumeration:
		 *
		 * <pre>
		 * enum scopes = 'wi || 'wg || 'dev
		 * </pre>
		 */
		public class Enum extends AbstractTerm implements Instruction {
			private final String name;
			private final List<String> tags;

			public Enum(String name, List<String> tags, Attribute... attributes) {
				super(INS_enum, attributes);
				this.name = name;
				this.tags = Collections.unmodifiableList(tags);
			}

			public String name() {
				return name;
			}

			public List<String> tags() {
				return tags;
			}

			@Override
			public String toString() {
				return "enum " + name + " = '" + String.join(" || '", tags);
			}
		}

		/**
		 * Requests the display of some named relations.
		 */
		public class Show extends AbstractTerm implements Instruction {
			private final List<String> names;

			public Show(List<String> names, Attribute... attributes) {
				super(INS_show, attributes);
				this.names = Collections.unmodifiableList(names);
			}

			public List<String> names() {
				return names;
			}

			@Override
			public String toString() {
				return "show " + String.join(", ", names);
			}
		}

		/**
		 * Requests the display of a relation under a given name.
		 */
		public class ShowAs extends AbstractTerm implements Instruction {
			private final Expr operand;
			private final String name;

			public ShowAs(Expr operand, String name, Attribute... attributes) {
				super(INS_showas, attributes);
				this.operand = operand;
				this.name = name;
			}

			public Expr operand() {
				return operand;
			}

			public String name() {
				return name;
			}

			@Override
			public String toString() {
				return "show " + operand + " as " + name;
			}
		}

		/**
		 * Withdraws the display of some named relations.
		 */
		public class UnShow extends AbstractTerm implements Instruction {
			private final List<String> names;

			public UnShow(List<String> names, Attribute... attributes) {
				super(INS_unshow, attributes);
				this.names = Collections.unmodifiableList(names);
			}

			public List<String> names() {
				return names;
			}

			@Override
			public String toString() {
				return "unshow " + String.join(", ", names);
			}
		}

		/**
		 * Prints the value of an expression.
		 */
		public class Debug extends AbstractTerm implements Instruction {
			private final Expr operand;

			public Debug(Expr operand, Attribute... attributes) {
				super(INS_debug, attributes);
				this.operand = operand;
			}

			public Expr operand() {
				return operand;
			}

			@Override
			public String toString() {
				return "debug " + operand;
			}
		}

		/**
		 * Typesetting directive, which has no effect on interpretation.
		 */
		public class Latex extends AbstractTerm implements Instruction {
			private final String text;

			public Latex(String text, Attribute... attributes) {
				super(INS_latex, attributes);
				this.text = text;
			}

			public String text() {
				return text;
			}

			@Override
			public String toString() {
				return "latex \"" + text + "\"";
			}
		}

		/**
		 * Declares the annotations permitted on a kind of event (annotation mode
		 * only):
		 *
		 * <pre>
		 * events R[{'once, 'acquire}]
		 * </pre>
		 */
		public class EventDec extends AbstractTerm implements Instruction {
			private final String name;
			private final List<Expr> annotations;

			public EventDec(String name, List<Expr> annotations, Attribute... attributes) {
				super(INS_eventdec, attributes);
				this.name = name;
				this.annotations = Collections.unmodifiableList(annotations);
			}

			public String name() {
				return name;
			}

			public List<Expr> annotations() {
				return annotations;
			}

			@Override
			public String toString() {
				return "events " + name + "[" + join(annotations, ", ") + "]";
			}
		}

		/**
		 * Deprecated relation declaration (annotation mode only).
		 */
		public class RelationDec extends AbstractTerm implements Instruction {
			private final String name;
			private final Expr operand;

			public RelationDec(String name, Expr operand, Attribute... attributes) {
				super(INS_relationdec, attributes);
				this.name = name;
				this.operand = operand;
			}

			public String name() {
				return name;
			}

			public Expr operand() {
				return operand;
			}

			@Override
			public String toString() {
				return "relation " + name + " " + operand;
			}
		}

		/**
		 * Deprecated order declaration (annotation mode only).
		 */
		public class OrderDec extends AbstractTerm implements Instruction {
			private final String name;
			private final Expr operand;

			public OrderDec(String name, Expr operand, Attribute... attributes) {
				super(INS_orderdec, attributes);
				this.name = name;
				this.operand = operand;
			}

			public String name() {
				return name;
			}

			public Expr operand() {
				return operand;
			}

			@Override
			public String toString() {
				return "order " + name + " " + operand;
			}
		}
	}

	private static String join(List<?> items, String separator) {
		StringBuilder r = new StringBuilder();
		for (int i = 0; i != items.size(); ++i) {
			if (i != 0) {
				r.append(separator);
			}
			r.append(items.get(i));
		}
		return r.toString();
	}
}
