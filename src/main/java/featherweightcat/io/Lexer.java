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

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import featherweightcat.util.SyntaxError;

/**
 * Responsible for turning a stream of characters into a sequence of tokens.
 *
 * @author Daivd J. Pearce
 *
 */
public class Lexer {

	private final String filename;
	private final String input;
	private int pos;

	public Lexer(String filename) throws IOException {
		this(filename, new InputStreamReader(new FileInputStream(filename), StandardCharsets.UTF_8));
	}

	public Lexer(String filename, Reader reader) throws IOException {
		BufferedReader in = new BufferedReader(reader);

		StringBuilder text = new StringBuilder();
		String tmp;
		while ((tmp = in.readLine()) != null) {
			text.append(tmp);
			text.append("\n");
		}

		this.filename = filename;
		this.input = text.toString();
	}

	/**
	 * Get the text being scanned.
	 *
	 * @return
	 */
	public String text() {
		return input;
	}

	/**
	 * Scan all characters from the input stream and generate a corresponding
	 * list of tokens, whilst discarding all whitespace and comments.
	 *
	 * @return
	 */
	public List<Token> scan() {
		ArrayList<Token> tokens = new ArrayList<>();
		pos = 0;

		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (Character.isDigit(c)) {
				tokens.add(scanNumericConstant());
			} else if (c == '/' && (pos + 1) < input.length() && input.charAt(pos + 1) == '/') {
				scanLineComment();
			} else if (c == '(' && (pos + 1) < input.length() && input.charAt(pos + 1) == '*') {
				scanBlockComment();
			} else if (c == '"') {
				tokens.add(scanString());
			} else if (c == '\'') {
				tokens.add(scanTag());
			} else if (isOperatorStart(c)) {
				tokens.add(scanOperator());
			} else if (isIdentifierStart(c)) {
				tokens.add(scanIdentifier());
			} else if (Character.isWhitespace(c)) {
				skipWhitespace();
			} else {
				syntaxError("syntax error");
			}
		}

		return tokens;
	}

	/**
	 * Scan a numeric constant. That is a sequence of digits which gives an
	 * integer constant.
	 *
	 * @return
	 */
	public Token scanNumericConstant() {
		int start = pos;
		while (pos < input.length() && Character.isDigit(input.charAt(pos))) {
			pos = pos + 1;
		}
		String text = input.substring(start, pos);
		return new Int(Integer.parseInt(text), text, start);
	}

	/**
	 * Scan a string literal, such as a file name.
	 *
	 * @return
	 */
	public Token scanString() {
		int start = pos;
		pos++;
		while (pos < input.length() && input.charAt(pos) != '"') {
			if (input.charAt(pos) == '\n') {
				syntaxError("unterminated string");
			}
			pos++;
		}
		if (pos >= input.length()) {
			syntaxError("unterminated string");
		}
		pos++;
		return new StringLiteral(input.substring(start + 1, pos - 1), input.substring(start, pos), start);
	}

	/**
	 * Scan a tag constant, such as <code>'wg</code>.
	 *
	 * @return
	 */
	public Token scanTag() {
		int start = pos;
		pos++;
		if (pos >= input.length() || !isIdentifierStart(input.charAt(pos))) {
			syntaxError("tag name expected");
		}
		while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
			pos++;
		}
		return new Tag(input.substring(start + 1, pos), input.substring(start, pos), start);
	}

	static final char[] opStarts = { '|', '+', ';', '\\', '&', '*', '?', '^', '~', '(', ')', '{', '}', '[', ']', ',',
			'=', '-' };

	public boolean isOperatorStart(char c) {
		for (char o : opStarts) {
			if (c == o) {
				return true;
			}
		}
		return false;
	}

	static final String[] operators = { "||", "|", "++", "+", ";", "\\", "&", "*", "?", "^-1", "^+", "^*", "^?", "~",
			"(", ")", "{", "}", "[", "]", ",", "=", "->" };

	public Token scanOperator() {
		// Longest operators are listed before their prefixes
		for (String op : operators) {
			if (input.startsWith(op, pos)) {
				Token t = new Operator(op, pos);
				pos += op.length();
				return t;
			}
		}
		syntaxError("unknown operator encountered: " + input.charAt(pos));
		return null;
	}

	public static final String[] keywords = { "let", "rec", "and", "in", "fun", "match", "with", "end", "try",
			"acyclic", "irreflexive", "empty", "as", "undefined_unless", "show", "unshow", "debug", "include",
			"procedure", "call", "enum", "forall", "do", "from", "events", "relation", "order", "latex", "_" };

	public Token scanIdentifier() {
		int start = pos;
		while (pos < input.length() && isIdentifierPart(input.charAt(pos))) {
			if (input.startsWith("->", pos)) {
				break;
			}
			pos++;
		}
		String text = input.substring(start, pos);

		// now, check for keywords
		for (String keyword : keywords) {
			if (keyword.equals(text)) {
				return new Keyword(text, start);
			}
		}

		// otherwise, must be identifier
		return new Identifier(text, start);
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '-';
	}

	public void scanLineComment() {
		while (pos < input.length() && input.charAt(pos) != '\n') {
			pos++;
		}
	}

	/**
	 * Skip over a (possibly nested) comment <code>(* ... *)</code>.
	 */
	public void scanBlockComment() {
		int start = pos;
		int depth = 0;
		while ((pos + 1) < input.length()) {
			if (input.charAt(pos) == '(' && input.charAt(pos + 1) == '*') {
				depth++;
				pos += 2;
			} else if (input.charAt(pos) == '*' && input.charAt(pos + 1) == ')') {
				depth--;
				pos += 2;
				if (depth == 0) {
					return;
				}
			} else {
				pos++;
			}
		}
		throw new SyntaxError("unterminated comment", filename, input, start, start + 1);
	}

	/**
	 * Skip over any whitespace at the current index position in the input
	 * string.
	 *
	 * @param tokens
	 */
	public void skipWhitespace() {
		while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
			pos++;
		}
	}

	/**
	 * Raise a syntax error with a given message at the current index.
	 *
	 * @param msg
	 * @param index
	 */
	private void syntaxError(String msg) {
		throw new SyntaxError(msg, filename, input, pos, pos);
	}

	/**
	 * The base class for all tokens.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static abstract class Token {

		public final String text;
		public final int start;

		public Token(String text, int pos) {
			this.text = text;
			this.start = pos;
		}

		public int end() {
			return start + text.length() - 1;
		}
	}

	/**
	 * Represents an integer constant. That is, a sequence of 1 or more digits.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Int extends Token {

		public final int value;

		public Int(int r, String text, int pos) {
			super(text, pos);
			value = r;
		}
	}

	/**
	 * Represents a variable or function name. That is, an alphabetic character
	 * (or '_'), followed by a sequence of zero or more alpha-numeric characters
	 * (or '_', '.' and '-').
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Identifier extends Token {

		public Identifier(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a known keyword. In essence, a keyword is a sequence of one or
	 * more alphabetic characters which is defined in advance.
	 *
	 * @author David J. Pearce
	 *
	 */
	public static class Keyword extends Token {

		public Keyword(String text, int pos) {
			super(text, pos);
		}
	}

	/**
	 * Represents a tag constant, such as <code>'acquire</code>.
	 */
	public static class Tag extends Token {
		public final String name;

		public Tag(String name, String text, int pos) {
			super(text, pos);
			this.name = name;
		}
	}

	/**
	 * Represents a string constant, such as <code>"stdlib.cat"</code>.
	 */
	public static class StringLiteral extends Token {
		public final String value;

		public StringLiteral(String value, String text, int pos) {
			super(text, pos);
			this.value = value;
		}
	}

	public static class Operator extends Token {
		public Operator(String text, int pos) {
			super(text, pos);
		}
	}
}
