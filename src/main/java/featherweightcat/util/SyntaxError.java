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

package featherweightcat.util;

import java.io.PrintStream;

/**
 * This exception is thrown when a lexical or syntax error occurs whilst reading
 * a model file.
 *
 * @author David Pearce
 */
public class SyntaxError extends RuntimeException {

	private String msg;
	private String filename;
	private String src;
	private int start;
	private int end;

	/**
	 * Identify a syntax error at a particular point in a file.
	 *
	 * @param msg
	 *            Message detailing the problem.
	 * @param filename
	 *            The name of the model file being read.
	 * @param src
	 *            The text of the model file this error is referring to.
	 * @param start
	 *            Index of first offending character.
	 * @param end
	 *            Index of last offending character.
	 */
	public SyntaxError(String msg, String filename, String src, int start, int end) {
		this.msg = msg;
		this.filename = filename;
		this.src = src;
		this.start = start;
		this.end = end;
	}

	@Override
	public String getMessage() {
		if (msg != null) {
			return msg;
		} else {
			return "";
		}
	}

	/**
	 * Error message
	 *
	 * @return
	 */
	public String msg() {
		return msg;
	}

	/**
	 * Name of the model file where the error arose.
	 *
	 * @return
	 */
	public String filename() {
		return filename;
	}

	/**
	 * Get index of first character of offending location.
	 *
	 * @return
	 */
	public int start() {
		return start;
	}

	/**
	 * Get index of last character of offending location.
	 *
	 * @return
	 */
	public int end() {
		return end;
	}

	/**
	 * Output the syntax error to a given output stream, underlining the offending
	 * region of the source line.
	 */
	public void outputSourceError(PrintStream output) {
		if (src == null || start < 0) {
			output.println(filename + ": syntax error: " + getMessage());
		} else {
			int line = 0;
			int lineStart = 0;
			int lineEnd = 0;

			while (lineEnd < src.length() && lineEnd <= start) {
				lineStart = lineEnd;
				lineEnd = parseLine(src, lineEnd);
				line = line + 1;
			}
			lineEnd = Math.min(lineEnd, src.length());

			output.println(filename + ":" + line + ": " + getMessage());
			StringBuilder str = new StringBuilder(src.substring(lineStart, lineEnd));
			if (str.length() == 0 || str.charAt(str.length() - 1) != '\n') {
				// Last line of the file, which has no terminating new-line.
				str.append('\n');
			}
			output.print(str);
			str.setLength(0);
			for (int i = lineStart; i < start; ++i) {
				str.append(src.charAt(i) == '\t' ? '\t' : ' ');
			}
			for (int i = start; i <= end; ++i) {
				str.append('^');
			}
			output.println(str);
		}
	}

	private static int parseLine(String text, int index) {
		while (index < text.length() && text.charAt(index) != '\n') {
			index++;
		}
		return index + 1;
	}

	public static final long serialVersionUID = 1l;
}
