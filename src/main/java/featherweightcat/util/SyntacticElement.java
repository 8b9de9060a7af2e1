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

/**
 * A Syntactic Element represents any part of a model file which is relevant to
 * the syntactic structure of the file, and in particular parts we may wish to
 * add information too (e.g. line numbers, the text of a check, etc).
 *
 * @author David Pearce
 */
public interface SyntacticElement {

	/**
	 * Get the list of attributes associated with this syntactic element.
	 *
	 * @return
	 */
	public Attribute[] attributes();

	/**
	 * Get the first attribute of the given class type. This is useful short-hand.
	 *
	 * @param c
	 * @return
	 */
	public <T extends Attribute> T attribute(Class<T> c);

	/**
	 * Describe the source location of a given element, in the form used for all
	 * diagnostics.
	 *
	 * @param element Element to describe, which may be <code>null</code>.
	 * @return
	 */
	public static String location(SyntacticElement element) {
		Attribute.Source src = element == null ? null : element.attribute(Attribute.Source.class);
		return src == null ? "<unknown location>" : src.toString();
	}

	public class Impl implements SyntacticElement {

		private Attribute[] attributes;

		public Impl(Attribute x) {
			attributes = new Attribute[]{x};
		}

		public Impl(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public Attribute[] attributes() {
			return attributes;
		}

		@Override
		@SuppressWarnings("unchecked")
		public <T extends Attribute> T attribute(Class<T> c) {
			for (Attribute a : attributes) {
				if (c.isInstance(a)) {
					return (T) a;
				}
			}
			return null;
		}
	}

	/**
	 * Represents an attribute that can be associated with a syntactic element.
	 *
	 * @author djp
	 *
	 */
	public interface Attribute {

		/**
		 * Identifies the region of a model file from which an element was parsed.
		 * Positions are columns within the starting line, and both are inclusive.
		 */
		public static class Source implements Attribute {
			public final String filename;
			public final int line;
			public final int start;
			public final int end;

			public Source(String filename, int line, int start, int end) {
				this.filename = filename;
				this.line = line;
				this.start = start;
				this.end = end;
			}

			@Override
			public String toString() {
				return "File \"" + filename + "\", line " + line + ", characters " + start + "-" + (end + 1);
			}
		}

		/**
		 * Records the original text of an element. This is used to report which check
		 * failed.
		 */
		public static class Text implements Attribute {
			public final String text;

			public Text(String text) {
				this.text = text;
			}

			@Override
			public String toString() {
				return text;
			}
		}
	}
}
