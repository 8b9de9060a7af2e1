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

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import featherweightcat.core.Syntax.Model;

/**
 * Locates, reads and parses model files. A file is searched for as given, then
 * in each directory of the include path in turn and, finally, amongst the
 * models bundled with the interpreter (such as the standard library). Parsed
 * models are cached by name.
 *
 * @author David J. Pearce
 *
 */
public class ModelLoader {
	private final List<File> includePath;
	private final HashMap<String, Model> cache = new HashMap<>();

	public ModelLoader(List<File> includePath) {
		this.includePath = new ArrayList<>(includePath);
	}

	public List<File> includePath() {
		return includePath;
	}

	/**
	 * Load a given model file.
	 *
	 * @param filename
	 * @return
	 * @throws IOException if the file cannot be found or read.
	 * @throws featherweightcat.util.SyntaxError if the file is malformed.
	 */
	public synchronized Model load(String filename) throws IOException {
		Model model = cache.get(filename);
		if (model == null) {
			model = parse(filename, read(filename));
			cache.put(filename, model);
		}
		return model;
	}

	private String read(String filename) throws IOException {
		File file = new File(filename);
		if (file.isFile()) {
			return read(new FileInputStream(file));
		}
		if (!file.isAbsolute()) {
			for (File dir : includePath) {
				File f = new File(dir, filename);
				if (f.isFile()) {
					return read(new FileInputStream(f));
				}
			}
			InputStream in = ModelLoader.class.getResourceAsStream(filename);
			if (in != null) {
				return read(in);
			}
		}
		throw new FileNotFoundException("cannot find file " + filename);
	}

	private static String read(InputStream input) throws IOException {
		try (InputStream in = input) {
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	/**
	 * Parse the text of a model file.
	 *
	 * @param filename Name used when reporting errors.
	 * @param text
	 * @return
	 */
	public static Model parse(String filename, String text) {
		try {
			Lexer lexer = new Lexer(filename, new StringReader(text));
			Parser parser = new Parser(filename, lexer.text(), lexer.scan());
			return parser.parseModel();
		} catch (IOException e) {
			// Reading from a string cannot fail
			throw new IllegalStateException(e);
		}
	}
}
