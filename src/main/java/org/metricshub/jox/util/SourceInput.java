package org.metricshub.jox.util;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jox
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;

/**
 * One source text to read: either a string given on the command line, or
 * a file named with the {@code -f} switch (see {@link SourceFileInput}).
 */
public class SourceInput {

	/** Description of a source text supplied on the command line */
	public static final String DESCRIPTION_COMMAND_LINE_SOURCE = "<command-line-supplied-source>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description where the text comes from, used in messages
	 * @param reader the text
	 */
	public SourceInput(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @param text source text given on the command line
	 * @return a source input reading {@code text}
	 */
	public static SourceInput ofText(String text) {
		return new SourceInput(DESCRIPTION_COMMAND_LINE_SOURCE, new StringReader(text));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the source contents.
	 *
	 * @return The reader which contains the source contents.
	 * @throws IOException if the source cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole source and closes the reader.
	 *
	 * @return the source contents
	 * @throws IOException if the source cannot be read
	 */
	public String readText() throws IOException {
		StringBuilder sb = new StringBuilder();
		char[] buf = new char[4096];
		try (Reader r = getReader()) {
			int n;
			while ((n = r.read(buf)) >= 0) {
				sb.append(buf, 0, n);
			}
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return getDescription();
	}
}
