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
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;

/**
 * Source text read from a file named with the {@code -f} switch.
 * <p>
 * The file must be UTF-8. A leading byte order mark, as written by some
 * editors, is dropped so that the first line keeps its indentation level.
 */
public class SourceFileInput extends SourceInput {

	private static final Logger LOG = JoxLogger.getLogger(SourceFileInput.class);

	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final Path path;

	/**
	 * @param filePath path of the file to read
	 */
	public SourceFileInput(String filePath) {
		super(filePath, null);
		this.path = Paths.get(filePath);
	}

	public String getFilePath() {
		return getDescription();
	}

	/**
	 * Opens the file. Each call returns a new reader.
	 *
	 * @throws NoSuchFileException if there is no regular file at the path
	 */
	@Override
	public Reader getReader() throws IOException {
		if (!Files.isRegularFile(path)) {
			throw new NoSuchFileException(path.toString(), null, "source file not found");
		}
		return Files.newBufferedReader(path, StandardCharsets.UTF_8);
	}

	/**
	 * Reads the file, without its byte order mark.
	 *
	 * @throws IOException if the file cannot be read or is not valid UTF-8
	 */
	@Override
	public String readText() throws IOException {
		String text;
		try {
			text = super.readText();
		} catch (CharacterCodingException e) {
			throw new IOException("Source file is not valid UTF-8: " + path, e);
		}
		if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
			text = text.substring(1);
		}
		LOG.debug("Read {} character(s) from {}", text.length(), path);
		return text;
	}
}
