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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import org.metricshub.jox.ast.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J logger factory for Jox, which also renders trees for trace
 * messages. SLF4J's own initialization report is kept off the console.
 */
public final class JoxLogger {
	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	private JoxLogger() {
		// utility class
	}

	/**
	 * @param clazz Class for which the logger will be used
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}

	/**
	 * Logs the dump of a tree at trace level, preceded by the name of the
	 * stage that produced it. Nothing is rendered when trace is disabled.
	 *
	 * @param log where to log
	 * @param stage what produced the tree, e.g. {@code "parsed"}
	 * @param tree the tree to dump
	 */
	public static void traceTree(Logger log, String stage, Node tree) {
		if (log.isTraceEnabled()) {
			log.trace("{} tree:{}{}", stage, System.lineSeparator(), dumpText(tree));
		}
	}

	/**
	 * @param tree the tree to render
	 * @return the text {@link Node#dump(PrintStream)} prints for {@code tree}
	 */
	public static String dumpText(Node tree) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		try {
			tree.dump(new PrintStream(bytes, true, StandardCharsets.UTF_8.name()));
			return bytes.toString(StandardCharsets.UTF_8.name());
		} catch (UnsupportedEncodingException e) {
			throw new IllegalStateException("UTF-8 is not supported", e);
		}
	}
}
