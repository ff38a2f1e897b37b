package org.metricshub.jox;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jox.ast.Node;
import org.metricshub.jox.frontend.SourceSyntaxException;
import org.metricshub.jox.util.JoxLogger;
import org.metricshub.jox.util.JoxSettings;
import org.metricshub.jox.util.SourceFileInput;
import org.metricshub.jox.util.SourceInput;
import org.slf4j.Logger;

/**
 * Command-line interface for Jox: reads a source text, substitutes the
 * {@code -v} variables, folds constants and prints the result.
 */
public final class Cli {

	private static final Logger LOG = JoxLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (URISyntaxException | RuntimeException e) {
			myName = "jox.jar";
		}
		JAR_NAME = myName;
	}

	private final JoxSettings settings = new JoxSettings();
	private final PrintStream out;

	private final List<SourceInput> sources = new ArrayList<SourceInput>();
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * @param out stream where the result is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link JoxSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JoxSettings getSettings() {
		return settings;
	}

	/**
	 * @return defensive copy of the sources given on the command line
	 */
	public List<SourceInput> getSources() {
		return new ArrayList<SourceInput>(sources);
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: what follows is the source text
				break;
			} else if (arg.equals("-") || arg.equals("--")) {
				// dashes end the options as well, for a source text starting with '-'
				++argIdx;
				break;
			} else if (arg.equals("-v")) {
				// -v name=val : substitute a value for a free name
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : read the source from a file
				checkParameterHasArgument(args, argIdx);
				sources.add(new SourceFileInput(args[++argIdx]));
			} else if (arg.equals("--expr")) {
				settings.setExpressionMode(true);
			} else if (arg.equals("-s") || arg.equals("--no-simplify")) {
				settings.setSimplify(false);
			} else if (arg.equals("--dump-syntax")) {
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("--free-vars")) {
				settings.setPrintFreeVariables(true);
			} else if (arg.equals("--indent")) {
				checkParameterHasArgument(args, argIdx);
				String width = args[++argIdx];
				try {
					settings.setIndentWidth(Integer.parseInt(width));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid indentation width: " + width, e);
				}
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (settings.isDumpSyntaxTree() && settings.isPrintFreeVariables()) {
			throw new IllegalArgumentException("--dump-syntax and --free-vars cannot be combined.");
		}

		if (sources.isEmpty()) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Source text not provided.");
			}
			sources.add(SourceInput.ofText(args[argIdx++]));
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("Settings:\n{}", settings.toDescriptionString());
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)");

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance. The value is an integer if it reads as one,
	 * else a float if it reads as one, else a string.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void addVariable(JoxSettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException(
					"keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		String name = m.group(1);
		String valueString = m.group(2);
		Object value;
		try {
			value = Long.parseLong(valueString);
		} catch (NumberFormatException nfe) {
			try {
				double d = Double.parseDouble(valueString);
				value = Double.isNaN(d) || Double.isInfinite(d) ? valueString : d;
			} catch (NumberFormatException nfe2) {
				value = valueString;
			}
		}
		settings.putVariable(name, value);
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if a source cannot be read
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		Jox jox = new Jox(settings);
		Node tree = jox.transform(sources);
		jox.invoke(tree);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f source-filename]" +
								" [--expr]" +
								" [-v name=val]..." +
								" [-s|--no-simplify]" +
								" [--dump-syntax]" +
								" [--free-vars]" +
								" [--indent n]" +
								" [source]");
		dest.println();
		dest.println(" -f filename = Read the source from filename.");
		dest.println(" --expr = The source is a single expression.");
		dest.println(" -v name=val = Replace the free name by val (integer, float or string).");
		dest.println(" -s, --no-simplify = Do not fold constants.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --free-vars = Print the free variables, one per line.");
		dest.println(" --indent n = Indent emitted blocks with n spaces (default 4).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the result
	 * @return configured and executed CLI instance
	 * @throws IOException if a source cannot be read
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (SourceSyntaxException e) {
			System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLine(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
