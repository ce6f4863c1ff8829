package org.metricshub.romanloop;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Romanloop
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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
import java.io.StringReader;
import org.metricshub.romanloop.frontend.AstNode;
import org.metricshub.romanloop.frontend.SourceException;
import org.metricshub.romanloop.util.ParserSettings;
import org.metricshub.romanloop.util.ScriptFileSource;
import org.metricshub.romanloop.util.ScriptSource;

/**
 * Command-line interface for Romanloop.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "romanloop.jar";
		}
		JAR_NAME = myName;
	}

	private final ParserSettings settings = new ParserSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance using the supplied stream.
	 *
	 * @param out stream where the dumps are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link ParserSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ParserSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source given on the command line, or {@code null}
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
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
				// end of options: the program text follows
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one program may be given.");
				}
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("--dump-tokens")) {
				settings.setDumpTokens(true);
			} else if (arg.equals("--no-dump-syntax")) {
				settings.setDumpSyntaxTree(false);
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

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Program not provided.");
			}
			scriptSource = new ScriptSource(
					ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT,
					new StringReader(args[argIdx++]));
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
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

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the parsed tree, or {@code null} when only the usage was printed
	 * @throws IOException if the program cannot be read
	 * @throws SourceException if the program is rejected
	 */
	public AstNode run() throws IOException, SourceException {
		if (printUsage) {
			usage(out);
			return null;
		}
		return new Romanloop().invoke(scriptSource, settings);
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
								" [-f program-filename]" +
								" [--dump-tokens]" +
								" [--no-dump-syntax]" +
								" [program]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for the program.");
		dest.println(" --dump-tokens = Print the tokens before parsing.");
		dest.println(" --no-dump-syntax = Do not print the syntax tree.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the dumps
	 * @return configured and executed CLI instance
	 * @throws IOException if the program cannot be read
	 * @throws SourceException if the program is rejected
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException, SourceException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 * Exits with 1 when the program is rejected and 2 on bad arguments.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			create(args, System.out);
		} catch (SourceException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(2);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
