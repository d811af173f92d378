package org.metricshub.compatrandom;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CompatRandom
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
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import org.metricshub.compatrandom.util.CompatLogger;
import org.metricshub.compatrandom.util.RandomSettings;
import org.metricshub.compatrandom.util.RandomSettings.Operation;
import org.slf4j.Logger;

/**
 * Command-line interface printing the sequence of a seed, one value per line.
 */
public final class Cli {

	private static final Logger LOGGER = CompatLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "compat-random.jar";
		}
		JAR_NAME = myName;
	}

	private final RandomSettings settings = new RandomSettings();
	private final PrintStream out;

	private boolean printUsage;

	/**
	 * Creates a CLI instance printing to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance printing to the supplied stream.
	 *
	 * @param out stream where the values and the usage are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link RandomSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public RandomSettings getSettings() {
		return settings;
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
				// end of options: the operation follows
				break;
			} else if (arg.equals("-s") || arg.equals("--seed")) {
				checkParameterHasArgument(args, argIdx);
				settings.setSeed(parseInt(args[++argIdx], "seed"));
			} else if (arg.equals("-n") || arg.equals("--count")) {
				checkParameterHasArgument(args, argIdx);
				settings.setCount(parseInt(args[++argIdx], "count"));
			} else if (arg.equals("-d") || arg.equals("--derived")) {
				settings.setDerived(true);
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

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("Operation not provided.");
		}
		Operation operation = Operation.fromKeyword(args[argIdx++].toLowerCase(Locale.ROOT));
		settings.setOperation(operation);

		int boundCount = args.length - argIdx;
		if (boundCount > operation.getMaxBounds()) {
			throw new IllegalArgumentException(
					"Operation " + operation.getKeyword() + " accepts at most " + operation.getMaxBounds() + " bound(s)");
		}
		while (argIdx < args.length) {
			long bound = parseLong(args[argIdx++], "bound");
			if (operation == Operation.INT && (bound < Integer.MIN_VALUE || bound > Integer.MAX_VALUE)) {
				throw new IllegalArgumentException("Bound out of int range: " + bound);
			}
			settings.addBound(bound);
		}

		LOGGER.debug("Parsed settings:\n{}", settings.toDescriptionString());
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

	private static int parseInt(String value, String name) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "'", e);
		}
	}

	private static long parseLong(String value, String name) {
		try {
			return Long.parseLong(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + name + " '" + value + "'", e);
		}
	}

	/**
	 * Prints the values requested by the previously parsed arguments.
	 */
	public void run() {
		if (printUsage) {
			usage(out);
			return;
		}

		CompatRandom random = createRandom(settings);
		PrintStream dest = settings.getOutputStream();
		List<Long> bounds = settings.getBounds();
		int count = settings.getCount();

		switch (settings.getOperation()) {
		case INT:
			for (int i = 0; i < count; i++) {
				dest.println(nextInt(random, bounds));
			}
			break;
		case LONG:
			for (int i = 0; i < count; i++) {
				dest.println(nextLong(random, bounds));
			}
			break;
		case DOUBLE:
			for (int i = 0; i < count; i++) {
				dest.println(random.nextDouble());
			}
			break;
		case FLOAT:
			for (int i = 0; i < count; i++) {
				dest.println(random.nextFloat());
			}
			break;
		case BYTES:
			byte[] buffer = new byte[count];
			random.nextBytes(buffer);
			for (byte b : buffer) {
				dest.println(String.format("%02x", b & 0xff));
			}
			break;
		default:
			throw new IllegalStateException("Unsupported operation " + settings.getOperation());
		}
	}

	/**
	 * Creates the generator described by the settings. A derived generator is
	 * an empty subclass, so that the overridable primitives are exercised.
	 *
	 * @param settings seed and kind of generator
	 * @return a new generator
	 */
	static CompatRandom createRandom(RandomSettings settings) {
		Integer seed = settings.getSeed();
		if (settings.isDerived()) {
			return seed == null ? new CompatRandom() {} : new CompatRandom(seed) {};
		}
		return seed == null ? new CompatRandom() : new CompatRandom(seed);
	}

	private static int nextInt(CompatRandom random, List<Long> bounds) {
		switch (bounds.size()) {
		case 0:
			return random.nextInt();
		case 1:
			return random.nextInt(bounds.get(0).intValue());
		default:
			return random.nextInt(bounds.get(0).intValue(), bounds.get(1).intValue());
		}
	}

	private static long nextLong(CompatRandom random, List<Long> bounds) {
		switch (bounds.size()) {
		case 0:
			return random.nextLong();
		case 1:
			return random.nextLong(bounds.get(0));
		default:
			return random.nextLong(bounds.get(0), bounds.get(1));
		}
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
								" [-s seed]" +
								" [-n count]" +
								" [-d|--derived]" +
								" int|long|double|float|bytes" +
								" [bound...]");
		dest.println();
		dest.println(" -s seed, --seed seed = Seed of the sequence (default: a random seed).");
		dest.println(" -n count, --count count = Number of values to print (default: 10).");
		dest.println(" -d, --derived = Draw through the overridable primitives of a subclass.");
		dest.println();
		dest.println(" int [max | min max] = Ints, optionally bounded.");
		dest.println(" long [max | min max] = Longs, optionally bounded.");
		dest.println(" double = Doubles in [0,1).");
		dest.println(" float = Floats in [0,1).");
		dest.println(" bytes = count bytes, in hexadecimal.");
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
	 * @param os output stream for the values
	 * @return configured and executed CLI instance
	 */
	public static Cli create(String[] args, PrintStream os) {
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
		} catch (IllegalArgumentException e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
