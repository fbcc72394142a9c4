// KebnfToolkit - Convert KEBNF language specifications to ANTLR4 grammars
// Copyright (C) 2013,2017,2026 David H. Hovemeyer <david.hovemeyer@gmail.com>
//
// Permission is hereby granted, free of charge, to any person obtaining
// a copy of this software and associated documentation files (the
// "Software"), to deal in the Software without restriction, including
// without limitation the rights to use, copy, modify, merge, publish,
// distribute, sublicense, and/or sell copies of the Software, and to
// permit persons to whom the Software is furnished to do so, subject to
// the following conditions:
// 
// The above copyright notice and this permission notice shall be included
// in all copies or substantial portions of the Software.
// 
// THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
// EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
// MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
// IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY
// CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT,
// TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
// SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.

package io.github.daveho.kebnftk;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;

/**
 * Simple hierarchical logger.
 * Each message is prefixed with a timestamp and the chain of logger names
 * from the root logger, e.g., <code>[kebnftk / parse] ...</code>.
 * Messages go to standard error, so that grammar text written to
 * standard output is not interleaved with log output.
 */
public class Slog {
	private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
			.appendLiteral('[')
			.appendValue(ChronoField.YEAR, 4).appendLiteral('-').appendValue(ChronoField.MONTH_OF_YEAR, 2).appendLiteral('-').appendValue(ChronoField.DAY_OF_MONTH, 2)
			.appendLiteral(' ')
			.appendValue(ChronoField.HOUR_OF_DAY, 2).appendLiteral(':').appendValue(ChronoField.MINUTE_OF_HOUR, 2).appendLiteral(':').appendValue(ChronoField.SECOND_OF_MINUTE, 2).appendLiteral('.').appendValue(ChronoField.MILLI_OF_SECOND, 3)
			.appendLiteral(']')
			.toFormatter();

	private final Slog parent;
	private final String name;
	private PrintStream dest;
	private long stopwatch;

	/**
	 * Create a root logger writing to standard error.
	 * 
	 * @param name the logger name
	 */
	public Slog(String name) {
		this(null, name, System.err);
	}

	/**
	 * Create a root logger writing to the given stream.
	 * 
	 * @param name the logger name
	 * @param dest the stream to write messages to
	 */
	public Slog(String name, PrintStream dest) {
		this(null, name, dest);
	}

	private Slog(Slog parent, String name, PrintStream dest) {
		this.parent = parent;
		this.name = name;
		this.dest = dest;
		this.stopwatch = -1;
	}

	/**
	 * Create a child logger. Its messages go to the same stream.
	 * 
	 * @param name the child's name
	 * @return the child logger
	 */
	public Slog child(String name) {
		return new Slog(this, name, dest);
	}

	private void nameChain(StringBuilder buf) {
		if (parent != null) {
			parent.nameChain(buf);
			buf.append(" / ");
		}
		buf.append(name);
	}

	/**
	 * Start (or restart) the stopwatch.
	 * 
	 * @return this logger
	 */
	public Slog start() {
		this.stopwatch = System.nanoTime();
		return this;
	}

	/**
	 * @return seconds since {@link #start()} was called
	 */
	public double elapsed() {
		if (stopwatch < 0)
			throw new IllegalStateException("Stopwatch of " + name + " was never started");
		return (double) (System.nanoTime() - stopwatch) / 1e9;
	}

	/**
	 * Log an informational message.
	 * 
	 * @param format format string (as for {@link String#format(String, Object...)})
	 * @param args   format arguments
	 * @return this logger
	 */
	public Slog log(String format, Object... args) {
		return write("", format, args);
	}

	/**
	 * Log a warning.
	 * 
	 * @param format format string
	 * @param args   format arguments
	 * @return this logger
	 */
	public Slog warn(String format, Object... args) {
		return write("WARNING: ", format, args);
	}

	/**
	 * Log an error.
	 * 
	 * @param format format string
	 * @param args   format arguments
	 * @return this logger
	 */
	public Slog err(String format, Object... args) {
		return write("ERROR: ", format, args);
	}

	/**
	 * Log an error along with the stack trace of an exception.
	 * 
	 * @param t      the exception
	 * @param format format string
	 * @param args   format arguments
	 * @return this logger
	 */
	public Slog err(Throwable t, String format, Object... args) {
		StringWriter str = new StringWriter();
		t.printStackTrace(new PrintWriter(str));
		return write("ERROR: ", "%s%n%n%s", String.format(format, args), str.toString());
	}

	private Slog write(String level, String format, Object... args) {
		StringBuilder buf = new StringBuilder();
		buf.append(TIMESTAMP_FORMAT.format(OffsetDateTime.now())).append(" [");
		nameChain(buf);
		buf.append("] ");
		buf.append(level);
		buf.append(String.format(format, args));
		synchronized (dest) {
			dest.println(buf.toString());
		}
		return this;
	}
}
