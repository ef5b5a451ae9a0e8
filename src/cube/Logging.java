/*
 * MIT License
 *
 * Copyright (c) 2022 Justin Kunimune
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package cube;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class Logging {

	/**
	 * give the console a one-line format and, if a directory is given, copy everything to log-&lt;name&gt;.log in it.
	 * @param logger the logger to set up (its parent's console handler gets reformatted too)
	 * @param name the name of this run, for the log file
	 * @param directory the directory in which to put the log file, or null for no file
	 * @throws IOException if the log file can't be opened
	 */
	public static void configureLogger(Logger logger, String name, File directory) throws IOException {
		System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));

		Handler console = findConsoleHandler(logger);
		console.setFormatter(newFormatter("%1$ta %1$tH:%1$tM:%1$tS | %2$s | %3$s%4$s%n"));
		console.setEncoding("UTF-8");
		if (directory != null) {
			if (!directory.isDirectory() && !directory.mkdirs())
				throw new IOException("couldn't make the log directory "+directory);
			String filename = new File(directory, String.format("log-%s.log", name)).getPath();
			FileHandler handler = new FileHandler(filename, true);
			handler.setFormatter(newFormatter("%1$tY-%1$tm-%1$td %1$tH:%1$tM:%1$tS | %2$s | %3$s%4$s%n"));
			handler.setEncoding("UTF-8");
			logger.addHandler(handler);
			System.out.println("logging in　to `"+filename+"`");
		}
	}

	/**
	 * the console handler of the logger's parent, which is where the JDK puts it by default, or a new one on the
	 * logger itself if there isn't one
	 */
	private static Handler findConsoleHandler(Logger logger) {
		Logger parent = logger.getParent();
		if (parent != null)
			for (Handler handler: parent.getHandlers())
				if (handler instanceof ConsoleHandler)
					return handler;
		for (Handler handler: logger.getHandlers())
			if (handler instanceof ConsoleHandler)
				return handler;
		ConsoleHandler handler = new ConsoleHandler();
		logger.addHandler(handler);
		return handler;
	}

	static Formatter newFormatter(String format) {
		return new SimpleFormatter() {
			public String format(LogRecord record) {
				return String.format(format,
				                     record.getMillis(),
				                     record.getLevel(),
				                     record.getMessage(),
				                     (record.getThrown() != null) ? record.getThrown() : "");
			}
		};
	}
}
