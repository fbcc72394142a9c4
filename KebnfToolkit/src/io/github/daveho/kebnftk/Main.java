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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * Command line entry point.
 */
public class Main {
	public static final Slog LOG = new Slog("kebnftk");

	private static final String USAGE =
			"Usage: java -jar kebnftk.jar <command> [args...]\n" +
			"Commands:\n" +
			"  generate [--tag TAG] [--output-dir DIR] [--cache] [--config FILE]\n" +
			"      download the KEBNF documents of a release and generate the grammars\n" +
			"  translate <file.kebnf>... <output dir> [--config FILE]\n" +
			"      generate the grammars from local KEBNF files\n" +
			"  cycles <grammar.g4>\n" +
			"      report rule reference cycles of a generated parser grammar";

	public static void main(String[] args) {
		if (args.length < 1) {
			System.err.println(USAGE);
			System.exit(1);
		}

		String command = args[0];
		String[] rest = Arrays.copyOfRange(args, 1, args.length);
		try {
			if (command.equals("generate")) {
				new GrammarGen(LOG).executeGenerate(rest);
			} else if (command.equals("translate")) {
				new GrammarGen(LOG).executeTranslate(rest);
			} else if (command.equals("cycles")) {
				if (rest.length != 1)
					throw new IllegalArgumentException("Expected one grammar file");
				String text = new String(Files.readAllBytes(Paths.get(rest[0])), StandardCharsets.UTF_8);
				new FindCycles(FindCycles.parseGrammar(text)).report(System.out);
			} else {
				System.err.println("Unknown command: " + command);
				System.err.println(USAGE);
				System.exit(1);
			}
		} catch (IllegalArgumentException e) {
			LOG.err("%s", e.getMessage());
			System.err.println(USAGE);
			System.exit(1);
		} catch (IOException e) {
			LOG.err(e, "I/O error");
			System.exit(1);
		}
	}
}
