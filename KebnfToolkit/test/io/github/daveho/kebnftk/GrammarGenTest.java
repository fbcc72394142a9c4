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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GrammarGenTest {
	@TempDir
	Path dir;

	private ByteArrayOutputStream logText;
	private GrammarGen gen;

	@BeforeEach
	public void setUp() {
		logText = new ByteArrayOutputStream();
		gen = new GrammarGen(new Slog("test", new PrintStream(logText, true, StandardCharsets.UTF_8)));
	}

	private Path write(String name, String text) throws IOException {
		Path file = dir.resolve(name);
		Files.write(file, text.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void testTranslate() throws IOException {
		Path kerml = write("kerml.kebnf", "Foo = 'bar' Baz\n");
		Path sysml = write("sysml.kebnf", "Baz = 'qux'\n");
		Path out = dir.resolve("out");

		GeneratedGrammar grammar = gen.executeTranslate(new String[] { kerml.toString(), sysml.toString(), out.toString() });
		assertEquals(2, grammar.getRuleCount());

		String lexer = new String(Files.readAllBytes(out.resolve("SysMLv2Lexer.g4")), StandardCharsets.UTF_8);
		String parser = new String(Files.readAllBytes(out.resolve("SysMLv2.g4")), StandardCharsets.UTF_8);
		assertEquals(grammar.getLexerGrammar(), lexer);
		assertEquals(grammar.getParserGrammar(), parser);
		assertTrue(parser.contains("\nparser grammar SysMLv2;\n"));
		assertTrue(parser.contains("\nfoo\n    : BAR baz\n    ;\n"));
		assertTrue(lexer.contains("\nlexer grammar SysMLv2Lexer;\n"));
	}

	@Test
	public void testTranslateWithConfig() throws IOException {
		Path config = write("config.json", """
				{
				  "release_tag": "local",
				  "release_repo": "owner/repo",
				  "bnf_files": { "test": "test.kebnf" },
				  "output": { "lexer_grammar": "g/TLexer.g4", "parser_grammar": "g/T.g4" },
				  "grammar_name": "T",
				  "lexer_name": "TLexer"
				}
				""");
		Path input = write("test.kebnf", "Foo = 'bar'\n");
		Path out = dir.resolve("out");
		gen.executeTranslate(new String[] { "--config", config.toString(), input.toString(), out.toString() });
		assertTrue(Files.exists(out.resolve("TLexer.g4")));
		assertTrue(Files.exists(out.resolve("T.g4")));
	}

	@Test
	public void testTranslateUsage() {
		assertThrows(IllegalArgumentException.class, () -> gen.executeTranslate(new String[] { "only.kebnf" }));
		assertThrows(IllegalArgumentException.class,
				() -> gen.executeTranslate(new String[] { "--tag", "2025-12", "a.kebnf", "out" }));
	}

	@Test
	public void testGenerateRejectsInvalidTag() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> gen.executeGenerate(new String[] { "--tag", "../x", "--output-dir", dir.toString() }));
		assertTrue(e.getMessage().startsWith("Invalid release tag"));
	}

	@Test
	public void testGenerateUsage() {
		assertThrows(IllegalArgumentException.class, () -> gen.executeGenerate(new String[] { "--bogus" }));
		assertThrows(IllegalArgumentException.class, () -> gen.executeGenerate(new String[] { "--tag" }));
		assertThrows(IllegalArgumentException.class, () -> gen.executeGenerate(new String[] { "extra" }));
	}
}
