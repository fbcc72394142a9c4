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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GeneratorConfigTest {
	private static final String MINIMAL = """
			{
			  "release_tag": "2024-09",
			  "release_repo": "owner/repo",
			  "bnf_files": { "b": "bnf/b.kebnf", "a": "bnf/a.kebnf" },
			  "output": { "lexer_grammar": "out/FooLexer.g4", "parser_grammar": "out/Foo.g4" },
			  "grammar_name": "Foo",
			  "lexer_name": "FooLexer"
			}
			""";

	@Test
	public void testLoad() {
		GeneratorConfig config = GeneratorConfig.load(new StringReader(MINIMAL));
		assertEquals("2024-09", config.releaseTag);
		assertEquals("owner/repo", config.releaseRepo);
		assertEquals(Arrays.asList("b", "a"), Arrays.asList(config.bnfFiles.keySet().toArray()));
		assertEquals("out/FooLexer.g4", config.output.lexerGrammar);
		assertEquals("out/Foo.g4", config.output.parserGrammar);
		assertEquals("Foo", config.grammarTitle);
		assertNull(config.grammarVersion);
		assertTrue(config.cycles.isEmpty());
	}

	@Test
	public void testLoadDefault() throws IOException {
		GeneratorConfig config = GeneratorConfig.loadDefault();
		assertEquals("SysMLv2", config.grammarName);
		assertEquals("SysMLv2Lexer", config.lexerName);
		assertEquals("SysML v2.0", config.grammarTitle);
		assertEquals(Arrays.asList("kerml", "sysml"), Arrays.asList(config.bnfFiles.keySet().toArray()));
		assertEquals(Arrays.asList(Arrays.asList("FilterPackage", "ImportDeclaration", "NamespaceImport")),
				config.cycles);
		assertTrue(ReleaseTags.isValid(config.releaseTag));
	}

	@Test
	public void testLoadFile(@TempDir Path dir) throws IOException {
		Path file = dir.resolve("config.json");
		Files.write(file, MINIMAL.getBytes(StandardCharsets.UTF_8));
		assertEquals("Foo", GeneratorConfig.loadFile(file).grammarName);
	}

	@Test
	public void testMissingField() {
		String json = MINIMAL.replace("\"lexer_name\": \"FooLexer\"", "\"grammar_version\": \"1\"");
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> GeneratorConfig.load(new StringReader(json)));
		assertEquals("Missing configuration field: lexer_name", e.getMessage());
	}

	@Test
	public void testMalformed() {
		assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.load(new StringReader("{ \"release_tag\": ")));
		assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.load(new StringReader("")));
	}

	@Test
	public void testShortCycle() {
		String json = MINIMAL.replace("\"grammar_name\"", "\"cycles\": [[\"Foo\"]], \"grammar_name\"");
		assertThrows(IllegalArgumentException.class, () -> GeneratorConfig.load(new StringReader(json)));
	}

	@Test
	public void testFileName() {
		assertEquals("Foo.g4", GeneratorConfig.fileName("grammar/Foo.g4"));
		assertEquals("Foo.g4", GeneratorConfig.fileName("Foo.g4"));
	}
}
