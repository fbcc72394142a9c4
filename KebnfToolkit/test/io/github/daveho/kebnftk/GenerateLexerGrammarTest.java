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

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

public class GenerateLexerGrammarTest {
	private static String generate(TokenVocabulary vocab) {
		StringWriter text = new StringWriter();
		new GenerateLexerGrammar(vocab, "Test", "TestLexer").generateLexerGrammar(new PrintWriter(text));
		return text.toString();
	}

	@Test
	public void testHeaderAndFixedTokens() {
		String lexer = generate(new TokenVocabulary(Collections.<String>emptyList(), Collections.<String>emptyList()));
		assertTrue(lexer.startsWith("/*\n * Test ANTLR4 Lexer Grammar\n"));
		assertTrue(lexer.contains("\nlexer grammar TestLexer;\n"));
		assertTrue(lexer.contains("\nIDENTIFIER : [a-zA-Z_] [a-zA-Z0-9_]* ;\n"));
		assertTrue(lexer.contains("\nSTRING : '\\'' ( '\\\\' . | ~['\\\\] )* '\\'' ;\n"));
		assertTrue(lexer.contains("\nDOUBLE_STRING : '\"' ( '\\\\' . | ~[\"\\\\] )* '\"' ;\n"));
		assertTrue(lexer.contains("\nSINGLE_LINE_NOTE : '//' ~[\\r\\n]* -> skip ;\n"));
		assertTrue(lexer.endsWith("\nWS : [ \\t\\r\\n]+ -> skip ;\n"));
	}

	@Test
	public void testKeywordsAreSorted() {
		String lexer = generate(new TokenVocabulary(Arrays.asList("qux", "bar"), Collections.<String>emptyList()));
		int bar = lexer.indexOf("\nBAR : 'bar' ;\n");
		int qux = lexer.indexOf("\nQUX : 'qux' ;\n");
		assertTrue(bar >= 0);
		assertTrue(qux > bar);
	}

	@Test
	public void testLongerOperatorsFirst() {
		String lexer = generate(new TokenVocabulary(Collections.<String>emptyList(), Collections.<String>emptyList()));
		int longest = lexer.indexOf("\nCOLON_GT_GT : ':>>' ;\n");
		int shorter = lexer.indexOf("\nCOLON_GT : ':>' ;\n");
		int shortest = lexer.indexOf("\nCOLON : ':' ;\n");
		assertTrue(longest >= 0);
		assertTrue(shorter > longest);
		assertTrue(shortest > shorter);
	}

	@Test
	public void testKeywordsBeforeOperators() {
		String lexer = generate(new TokenVocabulary(Arrays.asList("zzz"), Collections.<String>emptyList()));
		assertTrue(lexer.indexOf("\nZZZ : 'zzz' ;\n") < lexer.indexOf("// Operators and punctuation"));
	}

	@Test
	public void testLiteralsAreEscaped() {
		String lexer = generate(new TokenVocabulary(Collections.<String>emptyList(), Arrays.asList("'", "\\")));
		assertTrue(lexer.contains("\nQUOTE : '\\'' ;\n"));
		assertTrue(lexer.contains("\nBACKSLASH : '\\\\' ;\n"));
	}
}
