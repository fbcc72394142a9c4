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

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

public class TokenizeRuleBodyTest {
	private static List<String> tokenize(String text) {
		return new TokenizeRuleBody(text).tokenize();
	}

	@Test
	public void testEscapedQuoteIsOneToken() {
		assertEquals(Arrays.asList("'it\\'s'", "Foo"), tokenize("'it\\'s' Foo"));
	}

	@Test
	public void testAssignmentOfGroup() {
		assertEquals(Arrays.asList("kind", "=", "(", "'at'", "|", "'after'", ")"),
				tokenize("kind = ( 'at' | 'after' )"));
	}

	@Test
	public void testTwoCharacterAssignmentOperators() {
		assertEquals(Arrays.asList("members", "+=", "Member", "*"), tokenize("members += Member*"));
		assertEquals(Arrays.asList("isNegated", "?=", "'not'"), tokenize("isNegated ?= 'not'"));
	}

	@Test
	public void testCrossReferences() {
		assertEquals(Arrays.asList("[QualifiedName]", "~[QualifiedName]", "?"),
				tokenize("[QualifiedName] ~[QualifiedName]?"));
	}

	@Test
	public void testIdentifierWithDots() {
		assertEquals(Arrays.asList("{", "this.isAbstract", "=", "true", "}"),
				tokenize("{ this.isAbstract = true }"));
	}

	@Test
	public void testStrayCharactersAreSkipped() {
		TokenizeRuleBody tokenizer = new TokenizeRuleBody("Foo ; Bar");
		assertEquals(Arrays.asList("Foo", "Bar"), tokenizer.tokenize());
		assertEquals(1, tokenizer.getSkippedCharCount());
	}

	@Test
	public void testUnclosedBracketIsSkipped() {
		TokenizeRuleBody tokenizer = new TokenizeRuleBody("[Foo");
		assertEquals(Arrays.asList("Foo"), tokenizer.tokenize());
		assertEquals(1, tokenizer.getSkippedCharCount());
	}

	@Test
	public void testUnterminatedQuote() {
		assertEquals(Arrays.asList("'abc"), tokenize("'abc"));
	}
}
