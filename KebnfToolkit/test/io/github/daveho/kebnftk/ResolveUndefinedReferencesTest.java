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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ResolveUndefinedReferencesTest {
	private ResolveUndefinedReferences resolver;

	@BeforeEach
	public void setUp() {
		resolver = new ResolveUndefinedReferences(
				new TokenVocabulary(Arrays.asList("part"), Collections.<String>emptyList()));
	}

	@Test
	public void testUndefinedReferences() {
		resolver.addRule("alpha", "beta gamma? PART\n    | <assoc=right> alpha");
		resolver.addRule("beta", "'delta' /* epsilon */ IDENTIFIER");
		resolver.addDefined(Arrays.asList("name"));
		resolver.scan("name omega");
		assertEquals(Arrays.asList("gamma", "omega"), Arrays.asList(resolver.getUndefined().toArray()));
	}

	@Test
	public void testKeywordsAreNotReferences() {
		resolver.addRule("alpha", "part");
		assertTrue(resolver.getUndefined().isEmpty());
	}

	@Test
	public void testGenerateStubRules() {
		resolver.addRule("alpha", "emptyUsage missing");
		StringWriter text = new StringWriter();
		assertEquals(2, resolver.generateStubRules(new PrintWriter(text)));
		String stubs = text.toString();
		assertTrue(stubs.startsWith("\n// ===== Stub rules for undefined references =====\n"));
		assertTrue(stubs.contains("\nemptyUsage\n    : /* epsilon */\n    ;\n"));
		assertTrue(stubs.contains("\nmissing\n    : IDENTIFIER  /* TODO: stub for missing */\n    ;\n"));
		assertTrue(stubs.indexOf("emptyUsage") < stubs.indexOf("missing"));
	}

	@Test
	public void testNoStubRules() {
		resolver.addRule("alpha", "PART");
		StringWriter text = new StringWriter();
		assertEquals(0, resolver.generateStubRules(new PrintWriter(text)));
		assertEquals("", text.toString());
	}
}
