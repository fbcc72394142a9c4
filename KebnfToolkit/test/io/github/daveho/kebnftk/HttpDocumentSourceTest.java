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

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class HttpDocumentSourceTest {
	private static HttpDocumentSource source() {
		return new HttpDocumentSource("Systems-Modeling/SysML-v2-Release",
				new Slog("test", new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8)));
	}

	@Test
	public void testGetUrl() {
		assertEquals("https://raw.githubusercontent.com/Systems-Modeling/SysML-v2-Release/2025-12/bnf/KerML-textual-bnf.kebnf",
				source().getUrl("bnf/KerML-textual-bnf.kebnf", "2025-12"));
	}

	@Test
	public void testInvalidTagIsRejectedBeforeDownload() {
		assertThrows(IllegalArgumentException.class, () -> source().fetch("kerml", "bnf/k.kebnf", "main/../x"));
	}
}
