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

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

public class SlogTest {
	@Test
	public void testMessages() {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		Slog root = new Slog("kebnftk", new PrintStream(buf, true, StandardCharsets.UTF_8));
		Slog child = root.child("parse");
		root.log("Release tag: %s", "2025-12");
		child.warn("Skipped %d fragments", 3);
		child.err(new IOException("boom"), "Download of %s failed", "kerml");

		String text = buf.toString(StandardCharsets.UTF_8);
		assertTrue(text.contains("[kebnftk] Release tag: 2025-12"));
		assertTrue(text.contains("[kebnftk / parse] WARNING: Skipped 3 fragments"));
		assertTrue(text.contains("[kebnftk / parse] ERROR: Download of kerml failed"));
		assertTrue(text.contains("java.io.IOException: boom"));
	}

	@Test
	public void testStopwatch() {
		Slog log = new Slog("test", new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
		assertThrows(IllegalStateException.class, () -> log.elapsed());
		assertTrue(log.start().elapsed() >= 0.0);
	}
}
