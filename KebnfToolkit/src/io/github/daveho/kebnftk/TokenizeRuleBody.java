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

import java.util.ArrayList;
import java.util.List;

/**
 * Split the text of a KEBNF rule body (or of one alternative of it)
 * into tokens.
 */
public class TokenizeRuleBody {
	/*
	Tokens:

	'...'          quoted terminal; backslash escapes are kept as written,
	               so 'it\'s' is one token
	[Name]         cross-reference
	~[Name]        conjugated cross-reference
	( ) { } ? + * | single characters
	+= ?=          assignment operators (recognized before =)
	=              assignment operator
	ident          letter or _, followed by letters, digits, _ and .

	Whitespace separates tokens. Any other character is skipped:
	the notation contains incidental punctuation (e.g., a trailing ';')
	that carries no grammar content.
	 */

	private static final String SINGLE_CHAR_TOKENS = "(){}?+*|";

	private final String text;
	private int pos;
	private int skippedCharCount;

	/**
	 * Constructor.
	 * 
	 * @param text the text to tokenize
	 */
	public TokenizeRuleBody(String text) {
		this.text = text.strip();
		this.pos = 0;
		this.skippedCharCount = 0;
	}

	/**
	 * Tokenize the text passed to the constructor.
	 * 
	 * @return list of tokens
	 */
	public List<String> tokenize() {
		List<String> tokens = new ArrayList<String>();

		while (pos < text.length()) {
			char c = text.charAt(pos);

			if (c == ' ' || c == '\t' || c == '\n') {
				++pos;
			} else if (c == '\'') {
				tokens.add(scanQuoted());
			} else if (c == '[' || (c == '~' && peekAt(pos + 1) == '[')) {
				int end = text.indexOf(']', pos);
				if (end < 0) {
					// no closing bracket: drop the opening character(s)
					skip(c == '~' ? 2 : 1);
				} else {
					tokens.add(text.substring(pos, end + 1));
					pos = end + 1;
				}
			} else if (SINGLE_CHAR_TOKENS.indexOf(c) >= 0) {
				if ((c == '+' || c == '?') && peekAt(pos + 1) == '=') {
					tokens.add(text.substring(pos, pos + 2));
					pos += 2;
				} else {
					tokens.add(String.valueOf(c));
					++pos;
				}
			} else if (c == '=') {
				tokens.add("=");
				++pos;
			} else if (Character.isLetter(c) || c == '_') {
				int start = pos;
				while (pos < text.length() && isIdentifierChar(text.charAt(pos)))
					++pos;
				tokens.add(text.substring(start, pos));
			} else {
				skip(1);
			}
		}

		return tokens;
	}

	/**
	 * @return number of characters which were skipped because they
	 *         did not start any recognized token
	 */
	public int getSkippedCharCount() {
		return skippedCharCount;
	}

	private String scanQuoted() {
		int start = pos;
		int j = pos + 1;
		while (j < text.length()) {
			char c = text.charAt(j);
			if (c == '\\') {
				j += 2;
				continue;
			}
			++j;
			if (c == '\'')
				break;
		}
		pos = Math.min(j, text.length());
		return text.substring(start, pos);
	}

	private int peekAt(int index) {
		return index < text.length() ? text.charAt(index) : -1;
	}

	private void skip(int count) {
		pos += count;
		skippedCharCount += count;
	}

	private static boolean isIdentifierChar(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '.';
	}
}
