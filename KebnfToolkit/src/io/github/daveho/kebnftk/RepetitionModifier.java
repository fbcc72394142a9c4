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

/**
 * Repetition suffixes which may follow an element.
 */
public enum RepetitionModifier {
	/** <code>?</code>: zero or one */
	OPTIONAL('?'),
	/** <code>+</code>: one or more */
	ONE_OR_MORE('+'),
	/** <code>*</code>: zero or more */
	ZERO_OR_MORE('*');

	private final char symbol;

	private RepetitionModifier(char symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return the suffix character
	 */
	public char getSymbol() {
		return symbol;
	}

	/**
	 * Find the modifier written as the given token.
	 * 
	 * @param token a token
	 * @return the modifier, or null if the token is not a repetition suffix
	 */
	public static RepetitionModifier fromToken(String token) {
		if (token.length() != 1)
			return null;
		for (RepetitionModifier modifier : values()) {
			if (modifier.symbol == token.charAt(0))
				return modifier;
		}
		return null;
	}
}
