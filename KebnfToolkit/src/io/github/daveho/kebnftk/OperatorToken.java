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
 * An operator literal and the name of the lexer token which matches it.
 * The natural ordering puts longer literals first, so that in the
 * generated lexer a multi-character operator is defined before any
 * operator which is a prefix of it.
 */
public class OperatorToken implements Comparable<OperatorToken> {
	private final String literal;
	private final String tokenName;

	/**
	 * Constructor.
	 * 
	 * @param literal   the operator text, e.g., <code>::&gt;</code>
	 * @param tokenName the token name, e.g., <code>COLON_COLON_GT</code>
	 */
	public OperatorToken(String literal, String tokenName) {
		this.literal = literal;
		this.tokenName = tokenName;
	}

	public String getLiteral() {
		return literal;
	}

	public String getTokenName() {
		return tokenName;
	}

	@Override
	public int compareTo(OperatorToken o) {
		// Sort descending by length
		int lengthDiff = literal.length() - o.literal.length();
		if (lengthDiff != 0)
			return -lengthDiff;

		// Literal text as tie-breaker
		return literal.compareTo(o.literal);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != this.getClass())
			return false;
		OperatorToken other = (OperatorToken) obj;
		return literal.equals(other.literal) && tokenName.equals(other.tokenName);
	}

	@Override
	public int hashCode() {
		return literal.hashCode() * 31 + tokenName.hashCode();
	}

	@Override
	public String toString() {
		return tokenName + " : '" + literal + "'";
	}
}
