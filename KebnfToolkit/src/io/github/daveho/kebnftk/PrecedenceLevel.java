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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One level of the binary operator precedence table used to generate
 * the left-recursive <code>ownedExpression</code> rule.
 * Levels are listed from loosest to tightest binding.
 */
public class PrecedenceLevel {
	/**
	 * Associativity of the operators at a precedence level.
	 */
	public enum Associativity {
		/** Not a binary operator level (the conditional expression). */
		NONE,
		LEFT,
		RIGHT,
	}

	private final String name;
	private final Associativity associativity;
	private final List<String> operators;

	/**
	 * Constructor.
	 * 
	 * @param name          descriptive name of the level
	 * @param associativity associativity of the operators
	 * @param operators     operator literals at this level
	 */
	public PrecedenceLevel(String name, Associativity associativity, String... operators) {
		this.name = name;
		this.associativity = associativity;
		this.operators = Collections.unmodifiableList(Arrays.asList(operators));
	}

	public String getName() {
		return name;
	}

	public Associativity getAssociativity() {
		return associativity;
	}

	/**
	 * @return the operator literals (e.g., <code>"=="</code> or <code>"implies"</code>)
	 */
	public List<String> getOperators() {
		return operators;
	}
}
