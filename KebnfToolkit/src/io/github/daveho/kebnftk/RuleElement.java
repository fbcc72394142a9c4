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
 * An element of a KEBNF rule alternative.
 * The set of element kinds is closed: {@link Terminal}, {@link NonTerminal},
 * {@link QualifiedNameRef}, {@link Repetition}, and {@link Group}.
 * Code that examines elements should do so by implementing
 * {@link RuleElementVisitor}, so that every kind of element
 * is handled explicitly.
 */
public abstract class RuleElement {
	// Only classes in this package may define element kinds.
	RuleElement() {
	}

	/**
	 * Dispatch to the visitor method for this kind of element.
	 * 
	 * @param visitor the visitor
	 * @return the value returned by the visitor method
	 */
	public abstract <R> R accept(RuleElementVisitor<R> visitor);
}
