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
 * An element followed by a repetition suffix (<code>?</code>, <code>+</code>, or <code>*</code>).
 */
public class Repetition extends RuleElement {
	private final RuleElement child;
	private final RepetitionModifier modifier;

	/**
	 * Constructor.
	 * 
	 * @param child    the repeated element
	 * @param modifier the repetition suffix
	 */
	public Repetition(RuleElement child, RepetitionModifier modifier) {
		if (child == null || modifier == null)
			throw new IllegalArgumentException("Repetition requires a child and a modifier");
		this.child = child;
		this.modifier = modifier;
	}

	public RuleElement getChild() {
		return child;
	}

	public RepetitionModifier getModifier() {
		return modifier;
	}

	@Override
	public <R> R accept(RuleElementVisitor<R> visitor) {
		return visitor.visitRepetition(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != this.getClass())
			return false;
		Repetition other = (Repetition) obj;
		return child.equals(other.child) && modifier == other.modifier;
	}

	@Override
	public int hashCode() {
		return child.hashCode() * 31 + modifier.hashCode();
	}

	@Override
	public String toString() {
		return child.toString() + modifier.getSymbol();
	}
}
