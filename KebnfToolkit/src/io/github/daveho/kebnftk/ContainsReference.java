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

import java.util.List;

/**
 * Check whether an element refers to a given rule, at any depth.
 */
public class ContainsReference implements RuleElementVisitor<Boolean> {
	private String ruleName;

	/**
	 * Constructor.
	 * 
	 * @param ruleName name of the referenced rule to look for
	 */
	public ContainsReference(String ruleName) {
		this.ruleName = ruleName;
	}

	/**
	 * @param sequence a sequence of elements
	 * @return true if any element of the sequence refers to the rule
	 */
	public boolean inSequence(List<RuleElement> sequence) {
		for (RuleElement elem : sequence) {
			if (elem.accept(this))
				return true;
		}
		return false;
	}

	@Override
	public Boolean visitTerminal(Terminal terminal) {
		return false;
	}

	@Override
	public Boolean visitNonTerminal(NonTerminal nonTerminal) {
		return nonTerminal.getName().equals(ruleName);
	}

	@Override
	public Boolean visitQualifiedNameRef(QualifiedNameRef ref) {
		return false;
	}

	@Override
	public Boolean visitRepetition(Repetition repetition) {
		return repetition.getChild().accept(this);
	}

	@Override
	public Boolean visitGroup(Group group) {
		for (List<RuleElement> alt : group.getAlternatives()) {
			if (inSequence(alt))
				return true;
		}
		return false;
	}
}
