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
import java.util.Collections;
import java.util.List;

/**
 * A parenthesized alternation. Each alternative is a sequence
 * of elements; the order of the alternatives is the order in which
 * they appeared in the source.
 */
public class Group extends RuleElement {
	private final List<List<RuleElement>> alternatives;

	/**
	 * Constructor.
	 * 
	 * @param alternatives the alternatives (each one a sequence of elements)
	 */
	public Group(List<List<RuleElement>> alternatives) {
		List<List<RuleElement>> copy = new ArrayList<List<RuleElement>>();
		for (List<RuleElement> alt : alternatives)
			copy.add(Collections.unmodifiableList(new ArrayList<RuleElement>(alt)));
		this.alternatives = Collections.unmodifiableList(copy);
	}

	/**
	 * Convenience method to create a group with a single alternative.
	 * 
	 * @param sequence the elements of the single alternative
	 * @return the group
	 */
	public static Group of(RuleElement... sequence) {
		List<List<RuleElement>> alts = new ArrayList<List<RuleElement>>();
		List<RuleElement> seq = new ArrayList<RuleElement>();
		Collections.addAll(seq, sequence);
		alts.add(seq);
		return new Group(alts);
	}

	/**
	 * @return the alternatives (unmodifiable)
	 */
	public List<List<RuleElement>> getAlternatives() {
		return alternatives;
	}

	@Override
	public <R> R accept(RuleElementVisitor<R> visitor) {
		return visitor.visitGroup(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == null || obj.getClass() != this.getClass())
			return false;
		return alternatives.equals(((Group) obj).alternatives);
	}

	@Override
	public int hashCode() {
		return alternatives.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder();
		buf.append("(");
		boolean first = true;
		for (List<RuleElement> alt : alternatives) {
			if (!first)
				buf.append(" |");
			first = false;
			for (RuleElement elem : alt) {
				buf.append(" ");
				buf.append(elem);
			}
		}
		buf.append(" )");
		return buf.toString();
	}
}
