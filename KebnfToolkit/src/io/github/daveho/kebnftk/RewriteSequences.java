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
 * Base class for structural rewrites of rule alternatives.
 * Every sequence (a rule alternative, or an alternative of a nested group)
 * is rebuilt bottom-up: its elements are visited first, and
 * then the rebuilt sequence is passed to {@link #rewriteSequence(List)}.
 * Elements are immutable, so a rewrite always produces new
 * elements and leaves the originals untouched.
 */
public abstract class RewriteSequences implements RuleElementVisitor<RuleElement> {
	/**
	 * Rewrite all alternatives of a rule.
	 * 
	 * @param rule the rule to rewrite
	 * @return true if the rule was changed
	 */
	public boolean apply(GrammarRule rule) {
		List<List<RuleElement>> result = new ArrayList<List<RuleElement>>();
		for (List<RuleElement> alt : rule.getAlternatives())
			result.add(rewrite(alt));
		if (result.equals(rule.getAlternatives()))
			return false;
		rule.setAlternatives(result);
		return true;
	}

	/**
	 * Rewrite every rule in a table.
	 * 
	 * @param table the rule table
	 * @return true if any rule was changed
	 */
	public boolean applyAll(RuleTable table) {
		boolean changed = false;
		for (GrammarRule rule : table.getRules()) {
			if (apply(rule))
				changed = true;
		}
		return changed;
	}

	/**
	 * Rewrite one sequence.
	 * 
	 * @param sequence the sequence
	 * @return the rewritten sequence
	 */
	public List<RuleElement> rewrite(List<RuleElement> sequence) {
		List<RuleElement> visited = new ArrayList<RuleElement>();
		for (RuleElement elem : sequence)
			visited.add(elem.accept(this));
		return rewriteSequence(visited);
	}

	/**
	 * Rewrite a sequence whose elements have already been rewritten.
	 * The default implementation returns the sequence unchanged.
	 * 
	 * @param sequence the sequence
	 * @return the rewritten sequence
	 */
	protected List<RuleElement> rewriteSequence(List<RuleElement> sequence) {
		return sequence;
	}

	@Override
	public RuleElement visitTerminal(Terminal terminal) {
		return terminal;
	}

	@Override
	public RuleElement visitNonTerminal(NonTerminal nonTerminal) {
		return nonTerminal;
	}

	@Override
	public RuleElement visitQualifiedNameRef(QualifiedNameRef ref) {
		return ref;
	}

	@Override
	public RuleElement visitRepetition(Repetition repetition) {
		return new Repetition(repetition.getChild().accept(this), repetition.getModifier());
	}

	@Override
	public RuleElement visitGroup(Group group) {
		List<List<RuleElement>> alts = new ArrayList<List<RuleElement>>();
		for (List<RuleElement> alt : group.getAlternatives())
			alts.add(rewrite(alt));
		return new Group(alts);
	}
}
