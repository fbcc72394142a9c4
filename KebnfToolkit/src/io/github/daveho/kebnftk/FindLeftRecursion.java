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

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Find cycles of mutually left-recursive rules.
 * ANTLR only handles direct left recursion, so any such cycle
 * remaining after rewriting makes the generated grammar unusable.
 */
public class FindLeftRecursion {
	private RuleTable table;
	private Set<String> ignoredRules;
	private Set<String> nullableRules;

	/**
	 * Constructor.
	 * 
	 * @param table        the rule table
	 * @param ignoredRules names of rules which are not rendered (and so cannot
	 *                     take part in a cycle)
	 */
	public FindLeftRecursion(RuleTable table, Set<String> ignoredRules) {
		this.table = table;
		this.ignoredRules = ignoredRules;
		this.nullableRules = new HashSet<String>();
	}

	/**
	 * Build the left-corner graph: an edge from A to B means that
	 * A can begin with B without consuming any input first.
	 * 
	 * @return the left-corner graph
	 */
	public Map<String, Set<String>> buildLeftCornerGraph() {
		computeNullableRules();
		Map<String, Set<String>> graph = new LinkedHashMap<String, Set<String>>();
		for (GrammarRule rule : table.getRules()) {
			if (!isCandidate(rule.getName()))
				continue;
			Set<String> corners = new HashSet<String>();
			for (List<RuleElement> alt : rule.getAlternatives())
				new LeftCorners(corners).sequence(alt);
			graph.put(rule.getName(), corners);
		}
		return graph;
	}

	/**
	 * Find the left recursion cycles.
	 * 
	 * @return the cycles (each one a path starting and ending with the same rule)
	 */
	public List<List<String>> findCycles() {
		return new FindCycles(buildLeftCornerGraph()).findCycles();
	}

	private boolean isCandidate(String name) {
		GrammarRule rule = table.get(name);
		return rule != null && !rule.isLexical() && !ignoredRules.contains(name);
	}

	private void computeNullableRules() {
		nullableRules.clear();
		NullableCheck check = new NullableCheck();
		boolean changed = true;
		while (changed) {
			changed = false;
			for (GrammarRule rule : table.getRules()) {
				if (nullableRules.contains(rule.getName()))
					continue;
				for (List<RuleElement> alt : rule.getAlternatives()) {
					if (check.sequence(alt)) {
						nullableRules.add(rule.getName());
						changed = true;
						break;
					}
				}
			}
		}
	}

	private class NullableCheck implements RuleElementVisitor<Boolean> {
		boolean sequence(List<RuleElement> seq) {
			for (RuleElement elem : seq) {
				if (!elem.accept(this))
					return false;
			}
			return true;
		}

		@Override
		public Boolean visitTerminal(Terminal terminal) {
			return false;
		}

		@Override
		public Boolean visitNonTerminal(NonTerminal nonTerminal) {
			return nullableRules.contains(nonTerminal.getName());
		}

		@Override
		public Boolean visitQualifiedNameRef(QualifiedNameRef ref) {
			return false;
		}

		@Override
		public Boolean visitRepetition(Repetition repetition) {
			if (repetition.getModifier() != RepetitionModifier.ONE_OR_MORE)
				return true;
			return repetition.getChild().accept(this);
		}

		@Override
		public Boolean visitGroup(Group group) {
			for (List<RuleElement> alt : group.getAlternatives()) {
				if (sequence(alt))
					return true;
			}
			return false;
		}
	}

	// Adds the left corners of the visited elements; returns whether the element is nullable
	private class LeftCorners implements RuleElementVisitor<Boolean> {
		private Set<String> corners;
		private NullableCheck nullable = new NullableCheck();

		LeftCorners(Set<String> corners) {
			this.corners = corners;
		}

		boolean sequence(List<RuleElement> seq) {
			for (RuleElement elem : seq) {
				if (!elem.accept(this))
					return false;
			}
			return true;
		}

		@Override
		public Boolean visitTerminal(Terminal terminal) {
			return false;
		}

		@Override
		public Boolean visitNonTerminal(NonTerminal nonTerminal) {
			if (isCandidate(nonTerminal.getName()))
				corners.add(nonTerminal.getName());
			return nullable.visitNonTerminal(nonTerminal);
		}

		@Override
		public Boolean visitQualifiedNameRef(QualifiedNameRef ref) {
			return false;
		}

		@Override
		public Boolean visitRepetition(Repetition repetition) {
			boolean childNullable = repetition.getChild().accept(this);
			return repetition.getModifier() != RepetitionModifier.ONE_OR_MORE || childNullable;
		}

		@Override
		public Boolean visitGroup(Group group) {
			boolean result = false;
			for (List<RuleElement> alt : group.getAlternatives()) {
				if (sequence(alt))
					result = true;
			}
			return result;
		}
	}
}
