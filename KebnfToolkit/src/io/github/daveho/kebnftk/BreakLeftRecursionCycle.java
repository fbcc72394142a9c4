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
 * Break a cycle of mutually left-recursive rules by adding
 * non-recursive copies of the rules along the cycle.
 * 
 * <p>For a cycle <code>[A, B, ..., Z]</code>, where each rule refers to
 * the next one and <code>Z</code> refers back to <code>A</code>, the
 * "safe" subset of each rule is computed walking backwards from <code>Z</code>:
 * the safe subset of <code>Z</code> is its alternatives which don't refer to
 * <code>A</code>, and the safe subset of any other rule is its alternatives
 * with references to the next rule redirected to that rule's safe copy.
 * Alternatives referring to a rule whose safe subset is empty are dropped.
 * The safe copy of <code>B</code> is named <code>AB</code>, the others
 * <code>XDirect</code>. Finally, <code>A</code>'s references to
 * <code>B</code> are redirected to <code>AB</code>.</p>
 */
public class BreakLeftRecursionCycle {
	private List<String> cycle;

	/**
	 * Constructor.
	 * 
	 * @param cycle the rule names of the cycle, starting with the head rule
	 * @throws IllegalArgumentException if the cycle has fewer than two rules
	 */
	public BreakLeftRecursionCycle(List<String> cycle) {
		if (cycle.size() < 2)
			throw new IllegalArgumentException("A cycle needs at least two rules: " + cycle);
		this.cycle = Collections.unmodifiableList(new ArrayList<String>(cycle));
	}

	public List<String> getCycle() {
		return cycle;
	}

	/**
	 * Get the name of the non-recursive copy of the rule at
	 * the given position in the cycle.
	 * 
	 * @param index position in the cycle (at least 1)
	 * @return the name of the safe copy
	 */
	public String getSafeName(int index) {
		if (index == 1)
			return cycle.get(0) + cycle.get(1);
		return cycle.get(index) + "Direct";
	}

	/**
	 * Break the cycle.
	 * Nothing is changed if a rule of the cycle is missing, if any of the
	 * safe copy names is already taken (e.g., because the cycle has already
	 * been broken), or if no non-recursive path exists.
	 * 
	 * @param table the rule table
	 * @return true if the table was changed
	 */
	public boolean apply(RuleTable table) {
		for (String name : cycle) {
			if (!table.contains(name))
				return false;
		}
		for (int k = 1; k < cycle.size(); k++) {
			if (table.contains(getSafeName(k)))
				return false;
		}

		int n = cycle.size();
		List<List<List<RuleElement>>> safe = new ArrayList<List<List<RuleElement>>>();
		for (int i = 0; i < n; i++)
			safe.add(null);

		ContainsReference refersToHead = new ContainsReference(cycle.get(0));
		List<List<RuleElement>> last = new ArrayList<List<RuleElement>>();
		for (List<RuleElement> alt : table.get(cycle.get(n - 1)).getAlternatives()) {
			if (!refersToHead.inSequence(alt))
				last.add(alt);
		}
		safe.set(n - 1, last);

		for (int k = n - 2; k >= 1; k--) {
			String next = cycle.get(k + 1);
			boolean nextIsSafe = !safe.get(k + 1).isEmpty();
			ContainsReference refersToNext = new ContainsReference(next);
			RenameReferences redirect = new RenameReferences(next, getSafeName(k + 1));
			List<List<RuleElement>> alts = new ArrayList<List<RuleElement>>();
			for (List<RuleElement> alt : table.get(cycle.get(k)).getAlternatives()) {
				if (!refersToNext.inSequence(alt))
					alts.add(alt);
				else if (nextIsSafe)
					alts.add(redirect.rewrite(alt));
			}
			safe.set(k, alts);
		}

		if (safe.get(1).isEmpty())
			return false;

		for (int k = 1; k < n; k++) {
			if (!safe.get(k).isEmpty())
				table.addGenerated(new GrammarRule(getSafeName(k), null, safe.get(k), GrammarRule.GENERATED));
		}
		new RenameReferences(cycle.get(1), getSafeName(1)).apply(table.get(cycle.get(0)));
		return true;
	}
}
