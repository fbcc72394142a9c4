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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The table of all rules of one conversion run.
 * Rules are unique by name, and the order in which names were first
 * added is recorded so that output can follow declaration order.
 * Rules are never removed.
 */
public class RuleTable {
	private Map<String, GrammarRule> rules;
	private List<String> ruleOrder;

	public RuleTable() {
		this.rules = new HashMap<String, GrammarRule>();
		this.ruleOrder = new ArrayList<String>();
	}

	/**
	 * Add a parsed rule. If a rule with the same name is already
	 * present, the new rule's alternatives are appended to the
	 * existing rule's alternatives.
	 * 
	 * @param rule the rule to add
	 */
	public void add(GrammarRule rule) {
		GrammarRule existing = rules.get(rule.getName());
		if (existing != null) {
			existing.getAlternatives().addAll(rule.getAlternatives());
			return;
		}
		rules.put(rule.getName(), rule);
		ruleOrder.add(rule.getName());
	}

	/**
	 * Add a rule synthesized by rewriting. Such rules are
	 * ordered after every rule already in the table.
	 * 
	 * @param rule the rule to add
	 * @throws IllegalStateException if a rule with the same name already exists
	 */
	public void addGenerated(GrammarRule rule) {
		if (rules.containsKey(rule.getName()))
			throw new IllegalStateException("Rule " + rule.getName() + " is already defined");
		rules.put(rule.getName(), rule);
		ruleOrder.add(rule.getName());
	}

	/**
	 * @param name a rule name
	 * @return the rule with that name, or null if there is none
	 */
	public GrammarRule get(String name) {
		return rules.get(name);
	}

	public boolean contains(String name) {
		return rules.containsKey(name);
	}

	/**
	 * @return rule names in the order they were first added
	 */
	public List<String> getRuleOrder() {
		return Collections.unmodifiableList(ruleOrder);
	}

	/**
	 * @return all rules, in the order they were first added
	 */
	public List<GrammarRule> getRules() {
		List<GrammarRule> result = new ArrayList<GrammarRule>();
		for (String name : ruleOrder)
			result.add(rules.get(name));
		return result;
	}

	public int size() {
		return ruleOrder.size();
	}

	/**
	 * @return the number of lexical rules
	 */
	public int countLexicalRules() {
		int count = 0;
		for (GrammarRule rule : rules.values()) {
			if (rule.isLexical())
				++count;
		}
		return count;
	}
}
