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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The patches applied to every generated grammar, and the
 * building blocks they are made of.
 * Rules are identified by their ANTLR parser rule names, and rule
 * elements are matched by the text they render as.
 */
public class GrammarPatches {
	/**
	 * Rendered form of {@link #featureChain()}.
	 */
	public static final String FEATURE_CHAIN_TEXT = "qualifiedName ( DOT qualifiedName )*";

	/**
	 * Get the default patches, in the order in which they must be applied.
	 * 
	 * @return list of patches
	 */
	public static List<GrammarPatch> defaultPatches() {
		List<GrammarPatch> patches = new ArrayList<GrammarPatch>();

		// Double THEN: targetSuccession itself starts with THEN
		patches.add(new ReplaceReferenceAfterTerminal("entryTransitionMember",
				"then", "TargetSuccession", "TransitionSuccessionMember"));

		// ?= assignments are optional; satisfy may also appear without assert
		patches.add(new OptionalAssertBeforeSatisfy());

		patches.add(new MakeLeadingElementOptional(null, "( STANDARD )", "LIBRARY"));
		patches.add(new MakeLeadingElementOptional("importRule", "visibilityIndicator", "IMPORT"));

		// allocation definitions are missing from definitionElement
		patches.add(new InsertAlternativeAfter(null, "metadataDefinition", "extendedDefinition",
				"AllocationDefinition"));

		patches.add(new ReplaceOptionalBeforeTerminal("sendNode", "actionUsageDeclaration?", "SEND",
				"ActionNodeUsageDeclaration", "ActionUsageDeclaration"));

		// return is allowed in case bodies as in calculation bodies
		patches.add(new InsertAlternativeAfter("caseBodyItem", "actionBodyItem", "subjectMember",
				"ReturnParameterMember"));

		patches.add(new DefineMissingRule("CalculationUsageDeclaration",
				Arrays.<RuleElement>asList(new NonTerminal("UsageDeclaration"),
						new Repetition(new NonTerminal("ValuePart"), RepetitionModifier.OPTIONAL))));

		patches.add(new UnifyFeatureChain(
				Arrays.asList("generalType", "specificType", "unioning", "intersecting", "differencing",
						"ownedFeatureInverting"),
				Arrays.asList("qualifiedName", "ownedFeatureChain")));
		patches.add(new UnifyFeatureChain(
				Arrays.asList("ownedSubsetting", "ownedReferenceSubsetting", "ownedCrossSubsetting",
						"ownedRedefinition", "ownedFeatureTyping"),
				Arrays.asList("generalType", "qualifiedName", "ownedFeatureChain")));
		patches.add(new UnifyFeatureChain(
				Arrays.asList("ownedConjugation", "ownedDisjoining"),
				Arrays.asList("qualifiedName", "featureChain")));
		patches.add(new UnifyFeatureChain(
				Arrays.asList("featureChainMember"),
				Arrays.asList("featureReferenceMember", "ownedFeatureChainMember", "qualifiedName")));
		patches.add(new UnifyFeatureChain(
				Arrays.asList("instantiatedTypeMember"),
				Arrays.asList("instantiatedTypeReference", "ownedFeatureChainMember")));

		patches.add(new InlineFeatureChainGroups(Arrays.asList(
				"( qualifiedName | featureChain )",
				"( qualifiedName | ownedFeatureChain )",
				"( ownedFeatureChaining | featureChain )")));

		// the explicit DOT is unreachable once ownedReferenceSubsetting accepts chains
		patches.add(new UnifyFeatureChain(
				Arrays.asList("flowEnd"),
				Arrays.asList("( ownedReferenceSubsetting DOT )? flowFeatureMember",
						"( flowEndSubsetting )? flowFeatureMember")));

		return patches;
	}

	/**
	 * Create the elements of a (possibly dotted) chain of qualified names.
	 * 
	 * @return the elements
	 */
	public static List<RuleElement> featureChain() {
		List<RuleElement> result = new ArrayList<RuleElement>();
		result.add(new QualifiedNameRef(false));
		result.add(new Repetition(Group.of(new Terminal("."), new QualifiedNameRef(false)),
				RepetitionModifier.ZERO_OR_MORE));
		return result;
	}

	/**
	 * Find the rules with a given parser rule name.
	 * 
	 * @param table    the rule table
	 * @param ruleName the parser rule name, or null for all rules
	 * @return the matching rules
	 */
	static List<GrammarRule> findRules(RuleTable table, String ruleName) {
		List<GrammarRule> result = new ArrayList<GrammarRule>();
		for (GrammarRule rule : table.getRules()) {
			if (rule.isLexical())
				continue;
			if (ruleName == null || RuleRenderer.toParserRuleName(rule.getName()).equals(ruleName))
				result.add(rule);
		}
		return result;
	}

	static String render(RuleRenderer renderer, RuleElement elem) {
		return elem.accept(renderer);
	}

	/**
	 * In a sequence, replace a reference which directly follows
	 * a given terminal.
	 */
	public static class ReplaceReferenceAfterTerminal implements GrammarPatch {
		private String ruleName;
		private String terminal;
		private String from;
		private String to;

		public ReplaceReferenceAfterTerminal(String ruleName, String terminal, String from, String to) {
			this.ruleName = ruleName;
			this.terminal = terminal;
			this.from = from;
			this.to = to;
		}

		@Override
		public String getDescription() {
			return ruleName + ": '" + terminal + "' " + from + " -> '" + terminal + "' " + to;
		}

		@Override
		public boolean apply(RuleTable table, RuleRenderer renderer) {
			RewriteSequences rewrite = new RewriteSequences() {
				@Override
				protected List<RuleElement> rewriteSequence(List<RuleElement> sequence) {
					List<RuleElement> result = new ArrayList<RuleElement>(sequence);
					for (int i = 1; i < result.size(); i++) {
						if (result.get(i - 1).equals(new Terminal(terminal)) && result.get(i).equals(new NonTerminal(from)))
							result.set(i, new NonTerminal(to));
					}
					return result;
				}
			};
			boolean changed = false;
			for (GrammarRule rule : findRules(table, ruleName)) {
				if (rewrite.apply(rule))
					changed = true;
			}
			return changed;
		}
	}

	/**
	 * Rewrite <code>ASSERT ( NOT ) SATISFY</code> (with or without
	 * the NOT group being optional) to <code>( ASSERT ( NOT )? )? SATISFY</code>
	 * throughout the grammar.
	 */
	public static class OptionalAssertBeforeSatisfy implements GrammarPatch {
		@Override
		public String getDescription() {
			return "( ASSERT ( NOT )? )? SATISFY";
		}

		@Override
		public boolean apply(RuleTable table, final RuleRenderer renderer) {
			RewriteSequences rewrite = new RewriteSequences() {
				@Override
				protected List<RuleElement> rewriteSequence(List<RuleElement> sequence) {
					List<RuleElement> result = new ArrayList<RuleElement>();
					int i = 0;
					while (i < sequence.size()) {
						if (i + 2 < sequence.size()
								&& sequence.get(i).equals(new Terminal("assert"))
								&& sequence.get(i + 2).equals(new Terminal("satisfy"))) {
							Group negation = negationGroup(sequence.get(i + 1));
							if (negation != null) {
								Group assertPart = Group.of(sequence.get(i),
										new Repetition(negation, RepetitionModifier.OPTIONAL));
								result.add(new Repetition(assertPart, RepetitionModifier.OPTIONAL));
								result.add(sequence.get(i + 2));
								i += 3;
								continue;
							}
						}
						result.add(sequence.get(i));
						i++;
					}
					return result;
				}

				private Group negationGroup(RuleElement elem) {
					RuleElement group = elem;
					if (elem instanceof Repetition && ((Repetition) elem).getModifier() == RepetitionModifier.OPTIONAL)
						group = ((Repetition) elem).getChild();
					if (!(group instanceof Group))
						return null;
					return render(renderer, group).equals("( NOT )") ? (Group) group : null;
				}
			};
			return rewrite.applyAll(table);
		}
	}

	/**
	 * Make the first element of an alternative optional when it
	 * is followed by a given element.
	 */
	public static class MakeLeadingElementOptional implements GrammarPatch {
		private String ruleName;
		private String first;
		private String second;

		/**
		 * Constructor.
		 * 
		 * @param ruleName parser rule name, or null to patch every rule
		 * @param first    rendered text of the element to make optional
		 * @param second   rendered text of the element which must follow
		 */
		public MakeLeadingElementOptional(String ruleName, String first, String second) {
			this.ruleName = ruleName;
			this.first = first;
			this.second = second;
		}

		@Override
		public String getDescription() {
			return (ruleName != null ? ruleName : "*") + ": " + first + " " + second + " -> optional " + first;
		}

		@Override
		public boolean apply(RuleTable table, RuleRenderer renderer) {
			boolean changed = false;
			for (GrammarRule rule : findRules(table, ruleName)) {
				List<List<RuleElement>> alts = rule.getAlternatives();
				for (int i = 0; i < alts.size(); i++) {
					List<RuleElement> alt = alts.get(i);
					if (alt.size() < 2 || !render(renderer, alt.get(0)).equals(first)
							|| !render(renderer, alt.get(1)).equals(second))
						continue;
					RuleElement head = alt.get(0);
					Group group = head instanceof Group ? (Group) head : Group.of(head);
					List<RuleElement> patched = new ArrayList<RuleElement>(alt);
					patched.set(0, new Repetition(group, RepetitionModifier.OPTIONAL));
					alts.set(i, patched);
					changed = true;
				}
			}
			return changed;
		}
	}

	/**
	 * Insert a reference as a new alternative between two
	 * adjacent alternatives.
	 */
	public static class InsertAlternativeAfter implements GrammarPatch {
		private String ruleName;
		private String after;
		private String before;
		private String reference;

		/**
		 * Constructor.
		 * 
		 * @param ruleName  parser rule name, or null to patch every rule
		 * @param after     rendered text of the alternative to insert after
		 * @param before    rendered text of the alternative which must follow it
		 * @param reference name of the rule to insert a reference to
		 */
		public InsertAlternativeAfter(String ruleName, String after, String before, String reference) {
			this.ruleName = ruleName;
			this.after = after;
			this.before = before;
			this.reference = reference;
		}

		@Override
		public String getDescription() {
			return (ruleName != null ? ruleName : "*") + ": insert " + reference + " after " + after;
		}

		@Override
		public boolean apply(RuleTable table, RuleRenderer renderer) {
			boolean changed = false;
			String referenceText = RuleRenderer.toParserRuleName(reference);
			for (GrammarRule rule : findRules(table, ruleName)) {
				List<List<RuleElement>> alts = rule.getAlternatives();
				if (renderer.renderAlternatives(rule).contains(referenceText))
					continue;
				for (int i = 0; i + 1 < alts.size(); i++) {
					if (renderer.renderSequence(alts.get(i)).equals(after)
							&& renderer.renderSequence(alts.get(i + 1)).equals(before)) {
						List<RuleElement> alt = new ArrayList<RuleElement>();
						alt.add(new NonTerminal(reference));
						alts.add(i + 1, alt);
						changed = true;
						break;
					}
				}
			}
			return changed;
		}
	}

	/**
	 * Replace an optional element preceding a given element by an optional
	 * choice between several references.
	 */
	public static class ReplaceOptionalBeforeTerminal implements GrammarPatch {
		private String ruleName;
		private String optional;
		private String following;
		private List<String> choices;

		public ReplaceOptionalBeforeTerminal(String ruleName, String optional, String following, String... choices) {
			this.ruleName = ruleName;
			this.optional = optional;
			this.following = following;
			this.choices = Arrays.asList(choices);
		}

		@Override
		public String getDescription() {
			return ruleName + ": " + optional + " " + following + " -> ( " + String.join(" | ", choices) + " )? " + following;
		}

		@Override
		public boolean apply(RuleTable table, final RuleRenderer renderer) {
			final List<List<RuleElement>> groupAlts = new ArrayList<List<RuleElement>>();
			for (String choice : choices)
				groupAlts.add(Collections.<RuleElement>singletonList(new NonTerminal(choice)));
			RewriteSequences rewrite = new RewriteSequences() {
				@Override
				protected List<RuleElement> rewriteSequence(List<RuleElement> sequence) {
					List<RuleElement> result = new ArrayList<RuleElement>(sequence);
					for (int i = 0; i + 1 < result.size(); i++) {
						if (render(renderer, result.get(i)).equals(optional)
								&& render(renderer, result.get(i + 1)).equals(following))
							result.set(i, new Repetition(new Group(groupAlts), RepetitionModifier.OPTIONAL));
					}
					return result;
				}
			};
			boolean changed = false;
			for (GrammarRule rule : findRules(table, ruleName)) {
				if (rewrite.apply(rule))
					changed = true;
			}
			return changed;
		}
	}

	/**
	 * Define a rule which is referenced but has no definition.
	 */
	public static class DefineMissingRule implements GrammarPatch {
		private String name;
		private List<RuleElement> body;

		public DefineMissingRule(String name, List<RuleElement> body) {
			this.name = name;
			this.body = body;
		}

		@Override
		public String getDescription() {
			return "define " + name;
		}

		@Override
		public boolean apply(RuleTable table, RuleRenderer renderer) {
			if (table.contains(name))
				return false;
			ContainsReference ref = new ContainsReference(name);
			for (GrammarRule rule : table.getRules()) {
				for (List<RuleElement> alt : rule.getAlternatives()) {
					if (ref.inSequence(alt)) {
						List<List<RuleElement>> alts = new ArrayList<List<RuleElement>>();
						alts.add(body);
						table.addGenerated(new GrammarRule(name, null, alts, GrammarRule.GENERATED));
						return true;
					}
				}
			}
			return false;
		}
	}

	/**
	 * Replace the body of rules whose alternatives are overlapping
	 * ways of writing a qualified name or a feature chain by the single
	 * production <code>qualifiedName ( DOT qualifiedName )*</code>.
	 */
	public static class UnifyFeatureChain implements GrammarPatch {
		private List<String> ruleNames;
		private List<String> alternatives;

		/**
		 * Constructor.
		 * 
		 * @param ruleNames    parser rule names of the rules to patch
		 * @param alternatives rendered alternatives a rule must have to be patched
		 */
		public UnifyFeatureChain(List<String> ruleNames, List<String> alternatives) {
			this.ruleNames = ruleNames;
			this.alternatives = alternatives;
		}

		@Override
		public String getDescription() {
			return String.join(", ", ruleNames) + ": " + String.join(" | ", alternatives) + " -> " + FEATURE_CHAIN_TEXT;
		}

		@Override
		public boolean apply(RuleTable table, RuleRenderer renderer) {
			boolean changed = false;
			for (String ruleName : ruleNames) {
				for (GrammarRule rule : findRules(table, ruleName)) {
					if (!renderer.renderAlternatives(rule).equals(alternatives))
						continue;
					List<List<RuleElement>> alts = new ArrayList<List<RuleElement>>();
					alts.add(featureChain());
					rule.setAlternatives(alts);
					changed = true;
				}
			}
			return changed;
		}
	}

	/**
	 * Replace groups choosing between a qualified name and a feature
	 * chain by the unified feature chain production. A group directly in
	 * a sequence is spliced into the sequence; a repeated group
	 * stays a group.
	 */
	public static class InlineFeatureChainGroups implements GrammarPatch {
		private List<String> groupTexts;

		public InlineFeatureChainGroups(List<String> groupTexts) {
			this.groupTexts = groupTexts;
		}

		@Override
		public String getDescription() {
			return String.join(", ", groupTexts) + " -> " + FEATURE_CHAIN_TEXT;
		}

		@Override
		public boolean apply(RuleTable table, final RuleRenderer renderer) {
			RewriteSequences rewrite = new RewriteSequences() {
				@Override
				protected List<RuleElement> rewriteSequence(List<RuleElement> sequence) {
					List<RuleElement> result = new ArrayList<RuleElement>();
					for (RuleElement elem : sequence) {
						if (matches(elem))
							result.addAll(featureChain());
						else
							result.add(elem);
					}
					return result;
				}

				@Override
				public RuleElement visitRepetition(Repetition repetition) {
					RuleElement child = repetition.getChild().accept(this);
					if (matches(child)) {
						List<RuleElement> chain = featureChain();
						child = Group.of(chain.toArray(new RuleElement[chain.size()]));
					}
					return new Repetition(child, repetition.getModifier());
				}

				private boolean matches(RuleElement elem) {
					return elem instanceof Group && groupTexts.contains(render(renderer, elem));
				}
			};
			return rewrite.applyAll(table);
		}
	}
}
