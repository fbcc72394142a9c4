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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GrammarPatchesTest {
	private static final String RULES = """
			EntryTransitionMember = 'then' TargetSuccession
			SatisfyUsage = 'assert' ( 'not' )? 'satisfy' Foo
			SatisfyNode = 'assert' ( 'not' ) 'satisfy' Bar
			LibraryPackage = ( 'standard' ) 'library' Bar
			Import = VisibilityIndicator 'import' Baz
			DefinitionElement = MetadataDefinition | ExtendedDefinition
			SendNode = ActionUsageDeclaration? 'send' Qux
			CaseBodyItem = ActionBodyItem | SubjectMember
			CalculationUsage = 'calc' CalculationUsageDeclaration
			GeneralType = QualifiedName | OwnedFeatureChain
			FeatureChainMember = FeatureReferenceMember | OwnedFeatureChainMember | QualifiedName
			Chained = ( QualifiedName | FeatureChain ) 'by' ( QualifiedName | OwnedFeatureChain )*
			""";

	private RuleTable table;
	private RuleRenderer renderer;

	@BeforeEach
	public void setUp() {
		table = new RuleTable();
		new ParseKebnf(table).parseDocument(RULES, "test");
		renderer = new RuleRenderer(table,
				new TokenVocabulary(Collections.<String>emptyList(), Collections.<String>emptyList()));
	}

	private List<Boolean> applyAll() {
		List<Boolean> result = new ArrayList<Boolean>();
		for (GrammarPatch patch : GrammarPatches.defaultPatches())
			result.add(patch.apply(table, renderer));
		return result;
	}

	private String body(String name) {
		GrammarRule rule = table.get(name);
		assertNotNull(rule, name);
		return renderer.renderBody(rule);
	}

	@Test
	public void testDefaultPatches() {
		applyAll();
		assertEquals("THEN transitionSuccessionMember", body("EntryTransitionMember"));
		assertEquals("( ASSERT ( NOT )? )? SATISFY foo", body("SatisfyUsage"));
		assertEquals("( ASSERT ( NOT )? )? SATISFY bar", body("SatisfyNode"));
		assertEquals("( STANDARD )? LIBRARY bar", body("LibraryPackage"));
		assertEquals("( visibilityIndicator )? IMPORT baz", body("Import"));
		assertEquals("metadataDefinition\n    | allocationDefinition\n    | extendedDefinition",
				body("DefinitionElement"));
		assertEquals("( actionNodeUsageDeclaration | actionUsageDeclaration )? SEND qux", body("SendNode"));
		assertEquals("actionBodyItem\n    | returnParameterMember\n    | subjectMember", body("CaseBodyItem"));
		assertEquals("usageDeclaration valuePart?", body("CalculationUsageDeclaration"));
		assertEquals(GrammarRule.GENERATED, table.get("CalculationUsageDeclaration").getSource());
		assertEquals(GrammarPatches.FEATURE_CHAIN_TEXT, body("GeneralType"));
		assertEquals(GrammarPatches.FEATURE_CHAIN_TEXT, body("FeatureChainMember"));
		assertEquals("qualifiedName ( DOT qualifiedName )* BY ( qualifiedName ( DOT qualifiedName )* )*",
				body("Chained"));
	}

	@Test
	public void testPatchesAreIdempotent() {
		List<Boolean> first = applyAll();
		assertTrue(first.contains(Boolean.TRUE));
		List<String> rendered = new ArrayList<String>();
		for (String name : table.getRuleOrder())
			rendered.add(body(name));

		List<Boolean> second = applyAll();
		assertFalse(second.contains(Boolean.TRUE));
		List<String> again = new ArrayList<String>();
		for (String name : table.getRuleOrder())
			again.add(body(name));
		assertEquals(rendered, again);
	}

	@Test
	public void testUnrelatedRulesUntouched() {
		table = new RuleTable();
		new ParseKebnf(table).parseDocument("""
				Other = 'then' TargetSuccession
				OtherType = QualifiedName | OwnedFeatureChain | Extra
				""", "test");
		renderer = new RuleRenderer(table,
				new TokenVocabulary(Collections.<String>emptyList(), Collections.<String>emptyList()));
		assertFalse(applyAll().contains(Boolean.TRUE));
		assertEquals("THEN targetSuccession", body("Other"));
		assertEquals("qualifiedName\n    | ownedFeatureChain\n    | extra", body("OtherType"));
	}

	@Test
	public void testFeatureChain() {
		List<RuleElement> chain = GrammarPatches.featureChain();
		assertEquals(2, chain.size());
		assertEquals(GrammarPatches.FEATURE_CHAIN_TEXT, renderer.renderSequence(chain));
	}

	@Test
	public void testFindRules() {
		assertEquals(1, GrammarPatches.findRules(table, "importRule").size());
		assertEquals(table.size(), GrammarPatches.findRules(table, null).size());
		assertEquals(Arrays.asList(table.get("Import")), GrammarPatches.findRules(table, "importRule"));
	}
}
