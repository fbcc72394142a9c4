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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class BreakLeftRecursionCycleTest {
	static final String FILTER_PACKAGE_RULES = """
			FilterPackage = ImportDeclaration FilterPackageMember+
			ImportDeclaration = MembershipImport | NamespaceImport
			MembershipImport = [QualifiedName]
			NamespaceImport = [QualifiedName] '::' '*' | FilterPackage
			FilterPackageMember = '[' [QualifiedName] ']'
			""";

	private static final List<String> FILTER_PACKAGE_CYCLE =
			Arrays.asList("FilterPackage", "ImportDeclaration", "NamespaceImport");

	private static RuleTable parse(String text) {
		RuleTable table = new RuleTable();
		new ParseKebnf(table).parseDocument(text, "test");
		return table;
	}

	private static List<List<String>> leftRecursion(RuleTable table) {
		return new FindLeftRecursion(table, Collections.<String>emptySet()).findCycles();
	}

	@Test
	public void testBreakFilterPackageCycle() {
		RuleTable table = parse(FILTER_PACKAGE_RULES);
		assertEquals(1, leftRecursion(table).size());

		BreakLeftRecursionCycle brk = new BreakLeftRecursionCycle(FILTER_PACKAGE_CYCLE);
		assertEquals("FilterPackageImportDeclaration", brk.getSafeName(1));
		assertEquals("NamespaceImportDirect", brk.getSafeName(2));
		assertTrue(brk.apply(table));

		GrammarRule safeImport = table.get("FilterPackageImportDeclaration");
		assertEquals(GrammarRule.GENERATED, safeImport.getSource());
		assertEquals(Arrays.asList(
				Arrays.<RuleElement>asList(new NonTerminal("MembershipImport")),
				Arrays.<RuleElement>asList(new NonTerminal("NamespaceImportDirect"))),
				safeImport.getAlternatives());

		GrammarRule safeNamespace = table.get("NamespaceImportDirect");
		assertEquals(Arrays.asList(Arrays.<RuleElement>asList(
				new QualifiedNameRef(false), new Terminal("::"), new Terminal("*"))),
				safeNamespace.getAlternatives());

		GrammarRule head = table.get("FilterPackage");
		assertEquals(new NonTerminal("FilterPackageImportDeclaration"), head.getAlternatives().get(0).get(0));

		// the rules of the cycle are kept
		assertEquals(2, table.get("ImportDeclaration").getAlternatives().size());
		assertEquals(2, table.get("NamespaceImport").getAlternatives().size());

		assertTrue(leftRecursion(table).isEmpty());
	}

	@Test
	public void testApplyTwice() {
		RuleTable table = parse(FILTER_PACKAGE_RULES);
		BreakLeftRecursionCycle brk = new BreakLeftRecursionCycle(FILTER_PACKAGE_CYCLE);
		assertTrue(brk.apply(table));
		int size = table.size();
		assertFalse(brk.apply(table));
		assertEquals(size, table.size());
	}

	@Test
	public void testSafeNameAlreadyTaken() {
		RuleTable table = parse(FILTER_PACKAGE_RULES + "NamespaceImportDirect = 'y'\n");
		int size = table.size();
		assertFalse(new BreakLeftRecursionCycle(FILTER_PACKAGE_CYCLE).apply(table));
		assertEquals(size, table.size());
		assertFalse(table.contains("FilterPackageImportDeclaration"));
		assertEquals(new NonTerminal("ImportDeclaration"), table.get("FilterPackage").getAlternatives().get(0).get(0));
		assertEquals(1, leftRecursion(table).size());
	}

	@Test
	public void testTwoRuleCycle() {
		RuleTable table = parse("""
				Alpha = Beta 'x'
				Beta = Alpha 'y' | 'z'
				""");
		assertTrue(new BreakLeftRecursionCycle(Arrays.asList("Alpha", "Beta")).apply(table));
		assertEquals(Arrays.asList(Arrays.<RuleElement>asList(new Terminal("z"))),
				table.get("AlphaBeta").getAlternatives());
		assertEquals(Arrays.asList(Arrays.<RuleElement>asList(new NonTerminal("AlphaBeta"), new Terminal("x"))),
				table.get("Alpha").getAlternatives());
		assertTrue(leftRecursion(table).isEmpty());
	}

	@Test
	public void testNoSafePath() {
		RuleTable table = parse("""
				Alpha = Beta 'x'
				Beta = Alpha 'y'
				""");
		assertFalse(new BreakLeftRecursionCycle(Arrays.asList("Alpha", "Beta")).apply(table));
		assertEquals(2, table.size());
		assertEquals(new NonTerminal("Beta"), table.get("Alpha").getAlternatives().get(0).get(0));
	}

	@Test
	public void testMissingRule() {
		RuleTable table = parse("Alpha = Beta 'x'\n");
		assertFalse(new BreakLeftRecursionCycle(Arrays.asList("Alpha", "Beta")).apply(table));
		assertEquals(1, table.size());
	}

	@Test
	public void testCycleTooShort() {
		assertThrows(IllegalArgumentException.class, () -> new BreakLeftRecursionCycle(Arrays.asList("Alpha")));
	}
}
