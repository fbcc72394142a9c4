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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

public class GenerateExpressionRulesTest {
	private static GenerateExpressionRules generator() {
		return new GenerateExpressionRules(
				new TokenVocabulary(Collections.<String>emptyList(), Collections.<String>emptyList()));
	}

	@Test
	public void testOwnedExpressionAlternatives() {
		List<String> alts = generator().getOwnedExpressionAlternatives();
		assertEquals("IF ownedExpression QUESTION ownedExpression ELSE ownedExpression", alts.get(0));
		assertEquals("ownedExpression QUESTION_QUESTION ownedExpression", alts.get(1));
		assertEquals("ownedExpression IMPLIES ownedExpression", alts.get(2));
		assertTrue(alts.contains("ownedExpression ( EQ_EQ | BANG_EQ | EQ_EQ_EQ | BANG_EQ_EQ ) ownedExpression"));
		assertTrue(alts.contains("<assoc=right> ownedExpression ( STAR_STAR | CARET ) ownedExpression"));
		assertTrue(alts.contains("ownedExpression ARROW qualifiedName ( bodyExpression | argumentList )"));
		assertEquals("baseExpression", alts.get(alts.size() - 1));
		assertEquals(GenerateExpressionRules.PRECEDENCE.size() + 14, alts.size());
	}

	@Test
	public void testPrecedenceOrder() {
		List<String> alts = generator().getOwnedExpressionAlternatives();
		int additive = alts.indexOf("ownedExpression ( PLUS | MINUS ) ownedExpression");
		int multiplicative = alts.indexOf("ownedExpression ( STAR | SLASH | PERCENT ) ownedExpression");
		int unary = alts.indexOf("( PLUS | MINUS | TILDE | NOT ) ownedExpression");
		assertTrue(additive > 0);
		assertTrue(multiplicative > additive);
		assertTrue(unary > multiplicative);
	}

	@Test
	public void testHelperRules() {
		StringWriter text = new StringWriter();
		generator().generateExpressionRules(new PrintWriter(text));
		String rules = text.toString();
		assertTrue(rules.startsWith("ownedExpression\n    : IF "));
		assertTrue(rules.contains("\nliteralBoolean\n    : TRUE\n    | FALSE\n    ;\n"));
		assertTrue(rules.contains("\nbodyExpression\n    : LBRACE functionBodyPart RBRACE\n    ;\n"));
		assertTrue(rules.contains("\nargumentExpressionMember\n    : ownedExpression\n    ;\n"));
	}

	@Test
	public void testNameRule() {
		StringWriter text = new StringWriter();
		generator().generateNameRule(new PrintWriter(text));
		assertEquals("name\n    : IDENTIFIER\n    | STRING\n    ;\n\n", text.toString());
	}

	@Test
	public void testRuleNameSets() {
		assertTrue(GenerateExpressionRules.SYNTHESIZED_RULE_NAMES.contains("name"));
		assertTrue(GenerateExpressionRules.SYNTHESIZED_RULE_NAMES.contains("literalInfinity"));
		assertTrue(GenerateExpressionRules.EXCLUDED_RULE_NAMES.contains("OwnedExpression"));
		assertTrue(GenerateExpressionRules.EXCLUDED_RULE_NAMES.contains("MetadataValue"));
		assertFalse(GenerateExpressionRules.EXCLUDED_RULE_NAMES.contains("QualifiedName"));
	}
}
