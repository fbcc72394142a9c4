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

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import io.github.daveho.kebnftk.PrecedenceLevel.Associativity;

/**
 * Generate the expression sub-grammar.
 * The KEBNF expression rules encode operator precedence implicitly,
 * as a chain of rules. Copying that chain produces a grammar which ANTLR
 * cannot analyze efficiently, so the chain is replaced by a single
 * directly left-recursive <code>ownedExpression</code> rule
 * whose alternatives are ordered by precedence, plus a fixed set
 * of non-recursive helper rules.
 */
public class GenerateExpressionRules {
	/**
	 * Binary operator precedence, loosest binding first.
	 */
	public static final List<PrecedenceLevel> PRECEDENCE = Collections.unmodifiableList(Arrays.asList(
			new PrecedenceLevel("conditional", Associativity.NONE, "if"),
			new PrecedenceLevel("nullCoalescing", Associativity.LEFT, "??"),
			new PrecedenceLevel("implies", Associativity.LEFT, "implies"),
			new PrecedenceLevel("or", Associativity.LEFT, "or"),
			new PrecedenceLevel("and", Associativity.LEFT, "and"),
			new PrecedenceLevel("xor", Associativity.LEFT, "xor"),
			new PrecedenceLevel("bitwiseOr", Associativity.LEFT, "|"),
			new PrecedenceLevel("bitwiseAnd", Associativity.LEFT, "&"),
			new PrecedenceLevel("equality", Associativity.LEFT, "==", "!=", "===", "!=="),
			new PrecedenceLevel("relational", Associativity.LEFT, "<", ">", "<=", ">="),
			new PrecedenceLevel("range", Associativity.LEFT, ".."),
			new PrecedenceLevel("additive", Associativity.LEFT, "+", "-"),
			new PrecedenceLevel("multiplicative", Associativity.LEFT, "*", "/", "%"),
			new PrecedenceLevel("exponentiation", Associativity.RIGHT, "**", "^")));

	/**
	 * Alternatives of <code>ownedExpression</code> following the binary
	 * operator levels: unary operators, classification, indexing,
	 * invocation and feature access, and the base expression.
	 */
	private static final String[] POSTFIX_ALTERNATIVES = {
			"( PLUS | MINUS | TILDE | NOT ) ownedExpression",
			"( AT_SIGN | AT_AT ) typeReference",
			"ownedExpression ( ISTYPE | HASTYPE | AT_SIGN ) typeReference",
			"ownedExpression AS typeReference",
			"ownedExpression AT_AT typeReference",
			"ownedExpression META typeReference",
			"ownedExpression LBRACK sequenceExpressionList? RBRACK",
			"ownedExpression HASH LPAREN sequenceExpressionList? RPAREN",
			"ownedExpression argumentList",
			"ownedExpression DOT qualifiedName",
			"ownedExpression DOT_QUESTION bodyExpression",
			"ownedExpression ARROW qualifiedName ( bodyExpression | argumentList )",
			"ALL typeReference",
			"baseExpression",
	};

	// Helper rules: each entry is the rule name followed by its alternatives
	private static final String[][] HELPER_RULES = {
			{ "typeReference", "qualifiedName" },
			{ "sequenceExpressionList", "ownedExpression ( COMMA ownedExpression )*" },
			{ "baseExpression", "nullExpression", "literalExpression", "featureReferenceExpression",
				"metadataAccessExpression", "invocationExpression", "constructorExpression",
				"bodyExpression", "LPAREN sequenceExpressionList? RPAREN" },
			{ "nullExpression", "NULL", "LPAREN RPAREN" },
			{ "featureReferenceExpression", "qualifiedName" },
			{ "metadataAccessExpression", "qualifiedName DOT METADATA" },
			{ "invocationExpression", "qualifiedName argumentList" },
			{ "constructorExpression", "NEW qualifiedName argumentList" },
			{ "bodyExpression", "LBRACE functionBodyPart RBRACE" },
			{ "argumentList", "LPAREN ( positionalArgumentList | namedArgumentList )? RPAREN" },
			{ "positionalArgumentList", "ownedExpression ( COMMA ownedExpression )*" },
			{ "namedArgumentList", "namedArgument ( COMMA namedArgument )*" },
			{ "namedArgument", "qualifiedName EQ ownedExpression" },
			{ "literalExpression", "literalBoolean", "literalString", "literalInteger", "literalReal",
				"literalInfinity" },
			{ "literalBoolean", "TRUE", "FALSE" },
			{ "literalString", "DOUBLE_STRING" },
			{ "literalInteger", "INTEGER" },
			{ "literalReal", "REAL" },
			{ "literalInfinity", "STAR" },
			{ "argumentMember", "ownedExpression" },
			{ "argumentExpressionMember", "ownedExpression" },
	};

	/**
	 * KEBNF rules replaced by the generated expression rules.
	 * These are never rendered.
	 */
	public static final Set<String> EXCLUDED_RULE_NAMES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			// expression chain
			"OwnedExpression", "ConditionalExpression", "ConditionalBinaryOperatorExpression",
			"BinaryOperatorExpression", "UnaryOperatorExpression", "ClassificationExpression",
			"MetaclassificationExpression", "ExtentExpression",
			// operators
			"ConditionalBinaryOperator", "BinaryOperator", "UnaryOperator", "ClassificationTestOperator",
			"CastOperator", "MetaclassificationTestOperator", "MetaCastOperator",
			// primary expressions
			"PrimaryExpression", "NonFeatureChainPrimaryExpression", "BracketExpression", "IndexExpression",
			"SequenceExpression", "SelectExpression", "CollectExpression", "FunctionOperationExpression",
			"FeatureChainExpression",
			// argument wrappers
			"ArgumentMember", "Argument", "ArgumentValue", "ArgumentExpressionMember", "ArgumentExpression",
			"ArgumentExpressionValue", "PrimaryArgumentMember", "PrimaryArgument", "PrimaryArgumentValue",
			"NonFeatureChainPrimaryArgumentMember", "NonFeatureChainPrimaryArgument",
			"NonFeatureChainPrimaryArgumentValue", "MetadataArgumentMember", "MetadataArgument",
			"MetadataValue", "OwnedExpressionReferenceMember", "OwnedExpressionReference",
			// helpers
			"TypeReference", "SequenceExpressionList", "BaseExpression", "NullExpression",
			"FeatureReferenceExpression", "MetadataAccessExpression", "InvocationExpression",
			"ConstructorExpression", "BodyExpression", "ArgumentList", "PositionalArgumentList",
			"NamedArgumentList", "NamedArgument", "LiteralExpression", "LiteralBoolean", "LiteralString",
			"LiteralInteger", "LiteralReal", "LiteralInfinity")));

	/** Name of the rule matching a name (plain or quoted). */
	public static final String NAME_RULE = "name";

	/**
	 * Names of all parser rules defined by this generator,
	 * including the <code>name</code> rule.
	 */
	public static final Set<String> SYNTHESIZED_RULE_NAMES;
	static {
		Set<String> names = new HashSet<String>();
		names.add("ownedExpression");
		for (String[] helper : HELPER_RULES)
			names.add(helper[0]);
		names.add(NAME_RULE);
		SYNTHESIZED_RULE_NAMES = Collections.unmodifiableSet(names);
	}

	private TokenVocabulary vocab;

	/**
	 * Constructor.
	 * 
	 * @param vocab the token vocabulary (used to name the operator tokens)
	 */
	public GenerateExpressionRules(TokenVocabulary vocab) {
		this.vocab = vocab;
	}

	/**
	 * Get the alternatives of the <code>ownedExpression</code> rule.
	 * 
	 * @return the alternatives, in precedence order
	 */
	public List<String> getOwnedExpressionAlternatives() {
		List<String> alts = new ArrayList<String>();
		for (PrecedenceLevel level : PRECEDENCE) {
			if (level.getAssociativity() == Associativity.NONE) {
				alts.add(token("if") + " ownedExpression " + token("?") + " ownedExpression "
						+ token("else") + " ownedExpression");
				continue;
			}
			StringBuilder buf = new StringBuilder();
			if (level.getAssociativity() == Associativity.RIGHT)
				buf.append("<assoc=right> ");
			buf.append("ownedExpression ");
			List<String> ops = level.getOperators();
			if (ops.size() == 1) {
				buf.append(token(ops.get(0)));
			} else {
				buf.append("(");
				for (int i = 0; i < ops.size(); i++) {
					if (i > 0)
						buf.append(" |");
					buf.append(" ");
					buf.append(token(ops.get(i)));
				}
				buf.append(" )");
			}
			buf.append(" ownedExpression");
			alts.add(buf.toString());
		}
		Collections.addAll(alts, POSTFIX_ALTERNATIVES);
		return alts;
	}

	/**
	 * Write the expression rules.
	 * 
	 * @param out the PrintWriter to write to
	 */
	public void generateExpressionRules(PrintWriter out) {
		writeRule(out, "ownedExpression", getOwnedExpressionAlternatives());
		for (String[] helper : HELPER_RULES) {
			List<String> alts = new ArrayList<String>();
			for (int i = 1; i < helper.length; i++)
				alts.add(helper[i]);
			writeRule(out, helper[0], alts);
		}
		out.flush();
	}

	/**
	 * Write the <code>name</code> rule.
	 * 
	 * @param out the PrintWriter to write to
	 */
	public void generateNameRule(PrintWriter out) {
		writeRule(out, NAME_RULE, Arrays.asList("IDENTIFIER", "STRING"));
		out.flush();
	}

	/**
	 * Write one parser rule in the standard layout.
	 * 
	 * @param out          the PrintWriter to write to
	 * @param name         the rule name
	 * @param alternatives the rendered alternatives
	 */
	static void writeRule(PrintWriter out, String name, List<String> alternatives) {
		out.write(name + "\n");
		for (int i = 0; i < alternatives.size(); i++) {
			out.write(i == 0 ? "    : " : "    | ");
			out.write(alternatives.get(i));
			out.write("\n");
		}
		out.write("    ;\n");
		out.write("\n");
	}

	private String token(String literal) {
		return vocab.terminalToken(literal);
	}
}
