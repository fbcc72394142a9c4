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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Find parser rule references which no rule defines, and generate
 * stub rules for them so that the parser grammar is complete.
 */
public class ResolveUndefinedReferences {
	/**
	 * Undefined rules which are known to match the empty string.
	 */
	public static final Set<String> EPSILON_RULES = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"emptyActionUsage", "emptyUsage", "emptyFeature", "emptyMultiplicity",
			"emptyEndMember", "portConjugation", "emptyParameterMember")));

	private static final Pattern REFERENCE = Pattern.compile("\\b([a-z][a-zA-Z]+)\\b");
	private static final Pattern QUOTED = Pattern.compile("'(\\\\.|[^'\\\\])*'");
	private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

	private Set<String> defined;
	private Set<String> referenced;
	private TokenVocabulary vocab;

	/**
	 * Constructor.
	 * 
	 * @param vocab the token vocabulary (keywords are never rule references)
	 */
	public ResolveUndefinedReferences(TokenVocabulary vocab) {
		this.vocab = vocab;
		this.defined = new HashSet<String>();
		this.referenced = new HashSet<String>();
	}

	/**
	 * Record rules which are defined.
	 * 
	 * @param names parser rule names
	 */
	public void addDefined(Collection<String> names) {
		defined.addAll(names);
	}

	/**
	 * Record a defined rule and scan its body for references.
	 * 
	 * @param name the parser rule name
	 * @param body the rendered rule body
	 */
	public void addRule(String name, String body) {
		defined.add(name);
		scan(body);
	}

	/**
	 * Scan rendered grammar text for references.
	 * 
	 * @param text the text to scan
	 */
	public void scan(String text) {
		String s = QUOTED.matcher(text).replaceAll(" ");
		s = COMMENT.matcher(s).replaceAll(" ");
		Matcher m = REFERENCE.matcher(s);
		while (m.find())
			referenced.add(m.group(1));
	}

	/**
	 * @return the referenced but undefined rule names, sorted
	 */
	public SortedSet<String> getUndefined() {
		SortedSet<String> result = new TreeSet<String>();
		for (String ref : referenced) {
			if (defined.contains(ref) || FindCycles.NON_REFERENCES.contains(ref) || vocab.isKeyword(ref))
				continue;
			result.add(ref);
		}
		return result;
	}

	/**
	 * Write a stub rule for each undefined reference.
	 * Nothing is written if there are none.
	 * 
	 * @param out the PrintWriter to write to
	 * @return the number of stub rules written
	 */
	public int generateStubRules(PrintWriter out) {
		SortedSet<String> undefined = getUndefined();
		if (undefined.isEmpty())
			return 0;
		out.write("\n");
		out.write("// ===== Stub rules for undefined references =====\n");
		out.write("// These rules are referenced in the source grammar but not defined.\n");
		out.write("// They need manual review and completion.\n");
		out.write("\n");
		for (String name : undefined) {
			out.write(name + "\n");
			if (EPSILON_RULES.contains(name))
				out.write("    : /* epsilon */\n");
			else
				out.write("    : IDENTIFIER  /* TODO: stub for " + name + " */\n");
			out.write("    ;\n");
			out.write("\n");
		}
		out.flush();
		return undefined.size();
	}
}
