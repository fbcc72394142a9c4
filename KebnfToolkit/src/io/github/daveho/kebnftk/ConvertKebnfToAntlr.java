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
import java.io.StringWriter;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Convert KEBNF documents to a pair of ANTLR4 grammars.
 * 
 * <p>The stages are run in a fixed order: parse the documents, break the
 * configured left recursion cycles, collect terminals and build the token
 * vocabulary, apply the patches, check for remaining left recursion,
 * and finally generate the lexer and parser grammars.</p>
 */
public class ConvertKebnfToAntlr {
	private GeneratorConfig config;
	private List<GrammarPatch> patches;
	private Slog log;

	/**
	 * Constructor using the default patches.
	 * 
	 * @param config the configuration
	 * @param log    logger
	 */
	public ConvertKebnfToAntlr(GeneratorConfig config, Slog log) {
		this(config, GrammarPatches.defaultPatches(), log);
	}

	/**
	 * Constructor.
	 * 
	 * @param config  the configuration
	 * @param patches the patches to apply
	 * @param log     logger
	 */
	public ConvertKebnfToAntlr(GeneratorConfig config, List<GrammarPatch> patches, Slog log) {
		this.config = config;
		this.patches = patches;
		this.log = log;
	}

	/**
	 * Convert documents.
	 * 
	 * @param documents map of document keys to document text, in parsing order
	 * @return the generated grammars
	 */
	public GeneratedGrammar convert(Map<String, String> documents) {
		RuleTable table = new RuleTable();

		Slog parseLog = log.child("parse").start();
		ParseKebnf parser = new ParseKebnf(table);
		for (Map.Entry<String, String> entry : documents.entrySet()) {
			int before = table.size();
			parser.parseDocument(entry.getValue(), entry.getKey());
			parseLog.log("%s: %d bytes, %d new rules", entry.getKey(), entry.getValue().length(), table.size() - before);
		}
		int lexicalCount = table.countLexicalRules();
		parseLog.log("Total rules: %d (%d lexical, %d parser) in %.3f s", table.size(), lexicalCount,
				table.size() - lexicalCount, parseLog.elapsed());
		if (parser.getSkippedFragmentCount() > 0)
			parseLog.warn("Skipped %d unparseable fragments", parser.getSkippedFragmentCount());

		Slog rewriteLog = log.child("rewrite");
		for (List<String> cycle : config.cycles) {
			if (new BreakLeftRecursionCycle(cycle).apply(table))
				rewriteLog.log("Broke left recursion cycle %s", String.join(" -> ", cycle));
			else
				rewriteLog.log("Left recursion cycle %s not present", String.join(" -> ", cycle));
		}

		CollectTerminals collector = new CollectTerminals(table);
		collector.execute();
		TokenVocabulary vocab = new TokenVocabulary(collector.getKeywords(), collector.getOperators());
		log.child("terminals").log("Keywords found: %d, operators found: %d",
				collector.getKeywords().size(), collector.getOperators().size());

		RuleRenderer renderer = new RuleRenderer(table, vocab);
		for (GrammarPatch patch : patches) {
			if (patch.apply(table, renderer))
				rewriteLog.log("Applied patch: %s", patch.getDescription());
		}

		Set<String> ignored = new HashSet<String>();
		for (GrammarRule rule : table.getRules()) {
			if (!GenerateParserGrammar.isRenderable(rule))
				ignored.add(rule.getName());
		}
		List<List<String>> cycles = new FindLeftRecursion(table, ignored).findCycles();
		for (List<String> cycle : cycles)
			rewriteLog.warn("Mutual left recursion remains: %s", String.join(" -> ", cycle));

		Slog generateLog = log.child("generate");
		StringWriter lexerText = new StringWriter();
		new GenerateLexerGrammar(vocab, config.grammarTitle, config.lexerName)
				.generateLexerGrammar(new PrintWriter(lexerText));

		StringWriter parserText = new StringWriter();
		GenerateParserGrammar parserGen = new GenerateParserGrammar(table, renderer,
				new GenerateExpressionRules(vocab), new ResolveUndefinedReferences(vocab),
				config.grammarTitle, config.grammarName, config.lexerName);
		parserGen.generateParserGrammar(new PrintWriter(parserText));
		generateLog.log("Rendered %d parser rules, %d stub rules", parserGen.getRenderedRuleCount(),
				parserGen.getStubRuleCount());
		if (parserGen.getStubRuleCount() > 0)
			generateLog.warn("%d undefined rules were stubbed and need review", parserGen.getStubRuleCount());

		return new GeneratedGrammar(lexerText.toString(), parserText.toString(), table.size(), lexicalCount,
				collector.getKeywords().size(), collector.getOperators().size(), parserGen.getRenderedRuleCount(),
				parserGen.getStubRuleCount(), parser.getSkippedFragmentCount(), cycles);
	}
}
