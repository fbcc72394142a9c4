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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Keep fetched documents in a cache directory, so that they
 * are only retrieved once per release tag.
 * Cached files are named <code>&lt;key&gt;-&lt;tag&gt;.kebnf</code>.
 */
public class CachingDocumentSource implements DocumentSource {
	private final DocumentSource delegate;
	private final Path cacheDir;
	private final Slog log;

	/**
	 * Constructor.
	 * 
	 * @param delegate source used on a cache miss
	 * @param cacheDir the cache directory (created when needed)
	 * @param log      logger
	 */
	public CachingDocumentSource(DocumentSource delegate, Path cacheDir, Slog log) {
		this.delegate = delegate;
		this.cacheDir = cacheDir;
		this.log = log;
	}

	/**
	 * @param key the document key
	 * @param tag the release tag
	 * @return path of the cache file for the document
	 */
	public Path getCachePath(String key, String tag) {
		return cacheDir.resolve(key + "-" + ReleaseTags.validate(tag) + ".kebnf");
	}

	@Override
	public String fetch(String key, String path, String tag) throws IOException {
		Path cachePath = getCachePath(key, tag);
		if (Files.exists(cachePath)) {
			log.log("Using cached %s from %s", key, cachePath);
			return new String(Files.readAllBytes(cachePath), StandardCharsets.UTF_8);
		}
		String content = delegate.fetch(key, path, tag);
		Files.createDirectories(cacheDir);
		Files.write(cachePath, content.getBytes(StandardCharsets.UTF_8));
		return content;
	}
}
