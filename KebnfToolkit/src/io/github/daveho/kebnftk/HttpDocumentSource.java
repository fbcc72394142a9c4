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
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Fetch documents over HTTP from the raw file view of a GitHub repository.
 */
public class HttpDocumentSource implements DocumentSource {
	private static final String URL_FORMAT = "https://raw.githubusercontent.com/%s/%s/%s";
	private static final Duration TIMEOUT = Duration.ofSeconds(30);

	private final String repo;
	private final HttpClient client;
	private final Slog log;

	/**
	 * Constructor.
	 * 
	 * @param repo the repository (<code>owner/name</code>)
	 * @param log  logger
	 */
	public HttpDocumentSource(String repo, Slog log) {
		this.repo = repo;
		this.client = HttpClient.newBuilder()
				.connectTimeout(TIMEOUT)
				.followRedirects(HttpClient.Redirect.NORMAL)
				.build();
		this.log = log;
	}

	/**
	 * Get the URL of a document.
	 * 
	 * @param path path of the document within the repository
	 * @param tag  the release tag
	 * @return the URL
	 */
	public String getUrl(String path, String tag) {
		return String.format(URL_FORMAT, repo, tag, path);
	}

	@Override
	public String fetch(String key, String path, String tag) throws IOException {
		ReleaseTags.validate(tag);
		String url = getUrl(path, tag);
		log.log("Downloading %s from %s...", key, url);
		HttpRequest request = HttpRequest.newBuilder(URI.create(url))
				.timeout(TIMEOUT)
				.GET()
				.build();
		HttpResponse<String> response;
		try {
			response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IOException("Interrupted while downloading " + url, e);
		}
		if (response.statusCode() / 100 != 2)
			throw new IOException("Download of " + url + " failed with HTTP status " + response.statusCode());
		return response.body();
	}
}
