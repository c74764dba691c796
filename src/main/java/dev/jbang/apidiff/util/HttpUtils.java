package dev.jbang.apidiff.util;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for HTTP operations */
public class HttpUtils {
	private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	public static final int DEFAULT_MAX_RETRIES = 3;
	public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(2);

	private final HttpClient httpClient;
	private final Duration requestTimeout;
	private final int maxRetries;
	private final Duration initialBackoff;
	private final String bearerToken;

	public HttpUtils() {
		this(Duration.ofSeconds(30), Duration.ofMinutes(2), DEFAULT_MAX_RETRIES, DEFAULT_INITIAL_BACKOFF, null);
	}

	public HttpUtils(
			Duration connectTimeout,
			Duration requestTimeout,
			int maxRetries,
			Duration initialBackoff,
			String bearerToken) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(connectTimeout)
				.build();
		this.requestTimeout = requestTimeout;
		this.maxRetries = Math.max(1, maxRetries);
		this.initialBackoff = initialBackoff;
		this.bearerToken = bearerToken;
	}

	/** Download content from a URL, fully buffered in memory */
	public byte[] downloadBytes(String url) throws IOException, InterruptedException {
		return retry(url, () -> {
			HttpRequest request = request(url).build();
			HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
			if (response.statusCode() < 200 || response.statusCode() >= 300) {
				throw new HttpStatusException(url, response.statusCode());
			}
			return response.body();
		});
	}

	/** Download content from a URL as a string */
	public String downloadString(String url) throws IOException, InterruptedException {
		return retry(url, () -> {
			HttpRequest request = request(url).build();
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			if (response.statusCode() < 200 || response.statusCode() >= 300) {
				throw new HttpStatusException(url, response.statusCode());
			}
			return response.body();
		});
	}

	/** Check if a URL exists (returns 2xx status code) */
	public boolean urlExists(String url) throws InterruptedException {
		try {
			HttpRequest request = request(url)
					.method("HEAD", HttpRequest.BodyPublishers.noBody())
					.build();
			HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
			int statusCode = response.statusCode();
			return statusCode >= 200 && statusCode < 300;
		} catch (IOException e) {
			logger.debug("HEAD {} failed: {}", url, e.getMessage());
			return false;
		}
	}

	private HttpRequest.Builder request(String url) {
		URI uri = URI.create(url);
		HttpRequest.Builder builder =
				HttpRequest.newBuilder().uri(uri).timeout(requestTimeout).GET();
		if (bearerToken != null && !bearerToken.isEmpty()) {
			builder.header("Authorization", "Bearer " + bearerToken);
		}
		return builder;
	}

	/**
	 * Retry an operation with exponential backoff. Client errors (4xx) are not retried.
	 *
	 * @param url The URL being fetched, for logging
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(String url, IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < maxRetries; attempt++) {
			try {
				return operation.get();
			} catch (HttpStatusException e) {
				if (e.isClientError()) {
					throw e;
				}
				lastException = e;
			} catch (IOException e) {
				lastException = e;
			}
			if (attempt < maxRetries - 1) {
				// Exponential backoff: 2s, 4s, 8s, ...
				long backoffMillis = initialBackoff.toMillis() * (1L << attempt);
				logger.debug(
						"Attempt {} for {} failed ({}), retrying in {} ms",
						attempt + 1,
						url,
						lastException.getMessage(),
						backoffMillis);
				Thread.sleep(backoffMillis);
			}
		}
		throw lastException;
	}
}
