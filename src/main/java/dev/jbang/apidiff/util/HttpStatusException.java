package dev.jbang.apidiff.util;

import java.io.IOException;

/** A request completed with a non-2xx status code */
public class HttpStatusException extends IOException {
	private final String url;
	private final int statusCode;

	public HttpStatusException(String url, int statusCode) {
		super("Request failed: " + url + " - HTTP status: " + statusCode);
		this.url = url;
		this.statusCode = statusCode;
	}

	public String url() {
		return url;
	}

	public int statusCode() {
		return statusCode;
	}

	/** Client errors are answers, not failures: retrying them cannot succeed */
	public boolean isClientError() {
		return statusCode >= 400 && statusCode < 500;
	}

	public boolean isNotFound() {
		return statusCode == 404 || statusCode == 410;
	}
}
