package org.cloudplane.ops;

final class NoOpRetryReporter implements RetryReporter {

	static final NoOpRetryReporter INSTANCE = new NoOpRetryReporter();

	private NoOpRetryReporter() {}
}
