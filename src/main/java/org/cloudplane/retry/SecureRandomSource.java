package org.cloudplane.retry;

import java.security.SecureRandom;

final class SecureRandomSource implements RandomSource {

    static final SecureRandomSource INSTANCE = new SecureRandomSource();

    // SecureRandom is thread-safe
    private final SecureRandom random = new SecureRandom();

    private SecureRandomSource() {}

    @Override
    public double nextUnit() {
        return random.nextDouble();
    }
}
