package com.acme.taskmanager.ratelimit;

public class RateLimitExceededException extends RuntimeException {
    private final String route;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String route, long retryAfterSeconds) {
        super("Rate limit exceeded. Retry in " + retryAfterSeconds + " seconds.");
        this.route = route;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public String getRoute() { return route; }
    public long getRetryAfterSeconds() { return retryAfterSeconds; }
}
