package com.feedrelay.sources.api;

/**
 * Fetches the most recent item published by a source identity.
 * Implementations are stateless and never throw: transport problems come back as
 * {@link FetchOutcome#failure(String, Throwable)}, an unrecognised document as
 * {@link FetchOutcome#noItem()}.
 */
public interface ContentSource {
    String name();

    FetchOutcome fetch(String sourceIdentity);
}
