package com.phillippitts.streamwatch.service.resolver;

/**
 * Resolves a channel URL into its current live status and stream metadata.
 *
 * <p>Implementations must be safe to call concurrently, up to the per-platform permit count. Offline is not an
 * error: return {@link StreamInfo#offline(String)}. Transport or parsing failures may either be returned as
 * {@link StreamInfo#failed(String)} or thrown as {@link com.phillippitts.streamwatch.exception.ResolutionException}.
 */
public interface StreamResolver {

    /**
     * @param url         channel URL
     * @param platformKey platform hint derived from the URL host
     * @return resolution result, never null
     */
    StreamInfo resolve(String url, String platformKey);
}
