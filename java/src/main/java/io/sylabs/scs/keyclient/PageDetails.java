package io.sylabs.scs.keyclient;

/**
 * Pagination details passed through to paged key service operations. The client never inspects or advances the
 * token; callers copy it from one response into the next request.
 *
 * @param size  maximum number of results per page; the server may ignore it or return fewer.
 * @param token continuation token, empty for the first page and after the last page.
 */
public record PageDetails(int size, String token) {

    public PageDetails {
        token = token == null ? "" : token;
    }

    public static PageDetails first(int size) {
        return new PageDetails(size, "");
    }

    public boolean hasToken() {
        return !token.isEmpty();
    }

    /**
     * Returns a copy carrying the continuation token received from the server.
     */
    public PageDetails withToken(String token) {
        return new PageDetails(size, token);
    }
}
