package io.sylabs.scs.keyclient.internal;

import java.net.http.HttpClient;

/**
 * Process-wide transport used when a configuration does not supply one. Created on first use and never reconfigured.
 */
public final class DefaultHttpClient {

    private DefaultHttpClient() {
    }

    public static HttpClient instance() {
        return Holder.INSTANCE;
    }

    private static final class Holder {
        private static final HttpClient INSTANCE = HttpClient.newHttpClient();
    }
}
