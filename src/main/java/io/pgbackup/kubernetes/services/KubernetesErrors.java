package io.pgbackup.kubernetes.services;

import io.fabric8.kubernetes.client.KubernetesClientException;

import java.io.IOException;
import java.net.HttpURLConnection;

/**
 * Classifies API server failures between transient ones, worth a retry, and definitive ones.
 */
abstract public class KubernetesErrors {
    public static final int HTTP_TOO_MANY_REQUESTS = 429;

    public static boolean isTransient(KubernetesClientException e) {
        int code = e.getCode();

        // no HTTP response at all: connection refused, reset, timed out
        if (code <= 0) {
            return true;
        }

        return code >= HttpURLConnection.HTTP_INTERNAL_ERROR ||
            code == HTTP_TOO_MANY_REQUESTS ||
            code == HttpURLConnection.HTTP_CLIENT_TIMEOUT ||
            e.getCause() instanceof IOException;
    }

    public static boolean isNotFound(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_NOT_FOUND;
    }

    public static boolean isConflict(KubernetesClientException e) {
        return e.getCode() == HttpURLConnection.HTTP_CONFLICT;
    }

    public static String describe(KubernetesClientException e) {
        if (e.getStatus() != null && e.getStatus().getMessage() != null) {
            return e.getCode() + " " + e.getStatus().getReason() + ": " + e.getStatus().getMessage();
        }

        return e.getCode() > 0 ? e.getCode() + ": " + e.getMessage() : e.getMessage();
    }
}
