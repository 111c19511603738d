package com.di.rawingest.util;

/**
 * Helpers for input paths that may be local files or {@code gs://} objects.
 */
public final class GcsPaths {

    public static final String GCS_SCHEME = "gs://";

    private GcsPaths() {
    }

    public static boolean isGcsUri(String path) {
        return path != null && path.startsWith(GCS_SCHEME);
    }

    /**
     * Rewrites {@code gs://bucket/...} to the path where buckets are mounted locally
     * (e.g. {@code /gcs/bucket/...}). Paths without the scheme come back unchanged.
     *
     * @param path        input path
     * @param mountPrefix local mount point of the buckets, e.g. {@code /gcs/}
     */
    public static String toMountedPath(String path, String mountPrefix) {
        if (path == null) {
            return null;
        }
        return path.replace(GCS_SCHEME, mountPrefix);
    }

    /**
     * Final path segment, e.g. {@code test.csv} for {@code gs://bucket/dir/test.csv} or {@code /data/in/test.csv}.
     */
    public static String baseName(String path) {
        if (path == null) {
            return null;
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
