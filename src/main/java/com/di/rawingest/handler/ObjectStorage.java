package com.di.rawingest.handler;

/**
 * Object-storage existence lookup for remote inputs (e.g. {@code gs://bucket/dir/file.csv}).
 */
public interface ObjectStorage {

    boolean exists(String uri);
}
