package com.certmanager.service;

@FunctionalInterface
public interface ProgressListener {
    void onProgress(double percent, String message);
}
