package com.delta.autoapply.apply.flow;

@FunctionalInterface
public interface ProgressListener {
    void onProgress(String message);

    static ProgressListener none() {
        return message -> {
        };
    }
}
