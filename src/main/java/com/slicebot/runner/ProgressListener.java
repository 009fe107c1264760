package com.slicebot.runner;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = event -> {
    };

    void onProgress(RetrievalProgress event);
}
