package com.cipherline.file;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(EncryptionProgress progress);
}
