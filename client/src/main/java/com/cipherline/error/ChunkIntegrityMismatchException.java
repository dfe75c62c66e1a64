package com.cipherline.error;

public class ChunkIntegrityMismatchException extends E2eeException {

    private final int chunkIndex;

    public ChunkIntegrityMismatchException(int chunkIndex) {
        super("Chunk " + chunkIndex + " auth tag mismatch");
        this.chunkIndex = chunkIndex;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
