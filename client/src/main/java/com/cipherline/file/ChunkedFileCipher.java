package com.cipherline.file;

import com.cipherline.crypto.CryptoPrimitives;
import com.cipherline.error.ChunkIntegrityMismatchException;
import com.cipherline.error.MasterIntegrityMismatchException;
import com.cipherline.error.MissingKeyException;
import com.cipherline.file.EncryptionProgress.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Encrypts large files as a sequence of independently authenticated chunks.
 *
 * <p>Each chunk is AES-256-CBC with its own IV and an HMAC-SHA256 tag over
 * {@code fileId:index:iv:ciphertext}. A master tag over the ordered chunk tags
 * binds the chunk count and order, so dropping, duplicating or reordering
 * chunks is detected before any plaintext is produced.
 *
 * <p>The encryption key is SHA-256 of the supplied key material and the MAC
 * key is SHA-256 of a fixed label followed by the key material, so the two
 * are independent.
 *
 * <p>Chunks are processed one at a time on the supplied scheduler. Disposing
 * the subscription stops work at the next chunk boundary and closes the source.
 */
public class ChunkedFileCipher {

    private static final Logger log = LoggerFactory.getLogger(ChunkedFileCipher.class);

    static final byte[] MAC_LABEL = "cipherline-file-mac".getBytes(StandardCharsets.UTF_8);

    private final int chunkSize;
    private final Scheduler scheduler;

    public ChunkedFileCipher(int chunkSize, Scheduler scheduler) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        this.chunkSize = chunkSize;
        this.scheduler = scheduler;
    }

    public int chunkSize() {
        return chunkSize;
    }

    /** {@code ceil(size / chunkSize)}, and 1 for an empty file. */
    public int chunkCount(long size) {
        if (size == 0) {
            return 1;
        }
        return (int) ((size + chunkSize - 1) / chunkSize);
    }

    // ── Encrypt ───────────────────────────────────────────────────────────────

    public Mono<ChunkedFile> encrypt(Path file, String fileName, byte[] keyMaterial, ProgressListener listener) {
        return Mono.fromCallable(() -> Files.size(file))
                .subscribeOn(scheduler)
                .flatMap(size -> Mono.using(
                        () -> Files.newInputStream(file),
                        in -> encrypt(in, size, fileName, keyMaterial, listener),
                        ChunkedFileCipher::close));
    }

    public Mono<ChunkedFile> encrypt(byte[] data, String fileName, byte[] keyMaterial, ProgressListener listener) {
        return encrypt(new ByteArrayInputStream(data), data.length, fileName, keyMaterial, listener);
    }

    /**
     * Reads exactly {@code size} bytes from {@code in}. The stream is not closed.
     */
    public Mono<ChunkedFile> encrypt(InputStream in, long size, String fileName, byte[] keyMaterial,
                                     ProgressListener listener) {
        return Mono.defer(() -> {
            FileKeys keys = FileKeys.derive(keyMaterial);
            String fileId = UUID.randomUUID().toString();
            int total = chunkCount(size);
            log.debug("Encrypting {} ({} bytes) as {} chunks, fileId={}", fileName, size, total, fileId);
            listener.onProgress(new EncryptionProgress(Phase.READING, 0, total, 0, 0, size));

            return Flux.range(0, total)
                    .concatMap(index -> Mono.fromCallable(() -> sealChunk(in, index, size, fileId, keys))
                            .subscribeOn(scheduler)
                            .doOnNext(chunk -> listener.onProgress(
                                    progress(Phase.ENCRYPTING, index, total, size))))
                    .collectList()
                    .map(chunks -> assemble(fileId, fileName, size, chunks, keys))
                    .doOnNext(encrypted -> {
                        listener.onProgress(new EncryptionProgress(Phase.FINALIZING, total, total, 100, size, size));
                        log.info("Encrypted {} into {} chunks, fileId={}", fileName, total, fileId);
                    });
        });
    }

    private EncryptedChunk sealChunk(InputStream in, int index, long size, String fileId, FileKeys keys)
            throws IOException {
        int length = (int) Math.min(chunkSize, size - (long) index * chunkSize);
        byte[] plaintext = in.readNBytes(length);
        if (plaintext.length != length) {
            throw new IOException("Input ended early at chunk " + index + ": expected "
                    + length + " bytes, read " + plaintext.length);
        }
        byte[] iv = CryptoPrimitives.randomBytes(CryptoPrimitives.BLOCK_IV_SIZE);
        String encryptedData = CryptoPrimitives.toBase64(CryptoPrimitives.aesCbcEncrypt(keys.encKey(), iv, plaintext));
        String encodedIv = CryptoPrimitives.toBase64(iv);
        String tag = chunkTag(keys.macKey(), fileId, index, encodedIv, encryptedData);
        return new EncryptedChunk(index, encodedIv, tag, encryptedData,
                length, encryptedData.length());
    }

    private static ChunkedFile assemble(String fileId, String fileName, long size,
                                        List<EncryptedChunk> chunks, FileKeys keys) {
        List<String> tags = new ArrayList<>(chunks.size());
        long encryptedSize = 0;
        for (EncryptedChunk chunk : chunks) {
            tags.add(chunk.authTag());
            encryptedSize += chunk.encryptedSize();
        }
        String masterIv = CryptoPrimitives.toBase64(CryptoPrimitives.randomBytes(CryptoPrimitives.BLOCK_IV_SIZE));
        return new ChunkedFile(fileId, fileName, MimeTypes.forFileName(fileName), chunks.size(), size,
                encryptedSize, masterIv, masterTag(keys.macKey(), fileId, tags), chunks);
    }

    // ── Decrypt ───────────────────────────────────────────────────────────────

    /**
     * Verifies and decrypts the whole file into memory. Nothing is emitted
     * unless every tag checks out.
     */
    public Mono<byte[]> decrypt(ChunkedFile file, byte[] keyMaterial, ProgressListener listener) {
        return decryptChunks(file, keyMaterial, listener)
                .collect(ByteArrayOutputStream::new, ByteArrayOutputStream::writeBytes)
                .map(ByteArrayOutputStream::toByteArray);
    }

    /**
     * Verifies and decrypts to {@code target}. Output goes to a sibling
     * {@code .part} file that is moved into place only after the last chunk
     * verifies, and deleted on failure or cancellation.
     */
    public Mono<Path> decryptToFile(ChunkedFile file, byte[] keyMaterial, Path target, ProgressListener listener) {
        return Mono.defer(() -> {
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            return Mono.using(
                            () -> Files.newOutputStream(partial),
                            out -> decryptChunks(file, keyMaterial, listener)
                                    .concatMap(bytes -> write(out, bytes))
                                    .then(),
                            ChunkedFileCipher::close)
                    .then(Mono.fromCallable(() -> Files.move(partial, target,
                                    StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE))
                            .subscribeOn(scheduler))
                    .doOnError(e -> deletePartial(partial))
                    .doOnCancel(() -> deletePartial(partial));
        });
    }

    private Flux<byte[]> decryptChunks(ChunkedFile file, byte[] keyMaterial, ProgressListener listener) {
        return Flux.defer(() -> {
            FileKeys keys = FileKeys.derive(keyMaterial);
            List<EncryptedChunk> chunks = file.chunks();
            int total = chunks.size();
            listener.onProgress(new EncryptionProgress(Phase.VERIFYING, 0, total, 0, 0, file.originalSize()));

            if (total != file.totalChunks()) {
                return Flux.error(new MasterIntegrityMismatchException(
                        "Expected " + file.totalChunks() + " chunks, found " + total));
            }
            List<String> tags = new ArrayList<>(total);
            for (EncryptedChunk chunk : chunks) {
                tags.add(chunk.authTag());
            }
            String expected = masterTag(keys.macKey(), file.fileId(), tags);
            if (!CryptoPrimitives.tagsEqual(expected, file.masterAuthTag())) {
                log.warn("Master tag mismatch for fileId={}", file.fileId());
                return Flux.error(new MasterIntegrityMismatchException("Master auth tag mismatch"));
            }

            return Flux.range(0, total)
                    .concatMap(position -> Mono.fromCallable(() -> openChunk(file.fileId(), chunks.get(position), position, keys))
                            .subscribeOn(scheduler)
                            .doOnNext(bytes -> listener.onProgress(
                                    progress(Phase.DECRYPTING, position, total, file.originalSize()))))
                    .doOnComplete(() -> {
                        listener.onProgress(new EncryptionProgress(Phase.FINALIZING, total, total, 100,
                                file.originalSize(), file.originalSize()));
                        log.info("Decrypted fileId={} ({} chunks)", file.fileId(), total);
                    });
        });
    }

    private static byte[] openChunk(String fileId, EncryptedChunk chunk, int position, FileKeys keys) {
        if (chunk.index() != position) {
            throw new ChunkIntegrityMismatchException(position);
        }
        String expected = chunkTag(keys.macKey(), fileId, chunk.index(), chunk.iv(), chunk.encryptedData());
        if (!CryptoPrimitives.tagsEqual(expected, chunk.authTag())) {
            log.warn("Chunk {} tag mismatch for fileId={}", chunk.index(), fileId);
            throw new ChunkIntegrityMismatchException(chunk.index());
        }
        byte[] plaintext;
        try {
            byte[] iv = CryptoPrimitives.fromBase64(chunk.iv());
            byte[] ciphertext = CryptoPrimitives.fromBase64(chunk.encryptedData());
            plaintext = CryptoPrimitives.aesCbcDecrypt(keys.encKey(), iv, ciphertext);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new ChunkIntegrityMismatchException(chunk.index());
        }
        if (plaintext.length != chunk.originalSize()) {
            throw new ChunkIntegrityMismatchException(chunk.index());
        }
        return plaintext;
    }

    // ── Tags ──────────────────────────────────────────────────────────────────

    /** HMAC over fileId, index, IV and ciphertext, hex encoded. */
    static String chunkTag(byte[] macKey, String fileId, int index, String iv, String encryptedData) {
        return CryptoPrimitives.toHex(CryptoPrimitives.hmacSha256(macKey,
                fileId + ":" + index + ":" + iv + ":" + encryptedData));
    }

    static String masterTag(byte[] macKey, String fileId, List<String> chunkTags) {
        return CryptoPrimitives.toHex(CryptoPrimitives.hmacSha256(macKey,
                fileId + ":master:" + String.join(":", chunkTags)));
    }

    private EncryptionProgress progress(Phase phase, int index, int total, long totalBytes) {
        double percentage = 10 + ((double) (index + 1) / total) * 85;
        long processed = Math.min(totalBytes, (long) (index + 1) * chunkSize);
        return new EncryptionProgress(phase, index + 1, total, percentage, processed, totalBytes);
    }

    private Mono<Integer> write(OutputStream out, byte[] bytes) {
        return Mono.fromCallable(() -> {
            out.write(bytes);
            return bytes.length;
        }).subscribeOn(scheduler);
    }

    private static void deletePartial(Path partial) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            log.warn("Could not delete partial output {}: {}", partial, e.getMessage());
        }
    }

    private static void close(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("Failed to close stream: {}", e.getMessage());
        }
    }

    private record FileKeys(byte[] encKey, byte[] macKey) {

        static FileKeys derive(byte[] keyMaterial) {
            if (keyMaterial == null || keyMaterial.length == 0) {
                throw new MissingKeyException("File key material is missing");
            }
            return new FileKeys(CryptoPrimitives.sha256(keyMaterial), CryptoPrimitives.sha256(MAC_LABEL, keyMaterial));
        }
    }
}
