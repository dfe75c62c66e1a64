package com.cipherline.backup;

import com.cipherline.directory.ApiResponse;
import com.cipherline.directory.AuthorizedHttp;
import org.springframework.core.ParameterizedTypeReference;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * {@code GET /keys/backup/check}, {@code POST /keys/backup} and {@code GET /keys/backup}.
 */
public class HttpBackupStorage implements BackupStorage {

    private static final ParameterizedTypeReference<ApiResponse<BackupCheck>> CHECK_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiResponse<Object>> UPLOAD_RESPONSE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<ApiResponse<BackupBlob>> BACKUP_RESPONSE =
            new ParameterizedTypeReference<>() {};

    private final AuthorizedHttp http;

    public HttpBackupStorage(AuthorizedHttp http) {
        this.http = http;
    }

    @Override
    public Mono<Boolean> hasBackup() {
        return http.get(CHECK_RESPONSE, "/keys/backup/check")
                .map(response -> response.success() && response.data() != null && response.data().hasBackup())
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> upload(BackupBlob blob) {
        return http.post(Map.of("backup", blob), UPLOAD_RESPONSE, "/keys/backup")
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Backup endpoint not found")))
                .flatMap(response -> response.success()
                        ? Mono.<Void>empty()
                        : Mono.error(new IllegalStateException(
                                response.error() != null ? response.error() : "Failed to store backup")));
    }

    @Override
    public Mono<BackupBlob> download() {
        return http.get(BACKUP_RESPONSE, "/keys/backup")
                .filter(response -> response.success() && response.data() != null)
                .map(ApiResponse::data);
    }

    record BackupCheck(boolean hasBackup) {}
}
