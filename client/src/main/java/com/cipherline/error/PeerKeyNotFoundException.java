package com.cipherline.error;

/**
 * The directory has no published key for a user (HTTP 404), or the user is
 * in the negative cache from an earlier 404.
 */
public class PeerKeyNotFoundException extends E2eeException {

    private final String userId;

    public PeerKeyNotFoundException(String userId) {
        this(userId, "No published key for user: " + userId);
    }

    public PeerKeyNotFoundException(String userId, String message) {
        super(message);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
