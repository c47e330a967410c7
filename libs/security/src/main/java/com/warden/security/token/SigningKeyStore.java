package com.warden.security.token;

import java.util.Optional;

/**
 * Source of token keys. New tokens are always signed with {@link #current()}; verification
 * accepts any key the store still knows.
 */
public interface SigningKeyStore {

    SigningKey current();

    Optional<SigningKey> find(String keyId);
}
