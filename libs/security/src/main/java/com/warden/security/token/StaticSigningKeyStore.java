package com.warden.security.token;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed key set: one signing key plus retired keys that still verify tokens issued before a
 * rotation.
 */
public class StaticSigningKeyStore implements SigningKeyStore {

    private final SigningKey current;
    private final Map<String, SigningKey> keys;

    public StaticSigningKeyStore(SigningKey current, List<SigningKey> previous) {
        if (current == null) {
            throw new IllegalArgumentException("current key must not be null");
        }
        Map<String, SigningKey> all = new LinkedHashMap<>();
        all.put(current.id(), current);
        for (SigningKey key : previous) {
            if (all.putIfAbsent(key.id(), key) != null) {
                throw new IllegalArgumentException("Duplicate signing key id: " + key.id());
            }
        }
        this.current = current;
        this.keys = Map.copyOf(all);
    }

    public StaticSigningKeyStore(SigningKey current) {
        this(current, List.of());
    }

    @Override
    public SigningKey current() {
        return current;
    }

    @Override
    public Optional<SigningKey> find(String keyId) {
        return keyId == null ? Optional.empty() : Optional.ofNullable(keys.get(keyId));
    }
}
