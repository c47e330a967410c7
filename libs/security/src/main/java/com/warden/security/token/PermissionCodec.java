package com.warden.security.token;

import com.warden.security.Permission;

import java.util.Base64;
import java.util.BitSet;
import java.util.EnumSet;
import java.util.Set;

/**
 * Packs a permission set into the {@code perms} claim: the bit of every granted permission set
 * in a little-endian bitset, base64url encoded. The claim stays a few characters long no matter
 * how many permissions are granted.
 */
final class PermissionCodec {

    private PermissionCodec() {
        // utility class
    }

    static String encode(Set<Permission> permissions) {
        BitSet bits = new BitSet();
        permissions.forEach(p -> bits.set(p.bit()));
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bits.toByteArray());
    }

    /**
     * @throws IllegalArgumentException for malformed input or an unknown bit
     */
    static Set<Permission> decode(String encoded) {
        Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        if (encoded == null || encoded.isEmpty()) {
            return permissions;
        }
        BitSet bits = BitSet.valueOf(Base64.getUrlDecoder().decode(encoded));
        for (int i = bits.nextSetBit(0); i >= 0; i = bits.nextSetBit(i + 1)) {
            int bit = i;
            permissions.add(Permission.fromBit(bit)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown permission bit: " + bit)));
        }
        return permissions;
    }
}
