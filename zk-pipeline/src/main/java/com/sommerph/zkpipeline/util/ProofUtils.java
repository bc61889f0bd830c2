package com.sommerph.zkpipeline.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Optional;

public class ProofUtils {

    private ProofUtils() {
    }

    public static String sha256Hex(byte[] data) {
        SHA256Digest digest = new SHA256Digest();
        digest.update(data, 0, data.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return Hex.toHexString(out);
    }

    /**
     * Reads the first public instance of a proof. Instances are field elements serialized as
     * little-endian hex, so the byte order is reversed before parsing.
     */
    public static Optional<BigInteger> firstPublicInput(JsonNode proof) {
        JsonNode instance = proof.path("instances").path(0).path(0);
        if (!instance.isTextual()) {
            return Optional.empty();
        }
        String hex = instance.asText();
        if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        if (hex.isEmpty()) {
            return Optional.empty();
        }
        if (hex.length() % 2 != 0) {
            hex = "0" + hex;
        }
        try {
            byte[] bytes = Hex.decode(hex);
            for (int i = 0, j = bytes.length - 1; i < j; i++, j--) {
                byte tmp = bytes[i];
                bytes[i] = bytes[j];
                bytes[j] = tmp;
            }
            return Optional.of(new BigInteger(1, bytes));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    public static String addressToFilename(String address) {
        if (address.startsWith("0x") || address.startsWith("0X")) {
            return address.substring(2);
        }
        return address;
    }

}
