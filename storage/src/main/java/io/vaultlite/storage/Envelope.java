// file: src/main/java/io/vaultlite/storage/Envelope.java
package io.vaultlite.storage;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Authenticated framing around a serialized database.
 * <p>
 * Layout (big-endian):
 * <p>
 *   [HEADER (39 bytes)]
 *     - magic   (2B)  = 0x5AFE
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - tag     (32B) = HMAC-SHA256(key, magic | version | length | payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 * <p>
 * The tag covers the header fields as well, so a flipped version or length
 * byte fails authentication instead of being misread. Confidentiality is
 * the job of the encryption layer wrapped around this one, not of the envelope.
 */
final class Envelope {
    static final short MAGIC = (short) 0x5AFE;
    static final byte VERSION = 1;
    static final int TAG_LENGTH = 32;
    static final int HEADER_LENGTH = 2 + 1 + 4 + TAG_LENGTH;

    private static final String MAC_ALGORITHM = "HmacSHA256";

    private Envelope() {
    }

    /** Frame and authenticate a payload. */
    static byte[] seal(byte[] payload, DatabaseKey key) {
        byte[] tag = tag(MAGIC, VERSION, payload.length, payload, key);
        ByteBuffer out = ByteBuffer.allocate(HEADER_LENGTH + payload.length).order(ByteOrder.BIG_ENDIAN);
        out.putShort(MAGIC).put(VERSION).putInt(payload.length).put(tag).put(payload);
        return out.array();
    }

    /**
     * Validate magic, version, length and tag, then return the payload.
     *
     * @throws DecodeException on any mismatch.
     */
    static byte[] open(byte[] bytes, DatabaseKey key) {
        if (bytes == null || bytes.length < HEADER_LENGTH) {
            throw new DecodeException(DecodeException.Reason.TRUNCATED,
                    "need at least " + HEADER_LENGTH + " header bytes");
        }
        ByteBuffer in = ByteBuffer.wrap(bytes).order(ByteOrder.BIG_ENDIAN);
        short magic = in.getShort();
        if (magic != MAGIC) {
            throw new DecodeException(DecodeException.Reason.BAD_MAGIC,
                    String.format("expected 0x%04X but found 0x%04X", MAGIC, magic));
        }
        byte version = in.get();
        if (version != VERSION) {
            throw new DecodeException(DecodeException.Reason.UNSUPPORTED_VERSION, "version " + version);
        }
        int length = in.getInt();
        if (length < 0 || length != bytes.length - HEADER_LENGTH) {
            throw new DecodeException(DecodeException.Reason.TRUNCATED,
                    "declared payload length " + length + " but " + (bytes.length - HEADER_LENGTH) + " bytes follow");
        }
        byte[] tag = new byte[TAG_LENGTH];
        in.get(tag);
        byte[] payload = new byte[length];
        in.get(payload);

        if (!MessageDigest.isEqual(tag, tag(magic, version, length, payload, key))) {
            throw new DecodeException(DecodeException.Reason.AUTHENTICATION_FAILED,
                    "wrong key or modified data");
        }
        return payload;
    }

    private static byte[] tag(short magic, byte version, int length, byte[] payload, DatabaseKey key) {
        try {
            Mac mac = Mac.getInstance(MAC_ALGORITHM);
            mac.init(new SecretKeySpec(key.material(), MAC_ALGORITHM));
            mac.update(ByteBuffer.allocate(7).order(ByteOrder.BIG_ENDIAN)
                    .putShort(magic).put(version).putInt(length).array());
            mac.update(payload);
            return mac.doFinal();
        } catch (GeneralSecurityException e) {
            // HmacSHA256 is mandatory on every Java platform.
            throw new IllegalStateException("HMAC unavailable", e);
        }
    }
}
