package bastion.core.service.auth;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

/**
 * AES-256-GCM with a fresh IV per message.
 *
 * <p>Output layout, Base64url without padding:
 * {@code keyIdLength(1) | keyId | iv(12) | ciphertext+tag}. The key id travels in the
 * clear so a reader can pick the right key after rotation.
 */
public final class AesGcmCipher {

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKey key;
    private final String keyId;

    public AesGcmCipher(SecretKey key, String keyId) {
        if (key.getEncoded() == null || key.getEncoded().length != 32) {
            throw new IllegalArgumentException("AES key must be 256 bits (32 bytes)");
        }
        final var keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);
        if (keyIdBytes.length == 0 || keyIdBytes.length > 255) {
            throw new IllegalArgumentException("Key ID must be between 1 and 255 bytes");
        }
        this.key = key;
        this.keyId = keyId;
    }

    public String keyId() {
        return keyId;
    }

    /**
     * Encrypt and authenticate a message.
     *
     * @param plaintext      message
     * @param associatedData authenticated but unencrypted context, may be empty
     */
    public String encrypt(byte[] plaintext, byte[] associatedData) {
        try {
            final byte[] iv = new byte[IV_LENGTH];
            RANDOM.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            cipher.updateAAD(associatedData);
            final byte[] ciphertext = cipher.doFinal(plaintext);
            final byte[] keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Decrypt a message produced by {@link #encrypt}.
     *
     * @throws GeneralSecurityException if the message is malformed, was encrypted under
     *     another key id, or fails authentication
     */
    public byte[] decrypt(String encoded, byte[] associatedData) throws GeneralSecurityException {
        final Envelope envelope = parse(encoded);
        if (!keyId.equals(envelope.keyId())) {
            throw new GeneralSecurityException("Key ID mismatch: " + envelope.keyId());
        }
        final Cipher cipher = Cipher.getInstance(ALGORITHM);
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, envelope.iv()));
        cipher.updateAAD(associatedData);
        return cipher.doFinal(envelope.ciphertext());
    }

    private static Envelope parse(String encoded) throws GeneralSecurityException {
        try {
            final ByteBuffer buffer = ByteBuffer.wrap(Base64.getUrlDecoder().decode(encoded));
            final int keyIdLength = buffer.get() & 0xFF;
            final byte[] keyIdBytes = new byte[keyIdLength];
            buffer.get(keyIdBytes);
            final byte[] iv = new byte[IV_LENGTH];
            buffer.get(iv);
            if (buffer.remaining() < TAG_LENGTH_BITS / 8) {
                throw new GeneralSecurityException("Ciphertext too short");
            }
            final byte[] ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);
            return new Envelope(new String(keyIdBytes, StandardCharsets.UTF_8), iv, ciphertext);
        } catch (IllegalArgumentException | BufferUnderflowException e) {
            throw new GeneralSecurityException("Malformed ciphertext", e);
        }
    }

    private record Envelope(String keyId, byte[] iv, byte[] ciphertext) {}
}
