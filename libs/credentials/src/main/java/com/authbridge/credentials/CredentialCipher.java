package com.authbridge.credentials;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * Symmetric encryption of passwords kept in the credential cache.
 * <p>
 * Scheme: key = MD5(passphrase) (16 bytes, AES-128), a fresh random 16-byte IV per call,
 * AES in CFB mode with 8-bit segments, output = base64(IV || ciphertext).
 * <p>
 * There is no salt and no authentication tag. The cache store is treated as a trusted
 * boundary; this only keeps passwords from sitting in it in clear text.
 */
public final class CredentialCipher {

    /** AES block size, also the IV length. */
    public static final int BLOCK_SIZE = 16;

    private static final String TRANSFORMATION = "AES/CFB8/NoPadding";
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] passphrase;

    /**
     * Creates a cipher bound to the given passphrase.
     *
     * @param passphrase the secret key configured for the bridge (may be empty, never null)
     */
    public CredentialCipher(String passphrase) {
        if (passphrase == null) {
            throw new IllegalArgumentException("passphrase must not be null");
        }
        this.passphrase = passphrase.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encrypts a password with this cipher's passphrase.
     *
     * @return base64 text safe to store in the cache
     */
    public String encryptPassword(String password) {
        byte[] encoded = encrypt(password.getBytes(StandardCharsets.UTF_8), passphrase);
        return new String(encoded, StandardCharsets.US_ASCII);
    }

    /**
     * Decrypts a value produced by {@link #encryptPassword(String)}.
     *
     * @throws DecryptionException if the value is malformed or was encrypted under another key
     */
    public String decryptPassword(String encoded) {
        if (encoded == null) {
            throw new DecryptionException("encrypted value is null");
        }
        byte[] plaintext = decrypt(encoded.getBytes(StandardCharsets.US_ASCII), passphrase);
        return new String(plaintext, StandardCharsets.UTF_8);
    }

    /**
     * Encrypts {@code plaintext} under a key derived from {@code passphraseKey}.
     *
     * @return base64 of {@code IV || ciphertext}
     * @throws EncryptionException if the JCE rejects the operation
     */
    public static byte[] encrypt(byte[] plaintext, byte[] passphraseKey) {
        byte[] iv = new byte[BLOCK_SIZE];
        RANDOM.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, deriveKey(passphraseKey), new IvParameterSpec(iv));
            byte[] body = cipher.doFinal(plaintext);

            byte[] out = new byte[BLOCK_SIZE + body.length];
            System.arraycopy(iv, 0, out, 0, BLOCK_SIZE);
            System.arraycopy(body, 0, out, BLOCK_SIZE, body.length);
            return Base64.getEncoder().encode(out);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to encrypt credential", e);
        }
    }

    /**
     * Reverses {@link #encrypt(byte[], byte[])}.
     *
     * @throws DecryptionException if the input is not base64, is shorter than one block,
     *                             or the JCE rejects the operation
     */
    public static byte[] decrypt(byte[] encoded, byte[] passphraseKey) {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted credential is not valid base64", e);
        }
        if (raw.length < BLOCK_SIZE) {
            throw new DecryptionException(
                    "Encrypted credential is shorter than one block (" + raw.length + " bytes)");
        }
        byte[] iv = Arrays.copyOfRange(raw, 0, BLOCK_SIZE);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, deriveKey(passphraseKey), new IvParameterSpec(iv));
            return cipher.doFinal(raw, BLOCK_SIZE, raw.length - BLOCK_SIZE);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt credential", e);
        }
    }

    private static SecretKeySpec deriveKey(byte[] passphraseKey) throws NoSuchAlgorithmException {
        byte[] digest = MessageDigest.getInstance("MD5").digest(passphraseKey);
        return new SecretKeySpec(digest, "AES");
    }
}
