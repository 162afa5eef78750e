package io.github.rowbase.hashid;

import io.github.rowbase.exception.CryptoConfigException;
import io.github.rowbase.exception.CryptoIntegrityException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Keyed, authenticated obfuscation of numeric row ids, making it infeasible to enumerate
 * a table by iterating its autoincrement keys.
 *
 * <p>A token is {@code ivSeed || base62(ciphertext) || base62(tag)}. The iv-seed is
 * {@code ceil(minLength/2)} characters of nonce, either random or derived from the cell seed
 * when static ids are wanted. The AES-GCM iv is derived from the iv-seed with HMAC-SHA256, so
 * the token carries everything needed to decode it apart from the key. The tag is always
 * {@value #TAG_WIDTH} characters wide.</p>
 *
 * <p>Instances are immutable and thread safe.</p>
 */
public final class IdCodec {

    public static final int MIN_LENGTH = 12;
    public static final int MAX_LENGTH = 42;

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 16;
    private static final int TAG_BYTES = 16;
    private static final int TAG_WIDTH = 22;
    private static final int NONCE_BYTES = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SecretKeySpec cipherKey;
    private final SecretKeySpec macKey;
    private final String domainId;
    private final int minLength;
    private final int seedLength;
    private final boolean staticIds;

    /**
     * @param hexKey 16 byte AES key as 32 hex characters
     * @param domainId id of the domain in which row ids are unique, e.g. the database name
     * @param minLength minimum token length, between {@value #MIN_LENGTH} and {@value #MAX_LENGTH}
     * @param staticIds whether a cell always gets the same token
     * @throws CryptoConfigException on an invalid key or length
     */
    public IdCodec(String hexKey, String domainId, int minLength, boolean staticIds) {
        if (minLength < MIN_LENGTH || minLength > MAX_LENGTH) {
            throw new CryptoConfigException("Id codec min length " + minLength + " needs to be between "
                    + MIN_LENGTH + " and " + MAX_LENGTH);
        }
        if (hexKey == null || hexKey.length() != 32) {
            throw new CryptoConfigException("Id codec key needs to be a 32 character hex string");
        }
        byte[] key;
        try {
            key = HexFormat.of().parseHex(hexKey);
        } catch (IllegalArgumentException e) {
            throw new CryptoConfigException("Id codec key needs to be a 32 character hex string", e);
        }
        this.cipherKey = new SecretKeySpec(key, "AES");
        this.macKey = new SecretKeySpec(key, HMAC_ALGORITHM);
        this.domainId = domainId == null ? "" : domainId;
        this.minLength = minLength;
        this.seedLength = (minLength + 1) / 2;
        this.staticIds = staticIds;
    }

    public int getMinLength() {
        return minLength;
    }

    public boolean isStaticIds() {
        return staticIds;
    }

    /**
     * Encode an id.
     *
     * @param id id text, must not contain a space
     * @param cellSeed seed unique to the cell, e.g. field name and primary key values; only used
     *                 for static ids
     */
    public String encode(String id, String cellSeed) {
        String nonce;
        if (staticIds) {
            nonce = Base62.encode(hmac(domainId + " " + cellSeed));
        } else {
            byte[] random = new byte[NONCE_BYTES];
            RANDOM.nextBytes(random);
            nonce = Base62.encode(random);
        }
        String ivSeed = nonce.substring(0, seedLength);

        String plaintext = id;
        if (plaintext.length() < seedLength) {
            plaintext += " " + nonce.substring(nonce.length() - (seedLength - plaintext.length() - 1));
        }
        byte[] sealed = crypt(Cipher.ENCRYPT_MODE, deriveIv(ivSeed), plaintext.getBytes(StandardCharsets.UTF_8));
        byte[] ciphertext = Arrays.copyOfRange(sealed, 0, sealed.length - TAG_BYTES);
        byte[] tag = Arrays.copyOfRange(sealed, sealed.length - TAG_BYTES, sealed.length);
        return ivSeed + Base62.encode(ciphertext) + Base62.encodeFixed(tag, TAG_WIDTH);
    }

    /**
     * Decode a token back to the id.
     *
     * @throws CryptoIntegrityException if the token is malformed or fails authentication
     */
    public String decode(String token) {
        if (token == null || token.length() < seedLength + TAG_WIDTH + 1) {
            throw new CryptoIntegrityException("Invalid id '" + token + "'");
        }
        String ivSeed = token.substring(0, seedLength);
        byte[] ciphertext;
        byte[] tag;
        try {
            ciphertext = Base62.decode(token.substring(seedLength, token.length() - TAG_WIDTH));
            tag = Base62.decodeFixed(token.substring(token.length() - TAG_WIDTH), TAG_BYTES);
            for (int i = 0; i < ivSeed.length(); i++) {
                if (Base62.ALPHABET.indexOf(ivSeed.charAt(i)) < 0) {
                    throw new IllegalArgumentException("Invalid symbol '" + ivSeed.charAt(i) + "'");
                }
            }
        } catch (IllegalArgumentException e) {
            throw new CryptoIntegrityException("Invalid id '" + token + "'", e);
        }
        byte[] sealed = new byte[ciphertext.length + TAG_BYTES];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, TAG_BYTES);

        String plaintext;
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, cipherKey, new GCMParameterSpec(TAG_BYTES * 8, deriveIv(ivSeed)));
            plaintext = new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new CryptoIntegrityException("Id '" + token + "' failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new CryptoIntegrityException("Id '" + token + "' could not be decrypted", e);
        }
        int separator = plaintext.indexOf(' ');
        return separator < 0 ? plaintext : plaintext.substring(0, separator);
    }

    private byte[] deriveIv(String ivSeed) {
        return Arrays.copyOf(hmac(domainId + " " + ivSeed), IV_BYTES);
    }

    private byte[] hmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(macKey);
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    private byte[] crypt(int mode, byte[] iv, byte[] input) {
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_ALGORITHM);
            cipher.init(mode, cipherKey, new GCMParameterSpec(TAG_BYTES * 8, iv));
            return cipher.doFinal(input);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM not available", e);
        }
    }
}
