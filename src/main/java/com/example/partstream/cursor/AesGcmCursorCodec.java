package com.example.partstream.cursor;

import com.example.partstream.error.ConfigurationException;
import com.example.partstream.error.CursorExpiredException;
import com.example.partstream.error.CursorTooLargeException;
import com.example.partstream.error.InvalidCursorException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link CursorCodec} that seals the payload with AES-256-GCM.
 * <p>
 * The AES key is derived once from the application secret with PBKDF2-HMAC-SHA256 over a
 * fixed salt, so the raw secret never serves as a cipher key. The token layout is
 * {@code base64url(version | iv | ciphertext | tag)} without padding; the version byte is
 * bound into the authentication tag as associated data. The sealed JSON envelope is
 * {@code {"d": payload, "iat": issuedAtMillis, "ttl": ttlMillis}} where the last two are
 * present only for expiring cursors.
 * <p>
 * A {@link ThreadLocal} holds the {@link Cipher} to avoid re-creating it on every request.
 */
@Slf4j
public class AesGcmCursorCodec implements CursorCodec {

    static final byte VERSION = 1;

    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final byte[] KDF_SALT = "partstream-cursor-key-v1".getBytes(StandardCharsets.UTF_8);
    private static final int KDF_ITERATIONS = 100_000;
    private static final int KEY_BITS = 256;

    private static final String CIPHER = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final int HEADER_BYTES = 1 + IV_BYTES;
    private static final int MIN_TOKEN_BYTES = HEADER_BYTES + TAG_BITS / 8;

    private static final String FIELD_DATA = "d";
    private static final String FIELD_ISSUED_AT = "iat";
    private static final String FIELD_TTL = "ttl";

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final SecretKey key;
    private final Duration defaultTtl;
    private final int maxTokenLength;
    private final Clock clock;
    private final ObjectMapper mapper;
    private final SecureRandom random = new SecureRandom();
    private final ThreadLocal<Cipher> cipherHolder = new ThreadLocal<>();

    /**
     * @param secret         server-wide secret; must not be blank
     * @param defaultTtl     lifetime applied by {@link #encode(Map)}; {@code null} or zero means no expiry
     * @param maxTokenLength tokens longer than this are rejected before any decoding work
     * @param clock          time source for issue timestamps and expiry checks
     */
    public AesGcmCursorCodec(String secret, Duration defaultTtl, int maxTokenLength, Clock clock) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("a secret is required for cursor encryption (partstream.secret)");
        }
        if (maxTokenLength <= 0) {
            throw new ConfigurationException("max cursor size must be positive, got " + maxTokenLength);
        }
        if (defaultTtl != null && defaultTtl.isNegative()) {
            throw new ConfigurationException("cursor ttl must not be negative, got " + defaultTtl);
        }
        this.key = deriveKey(secret);
        this.defaultTtl = (defaultTtl == null || defaultTtl.isZero()) ? null : defaultTtl;
        this.maxTokenLength = maxTokenLength;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.mapper = new ObjectMapper().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    @Override
    public String encode(Map<String, ?> payload) {
        return encode(payload, defaultTtl);
    }

    @Override
    public String encode(Map<String, ?> payload, Duration ttl) {
        Objects.requireNonNull(payload, "payload");
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        Map<String, Object> envelope = new LinkedHashMap<>();
        envelope.put(FIELD_DATA, payload);
        if (ttl != null && !ttl.isZero()) {
            envelope.put(FIELD_ISSUED_AT, clock.millis());
            envelope.put(FIELD_TTL, ttl.toMillis());
        }

        byte[] plain;
        try {
            plain = mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cursor payload is not JSON-serializable", e);
        }

        byte[] iv = new byte[IV_BYTES];
        random.nextBytes(iv);
        byte[] sealed;
        try {
            Cipher cipher = cipher();
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            cipher.updateAAD(new byte[]{VERSION});
            sealed = cipher.doFinal(plain);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to seal cursor", e);
        }

        ByteBuffer token = ByteBuffer.allocate(HEADER_BYTES + sealed.length);
        token.put(VERSION).put(iv).put(sealed);
        String encoded = ENCODER.encodeToString(token.array());
        if (encoded.length() > maxTokenLength) {
            throw new CursorTooLargeException(encoded.length(), maxTokenLength);
        }
        return encoded;
    }

    @Override
    public Map<String, Object> decode(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCursorException("cursor is empty");
        }
        if (token.length() > maxTokenLength) {
            throw new InvalidCursorException("cursor length " + token.length() + " exceeds " + maxTokenLength);
        }

        byte[] raw;
        try {
            raw = DECODER.decode(token);
        } catch (IllegalArgumentException e) {
            throw new InvalidCursorException("cursor is not base64url", e);
        }
        // Base64 ignores unused trailing bits; insist on the one canonical spelling of the bytes
        if (!ENCODER.encodeToString(raw).equals(token)) {
            throw new InvalidCursorException("cursor is not canonically encoded");
        }
        if (raw.length < MIN_TOKEN_BYTES) {
            throw new InvalidCursorException("cursor is truncated");
        }
        if (raw[0] != VERSION) {
            throw new InvalidCursorException("unsupported cursor version " + raw[0]);
        }

        byte[] plain;
        try {
            Cipher cipher = cipher();
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, raw, 1, IV_BYTES));
            cipher.updateAAD(raw, 0, 1);
            plain = cipher.doFinal(raw, HEADER_BYTES, raw.length - HEADER_BYTES);
        } catch (AEADBadTagException e) {
            throw new InvalidCursorException("cursor failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new InvalidCursorException("cursor could not be decrypted", e);
        }

        JsonNode envelope;
        try {
            envelope = mapper.readTree(plain);
        } catch (IOException e) {
            throw new InvalidCursorException("cursor payload is not JSON", e);
        }
        if (envelope == null || !envelope.isObject() || !envelope.path(FIELD_DATA).isObject()) {
            throw new InvalidCursorException("cursor payload has an unexpected structure");
        }
        checkExpiry(envelope);
        return mapper.convertValue(envelope.get(FIELD_DATA), PAYLOAD_TYPE);
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public int maxTokenLength() {
        return maxTokenLength;
    }

    private void checkExpiry(JsonNode envelope) {
        JsonNode issuedAt = envelope.get(FIELD_ISSUED_AT);
        if (issuedAt == null || issuedAt.isNull()) {
            return;
        }
        if (!issuedAt.isIntegralNumber()) {
            throw new InvalidCursorException("cursor issue timestamp is not an integer");
        }
        Duration limit = effectiveTtl(envelope.get(FIELD_TTL));
        if (limit == null) {
            return;
        }
        Duration age = Duration.ofMillis(clock.millis() - issuedAt.asLong());
        if (age.compareTo(limit) > 0) {
            log.debug("Rejecting cursor issued {}ms ago (ttl {}ms)", age.toMillis(), limit.toMillis());
            throw new CursorExpiredException(age, limit);
        }
    }

    /** The sealed ttl, tightened by this codec's default ttl when both exist. */
    private Duration effectiveTtl(JsonNode sealedTtl) {
        Duration limit = null;
        if (sealedTtl != null && !sealedTtl.isNull()) {
            if (!sealedTtl.isIntegralNumber()) {
                throw new InvalidCursorException("cursor ttl is not an integer");
            }
            limit = Duration.ofMillis(sealedTtl.asLong());
        }
        if (defaultTtl != null && (limit == null || defaultTtl.compareTo(limit) < 0)) {
            limit = defaultTtl;
        }
        return limit;
    }

    private Cipher cipher() throws GeneralSecurityException {
        Cipher c = cipherHolder.get();
        if (c == null) {
            c = Cipher.getInstance(CIPHER);
            cipherHolder.set(c);
        }
        return c;
    }

    private static SecretKey deriveKey(String secret) {
        PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), KDF_SALT, KDF_ITERATIONS, KEY_BITS);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            byte[] material = factory.generateSecret(spec).getEncoded();
            return new SecretKeySpec(material, "AES");
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to derive cursor key with " + KDF_ALGORITHM, e);
        } finally {
            spec.clearPassword();
        }
    }
}
