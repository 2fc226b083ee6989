package com.qoeboost.api.security;

import com.qoeboost.api.exception.ValidationFailedException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PasswordHasherTest {

    private final PasswordHasher hasher = new PasswordHasher();

    @Test
    void sameInputHashesDifferentlyButBothVerify() {
        String first = hasher.hash("correct horse battery");
        String second = hasher.hash("correct horse battery");

        assertNotEquals(first, second);
        assertTrue(hasher.verify("correct horse battery", first));
        assertTrue(hasher.verify("correct horse battery", second));
    }

    @Test
    void hashNeverContainsThePassword() {
        String hash = hasher.hash("plaintext-password");

        assertFalse(hash.contains("plaintext-password"));
        assertTrue(hash.startsWith("$2"));
    }

    @Test
    void wrongPasswordFails() {
        String hash = hasher.hash("right-password");

        assertFalse(hasher.verify("wrong-password", hash));
        assertFalse(hasher.verify("", hash));
    }

    @Test
    void malformedHashReturnsFalseInsteadOfThrowing() {
        assertFalse(hasher.verify("anything", null));
        assertFalse(hasher.verify("anything", ""));
        assertFalse(hasher.verify("anything", "   "));
        assertFalse(hasher.verify("anything", "not-a-bcrypt-hash"));
        assertFalse(hasher.verify("anything", "$2a$10$tooShort"));
        assertFalse(hasher.verify(null, hasher.hash("anything")));
    }

    @Test
    void multibytePasswordBeyondSeventyTwoBytesIsRefused() {
        String prefix = "\u00e9".repeat(36);
        String password = prefix + "correct";
        assertEquals(43, password.length());

        ValidationFailedException ex = assertThrows(ValidationFailedException.class, () -> hasher.hash(password));
        assertEquals("password", ex.getField());

        String atLimit = "\u00e9".repeat(36);
        String hash = hasher.hash(atLimit);
        assertTrue(hasher.verify(atLimit, hash));
        assertFalse(hasher.verify(prefix + "WRONG!!", hash));
        assertFalse(hasher.verify(atLimit + "x", hash));
    }
}
