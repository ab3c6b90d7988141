package com.sunny.notepillar.server.security;

import com.sunny.notepillar.common.exception.BadRequestException;
import com.sunny.notepillar.server.exception.security.PasswordHashInvalidException;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialServiceTest {

    private final CredentialService credentialService =
            new CredentialService(new Argon2PasswordEncoder(16, 32, 1, 1 << 12, 1));

    @Test
    void hash_shouldProduceSaltedArgon2Encoding() {
        String first = credentialService.hash("Sup3rSecret!");
        String second = credentialService.hash("Sup3rSecret!");

        assertTrue(first.startsWith("$argon2id$"));
        assertNotEquals(first, second);
        assertTrue(credentialService.verify("Sup3rSecret!", first));
        assertTrue(credentialService.verify("Sup3rSecret!", second));
    }

    @Test
    void verify_shouldReturnFalseForWrongPassword() {
        String hash = credentialService.hash("Sup3rSecret!");

        assertFalse(credentialService.verify("sup3rsecret!", hash));
        assertFalse(credentialService.verify(null, hash));
    }

    @Test
    void verify_shouldRejectMalformedStoredHash() {
        assertThrows(PasswordHashInvalidException.class,
                () -> credentialService.verify("Sup3rSecret!", "plain-text-password"));
        assertThrows(PasswordHashInvalidException.class,
                () -> credentialService.verify("Sup3rSecret!", null));
    }

    @Test
    void verify_shouldRejectCorruptArgon2Encoding() {
        assertThrows(PasswordHashInvalidException.class,
                () -> credentialService.verify("Sup3rSecret!", "$argon2id$garbage"));
        assertThrows(PasswordHashInvalidException.class,
                () -> credentialService.verify("Sup3rSecret!", "$argon2id$v=19$m=abc"));
        assertThrows(PasswordHashInvalidException.class,
                () -> credentialService.verify("Sup3rSecret!", "$argon2"));
        assertThrows(PasswordHashInvalidException.class,
                () -> credentialService.verify("Sup3rSecret!", "$argon2id$v=19$m=4096,t=1,p=1$$aGFzaA"));
    }

    @Test
    void verifyAgainstDummy_shouldNeverMatch() {
        assertFalse(credentialService.verifyAgainstDummy("Sup3rSecret!"));
        assertFalse(credentialService.verifyAgainstDummy(null));
    }

    @Test
    void hash_shouldRejectEmptyPassword() {
        assertThrows(BadRequestException.class, () -> credentialService.hash(""));
    }
}
