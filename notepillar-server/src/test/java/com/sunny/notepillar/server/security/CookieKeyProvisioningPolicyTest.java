package com.sunny.notepillar.server.security;

import com.sunny.notepillar.server.exception.security.WeakProductionKeyException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CookieKeyProvisioningPolicyTest {

    private final CookieKeyProvisioningPolicy policy = new CookieKeyProvisioningPolicy();

    @Test
    void production_shouldUseConfiguredKey() {
        ProvisionedKey key = policy.provision(DeploymentEnvironment.PRODUCTION, "a-strong-configured-cookie-key", false);

        assertEquals("a-strong-configured-cookie-key", key.value());
        assertEquals(ProvisionedKey.Source.CONFIGURED, key.source());
    }

    @Test
    void production_shouldGenerateFreshKeyPerStartupWhenAllowed() {
        ProvisionedKey first = policy.provision(DeploymentEnvironment.PRODUCTION, null, true);
        ProvisionedKey second = policy.provision(DeploymentEnvironment.PRODUCTION, "", true);

        assertEquals(ProvisionedKey.Source.GENERATED, first.source());
        assertNotEquals(first.value(), second.value());
        assertNotEquals(CookieKeyProvisioningPolicy.DEFAULT_COOKIE_KEY, first.value());
        assertEquals(64, first.value().length());
    }

    @Test
    void production_shouldRefuseToStartWithoutKey() {
        WeakProductionKeyException exception = assertThrows(WeakProductionKeyException.class,
                () -> policy.provision(DeploymentEnvironment.PRODUCTION, null, false));

        assertTrue(exception.getMessage().contains("COOKIE_SIGNING_KEY"));
        assertTrue(exception.getMessage().contains("ALLOW_GENERATED_COOKIE_KEY"));
    }

    @Test
    void production_shouldTreatDefaultKeyAsMissing() {
        assertThrows(WeakProductionKeyException.class, () -> policy.provision(
                DeploymentEnvironment.PRODUCTION, CookieKeyProvisioningPolicy.DEFAULT_COOKIE_KEY, false));
    }

    @Test
    void development_shouldFallBackToDefaultKey() {
        ProvisionedKey key = policy.provision(DeploymentEnvironment.DEVELOPMENT, null, false);

        assertEquals(CookieKeyProvisioningPolicy.DEFAULT_COOKIE_KEY, key.value());
        assertEquals(ProvisionedKey.Source.DEFAULT, key.source());
    }

    @Test
    void provisionedKey_shouldNotExposeValueInToString() {
        ProvisionedKey key = policy.provision(DeploymentEnvironment.DEVELOPMENT, "dev-cookie-key", false);

        assertFalse(key.toString().contains("dev-cookie-key"));
    }
}
