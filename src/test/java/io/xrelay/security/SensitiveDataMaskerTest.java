package io.xrelay.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void detectsCredentialLikeKeys() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("X-API-Key"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("refresh_token"));
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("Cookie"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("relay"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(null));
    }

    @Test
    void urlQueryStringIsMasked() {
        Assertions.assertEquals("https://a.example/p?***", SensitiveDataMasker.maskUrl("https://a.example/p?token=1"));
        Assertions.assertEquals("https://a.example/p", SensitiveDataMasker.maskUrl("https://a.example/p"));
        Assertions.assertNull(SensitiveDataMasker.maskUrl(null));
    }
}
