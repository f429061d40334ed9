package io.cryptomm.engine.exchange;

import io.cryptomm.engine.core.exception.ExchangeException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RequestSignerTest {

    @Test
    void testHmacSignature() {
        RequestSigner signer = new RequestSigner("key-id", "key");

        assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                signer.sign("The quick brown fox jumps over the lazy dog"));
    }

    @Test
    void testMissingCredentials() {
        assertThrows(ExchangeException.class, () -> new RequestSigner("", "secret"));
        assertThrows(ExchangeException.class, () -> new RequestSigner("key", null));
    }
}
