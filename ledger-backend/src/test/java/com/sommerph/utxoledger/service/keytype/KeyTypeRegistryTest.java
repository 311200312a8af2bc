package com.sommerph.utxoledger.service.keytype;

import com.sommerph.utxoledger.exception.LedgerError;
import com.sommerph.utxoledger.exception.LedgerException;
import com.sommerph.utxoledger.model.ledger.KeyType;
import org.bitcoinj.core.ECKey;
import org.bouncycastle.jce.ECNamedCurveTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("KeyTypeRegistry Tests")
class KeyTypeRegistryTest {

    private static byte[] r1Key(boolean compressed) {
        return ECNamedCurveTable.getParameterSpec("secp256r1").getG()
                .multiply(BigInteger.valueOf(7)).normalize().getEncoded(compressed);
    }

    private static LedgerError errorOf(Runnable call) {
        try {
            call.run();
        } catch (LedgerException e) {
            return e.getError();
        }
        return null;
    }

    @Nested
    @DisplayName("secp256k1 only")
    class K1OnlyTests {

        private final KeyTypeRegistry registry = new KeyTypeRegistry(List.of(new Secp256k1KeyValidator()));

        @Test
        @DisplayName("Compressed and uncompressed secp256k1 keys are accepted")
        void shouldAcceptK1Keys() {
            ECKey key = new ECKey();

            assertThatCode(() -> registry.validate(KeyType.SECP256K1, key.getPubKey())).doesNotThrowAnyException();
            assertThatCode(() -> registry.validate(KeyType.SECP256K1, key.decompress().getPubKey())).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Malformed secp256k1 keys are rejected")
        void shouldRejectMalformedK1Keys() {
            assertThat(errorOf(() -> registry.validate(KeyType.SECP256K1, new byte[33])))
                    .isEqualTo(LedgerError.INVALID_EPHEMERAL_KEY);
            assertThat(errorOf(() -> registry.validate(KeyType.SECP256K1, new byte[20])))
                    .isEqualTo(LedgerError.INVALID_EPHEMERAL_KEY);
            assertThat(errorOf(() -> registry.validate(KeyType.SECP256K1, null)))
                    .isEqualTo(LedgerError.INVALID_EPHEMERAL_KEY);
        }

        @Test
        @DisplayName("secp256r1 is known but unavailable")
        void shouldReportR1Unavailable() {
            assertThat(registry.isAvailable(KeyType.SECP256R1)).isFalse();
            assertThat(errorOf(() -> registry.validate(KeyType.SECP256R1, r1Key(true))))
                    .isEqualTo(LedgerError.KEY_TYPE_UNAVAILABLE);
        }

        @Test
        @DisplayName("Unknown key type codes are unsupported")
        void shouldRejectUnknownCode() {
            assertThatThrownBy(() -> KeyType.fromCode(7))
                    .isInstanceOf(LedgerException.class)
                    .extracting(e -> ((LedgerException) e).getError())
                    .isEqualTo(LedgerError.UNSUPPORTED_KEY_TYPE);
            assertThat(errorOf(() -> registry.validate(null, new byte[33])))
                    .isEqualTo(LedgerError.UNSUPPORTED_KEY_TYPE);
        }
    }

    @Nested
    @DisplayName("secp256r1 enabled")
    class R1EnabledTests {

        private final KeyTypeRegistry registry = new KeyTypeRegistry(
                List.of(new Secp256k1KeyValidator(), new Secp256r1KeyValidator()));

        @Test
        @DisplayName("Points on P-256 are accepted")
        void shouldAcceptR1Keys() {
            assertThat(registry.isAvailable(KeyType.SECP256R1)).isTrue();
            assertThatCode(() -> registry.validate(KeyType.SECP256R1, r1Key(true))).doesNotThrowAnyException();
            assertThatCode(() -> registry.validate(KeyType.SECP256R1, r1Key(false))).doesNotThrowAnyException();
        }

        @Test
        @DisplayName("Encodings with an invalid prefix are rejected")
        void shouldRejectBadPrefix() {
            byte[] key = r1Key(true);
            key[0] = 0x05;

            assertThat(errorOf(() -> registry.validate(KeyType.SECP256R1, key)))
                    .isEqualTo(LedgerError.INVALID_EPHEMERAL_KEY);
        }
    }

}
