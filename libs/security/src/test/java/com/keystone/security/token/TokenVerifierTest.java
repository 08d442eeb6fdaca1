package com.keystone.security.token;

import com.keystone.security.testing.MutableClock;
import com.keystone.security.testing.TestTokenFactory;
import com.nimbusds.jose.util.Base64URL;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenVerifier")
class TokenVerifierTest {

    private static final Instant START = Instant.parse("2025-03-01T12:00:00Z");

    private MutableClock clock;
    private AtomicInteger fetches;
    private TokenVerifier verifier;
    private TokenIssuer issuer;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(START);
        fetches = new AtomicInteger();
        KeySetSource source = () -> {
            fetches.incrementAndGet();
            return TestTokenFactory.publicKeys();
        };
        KeyMaterialCache cache = new KeyMaterialCache(source, clock, null);
        verifier = new TokenVerifier(cache, TestTokenFactory.LEGACY_SECRET, clock);
        issuer = TestTokenFactory.issuer(clock);
    }

    private static TokenVerificationException.Reason reasonOf(Throwable e) {
        return ((TokenVerificationException) e).reason();
    }

    @Nested
    @DisplayName("RS256")
    class Rs256 {

        @Test
        @DisplayName("issue, verify, then expire")
        void issueVerifyExpire() {
            String token = issuer.issue(TokenClaims.builder()
                    .customerId("cust_1")
                    .expiresAt(START.plusSeconds(3600))
                    .build());

            TokenClaims claims = verifier.verify(token);
            assertThat(claims.customerId()).isEqualTo("cust_1");
            assertThat(claims.effectiveCustomerId()).isEqualTo("cust_1");
            assertThat(claims.expiresAt()).isEqualTo(START.plusSeconds(3600));

            clock.advance(Duration.ofSeconds(3601));

            assertThatThrownBy(() -> verifier.verify(token))
                    .isInstanceOf(TokenVerificationException.class)
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("expiry equal to now is already expired")
        void expiryIsStrict() {
            String token = issuer.issue(TestTokenFactory.claimsFor("cust_1", START).withTimes(START, START.plusSeconds(60)));
            clock.advance(Duration.ofSeconds(60));

            assertThatThrownBy(() -> verifier.verify(token))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("flipping a signature bit gives INVALID_SIGNATURE")
        void flippedSignatureBit() {
            String token = TestTokenFactory.tokenFor("cust_1", clock);
            String[] parts = token.split("\\.");
            byte[] signature = new Base64URL(parts[2]).decode();
            signature[signature.length / 2] ^= 0x10;
            String tampered = parts[0] + "." + parts[1] + "." + Base64URL.encode(signature);

            assertThatThrownBy(() -> verifier.verify(tampered))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("a token signed by another key with the same kid gives INVALID_SIGNATURE")
        void foreignKeySameKid() {
            TokenIssuer impostor = new TokenIssuer(TokenIssuer.generateSigningKey(TestTokenFactory.TEST_KID), clock);
            String token = impostor.issue(TestTokenFactory.claimsFor("cust_1", START));

            assertThatThrownBy(() -> verifier.verify(token))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("an unknown kid gives UNKNOWN_SIGNING_KEY")
        void unknownKid() {
            TokenIssuer other = new TokenIssuer(TokenIssuer.generateSigningKey("rotated-key-9"), clock);
            String token = other.issue(TestTokenFactory.claimsFor("cust_1", START));

            assertThatThrownBy(() -> verifier.verify(token))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.UNKNOWN_SIGNING_KEY);
        }

        @Test
        @DisplayName("two tokens with the same kid within the TTL cause one key-set fetch")
        void oneFetchPerTtl() {
            verifier.verify(TestTokenFactory.tokenFor("cust_1", clock));
            clock.advance(Duration.ofMinutes(5));
            verifier.verify(TestTokenFactory.tokenFor("cust_2", clock));

            assertThat(fetches).hasValue(1);
        }

        @Test
        @DisplayName("subject alone is enough identity")
        void subjectOnly() {
            String token = issuer.issue(TokenClaims.builder().subject("cust_9").expiresAt(START.plusSeconds(60)).build());

            assertThat(verifier.verify(token).effectiveCustomerId()).isEqualTo("cust_9");
        }

        @Test
        @DisplayName("no subject and no customer id is MALFORMED_TOKEN")
        void noIdentity() {
            String token = issuer.issue(TokenClaims.builder().expiresAt(START.plusSeconds(60)).build());

            assertThatThrownBy(() -> verifier.verify(token))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("the super-admin claim survives verification")
        void superAdminClaim() {
            assertThat(verifier.verify(TestTokenFactory.superAdminToken("cust_admin", clock)).superAdmin()).isTrue();
        }
    }

    @Nested
    @DisplayName("HS256 legacy")
    class Hs256 {

        @Test
        @DisplayName("accepts tokens signed with the configured secret")
        void acceptsLegacy() {
            String token = issuer.issueLegacy(TestTokenFactory.claimsFor("cust_legacy", START), TestTokenFactory.LEGACY_SECRET);

            assertThat(verifier.verify(token).customerId()).isEqualTo("cust_legacy");
            assertThat(fetches).hasValue(0);
        }

        @Test
        @DisplayName("rejects legacy tokens when no secret is configured")
        void noSecretIsHardFailure() {
            TokenVerifier strict = new TokenVerifier(null, null, clock);
            String token = issuer.issueLegacy(TestTokenFactory.claimsFor("cust_legacy", START), TestTokenFactory.LEGACY_SECRET);

            assertThatThrownBy(() -> strict.verify(token))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.INVALID_SIGNATURE);
        }

        @Test
        @DisplayName("rejects legacy tokens signed with another secret")
        void wrongSecret() {
            String token = issuer.issueLegacy(TestTokenFactory.claimsFor("cust_legacy", START),
                    "some-other-shared-secret-of-32-bytes!!");

            assertThatThrownBy(() -> verifier.verify(token))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.INVALID_SIGNATURE);
        }
    }

    @Nested
    @DisplayName("Malformed input")
    class Malformed {

        @Test
        @DisplayName("garbage and empty strings are MALFORMED_TOKEN")
        void garbage() {
            assertThatThrownBy(() -> verifier.verify("not-a-token"))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.MALFORMED_TOKEN);
            assertThatThrownBy(() -> verifier.verify("  "))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("alg none is MALFORMED_TOKEN")
        void algNone() {
            String header = Base64URL.encode("{\"alg\":\"none\"}").toString();
            String payload = Base64URL.encode("{\"sub\":\"cust_1\",\"exp\":4102444800}").toString();

            assertThatThrownBy(() -> verifier.verify(header + "." + payload + "."))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.MALFORMED_TOKEN);
        }

        @Test
        @DisplayName("other signature algorithms are MALFORMED_TOKEN")
        void otherAlgorithm() {
            String header = Base64URL.encode("{\"alg\":\"ES256\",\"kid\":\"k\"}").toString();
            String payload = Base64URL.encode("{\"sub\":\"cust_1\"}").toString();

            assertThatThrownBy(() -> verifier.verify(header + "." + payload + ".c2ln"))
                    .extracting(TokenVerifierTest::reasonOf)
                    .isEqualTo(TokenVerificationException.Reason.MALFORMED_TOKEN);
        }
    }
}
