package com.keystone.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("Authorization header")
    class Header {

        @Test
        @DisplayName("extracts the token after 'Bearer '")
        void extractsToken() {
            assertThat(BearerTokenExtractor.extract("Bearer eyJhbGciOiJSUzI1NiJ9.payload.sig"))
                    .contains("eyJhbGciOiJSUzI1NiJ9.payload.sig");
        }

        @Test
        @DisplayName("trims whitespace around the token and the header")
        void trims() {
            assertThat(BearerTokenExtractor.extract("  Bearer   my-token  ")).contains("my-token");
        }

        @Test
        @DisplayName("matches the scheme case-insensitively")
        void caseInsensitive() {
            assertThat(BearerTokenExtractor.extract("bearer my-token")).contains("my-token");
            assertThat(BearerTokenExtractor.extract("BEARER my-token")).contains("my-token");
        }

        @Test
        @DisplayName("is empty for a missing or blank header")
        void missing() {
            assertThat(BearerTokenExtractor.extract(null)).isEmpty();
            assertThat(BearerTokenExtractor.extract("")).isEmpty();
            assertThat(BearerTokenExtractor.extract("   ")).isEmpty();
        }

        @Test
        @DisplayName("is empty for another scheme")
        void otherScheme() {
            assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
        }

        @Test
        @DisplayName("is empty when no token follows the scheme")
        void noToken() {
            assertThat(BearerTokenExtractor.extract("Bearer ")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
        }

        @Test
        @DisplayName("requires whitespace between scheme and token")
        void glued() {
            assertThat(BearerTokenExtractor.extract("Bearertoken")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Cookie value")
    class Cookie {

        @Test
        @DisplayName("returns the trimmed value")
        void trimmed() {
            assertThat(BearerTokenExtractor.fromCookie(" abc.def.ghi ")).contains("abc.def.ghi");
        }

        @Test
        @DisplayName("is empty for a missing or blank value")
        void blank() {
            assertThat(BearerTokenExtractor.fromCookie(null)).isEmpty();
            assertThat(BearerTokenExtractor.fromCookie("  ")).isEmpty();
        }
    }
}
