package com.keystone.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.keystone.observability.CorrelationContext;
import com.keystone.observability.CorrelationContextHolder;
import com.keystone.security.AuthExtractor;
import com.keystone.security.AuthResult;
import com.keystone.security.TokenTransport;
import com.keystone.security.access.AccessDeniedException;
import com.keystone.security.access.AdminLevel;
import jakarta.servlet.http.Cookie;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthenticationInterceptor")
class AuthenticationInterceptorTest {

    static class PublicHandler {
        public String info() {
            return "info";
        }
    }

    @Authenticated
    static class CustomerHandler {
        public String me() {
            return "me";
        }
    }

    @RequiresAdminLevel(AdminLevel.ADMIN)
    static class AdminHandler {
        public String roles() {
            return "roles";
        }

        @RequiresAdminLevel(AdminLevel.SUPER_ADMIN)
        public String keys() {
            return "keys";
        }
    }

    @Mock private AuthExtractor authExtractor;

    private AuthenticationInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new AuthenticationInterceptor(authExtractor);
        CorrelationContextHolder.set(CorrelationContext.of("corr-1", "req-1"));
    }

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    private static HandlerMethod handler(Object bean, String method) throws NoSuchMethodException {
        return new HandlerMethod(bean, bean.getClass().getMethod(method));
    }

    @Test
    @DisplayName("leaves public handlers alone")
    void publicHandler() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer garbage");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(),
                handler(new PublicHandler(), "info"))).isTrue();

        verifyNoInteractions(authExtractor);
        assertThat(AuthenticationInterceptor.principalOf(request)).isNull();
    }

    @Test
    @DisplayName("stores the principal and binds the customer to the context")
    void storesPrincipal() throws Exception {
        var principal = new AuthResult("cust_1", "tok", null, TokenTransport.COOKIE);
        when(authExtractor.authenticate("tok", null)).thenReturn(Optional.of(principal));
        var request = new MockHttpServletRequest();
        request.setCookies(new Cookie("auth_token", "tok"));

        interceptor.preHandle(request, new MockHttpServletResponse(), handler(new CustomerHandler(), "me"));

        assertThat(AuthenticationInterceptor.principalOf(request)).isSameAs(principal);
        assertThat(CorrelationContextHolder.get()).get()
                .extracting(CorrelationContext::customerId).isEqualTo("cust_1");
    }

    @Test
    @DisplayName("rejects a protected handler without credentials")
    void noCredentials() throws Exception {
        when(authExtractor.authenticate(null, null)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> interceptor.preHandle(new MockHttpServletRequest(),
                        new MockHttpServletResponse(), handler(new AdminHandler(), "roles")))
                .isInstanceOf(AccessDeniedException.class)
                .satisfies(e -> {
                    var denied = (AccessDeniedException) e;
                    assertThat(denied.reason()).isEqualTo(AccessDeniedException.Reason.UNAUTHENTICATED);
                    assertThat(denied.requiredLevel()).isEqualTo(AdminLevel.ADMIN);
                });
    }

    @Test
    @DisplayName("method level annotations override the class level")
    void methodLevelWins() throws Exception {
        assertThat(AuthenticationInterceptor.requiredLevel(handler(new AdminHandler(), "keys")))
                .isEqualTo(AdminLevel.SUPER_ADMIN);
        assertThat(AuthenticationInterceptor.requiredLevel(handler(new AdminHandler(), "roles")))
                .isEqualTo(AdminLevel.ADMIN);
        assertThat(AuthenticationInterceptor.requiredLevel(handler(new CustomerHandler(), "me"))).isNull();
    }
}
