package com.sunny.notepillar.server.security;

import java.lang.reflect.Method;

import com.sunny.notepillar.common.exception.UnauthorizedException;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CurrentIdentityArgumentResolverTest {

    private final CurrentIdentityArgumentResolver resolver = new CurrentIdentityArgumentResolver();

    @Test
    void supportsParameter_shouldRequireAnnotationAndType() throws NoSuchMethodException {
        Method method = SampleController.class.getMethod("handle", AuthenticatedIdentity.class, AuthenticatedIdentity.class);

        assertTrue(resolver.supportsParameter(new MethodParameter(method, 0)));
        assertFalse(resolver.supportsParameter(new MethodParameter(method, 1)));
    }

    @Test
    void resolveArgument_shouldReturnIdentityFromRequest() throws NoSuchMethodException {
        Method method = SampleController.class.getMethod("handle", AuthenticatedIdentity.class, AuthenticatedIdentity.class);
        MockHttpServletRequest request = new MockHttpServletRequest();
        AuthenticatedIdentity identity = new AuthenticatedIdentity(7L, "alice", null, "access-token-1");
        request.setAttribute(BearerAuthInterceptor.IDENTITY_ATTRIBUTE, identity);

        Object resolved = resolver.resolveArgument(new MethodParameter(method, 0), null, new ServletWebRequest(request), null);

        assertEquals(identity, resolved);
    }

    @Test
    void resolveArgument_shouldRejectUnauthenticatedRequest() throws NoSuchMethodException {
        Method method = SampleController.class.getMethod("handle", AuthenticatedIdentity.class, AuthenticatedIdentity.class);

        assertThrows(UnauthorizedException.class, () -> resolver.resolveArgument(
                new MethodParameter(method, 0), null, new ServletWebRequest(new MockHttpServletRequest()), null));
    }

    static class SampleController {
        public void handle(@CurrentIdentity AuthenticatedIdentity identity, AuthenticatedIdentity other) {
        }
    }
}
