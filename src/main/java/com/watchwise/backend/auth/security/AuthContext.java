package com.watchwise.backend.auth.security;

import com.watchwise.backend.common.web.ApiErrorCode;
import com.watchwise.backend.common.web.ApiException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

/**
 * Resolves the identity bound to the current request.
 */
@Component
public class AuthContext {

    public Long requireUserId() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth != null && auth.isAuthenticated() && !(auth instanceof AnonymousAuthenticationToken)) {
            Object p = auth.getPrincipal();
            if (p instanceof Long l) return l;
        }
        throw new ApiException(ApiErrorCode.UNAUTHENTICATED);
    }
}
