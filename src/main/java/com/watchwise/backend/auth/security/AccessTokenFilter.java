package com.watchwise.backend.auth.security;

import com.watchwise.backend.auth.entity.AuthToken;
import com.watchwise.backend.auth.repo.AuthTokenRepo;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.Optional;

@Component
public class AccessTokenFilter extends OncePerRequestFilter {

    private final AuthTokenRepo tokens;
    private final Clock clock;

    public AccessTokenFilter(AuthTokenRepo tokens, Clock clock) {
        this.tokens = tokens;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String auth = req.getHeader(HttpHeaders.AUTHORIZATION);
        if (auth == null || !auth.startsWith("Bearer ")) {
            // anonymous; the entry point answers 401 for protected paths
            chain.doFilter(req, res);
            return;
        }

        String raw = auth.substring(7).trim();
        Optional<AuthToken> found = tokens.findByToken(raw);
        if (found.isEmpty() || !found.get().isUsableAccessToken(Instant.now(clock))) {
            unauthorized(res);
            return;
        }

        // principal is the user id only, never the entity
        Long uid = found.get().getUserId();
        var authentication = new UsernamePasswordAuthenticationToken(uid, null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(req));
        SecurityContextHolder.getContext().setAuthentication(authentication);

        chain.doFilter(req, res);
    }

    private static void unauthorized(HttpServletResponse res) throws IOException {
        res.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        res.setContentType("application/json");
        res.getWriter().write("{\"code\":\"UNAUTHENTICATED\",\"message\":\"Invalid or expired access token\"}");
    }
}
