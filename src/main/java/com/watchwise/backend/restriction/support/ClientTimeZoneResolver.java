package com.watchwise.backend.restriction.support;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

@Component
public class ClientTimeZoneResolver {

    private static final String[] HEADERS = {"X-Client-Timezone", "X-Client-TZ", "Time-Zone", "X-Timezone"};

    /** Zone the calling device reported, if any and if valid. */
    public Optional<ZoneId> resolveFromCurrentRequest() {
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        if (attrs == null) return Optional.empty();
        HttpServletRequest req = attrs.getRequest();
        for (String k : HEADERS) {
            Optional<ZoneId> z = parse(req.getHeader(k));
            if (z.isPresent()) return z;
        }
        return Optional.empty();
    }

    public static Optional<ZoneId> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        try {
            return Optional.of(ZoneId.of(raw.trim()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
