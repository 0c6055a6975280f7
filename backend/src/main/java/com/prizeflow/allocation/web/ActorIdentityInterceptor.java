package com.prizeflow.allocation.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Set;
import java.util.UUID;

/**
 * Resolves the acting organizer from {@value #ACTOR_HEADER} into a request attribute.
 * Mutating requests must carry the header; read-only requests may omit it.
 */
public class ActorIdentityInterceptor implements HandlerInterceptor {

    public static final String ACTOR_HEADER = "X-Actor-Id";
    public static final String ACTOR_ID_ATTRIBUTE = "prizeflow.actorId";

    private static final Logger log = LoggerFactory.getLogger(ActorIdentityInterceptor.class);

    private static final Set<String> READ_ONLY_METHODS = Set.of("GET", "HEAD", "OPTIONS");

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull Object handler) {
        String rawActorId = request.getHeader(ACTOR_HEADER);
        if (rawActorId == null || rawActorId.isBlank()) {
            if (READ_ONLY_METHODS.contains(request.getMethod())) {
                return true;
            }
            throw AllocationRequestException.actorRequired(ACTOR_HEADER + " header is required");
        }

        try {
            request.setAttribute(ACTOR_ID_ATTRIBUTE, UUID.fromString(rawActorId.trim()));
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected malformed actor id on {} {}", request.getMethod(), request.getRequestURI());
            throw AllocationRequestException.invalidActor(ACTOR_HEADER + " must be a valid UUID");
        }
        return true;
    }
}
