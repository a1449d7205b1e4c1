package com.mylab.labservice.infrastructure.web;

import com.mylab.labservice.domain.common.UnauthenticatedException;
import com.mylab.observability.CorrelationContext;
import com.mylab.observability.CorrelationContextHolder;
import com.mylab.security.LabSecurityContext;
import com.mylab.security.SecurityContextValidator;
import com.mylab.security.SessionClaims;
import com.mylab.security.SessionTokenCodec;
import java.util.UUID;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Turns the bearer token of the request into a {@link LabSecurityContext} controller argument.
 * Controllers pass the context on explicitly; nothing downstream reads it from a thread-local.
 */
@Component
public class CallerContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return LabSecurityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public LabSecurityContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {

        String token = SessionTokenCodec.fromAuthorizationHeader(webRequest.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseThrow(() -> new UnauthenticatedException("Missing bearer token"));

        SessionClaims claims;
        try {
            claims = SessionTokenCodec.decode(token);
        } catch (SessionTokenCodec.SessionTokenException e) {
            throw new UnauthenticatedException("Malformed bearer token", e);
        }

        String correlationId = CorrelationContextHolder.get()
                .map(CorrelationContext::correlationId)
                .orElseGet(() -> UUID.randomUUID().toString());

        LabSecurityContext context;
        try {
            context = SecurityContextValidator.toContext(claims, token, correlationId);
        } catch (IllegalArgumentException e) {
            throw new UnauthenticatedException("Invalid session: " + e.getMessage(), e);
        }

        CorrelationContextHolder.attachCaller(context.workspaceId().toString(), context.userId().toString());
        return context;
    }
}
