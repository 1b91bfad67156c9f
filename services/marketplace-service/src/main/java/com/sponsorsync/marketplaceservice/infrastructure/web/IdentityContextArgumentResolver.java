package com.sponsorsync.marketplaceservice.infrastructure.web;

import com.sponsorsync.security.IdentityContext;
import com.sponsorsync.security.PrincipalHeaderExtractor;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies an {@link IdentityContext} parameter to controller methods from the
 * {@code X-Principal-Id} header. A missing or malformed header yields the anonymous identity;
 * the policy engine then denies.
 */
public class IdentityContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return IdentityContext.class.equals(parameter.getParameterType());
    }

    @Override
    public IdentityContext resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        return PrincipalHeaderExtractor.extract(webRequest.getHeader(PrincipalHeaderExtractor.PRINCIPAL_HEADER));
    }
}
