package com.mailbridge.smtpapp.infrastructure.web;

import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the {@link ProcedureContext} completed by {@link ProtectedProcedureInterceptor} into
 * handler parameters.
 */
public class ProcedureContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ProcedureContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        Object context =
                webRequest.getAttribute(ProcedureContext.REQUEST_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST);
        if (context == null) {
            throw new IllegalStateException(
                    "No procedure context; is the handler annotated with @ProtectedProcedure?");
        }
        return context;
    }
}
