package com.bastion.gateway.infrastructure.web;

import com.bastion.admission.AdmissionContext;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Injects the {@link AdmissionContext} established by {@link AdmissionInterceptor} into handler
 * parameters.
 */
public class AdmissionContextArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AdmissionContext.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        Object context = webRequest.getAttribute(AdmissionInterceptor.CONTEXT_ATTRIBUTE,
                RequestAttributes.SCOPE_REQUEST);
        if (context == null) {
            throw new IllegalStateException("Handler " + parameter.getExecutable().getName()
                    + " takes an AdmissionContext but is not annotated with @AdmissionAction");
        }
        return context;
    }
}
