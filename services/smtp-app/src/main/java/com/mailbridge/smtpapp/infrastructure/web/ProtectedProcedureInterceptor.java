package com.mailbridge.smtpapp.infrastructure.web;

import com.mailbridge.security.BearerTokenExtractor;
import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import com.mailbridge.smtpapp.pipeline.ProcedurePipeline;
import com.mailbridge.smtpapp.pipeline.ProtectedProcedure;
import com.mailbridge.smtpapp.sync.WebhookSyncHook;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Arrays;
import java.util.LinkedHashSet;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs the procedure pipeline in front of every handler annotated with
 * {@link ProtectedProcedure}, and the webhook reconciliation after those flagged
 * {@code updatesWebhooks} once they have succeeded.
 *
 * <p>A refusal surfaces as {@link com.mailbridge.smtpapp.pipeline.ProcedureRejectedException},
 * mapped to a response by {@link GlobalExceptionHandler}; the handler is never invoked.
 */
public class ProtectedProcedureInterceptor implements HandlerInterceptor {

    public static final String TENANT_API_URL_HEADER = "X-Tenant-Api-Url";
    public static final String APP_ID_HEADER = "X-App-Id";

    private final ProcedurePipeline pipeline;
    private final WebhookSyncHook webhookSyncHook;

    public ProtectedProcedureInterceptor(ProcedurePipeline pipeline, WebhookSyncHook webhookSyncHook) {
        this.pipeline = pipeline;
        this.webhookSyncHook = webhookSyncHook;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        ProtectedProcedure procedure = procedureOf(handler);
        if (procedure == null) {
            return true;
        }
        String token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION)).orElse(null);
        ProcedureContext initial = ProcedureContext.fromBrowser(
                token,
                request.getHeader(TENANT_API_URL_HEADER),
                request.getHeader(APP_ID_HEADER),
                new LinkedHashSet<>(Arrays.asList(procedure.requiredPermissions())));

        ProcedureContext completed = pipeline.runOrThrow(initial);
        request.setAttribute(ProcedureContext.REQUEST_ATTRIBUTE, completed);
        return true;
    }

    @Override
    public void afterCompletion(
            HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        ProtectedProcedure procedure = procedureOf(handler);
        if (procedure == null || !procedure.updatesWebhooks() || ex != null || response.getStatus() >= 400) {
            return;
        }
        if (request.getAttribute(ProcedureContext.REQUEST_ATTRIBUTE) instanceof ProcedureContext context) {
            webhookSyncHook.afterMutation(context);
        }
    }

    static ProtectedProcedure procedureOf(Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return null;
        }
        ProtectedProcedure annotation =
                AnnotatedElementUtils.findMergedAnnotation(method.getMethod(), ProtectedProcedure.class);
        if (annotation == null) {
            annotation = AnnotatedElementUtils.findMergedAnnotation(method.getBeanType(), ProtectedProcedure.class);
        }
        return annotation;
    }
}
