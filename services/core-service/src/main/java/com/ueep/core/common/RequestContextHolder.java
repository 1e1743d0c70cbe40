package com.ueep.core.common;

public final class RequestContextHolder {
    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void set(RequestContext context) {
        CONTEXT.set(context);
    }

    public static RequestContext get() {
        return CONTEXT.get();
    }

    public static String correlationId() {
        RequestContext context = CONTEXT.get();
        return context == null ? null : context.getCorrelationId();
    }

    public static void clear() {
        CONTEXT.remove();
    }
}
