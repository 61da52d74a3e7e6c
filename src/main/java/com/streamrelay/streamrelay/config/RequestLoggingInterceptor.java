package com.streamrelay.streamrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingInterceptor.class);

    @Value("${logging.request.enabled:false}")
    private boolean enabled;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!enabled) {
            return true;
        }

        String iso = OffsetDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        String handlerInfo = (handler instanceof HandlerMethod)
                ? ((HandlerMethod) handler).getShortLogMessage()
                : String.valueOf(handler);

        // Query strings are left out: transport callbacks carry stream keys in them
        logger.info("Incoming request - time={}, method={}, uri={}, handler={}, remoteAddr={}",
                iso, request.getMethod(), request.getRequestURI(), handlerInfo, request.getRemoteAddr());

        return true;
    }
}
