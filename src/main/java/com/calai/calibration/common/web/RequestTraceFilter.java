package com.calai.calibration.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 每個 request 的追蹤資訊：rid（回寫 X-Request-Id）與路徑上的 userId，都放進 MDC 讓 log pattern 印出。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTraceFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_RID = "rid";
    public static final String MDC_UID = "uid";

    private static final Pattern SAFE_RID = Pattern.compile("[A-Za-z0-9._-]{1,64}");
    /** /api/v1/observations/{userId}、/api/v1/calibration/{userId}/states、/api/v1/params/{userId}/... */
    private static final Pattern USER_PATH = Pattern.compile("^/api/v1/(?:observations|calibration|params)/(\\d+)(?:/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = resolveRequestId(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        res.setHeader(HEADER, rid);

        MDC.put(MDC_RID, rid);
        String uid = userIdFromPath(req.getRequestURI());
        if (uid != null) MDC.put(MDC_UID, uid);

        try {
            chain.doFilter(req, res);
        } finally {
            MDC.remove(MDC_RID);
            MDC.remove(MDC_UID);
        }
    }

    /** client 帶來的 id 只收安全字元（log injection），否則換一個新的 */
    static String resolveRequestId(String incoming) {
        if (incoming != null && SAFE_RID.matcher(incoming).matches()) return incoming;
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    static String userIdFromPath(String uri) {
        if (uri == null) return null;
        Matcher m = USER_PATH.matcher(uri);
        return m.matches() ? m.group(1) : null;
    }

    public static String requestId(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return v == null ? null : String.valueOf(v);
    }
}
