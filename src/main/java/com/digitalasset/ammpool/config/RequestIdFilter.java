// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.ammpool.config;

import com.digitalasset.ammpool.constants.PoolConstants;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;

/**
 * Request ID filter - generates/extracts X-Request-ID for correlation.
 *
 * The id is echoed in the response header and kept in the MDC under "requestId"
 * (printed by logback-spring.xml) and under "callerId" when the caller header is present.
 */
@Component
@Order(1)
public class RequestIdFilter implements Filter {

    static final String MDC_REQUEST_ID = "requestId";
    static final String MDC_CALLER_ID = "callerId";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest req = (HttpServletRequest) request;
        HttpServletResponse res = (HttpServletResponse) response;

        String requestId = req.getHeader(PoolConstants.REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_REQUEST_ID, requestId);

        String callerId = req.getHeader(PoolConstants.CALLER_HEADER);
        if (callerId != null && !callerId.isBlank()) {
            MDC.put(MDC_CALLER_ID, callerId.trim());
        }

        try {
            res.setHeader(PoolConstants.REQUEST_ID_HEADER, requestId);
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CALLER_ID);
        }
    }
}
