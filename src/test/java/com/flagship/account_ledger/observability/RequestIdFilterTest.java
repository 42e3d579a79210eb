package com.flagship.account_ledger.observability;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    @Test
    void propagatesIncomingRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/transfers");
        request.addHeader(RequestContext.REQUEST_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(RequestContext.REQUEST_ID_MDC_KEY)));

        assertEquals("abc-123", seen.get());
        assertEquals("abc-123", response.getHeader(RequestContext.REQUEST_ID_HEADER));
        assertNull(MDC.get(RequestContext.REQUEST_ID_MDC_KEY));
    }

    @Test
    void generatesIdWhenHeaderMissingOrTooLong() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/accounts/123456/balance");
        request.addHeader(RequestContext.REQUEST_ID_HEADER, "x".repeat(65));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String generated = response.getHeader(RequestContext.REQUEST_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    void clearsOperationKeysAfterRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/accounts/123456/deposit");

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> {
            MDC.put(RequestContext.ACCOUNT_NUMBER_MDC_KEY, "123456");
            MDC.put(RequestContext.TRANSFER_ID_MDC_KEY, "t-1");
        });

        assertNull(MDC.get(RequestContext.ACCOUNT_NUMBER_MDC_KEY));
        assertNull(MDC.get(RequestContext.TRANSFER_ID_MDC_KEY));
    }

    @Test
    void skipsActuatorEndpoints() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertNull(response.getHeader(RequestContext.REQUEST_ID_HEADER));
    }
}
