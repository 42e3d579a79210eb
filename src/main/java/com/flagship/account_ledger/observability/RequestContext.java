package com.flagship.account_ledger.observability;

import java.util.UUID;

/**
 * Header and MDC keys shared by the HTTP filter and the operations.
 *
 * The request id identifies one HTTP call in the logs. It is unrelated to the
 * correlation id that links the two ledger entries of a transfer, which is
 * logged under {@link #TRANSFER_ID_MDC_KEY}.
 */
public final class RequestContext {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String ACCOUNT_NUMBER_MDC_KEY = "accountNumber";
    public static final String TRANSFER_ID_MDC_KEY = "transferId";

    private RequestContext() {
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
