package com.nosota.groupbuy.api;

/**
 * HTTP headers understood by the group-buy ledger service.
 */
public final class ApiHeaders {

    /**
     * Identifier of the calling participant (manufacturer, retailer or administrator).
     * Required on every state-changing request.
     */
    public static final String PARTICIPANT_ID = "X-Participant-Id";

    /**
     * Optional correlation id echoed back in responses and written to the service logs.
     */
    public static final String CORRELATION_ID = "X-Correlation-Id";

    private ApiHeaders() {
    }
}
