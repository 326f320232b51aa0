package com.poolledger.api.controller;

/**
 * Request headers shared by the controllers.
 */
final class CallerHeaders {

    /**
     * Address on whose behalf the request is made.
     */
    static final String CALLER = "X-Caller-Address";

    private CallerHeaders() {
    }
}
