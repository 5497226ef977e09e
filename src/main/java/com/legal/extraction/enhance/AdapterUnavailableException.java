package com.legal.extraction.enhance;

/**
 * The enhancement source cannot be reached or is not configured.
 */
public class AdapterUnavailableException extends EnhancementException {

    public AdapterUnavailableException(String adapterName, String message) {
        super(adapterName, message);
    }

    public AdapterUnavailableException(String adapterName, String message, Throwable cause) {
        super(adapterName, message, cause);
    }
}
