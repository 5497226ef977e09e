package com.legal.extraction.enhance;

/**
 * Runtime exception raised by an enhancement source that could not produce candidates.
 * The pipeline treats every such failure as an empty contribution from that source.
 */
public class EnhancementException extends RuntimeException {

    private final String adapterName;

    public EnhancementException(String adapterName, String message) {
        super(message);
        this.adapterName = adapterName;
    }

    public EnhancementException(String adapterName, String message, Throwable cause) {
        super(message, cause);
        this.adapterName = adapterName;
    }

    public String getAdapterName() {
        return adapterName;
    }
}
