package com.jreinhal.docguard.service;

import com.jreinhal.docguard.security.ScanResult;

/**
 * Hard stop raised by the pre-distribution gate. Callers must not distribute the content.
 */
public class DistributionBlockedException
extends SecurityException {
    private final transient ValidationResult result;

    public DistributionBlockedException(String message, ValidationResult result) {
        super(message);
        this.result = result;
    }

    public ValidationResult getResult() {
        return this.result;
    }

    public ScanResult getScanResult() {
        return this.result.scanResult();
    }
}
