package com.jreinhal.docguard.model;

public enum SeverityClass {
    CRITICAL,
    HIGH,
    MEDIUM;

}
