package com.enterprise.autosave.core;

import java.util.Objects;

/**
 * Why a download attempt failed
 */
public final class FailureReason {
    
    public enum Kind {
        HTTP_STATUS,    // Server answered with a non-2xx status
        TRANSPORT,      // Connection, protocol or timeout problem
        STORAGE,        // Output file could not be created or written
        INTERNAL        // Unexpected error while running the download
    }
    
    private final Kind kind;
    private final int httpStatus;
    private final String detail;
    
    private FailureReason(Kind kind, int httpStatus, String detail) {
        this.kind = kind;
        this.httpStatus = httpStatus;
        this.detail = detail;
    }
    
    public static FailureReason httpStatus(int code) {
        return new FailureReason(Kind.HTTP_STATUS, code, "HTTP status " + code);
    }
    
    public static FailureReason transport(String detail) {
        return new FailureReason(Kind.TRANSPORT, -1, detail);
    }
    
    public static FailureReason storage(String detail) {
        return new FailureReason(Kind.STORAGE, -1, detail);
    }
    
    public static FailureReason internal(String detail) {
        return new FailureReason(Kind.INTERNAL, -1, detail);
    }
    
    public Kind getKind() { return kind; }
    
    /**
     * Response status for {@link Kind#HTTP_STATUS}, -1 otherwise
     */
    public int getHttpStatus() { return httpStatus; }
    
    public String getDetail() { return detail; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FailureReason that = (FailureReason) o;
        return httpStatus == that.httpStatus && kind == that.kind && Objects.equals(detail, that.detail);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, httpStatus, detail);
    }
    
    @Override
    public String toString() {
        return kind + ": " + detail;
    }
}
