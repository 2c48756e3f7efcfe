package com.deepknow.goodface.coaching.domain.feature;

/**
 * 教练指导未能生效。
 */
public class GuidanceException extends RuntimeException {
    public GuidanceException(String message) {
        super(message);
    }
}
