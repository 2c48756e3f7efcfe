package com.deepknow.goodface.coaching.api.model;

import lombok.Data;

import java.io.Serializable;

@Data
public class ControlResult implements Serializable {
    private static final long serialVersionUID = -1528830264412979310L;

    public static final String OK = "OK";
    public static final String SESSION_NOT_FOUND = "SESSION_NOT_FOUND";
    public static final String SESSION_EXISTS = "SESSION_EXISTS";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String UNKNOWN_PARTICIPANT = "UNKNOWN_PARTICIPANT";
    public static final String GUIDANCE_TIMEOUT = "GUIDANCE_TIMEOUT";
    public static final String GUIDANCE_REJECTED = "GUIDANCE_REJECTED";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private boolean success;
    private String code;
    // 状态是否发生变化（静音/暂停为幂等操作）
    private boolean changed;
    private String message;

    public static ControlResult ok(boolean changed) {
        ControlResult r = new ControlResult();
        r.setSuccess(true);
        r.setCode(OK);
        r.setChanged(changed);
        return r;
    }

    public static ControlResult fail(String code, String message) {
        ControlResult r = new ControlResult();
        r.setSuccess(false);
        r.setCode(code);
        r.setMessage(message);
        return r;
    }
}
