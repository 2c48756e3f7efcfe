package com.deepknow.goodface.coaching.api.request;

import lombok.Data;

import java.io.Serializable;

@Data
public class GuidanceRequest implements Serializable {
    private static final long serialVersionUID = 7358201936624077049L;
    private String sessionId;
    private String coachId;
    private String text;
}
