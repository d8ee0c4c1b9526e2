package com.lingshield.core.signature;

/**
 * 签名属性，critical 属性必须被验证方识别
 */
public record SignedAttribute(String oid, String value, boolean critical) {

    public static final String SIGNING_TIME = "1.2.840.113549.1.9.5";
    public static final String CONTENT_TYPE = "1.2.840.113549.1.9.3";
    public static final String MESSAGE_DIGEST = "1.2.840.113549.1.9.4";

    public static final String PLUGIN_CONTENT_TYPE = "application/vnd.lingshield.plugin";
}
