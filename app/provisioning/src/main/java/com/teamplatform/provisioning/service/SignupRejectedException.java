package com.teamplatform.provisioning.service;

import com.teamplatform.provisioning.api.ApiErrorCode;

/** サインアップ入力が業務ルールに合わない (slug / email の重複、プラン固有の必須項目の欠落)。 */
public class SignupRejectedException extends RuntimeException {

    private final ApiErrorCode code;

    public SignupRejectedException(ApiErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ApiErrorCode code() {
        return code;
    }
}
